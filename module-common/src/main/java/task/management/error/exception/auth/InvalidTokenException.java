package task.management.error.exception.auth;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

/**
 * Thrown for any structural, signature, algorithm or expiry failure of an access token.
 *
 * <p>The failure reason is never distinguished towards the caller.
 */
public class InvalidTokenException extends ClientBaseException {
  public InvalidTokenException() {
    super(CommonErrorCode.INVALID_TOKEN);
  }
}
