package task.management.error.exception.auth;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ServerBaseException;

public class HashingException extends ServerBaseException {
  public HashingException(Throwable cause) {
    super(CommonErrorCode.PASSWORD_HASHING_FAILURE, cause);
  }
}
