package task.management.error.exception.auth;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ServerBaseException;

/** 서명 키가 사용 불가능하거나 토큰 서명에 실패한 경우 */
public class SigningException extends ServerBaseException {
  public SigningException(String reason) {
    super(CommonErrorCode.TOKEN_SIGNING_FAILURE, reason);
  }

  public SigningException(String reason, Throwable cause) {
    super(CommonErrorCode.TOKEN_SIGNING_FAILURE, cause, reason);
  }
}
