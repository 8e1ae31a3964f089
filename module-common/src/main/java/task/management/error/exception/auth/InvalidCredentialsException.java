package task.management.error.exception.auth;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

/**
 * 로그인 실패 예외
 *
 * <p>사용자 미존재와 비밀번호 불일치를 구분하지 않습니다 (계정 열거 방지).
 */
public class InvalidCredentialsException extends ClientBaseException {
  public InvalidCredentialsException() {
    super(CommonErrorCode.INVALID_CREDENTIALS);
  }
}
