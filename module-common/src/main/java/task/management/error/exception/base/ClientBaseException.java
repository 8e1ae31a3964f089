package task.management.error.exception.base;

import task.management.error.ErrorCode;

/**
 * ClientBaseException: 사용자의 요청이 도메인 규칙과 맞지 않을 때 발생하는 '비즈니스 예외'.
 *
 * <p>4xx 계열로 매핑되며, 호출자에게 구체적인 실패 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "Task not found (ID: %s)"와 같은 메시지 완성용
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
