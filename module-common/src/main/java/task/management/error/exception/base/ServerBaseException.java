package task.management.error.exception.base;

import task.management.error.ErrorCode;

/**
 * ServerBaseException: 저장소 장애, 암호화 실패 등 시스템 내부 오류.
 *
 * <p>응답에는 공통 메시지만 노출하고, 원인(cause)은 장애 분석을 위해 로그로만 남깁니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
