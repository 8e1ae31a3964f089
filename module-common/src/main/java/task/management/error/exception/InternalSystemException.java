package task.management.error.exception;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ServerBaseException;

/**
 * 저장소/인프라 장애를 감싸는 서버 예외
 *
 * <p>taskName에는 "component:operation" 형식의 작업 이름이 들어가며 로그 추적에만 사용됩니다.
 */
public class InternalSystemException extends ServerBaseException {
  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.PERSISTENCE_FAILURE, cause, taskName);
  }
}
