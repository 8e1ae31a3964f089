package task.management.error.exception.task;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

/**
 * 작업 권한 위반
 *
 * @see task.management.error.CommonErrorCode#TASK_ACCESS_DENIED
 */
public class TaskAccessDeniedException extends ClientBaseException {
  public TaskAccessDeniedException(String action, String taskId) {
    super(CommonErrorCode.TASK_ACCESS_DENIED, action, taskId);
  }
}
