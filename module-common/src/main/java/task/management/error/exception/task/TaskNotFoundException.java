package task.management.error.exception.task;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class TaskNotFoundException extends ClientBaseException {
  public TaskNotFoundException(String taskId) {
    super(CommonErrorCode.TASK_NOT_FOUND, taskId);
  }
}
