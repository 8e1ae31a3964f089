package task.management.error.exception.task;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class AssigneeNotFoundException extends ClientBaseException {
  public AssigneeNotFoundException(String userId) {
    super(CommonErrorCode.ASSIGNEE_NOT_FOUND, userId);
  }
}
