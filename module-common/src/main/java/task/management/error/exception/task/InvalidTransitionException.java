package task.management.error.exception.task;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class InvalidTransitionException extends ClientBaseException {
  public InvalidTransitionException(String current, String next) {
    super(CommonErrorCode.INVALID_STATUS_TRANSITION, current, next);
  }
}
