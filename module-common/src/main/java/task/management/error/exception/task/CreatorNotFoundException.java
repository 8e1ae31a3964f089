package task.management.error.exception.task;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class CreatorNotFoundException extends ClientBaseException {
  public CreatorNotFoundException(String userId) {
    super(CommonErrorCode.CREATOR_NOT_FOUND, userId);
  }
}
