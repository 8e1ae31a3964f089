package task.management.error.exception.user;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class UserNotFoundException extends ClientBaseException {
  public UserNotFoundException(String lookupKey) {
    super(CommonErrorCode.USER_NOT_FOUND, lookupKey);
  }
}
