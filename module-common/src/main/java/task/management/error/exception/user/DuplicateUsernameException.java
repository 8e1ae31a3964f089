package task.management.error.exception.user;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class DuplicateUsernameException extends ClientBaseException {
  public DuplicateUsernameException(String username) {
    super(CommonErrorCode.DUPLICATE_USERNAME, username);
  }
}
