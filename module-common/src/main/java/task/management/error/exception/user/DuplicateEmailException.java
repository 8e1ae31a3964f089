package task.management.error.exception.user;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class DuplicateEmailException extends ClientBaseException {
  public DuplicateEmailException(String email) {
    super(CommonErrorCode.DUPLICATE_EMAIL, email);
  }
}
