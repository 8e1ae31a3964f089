package task.management.error.exception;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class InvalidInputException extends ClientBaseException {
  public InvalidInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
