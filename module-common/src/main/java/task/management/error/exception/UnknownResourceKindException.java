package task.management.error.exception;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class UnknownResourceKindException extends ClientBaseException {
  public UnknownResourceKindException(String resourceKind) {
    super(CommonErrorCode.UNKNOWN_RESOURCE_KIND, resourceKind);
  }
}
