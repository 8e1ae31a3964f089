package task.management.error.exception.auth;

import task.management.error.CommonErrorCode;
import task.management.error.exception.base.ClientBaseException;

public class ResourceAccessDeniedException extends ClientBaseException {
  public ResourceAccessDeniedException(String resourceKind, String resourceOwnerId) {
    super(CommonErrorCode.RESOURCE_ACCESS_DENIED, resourceKind, resourceOwnerId);
  }
}
