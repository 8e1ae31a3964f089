package task.management.domain.service;

import java.util.Objects;
import task.management.domain.model.auth.ResourceKind;
import task.management.error.exception.auth.ResourceAccessDeniedException;

/**
 * 단일 소유자 접근 정책
 *
 * <p>호출자가 리소스의 소유자일 때만 접근을 허용합니다. 작업의 생성자/담당자 규칙은 TaskLifecycleService가 연산별로 직접
 * 판단하며, 이 정책은 "본인 프로필만 수정/삭제" 같은 단일 소유자 검사에만 쓰입니다.
 */
public class ResourceAccessPolicy {

  /**
   * @throws task.management.error.exception.UnknownResourceKindException 알 수 없는 리소스 종류
   * @throws ResourceAccessDeniedException 소유자가 아닌 경우
   */
  public void authorize(String userId, String resourceOwnerId, String resourceKind) {
    ResourceKind kind = ResourceKind.from(resourceKind);
    authorize(userId, resourceOwnerId, kind);
  }

  public void authorize(String userId, String resourceOwnerId, ResourceKind kind) {
    Objects.requireNonNull(kind, "kind");
    if (userId == null || !userId.equals(resourceOwnerId)) {
      throw new ResourceAccessDeniedException(kind.value(), resourceOwnerId);
    }
  }
}
