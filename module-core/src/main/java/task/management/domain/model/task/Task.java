package task.management.domain.model.task;

import java.time.Instant;
import java.util.Objects;
import task.management.error.exception.InvalidInputException;

/**
 * 작업 도메인 모델 (순수 도메인)
 *
 * <p>MongoDB 문서는 module-infra에 별도로 존재합니다.
 *
 * <h3>불변식</h3>
 *
 * <ul>
 *   <li>title은 비어 있을 수 없음
 *   <li>priority는 {@link Priority}가 [1, 5]를 보장
 *   <li>status는 {@link TaskStatus} 전이 테이블로만 변경
 *   <li>createdBy는 생성 이후 변경 불가 (with* 메서드가 그대로 복사)
 *   <li>assignedTo는 {@link #assignTo(String, Instant)}로만 변경
 * </ul>
 */
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    Priority priority,
    Instant dueDate,
    String assignedTo,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {

  /** 새 작업 생성 (항상 pending 상태로 시작) */
  public static Task create(
      String title,
      String description,
      Priority priority,
      Instant dueDate,
      String createdBy,
      Instant now) {
    requireTitle(title);
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(createdBy, "createdBy");
    return new Task(
        null,
        title,
        description,
        TaskStatus.PENDING,
        priority,
        dueDate,
        null,
        createdBy,
        now,
        now);
  }

  public boolean isCreatedBy(String userId) {
    return createdBy.equals(userId);
  }

  public boolean isAssignedTo(String userId) {
    return assignedTo != null && assignedTo.equals(userId);
  }

  /** 생성자 또는 담당자만 수정 가능 */
  public boolean canBeEditedBy(String userId) {
    return isCreatedBy(userId) || isAssignedTo(userId);
  }

  /**
   * 부분 수정된 새 인스턴스 반환
   *
   * <p>null 인자는 "변경 없음"을 의미합니다. 빈 문자열 description은 설명을 비웁니다.
   *
   * @throws InvalidInputException title이 공백으로 주어진 경우
   * @throws task.management.error.exception.task.InvalidTransitionException 허용되지 않은 상태 전이
   */
  public Task withChanges(
      String newTitle,
      String newDescription,
      TaskStatus newStatus,
      Priority newPriority,
      Instant newDueDate,
      Instant now) {
    if (newTitle != null) {
      requireTitle(newTitle);
    }
    if (newStatus != null) {
      status.requireTransitionTo(newStatus);
    }
    return new Task(
        id,
        newTitle != null ? newTitle : title,
        newDescription != null ? newDescription : description,
        newStatus != null ? newStatus : status,
        newPriority != null ? newPriority : priority,
        newDueDate != null ? newDueDate : dueDate,
        assignedTo,
        createdBy,
        createdAt,
        now);
  }

  /** 담당자 지정. pending 작업은 in_progress로 자동 전환됩니다. */
  public Task assignTo(String assigneeId, Instant now) {
    Objects.requireNonNull(assigneeId, "assigneeId");
    TaskStatus nextStatus = status == TaskStatus.PENDING ? TaskStatus.IN_PROGRESS : status;
    return new Task(
        id,
        title,
        description,
        nextStatus,
        priority,
        dueDate,
        assigneeId,
        createdBy,
        createdAt,
        now);
  }

  /** ID가 할당된 새 인스턴스 반환 (저장 후) */
  public Task withId(String id) {
    return new Task(
        id,
        title,
        description,
        status,
        priority,
        dueDate,
        assignedTo,
        createdBy,
        createdAt,
        updatedAt);
  }

  private static void requireTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new InvalidInputException("title is required");
    }
  }
}
