package task.management.domain.model.task;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import task.management.error.exception.InvalidInputException;
import task.management.error.exception.task.InvalidTransitionException;

/**
 * 작업 상태 및 전이 테이블
 *
 * <pre>
 * pending      → in_progress, completed
 * in_progress  → completed
 * completed    → in_progress (재작업)
 * </pre>
 *
 * <p>동일 상태로의 전이를 포함해 테이블에 없는 전이는 모두 거부됩니다.
 */
public enum TaskStatus {
  PENDING("pending"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed");

  private final String value;

  TaskStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public Set<TaskStatus> allowedNext() {
    return switch (this) {
      case PENDING -> EnumSet.of(IN_PROGRESS, COMPLETED);
      case IN_PROGRESS -> EnumSet.of(COMPLETED);
      case COMPLETED -> EnumSet.of(IN_PROGRESS);
    };
  }

  public boolean canTransitionTo(TaskStatus next) {
    return next != null && allowedNext().contains(next);
  }

  /**
   * 전이 검증
   *
   * @throws InvalidTransitionException 테이블에 없는 전이
   */
  public void requireTransitionTo(TaskStatus next) {
    if (!canTransitionTo(next)) {
      throw new InvalidTransitionException(value, next == null ? "null" : next.value);
    }
  }

  /**
   * Wire 값("pending", "in_progress", "completed")으로부터 상태를 해석합니다.
   *
   * @throws InvalidInputException 알 수 없는 값
   */
  public static TaskStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new InvalidInputException("unknown task status '" + value + "'"));
  }
}
