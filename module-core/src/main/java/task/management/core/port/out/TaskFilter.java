package task.management.core.port.out;

import task.management.domain.model.task.TaskStatus;

/**
 * 작업 목록 필터. null 필드는 조건에서 제외됩니다.
 *
 * @param status 상태 조건
 * @param createdBy 생성자 조건
 * @param assignedTo 담당자 조건
 */
public record TaskFilter(TaskStatus status, String createdBy, String assignedTo) {

  public static TaskFilter none() {
    return new TaskFilter(null, null, null);
  }

  public static TaskFilter byStatus(TaskStatus status) {
    return new TaskFilter(status, null, null);
  }

  public boolean isEmpty() {
    return status == null && createdBy == null && assignedTo == null;
  }
}
