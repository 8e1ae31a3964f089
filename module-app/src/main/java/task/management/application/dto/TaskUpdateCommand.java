package task.management.application.dto;

import java.time.Instant;
import task.management.domain.model.task.TaskStatus;

/**
 * 작업 부분 수정 입력. null 필드는 "변경 없음"입니다.
 *
 * <p>description은 빈 문자열도 값으로 취급해 설명을 비웁니다.
 */
public record TaskUpdateCommand(
    String title, String description, TaskStatus status, Integer priority, Instant dueDate) {

  public static TaskUpdateCommand empty() {
    return new TaskUpdateCommand(null, null, null, null, null);
  }

  public TaskUpdateCommand withStatus(TaskStatus newStatus) {
    return new TaskUpdateCommand(title, description, newStatus, priority, dueDate);
  }

  public TaskUpdateCommand withPriority(Integer newPriority) {
    return new TaskUpdateCommand(title, description, status, newPriority, dueDate);
  }
}
