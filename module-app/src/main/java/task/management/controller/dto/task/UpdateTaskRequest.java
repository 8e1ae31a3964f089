package task.management.controller.dto.task;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import task.management.application.dto.TaskUpdateCommand;
import task.management.domain.model.task.TaskStatus;

/**
 * 작업 부분 수정 요청. 생략한 필드는 변경하지 않습니다.
 *
 * @param status "pending" | "in_progress" | "completed"
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateTaskRequest(
    String title, String description, String status, Integer priority, Instant dueDate) {

  public TaskUpdateCommand toCommand() {
    TaskStatus newStatus = status == null ? null : TaskStatus.fromValue(status);
    return new TaskUpdateCommand(title, description, newStatus, priority, dueDate);
  }
}
