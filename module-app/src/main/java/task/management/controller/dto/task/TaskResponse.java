package task.management.controller.dto.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import task.management.domain.model.task.Task;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskResponse(
    String id,
    String title,
    String description,
    String status,
    int priority,
    String dueDate,
    String assignedTo,
    String createdBy,
    String createdAt,
    String updatedAt) {

  public static TaskResponse from(Task task) {
    return new TaskResponse(
        task.id(),
        task.title(),
        task.description(),
        task.status().value(),
        task.priority().value(),
        format(task.dueDate()),
        task.assignedTo(),
        task.createdBy(),
        format(task.createdAt()),
        format(task.updatedAt()));
  }

  private static String format(Instant instant) {
    return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
  }
}
