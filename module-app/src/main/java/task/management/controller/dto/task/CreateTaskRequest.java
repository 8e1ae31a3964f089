package task.management.controller.dto.task;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import task.management.application.dto.CreateTaskCommand;

/** 작업 생성 요청. priority 범위(1~5)는 서비스가 검증합니다. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateTaskRequest(
    @NotBlank String title, String description, @NotNull Integer priority, Instant dueDate) {

  public CreateTaskCommand toCommand(String createdBy) {
    return new CreateTaskCommand(title, description, priority, dueDate, createdBy);
  }
}
