package task.management.infrastructure.mongodb.mapper;

import task.management.domain.model.task.Priority;
import task.management.domain.model.task.Task;
import task.management.domain.model.task.TaskStatus;
import task.management.infrastructure.mongodb.document.TaskDocument;

/**
 * TaskDocument ↔ Task 변환 (stateless)
 *
 * <p>저장된 status/priority가 도메인 범위를 벗어나면 {@link task.management.error.exception.InvalidInputException}이
 * 발생합니다.
 */
public final class TaskDocumentMapper {

  private TaskDocumentMapper() {}

  public static Task toDomain(TaskDocument document) {
    if (document == null) {
      throw new IllegalArgumentException("TaskDocument cannot be null");
    }
    return new Task(
        document.getId(),
        document.getTitle(),
        document.getDescription(),
        TaskStatus.fromValue(document.getStatus()),
        Priority.of(document.getPriority()),
        document.getDueDate(),
        document.getAssignedTo(),
        document.getCreatedBy(),
        document.getCreatedAt(),
        document.getUpdatedAt());
  }

  public static TaskDocument toDocument(Task task) {
    if (task == null) {
      throw new IllegalArgumentException("Task cannot be null");
    }
    return TaskDocument.builder()
        .id(task.id())
        .title(task.title())
        .description(task.description())
        .status(task.status().value())
        .priority(task.priority().value())
        .dueDate(task.dueDate())
        .assignedTo(task.assignedTo())
        .createdBy(task.createdBy())
        .createdAt(task.createdAt())
        .updatedAt(task.updatedAt())
        .build();
  }
}
