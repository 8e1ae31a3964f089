package task.management.application.service;

import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import task.management.application.dto.CreateTaskCommand;
import task.management.application.dto.TaskUpdateCommand;
import task.management.core.port.out.TaskFilter;
import task.management.core.port.out.TaskRepositoryPort;
import task.management.core.port.out.UserRepositoryPort;
import task.management.domain.model.task.Priority;
import task.management.domain.model.task.Task;
import task.management.domain.model.task.TaskStatus;
import task.management.error.exception.InvalidInputException;
import task.management.error.exception.task.AssigneeNotFoundException;
import task.management.error.exception.task.CreatorNotFoundException;
import task.management.error.exception.task.TaskAccessDeniedException;
import task.management.error.exception.task.TaskNotFoundException;

/**
 * 작업 생성, 수정, 삭제, 담당자 지정, 조회
 *
 * <h3>권한 규칙</h3>
 *
 * <ul>
 *   <li>수정: 생성자 또는 담당자
 *   <li>삭제, 담당자 지정: 생성자만
 * </ul>
 *
 * <p>버전 필드가 없으므로 동시 수정은 마지막 쓰기가 이깁니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskLifecycleService {

  private final TaskRepositoryPort taskRepository;
  private final UserRepositoryPort userRepository;
  private final Clock clock;

  /**
   * @throws InvalidInputException 제목 공백, priority 누락 또는 범위 밖
   * @throws CreatorNotFoundException 생성자 없음
   */
  public Task create(CreateTaskCommand command) {
    Priority priority = requirePriority(command.priority());
    if (userRepository.findById(command.createdBy()).isEmpty()) {
      throw new CreatorNotFoundException(command.createdBy());
    }

    Task task =
        Task.create(
            command.title(),
            command.description(),
            priority,
            command.dueDate(),
            command.createdBy(),
            clock.instant());
    Task saved = taskRepository.create(task);
    log.info("[Task] 생성: id={}, createdBy={}", saved.id(), saved.createdBy());
    return saved;
  }

  public Task getById(String id) {
    return taskRepository.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
  }

  /**
   * @throws TaskNotFoundException 작업 없음
   * @throws TaskAccessDeniedException 생성자/담당자가 아님
   * @throws InvalidInputException 제목 공백 또는 priority 범위 밖
   * @throws task.management.error.exception.task.InvalidTransitionException 허용되지 않은 상태 전이
   */
  public Task update(String id, TaskUpdateCommand command, String updatedBy) {
    Task current = getById(id);
    if (!current.canBeEditedBy(updatedBy)) {
      throw new TaskAccessDeniedException("update", id);
    }

    Priority priority = command.priority() == null ? null : Priority.of(command.priority());
    Task updated =
        current.withChanges(
            command.title(),
            command.description(),
            command.status(),
            priority,
            command.dueDate(),
            clock.instant());
    return taskRepository.update(updated);
  }

  /**
   * @throws TaskNotFoundException 작업 없음
   * @throws TaskAccessDeniedException 생성자가 아님
   */
  public void delete(String id, String requesterId) {
    Task current = getById(id);
    if (!current.isCreatedBy(requesterId)) {
      throw new TaskAccessDeniedException("delete", id);
    }
    taskRepository.deleteById(id);
    log.info("[Task] 삭제: id={}, by={}", id, requesterId);
  }

  /**
   * 담당자를 지정합니다. pending 작업은 in_progress로 전환됩니다.
   *
   * @throws TaskNotFoundException 작업 없음
   * @throws TaskAccessDeniedException 생성자가 아님
   * @throws AssigneeNotFoundException 담당자 없음
   */
  public Task assign(String taskId, String assigneeId, String assignerId) {
    Task current = getById(taskId);
    if (!current.isCreatedBy(assignerId)) {
      throw new TaskAccessDeniedException("assign", taskId);
    }
    if (assigneeId == null || userRepository.findById(assigneeId).isEmpty()) {
      throw new AssigneeNotFoundException(assigneeId);
    }
    Task assigned = taskRepository.update(current.assignTo(assigneeId, clock.instant()));
    log.info("[Task] 담당자 지정: id={}, assignee={}", taskId, assigneeId);
    return assigned;
  }

  /** dueDate 오름차순, dueDate 없는 작업이 먼저 */
  public List<Task> listAll() {
    return taskRepository.findAll(TaskFilter.none());
  }

  public List<Task> listByStatus(TaskStatus status) {
    return taskRepository.findByStatus(status);
  }

  /** 생성자 또는 담당자가 userId인 작업 */
  public List<Task> listByUser(String userId) {
    return taskRepository.findByUser(userId);
  }

  private static Priority requirePriority(Integer value) {
    if (value == null) {
      throw new InvalidInputException("priority is required");
    }
    return Priority.of(value);
  }
}
