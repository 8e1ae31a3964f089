package task.management.core.port.out;

import java.util.List;
import java.util.Optional;
import task.management.domain.model.task.Task;
import task.management.domain.model.task.TaskStatus;

/**
 * 작업 저장소 Port
 *
 * <p>목록 조회는 모두 dueDate 오름차순이며, dueDate가 없는 작업이 먼저 옵니다. 존재하지 않는 키에 대한 수정/삭제는 {@link
 * task.management.error.exception.task.TaskNotFoundException}을 던집니다.
 */
public interface TaskRepositoryPort {

  Optional<Task> findById(String id);

  List<Task> findAll(TaskFilter filter);

  /** 생성자 또는 담당자가 userId인 작업 */
  List<Task> findByUser(String userId);

  List<Task> findByStatus(TaskStatus status);

  Task create(Task task);

  Task update(Task task);

  void deleteById(String id);
}
