package task.management.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import task.management.application.dto.CreateTaskCommand;
import task.management.application.dto.TaskUpdateCommand;
import task.management.domain.model.task.Task;
import task.management.domain.model.task.TaskStatus;
import task.management.domain.model.user.User;
import task.management.error.exception.InvalidInputException;
import task.management.error.exception.task.AssigneeNotFoundException;
import task.management.error.exception.task.CreatorNotFoundException;
import task.management.error.exception.task.InvalidTransitionException;
import task.management.error.exception.task.TaskAccessDeniedException;
import task.management.error.exception.task.TaskNotFoundException;
import task.management.support.ApplicationFixture;

@Tag("unit")
@DisplayName("TaskLifecycleService 테스트")
class TaskLifecycleServiceTest {

  private static final String MISSING_ID = "ffffffffffffffffffffffff";

  private ApplicationFixture fx;
  private TaskLifecycleService service;
  private User alice;
  private User bob;

  @BeforeEach
  void setUp() {
    fx = new ApplicationFixture();
    service = fx.taskLifecycleService;
    alice = fx.register("alice", "alice@x.com", "secret1");
    bob = fx.register("bob", "bob@x.com", "secret2");
  }

  private Task createBy(User user, String title, Instant dueDate) {
    return service.create(new CreateTaskCommand(title, null, 3, dueDate, user.id()));
  }

  @Nested
  @DisplayName("생성")
  class Create {

    @Test
    @DisplayName("새 작업은 pending 상태, 담당자 없음, 생성자는 호출자")
    void create_success() {
      Task task = createBy(alice, "Write report", null);

      assertThat(task.id()).isNotBlank();
      assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
      assertThat(task.assignedTo()).isNull();
      assertThat(task.createdBy()).isEqualTo(alice.id());
      assertThat(task.createdAt()).isEqualTo(task.updatedAt());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6, -1, 100})
    @DisplayName("priority 범위 밖은 InvalidInput")
    void create_priorityOutOfRange(int priority) {
      assertThatThrownBy(
              () -> service.create(new CreateTaskCommand("t", null, priority, null, alice.id())))
          .isInstanceOf(InvalidInputException.class);
      assertThat(service.listAll()).isEmpty();
    }

    @Test
    @DisplayName("priority 누락과 빈 제목은 InvalidInput")
    void create_missingFields() {
      assertThatThrownBy(
              () -> service.create(new CreateTaskCommand("t", null, null, null, alice.id())))
          .isInstanceOf(InvalidInputException.class);
      assertThatThrownBy(
              () -> service.create(new CreateTaskCommand("  ", null, 1, null, alice.id())))
          .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("없는 생성자는 CreatorNotFound")
    void create_unknownCreator() {
      assertThatThrownBy(() -> service.create(new CreateTaskCommand("t", null, 1, null, MISSING_ID)))
          .isInstanceOf(CreatorNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("수정")
  class Update {

    @Test
    @DisplayName("생성자는 상태를 pending → in_progress → completed 로 바꿀 수 있다")
    void update_transitions() {
      Task task = createBy(alice, "t", null);
      fx.clock.advance(Duration.ofMinutes(1));

      Task inProgress =
          service.update(
              task.id(), TaskUpdateCommand.empty().withStatus(TaskStatus.IN_PROGRESS), alice.id());
      Task completed =
          service.update(
              task.id(), TaskUpdateCommand.empty().withStatus(TaskStatus.COMPLETED), alice.id());

      assertThat(inProgress.status()).isEqualTo(TaskStatus.IN_PROGRESS);
      assertThat(completed.status()).isEqualTo(TaskStatus.COMPLETED);
      assertThat(completed.updatedAt()).isAfter(task.createdAt());
    }

    @Test
    @DisplayName("동일 상태나 in_progress → pending 전이는 InvalidTransition")
    void update_invalidTransition() {
      Task task = createBy(alice, "t", null);

      assertThatThrownBy(
              () ->
                  service.update(
                      task.id(), TaskUpdateCommand.empty().withStatus(TaskStatus.PENDING), alice.id()))
          .isInstanceOf(InvalidTransitionException.class);

      service.update(
          task.id(), TaskUpdateCommand.empty().withStatus(TaskStatus.IN_PROGRESS), alice.id());
      assertThatThrownBy(
              () ->
                  service.update(
                      task.id(), TaskUpdateCommand.empty().withStatus(TaskStatus.PENDING), alice.id()))
          .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("수정 시 priority 범위를 다시 검증한다")
    void update_priorityRevalidated() {
      Task task = createBy(alice, "t", null);

      assertThatThrownBy(
              () -> service.update(task.id(), TaskUpdateCommand.empty().withPriority(9), alice.id()))
          .isInstanceOf(InvalidInputException.class);
      assertThat(service.getById(task.id()).priority().value()).isEqualTo(3);
    }

    @Test
    @DisplayName("생성자도 담당자도 아닌 사용자는 TaskAccessDenied, 담당자는 수정 가능")
    void update_permissions() {
      Task task = createBy(alice, "t", null);
      TaskUpdateCommand rename = new TaskUpdateCommand("renamed", null, null, null, null);

      assertThatThrownBy(() -> service.update(task.id(), rename, bob.id()))
          .isInstanceOf(TaskAccessDeniedException.class);

      service.assign(task.id(), bob.id(), alice.id());
      assertThat(service.update(task.id(), rename, bob.id()).title()).isEqualTo("renamed");
    }

    @Test
    @DisplayName("동시 수정은 마지막 쓰기가 이긴다")
    void update_lastWriterWins() {
      Task task = createBy(alice, "t", null);
      service.assign(task.id(), bob.id(), alice.id());

      service.update(task.id(), new TaskUpdateCommand("from alice", null, null, null, null), alice.id());
      service.update(task.id(), new TaskUpdateCommand("from bob", null, null, null, null), bob.id());

      assertThat(service.getById(task.id()).title()).isEqualTo("from bob");
    }

    @Test
    @DisplayName("없는 작업은 TaskNotFound")
    void update_missing() {
      assertThatThrownBy(() -> service.update(MISSING_ID, TaskUpdateCommand.empty(), alice.id()))
          .isInstanceOf(TaskNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("삭제/담당자 지정")
  class DeleteAndAssign {

    @Test
    @DisplayName("alice가 만든 작업을 bob이 삭제하면 TaskAccessDenied, alice는 삭제 가능")
    void delete_onlyCreator() {
      Task task = createBy(alice, "t", null);

      assertThatThrownBy(() -> service.delete(task.id(), bob.id()))
          .isInstanceOf(TaskAccessDeniedException.class);

      service.delete(task.id(), alice.id());
      assertThatThrownBy(() -> service.getById(task.id()))
          .isInstanceOf(TaskNotFoundException.class);
    }

    @Test
    @DisplayName("담당자가 되어도 삭제는 불가")
    void delete_assigneeDenied() {
      Task task = createBy(alice, "t", null);
      service.assign(task.id(), bob.id(), alice.id());

      assertThatThrownBy(() -> service.delete(task.id(), bob.id()))
          .isInstanceOf(TaskAccessDeniedException.class);
    }

    @Test
    @DisplayName("담당자 지정 시 pending 작업은 in_progress로 전환")
    void assign_advancesPending() {
      Task task = createBy(alice, "t", null);

      Task assigned = service.assign(task.id(), bob.id(), alice.id());

      assertThat(assigned.assignedTo()).isEqualTo(bob.id());
      assertThat(assigned.status()).isEqualTo(TaskStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("completed 작업은 담당자 지정 후에도 completed 유지")
    void assign_keepsCompleted() {
      Task task = createBy(alice, "t", null);
      service.update(
          task.id(), TaskUpdateCommand.empty().withStatus(TaskStatus.COMPLETED), alice.id());

      assertThat(service.assign(task.id(), bob.id(), alice.id()).status())
          .isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("생성자가 아닌 지정자는 TaskAccessDenied, 없는 담당자는 AssigneeNotFound")
    void assign_rejections() {
      Task task = createBy(alice, "t", null);

      assertThatThrownBy(() -> service.assign(task.id(), bob.id(), bob.id()))
          .isInstanceOf(TaskAccessDeniedException.class);
      assertThatThrownBy(() -> service.assign(task.id(), MISSING_ID, alice.id()))
          .isInstanceOf(AssigneeNotFoundException.class);
      assertThat(service.getById(task.id()).assignedTo()).isNull();
    }
  }

  @Nested
  @DisplayName("목록")
  class Listing {

    @Test
    @DisplayName("dueDate 오름차순, dueDate 없는 작업이 먼저")
    void listAll_ordering() {
      Task late = createBy(alice, "late", ApplicationFixture.T0.plus(Duration.ofDays(3)));
      Task early = createBy(alice, "early", ApplicationFixture.T0.plus(Duration.ofDays(1)));
      Task none = createBy(bob, "none", null);

      List<String> ids = service.listAll().stream().map(Task::id).toList();

      assertThat(ids).containsExactly(none.id(), early.id(), late.id());
    }

    @Test
    @DisplayName("상태 필터")
    void listByStatus() {
      Task a = createBy(alice, "a", null);
      createBy(alice, "b", null);
      service.assign(a.id(), bob.id(), alice.id());

      assertThat(service.listByStatus(TaskStatus.IN_PROGRESS)).extracting(Task::id)
          .containsExactly(a.id());
      assertThat(service.listByStatus(TaskStatus.PENDING)).hasSize(1);
      assertThat(service.listByStatus(TaskStatus.COMPLETED)).isEmpty();
    }

    @Test
    @DisplayName("사용자별 목록은 생성자 또는 담당자인 작업의 합집합")
    void listByUser_union() {
      Task mine = createBy(alice, "mine", null);
      Task assignedToMe = createBy(bob, "assigned", null);
      createBy(bob, "other", null);
      service.assign(assignedToMe.id(), alice.id(), bob.id());

      assertThat(service.listByUser(alice.id()))
          .extracting(Task::id)
          .containsExactlyInAnyOrder(mine.id(), assignedToMe.id());
    }
  }
}
