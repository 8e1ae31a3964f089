package task.management.controller;

import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import task.management.application.service.TaskLifecycleService;
import task.management.controller.dto.task.AssignTaskRequest;
import task.management.controller.dto.task.CreateTaskRequest;
import task.management.controller.dto.task.TaskResponse;
import task.management.controller.dto.task.UpdateTaskRequest;
import task.management.domain.model.task.Task;
import task.management.domain.model.task.TaskStatus;
import task.management.global.response.ApiResponse;
import task.management.global.security.AuthenticatedUser;

/**
 * 작업 API 컨트롤러 (인증 필요)
 *
 * <p>행위자(생성자, 수정자, 삭제 요청자, 지정자)는 항상 토큰의 사용자입니다.
 */
@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
public class TaskController {

  private final TaskLifecycleService taskLifecycleService;

  @PostMapping
  public ResponseEntity<ApiResponse<TaskResponse>> create(
      @AuthenticationPrincipal AuthenticatedUser user,
      @Valid @RequestBody CreateTaskRequest request) {
    Task task = taskLifecycleService.create(request.toCommand(user.userId()));
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.success(TaskResponse.from(task)));
  }

  /**
   * @param status 선택. 지정하면 해당 상태만 조회
   */
  @GetMapping
  public ResponseEntity<ApiResponse<List<TaskResponse>>> list(
      @RequestParam(required = false) String status) {
    List<Task> tasks =
        status == null || status.isBlank()
            ? taskLifecycleService.listAll()
            : taskLifecycleService.listByStatus(TaskStatus.fromValue(status));
    return ResponseEntity.ok(ApiResponse.success(tasks.stream().map(TaskResponse::from).toList()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ApiResponse<TaskResponse>> get(@PathVariable String id) {
    Task task = taskLifecycleService.getById(id);
    return ResponseEntity.ok(ApiResponse.success(TaskResponse.from(task)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ApiResponse<TaskResponse>> update(
      @AuthenticationPrincipal AuthenticatedUser user,
      @PathVariable String id,
      @RequestBody UpdateTaskRequest request) {
    Task task = taskLifecycleService.update(id, request.toCommand(), user.userId());
    return ResponseEntity.ok(ApiResponse.success(TaskResponse.from(task)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(
      @AuthenticationPrincipal AuthenticatedUser user, @PathVariable String id) {
    taskLifecycleService.delete(id, user.userId());
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/assign")
  public ResponseEntity<ApiResponse<TaskResponse>> assign(
      @AuthenticationPrincipal AuthenticatedUser user,
      @PathVariable String id,
      @Valid @RequestBody AssignTaskRequest request) {
    Task task = taskLifecycleService.assign(id, request.assigneeId(), user.userId());
    return ResponseEntity.ok(ApiResponse.success(TaskResponse.from(task)));
  }
}
