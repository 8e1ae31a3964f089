package task.management.controller;

import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import task.management.application.service.CredentialService;
import task.management.application.service.TaskLifecycleService;
import task.management.application.service.UserDirectoryService;
import task.management.controller.dto.task.TaskResponse;
import task.management.controller.dto.user.UpdateUserRequest;
import task.management.controller.dto.user.UserResponse;
import task.management.domain.model.auth.ResourceKind;
import task.management.global.response.ApiResponse;
import task.management.global.security.AuthenticatedUser;

/**
 * 사용자 API 컨트롤러 (인증 필요)
 *
 * <p>프로필 수정/삭제는 본인만 가능합니다.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class UserController {

  private final UserDirectoryService userDirectoryService;
  private final CredentialService credentialService;
  private final TaskLifecycleService taskLifecycleService;

  @GetMapping("/me")
  public ResponseEntity<ApiResponse<UserResponse>> me(
      @AuthenticationPrincipal AuthenticatedUser user) {
    return ResponseEntity.ok(
        ApiResponse.success(UserResponse.from(userDirectoryService.getById(user.userId()))));
  }

  @GetMapping("/users/{id}")
  public ResponseEntity<ApiResponse<UserResponse>> getUser(@PathVariable String id) {
    UserResponse response = UserResponse.from(userDirectoryService.getById(id));
    return ResponseEntity.ok(ApiResponse.success(response));
  }

  @PutMapping("/users/{id}")
  public ResponseEntity<ApiResponse<UserResponse>> updateUser(
      @AuthenticationPrincipal AuthenticatedUser user,
      @PathVariable String id,
      @Valid @RequestBody UpdateUserRequest request) {
    credentialService.authorizeResourceAccess(user.userId(), id, ResourceKind.USER.value());
    UserResponse response = UserResponse.from(userDirectoryService.update(id, request.toCommand()));
    return ResponseEntity.ok(ApiResponse.success(response));
  }

  @DeleteMapping("/users/{id}")
  public ResponseEntity<Void> deleteUser(
      @AuthenticationPrincipal AuthenticatedUser user, @PathVariable String id) {
    credentialService.authorizeResourceAccess(user.userId(), id, ResourceKind.USER.value());
    userDirectoryService.delete(id);
    return ResponseEntity.noContent().build();
  }

  /** 생성자 또는 담당자가 해당 사용자인 작업 */
  @GetMapping("/users/{id}/tasks")
  public ResponseEntity<ApiResponse<List<TaskResponse>>> getUserTasks(@PathVariable String id) {
    List<TaskResponse> tasks =
        taskLifecycleService.listByUser(id).stream().map(TaskResponse::from).toList();
    return ResponseEntity.ok(ApiResponse.success(tasks));
  }
}
