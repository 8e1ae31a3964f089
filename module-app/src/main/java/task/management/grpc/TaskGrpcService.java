package task.management.grpc;

import com.google.protobuf.Empty;
import io.grpc.stub.StreamObserver;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import task.management.application.dto.CreateTaskCommand;
import task.management.application.dto.TaskUpdateCommand;
import task.management.application.service.TaskLifecycleService;
import task.management.domain.model.task.Task;
import task.management.domain.model.task.TaskStatus;
import task.management.global.security.AuthenticatedUser;
import task.management.grpc.proto.AssignTaskRequest;
import task.management.grpc.proto.CreateTaskRequest;
import task.management.grpc.proto.DeleteTaskRequest;
import task.management.grpc.proto.GetTaskRequest;
import task.management.grpc.proto.GetUserTasksRequest;
import task.management.grpc.proto.ListTasksRequest;
import task.management.grpc.proto.ListTasksResponse;
import task.management.grpc.proto.TaskResponse;
import task.management.grpc.proto.TaskServiceGrpc;
import task.management.grpc.proto.UpdateTaskRequest;

/**
 * gRPC TaskService 구현
 *
 * <p>모든 메서드는 인증이 필요하며, 행위자는 항상 토큰의 사용자입니다.
 */
@Component
@RequiredArgsConstructor
public class TaskGrpcService extends TaskServiceGrpc.TaskServiceImplBase {

  private final TaskLifecycleService taskLifecycleService;

  @Override
  public void createTask(CreateTaskRequest request, StreamObserver<TaskResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          AuthenticatedUser caller = GrpcAuthContext.currentUser();
          CreateTaskCommand command =
              new CreateTaskCommand(
                  request.getTitle(),
                  request.getDescription(),
                  request.getPriority(),
                  request.hasDueDate() ? ProtoMapper.toInstant(request.getDueDate()) : null,
                  caller.userId());
          return ProtoMapper.toProto(taskLifecycleService.create(command));
        });
  }

  @Override
  public void getTask(GetTaskRequest request, StreamObserver<TaskResponse> observer) {
    GrpcErrors.respond(
        observer, () -> ProtoMapper.toProto(taskLifecycleService.getById(request.getId())));
  }

  /** optional 필드와 status(UNSPECIFIED 제외), due_date는 설정된 경우에만 반영 */
  @Override
  public void updateTask(UpdateTaskRequest request, StreamObserver<TaskResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          AuthenticatedUser caller = GrpcAuthContext.currentUser();
          TaskUpdateCommand command =
              new TaskUpdateCommand(
                  request.hasTitle() ? request.getTitle() : null,
                  request.hasDescription() ? request.getDescription() : null,
                  ProtoMapper.toDomain(request.getStatus()),
                  request.hasPriority() ? request.getPriority() : null,
                  request.hasDueDate() ? ProtoMapper.toInstant(request.getDueDate()) : null);
          Task updated = taskLifecycleService.update(request.getId(), command, caller.userId());
          return ProtoMapper.toProto(updated);
        });
  }

  @Override
  public void deleteTask(DeleteTaskRequest request, StreamObserver<Empty> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          taskLifecycleService.delete(request.getId(), GrpcAuthContext.currentUser().userId());
          return Empty.getDefaultInstance();
        });
  }

  @Override
  public void listTasks(ListTasksRequest request, StreamObserver<ListTasksResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          TaskStatus status = ProtoMapper.toDomain(request.getStatus());
          List<Task> tasks =
              status == null
                  ? taskLifecycleService.listAll()
                  : taskLifecycleService.listByStatus(status);
          return toListResponse(tasks);
        });
  }

  @Override
  public void assignTask(AssignTaskRequest request, StreamObserver<TaskResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          AuthenticatedUser caller = GrpcAuthContext.currentUser();
          Task assigned =
              taskLifecycleService.assign(
                  request.getTaskId(),
                  ProtoMapper.emptyToNull(request.getAssigneeId()),
                  caller.userId());
          return ProtoMapper.toProto(assigned);
        });
  }

  /** user_id가 비어 있으면 호출자 본인의 작업 */
  @Override
  public void getUserTasks(GetUserTasksRequest request, StreamObserver<ListTasksResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          String userId = ProtoMapper.emptyToNull(request.getUserId());
          if (userId == null) {
            userId = GrpcAuthContext.currentUser().userId();
          }
          return toListResponse(taskLifecycleService.listByUser(userId));
        });
  }

  private static ListTasksResponse toListResponse(List<Task> tasks) {
    ListTasksResponse.Builder builder = ListTasksResponse.newBuilder();
    tasks.forEach(task -> builder.addTasks(ProtoMapper.toProto(task)));
    return builder.build();
  }
}
