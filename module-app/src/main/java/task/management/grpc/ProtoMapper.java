package task.management.grpc;

import com.google.protobuf.Timestamp;
import java.time.Instant;
import task.management.application.dto.LoginResult;
import task.management.domain.model.task.Task;
import task.management.domain.model.user.User;
import task.management.error.exception.InvalidInputException;
import task.management.grpc.proto.LoginResponse;
import task.management.grpc.proto.TaskResponse;
import task.management.grpc.proto.TaskStatus;
import task.management.grpc.proto.UserResponse;

/** 도메인 모델 ↔ protobuf 메시지 변환 (정적 유틸리티) */
final class ProtoMapper {

  private ProtoMapper() {}

  static TaskResponse toProto(Task task) {
    TaskResponse.Builder builder =
        TaskResponse.newBuilder()
            .setId(task.id())
            .setTitle(task.title())
            .setDescription(nullToEmpty(task.description()))
            .setStatus(toProto(task.status()))
            .setPriority(task.priority().value())
            .setAssignedTo(nullToEmpty(task.assignedTo()))
            .setCreatedBy(task.createdBy())
            .setCreatedAt(toTimestamp(task.createdAt()))
            .setUpdatedAt(toTimestamp(task.updatedAt()));
    if (task.dueDate() != null) {
      builder.setDueDate(toTimestamp(task.dueDate()));
    }
    return builder.build();
  }

  static UserResponse toProto(User user) {
    return UserResponse.newBuilder()
        .setId(user.id())
        .setUsername(user.username())
        .setEmail(user.email())
        .setFirstName(nullToEmpty(user.firstName()))
        .setLastName(nullToEmpty(user.lastName()))
        .setCreatedAt(toTimestamp(user.createdAt()))
        .setUpdatedAt(toTimestamp(user.updatedAt()))
        .build();
  }

  static LoginResponse toProto(LoginResult result) {
    return LoginResponse.newBuilder()
        .setAccessToken(result.accessToken())
        .setExpiresAt(toTimestamp(result.expiresAt()))
        .setUserId(result.userId())
        .setUsername(result.username())
        .build();
  }

  static TaskStatus toProto(task.management.domain.model.task.TaskStatus status) {
    return switch (status) {
      case PENDING -> TaskStatus.TASK_STATUS_PENDING;
      case IN_PROGRESS -> TaskStatus.TASK_STATUS_IN_PROGRESS;
      case COMPLETED -> TaskStatus.TASK_STATUS_COMPLETED;
    };
  }

  /**
   * @return UNSPECIFIED면 null ("변경 없음" / "필터 없음")
   * @throws InvalidInputException 알 수 없는 enum 값
   */
  static task.management.domain.model.task.TaskStatus toDomain(TaskStatus status) {
    return switch (status) {
      case TASK_STATUS_UNSPECIFIED -> null;
      case TASK_STATUS_PENDING -> task.management.domain.model.task.TaskStatus.PENDING;
      case TASK_STATUS_IN_PROGRESS -> task.management.domain.model.task.TaskStatus.IN_PROGRESS;
      case TASK_STATUS_COMPLETED -> task.management.domain.model.task.TaskStatus.COMPLETED;
      default -> throw new InvalidInputException("unknown task status");
    };
  }

  static Timestamp toTimestamp(Instant instant) {
    return Timestamp.newBuilder()
        .setSeconds(instant.getEpochSecond())
        .setNanos(instant.getNano())
        .build();
  }

  static Instant toInstant(Timestamp timestamp) {
    return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
  }

  /** proto3 문자열은 null이 될 수 없음 */
  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /** 빈 문자열은 "미입력" */
  static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
