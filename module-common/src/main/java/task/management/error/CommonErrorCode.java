package task.management.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors ===
  INVALID_INPUT_VALUE("C001", "Invalid input: %s", ErrorKind.INVALID_INPUT),
  UNKNOWN_RESOURCE_KIND("C002", "Unknown resource kind: %s", ErrorKind.INVALID_INPUT),

  // === Auth ===
  INVALID_CREDENTIALS("A001", "Invalid login credentials", ErrorKind.INVALID_CREDENTIALS),
  INVALID_TOKEN("A002", "Invalid or expired token", ErrorKind.INVALID_TOKEN),
  RESOURCE_ACCESS_DENIED("A003", "Access to %s %s denied", ErrorKind.UNAUTHORIZED),

  // === User ===
  USER_NOT_FOUND("U001", "User not found (%s)", ErrorKind.NOT_FOUND),
  DUPLICATE_USERNAME("U002", "Username already taken: %s", ErrorKind.DUPLICATE_KEY),
  DUPLICATE_EMAIL("U003", "Email already registered: %s", ErrorKind.DUPLICATE_KEY),

  // === Task ===
  TASK_NOT_FOUND("T001", "Task not found (ID: %s)", ErrorKind.NOT_FOUND),
  TASK_ACCESS_DENIED("T002", "Not allowed to %s task %s", ErrorKind.UNAUTHORIZED),
  INVALID_STATUS_TRANSITION(
      "T003", "Invalid status transition: %s -> %s", ErrorKind.INVALID_TRANSITION),
  CREATOR_NOT_FOUND("T004", "Creator user not found (ID: %s)", ErrorKind.NOT_FOUND),
  ASSIGNEE_NOT_FOUND("T005", "Assignee user not found (ID: %s)", ErrorKind.NOT_FOUND),

  // === Server Errors ===
  INTERNAL_SERVER_ERROR("S001", "Internal server error.", ErrorKind.INTERNAL),
  PASSWORD_HASHING_FAILURE("S002", "Password hashing failed", ErrorKind.INTERNAL),
  TOKEN_SIGNING_FAILURE("S003", "Token signing failed: %s", ErrorKind.INTERNAL),
  PERSISTENCE_FAILURE("S004", "Persistence operation failed (%s)", ErrorKind.INTERNAL);

  private final String code;
  private final String message;
  private final ErrorKind kind;
}
