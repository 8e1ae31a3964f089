package task.management.error;

public interface ErrorCode {
  String getCode();

  String getMessage();

  ErrorKind getKind();
}
