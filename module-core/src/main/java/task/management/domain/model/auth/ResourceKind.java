package task.management.domain.model.auth;

import java.util.Arrays;
import task.management.error.exception.UnknownResourceKindException;

/** 단일 소유자 접근 검사를 지원하는 리소스 종류 */
public enum ResourceKind {
  TASK("task"),
  USER("user");

  private final String value;

  ResourceKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ResourceKind from(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new UnknownResourceKindException(String.valueOf(value)));
  }
}
