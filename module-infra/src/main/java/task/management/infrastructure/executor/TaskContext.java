package task.management.infrastructure.executor;

import java.util.Objects;

/**
 * 실행 단위 식별 컨텍스트
 *
 * <p>component/operation은 메트릭 태그로 쓰이는 고정 값이고, dynamicValue(문서 ID 등)는 로그에만 남깁니다.
 *
 * <pre>
 * TaskContext.of("TaskStore", "update", taskId).toTaskName()  →  "TaskStore:update:665f..."
 * TaskContext.of("Jwt", "issue").toTaskName()                 →  "Jwt:issue"
 * </pre>
 *
 * @param component 컴포넌트 이름 (예: "UserStore", "Jwt")
 * @param operation 작업 유형 (예: "create", "findById")
 * @param dynamicValue 로그 전용 동적 값
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** "component:operation[:dynamicValue]" */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
