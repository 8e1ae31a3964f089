package task.management.domain.model.task;

import task.management.error.exception.InvalidInputException;

/**
 * 작업 우선순위 (Value Object)
 *
 * <p>항상 [1, 5] 범위를 보장합니다.
 */
public record Priority(int value) {

  public static final int MIN = 1;
  public static final int MAX = 5;

  public Priority {
    if (value < MIN || value > MAX) {
      throw new InvalidInputException(
          "priority must be between " + MIN + " and " + MAX + " (was " + value + ")");
    }
  }

  public static Priority of(int value) {
    return new Priority(value);
  }
}
