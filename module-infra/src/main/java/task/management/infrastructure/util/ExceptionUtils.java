package task.management.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 래핑된 예외에서 원인 예외를 꺼내는 유틸리티 */
public final class ExceptionUtils {

  /**
   * CompletionException / ExecutionException 래퍼를 벗겨 원인을 반환합니다.
   *
   * @param throwable 원본 예외
   * @return 원인 예외, 래핑되지 않았거나 원인이 없으면 원본
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      Throwable next = cause.getCause();
      if (next == null) {
        return cause;
      }
      cause = next;
    }
    return cause;
  }

  private ExceptionUtils() {}
}
