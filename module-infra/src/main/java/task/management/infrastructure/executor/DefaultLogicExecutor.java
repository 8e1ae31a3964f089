package task.management.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import task.management.infrastructure.executor.function.ThrowingSupplier;
import task.management.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Micrometer 타이머를 기록하는 LogicExecutor 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>메트릭 카디널리티</b>: component/operation/outcome만 태그로 사용, dynamicValue는 로그 전용
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  static final String TIMER_NAME = "logic.execution";

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;
  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      record(context, "success", start);
      return result;
    } catch (Error e) {
      record(context, "error", start);
      throw e;
    } catch (Throwable t) {
      record(context, "fallback", start);
      log.warn("[{}] 실패, 기본값 반환: {}", context.toTaskName(), t.toString());
      return defaultValue;
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      record(context, "success", start);
      return result;
    } catch (Error e) {
      record(context, "error", start);
      throw e;
    } catch (Throwable t) {
      record(context, "failure", start);
      Throwable primary = translateSafe(customTranslator, t, context);
      log.debug("[{}] {} → {}", context.toTaskName(), t.getClass().getSimpleName(), primary);
      throwAsUnchecked(primary);
      return null;
    }
  }

  private void record(TaskContext context, String outcome, long startNanos) {
    Timer.builder(TIMER_NAME)
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
  }

  private static Throwable translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException | Error ex) {
      return ex;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  @SuppressWarnings("unchecked")
  private static <E extends Throwable> void throwAsUnchecked(Throwable t) throws E {
    throw (E) t;
  }
}
