package task.management.infrastructure.executor;

import task.management.infrastructure.executor.function.ThrowingSupplier;
import task.management.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>호출부에서 try-catch를 걷어내고, 예외 변환과 실행 시간 측정을 한 곳에서 수행합니다. 비즈니스 로직은 별도 메서드로 분리하고 메서드
 * 참조를 넘기는 형태를 권장합니다.
 *
 * <ul>
 *   <li>try-catch-throw (예외 변환 후 재전파) - {@link #execute}
 *   <li>try-catch-return (기본값 반환) - {@link #executeOrDefault}
 *   <li>다중 catch (ExceptionTranslator 사용) - {@link #executeWithTranslation}
 * </ul>
 *
 * <p>{@link task.management.error.exception.base.BaseException}은 어떤 경로에서도 변환 없이 그대로 전파되고, {@link
 * Error}는 번역 없이 즉시 전파됩니다.
 */
public interface LogicExecutor {

  /**
   * 기본 변환기로 예외를 RuntimeException으로 변환하여 전파
   *
   * @param task 실행할 작업
   * @param context 작업 컨텍스트 (로깅/메트릭용)
   * @return 작업 결과
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 예외 발생 시 WARN 로그를 남기고 기본값을 반환합니다. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * 주어진 변환기로 예외를 도메인 예외로 변환하여 전파
   *
   * <pre>{@code
   * return executor.executeWithTranslation(
   *     () -> repository.insert(document),
   *     ExceptionTranslator.forPersistence(this::toDuplicateException),
   *     TaskContext.of("UserStore", "create", user.username()));
   * }</pre>
   */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
