package task.management.infrastructure.executor.function;

/** 예외를 던질 수 있는 값 반환 작업 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
