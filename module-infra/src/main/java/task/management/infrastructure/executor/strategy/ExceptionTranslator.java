package task.management.infrastructure.executor.strategy;

import java.util.function.Function;
import org.springframework.dao.DuplicateKeyException;
import task.management.error.exception.InternalSystemException;
import task.management.error.exception.base.BaseException;
import task.management.infrastructure.executor.TaskContext;
import task.management.infrastructure.util.ExceptionUtils;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException → 그대로 반환
   *   <li>그 외 → 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 예외 변환기: 도메인 예외가 아니면 InternalSystemException */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /**
   * 저장소 예외 변환기
   *
   * <p>유니크 인덱스 위반({@link DuplicateKeyException})은 onDuplicate가 엔티티별 중복 예외로 바꾸고, 나머지 저장소 장애는 재시도
   * 없이 InternalSystemException으로 전파합니다.
   *
   * @param onDuplicate 중복 키 예외 → 도메인 예외 매핑
   */
  static ExceptionTranslator forPersistence(
      Function<DuplicateKeyException, RuntimeException> onDuplicate) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof DuplicateKeyException dke) {
            return onDuplicate.apply(dke);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  /** 중복 키가 발생할 수 없는 컬렉션용 저장소 변환기 */
  static ExceptionTranslator forPersistence() {
    return defaultTranslator();
  }
}
