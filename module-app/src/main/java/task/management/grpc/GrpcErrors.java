package task.management.grpc;

import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import task.management.error.CommonErrorCode;
import task.management.error.exception.base.BaseException;
import task.management.global.error.TransportErrorTable;

/**
 * gRPC 응답/오류 변환
 *
 * <p>{@link BaseException}은 {@link TransportErrorTable}로 상태 코드를 결정합니다. 서버 측 오류는 일반 메시지만
 * 노출하고 상세는 로그에 남깁니다.
 */
@Slf4j
final class GrpcErrors {

  private GrpcErrors() {}

  static <T> void respond(StreamObserver<T> observer, Supplier<T> handler) {
    T response;
    try {
      response = handler.get();
    } catch (StatusRuntimeException e) {
      observer.onError(e);
      return;
    } catch (BaseException e) {
      observer.onError(toStatusException(e));
      return;
    } catch (RuntimeException e) {
      log.error("[gRPC] Unexpected Exception", e);
      observer.onError(internal());
      return;
    }

    if (Context.current().isCancelled()) {
      observer.onError(
          Status.DEADLINE_EXCEEDED.withDescription("call deadline exceeded").asRuntimeException());
      return;
    }
    observer.onNext(response);
    observer.onCompleted();
  }

  static StatusRuntimeException toStatusException(BaseException e) {
    if (e.getKind().isServerSide()) {
      log.error(
          "[gRPC] Server Exception: {} | Message: {}",
          e.getErrorCode().getCode(),
          e.getMessage(),
          e);
      return internal();
    }
    log.warn(
        "[gRPC] Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return Status.fromCode(TransportErrorTable.grpcCode(e.getKind()))
        .withDescription(e.getMessage())
        .asRuntimeException();
  }

  private static StatusRuntimeException internal() {
    return Status.INTERNAL
        .withDescription(CommonErrorCode.INTERNAL_SERVER_ERROR.getMessage())
        .asRuntimeException();
  }
}
