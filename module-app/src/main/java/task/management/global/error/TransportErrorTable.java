package task.management.global.error;

import io.grpc.Status;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import task.management.error.ErrorKind;

/**
 * ErrorKind → HTTP 상태 / gRPC 상태 코드 매핑 (REST와 gRPC 공용)
 *
 * <pre>
 * NOT_FOUND           404  NOT_FOUND
 * INVALID_INPUT       400  INVALID_ARGUMENT
 * UNAUTHORIZED        403  PERMISSION_DENIED
 * DUPLICATE_KEY       409  ALREADY_EXISTS
 * INVALID_CREDENTIALS 401  UNAUTHENTICATED
 * INVALID_TOKEN       401  UNAUTHENTICATED
 * INVALID_TRANSITION  409  FAILED_PRECONDITION
 * INTERNAL            500  INTERNAL
 * </pre>
 */
public final class TransportErrorTable {

  private record Mapping(HttpStatus http, Status.Code grpc) {}

  private static final Map<ErrorKind, Mapping> TABLE = new EnumMap<>(ErrorKind.class);

  static {
    TABLE.put(ErrorKind.NOT_FOUND, new Mapping(HttpStatus.NOT_FOUND, Status.Code.NOT_FOUND));
    TABLE.put(
        ErrorKind.INVALID_INPUT, new Mapping(HttpStatus.BAD_REQUEST, Status.Code.INVALID_ARGUMENT));
    TABLE.put(
        ErrorKind.UNAUTHORIZED, new Mapping(HttpStatus.FORBIDDEN, Status.Code.PERMISSION_DENIED));
    TABLE.put(ErrorKind.DUPLICATE_KEY, new Mapping(HttpStatus.CONFLICT, Status.Code.ALREADY_EXISTS));
    TABLE.put(
        ErrorKind.INVALID_CREDENTIALS,
        new Mapping(HttpStatus.UNAUTHORIZED, Status.Code.UNAUTHENTICATED));
    TABLE.put(
        ErrorKind.INVALID_TOKEN, new Mapping(HttpStatus.UNAUTHORIZED, Status.Code.UNAUTHENTICATED));
    TABLE.put(
        ErrorKind.INVALID_TRANSITION,
        new Mapping(HttpStatus.CONFLICT, Status.Code.FAILED_PRECONDITION));
    TABLE.put(
        ErrorKind.INTERNAL, new Mapping(HttpStatus.INTERNAL_SERVER_ERROR, Status.Code.INTERNAL));
  }

  private TransportErrorTable() {}

  public static HttpStatus httpStatus(ErrorKind kind) {
    return TABLE.get(kind).http();
  }

  public static Status.Code grpcCode(ErrorKind kind) {
    return TABLE.get(kind).grpc();
  }
}
