package task.management.error;

/**
 * 도메인 에러 분류 (Transport 독립)
 *
 * <p>모든 {@link ErrorCode}는 정확히 하나의 Kind에 속하며, REST/gRPC 어댑터는 Kind만 보고 상태 코드를 결정합니다.
 */
public enum ErrorKind {
  NOT_FOUND,
  INVALID_INPUT,
  UNAUTHORIZED,
  DUPLICATE_KEY,
  INVALID_CREDENTIALS,
  INVALID_TOKEN,
  INVALID_TRANSITION,
  INTERNAL;

  /** 5xx 계열 여부 (상세 메시지를 외부로 노출하지 않음) */
  public boolean isServerSide() {
    return this == INTERNAL;
  }
}
