package task.management.global.error.dto;

import java.time.Instant;
import task.management.error.ErrorCode;
import task.management.error.exception.base.BaseException;

/**
 * 에러 응답 본문
 *
 * @param status HTTP 상태 코드
 * @param code 에러 코드 (예: "T001")
 * @param message 사용자 메시지 (서버 에러는 고정 메시지)
 * @param timestamp 발생 시각
 */
public record ErrorResponse(int status, String code, String message, Instant timestamp) {

  /** 비즈니스 예외: 동적으로 가공된 메시지를 그대로 전달 */
  public static ErrorResponse of(int status, BaseException e, Instant now) {
    return new ErrorResponse(status, e.getErrorCode().getCode(), e.getMessage(), now);
  }

  /** 시스템 예외: ErrorCode 기본 메시지만 전달하고 상세 내용은 숨김 */
  public static ErrorResponse of(int status, ErrorCode errorCode, Instant now) {
    return new ErrorResponse(status, errorCode.getCode(), errorCode.getMessage(), now);
  }

  public static ErrorResponse of(int status, ErrorCode errorCode, String message, Instant now) {
    return new ErrorResponse(status, errorCode.getCode(), message, now);
  }
}
