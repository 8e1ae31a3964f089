package task.management.global.error;

import jakarta.servlet.ServletException;
import jakarta.validation.ConstraintViolationException;
import java.time.Clock;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import task.management.error.CommonErrorCode;
import task.management.error.exception.base.BaseException;
import task.management.global.error.dto.ErrorResponse;
import task.management.global.response.ApiResponse;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final Clock clock;

  /** 비즈니스 예외: 서버 측 종류는 원인 포함 ERROR, 나머지는 WARN */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ApiResponse<Void>> handleBaseException(BaseException e) {
    HttpStatus status = TransportErrorTable.httpStatus(e.getKind());
    if (e.getKind().isServerSide()) {
      log.error(
          "Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
      return respond(
          status,
          ErrorResponse.of(status.value(), CommonErrorCode.INTERNAL_SERVER_ERROR, clock.instant()));
    }
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return respond(status, ErrorResponse.of(status.value(), e, clock.instant()));
  }

  /** Bean Validation 실패 → C001 */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return invalidInput(detail);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  protected ResponseEntity<ApiResponse<Void>> handleConstraint(ConstraintViolationException e) {
    return invalidInput(e.getMessage());
  }

  /** 잘못된 JSON 본문 */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  protected ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
    return invalidInput("malformed request body");
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    MissingRequestHeaderException.class
  })
  protected ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
    return invalidInput(e.getMessage());
  }

  /** 없는 경로, 지원하지 않는 메서드 등 MVC 표준 예외는 자체 상태 코드 유지 */
  @ExceptionHandler(ServletException.class)
  protected ResponseEntity<ApiResponse<Void>> handleServletException(ServletException e) {
    if (e instanceof org.springframework.web.ErrorResponse mvcError) {
      HttpStatus status = HttpStatus.valueOf(mvcError.getStatusCode().value());
      log.warn("Request Rejected: {} {}", status.value(), e.getMessage());
      return respond(
          status,
          ErrorResponse.of(
              status.value(), CommonErrorCode.INVALID_INPUT_VALUE, e.getMessage(), clock.instant()));
    }
    return handleException(e);
  }

  /** 예측하지 못한 시스템 예외: 상세 메시지는 로그에만 남김 */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
    return respond(
        status,
        ErrorResponse.of(status.value(), CommonErrorCode.INTERNAL_SERVER_ERROR, clock.instant()));
  }

  private ResponseEntity<ApiResponse<Void>> invalidInput(String detail) {
    log.warn("Invalid Request: {}", detail);
    HttpStatus status = HttpStatus.BAD_REQUEST;
    String message = String.format(CommonErrorCode.INVALID_INPUT_VALUE.getMessage(), detail);
    return respond(
        status,
        ErrorResponse.of(
            status.value(), CommonErrorCode.INVALID_INPUT_VALUE, message, clock.instant()));
  }

  private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, ErrorResponse body) {
    return ResponseEntity.status(status).body(ApiResponse.error(body));
  }
}
