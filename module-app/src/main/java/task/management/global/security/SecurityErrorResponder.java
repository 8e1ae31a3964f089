package task.management.global.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import task.management.error.CommonErrorCode;
import task.management.error.ErrorCode;
import task.management.global.error.dto.ErrorResponse;
import task.management.global.response.ApiResponse;

/** 인증 실패(401)/권한 없음(403)을 API 공통 응답 포맷으로 기록 */
@RequiredArgsConstructor
public class SecurityErrorResponder {

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AuthenticationEntryPoint entryPoint() {
    return (request, response, authException) ->
        write(response, HttpStatus.UNAUTHORIZED, CommonErrorCode.INVALID_TOKEN);
  }

  public AccessDeniedHandler accessDeniedHandler() {
    return (request, response, accessDeniedException) ->
        write(response, HttpStatus.FORBIDDEN, CommonErrorCode.RESOURCE_ACCESS_DENIED);
  }

  private void write(HttpServletResponse response, HttpStatus status, ErrorCode errorCode)
      throws IOException {
    ErrorResponse body =
        ErrorResponse.of(status.value(), errorCode, status.getReasonPhrase(), clock.instant());
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getWriter(), ApiResponse.error(body));
  }
}
