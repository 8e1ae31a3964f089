package task.management.controller.dto.auth;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.format.DateTimeFormatter;
import task.management.application.dto.LoginResult;

/** 로그인/토큰 갱신 응답 (expires_at은 ISO-8601 UTC) */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenResponse(String accessToken, String expiresAt, String userId, String username) {

  public static TokenResponse from(LoginResult result) {
    return new TokenResponse(
        result.accessToken(),
        DateTimeFormatter.ISO_INSTANT.format(result.expiresAt()),
        result.userId(),
        result.username());
  }
}
