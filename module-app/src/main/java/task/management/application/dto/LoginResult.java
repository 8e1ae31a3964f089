package task.management.application.dto;

import java.time.Instant;
import task.management.domain.model.auth.IssuedToken;
import task.management.domain.model.user.User;

/**
 * 로그인/토큰 갱신 결과
 *
 * @param accessToken 서명된 JWT
 * @param expiresAt 만료 시각
 */
public record LoginResult(String accessToken, Instant expiresAt, String userId, String username) {

  public static LoginResult of(IssuedToken token, User user) {
    return new LoginResult(token.token(), token.expiresAt(), user.id(), user.username());
  }

  @Override
  public String toString() {
    return "LoginResult[accessToken=****, expiresAt="
        + expiresAt
        + ", userId="
        + userId
        + ", username="
        + username
        + "]";
  }
}
