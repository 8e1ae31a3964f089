package task.management.domain.model.auth;

import java.time.Instant;

/**
 * 발급된 액세스 토큰
 *
 * @param token 서명된 JWT 문자열
 * @param expiresAt 만료 시각
 */
public record IssuedToken(String token, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedToken[token=" + mask(token) + ", expiresAt=" + expiresAt + "]";
  }

  private static String mask(String token) {
    if (token == null || token.length() < 10) {
      return "***";
    }
    return token.substring(0, 6) + "...";
  }
}
