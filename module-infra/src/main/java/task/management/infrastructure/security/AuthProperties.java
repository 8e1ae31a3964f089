package task.management.infrastructure.security;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * JWT 서명 설정 (불변)
 *
 * <pre>
 * auth:
 *   jwt:
 *     secret: ${JWT_SECRET:dev-secret-...}
 *     expiry: 24h
 * </pre>
 *
 * @param secret HS256 서명 키 (UTF-8 기준 32바이트 이상)
 * @param expiry 로그인/갱신 토큰의 기본 유효 기간
 */
@Validated
@ConfigurationProperties(prefix = "auth.jwt")
public record AuthProperties(@NotBlank String secret, @NotNull @DefaultValue("24h") Duration expiry) {

  @Override
  public String toString() {
    return "AuthProperties[secret=****, expiry=" + expiry + "]";
  }
}
