package task.management.infrastructure.security.jwt;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import task.management.core.port.out.TokenProvider;
import task.management.domain.model.auth.IssuedToken;
import task.management.domain.model.auth.TokenClaims;
import task.management.error.exception.auth.InvalidTokenException;
import task.management.error.exception.auth.SigningException;
import task.management.infrastructure.executor.LogicExecutor;
import task.management.infrastructure.executor.TaskContext;
import task.management.infrastructure.executor.strategy.ExceptionTranslator;
import task.management.infrastructure.security.AuthProperties;

/**
 * JWT 토큰 생성 및 검증을 담당하는 Provider
 *
 * <p>JJWT 0.12.x 기준:
 *
 * <ul>
 *   <li>HS256 고정. 헤더의 alg가 HS256이 아니면 서명이 맞아도 거부 (alg=none 포함)
 *   <li>jti(UUID)를 넣어 같은 초에 발급된 토큰도 서로 다름
 *   <li>프로덕션 환경에서 기본 secret 사용 시 시작 거부
 *   <li>검증 실패 원인은 DEBUG 로그에만 남기고 호출자에게는 단일 InvalidTokenException
 * </ul>
 */
@Slf4j
@Component
public class JwtTokenProvider implements TokenProvider {

  static final String ISSUER = "task-management";
  static final String CLAIM_USER_ID = "uid";
  static final String CLAIM_USERNAME = "username";
  static final String DEFAULT_SECRET_PREFIX = "dev-secret";
  private static final String ALGORITHM = "HS256";
  private static final int MIN_SECRET_BYTES = 32;

  private final SecretKey secretKey;
  private final Duration defaultTtl;
  private final Clock clock;
  private final LogicExecutor executor;

  public JwtTokenProvider(
      AuthProperties properties, Clock clock, Environment environment, LogicExecutor executor) {
    validateSecretForProduction(properties.secret(), environment);
    this.secretKey = toKey(properties.secret());
    this.defaultTtl = properties.expiry();
    this.clock = clock;
    this.executor = executor;
    log.info("JWT TokenProvider initialized with default ttl: {}", defaultTtl);
  }

  private static void validateSecretForProduction(String secret, Environment environment) {
    boolean isProduction = Arrays.asList(environment.getActiveProfiles()).contains("prod");
    if (isProduction && secret != null && secret.startsWith(DEFAULT_SECRET_PREFIX)) {
      throw new IllegalStateException(
          "JWT_SECRET must be set in production environment. "
              + "Default development secret is not allowed in production.");
    }
  }

  private static SecretKey toKey(String secret) {
    if (secret == null || secret.isBlank()) {
      throw new SigningException("secret is blank");
    }
    byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < MIN_SECRET_BYTES) {
      throw new SigningException("secret must be at least 256 bits for HS256");
    }
    try {
      return Keys.hmacShaKeyFor(bytes);
    } catch (RuntimeException e) {
      throw new SigningException("unusable HMAC key", e);
    }
  }

  @Override
  public IssuedToken issue(String userId, String username, Duration ttl) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(ttl);
    String token =
        executor.executeWithTranslation(
            () -> sign(userId, username, now, expiresAt),
            ExceptionTranslator.withErrorGuardAndUnwrap(
                (e, context) -> new SigningException(e.getClass().getSimpleName(), e)),
            TaskContext.of("Jwt", "issue", userId));
    return new IssuedToken(token, expiresAt);
  }

  private String sign(String userId, String username, Instant now, Instant expiresAt) {
    return Jwts.builder()
        .id(UUID.randomUUID().toString())
        .issuer(ISSUER)
        .subject(userId)
        .claim(CLAIM_USER_ID, userId)
        .claim(CLAIM_USERNAME, username)
        .issuedAt(Date.from(now))
        .notBefore(Date.from(now))
        .expiration(Date.from(expiresAt))
        .signWith(secretKey, Jwts.SIG.HS256)
        .compact();
  }

  @Override
  public TokenClaims validate(String token) {
    return executor.executeWithTranslation(
        () -> parse(token),
        ExceptionTranslator.withErrorGuardAndUnwrap(
            (e, context) -> {
              log.debug("[Jwt] token rejected: {}", e.toString());
              return new InvalidTokenException();
            }),
        TaskContext.of("Jwt", "validate"));
  }

  private TokenClaims parse(String token) {
    Jws<Claims> jws =
        Jwts.parser()
            .verifyWith(secretKey)
            .requireIssuer(ISSUER)
            .clock(() -> Date.from(clock.instant()))
            .build()
            .parseSignedClaims(token);

    if (!ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
      log.debug("[Jwt] unexpected algorithm: {}", jws.getHeader().getAlgorithm());
      throw new InvalidTokenException();
    }

    Claims claims = jws.getPayload();
    String userId = claims.get(CLAIM_USER_ID, String.class);
    if (userId == null || !userId.equals(claims.getSubject())) {
      throw new InvalidTokenException();
    }
    return new TokenClaims(
        userId,
        claims.get(CLAIM_USERNAME, String.class),
        claims.getIssuedAt().toInstant(),
        claims.getExpiration().toInstant());
  }

  @Override
  public Duration defaultTtl() {
    return defaultTtl;
  }
}
