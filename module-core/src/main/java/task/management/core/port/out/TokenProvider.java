package task.management.core.port.out;

import java.time.Duration;
import task.management.domain.model.auth.IssuedToken;
import task.management.domain.model.auth.TokenClaims;

/** 서명 토큰 발급/검증 Port */
public interface TokenProvider {

  /**
   * @throws task.management.error.exception.auth.SigningException 서명 실패
   */
  IssuedToken issue(String userId, String username, Duration ttl);

  /**
   * @throws task.management.error.exception.auth.InvalidTokenException 구조/서명/알고리즘/만료 오류
   */
  TokenClaims validate(String token);

  /** 로그인/갱신 시 사용하는 기본 유효 기간 */
  Duration defaultTtl();
}
