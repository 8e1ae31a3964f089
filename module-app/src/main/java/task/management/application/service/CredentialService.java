package task.management.application.service;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import task.management.core.port.out.PasswordHasher;
import task.management.core.port.out.TokenProvider;
import task.management.core.port.out.UserRepositoryPort;
import task.management.domain.model.auth.IssuedToken;
import task.management.domain.model.auth.TokenClaims;
import task.management.domain.model.user.User;
import task.management.domain.service.ResourceAccessPolicy;
import task.management.error.exception.user.UserNotFoundException;

/**
 * 비밀번호 해시, 토큰 발급/검증/갱신, 단일 소유자 접근 검사
 *
 * <p>토큰은 저장되지 않으며 만료 외의 무효화 수단은 없습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialService {

  private final PasswordHasher passwordHasher;
  private final TokenProvider tokenProvider;
  private final UserRepositoryPort userRepository;
  private final ResourceAccessPolicy accessPolicy;

  public String hashPassword(String plaintext) {
    return passwordHasher.hash(plaintext);
  }

  /** 불일치나 손상된 해시에도 예외 없이 false */
  public boolean verifyPassword(String passwordHash, String plaintext) {
    return passwordHasher.matches(plaintext, passwordHash);
  }

  public IssuedToken issueToken(String userId, String username, Duration ttl) {
    return tokenProvider.issue(userId, username, ttl);
  }

  public IssuedToken issueToken(User user) {
    return tokenProvider.issue(user.id(), user.username(), tokenProvider.defaultTtl());
  }

  /**
   * @throws task.management.error.exception.auth.InvalidTokenException 서명/알고리즘/만료 오류
   */
  public TokenClaims validateToken(String token) {
    return tokenProvider.validate(token);
  }

  /**
   * 유효한 토큰으로 새 유효 기간의 토큰을 발급합니다. 사용자를 다시 조회하므로 삭제된 사용자는 갱신할 수 없습니다.
   *
   * @throws task.management.error.exception.auth.InvalidTokenException 기존 토큰이 무효
   * @throws UserNotFoundException 토큰의 사용자가 더 이상 없음
   */
  public IssuedToken refreshToken(String oldToken) {
    return issueToken(resolveUser(oldToken));
  }

  /** 토큰을 검증하고 현재 사용자 정보를 조회합니다. */
  public User resolveUser(String token) {
    TokenClaims claims = tokenProvider.validate(token);
    return userRepository
        .findById(claims.userId())
        .orElseThrow(() -> new UserNotFoundException("ID: " + claims.userId()));
  }

  /**
   * @throws task.management.error.exception.UnknownResourceKindException 알 수 없는 리소스 종류
   * @throws task.management.error.exception.auth.ResourceAccessDeniedException 소유자가 아님
   */
  public void authorizeResourceAccess(String userId, String resourceOwnerId, String resourceKind) {
    accessPolicy.authorize(userId, resourceOwnerId, resourceKind);
  }
}
