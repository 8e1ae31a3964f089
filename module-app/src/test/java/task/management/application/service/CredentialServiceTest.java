package task.management.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import task.management.domain.model.auth.IssuedToken;
import task.management.domain.model.auth.TokenClaims;
import task.management.domain.model.user.User;
import task.management.error.exception.UnknownResourceKindException;
import task.management.error.exception.auth.InvalidTokenException;
import task.management.error.exception.auth.ResourceAccessDeniedException;
import task.management.error.exception.user.UserNotFoundException;
import task.management.support.ApplicationFixture;

@Tag("unit")
@DisplayName("CredentialService 테스트")
class CredentialServiceTest {

  private ApplicationFixture fx;
  private CredentialService service;
  private User alice;

  @BeforeEach
  void setUp() {
    fx = new ApplicationFixture();
    service = fx.credentialService;
    alice = fx.register("alice", "alice@x.com", "secret1");
  }

  @Nested
  @DisplayName("토큰")
  class Tokens {

    @Test
    @DisplayName("연속 발급한 두 토큰은 서로 다르고 모두 유효하다")
    void issue_distinctAndValid() {
      IssuedToken first = service.issueToken(alice);
      IssuedToken second = service.issueToken(alice);

      assertThat(first.token()).isNotEqualTo(second.token());
      assertThat(service.validateToken(first.token()).userId()).isEqualTo(alice.id());
      assertThat(service.validateToken(second.token()).userId()).isEqualTo(alice.id());
    }

    @Test
    @DisplayName("ttl=0 토큰은 1초 뒤 InvalidToken")
    void issue_zeroTtl_expires() {
      IssuedToken token = service.issueToken(alice.id(), alice.username(), Duration.ZERO);
      fx.clock.advance(Duration.ofSeconds(1));

      assertThatThrownBy(() -> service.validateToken(token.token()))
          .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("갱신 토큰은 새 만료 시각을 가진다")
    void refresh_extendsExpiry() {
      IssuedToken original = service.issueToken(alice);
      fx.clock.advance(Duration.ofHours(1));

      IssuedToken refreshed = service.refreshToken(original.token());

      TokenClaims claims = service.validateToken(refreshed.token());
      assertThat(claims.userId()).isEqualTo(alice.id());
      assertThat(refreshed.expiresAt()).isAfter(original.expiresAt());
    }

    @Test
    @DisplayName("삭제된 사용자의 토큰은 갱신할 수 없다")
    void refresh_deletedUser() {
      IssuedToken token = service.issueToken(alice);
      fx.userDirectoryService.delete(alice.id());

      assertThatThrownBy(() -> service.refreshToken(token.token()))
          .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("만료된 토큰은 갱신할 수 없다")
    void refresh_expired() {
      IssuedToken token = service.issueToken(alice);
      fx.clock.advance(Duration.ofHours(25));

      assertThatThrownBy(() -> service.refreshToken(token.token()))
          .isInstanceOf(InvalidTokenException.class);
    }
  }

  @Nested
  @DisplayName("비밀번호/접근 검사")
  class PasswordAndAccess {

    @Test
    @DisplayName("해시 검증은 불일치나 손상된 해시에도 예외 없이 false")
    void verifyPassword() {
      String hash = service.hashPassword("secret1");

      assertThat(service.verifyPassword(hash, "secret1")).isTrue();
      assertThat(service.verifyPassword(hash, "secret2")).isFalse();
      assertThat(service.verifyPassword(null, "secret1")).isFalse();
    }

    @Test
    @DisplayName("본인 리소스만 허용, 알 수 없는 종류는 UnknownResourceKind")
    void authorize() {
      assertThatCode(() -> service.authorizeResourceAccess(alice.id(), alice.id(), "user"))
          .doesNotThrowAnyException();
      assertThatThrownBy(() -> service.authorizeResourceAccess("other", alice.id(), "task"))
          .isInstanceOf(ResourceAccessDeniedException.class);
      assertThatThrownBy(() -> service.authorizeResourceAccess(alice.id(), alice.id(), "project"))
          .isInstanceOf(UnknownResourceKindException.class);
    }
  }
}
