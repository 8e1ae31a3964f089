package task.management.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import task.management.application.dto.RegisterCommand;
import task.management.application.dto.UserUpdateCommand;
import task.management.domain.model.user.User;
import task.management.error.exception.InvalidInputException;
import task.management.error.exception.auth.InvalidCredentialsException;
import task.management.error.exception.user.DuplicateEmailException;
import task.management.error.exception.user.DuplicateUsernameException;
import task.management.error.exception.user.UserNotFoundException;
import task.management.support.ApplicationFixture;

@Tag("unit")
@DisplayName("UserDirectoryService 테스트")
class UserDirectoryServiceTest {

  private ApplicationFixture fx;
  private UserDirectoryService service;

  @BeforeEach
  void setUp() {
    fx = new ApplicationFixture();
    service = fx.userDirectoryService;
  }

  @Nested
  @DisplayName("가입")
  class Register {

    @Test
    @DisplayName("alice 가입 성공 시 ID가 부여되고 비밀번호는 해시로 저장된다")
    void register_success() {
      // when
      User alice = fx.register("alice", "alice@x.com", "secret1");

      // then
      assertThat(alice.id()).isNotBlank();
      assertThat(alice.passwordHash()).isNotEqualTo("secret1");
      assertThat(alice.createdAt()).isEqualTo(ApplicationFixture.T0);
      assertThat(fx.users.findById(alice.id())).isPresent();
    }

    @Test
    @DisplayName("같은 이메일로 다른 사용자명 가입 시 DuplicateEmail")
    void register_duplicateEmail() {
      fx.register("alice", "alice@x.com", "secret1");

      assertThatThrownBy(() -> fx.register("alice2", "alice@x.com", "secret2"))
          .isInstanceOf(DuplicateEmailException.class);
    }

    @Test
    @DisplayName("같은 사용자명으로 다른 이메일 가입 시 DuplicateUsername")
    void register_duplicateUsername() {
      fx.register("alice", "alice@x.com", "secret1");

      assertThatThrownBy(() -> fx.register("alice", "other@x.com", "secret2"))
          .isInstanceOf(DuplicateUsernameException.class);
    }

    @Test
    @DisplayName("이메일과 사용자명이 모두 중복이면 이메일 중복이 먼저 보고된다")
    void register_bothDuplicate_emailFirst() {
      fx.register("alice", "alice@x.com", "secret1");

      assertThatThrownBy(() -> fx.register("alice", "alice@x.com", "secret1"))
          .isInstanceOf(DuplicateEmailException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "ab"})
    @DisplayName("사용자명 3자 미만은 InvalidInput")
    void register_shortUsername(String username) {
      assertThatThrownBy(() -> fx.register(username, "a@x.com", "secret1"))
          .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("이메일 형식 오류와 짧은 비밀번호는 InvalidInput")
    void register_invalidEmailOrPassword() {
      assertThatThrownBy(() -> fx.register("alice", "not-an-email", "secret1"))
          .isInstanceOf(InvalidInputException.class);
      assertThatThrownBy(() -> fx.register("alice", "alice@x.com", "12345"))
          .isInstanceOf(InvalidInputException.class);
      assertThat(fx.users.all()).isEmpty();
    }

    @Test
    @DisplayName("이름 필드는 선택 입력이다")
    void register_withNames() {
      User user =
          service.register(new RegisterCommand("carol", "carol@x.com", "secret1", "Carol", "Kim"));

      assertThat(user.firstName()).isEqualTo("Carol");
      assertThat(user.lastName()).isEqualTo("Kim");
    }
  }

  @Nested
  @DisplayName("자격 증명 확인")
  class ValidateCredentials {

    @Test
    @DisplayName("가입한 비밀번호로 이메일/사용자명 로그인 모두 성공한다")
    void roundTrip_success() {
      User alice = fx.register("alice", "alice@x.com", "secret1");

      assertThat(service.validateCredentials("alice@x.com", "secret1").id()).isEqualTo(alice.id());
      assertThat(service.validateCredentials("alice", "secret1").id()).isEqualTo(alice.id());
    }

    @ParameterizedTest
    @ValueSource(strings = {"secret2", "", "SECRET1", "secret1 "})
    @DisplayName("다른 비밀번호는 InvalidCredentials")
    void roundTrip_wrongPassword(String password) {
      fx.register("alice", "alice@x.com", "secret1");

      assertThatThrownBy(() -> service.validateCredentials("alice@x.com", password))
          .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    @DisplayName("없는 사용자도 같은 InvalidCredentials")
    void unknownUser() {
      assertThatThrownBy(() -> service.validateCredentials("ghost@x.com", "secret1"))
          .isInstanceOf(InvalidCredentialsException.class);
      assertThatThrownBy(() -> service.validateCredentials(null, "secret1"))
          .isInstanceOf(InvalidCredentialsException.class);
    }
  }

  @Nested
  @DisplayName("조회/수정/삭제")
  class ReadUpdateDelete {

    @Test
    @DisplayName("이메일/사용자명 조회, 없으면 UserNotFound")
    void lookups() {
      User alice = fx.register("alice", "alice@x.com", "secret1");

      assertThat(service.getByEmail("alice@x.com").id()).isEqualTo(alice.id());
      assertThat(service.getByUsername("alice").id()).isEqualTo(alice.id());
      assertThatThrownBy(() -> service.getById("000000000000000000000000"))
          .isInstanceOf(UserNotFoundException.class);
      assertThatThrownBy(() -> service.getByEmail("bad"))
          .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("본인 이메일 그대로 수정은 중복이 아니며 updatedAt이 갱신된다")
    void update_sameEmail() {
      User alice = fx.register("alice", "alice@x.com", "secret1");
      fx.clock.advance(Duration.ofMinutes(5));

      User updated =
          service.update(alice.id(), new UserUpdateCommand("alice@x.com", null, "Alice", null));

      assertThat(updated.firstName()).isEqualTo("Alice");
      assertThat(updated.updatedAt()).isEqualTo(ApplicationFixture.T0.plus(Duration.ofMinutes(5)));
      assertThat(updated.createdAt()).isEqualTo(ApplicationFixture.T0);
    }

    @Test
    @DisplayName("다른 사용자의 이메일로 수정하면 DuplicateEmail")
    void update_takenEmail() {
      User alice = fx.register("alice", "alice@x.com", "secret1");
      fx.register("bob", "bob@x.com", "secret2");

      assertThatThrownBy(
              () -> service.update(alice.id(), new UserUpdateCommand("bob@x.com", null, null, null)))
          .isInstanceOf(DuplicateEmailException.class);
    }

    @Test
    @DisplayName("비밀번호 변경 후 새 비밀번호로만 로그인된다")
    void update_password() {
      User alice = fx.register("alice", "alice@x.com", "secret1");

      service.update(alice.id(), new UserUpdateCommand(null, "newsecret", null, null));

      assertThat(service.validateCredentials("alice", "newsecret").id()).isEqualTo(alice.id());
      assertThatThrownBy(() -> service.validateCredentials("alice", "secret1"))
          .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    @DisplayName("빈 수정은 값을 바꾸지 않는다")
    void update_empty() {
      User alice = fx.register("alice", "alice@x.com", "secret1");

      User updated = service.update(alice.id(), UserUpdateCommand.empty());

      assertThat(updated.email()).isEqualTo(alice.email());
      assertThat(updated.passwordHash()).isEqualTo(alice.passwordHash());
    }

    @Test
    @DisplayName("삭제 후 조회는 UserNotFound, 재삭제도 UserNotFound")
    void delete() {
      User alice = fx.register("alice", "alice@x.com", "secret1");

      service.delete(alice.id());

      assertThatThrownBy(() -> service.getById(alice.id()))
          .isInstanceOf(UserNotFoundException.class);
      assertThatThrownBy(() -> service.delete(alice.id()))
          .isInstanceOf(UserNotFoundException.class);
    }
  }
}
