package task.management.domain.model.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import task.management.error.exception.InvalidInputException;

class UserRulesTest {

  @ParameterizedTest
  @ValueSource(strings = {"alice@x.com", "a.b-c+d@mail.example.org", "x_y%z@host.io"})
  void acceptsValidEmails(String email) {
    assertThat(UserRules.isEmail(email)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"alice", "alice@", "@x.com", "alice@x", "alice@x.c", "a b@x.com"})
  void rejectsInvalidEmails(String email) {
    assertThat(UserRules.isEmail(email)).isFalse();
  }

  @Test
  void usernameNeedsThreeCharacters() {
    assertThatThrownBy(() -> UserRules.requireValidUsername("al"))
        .isInstanceOf(InvalidInputException.class);
    assertThatCode(() -> UserRules.requireValidUsername("ali")).doesNotThrowAnyException();
  }

  @Test
  void passwordLengthBounds() {
    assertThatThrownBy(() -> UserRules.requireValidPassword("12345"))
        .isInstanceOf(InvalidInputException.class);
    assertThatCode(() -> UserRules.requireValidPassword("secret1")).doesNotThrowAnyException();
    assertThatThrownBy(() -> UserRules.requireValidPassword("p".repeat(73)))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void toStringMasksPasswordHash() {
    User user =
        User.register("alice", "alice@x.com", "$2a$10$secretHash", null, null, Instant.EPOCH);

    assertThat(user.toString()).doesNotContain("secretHash").contains("****");
  }
}
