package task.management.domain.model.user;

import java.time.Instant;
import java.util.Objects;

/**
 * 사용자 도메인 모델 (순수 도메인)
 *
 * <p>passwordHash는 BCrypt 해시이며 외부 응답으로 직렬화되지 않습니다. record 기본 toString()은 모든 필드를 노출하므로
 * 오버라이드하여 해시를 마스킹합니다.
 */
public record User(
    String id,
    String username,
    String email,
    String passwordHash,
    String firstName,
    String lastName,
    Instant createdAt,
    Instant updatedAt) {

  /** 신규 가입 사용자 생성 */
  public static User register(
      String username,
      String email,
      String passwordHash,
      String firstName,
      String lastName,
      Instant now) {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(passwordHash, "passwordHash");
    return new User(null, username, email, passwordHash, firstName, lastName, now, now);
  }

  /**
   * 프로필 변경된 새 인스턴스 반환
   *
   * <p>null 인자는 "변경 없음"을 의미합니다.
   */
  public User withChanges(
      String newEmail,
      String newFirstName,
      String newLastName,
      String newPasswordHash,
      Instant now) {
    return new User(
        id,
        username,
        newEmail != null ? newEmail : email,
        newPasswordHash != null ? newPasswordHash : passwordHash,
        newFirstName != null ? newFirstName : firstName,
        newLastName != null ? newLastName : lastName,
        createdAt,
        now);
  }

  public User withId(String id) {
    return new User(id, username, email, passwordHash, firstName, lastName, createdAt, updatedAt);
  }

  @Override
  public String toString() {
    return "User["
        + "id="
        + id
        + ", username="
        + username
        + ", email="
        + email
        + ", passwordHash=****"
        + ", createdAt="
        + createdAt
        + "]";
  }
}
