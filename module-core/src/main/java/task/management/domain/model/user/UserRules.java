package task.management.domain.model.user;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import task.management.error.exception.InvalidInputException;

/** 가입/수정 입력값 검증 규칙 */
public final class UserRules {

  public static final int MIN_USERNAME_LENGTH = 3;
  public static final int MIN_PASSWORD_LENGTH = 6;

  /** BCrypt는 72바이트 이후 입력을 무시하므로 상한을 둡니다. */
  public static final int MAX_PASSWORD_BYTES = 72;

  private static final Pattern EMAIL_PATTERN =
      Pattern.compile("^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

  private UserRules() {}

  public static boolean isEmail(String value) {
    return value != null && EMAIL_PATTERN.matcher(value).matches();
  }

  public static void requireValidUsername(String username) {
    if (username == null || username.length() < MIN_USERNAME_LENGTH) {
      throw new InvalidInputException(
          "username must be at least " + MIN_USERNAME_LENGTH + " characters long");
    }
  }

  public static void requireValidEmail(String email) {
    if (!isEmail(email)) {
      throw new InvalidInputException("invalid email format");
    }
  }

  public static void requireValidPassword(String password) {
    if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
      throw new InvalidInputException(
          "password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
    }
    if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
      throw new InvalidInputException(
          "password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
    }
  }
}
