package task.management.controller.dto.user;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import task.management.domain.model.user.User;

/** 사용자 응답. 비밀번호 해시는 포함하지 않습니다. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserResponse(
    String id,
    String username,
    String email,
    String firstName,
    String lastName,
    String createdAt,
    String updatedAt) {

  public static UserResponse from(User user) {
    return new UserResponse(
        user.id(),
        user.username(),
        user.email(),
        user.firstName(),
        user.lastName(),
        format(user.createdAt()),
        format(user.updatedAt()));
  }

  static String format(Instant instant) {
    return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
  }
}
