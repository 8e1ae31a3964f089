package task.management.controller.dto.user;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import task.management.application.dto.UserUpdateCommand;

/** 사용자 부분 수정 요청. 생략한 필드는 변경하지 않습니다. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateUserRequest(String email, String firstName, String lastName, String password) {

  public UserUpdateCommand toCommand() {
    return new UserUpdateCommand(email, password, firstName, lastName);
  }

  @Override
  public String toString() {
    return "UpdateUserRequest[email="
        + email
        + ", firstName="
        + firstName
        + ", lastName="
        + lastName
        + "]";
  }
}
