package task.management.controller.dto.auth;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import task.management.application.dto.RegisterCommand;

/** 회원 가입 요청. 세부 규칙(길이, 이메일 형식)은 서비스가 검증합니다. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisterRequest(
    @NotBlank String username,
    @NotBlank String email,
    @NotBlank String password,
    String firstName,
    String lastName) {

  public RegisterCommand toCommand() {
    return new RegisterCommand(username, email, password, firstName, lastName);
  }

  @Override
  public String toString() {
    return "RegisterRequest[username=" + username + ", email=" + email + ", password=****]";
  }
}
