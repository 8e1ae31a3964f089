package task.management.controller.dto.auth;

import jakarta.validation.constraints.NotBlank;

/**
 * 로그인 요청
 *
 * @param login 이메일 또는 사용자명
 * @param password 비밀번호
 */
public record LoginRequest(@NotBlank String login, @NotBlank String password) {

  @Override
  public String toString() {
    return "LoginRequest[login=" + login + ", password=****]";
  }
}
