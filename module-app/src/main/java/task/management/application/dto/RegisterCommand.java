package task.management.application.dto;

/**
 * 회원 가입 입력
 *
 * @param firstName 선택
 * @param lastName 선택
 */
public record RegisterCommand(
    String username, String email, String password, String firstName, String lastName) {

  @Override
  public String toString() {
    return "RegisterCommand[username=" + username + ", email=" + email + ", password=****]";
  }
}
