package task.management.application.dto;

/**
 * 사용자 부분 수정 입력. null 필드는 "변경 없음"입니다.
 *
 * @param email 새 이메일 (형식/중복 재검증)
 * @param password 새 비밀번호 (재해시)
 * @param firstName 빈 문자열이면 비움
 * @param lastName 빈 문자열이면 비움
 */
public record UserUpdateCommand(String email, String password, String firstName, String lastName) {

  public static UserUpdateCommand empty() {
    return new UserUpdateCommand(null, null, null, null);
  }

  @Override
  public String toString() {
    return "UserUpdateCommand[email="
        + email
        + ", password="
        + (password == null ? "null" : "****")
        + ", firstName="
        + firstName
        + ", lastName="
        + lastName
        + "]";
  }
}
