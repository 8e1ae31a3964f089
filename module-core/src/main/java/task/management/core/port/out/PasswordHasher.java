package task.management.core.port.out;

/** 단방향 비밀번호 해시 Port */
public interface PasswordHasher {

  /**
   * @throws task.management.error.exception.auth.HashingException 내부 해시/난수 생성 실패
   */
  String hash(String rawPassword);

  /** 불일치나 손상된 해시에도 예외 없이 false를 반환합니다. */
  boolean matches(String rawPassword, String passwordHash);
}
