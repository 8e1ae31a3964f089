package task.management.infrastructure.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;
import task.management.core.port.out.PasswordHasher;
import task.management.error.exception.auth.HashingException;
import task.management.infrastructure.executor.LogicExecutor;
import task.management.infrastructure.executor.TaskContext;
import task.management.infrastructure.executor.strategy.ExceptionTranslator;

/** BCrypt(strength 10) 기반 비밀번호 해시 */
@Slf4j
@Component
public class BCryptPasswordHasher implements PasswordHasher {

  static final int STRENGTH = 10;

  private static final TaskContext HASH_CONTEXT = TaskContext.of("BCrypt", "hash");

  private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(STRENGTH);
  private final LogicExecutor executor;

  public BCryptPasswordHasher(LogicExecutor executor) {
    this.executor = executor;
  }

  @Override
  public String hash(String rawPassword) {
    return executor.executeWithTranslation(
        () -> encoder.encode(rawPassword),
        ExceptionTranslator.withErrorGuardAndUnwrap((e, context) -> new HashingException(e)),
        HASH_CONTEXT);
  }

  @Override
  public boolean matches(String rawPassword, String passwordHash) {
    if (rawPassword == null || passwordHash == null || passwordHash.isEmpty()) {
      return false;
    }
    return executor.executeOrDefault(
        () -> encoder.matches(rawPassword, passwordHash),
        Boolean.FALSE,
        TaskContext.of("BCrypt", "matches"));
  }
}
