package task.management.application.service;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import task.management.application.dto.RegisterCommand;
import task.management.application.dto.UserUpdateCommand;
import task.management.core.port.out.UserRepositoryPort;
import task.management.domain.model.user.User;
import task.management.domain.model.user.UserRules;
import task.management.error.exception.InvalidInputException;
import task.management.error.exception.auth.InvalidCredentialsException;
import task.management.error.exception.user.DuplicateEmailException;
import task.management.error.exception.user.DuplicateUsernameException;
import task.management.error.exception.user.UserNotFoundException;

/**
 * 사용자 가입, 조회, 수정, 삭제, 자격 증명 확인
 *
 * <p>중복 검사는 빠른 경로일 뿐이며, 동시 가입 경합의 최종 판정은 저장소의 유니크 인덱스가 합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

  private final UserRepositoryPort userRepository;
  private final CredentialService credentialService;
  private final Clock clock;

  /**
   * @throws InvalidInputException username/email/password 규칙 위반
   * @throws DuplicateEmailException 이미 등록된 이메일
   * @throws DuplicateUsernameException 이미 사용 중인 사용자명
   */
  public User register(RegisterCommand command) {
    UserRules.requireValidUsername(command.username());
    UserRules.requireValidEmail(command.email());
    UserRules.requireValidPassword(command.password());

    if (userRepository.findByEmail(command.email()).isPresent()) {
      throw new DuplicateEmailException(command.email());
    }
    if (userRepository.findByUsername(command.username()).isPresent()) {
      throw new DuplicateUsernameException(command.username());
    }

    User user =
        User.register(
            command.username(),
            command.email(),
            credentialService.hashPassword(command.password()),
            command.firstName(),
            command.lastName(),
            clock.instant());
    User saved = userRepository.create(user);
    log.info("[User] 가입 완료: id={}, username={}", saved.id(), saved.username());
    return saved;
  }

  public User getById(String id) {
    return userRepository.findById(id).orElseThrow(() -> new UserNotFoundException("ID: " + id));
  }

  public User getByEmail(String email) {
    UserRules.requireValidEmail(email);
    return userRepository
        .findByEmail(email)
        .orElseThrow(() -> new UserNotFoundException("email: " + email));
  }

  public User getByUsername(String username) {
    UserRules.requireValidUsername(username);
    return userRepository
        .findByUsername(username)
        .orElseThrow(() -> new UserNotFoundException("username: " + username));
  }

  /**
   * 부분 수정. 이메일은 본인을 제외하고 중복 검사합니다.
   *
   * @throws UserNotFoundException 대상 사용자 없음
   * @throws InvalidInputException 이메일 형식/비밀번호 규칙 위반
   * @throws DuplicateEmailException 다른 사용자가 사용 중인 이메일
   */
  public User update(String userId, UserUpdateCommand command) {
    User current = getById(userId);

    String newEmail = command.email();
    if (newEmail != null && !newEmail.equals(current.email())) {
      UserRules.requireValidEmail(newEmail);
      userRepository
          .findByEmail(newEmail)
          .filter(other -> !other.id().equals(userId))
          .ifPresent(
              other -> {
                throw new DuplicateEmailException(newEmail);
              });
    }

    String newHash = null;
    if (command.password() != null) {
      UserRules.requireValidPassword(command.password());
      newHash = credentialService.hashPassword(command.password());
    }

    User updated =
        current.withChanges(
            newEmail, command.firstName(), command.lastName(), newHash, clock.instant());
    return userRepository.update(updated);
  }

  public void delete(String userId) {
    userRepository.deleteById(userId);
    log.info("[User] 삭제 완료: id={}", userId);
  }

  /**
   * 이메일 형식이면 이메일로, 아니면 사용자명으로 조회합니다. 사용자 없음과 비밀번호 불일치는 같은 예외입니다.
   *
   * @throws InvalidCredentialsException 자격 증명 불일치
   */
  public User validateCredentials(String login, String password) {
    if (login == null || password == null) {
      throw new InvalidCredentialsException();
    }
    User user =
        (UserRules.isEmail(login)
                ? userRepository.findByEmail(login)
                : userRepository.findByUsername(login))
            .orElseThrow(InvalidCredentialsException::new);

    if (!credentialService.verifyPassword(user.passwordHash(), password)) {
      log.debug("[User] 비밀번호 불일치: id={}", user.id());
      throw new InvalidCredentialsException();
    }
    return user;
  }
}
