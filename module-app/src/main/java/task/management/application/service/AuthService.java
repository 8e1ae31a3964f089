package task.management.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import task.management.application.dto.LoginResult;
import task.management.domain.model.user.User;

/** 로그인/토큰 갱신 Facade */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

  private final UserDirectoryService userDirectoryService;
  private final CredentialService credentialService;

  /**
   * @param login 이메일 또는 사용자명
   * @throws task.management.error.exception.auth.InvalidCredentialsException 자격 증명 불일치
   */
  public LoginResult login(String login, String password) {
    User user = userDirectoryService.validateCredentials(login, password);
    LoginResult result = LoginResult.of(credentialService.issueToken(user), user);
    log.info("[Auth] 로그인 성공: userId={}", user.id());
    return result;
  }

  /**
   * @throws task.management.error.exception.auth.InvalidTokenException 기존 토큰이 무효
   * @throws task.management.error.exception.user.UserNotFoundException 사용자가 삭제됨
   */
  public LoginResult refresh(String token) {
    User user = credentialService.resolveUser(token);
    return LoginResult.of(credentialService.issueToken(user), user);
  }
}
