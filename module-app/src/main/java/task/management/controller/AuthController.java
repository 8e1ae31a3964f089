package task.management.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import task.management.application.service.AuthService;
import task.management.application.service.UserDirectoryService;
import task.management.controller.dto.auth.LoginRequest;
import task.management.controller.dto.auth.RefreshTokenRequest;
import task.management.controller.dto.auth.RegisterRequest;
import task.management.controller.dto.auth.TokenResponse;
import task.management.controller.dto.user.UserResponse;
import task.management.global.response.ApiResponse;

/**
 * 인증 API 컨트롤러 (인증 불필요)
 *
 * <ul>
 *   <li>POST /api/v1/auth/register - 회원 가입 (201)
 *   <li>POST /api/v1/auth/login - 로그인 (이메일 또는 사용자명)
 *   <li>POST /api/v1/auth/refresh-token - 토큰 갱신
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

  private final UserDirectoryService userDirectoryService;
  private final AuthService authService;

  @PostMapping("/register")
  public ResponseEntity<ApiResponse<UserResponse>> register(
      @Valid @RequestBody RegisterRequest request) {
    UserResponse response = UserResponse.from(userDirectoryService.register(request.toCommand()));
    return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
  }

  @PostMapping("/login")
  public ResponseEntity<ApiResponse<TokenResponse>> login(
      @Valid @RequestBody LoginRequest request) {
    TokenResponse response =
        TokenResponse.from(authService.login(request.login(), request.password()));
    return ResponseEntity.ok(ApiResponse.success(response));
  }

  @PostMapping("/refresh-token")
  public ResponseEntity<ApiResponse<TokenResponse>> refresh(
      @Valid @RequestBody RefreshTokenRequest request) {
    TokenResponse response = TokenResponse.from(authService.refresh(request.token()));
    return ResponseEntity.ok(ApiResponse.success(response));
  }
}
