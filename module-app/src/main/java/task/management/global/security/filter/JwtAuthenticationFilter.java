package task.management.global.security.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import task.management.application.service.CredentialService;
import task.management.domain.model.auth.TokenClaims;
import task.management.error.exception.auth.InvalidTokenException;
import task.management.global.security.AuthenticatedUser;

/**
 * JWT 인증 필터 (OncePerRequestFilter)
 *
 * <ol>
 *   <li>Authorization 헤더에서 Bearer 토큰 추출
 *   <li>서명/알고리즘/만료 검증
 *   <li>SecurityContext에 {@link AuthenticatedUser} 저장
 * </ol>
 *
 * <p>토큰이 없거나 무효하면 인증 없이 다음 필터로 넘기며, 보호된 경로는 인증 진입점이 401을 응답합니다.
 *
 * <p>@Component 대신 SecurityConfig에서 @Bean으로 등록하고 FilterRegistrationBean으로 서블릿 컨테이너 중복 등록을 막습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private static final String AUTHORIZATION_HEADER = "Authorization";
  private static final String BEARER_PREFIX = "Bearer ";

  private final CredentialService credentialService;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String token = extractToken(request);

    if (StringUtils.hasText(token)) {
      authenticateWithToken(token);
    }

    filterChain.doFilter(request, response);
  }

  private String extractToken(HttpServletRequest request) {
    String bearerToken = request.getHeader(AUTHORIZATION_HEADER);
    if (StringUtils.hasText(bearerToken) && bearerToken.startsWith(BEARER_PREFIX)) {
      return bearerToken.substring(BEARER_PREFIX.length()).trim();
    }
    return null;
  }

  private void authenticateWithToken(String token) {
    try {
      setSecurityContext(credentialService.validateToken(token));
    } catch (InvalidTokenException e) {
      log.debug("JWT rejected: {}", e.getMessage());
    }
  }

  private void setSecurityContext(TokenClaims claims) {
    AuthenticatedUser principal = new AuthenticatedUser(claims.userId(), claims.username());
    UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            principal, null, List.of(new SimpleGrantedAuthority("ROLE_USER")));

    SecurityContext context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(authentication);
    SecurityContextHolder.setContext(context);

    log.debug("User authenticated: userId={}", claims.userId());
  }
}
