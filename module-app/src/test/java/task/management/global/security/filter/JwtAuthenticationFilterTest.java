package task.management.global.security.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import task.management.application.service.CredentialService;
import task.management.domain.model.auth.TokenClaims;
import task.management.error.exception.auth.InvalidTokenException;
import task.management.global.security.AuthenticatedUser;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("JwtAuthenticationFilter 테스트")
class JwtAuthenticationFilterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Mock private CredentialService credentialService;

  private JwtAuthenticationFilter filter;
  private MockHttpServletRequest request;
  private MockFilterChain chain;

  @BeforeEach
  void setUp() {
    filter = new JwtAuthenticationFilter(credentialService);
    request = new MockHttpServletRequest("GET", "/api/v1/me");
    chain = new MockFilterChain();
    SecurityContextHolder.clearContext();
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  @Test
  @DisplayName("유효한 Bearer 토큰이면 AuthenticatedUser가 principal로 설정된다")
  void validToken_authenticates() throws Exception {
    // given
    request.addHeader("Authorization", "Bearer good-token");
    given(credentialService.validateToken("good-token"))
        .willReturn(new TokenClaims("u1", "alice", NOW, NOW.plusSeconds(60)));

    // when
    filter.doFilter(request, new MockHttpServletResponse(), chain);

    // then
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication).isNotNull();
    assertThat(authentication.getPrincipal()).isEqualTo(new AuthenticatedUser("u1", "alice"));
    assertThat(chain.getRequest()).isSameAs(request);
  }

  @Test
  @DisplayName("무효한 토큰은 인증 없이 다음 필터로 진행")
  void invalidToken_continuesUnauthenticated() throws Exception {
    request.addHeader("Authorization", "Bearer bad-token");
    given(credentialService.validateToken("bad-token")).willThrow(new InvalidTokenException());

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(chain.getRequest()).isSameAs(request);
  }

  @Test
  @DisplayName("Bearer 접두사가 없으면 검증하지 않는다")
  void missingPrefix_skipsValidation() throws Exception {
    request.addHeader("Authorization", "raw-token");

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    then(credentialService).should(never()).validateToken(ArgumentMatchers.anyString());
    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
  }
}
