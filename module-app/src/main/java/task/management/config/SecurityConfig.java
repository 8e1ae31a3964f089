package task.management.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import task.management.application.service.CredentialService;
import task.management.global.security.SecurityErrorResponder;
import task.management.global.security.filter.AccessLogFilter;
import task.management.global.security.filter.JwtAuthenticationFilter;

/**
 * Spring Security 설정 (6.x Lambda DSL)
 *
 * <ul>
 *   <li>STATELESS 세션 정책 (JWT 사용)
 *   <li>CSRF 비활성화 (REST API)
 *   <li>공개 경로: 가입, 로그인, 토큰 갱신, 헬스 체크
 *   <li>인증 실패/권한 없음은 JSON 응답
 * </ul>
 *
 * <p>Filter는 @Component 대신 @Bean으로 등록하고 FilterRegistrationBean으로 서블릿 컨테이너 중복 등록을 막습니다.
 */
@Slf4j
@Configuration
@EnableWebSecurity
@EnableConfigurationProperties(CorsProperties.class)
@RequiredArgsConstructor
public class SecurityConfig {

  private final CorsProperties corsProperties;

  @Bean
  public JwtAuthenticationFilter jwtAuthenticationFilter(CredentialService credentialService) {
    return new JwtAuthenticationFilter(credentialService);
  }

  @Bean
  public FilterRegistrationBean<JwtAuthenticationFilter> jwtFilterRegistration(
      JwtAuthenticationFilter filter) {
    FilterRegistrationBean<JwtAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public AccessLogFilter accessLogFilter() {
    return new AccessLogFilter();
  }

  @Bean
  public FilterRegistrationBean<AccessLogFilter> accessLogFilterRegistration(
      AccessLogFilter filter) {
    FilterRegistrationBean<AccessLogFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public SecurityErrorResponder securityErrorResponder(ObjectMapper objectMapper, Clock clock) {
    return new SecurityErrorResponder(objectMapper, clock);
  }

  @Bean
  public SecurityFilterChain filterChain(
      HttpSecurity http,
      JwtAuthenticationFilter jwtAuthenticationFilter,
      AccessLogFilter accessLogFilter,
      SecurityErrorResponder errorResponder)
      throws Exception {
    http.csrf(AbstractHttpConfigurer::disable)
        .cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(
            headers ->
                headers
                    .frameOptions(HeadersConfigurer.FrameOptionsConfig::deny)
                    .contentTypeOptions(Customizer.withDefaults()))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        HttpMethod.POST,
                        "/api/v1/auth/register",
                        "/api/v1/auth/login",
                        "/api/v1/auth/refresh-token")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/api/v1/health", "/actuator/health")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .addFilterBefore(jwtAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterBefore(accessLogFilter, SecurityContextHolderFilter.class)
        .exceptionHandling(
            ex ->
                ex.authenticationEntryPoint(errorResponder.entryPoint())
                    .accessDeniedHandler(errorResponder.accessDeniedHandler()));

    return http.build();
  }

  @Bean
  public CorsConfigurationSource corsConfigurationSource() {
    log.info(
        "[CORS-Config] Allowed origins: {}, AllowCredentials: {}, MaxAge: {}s",
        corsProperties.getAllowedOrigins(),
        corsProperties.getAllowCredentials(),
        corsProperties.getMaxAge());

    CorsConfiguration configuration = new CorsConfiguration();
    configuration.setAllowedOrigins(corsProperties.getAllowedOrigins());
    configuration.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    configuration.setAllowedHeaders(Arrays.asList("Authorization", "Content-Type", "Accept"));
    configuration.setAllowCredentials(corsProperties.getAllowCredentials());
    configuration.setMaxAge(corsProperties.getMaxAge());

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", configuration);
    return source;
  }
}
