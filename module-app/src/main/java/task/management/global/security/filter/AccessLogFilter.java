package task.management.global.security.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

/** 요청 접근 로그 (메서드, 경로, 상태 코드, 처리 시간) */
@Slf4j
public class AccessLogFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    long start = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } finally {
      long elapsedMs = (System.nanoTime() - start) / 1_000_000;
      log.info(
          "[HTTP] {} {} {} {}ms",
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          elapsedMs);
    }
  }
}
