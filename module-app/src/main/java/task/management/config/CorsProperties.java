package task.management.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * CORS 설정 프로퍼티 (환경별 분리)
 *
 * <ul>
 *   <li>와일드카드(*) 대신 명시적 오리진 목록
 *   <li>빈 리스트 시 앱 시작 실패
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cors")
public class CorsProperties {

  @NotEmpty(message = "CORS 허용 오리진 목록은 필수입니다. cors.allowed-origins 설정을 확인하세요.")
  private List<String> allowedOrigins;

  @NotNull private Boolean allowCredentials = true;

  /** preflight 캐시 시간 (초) */
  @NotNull
  @Min(0)
  private Long maxAge = 3600L;
}
