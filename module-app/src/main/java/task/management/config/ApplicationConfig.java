package task.management.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import task.management.domain.service.ResourceAccessPolicy;
import task.management.infrastructure.security.AuthProperties;

/**
 * 공용 빈 구성
 *
 * <p>Clock은 MongoDB Date 정밀도에 맞춰 밀리초 단위로 진행합니다.
 */
@Configuration
@EnableConfigurationProperties({AuthProperties.class, GrpcServerProperties.class})
public class ApplicationConfig {

  @Bean
  public Clock clock() {
    return Clock.tickMillis(ZoneOffset.UTC);
  }

  @Bean
  public ResourceAccessPolicy resourceAccessPolicy() {
    return new ResourceAccessPolicy();
  }
}
