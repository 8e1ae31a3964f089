package task.management.infrastructure.mongodb;

import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** MongoClient 타임아웃 적용. 저장소 장애는 재시도 없이 이 시간 안에 실패로 전파됩니다. */
@Slf4j
@Configuration
@EnableConfigurationProperties(MongoTimeoutProperties.class)
public class MongoClientConfig {

  @Bean
  public MongoClientSettingsBuilderCustomizer mongoTimeoutCustomizer(
      MongoTimeoutProperties properties) {
    int timeoutMs = Math.toIntExact(properties.timeout().toMillis());
    log.info("[MongoDB] client timeout = {}ms", timeoutMs);
    return builder ->
        builder
            .applyToSocketSettings(
                socket ->
                    socket
                        .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout(timeoutMs, TimeUnit.MILLISECONDS))
            .applyToClusterSettings(
                cluster -> cluster.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS));
  }
}
