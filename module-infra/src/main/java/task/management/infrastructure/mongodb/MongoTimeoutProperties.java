package task.management.infrastructure.mongodb;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * MongoDB 클라이언트 타임아웃 설정
 *
 * @param timeout 연결/소켓 읽기/서버 선택 타임아웃 (database.mongodb.timeout)
 */
@Validated
@ConfigurationProperties(prefix = "database.mongodb")
public record MongoTimeoutProperties(@NotNull @DefaultValue("10s") Duration timeout) {}
