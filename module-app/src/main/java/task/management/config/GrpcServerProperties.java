package task.management.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * gRPC 서버 설정
 *
 * <pre>
 * grpc:
 *   server:
 *     enabled: true
 *     port: 50051
 *     call-timeout: 30s
 * </pre>
 *
 * @param enabled false면 서버를 띄우지 않음 (테스트 등)
 * @param port 리슨 포트
 * @param callTimeout 서버 측 호출 데드라인
 */
@Validated
@ConfigurationProperties(prefix = "grpc.server")
public record GrpcServerProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("50051") @Min(0) @Max(65535) int port,
    @NotNull @DefaultValue("30s") Duration callTimeout) {}
