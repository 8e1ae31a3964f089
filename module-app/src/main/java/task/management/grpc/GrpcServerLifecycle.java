package task.management.grpc;

import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import task.management.application.service.CredentialService;
import task.management.config.GrpcServerProperties;

/**
 * gRPC 서버 수명 주기
 *
 * <p>Spring 컨텍스트 기동 시 서버를 시작하고 종료 시 graceful shutdown 합니다. {@code grpc.server.enabled=false}면
 * 등록되지 않습니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(
    prefix = "grpc.server",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class GrpcServerLifecycle implements SmartLifecycle {

  private static final int MAX_MESSAGE_SIZE = 4 * 1024 * 1024;
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final GrpcServerProperties properties;
  private final TaskGrpcService taskGrpcService;
  private final UserGrpcService userGrpcService;
  private final CredentialService credentialService;

  private ScheduledExecutorService deadlineScheduler;
  private Server server;

  public GrpcServerLifecycle(
      GrpcServerProperties properties,
      TaskGrpcService taskGrpcService,
      UserGrpcService userGrpcService,
      CredentialService credentialService) {
    this.properties = properties;
    this.taskGrpcService = taskGrpcService;
    this.userGrpcService = userGrpcService;
    this.credentialService = credentialService;
  }

  @Override
  public synchronized void start() {
    deadlineScheduler = Executors.newSingleThreadScheduledExecutor();
    AuthenticationInterceptor interceptor =
        new AuthenticationInterceptor(
            credentialService, properties.callTimeout(), deadlineScheduler);
    try {
      server =
          NettyServerBuilder.forPort(properties.port())
              .maxInboundMessageSize(MAX_MESSAGE_SIZE)
              .addService(ServerInterceptors.intercept(taskGrpcService, interceptor))
              .addService(ServerInterceptors.intercept(userGrpcService, interceptor))
              .build()
              .start();
    } catch (IOException e) {
      deadlineScheduler.shutdownNow();
      throw new IllegalStateException("gRPC 서버 시작 실패: port=" + properties.port(), e);
    }
    log.info("[gRPC] 서버 시작: port={}", server.getPort());
  }

  @Override
  public synchronized void stop() {
    if (server == null) {
      return;
    }
    log.info("[gRPC] 서버 종료 중");
    server.shutdown();
    try {
      if (!server.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        server.shutdownNow();
      }
    } catch (InterruptedException e) {
      server.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      deadlineScheduler.shutdownNow();
      server = null;
    }
  }

  @Override
  public synchronized boolean isRunning() {
    return server != null && !server.isShutdown();
  }

  /** 실제 바인딩된 포트 (port=0 사용 시) */
  public synchronized int getPort() {
    return server == null ? -1 : server.getPort();
  }
}
