package task.management.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import task.management.application.service.CredentialService;
import task.management.domain.model.auth.TokenClaims;
import task.management.error.exception.auth.InvalidTokenException;
import task.management.global.security.AuthenticatedUser;
import task.management.grpc.proto.UserServiceGrpc;

/**
 * gRPC 인증 + 데드라인 인터셉터
 *
 * <p>{@code authorization} 메타데이터에서 {@code Bearer <token>} 또는 토큰 문자열을 읽어 검증하고, 성공 시
 * {@link GrpcAuthContext}에 사용자를 싣습니다. 공개 메서드(Register, Login, RefreshToken, ValidateToken)는 토큰
 * 없이 통과합니다.
 *
 * <p>모든 호출에 서버 측 데드라인({@code grpc.server.call-timeout})이 걸린 Context가 적용됩니다.
 */
@Slf4j
public class AuthenticationInterceptor implements ServerInterceptor {

  static final Metadata.Key<String> AUTHORIZATION =
      Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

  private static final String BEARER_PREFIX = "Bearer ";

  private static final Set<String> PUBLIC_METHODS =
      Set.of(
          UserServiceGrpc.getRegisterMethod().getFullMethodName(),
          UserServiceGrpc.getLoginMethod().getFullMethodName(),
          UserServiceGrpc.getRefreshTokenMethod().getFullMethodName(),
          UserServiceGrpc.getValidateTokenMethod().getFullMethodName());

  private final CredentialService credentialService;
  private final Duration callTimeout;
  private final ScheduledExecutorService deadlineScheduler;

  public AuthenticationInterceptor(
      CredentialService credentialService,
      Duration callTimeout,
      ScheduledExecutorService deadlineScheduler) {
    this.credentialService = credentialService;
    this.callTimeout = callTimeout;
    this.deadlineScheduler = deadlineScheduler;
  }

  @Override
  public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
      ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
    String method = call.getMethodDescriptor().getFullMethodName();
    Context context = Context.current();

    if (!PUBLIC_METHODS.contains(method)) {
      String token = extractToken(headers.get(AUTHORIZATION));
      if (token == null) {
        return reject(call, "authorization token is not provided");
      }
      try {
        TokenClaims claims = credentialService.validateToken(token);
        context =
            context.withValue(
                GrpcAuthContext.USER, new AuthenticatedUser(claims.userId(), claims.username()));
      } catch (InvalidTokenException e) {
        log.debug("[gRPC] 토큰 검증 실패: method={}", method);
        return reject(call, "invalid token");
      }
    }

    Context.CancellableContext deadlineContext =
        context.withDeadlineAfter(
            callTimeout.toMillis(), TimeUnit.MILLISECONDS, deadlineScheduler);
    ServerCall.Listener<ReqT> delegate =
        Contexts.interceptCall(deadlineContext, call, headers, next);
    return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
      @Override
      public void onComplete() {
        try {
          super.onComplete();
        } finally {
          deadlineContext.cancel(null);
        }
      }

      @Override
      public void onCancel() {
        try {
          super.onCancel();
        } finally {
          deadlineContext.cancel(null);
        }
      }
    };
  }

  /** "Bearer " 접두사가 없으면 값 전체를 토큰으로 봅니다. */
  static String extractToken(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    String token = header;
    if (header.startsWith(BEARER_PREFIX)) {
      token = header.substring(BEARER_PREFIX.length());
    }
    token = token.trim();
    return token.isEmpty() ? null : token;
  }

  private static <ReqT, RespT> ServerCall.Listener<ReqT> reject(
      ServerCall<ReqT, RespT> call, String description) {
    call.close(Status.UNAUTHENTICATED.withDescription(description), new Metadata());
    return new ServerCall.Listener<>() {};
  }
}
