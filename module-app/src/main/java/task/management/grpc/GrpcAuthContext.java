package task.management.grpc;

import io.grpc.Context;
import io.grpc.Status;
import task.management.global.security.AuthenticatedUser;

/** gRPC 호출 Context에 실린 인증 사용자 ({@link AuthenticationInterceptor}가 설정) */
public final class GrpcAuthContext {

  static final Context.Key<AuthenticatedUser> USER = Context.key("authenticated-user");

  private GrpcAuthContext() {}

  /**
   * @throws io.grpc.StatusRuntimeException 인증되지 않은 호출 (UNAUTHENTICATED)
   */
  public static AuthenticatedUser currentUser() {
    AuthenticatedUser user = USER.get();
    if (user == null) {
      throw Status.UNAUTHENTICATED.withDescription("authentication required").asRuntimeException();
    }
    return user;
  }
}
