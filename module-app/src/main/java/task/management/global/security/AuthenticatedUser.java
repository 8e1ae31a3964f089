package task.management.global.security;

/**
 * 인증된 사용자 정보
 *
 * <p>SecurityContext의 principal로 저장되어 컨트롤러에서 {@code @AuthenticationPrincipal}로 주입됩니다. gRPC에서는
 * {@link task.management.grpc.GrpcAuthContext}로 전달됩니다.
 *
 * @param userId 토큰의 사용자 ID
 * @param username 발급 시점의 사용자명
 */
public record AuthenticatedUser(String userId, String username) {

  public boolean isSelf(String otherUserId) {
    return userId.equals(otherUserId);
  }
}
