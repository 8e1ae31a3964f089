package task.management.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import task.management.application.dto.RegisterCommand;
import task.management.application.dto.UserUpdateCommand;
import task.management.application.service.AuthService;
import task.management.application.service.CredentialService;
import task.management.application.service.UserDirectoryService;
import task.management.domain.model.auth.ResourceKind;
import task.management.domain.model.auth.TokenClaims;
import task.management.error.exception.auth.InvalidTokenException;
import task.management.grpc.proto.GetUserRequest;
import task.management.grpc.proto.LoginRequest;
import task.management.grpc.proto.LoginResponse;
import task.management.grpc.proto.RefreshTokenRequest;
import task.management.grpc.proto.RegisterRequest;
import task.management.grpc.proto.UpdateUserRequest;
import task.management.grpc.proto.UserResponse;
import task.management.grpc.proto.UserServiceGrpc;
import task.management.grpc.proto.ValidateTokenRequest;
import task.management.grpc.proto.ValidateTokenResponse;

/**
 * gRPC UserService 구현
 *
 * <p>Register, Login, RefreshToken, ValidateToken은 공개 메서드입니다. UpdateUser는 본인만 가능합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserGrpcService extends UserServiceGrpc.UserServiceImplBase {

  private final UserDirectoryService userDirectoryService;
  private final AuthService authService;
  private final CredentialService credentialService;

  @Override
  public void register(RegisterRequest request, StreamObserver<UserResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          RegisterCommand command =
              new RegisterCommand(
                  request.getUsername(),
                  request.getEmail(),
                  request.getPassword(),
                  ProtoMapper.emptyToNull(request.getFirstName()),
                  ProtoMapper.emptyToNull(request.getLastName()));
          return ProtoMapper.toProto(userDirectoryService.register(command));
        });
  }

  @Override
  public void login(LoginRequest request, StreamObserver<LoginResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> ProtoMapper.toProto(authService.login(request.getLogin(), request.getPassword())));
  }

  @Override
  public void refreshToken(RefreshTokenRequest request, StreamObserver<LoginResponse> observer) {
    GrpcErrors.respond(
        observer, () -> ProtoMapper.toProto(authService.refresh(request.getToken())));
  }

  @Override
  public void getUser(GetUserRequest request, StreamObserver<UserResponse> observer) {
    GrpcErrors.respond(
        observer, () -> ProtoMapper.toProto(userDirectoryService.getById(request.getId())));
  }

  /** id가 비어 있으면 호출자 본인 */
  @Override
  public void updateUser(UpdateUserRequest request, StreamObserver<UserResponse> observer) {
    GrpcErrors.respond(
        observer,
        () -> {
          String callerId = GrpcAuthContext.currentUser().userId();
          String targetId = request.getId().isEmpty() ? callerId : request.getId();
          credentialService.authorizeResourceAccess(
              callerId, targetId, ResourceKind.USER.value());

          UserUpdateCommand command =
              new UserUpdateCommand(
                  request.hasEmail() ? request.getEmail() : null,
                  request.hasPassword() ? request.getPassword() : null,
                  request.hasFirstName() ? request.getFirstName() : null,
                  request.hasLastName() ? request.getLastName() : null);
          return ProtoMapper.toProto(userDirectoryService.update(targetId, command));
        });
  }

  /** 무효한 토큰은 오류가 아니라 valid=false 응답 */
  @Override
  public void validateToken(
      ValidateTokenRequest request, StreamObserver<ValidateTokenResponse> observer) {
    if (request.getToken().isEmpty()) {
      observer.onError(
          Status.INVALID_ARGUMENT.withDescription("token is required").asRuntimeException());
      return;
    }
    GrpcErrors.respond(
        observer,
        () -> {
          try {
            TokenClaims claims = credentialService.validateToken(request.getToken());
            return ValidateTokenResponse.newBuilder()
                .setUserId(claims.userId())
                .setUsername(claims.username())
                .setValid(true)
                .build();
          } catch (InvalidTokenException e) {
            log.debug("[gRPC] ValidateToken: invalid token");
            return ValidateTokenResponse.newBuilder().setValid(false).build();
          }
        });
  }
}
