package task.management.controller.dto.auth;

import jakarta.validation.constraints.NotBlank;

public record RefreshTokenRequest(@NotBlank String token) {

  @Override
  public String toString() {
    return "RefreshTokenRequest[token=****]";
  }
}
