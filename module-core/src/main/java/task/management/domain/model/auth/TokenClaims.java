package task.management.domain.model.auth;

import java.time.Instant;

/**
 * 검증된 토큰의 클레임
 *
 * @param userId 사용자 ID
 * @param username 발급 시점의 사용자명
 * @param issuedAt 발급 시각
 * @param expiresAt 만료 시각
 */
public record TokenClaims(String userId, String username, Instant issuedAt, Instant expiresAt) {}
