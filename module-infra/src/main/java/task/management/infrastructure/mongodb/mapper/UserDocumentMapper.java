package task.management.infrastructure.mongodb.mapper;

import task.management.domain.model.user.User;
import task.management.infrastructure.mongodb.document.UserDocument;

/** UserDocument ↔ User 변환 (stateless) */
public final class UserDocumentMapper {

  private UserDocumentMapper() {}

  public static User toDomain(UserDocument document) {
    if (document == null) {
      throw new IllegalArgumentException("UserDocument cannot be null");
    }
    return new User(
        document.getId(),
        document.getUsername(),
        document.getEmail(),
        document.getPasswordHash(),
        document.getFirstName(),
        document.getLastName(),
        document.getCreatedAt(),
        document.getUpdatedAt());
  }

  public static UserDocument toDocument(User user) {
    if (user == null) {
      throw new IllegalArgumentException("User cannot be null");
    }
    return UserDocument.builder()
        .id(user.id())
        .username(user.username())
        .email(user.email())
        .passwordHash(user.passwordHash())
        .firstName(user.firstName())
        .lastName(user.lastName())
        .createdAt(user.createdAt())
        .updatedAt(user.updatedAt())
        .build();
  }
}
