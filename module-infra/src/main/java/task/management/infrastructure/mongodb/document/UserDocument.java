package task.management.infrastructure.mongodb.document;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * users 컬렉션 문서
 *
 * <p>username/email 유니크 인덱스는 {@link task.management.infrastructure.mongodb.MongoIndexConfig}가
 * 생성합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = UserDocument.COLLECTION)
public class UserDocument {

  public static final String COLLECTION = "users";

  @Id private String id;

  private String username;

  private String email;

  @ToString.Exclude
  @Field("password_hash")
  private String passwordHash;

  @Field("first_name")
  private String firstName;

  @Field("last_name")
  private String lastName;

  @Field("created_at")
  private Instant createdAt;

  @Field("updated_at")
  private Instant updatedAt;
}
