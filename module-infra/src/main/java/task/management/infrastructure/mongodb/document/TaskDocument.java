package task.management.infrastructure.mongodb.document;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * tasks 컬렉션 문서
 *
 * <p>status는 소문자 문자열("pending", "in_progress", "completed")로 저장합니다. created_by, assigned_to,
 * status, due_date에 보조 인덱스가 있습니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = TaskDocument.COLLECTION)
public class TaskDocument {

  public static final String COLLECTION = "tasks";

  @Id private String id;

  private String title;

  private String description;

  private String status;

  private Integer priority;

  @Field("due_date")
  private Instant dueDate;

  @Field("assigned_to")
  private String assignedTo;

  @Field("created_by")
  private String createdBy;

  @Field("created_at")
  private Instant createdAt;

  @Field("updated_at")
  private Instant updatedAt;
}
