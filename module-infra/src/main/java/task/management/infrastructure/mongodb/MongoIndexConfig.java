package task.management.infrastructure.mongodb;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import task.management.infrastructure.mongodb.document.TaskDocument;
import task.management.infrastructure.mongodb.document.UserDocument;

/**
 * MongoDB 저장소 활성화 및 인덱스 보장
 *
 * <h3>인덱스</h3>
 *
 * <ul>
 *   <li>users: username, email (unique) - 중복 가입의 최종 판정 기준
 *   <li>tasks: created_by, assigned_to, status, due_date
 * </ul>
 *
 * <p>유니크 인덱스 이름은 중복 키 오류 메시지에서 어떤 필드가 충돌했는지 판별하는 데 사용됩니다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableMongoRepositories(basePackages = "task.management.infrastructure.mongodb.repository")
public class MongoIndexConfig {

  public static final String USERS_USERNAME_INDEX = "uk_users_username";
  public static final String USERS_EMAIL_INDEX = "uk_users_email";

  private final MongoTemplate mongoTemplate;

  @PostConstruct
  public void ensureIndexes() {
    try {
      IndexOperations users = mongoTemplate.indexOps(UserDocument.class);
      users.ensureIndex(
          new Index().on("username", Sort.Direction.ASC).unique().named(USERS_USERNAME_INDEX));
      users.ensureIndex(
          new Index().on("email", Sort.Direction.ASC).unique().named(USERS_EMAIL_INDEX));

      IndexOperations tasks = mongoTemplate.indexOps(TaskDocument.class);
      tasks.ensureIndex(new Index().on("created_by", Sort.Direction.ASC).named("idx_tasks_created_by"));
      tasks.ensureIndex(
          new Index().on("assigned_to", Sort.Direction.ASC).named("idx_tasks_assigned_to"));
      tasks.ensureIndex(new Index().on("status", Sort.Direction.ASC).named("idx_tasks_status"));
      tasks.ensureIndex(new Index().on("due_date", Sort.Direction.ASC).named("idx_tasks_due_date"));

      log.info("[MongoDB] 인덱스 확인 완료: {}, {}", UserDocument.COLLECTION, TaskDocument.COLLECTION);
    } catch (Exception e) {
      log.error("[MongoDB] 인덱스 생성 실패", e);
      throw new IllegalStateException("Failed to create MongoDB indexes", e);
    }
  }
}
