package task.management.infrastructure.mongodb.adapter;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import task.management.core.port.out.UserRepositoryPort;
import task.management.domain.model.user.User;
import task.management.error.exception.InternalSystemException;
import task.management.error.exception.user.DuplicateEmailException;
import task.management.error.exception.user.DuplicateUsernameException;
import task.management.error.exception.user.UserNotFoundException;
import task.management.infrastructure.executor.LogicExecutor;
import task.management.infrastructure.executor.TaskContext;
import task.management.infrastructure.executor.function.ThrowingSupplier;
import task.management.infrastructure.executor.strategy.ExceptionTranslator;
import task.management.infrastructure.mongodb.MongoIndexConfig;
import task.management.infrastructure.mongodb.document.UserDocument;
import task.management.infrastructure.mongodb.mapper.UserDocumentMapper;
import task.management.infrastructure.mongodb.repository.UserMongoRepository;

/**
 * MongoDB 기반 {@link UserRepositoryPort} 구현
 *
 * <p>유니크 인덱스 위반은 인덱스 이름으로 구분해 DuplicateUsername/DuplicateEmail로 정규화합니다. 수정은 ID 기준
 * findAndReplace 한 번으로 수행하므로 동시에 삭제된 문서를 되살리지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoUserRepositoryAdapter implements UserRepositoryPort {

  private static final String COMPONENT = "UserStore";

  private final UserMongoRepository repository;
  private final MongoTemplate mongoTemplate;
  private final LogicExecutor executor;

  @Override
  public Optional<User> findById(String id) {
    return read(() -> repository.findById(id), "findById", id);
  }

  @Override
  public Optional<User> findByEmail(String email) {
    return read(() -> repository.findByEmail(email), "findByEmail", email);
  }

  @Override
  public Optional<User> findByUsername(String username) {
    return read(() -> repository.findByUsername(username), "findByUsername", username);
  }

  @Override
  public User create(User user) {
    UserDocument saved =
        executor.executeWithTranslation(
            () -> repository.insert(UserDocumentMapper.toDocument(user)),
            duplicateTranslator(user),
            TaskContext.of(COMPONENT, "create", user.username()));
    log.info("[UserStore] 사용자 생성: id={}, username={}", saved.getId(), saved.getUsername());
    return UserDocumentMapper.toDomain(saved);
  }

  @Override
  public User update(User user) {
    UserDocument replaced =
        executor.executeWithTranslation(
            () ->
                mongoTemplate.findAndReplace(
                    byId(user.id()),
                    UserDocumentMapper.toDocument(user),
                    FindAndReplaceOptions.options().returnNew()),
            duplicateTranslator(user),
            TaskContext.of(COMPONENT, "update", user.id()));
    if (replaced == null) {
      throw new UserNotFoundException("ID: " + user.id());
    }
    return UserDocumentMapper.toDomain(replaced);
  }

  @Override
  public void deleteById(String id) {
    long deleted =
        executor.executeWithTranslation(
            () -> mongoTemplate.remove(byId(id), UserDocument.class).getDeletedCount(),
            ExceptionTranslator.forPersistence(),
            TaskContext.of(COMPONENT, "delete", id));
    if (deleted == 0) {
      throw new UserNotFoundException("ID: " + id);
    }
  }

  private Optional<User> read(
      ThrowingSupplier<Optional<UserDocument>> query, String operation, String key) {
    return executor
        .executeWithTranslation(
            query, ExceptionTranslator.forPersistence(), TaskContext.of(COMPONENT, operation, key))
        .map(UserDocumentMapper::toDomain);
  }

  private static Query byId(String id) {
    return Query.query(Criteria.where("_id").is(id));
  }

  private static ExceptionTranslator duplicateTranslator(User user) {
    return ExceptionTranslator.forPersistence(e -> toDuplicateException(e, user));
  }

  static RuntimeException toDuplicateException(DuplicateKeyException e, User user) {
    String message = String.valueOf(e.getMessage());
    if (message.contains(MongoIndexConfig.USERS_USERNAME_INDEX)) {
      return new DuplicateUsernameException(user.username());
    }
    if (message.contains(MongoIndexConfig.USERS_EMAIL_INDEX)) {
      return new DuplicateEmailException(user.email());
    }
    return new InternalSystemException(COMPONENT + ":duplicate-key", e);
  }
}
