package task.management.infrastructure.mongodb.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import task.management.core.port.out.TaskFilter;
import task.management.core.port.out.TaskRepositoryPort;
import task.management.domain.model.task.Task;
import task.management.domain.model.task.TaskStatus;
import task.management.error.exception.task.TaskNotFoundException;
import task.management.infrastructure.executor.LogicExecutor;
import task.management.infrastructure.executor.TaskContext;
import task.management.infrastructure.executor.function.ThrowingSupplier;
import task.management.infrastructure.executor.strategy.ExceptionTranslator;
import task.management.infrastructure.mongodb.document.TaskDocument;
import task.management.infrastructure.mongodb.mapper.TaskDocumentMapper;
import task.management.infrastructure.mongodb.repository.TaskMongoRepository;

/**
 * MongoDB 기반 {@link TaskRepositoryPort} 구현
 *
 * <p>모든 목록은 dueDate 오름차순(누락 값 먼저), 같은 dueDate는 _id 순입니다.
 */
@Component
@RequiredArgsConstructor
public class MongoTaskRepositoryAdapter implements TaskRepositoryPort {

  private static final String COMPONENT = "TaskStore";

  static final Sort DUE_DATE_ASC = Sort.by(Sort.Order.asc("dueDate"), Sort.Order.asc("id"));

  private final TaskMongoRepository repository;
  private final MongoTemplate mongoTemplate;
  private final LogicExecutor executor;

  @Override
  public Optional<Task> findById(String id) {
    return persist(() -> repository.findById(id), "findById", id).map(TaskDocumentMapper::toDomain);
  }

  @Override
  public List<Task> findAll(TaskFilter filter) {
    Query query = new Query().with(DUE_DATE_ASC);
    toCriteria(filter).forEach(query::addCriteria);
    return toDomain(persist(() -> mongoTemplate.find(query, TaskDocument.class), "findAll", ""));
  }

  @Override
  public List<Task> findByUser(String userId) {
    return toDomain(
        persist(
            () -> repository.findByCreatedByOrAssignedTo(userId, userId, DUE_DATE_ASC),
            "findByUser",
            userId));
  }

  @Override
  public List<Task> findByStatus(TaskStatus status) {
    return toDomain(
        persist(
            () -> repository.findByStatus(status.value(), DUE_DATE_ASC),
            "findByStatus",
            status.value()));
  }

  @Override
  public Task create(Task task) {
    TaskDocument saved =
        persist(() -> repository.insert(TaskDocumentMapper.toDocument(task)), "create", "");
    return TaskDocumentMapper.toDomain(saved);
  }

  @Override
  public Task update(Task task) {
    TaskDocument replaced =
        persist(
            () ->
                mongoTemplate.findAndReplace(
                    byId(task.id()),
                    TaskDocumentMapper.toDocument(task),
                    FindAndReplaceOptions.options().returnNew()),
            "update",
            task.id());
    if (replaced == null) {
      throw new TaskNotFoundException(task.id());
    }
    return TaskDocumentMapper.toDomain(replaced);
  }

  @Override
  public void deleteById(String id) {
    long deleted =
        persist(
            () -> mongoTemplate.remove(byId(id), TaskDocument.class).getDeletedCount(),
            "delete",
            id);
    if (deleted == 0) {
      throw new TaskNotFoundException(id);
    }
  }

  private <T> T persist(ThrowingSupplier<T> action, String operation, String key) {
    return executor.executeWithTranslation(
        action, ExceptionTranslator.forPersistence(), TaskContext.of(COMPONENT, operation, key));
  }

  private static List<Criteria> toCriteria(TaskFilter filter) {
    List<Criteria> criteria = new ArrayList<>();
    if (filter.status() != null) {
      criteria.add(Criteria.where("status").is(filter.status().value()));
    }
    if (filter.createdBy() != null) {
      criteria.add(Criteria.where("createdBy").is(filter.createdBy()));
    }
    if (filter.assignedTo() != null) {
      criteria.add(Criteria.where("assignedTo").is(filter.assignedTo()));
    }
    return criteria;
  }

  private static List<Task> toDomain(List<TaskDocument> documents) {
    return documents.stream().map(TaskDocumentMapper::toDomain).toList();
  }

  private static Query byId(String id) {
    return Query.query(Criteria.where("_id").is(id));
  }
}
