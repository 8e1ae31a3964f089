package task.management.infrastructure.mongodb.repository;

import java.util.List;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;
import task.management.infrastructure.mongodb.document.TaskDocument;

@Repository
public interface TaskMongoRepository extends MongoRepository<TaskDocument, String> {

  List<TaskDocument> findByStatus(String status, Sort sort);

  /** 생성자 또는 담당자 기준 조회 ($or) */
  List<TaskDocument> findByCreatedByOrAssignedTo(String createdBy, String assignedTo, Sort sort);
}
