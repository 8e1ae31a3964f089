package task.management.infrastructure.mongodb.repository;

import java.util.Optional;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;
import task.management.infrastructure.mongodb.document.UserDocument;

@Repository
public interface UserMongoRepository extends MongoRepository<UserDocument, String> {

  Optional<UserDocument> findByEmail(String email);

  Optional<UserDocument> findByUsername(String username);
}
