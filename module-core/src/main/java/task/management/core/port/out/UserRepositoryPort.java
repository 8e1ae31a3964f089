package task.management.core.port.out;

import java.util.Optional;
import task.management.domain.model.user.User;

/**
 * 사용자 저장소 Port
 *
 * <p>구현체는 유니크 제약 위반을 {@link task.management.error.exception.user.DuplicateUsernameException} /
 * {@link task.management.error.exception.user.DuplicateEmailException}으로, 존재하지 않는 키는 {@link
 * task.management.error.exception.user.UserNotFoundException}으로 정규화해야 합니다. 그 외 저장소 장애는 {@link
 * task.management.error.exception.InternalSystemException}으로 전파합니다.
 */
public interface UserRepositoryPort {

  Optional<User> findById(String id);

  Optional<User> findByEmail(String email);

  Optional<User> findByUsername(String username);

  /** 새 사용자 저장 후 ID가 할당된 인스턴스 반환 */
  User create(User user);

  /** 전체 문서 교체 (last-writer-wins) */
  User update(User user);

  void deleteById(String id);
}
