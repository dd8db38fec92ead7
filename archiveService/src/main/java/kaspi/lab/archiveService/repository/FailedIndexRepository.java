package kaspi.lab.archiveService.repository;

import kaspi.lab.archiveService.domain.FailedIndexEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

public interface FailedIndexRepository extends ReactiveCrudRepository<FailedIndexEntity, Long> {
}
