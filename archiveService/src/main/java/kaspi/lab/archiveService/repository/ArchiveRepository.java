package kaspi.lab.archiveService.repository;

import kaspi.lab.archiveService.domain.ArchiveEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface ArchiveRepository extends ReactiveCrudRepository<ArchiveEntity, Long> {
    Mono<ArchiveEntity> findByFileIdAndOwnerId(String fileId, String ownerId);
}
