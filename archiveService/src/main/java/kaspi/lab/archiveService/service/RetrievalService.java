package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.response.ArchiveView;
import reactor.core.publisher.Mono;

public interface RetrievalService {

    /**
     * Empty when the record does not exist or is not owned by {@code ownerId}.
     */
    Mono<ArchiveView> get(String fileId, String ownerId);
}
