package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import reactor.core.publisher.Mono;

public interface MetadataStore {

    Mono<String> insert(ArchiveRecord record);

    /**
     * Empty when the id does not exist or belongs to another owner; the two
     * cases are indistinguishable.
     */
    Mono<ArchiveRecord> findOne(String fileId, String ownerId);

    Mono<Void> ping();
}
