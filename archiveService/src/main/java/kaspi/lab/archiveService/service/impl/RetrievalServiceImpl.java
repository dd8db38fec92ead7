package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.ArchiveView;
import kaspi.lab.archiveService.service.MetadataStore;
import kaspi.lab.archiveService.service.ObjectStorageGateway;
import kaspi.lab.archiveService.service.ResultCache;
import kaspi.lab.archiveService.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

// Only metadata is cached; the download URL is signed on every call.
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalServiceImpl implements RetrievalService {

    private final ResultCache resultCache;
    private final MetadataStore metadataStore;
    private final ObjectStorageGateway storageGateway;
    private final ArchiveProperties props;

    @Override
    public Mono<ArchiveView> get(String fileId, String ownerId) {
        if (fileId == null || fileId.isBlank() || ownerId == null || ownerId.isBlank()) {
            return Mono.empty();
        }
        return resultCache.get(fileId)
                .flatMap(outcome -> outcome.value()
                        .map(cached -> ownedBy(cached, ownerId))
                        .orElseGet(() -> loadFromStore(fileId, ownerId)))
                .flatMap(this::withDownloadUrl);
    }

    private Mono<ArchiveRecord> ownedBy(ArchiveRecord cached, String ownerId) {
        if (ownerId.equals(cached.ownerId())) {
            return Mono.just(cached);
        }
        // same answer as an unknown id
        log.debug("Cached fileId={} belongs to another owner", cached.fileId());
        return Mono.empty();
    }

    private Mono<ArchiveRecord> loadFromStore(String fileId, String ownerId) {
        return metadataStore.findOne(fileId, ownerId)
                .flatMap(record -> resultCache.put(record, props.getCache().getTtl())
                        .thenReturn(record));
    }

    private Mono<ArchiveView> withDownloadUrl(ArchiveRecord record) {
        return storageGateway.signDownloadUrl(record.filename(), props.getStorage().getDownloadUrlTtl())
                .map(url -> new ArchiveView(record, url));
    }
}
