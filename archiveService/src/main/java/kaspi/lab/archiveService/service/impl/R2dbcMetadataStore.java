package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.exception.PersistenceException;
import kaspi.lab.archiveService.mapper.ArchiveMapper;
import kaspi.lab.archiveService.repository.ArchiveRepository;
import kaspi.lab.archiveService.service.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class R2dbcMetadataStore implements MetadataStore {

    private final ArchiveRepository archiveRepository;
    private final ArchiveMapper archiveMapper;
    private final DatabaseClient databaseClient;

    @Override
    public Mono<String> insert(ArchiveRecord record) {
        return archiveRepository.save(archiveMapper.toEntity(record))
                .map(saved -> String.valueOf(saved.getId()))
                .doOnSuccess(id -> log.info("Metadata saved: fileId={}, id={}", record.fileId(), id))
                .onErrorMap(e -> new PersistenceException("insert", record.fileId(), e));
    }

    @Override
    public Mono<ArchiveRecord> findOne(String fileId, String ownerId) {
        return archiveRepository.findByFileIdAndOwnerId(fileId, ownerId)
                .map(archiveMapper::toRecord)
                .onErrorMap(e -> new PersistenceException("find", fileId, e));
    }

    @Override
    public Mono<Void> ping() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .then();
    }
}
