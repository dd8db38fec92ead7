package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.dto.LedgerEntry;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.exception.PersistenceException;
import kaspi.lab.archiveService.metrics.ArchiveMetrics;
import kaspi.lab.archiveService.service.FailedIndexLedger;
import kaspi.lab.archiveService.service.MetadataStore;
import kaspi.lab.archiveService.service.SearchIndex;
import kaspi.lab.archiveService.support.Outcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

// Persist must succeed; a failed index write goes to the ledger.
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveCommitService {

    private final MetadataStore metadataStore;
    private final SearchIndex searchIndex;
    private final FailedIndexLedger failedIndexLedger;
    private final ArchiveMetrics metrics;

    public Mono<ArchiveRecord> commit(ArchiveRecord draft) {
        return persist(draft)
                .flatMap(Outcome::toMono)
                .flatMap(stored -> index(stored).thenReturn(stored))
                .doOnNext(stored -> {
                    metrics.recordArchived();
                    log.info("File archived: fileId={}, owner={}, size={}",
                            stored.fileId(), stored.ownerId(), stored.size());
                });
    }

    Mono<Outcome<ArchiveRecord>> persist(ArchiveRecord draft) {
        return metadataStore.insert(draft)
                .map(id -> Outcome.succeeded(draft.toBuilder().id(id).build()))
                .switchIfEmpty(Mono.fromSupplier(() -> Outcome.<ArchiveRecord>fatal(new PersistenceException("insert", draft.fileId(),
                        new IllegalStateException("store returned no identifier")))))
                .onErrorResume(e -> {
                    log.error("Metadata persist failed for fileId={}, object left in storage at {}",
                            draft.fileId(), draft.filename(), e);
                    Throwable error = e instanceof PersistenceException ? e : new PersistenceException("insert", draft.fileId(), e);
                    return Mono.just(Outcome.<ArchiveRecord>fatal(error));
                });
    }

    Mono<Outcome<Void>> index(ArchiveRecord stored) {
        return searchIndex.index(stored)
                .thenReturn(Outcome.<Void>empty())
                .onErrorResume(e -> recordIndexFailure(stored, e));
    }

    private Mono<Outcome<Void>> recordIndexFailure(ArchiveRecord stored, Throwable error) {
        log.warn("Index write failed for fileId={}, recording in ledger", stored.fileId(), error);
        LedgerEntry entry = new LedgerEntry(stored.fileId(), reason(error), Instant.now());
        return failedIndexLedger.append(entry)
                .onErrorResume(ledgerError -> {
                    log.warn("Ledger write failed for fileId={}, index drift is unrecorded", stored.fileId(), ledgerError);
                    return Mono.empty();
                })
                .thenReturn(Outcome.<Void>absorbed(error));
    }

    private static String reason(Throwable error) {
        Throwable root = error.getCause() != null ? error.getCause() : error;
        String message = root.getMessage();
        return message != null ? message : root.getClass().getSimpleName();
    }
}
