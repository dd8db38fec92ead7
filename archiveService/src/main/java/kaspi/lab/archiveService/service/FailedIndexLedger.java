package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.LedgerEntry;
import reactor.core.publisher.Mono;

public interface FailedIndexLedger {
    Mono<Void> append(LedgerEntry entry);
}
