package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.support.Outcome;
import reactor.core.publisher.Mono;

import java.time.Duration;

public interface ResultCache {

    Mono<Outcome<ArchiveRecord>> get(String fileId);

    Mono<Outcome<Void>> put(ArchiveRecord record, Duration ttl);

    Mono<Outcome<Void>> ping();
}
