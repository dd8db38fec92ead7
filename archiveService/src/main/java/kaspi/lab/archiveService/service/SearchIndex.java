package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.SearchCriteria;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.ArchiveStats;
import kaspi.lab.archiveService.dto.response.SearchResult;
import reactor.core.publisher.Mono;

public interface SearchIndex {

    /**
     * @return true when the index was created by this call
     */
    Mono<Boolean> ensureSchema();

    Mono<Void> index(ArchiveRecord record);

    Mono<SearchResult> search(SearchCriteria criteria);

    Mono<ArchiveStats> aggregateStats(String ownerId);
}
