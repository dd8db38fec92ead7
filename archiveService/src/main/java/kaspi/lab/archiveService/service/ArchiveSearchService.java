package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.ArchiveStats;
import kaspi.lab.archiveService.dto.response.SearchResult;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ArchiveSearchService {

    Mono<SearchResult> search(String ownerId, String text, List<String> tags,
                              String startDate, String endDate, Integer size);

    Mono<ArchiveStats> stats(String ownerId);

    Mono<List<ArchiveRecord>> recent(String ownerId);
}
