package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.SearchCriteria;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.ArchiveStats;
import kaspi.lab.archiveService.dto.response.SearchResult;
import kaspi.lab.archiveService.exception.ValidationException;
import kaspi.lab.archiveService.service.ArchiveSearchService;
import kaspi.lab.archiveService.service.SearchIndex;
import kaspi.lab.archiveService.support.TagNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveSearchServiceImpl implements ArchiveSearchService {

    private static final String OP = "search";

    private final SearchIndex searchIndex;
    private final ArchiveProperties props;

    @Override
    public Mono<SearchResult> search(String ownerId, String text, List<String> tags,
                                     String startDate, String endDate, Integer size) {
        return Mono.defer(() -> {
            requireOwner(OP, ownerId);
            LocalDate start = parseDate("start_date", startDate);
            LocalDate end = parseDate("end_date", endDate);
            if (start != null && end != null && start.isAfter(end)) {
                throw ValidationException.invalidField(OP, "start_date", startDate, "must not be after end_date");
            }

            SearchCriteria criteria = SearchCriteria.builder()
                    .ownerId(ownerId)
                    .text(text)
                    .tags(TagNormalizer.normalize(tags))
                    .startDate(start)
                    .endDate(end)
                    .size(pageSize(size))
                    .build();
            log.debug("Searching archives: {}", criteria);
            return searchIndex.search(criteria);
        });
    }

    @Override
    public Mono<ArchiveStats> stats(String ownerId) {
        return Mono.defer(() -> {
            requireOwner("stats", ownerId);
            return searchIndex.aggregateStats(ownerId);
        });
    }

    @Override
    public Mono<List<ArchiveRecord>> recent(String ownerId) {
        return Mono.defer(() -> {
            requireOwner("recent", ownerId);
            SearchCriteria criteria = SearchCriteria.builder()
                    .ownerId(ownerId)
                    .size(props.getSearch().getRecentSize())
                    .build();
            return searchIndex.search(criteria).map(SearchResult::results);
        });
    }

    int pageSize(Integer requested) {
        ArchiveProperties.Search search = props.getSearch();
        if (requested == null || requested < 1) {
            return search.getDefaultPageSize();
        }
        return Math.min(requested, search.getMaxPageSize());
    }

    private static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidField(OP, field, value, "expected YYYY-MM-DD");
        }
    }

    private static void requireOwner(String operation, String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw ValidationException.missingField(operation, "owner_id");
        }
    }
}
