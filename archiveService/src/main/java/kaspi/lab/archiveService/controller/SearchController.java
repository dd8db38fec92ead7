package kaspi.lab.archiveService.controller;

import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.ArchiveStats;
import kaspi.lab.archiveService.dto.response.SearchResult;
import kaspi.lab.archiveService.service.ArchiveSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

import static kaspi.lab.archiveService.controller.ArchiveController.OWNER_HEADER;

@RestController
@RequiredArgsConstructor
public class SearchController {

    private final ArchiveSearchService searchService;

    @GetMapping("/search")
    public Mono<SearchResult> search(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestParam(value = "q", required = false) String text,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate,
            @RequestParam(value = "size", required = false) Integer size
    ) {
        return searchService.search(ownerId, text, tags, startDate, endDate, size);
    }

    @GetMapping("/dashboard/stats")
    public Mono<ArchiveStats> stats(@RequestHeader(OWNER_HEADER) String ownerId) {
        return searchService.stats(ownerId);
    }

    @GetMapping("/dashboard/recent")
    public Mono<List<ArchiveRecord>> recent(@RequestHeader(OWNER_HEADER) String ownerId) {
        return searchService.recent(ownerId);
    }
}
