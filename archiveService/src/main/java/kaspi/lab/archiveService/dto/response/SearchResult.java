package kaspi.lab.archiveService.dto.response;

import java.util.List;

public record SearchResult(
        long total,
        List<ArchiveRecord> results
) {
    public static SearchResult empty() {
        return new SearchResult(0, List.of());
    }
}
