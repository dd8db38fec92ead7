package kaspi.lab.archiveService.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArchiveStats(
        long totalItems,
        long totalBytes,
        Instant lastUpload
) {}
