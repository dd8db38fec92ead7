package kaspi.lab.archiveService.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArchiveRecord(
        String id,
        String fileId,
        String ownerId,
        String filename,
        String originalFilename,
        String contentType,
        String originalContentType,
        boolean wasCompressed,
        long size,
        List<String> tags,
        String archivePolicy,
        Instant archivedAt,
        String status,
        String location
) {
    public static final String STATUS_ARCHIVED = "archived";
    public static final String DEFAULT_POLICY = "standard";
}
