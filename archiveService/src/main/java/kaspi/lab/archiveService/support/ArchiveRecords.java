package kaspi.lab.archiveService.support;

import kaspi.lab.archiveService.dto.response.ArchiveRecord;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

public final class ArchiveRecords {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private ArchiveRecords() {
    }

    public static ArchiveRecord.ArchiveRecordBuilder draft(String ownerId, String key, String originalFilename,
                                                          List<String> tags, String archivePolicy) {
        return ArchiveRecord.builder()
                .fileId(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .filename(key)
                .originalFilename(originalFilename)
                .tags(TagNormalizer.normalize(tags))
                .archivePolicy(policyOrDefault(archivePolicy))
                // stores keep millisecond precision
                .archivedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .status(ArchiveRecord.STATUS_ARCHIVED);
    }

    public static String contentTypeOrDefault(String contentType) {
        return contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType.trim();
    }

    public static String policyOrDefault(String archivePolicy) {
        return archivePolicy == null || archivePolicy.isBlank() ? ArchiveRecord.DEFAULT_POLICY : archivePolicy.trim();
    }
}
