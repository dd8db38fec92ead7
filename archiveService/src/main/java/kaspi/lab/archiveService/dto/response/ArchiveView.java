package kaspi.lab.archiveService.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

public record ArchiveView(
        @JsonUnwrapped ArchiveRecord record,
        @JsonProperty("download_url") String downloadUrl
) {}
