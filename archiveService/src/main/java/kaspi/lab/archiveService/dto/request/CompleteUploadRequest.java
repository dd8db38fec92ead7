package kaspi.lab.archiveService.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompleteUploadRequest(
        @JsonAlias("uploadId") String uploadId,
        String key,
        String filename,
        List<CompletedPartRequest> parts,
        @JsonAlias({"fileSize", "declared_size"}) Long fileSize,
        @JsonAlias("contentType") String contentType,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> tags,
        @JsonAlias("archive_policy") String policy
) {}
