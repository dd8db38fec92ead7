package kaspi.lab.archiveService.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompletedPartRequest(
        @JsonAlias({"PartNumber", "partNumber"}) Integer partNumber,
        @JsonAlias({"ETag", "eTag"}) String etag
) {}
