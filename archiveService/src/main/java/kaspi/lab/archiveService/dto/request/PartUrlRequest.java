package kaspi.lab.archiveService.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

// partNumber stays raw text, the upload service parses it
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PartUrlRequest(
        @JsonAlias("uploadId") String uploadId,
        String key,
        @JsonAlias("partNumber") String partNumber
) {}
