package kaspi.lab.archiveService.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String operation
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null, null);
    }
}
