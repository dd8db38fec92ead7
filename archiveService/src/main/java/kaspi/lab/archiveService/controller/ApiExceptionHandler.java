package kaspi.lab.archiveService.controller;

import kaspi.lab.archiveService.dto.response.ErrorResponse;
import kaspi.lab.archiveService.exception.ArchiveException;
import kaspi.lab.archiveService.exception.GatewayException;
import kaspi.lab.archiveService.exception.UploadAssemblyException;
import kaspi.lab.archiveService.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred.";

    @ExceptionHandler(ArchiveException.class)
    public ResponseEntity<ErrorResponse> handleArchiveException(ArchiveException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("{} failed: {}", e.getOperation(), e.getMessage(), e);
        } else {
            log.info("{} rejected: {}", e.getOperation(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getMessage(), e.getErrorCode(), e.getOperation()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        String reason = e.getReason();
        if (reason == null) {
            HttpStatus resolved = HttpStatus.resolve(status.value());
            reason = resolved != null ? resolved.getReasonPhrase() : status.toString();
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(INTERNAL_ERROR_MESSAGE));
    }

    static HttpStatus statusFor(ArchiveException e) {
        if (e instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof UploadAssemblyException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof GatewayException) {
            return HttpStatus.BAD_GATEWAY;
        }
        // configuration, persistence and unclassified
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
