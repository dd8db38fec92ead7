package kaspi.lab.archiveService.exception;

public class ValidationException extends ArchiveException {

    public ValidationException(String operation, String field, String reason) {
        super("VALIDATION_ERROR", operation, String.format("Invalid %s: %s", field, reason));
    }

    public static ValidationException missingField(String operation, String field) {
        return new ValidationException(operation, field, "field is required but missing");
    }

    public static ValidationException invalidField(String operation, String field, Object value, String reason) {
        return new ValidationException(operation, field, String.format("value '%s' is invalid: %s", value, reason));
    }
}
