package kaspi.lab.archiveService.exception;

public class ConfigurationException extends ArchiveException {

    public ConfigurationException(String operation, String message) {
        super("CONFIGURATION_ERROR", operation, message);
    }

    public static ConfigurationException bucketMissing(String operation) {
        return new ConfigurationException(operation, "storage bucket is not configured");
    }
}
