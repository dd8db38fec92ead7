package kaspi.lab.archiveService.exception;

public class GatewayException extends ArchiveException {

    public GatewayException(String operation, String key, Throwable cause) {
        super("GATEWAY_ERROR", operation, String.format("storage call failed for key=%s", key), cause);
    }
}
