package kaspi.lab.archiveService.exception;

public class PersistenceException extends ArchiveException {

    public PersistenceException(String operation, String fileId, Throwable cause) {
        super("PERSISTENCE_ERROR", operation, String.format("metadata store call failed for file_id=%s", fileId), cause);
    }
}
