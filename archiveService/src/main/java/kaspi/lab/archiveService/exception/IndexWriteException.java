package kaspi.lab.archiveService.exception;

public class IndexWriteException extends ArchiveException {

    public IndexWriteException(String fileId, Throwable cause) {
        super("INDEX_WRITE_ERROR", "index", String.format("could not index file_id=%s", fileId), cause);
    }
}
