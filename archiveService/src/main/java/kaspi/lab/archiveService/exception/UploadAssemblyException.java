package kaspi.lab.archiveService.exception;

public class UploadAssemblyException extends ArchiveException {

    private final String uploadId;

    public UploadAssemblyException(String uploadId, String key, Throwable cause) {
        super("UPLOAD_ASSEMBLY_ERROR", "complete",
                String.format("could not assemble upload %s for key=%s", uploadId, key), cause);
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }
}
