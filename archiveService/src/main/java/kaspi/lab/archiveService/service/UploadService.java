package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.CompleteUploadCommand;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.PartUrlResponse;
import kaspi.lab.archiveService.dto.response.StartUploadResponse;
import reactor.core.publisher.Mono;

public interface UploadService {

    Mono<StartUploadResponse> start(String ownerId, String filename, String contentType);

    Mono<PartUrlResponse> issuePartUrl(String ownerId, String uploadId, String key, String partNumber);

    default Mono<PartUrlResponse> issuePartUrl(String ownerId, String uploadId, String key, int partNumber) {
        return issuePartUrl(ownerId, uploadId, key, String.valueOf(partNumber));
    }

    Mono<ArchiveRecord> complete(CompleteUploadCommand command);

    // always completes empty
    Mono<Void> abort(String ownerId, String uploadId, String key);
}
