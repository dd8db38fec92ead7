package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.UploadedPart;
import kaspi.lab.archiveService.support.Outcome;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

public interface ObjectStorageGateway {

    Mono<String> createSession(String key, String contentType);

    Mono<String> signPartUrl(String uploadId, String key, int partNumber, Duration ttl);

    Mono<String> assemble(String uploadId, String key, List<UploadedPart> parts);

    /**
     * Releases a session. Idempotent and never signals an error.
     */
    Mono<Outcome<Void>> abort(String uploadId, String key);

    Mono<String> putObject(String key, byte[] content, String contentType);

    Mono<String> signDownloadUrl(String key, Duration ttl);
}
