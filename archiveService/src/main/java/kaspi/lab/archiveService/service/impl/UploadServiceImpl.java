package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.CompleteUploadCommand;
import kaspi.lab.archiveService.dto.UploadedPart;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.PartUrlResponse;
import kaspi.lab.archiveService.dto.response.StartUploadResponse;
import kaspi.lab.archiveService.exception.UploadAssemblyException;
import kaspi.lab.archiveService.exception.ValidationException;
import kaspi.lab.archiveService.service.ObjectStorageGateway;
import kaspi.lab.archiveService.service.UploadService;
import kaspi.lab.archiveService.support.ArchiveRecords;
import kaspi.lab.archiveService.support.ObjectKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class UploadServiceImpl implements UploadService {

    private static final String OP_START = "start";
    private static final String OP_PART_URL = "issue_part_url";
    private static final String OP_COMPLETE = "complete";

    private final ObjectStorageGateway storageGateway;
    private final ArchiveCommitService commitService;
    private final ArchiveProperties props;

    @Override
    public Mono<StartUploadResponse> start(String ownerId, String filename, String contentType) {
        return Mono.defer(() -> {
            requireText(OP_START, "owner_id", ownerId);
            requireText(OP_START, "filename", filename);
            String key = ObjectKeys.newKey(props.getStorage().getKeyPrefix(), ownerId, filename);

            return storageGateway.createSession(key, ArchiveRecords.contentTypeOrDefault(contentType))
                    .doOnNext(uploadId -> log.info("Upload session opened: uploadId={}, key={}", uploadId, key))
                    .map(uploadId -> new StartUploadResponse(uploadId, key, filename));
        });
    }

    @Override
    public Mono<PartUrlResponse> issuePartUrl(String ownerId, String uploadId, String key, String partNumber) {
        return Mono.defer(() -> {
            requireText(OP_PART_URL, "owner_id", ownerId);
            requireText(OP_PART_URL, "upload_id", uploadId);
            requireOwnedKey(OP_PART_URL, ownerId, key);
            int part = parsePartNumber(partNumber);

            return storageGateway.signPartUrl(uploadId, key, part, props.getStorage().getPartUrlTtl())
                    .map(url -> new PartUrlResponse(url, part));
        });
    }

    @Override
    public Mono<ArchiveRecord> complete(CompleteUploadCommand command) {
        return Mono.defer(() -> {
            validate(command);
            String key = command.key();

            return storageGateway.assemble(command.uploadId(), key, command.parts())
                    .onErrorResume(UploadAssemblyException.class, e -> {
                        log.error("Assembly failed for uploadId={}, key={}, aborting session",
                                command.uploadId(), key, e);
                        return storageGateway.abort(command.uploadId(), key).then(Mono.<String>error(e));
                    })
                    .map(location -> ArchiveRecords.draft(command.ownerId(), key, command.filename(),
                                    command.tags(), command.archivePolicy())
                            .contentType(ArchiveRecords.contentTypeOrDefault(command.contentType()))
                            .originalContentType(ArchiveRecords.contentTypeOrDefault(command.contentType()))
                            .wasCompressed(false)
                            .size(command.declaredSize())
                            .location(location)
                            .build())
                    .flatMap(commitService::commit);
        });
    }

    @Override
    public Mono<Void> abort(String ownerId, String uploadId, String key) {
        return Mono.defer(() -> {
                    if (isBlank(ownerId) || isBlank(uploadId) || isBlank(key)) {
                        log.debug("Ignoring abort with missing identifiers: uploadId={}, key={}", uploadId, key);
                        return Mono.<Void>empty();
                    }
                    if (!ObjectKeys.isOwnedBy(props.getStorage().getKeyPrefix(), ownerId, key)) {
                        log.warn("Ignoring abort of uploadId={}: key {} is outside owner scope", uploadId, key);
                        return Mono.<Void>empty();
                    }
                    return storageGateway.abort(uploadId, key).then();
                })
                .onErrorResume(e -> {
                    log.warn("Abort of uploadId={} failed", uploadId, e);
                    return Mono.empty();
                });
    }

    private void validate(CompleteUploadCommand command) {
        if (command == null) {
            throw ValidationException.missingField(OP_COMPLETE, "request");
        }
        requireText(OP_COMPLETE, "owner_id", command.ownerId());
        requireText(OP_COMPLETE, "upload_id", command.uploadId());
        requireOwnedKey(OP_COMPLETE, command.ownerId(), command.key());
        requireText(OP_COMPLETE, "filename", command.filename());
        if (command.parts() == null || command.parts().isEmpty()) {
            throw ValidationException.missingField(OP_COMPLETE, "parts");
        }
        for (UploadedPart part : command.parts()) {
            if (part == null) {
                throw ValidationException.invalidField(OP_COMPLETE, "parts", null, "part entry is null");
            }
            if (part.partNumber() < 1) {
                throw ValidationException.invalidField(OP_COMPLETE, "part_number", part.partNumber(), "must be a positive integer");
            }
            if (isBlank(part.etag())) {
                throw ValidationException.invalidField(OP_COMPLETE, "etag", part.etag(),
                        "missing for part " + part.partNumber());
            }
        }
        if (command.declaredSize() == null) {
            throw ValidationException.missingField(OP_COMPLETE, "file_size");
        }
        if (command.declaredSize() < 0) {
            throw ValidationException.invalidField(OP_COMPLETE, "file_size", command.declaredSize(), "must not be negative");
        }
    }

    static int parsePartNumber(String raw) {
        if (isBlank(raw)) {
            throw ValidationException.missingField(OP_PART_URL, "part_number");
        }
        int partNumber;
        try {
            partNumber = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidField(OP_PART_URL, "part_number", raw, "not an integer");
        }
        if (partNumber < 1) {
            throw ValidationException.invalidField(OP_PART_URL, "part_number", raw, "must be a positive integer");
        }
        return partNumber;
    }

    private void requireOwnedKey(String operation, String ownerId, String key) {
        requireText(operation, "key", key);
        if (!ObjectKeys.isOwnedBy(props.getStorage().getKeyPrefix(), ownerId, key)) {
            throw ValidationException.invalidField(operation, "key", key, "not issued to this owner");
        }
    }

    private static void requireText(String operation, String field, String value) {
        if (isBlank(value)) {
            throw ValidationException.missingField(operation, field);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
