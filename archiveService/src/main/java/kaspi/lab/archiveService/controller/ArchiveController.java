package kaspi.lab.archiveService.controller;

import kaspi.lab.archiveService.dto.request.AbortUploadRequest;
import kaspi.lab.archiveService.dto.request.CompleteUploadRequest;
import kaspi.lab.archiveService.dto.request.PartUrlRequest;
import kaspi.lab.archiveService.dto.request.StartUploadRequest;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.ArchiveView;
import kaspi.lab.archiveService.dto.response.PartUrlResponse;
import kaspi.lab.archiveService.dto.response.StartUploadResponse;
import kaspi.lab.archiveService.mapper.UploadRequestMapper;
import kaspi.lab.archiveService.service.DirectUploadService;
import kaspi.lab.archiveService.service.RetrievalService;
import kaspi.lab.archiveService.service.UploadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/archive")
@RequiredArgsConstructor
public class ArchiveController {

    public static final String OWNER_HEADER = "X-Owner-Id";
    static final String NOT_FOUND_MESSAGE = "File not found or you do not have permission";

    private final UploadService uploadService;
    private final RetrievalService retrievalService;
    private final DirectUploadService directUploadService;
    private final UploadRequestMapper requestMapper;

    @PostMapping("/start-upload")
    public Mono<StartUploadResponse> startUpload(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestBody StartUploadRequest request
    ) {
        log.info("Start upload request for file: {} by owner: {}", request.filename(), ownerId);
        return uploadService.start(ownerId, request.filename(), request.contentType());
    }

    @PostMapping("/get-upload-part-url")
    public Mono<PartUrlResponse> getUploadPartUrl(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestBody PartUrlRequest request
    ) {
        return uploadService.issuePartUrl(ownerId, request.uploadId(), request.key(), request.partNumber());
    }

    @PostMapping("/complete-upload")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ArchiveRecord> completeUpload(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestBody CompleteUploadRequest request
    ) {
        log.info("Complete upload request for uploadId: {} by owner: {}", request.uploadId(), ownerId);
        return uploadService.complete(requestMapper.toCommand(request, ownerId));
    }

    @PostMapping("/abort-upload")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> abortUpload(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestBody AbortUploadRequest request
    ) {
        return uploadService.abort(ownerId, request.uploadId(), request.key());
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ArchiveRecord> archiveFile(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @RequestPart(value = "file", required = false) Mono<FilePart> filePartMono,
            @RequestPart(value = "tags", required = false) String tags,
            @RequestPart(value = "policy", required = false) String policy
    ) {
        List<String> rawTags = tags != null ? List.of(tags) : List.of();
        return filePartMono
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(filePart -> directUploadService.archive(ownerId, filePart.orElse(null), rawTags, policy));
    }

    @GetMapping("/{fileId}")
    public Mono<ArchiveView> getArchive(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @PathVariable String fileId
    ) {
        return retrievalService.get(fileId, ownerId)
                .switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, NOT_FOUND_MESSAGE)));
    }
}
