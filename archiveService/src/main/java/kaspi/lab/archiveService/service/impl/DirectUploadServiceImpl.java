package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.exception.ValidationException;
import kaspi.lab.archiveService.service.CompressionPolicy;
import kaspi.lab.archiveService.service.DirectUploadService;
import kaspi.lab.archiveService.service.ObjectStorageGateway;
import kaspi.lab.archiveService.support.ArchiveRecords;
import kaspi.lab.archiveService.support.ObjectKeys;
import kaspi.lab.archiveService.support.ZipCompressor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DirectUploadServiceImpl implements DirectUploadService {

    private static final String OP = "archive_direct";

    private final ObjectStorageGateway storageGateway;
    private final CompressionPolicy compressionPolicy;
    private final ArchiveCommitService commitService;
    private final ArchiveProperties props;

    @Override
    public Mono<ArchiveRecord> archive(String ownerId, FilePart filePart, List<String> tags, String archivePolicy) {
        return Mono.defer(() -> {
            if (ownerId == null || ownerId.isBlank()) {
                throw ValidationException.missingField(OP, "owner_id");
            }
            if (filePart == null) {
                throw ValidationException.missingField(OP, "file");
            }
            String filename = filePart.filename();
            if (filename == null || filename.isBlank()) {
                throw ValidationException.invalidField(OP, "file", filename, "no file selected");
            }
            MediaType mediaType = filePart.headers().getContentType();
            String contentType = ArchiveRecords.contentTypeOrDefault(mediaType != null ? mediaType.toString() : null);

            return DataBufferUtils.join(filePart.content())
                    .map(DirectUploadServiceImpl::toBytes)
                    .defaultIfEmpty(new byte[0])
                    .flatMap(content -> store(ownerId, filename, contentType, content, tags, archivePolicy));
        });
    }

    private Mono<ArchiveRecord> store(String ownerId, String filename, String contentType, byte[] content,
                                      List<String> tags, String archivePolicy) {
        boolean compress = compressionPolicy.shouldCompress(contentType);
        String storedName = compress ? filename + ZipCompressor.ZIP_EXTENSION : filename;
        String storedType = compress ? ZipCompressor.ZIP_CONTENT_TYPE : contentType;
        String key = ObjectKeys.newKey(props.getStorage().getKeyPrefix(), ownerId, storedName);

        Mono<byte[]> payload = compress
                ? Mono.fromCallable(() -> ZipCompressor.zip(filename, content)).subscribeOn(Schedulers.boundedElastic())
                : Mono.just(content);

        return payload.flatMap(bytes -> storageGateway.putObject(key, bytes, storedType)
                .doOnNext(location -> log.info("Stored {} bytes at {} (compressed={}, original={} bytes)",
                        bytes.length, key, compress, content.length))
                .map(location -> ArchiveRecords.draft(ownerId, key, filename, tags, archivePolicy)
                        .contentType(storedType)
                        .originalContentType(contentType)
                        .wasCompressed(compress)
                        .size(bytes.length)
                        .location(location)
                        .build()))
                .flatMap(commitService::commit);
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
