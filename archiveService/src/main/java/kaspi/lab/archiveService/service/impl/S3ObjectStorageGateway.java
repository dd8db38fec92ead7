package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.UploadedPart;
import kaspi.lab.archiveService.exception.ArchiveException;
import kaspi.lab.archiveService.exception.ConfigurationException;
import kaspi.lab.archiveService.exception.GatewayException;
import kaspi.lab.archiveService.exception.UploadAssemblyException;
import kaspi.lab.archiveService.service.ObjectStorageGateway;
import kaspi.lab.archiveService.support.ArchiveRecords;
import kaspi.lab.archiveService.support.Outcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchUploadException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.UploadPartPresignRequest;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class S3ObjectStorageGateway implements ObjectStorageGateway {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final ArchiveProperties props;

    @Override
    public Mono<String> createSession(String key, String contentType) {
        return Mono.fromCallable(() -> {
                    String bucket = requireBucket("start");
                    String uploadId = s3Client.createMultipartUpload(CreateMultipartUploadRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(ArchiveRecords.contentTypeOrDefault(contentType))
                            .build()).uploadId();
                    log.info("Multipart session opened: key={}, uploadId={}", key, uploadId);
                    return uploadId;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ArchiveException), e -> new GatewayException("start", key, e));
    }

    @Override
    public Mono<String> signPartUrl(String uploadId, String key, int partNumber, Duration ttl) {
        return Mono.fromCallable(() -> {
                    String bucket = requireBucket("issue_part_url");
                    UploadPartRequest part = UploadPartRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .uploadId(uploadId)
                            .partNumber(partNumber)
                            .build();
                    return s3Presigner.presignUploadPart(UploadPartPresignRequest.builder()
                                    .signatureDuration(ttl)
                                    .uploadPartRequest(part)
                                    .build())
                            .url()
                            .toString();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ArchiveException), e -> new GatewayException("issue_part_url", key, e));
    }

    @Override
    public Mono<String> assemble(String uploadId, String key, List<UploadedPart> parts) {
        return Mono.fromCallable(() -> {
                    String bucket = requireBucket("complete");
                    // S3 requires ascending part numbers
                    List<CompletedPart> completedParts = parts.stream()
                            .sorted(Comparator.comparingInt(UploadedPart::partNumber))
                            .map(p -> CompletedPart.builder()
                                    .partNumber(p.partNumber())
                                    .eTag(p.etag())
                                    .build())
                            .toList();

                    CompleteMultipartUploadResponse response = s3Client.completeMultipartUpload(
                            CompleteMultipartUploadRequest.builder()
                                    .bucket(bucket)
                                    .key(key)
                                    .uploadId(uploadId)
                                    .multipartUpload(CompletedMultipartUpload.builder()
                                            .parts(completedParts)
                                            .build())
                                    .build());
                    log.info("Multipart upload assembled: key={}, uploadId={}, parts={}", key, uploadId, completedParts.size());
                    return response.location() != null ? response.location() : location(bucket, key);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ArchiveException), e -> new UploadAssemblyException(uploadId, key, e));
    }

    @Override
    public Mono<Outcome<Void>> abort(String uploadId, String key) {
        return Mono.fromCallable(() -> {
                    String bucket = requireBucket("abort");
                    s3Client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .uploadId(uploadId)
                            .build());
                    log.info("Aborted upload {} for {}", uploadId, key);
                    return Outcome.<Void>empty();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    if (isUnknownUpload(e)) {
                        log.debug("Upload {} for {} is already gone", uploadId, key);
                        return Mono.just(Outcome.<Void>empty());
                    }
                    log.warn("Could not abort upload {} for {}", uploadId, key, e);
                    return Mono.just(Outcome.<Void>absorbed(e));
                });
    }

    @Override
    public Mono<String> putObject(String key, byte[] content, String contentType) {
        return Mono.fromCallable(() -> {
                    String bucket = requireBucket("archive_direct");
                    s3Client.putObject(PutObjectRequest.builder()
                                    .bucket(bucket)
                                    .key(key)
                                    .contentType(ArchiveRecords.contentTypeOrDefault(contentType))
                                    .contentLength((long) content.length)
                                    .build(),
                            RequestBody.fromBytes(content));
                    log.info("Object stored: bucket={}, key={}, size={}", bucket, key, content.length);
                    return location(bucket, key);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ArchiveException), e -> new GatewayException("archive_direct", key, e));
    }

    @Override
    public Mono<String> signDownloadUrl(String key, Duration ttl) {
        return Mono.fromCallable(() -> {
                    String bucket = requireBucket("get");
                    return s3Presigner.presignGetObject(GetObjectPresignRequest.builder()
                                    .signatureDuration(ttl)
                                    .getObjectRequest(GetObjectRequest.builder()
                                            .bucket(bucket)
                                            .key(key)
                                            .build())
                                    .build())
                            .url()
                            .toString();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ArchiveException), e -> new GatewayException("get", key, e));
    }

    private String requireBucket(String operation) {
        String bucket = props.getStorage().getBucket();
        if (bucket == null || bucket.isBlank()) {
            throw ConfigurationException.bucketMissing(operation);
        }
        return bucket;
    }

    private String location(String bucket, String key) {
        String endpoint = props.getStorage().getEndpoint().replaceAll("/+$", "");
        return String.format("%s/%s/%s", endpoint, bucket, key);
    }

    private static boolean isUnknownUpload(Throwable e) {
        if (e instanceof NoSuchUploadException) {
            return true;
        }
        return e instanceof S3Exception s3e
                && s3e.awsErrorDetails() != null
                && "NoSuchUpload".equals(s3e.awsErrorDetails().errorCode());
    }
}
