package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.exception.PersistenceException;
import kaspi.lab.archiveService.service.MetadataStore;
import kaspi.lab.archiveService.service.ObjectStorageGateway;
import kaspi.lab.archiveService.service.ResultCache;
import kaspi.lab.archiveService.support.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceImplTest {

    private static final Duration ONE_HOUR = Duration.ofHours(1);

    @Mock
    private ResultCache resultCache;
    @Mock
    private MetadataStore metadataStore;
    @Mock
    private ObjectStorageGateway storageGateway;

    private RetrievalServiceImpl retrievalService;

    private final ArchiveRecord record = ArchiveRecord.builder()
            .id("42")
            .fileId("f-1")
            .ownerId("alice")
            .filename("archives/YWxpY2U/3f1c2b9e-8d4a-4c6e-9b2f-7a1d5e0c4b88/video.mp4")
            .originalFilename("video.mp4")
            .contentType("video/mp4")
            .originalContentType("video/mp4")
            .size(5_242_880L)
            .tags(List.of("travel"))
            .archivePolicy("standard")
            .archivedAt(Instant.parse("2024-03-01T10:15:30.123Z"))
            .status("archived")
            .build();

    @BeforeEach
    void setUp() {
        retrievalService = new RetrievalServiceImpl(resultCache, metadataStore, storageGateway, new ArchiveProperties());
    }

    @Test
    void cacheHitForOwnerSkipsStore() {
        when(resultCache.get("f-1")).thenReturn(Mono.just(Outcome.succeeded(record)));
        when(storageGateway.signDownloadUrl(record.filename(), ONE_HOUR)).thenReturn(Mono.just("https://dl/1"));

        StepVerifier.create(retrievalService.get("f-1", "alice"))
                .assertNext(view -> {
                    assertEquals(record, view.record());
                    assertEquals("https://dl/1", view.downloadUrl());
                })
                .verifyComplete();

        verifyNoInteractions(metadataStore);
        verify(resultCache, never()).put(any(), any());
    }

    @Test
    void cachedRecordOfAnotherOwnerIsNotFound() {
        when(resultCache.get("f-1")).thenReturn(Mono.just(Outcome.succeeded(record)));

        StepVerifier.create(retrievalService.get("f-1", "bob"))
                .verifyComplete();

        verifyNoInteractions(metadataStore, storageGateway);
    }

    @Test
    void cacheMissLoadsFromStoreAndPopulatesCache() {
        when(resultCache.get("f-1")).thenReturn(Mono.just(Outcome.empty()));
        when(metadataStore.findOne("f-1", "alice")).thenReturn(Mono.just(record));
        when(resultCache.put(record, Duration.ofSeconds(3600))).thenReturn(Mono.just(Outcome.empty()));
        when(storageGateway.signDownloadUrl(record.filename(), ONE_HOUR)).thenReturn(Mono.just("https://dl/1"));

        StepVerifier.create(retrievalService.get("f-1", "alice"))
                .assertNext(view -> assertEquals(record, view.record()))
                .verifyComplete();

        verify(resultCache).put(record, Duration.ofSeconds(3600));
    }

    @Test
    void unknownOrForeignRecordIsNotFound() {
        when(resultCache.get("f-1")).thenReturn(Mono.just(Outcome.empty()));
        when(metadataStore.findOne("f-1", "bob")).thenReturn(Mono.empty());

        StepVerifier.create(retrievalService.get("f-1", "bob"))
                .verifyComplete();

        verify(resultCache, never()).put(any(), any());
        verifyNoInteractions(storageGateway);
    }

    @Test
    void cacheFailuresNeverChangeTheResult() {
        when(resultCache.get("f-1")).thenReturn(Mono.just(Outcome.absorbed(new RuntimeException("redis down"))));
        when(metadataStore.findOne("f-1", "alice")).thenReturn(Mono.just(record));
        when(resultCache.put(any(), any())).thenReturn(Mono.just(Outcome.absorbed(new RuntimeException("redis down"))));
        when(storageGateway.signDownloadUrl(record.filename(), ONE_HOUR)).thenReturn(Mono.just("https://dl/1"));

        StepVerifier.create(retrievalService.get("f-1", "alice"))
                .assertNext(view -> assertEquals(record, view.record()))
                .verifyComplete();
    }

    @Test
    void everyCallSignsAFreshDownloadUrl() {
        when(resultCache.get("f-1")).thenReturn(Mono.just(Outcome.succeeded(record)));
        when(storageGateway.signDownloadUrl(record.filename(), ONE_HOUR))
                .thenReturn(Mono.just("https://dl/first"), Mono.just("https://dl/second"));

        StepVerifier.create(retrievalService.get("f-1", "alice"))
                .assertNext(view -> assertEquals("https://dl/first", view.downloadUrl()))
                .verifyComplete();
        StepVerifier.create(retrievalService.get("f-1", "alice"))
                .assertNext(view -> assertEquals("https://dl/second", view.downloadUrl()))
                .verifyComplete();

        verify(storageGateway, times(2)).signDownloadUrl(record.filename(), ONE_HOUR);
    }

    @Test
    void storeFailurePropagates() {
        when(resultCache.get("f-1")).thenReturn(Mono.just(Outcome.empty()));
        when(metadataStore.findOne("f-1", "alice"))
                .thenReturn(Mono.error(new PersistenceException("find", "f-1", new RuntimeException("db down"))));

        StepVerifier.create(retrievalService.get("f-1", "alice"))
                .expectError(PersistenceException.class)
                .verify();
    }

    @Test
    void blankOwnerIsNotFound() {
        StepVerifier.create(retrievalService.get("f-1", " "))
                .verifyComplete();

        verifyNoInteractions(resultCache, metadataStore, storageGateway);
    }
}
