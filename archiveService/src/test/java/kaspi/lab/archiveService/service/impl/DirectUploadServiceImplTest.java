package kaspi.lab.archiveService.service.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.exception.ValidationException;
import kaspi.lab.archiveService.metrics.ArchiveMetrics;
import kaspi.lab.archiveService.service.FailedIndexLedger;
import kaspi.lab.archiveService.service.MetadataStore;
import kaspi.lab.archiveService.service.ObjectStorageGateway;
import kaspi.lab.archiveService.service.SearchIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DirectUploadServiceImplTest {

    private static final String ALICE_PREFIX = "archives/YWxpY2U/";
    private static final byte[] TEXT = "line one\nline two\nline three\n".repeat(50).getBytes(StandardCharsets.UTF_8);

    @Mock
    private ObjectStorageGateway storageGateway;
    @Mock
    private MetadataStore metadataStore;
    @Mock
    private SearchIndex searchIndex;
    @Mock
    private FailedIndexLedger failedIndexLedger;

    private DirectUploadServiceImpl directUploadService;

    @BeforeEach
    void setUp() {
        ArchiveProperties props = new ArchiveProperties();
        props.getStorage().setBucket("archive-bucket");
        directUploadService = new DirectUploadServiceImpl(
                storageGateway,
                new DenylistCompressionPolicy(props),
                new ArchiveCommitService(metadataStore, searchIndex, failedIndexLedger,
                        new ArchiveMetrics(new SimpleMeterRegistry())),
                props);
    }

    @Test
    void compressibleFileIsZippedBeforeStoring() throws Exception {
        FilePart filePart = filePart("notes.txt", MediaType.TEXT_PLAIN, TEXT);
        when(storageGateway.putObject(startsWith(ALICE_PREFIX), any(byte[].class), eq("application/zip")))
                .thenAnswer(inv -> Mono.just("http://localhost:9000/archive-bucket/" + inv.getArgument(0)));
        when(metadataStore.insert(any(ArchiveRecord.class))).thenReturn(Mono.just("5"));
        when(searchIndex.index(any(ArchiveRecord.class))).thenReturn(Mono.empty());

        ArchiveRecord record = directUploadService.archive("alice", filePart, List.of("Notes"), null).block();

        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<byte[]> stored = ArgumentCaptor.forClass(byte[].class);
        verify(storageGateway).putObject(key.capture(), stored.capture(), eq("application/zip"));
        assertTrue(key.getValue().endsWith("/notes.txt.zip"), key.getValue());

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(stored.getValue()))) {
            ZipEntry entry = zip.getNextEntry();
            assertEquals("notes.txt", entry.getName());
            assertArrayEquals(TEXT, zip.readAllBytes());
        }

        assertTrue(record.wasCompressed());
        assertEquals("application/zip", record.contentType());
        assertEquals("text/plain", record.originalContentType());
        assertEquals("notes.txt", record.originalFilename());
        assertEquals(key.getValue(), record.filename());
        assertEquals(stored.getValue().length, record.size());
        assertEquals(List.of("notes"), record.tags());
        assertEquals("5", record.id());
    }

    @Test
    void alreadyCompressedFileIsStoredAsIs() {
        byte[] png = new byte[]{(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};
        FilePart filePart = filePart("photo.png", MediaType.IMAGE_PNG, png);
        when(storageGateway.putObject(startsWith(ALICE_PREFIX), eq(png), eq("image/png")))
                .thenAnswer(inv -> Mono.just("http://localhost:9000/archive-bucket/" + inv.getArgument(0)));
        when(metadataStore.insert(any(ArchiveRecord.class))).thenReturn(Mono.just("6"));
        when(searchIndex.index(any(ArchiveRecord.class))).thenReturn(Mono.empty());

        StepVerifier.create(directUploadService.archive("alice", filePart, List.of(), "cold"))
                .assertNext(record -> {
                    assertFalse(record.wasCompressed());
                    assertEquals("image/png", record.contentType());
                    assertEquals(png.length, record.size());
                    assertEquals("cold", record.archivePolicy());
                })
                .verifyComplete();
    }

    @Test
    void repeatedUploadOfSameNameGetsItsOwnKey() {
        byte[] png = new byte[]{(byte) 0x89, 'P', 'N', 'G'};
        when(storageGateway.putObject(startsWith(ALICE_PREFIX), eq(png), eq("image/png")))
                .thenAnswer(inv -> Mono.just("http://localhost:9000/archive-bucket/" + inv.getArgument(0)));
        when(metadataStore.insert(any(ArchiveRecord.class))).thenReturn(Mono.just("1"), Mono.just("2"));
        when(searchIndex.index(any(ArchiveRecord.class))).thenReturn(Mono.empty());

        ArchiveRecord first = directUploadService.archive("alice", filePart("photo.png", MediaType.IMAGE_PNG, png), List.of(), null).block();
        ArchiveRecord second = directUploadService.archive("alice", filePart("photo.png", MediaType.IMAGE_PNG, png), List.of(), null).block();

        assertNotEquals(first.filename(), second.filename());
        assertNotEquals(first.location(), second.location());
    }

    @Test
    void missingFileIsRejected() {
        StepVerifier.create(directUploadService.archive("alice", null, List.of(), null))
                .expectError(ValidationException.class)
                .verify();

        verifyNoInteractions(storageGateway, metadataStore);
    }

    @Test
    void blankFilenameIsRejected() {
        FilePart filePart = mock(FilePart.class);
        when(filePart.filename()).thenReturn("");

        StepVerifier.create(directUploadService.archive("alice", filePart, List.of(), null))
                .expectError(ValidationException.class)
                .verify();

        verifyNoInteractions(storageGateway);
    }

    private static FilePart filePart(String filename, MediaType mediaType, byte[] content) {
        FilePart filePart = mock(FilePart.class);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(mediaType);
        DataBuffer buffer = DefaultDataBufferFactory.sharedInstance.wrap(content);
        when(filePart.filename()).thenReturn(filename);
        when(filePart.headers()).thenReturn(headers);
        when(filePart.content()).thenReturn(Flux.just(buffer));
        return filePart;
    }
}
