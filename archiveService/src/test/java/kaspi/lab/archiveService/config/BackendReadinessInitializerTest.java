package kaspi.lab.archiveService.config;

import kaspi.lab.archiveService.service.MetadataStore;
import kaspi.lab.archiveService.service.ResultCache;
import kaspi.lab.archiveService.service.SearchIndex;
import kaspi.lab.archiveService.support.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BackendReadinessInitializerTest {

    @Mock
    private MetadataStore metadataStore;
    @Mock
    private SearchIndex searchIndex;
    @Mock
    private ResultCache resultCache;

    private BackendReadinessInitializer initializer;

    @BeforeEach
    void setUp() {
        ArchiveProperties props = new ArchiveProperties();
        props.getStartup().setStoreRetryDelay(Duration.ofMillis(1));
        props.getStartup().setIndexRetryDelay(Duration.ofMillis(1));
        initializer = new BackendReadinessInitializer(metadataStore, searchIndex, resultCache, props);
    }

    @Test
    void checksBackendsInDependencyOrder() {
        when(metadataStore.ping()).thenReturn(Mono.empty());
        when(searchIndex.ensureSchema()).thenReturn(Mono.just(true));
        when(resultCache.ping()).thenReturn(Mono.just(Outcome.empty()));

        initializer.run(null);

        InOrder order = inOrder(metadataStore, searchIndex, resultCache);
        order.verify(metadataStore).ping();
        order.verify(searchIndex).ensureSchema();
        order.verify(resultCache).ping();
    }

    @Test
    void storeIsRetriedBeforeGivingUp() {
        AtomicInteger attempts = new AtomicInteger();
        when(metadataStore.ping()).thenReturn(Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new IllegalStateException("connection refused"));
        }));

        assertThrows(RuntimeException.class, () -> initializer.run(null));
        assertEquals(3, attempts.get());
        verifyNoInteractions(searchIndex, resultCache);
    }

    @Test
    void unavailableCacheDoesNotStopStartup() {
        when(metadataStore.ping()).thenReturn(Mono.empty());
        when(searchIndex.ensureSchema()).thenReturn(Mono.just(false));
        when(resultCache.ping()).thenReturn(Mono.just(Outcome.absorbed(new IllegalStateException("redis down"))));

        assertDoesNotThrow(() -> initializer.run(null));
    }
}
