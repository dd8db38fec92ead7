package kaspi.lab.archiveService.config;

import kaspi.lab.archiveService.service.MetadataStore;
import kaspi.lab.archiveService.service.ResultCache;
import kaspi.lab.archiveService.service.SearchIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "archive.startup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackendReadinessInitializer implements ApplicationRunner {

    private final MetadataStore metadataStore;
    private final SearchIndex searchIndex;
    private final ResultCache resultCache;
    private final ArchiveProperties props;

    @Override
    public void run(ApplicationArguments args) {
        ArchiveProperties.Startup startup = props.getStartup();

        log.info("Checking metadata store...");
        metadataStore.ping()
                .retryWhen(Retry.fixedDelay(startup.getStoreAttempts() - 1L, startup.getStoreRetryDelay())
                        .doBeforeRetry(signal -> log.warn("Metadata store not ready (attempt {}): {}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .block();
        log.info("Metadata store is ready");

        Boolean created = searchIndex.ensureSchema()
                .retryWhen(Retry.fixedDelay(startup.getIndexAttempts() - 1L, startup.getIndexRetryDelay())
                        .doBeforeRetry(signal -> log.warn("Search index not ready (attempt {}): {}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .block();
        log.info("Search index is ready (created={})", created);

        resultCache.ping()
                .doOnNext(outcome -> {
                    if (outcome.isSucceeded()) {
                        log.info("Result cache is ready");
                    } else {
                        log.warn("Result cache unavailable, retrieval will go to the metadata store", outcome.error());
                    }
                })
                .block();
    }
}
