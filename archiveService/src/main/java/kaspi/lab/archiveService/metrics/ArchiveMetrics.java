package kaspi.lab.archiveService.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class ArchiveMetrics {

    // exported by the Prometheus registry as files_archived_total
    public static final String FILES_ARCHIVED = "files.archived";

    private final Counter filesArchived;

    public ArchiveMetrics(MeterRegistry registry) {
        this.filesArchived = Counter.builder(FILES_ARCHIVED)
                .description("Total number of files archived")
                .register(registry);
    }

    public void recordArchived() {
        filesArchived.increment();
    }
}
