package kaspi.lab.archiveService.service.impl;

import co.elastic.clients.elasticsearch._types.aggregations.Aggregate;
import kaspi.lab.archiveService.domain.ArchiveDocument;
import kaspi.lab.archiveService.dto.SearchCriteria;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.dto.response.ArchiveStats;
import kaspi.lab.archiveService.dto.response.SearchResult;
import kaspi.lab.archiveService.exception.IndexWriteException;
import kaspi.lab.archiveService.mapper.ArchiveMapper;
import kaspi.lab.archiveService.service.SearchIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchAggregation;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchAggregations;
import org.springframework.data.elasticsearch.core.AggregationsContainer;
import org.springframework.data.elasticsearch.core.ReactiveElasticsearchOperations;
import org.springframework.data.elasticsearch.core.ReactiveIndexOperations;
import org.springframework.data.elasticsearch.core.ReactiveSearchHits;
import org.springframework.data.elasticsearch.core.SearchHit;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class ElasticsearchSearchIndex implements SearchIndex {

    private final ReactiveElasticsearchOperations operations;
    private final ArchiveQueryFactory queryFactory;
    private final ArchiveMapper archiveMapper;

    @Override
    public Mono<Boolean> ensureSchema() {
        ReactiveIndexOperations indexOps = operations.indexOps(ArchiveDocument.class);
        return indexOps.exists()
                .flatMap(exists -> {
                    if (exists) {
                        log.debug("Index '{}' already exists", ArchiveDocument.INDEX_NAME);
                        return Mono.just(false);
                    }
                    return indexOps.createWithMapping()
                            .doOnNext(created -> log.info("Created index '{}' with mapping", ArchiveDocument.INDEX_NAME))
                            .thenReturn(true);
                });
    }

    @Override
    public Mono<Void> index(ArchiveRecord record) {
        return operations.save(archiveMapper.toDocument(record))
                .doOnNext(saved -> log.debug("Indexed file_id={}", saved.getFileId()))
                .onErrorMap(e -> new IndexWriteException(record.fileId(), e))
                .then();
    }

    @Override
    public Mono<SearchResult> search(SearchCriteria criteria) {
        return operations.searchForHits(queryFactory.search(criteria), ArchiveDocument.class)
                .flatMap(hits -> hits.getSearchHits()
                        .map(SearchHit::getContent)
                        .map(archiveMapper::fromDocument)
                        .collectList()
                        .map(results -> new SearchResult(hits.getTotalHits(), results)));
    }

    @Override
    public Mono<ArchiveStats> aggregateStats(String ownerId) {
        return operations.searchForHits(queryFactory.stats(ownerId), ArchiveDocument.class)
                .map(this::toStats);
    }

    private ArchiveStats toStats(ReactiveSearchHits<ArchiveDocument> hits) {
        long total = hits.getTotalHits();
        if (total == 0) {
            return new ArchiveStats(0, 0, null);
        }
        Aggregate sum = aggregate(hits.getAggregations(), ArchiveQueryFactory.TOTAL_BYTES);
        Aggregate max = aggregate(hits.getAggregations(), ArchiveQueryFactory.LAST_UPLOAD);

        long totalBytes = sum != null && sum.isSum() && present(sum.sum().value()) ? (long) sum.sum().value() : 0L;
        // max over no values comes back as null, -Infinity or 0 depending on the client decoder
        Instant lastUpload = max != null && max.isMax() && present(max.max().value()) && max.max().value() > 0
                ? Instant.ofEpochMilli((long) max.max().value())
                : null;
        return new ArchiveStats(total, totalBytes, lastUpload);
    }

    private static boolean present(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    private static Aggregate aggregate(AggregationsContainer<?> container, String name) {
        if (!(container instanceof ElasticsearchAggregations aggregations)) {
            return null;
        }
        ElasticsearchAggregation aggregation = aggregations.aggregationsAsMap().get(name);
        return aggregation != null ? aggregation.aggregation().getAggregate() : null;
    }
}
