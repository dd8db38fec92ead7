package kaspi.lab.archiveService.service.impl;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.aggregations.Aggregation;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.json.JsonData;
import kaspi.lab.archiveService.domain.ArchiveDocument;
import kaspi.lab.archiveService.dto.SearchCriteria;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.elasticsearch.client.elc.NativeQuery;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@Component
public class ArchiveQueryFactory {

    static final String TOTAL_BYTES = "total_bytes";
    static final String LAST_UPLOAD = "last_upload";

    static final List<String> TEXT_FIELDS = List.of("filename", "original_filename", "content_type", ArchiveDocument.TAGS);

    public NativeQuery search(SearchCriteria criteria) {
        return NativeQuery.builder()
                .withQuery(filter(criteria))
                .withPageable(PageRequest.of(0, criteria.size(), Sort.by(Sort.Direction.DESC, "archivedAt")))
                .withTrackTotalHits(true)
                .build();
    }

    public NativeQuery stats(String ownerId) {
        return NativeQuery.builder()
                .withQuery(ownerOnly(ownerId))
                .withAggregation(TOTAL_BYTES, Aggregation.of(a -> a.sum(s -> s.field(ArchiveDocument.SIZE))))
                .withAggregation(LAST_UPLOAD, Aggregation.of(a -> a.max(m -> m.field(ArchiveDocument.ARCHIVED_AT))))
                .withMaxResults(0)
                .withTrackTotalHits(true)
                .build();
    }

    Query filter(SearchCriteria criteria) {
        BoolQuery.Builder bool = new BoolQuery.Builder();
        bool.filter(ownerTerm(criteria.ownerId()));

        if (criteria.text() != null && !criteria.text().isBlank()) {
            bool.must(m -> m.multiMatch(mm -> mm
                    .query(criteria.text().trim())
                    .fields(TEXT_FIELDS)
                    .fuzziness("AUTO")));
        }

        if (criteria.tags() != null && !criteria.tags().isEmpty()) {
            List<FieldValue> values = criteria.tags().stream().map(FieldValue::of).toList();
            bool.filter(f -> f.terms(t -> t
                    .field(ArchiveDocument.TAGS)
                    .terms(v -> v.value(values))));
        }

        if (criteria.startDate() != null || criteria.endDate() != null) {
            bool.filter(f -> f.range(r -> {
                r.field(ArchiveDocument.ARCHIVED_AT);
                if (criteria.startDate() != null) {
                    r.gte(JsonData.of(startOfDay(criteria.startDate())));
                }
                if (criteria.endDate() != null) {
                    r.lt(JsonData.of(startOfDay(criteria.endDate().plusDays(1))));
                }
                return r;
            }));
        }

        return Query.of(q -> q.bool(bool.build()));
    }

    private Query ownerOnly(String ownerId) {
        return Query.of(q -> q.bool(b -> b.filter(ownerTerm(ownerId))));
    }

    private Query ownerTerm(String ownerId) {
        return Query.of(q -> q.term(t -> t.field(ArchiveDocument.OWNER_ID).value(ownerId)));
    }

    private static String startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toString();
    }
}
