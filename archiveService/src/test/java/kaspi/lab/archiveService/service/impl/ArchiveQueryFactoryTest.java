package kaspi.lab.archiveService.service.impl;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.MultiMatchQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.RangeQuery;
import kaspi.lab.archiveService.dto.SearchCriteria;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.elasticsearch.client.elc.NativeQuery;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveQueryFactoryTest {

    private final ArchiveQueryFactory factory = new ArchiveQueryFactory();

    @Test
    void everySearchIsScopedToOwner() {
        NativeQuery query = factory.search(SearchCriteria.builder().ownerId("alice").size(20).build());

        BoolQuery bool = query.getQuery().bool();
        assertEquals(1, bool.filter().size());
        assertOwnerTerm(bool.filter().get(0), "alice");
        assertTrue(bool.must().isEmpty());
    }

    @Test
    void textSearchIsFuzzyOverNamesTypeAndTags() {
        NativeQuery query = factory.search(SearchCriteria.builder().ownerId("alice").text(" quarterly ").size(20).build());

        MultiMatchQuery multiMatch = query.getQuery().bool().must().get(0).multiMatch();
        assertEquals("quarterly", multiMatch.query());
        assertEquals("AUTO", multiMatch.fuzziness());
        assertEquals(List.of("filename", "original_filename", "content_type", "tags"), multiMatch.fields());
    }

    @Test
    void tagsBecomeTermsFilter() {
        NativeQuery query = factory.search(SearchCriteria.builder()
                .ownerId("alice").tags(List.of("report", "invoice")).size(20).build());

        List<FieldValue> values = query.getQuery().bool().filter().get(1).terms().terms().value();
        assertEquals(List.of("report", "invoice"), values.stream().map(FieldValue::stringValue).toList());
        assertEquals("tags", query.getQuery().bool().filter().get(1).terms().field());
    }

    @Test
    void dateRangeCoversWholeEndDayInUtc() {
        NativeQuery query = factory.search(SearchCriteria.builder()
                .ownerId("alice")
                .startDate(LocalDate.of(2024, 3, 1))
                .endDate(LocalDate.of(2024, 3, 31))
                .size(20)
                .build());

        RangeQuery range = query.getQuery().bool().filter().get(1).range();
        assertEquals("archived_at", range.field());
        assertEquals("2024-03-01T00:00:00Z", range.gte().to(String.class));
        assertEquals("2024-04-01T00:00:00Z", range.lt().to(String.class));
    }

    @Test
    void openEndedRangeHasSingleBound() {
        NativeQuery query = factory.search(SearchCriteria.builder()
                .ownerId("alice").startDate(LocalDate.of(2024, 3, 1)).size(20).build());

        RangeQuery range = query.getQuery().bool().filter().get(1).range();
        assertNull(range.lt());
    }

    @Test
    void resultsAreNewestFirst() {
        NativeQuery query = factory.search(SearchCriteria.builder().ownerId("alice").size(7).build());

        assertEquals(7, query.getPageable().getPageSize());
        Sort.Order order = query.getPageable().getSort().getOrderFor("archivedAt");
        assertTrue(order != null && order.isDescending());
    }

    @Test
    void statsAggregatesSizeAndLatestUploadWithoutHits() {
        NativeQuery query = factory.stats("alice");

        assertOwnerTerm(query.getQuery().bool().filter().get(0), "alice");
        assertEquals("size", query.getAggregations().get(ArchiveQueryFactory.TOTAL_BYTES).sum().field());
        assertEquals("archived_at", query.getAggregations().get(ArchiveQueryFactory.LAST_UPLOAD).max().field());
        assertEquals(Integer.valueOf(0), query.getMaxResults());
        assertTrue(query.getTrackTotalHits());
    }

    private static void assertOwnerTerm(Query filter, String ownerId) {
        assertEquals("owner_id", filter.term().field());
        assertEquals(ownerId, filter.term().value().stringValue());
    }
}
