package org.bacteria.service;

import org.bacteria.configuration.QueryProperties;
import org.bacteria.models.dto.BacteriaPage;
import org.bacteria.models.dto.DatasetStats;
import org.bacteria.models.dto.SearchResult;
import org.bacteria.models.record.NormalizedRecord;
import org.bacteria.repository.BacteriaRepository;
import org.bacteria.support.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BacteriaQueryService")
class BacteriaQueryServiceTest {

    private static final QueryProperties PROPERTIES = new QueryProperties("unused.json", 100, 100);

    private static BacteriaQueryService serviceOver(List<NormalizedRecord> records) {
        return new BacteriaQueryService(new BacteriaRepository(records), PROPERTIES);
    }

    private static List<NormalizedRecord> numbered(int count, String genus) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> TestRecords.normalized(Integer.toString(i), genus, "sp" + i))
                .toList();
    }

    @Nested
    @DisplayName("getPage")
    class GetPage {

        private final BacteriaQueryService service = serviceOver(numbered(25, "Bacillus"));

        @Test
        @DisplayName("slices by one-based page and limit")
        void secondPage() {
            BacteriaPage page = service.getPage(2, 10);

            assertThat(page.total()).isEqualTo(25);
            assertThat(page.page()).isEqualTo(2);
            assertThat(page.limit()).isEqualTo(10);
            assertThat(page.data()).extracting(NormalizedRecord::identifier)
                    .containsExactly("11", "12", "13", "14", "15", "16", "17", "18", "19", "20");
        }

        @Test
        @DisplayName("the last page may be short")
        void lastPage() {
            assertThat(service.getPage(3, 10).data()).hasSize(5);
        }

        @Test
        @DisplayName("a page past the end is empty but keeps the total")
        void beyondEnd() {
            BacteriaPage page = service.getPage(4, 10);

            assertThat(page.data()).isEmpty();
            assertThat(page.total()).isEqualTo(25);
        }

        @Test
        @DisplayName("missing or non-positive parameters use the defaults")
        void defaults() {
            BacteriaPage page = service.getPage(null, null);
            assertThat(page.page()).isEqualTo(1);
            assertThat(page.limit()).isEqualTo(100);
            assertThat(page.data()).hasSize(25);

            BacteriaPage clamped = service.getPage(0, -3);
            assertThat(clamped.page()).isEqualTo(1);
            assertThat(clamped.limit()).isEqualTo(100);
        }

        @Test
        @DisplayName("a very large page does not overflow")
        void hugePage() {
            assertThat(service.getPage(Integer.MAX_VALUE, Integer.MAX_VALUE).data()).isEmpty();
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        private final BacteriaQueryService service = serviceOver(List.of(
                TestRecords.normalized("1", "Bacillus", "subtilis"),
                TestRecords.normalized("2", "Paenibacillus", "polymyxa"),
                TestRecords.normalized("3", "Pseudomonas", "putida"),
                TestRecords.normalized("4", null, null)));

        @Test
        @DisplayName("matches genus case-insensitively as a substring")
        void byGenus() {
            SearchResult result = service.search("BACILL", null);

            assertThat(result.total()).isEqualTo(2);
            assertThat(result.data()).extracting(NormalizedRecord::identifier).containsExactly("1", "2");
        }

        @Test
        @DisplayName("combines genus and species filters")
        void byGenusAndSpecies() {
            assertThat(service.search("bacillus", "SUB").data())
                    .extracting(NormalizedRecord::identifier).containsExactly("1");
        }

        @Test
        @DisplayName("without filters returns everything")
        void noFilters() {
            assertThat(service.search(null, "").total()).isEqualTo(4);
        }

        @Test
        @DisplayName("records without a species never match a species filter")
        void nullFieldsDoNotMatch() {
            assertThat(service.search(null, "a").data())
                    .extracting(NormalizedRecord::identifier).containsExactly("2", "3");
        }

        @Test
        @DisplayName("caps the returned data but reports every match")
        void capsResults() {
            BacteriaQueryService capped = new BacteriaQueryService(
                    new BacteriaRepository(numbered(150, "Bacillus")), PROPERTIES);

            SearchResult result = capped.search("bacillus", null);

            assertThat(result.total()).isEqualTo(150);
            assertThat(result.data()).hasSize(100);
            assertThat(result.data().get(0).identifier()).isEqualTo("1");
        }
    }

    @Test
    @DisplayName("stats count distinct genera and species, a missing value counting once")
    void stats() {
        BacteriaQueryService service = serviceOver(List.of(
                TestRecords.normalized("1", "A", null),
                TestRecords.normalized("2", "A", null),
                TestRecords.normalized("3", "B", null)));

        assertThat(service.getStats()).isEqualTo(new DatasetStats(3, 2, 1));
    }

    @Test
    @DisplayName("an empty dataset answers every query")
    void emptyDataset() {
        BacteriaQueryService service = serviceOver(List.of());

        assertThat(service.getStats()).isEqualTo(new DatasetStats(0, 0, 0));
        assertThat(service.getPage(1, 10).data()).isEmpty();
        assertThat(service.search("a", "b").total()).isZero();
        assertThat(service.findById("1")).isEmpty();
    }
}
