package com.tendersearch.search.service;

import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.consolidation.TenderNormalizer;
import com.tendersearch.search.model.ConsolidatedResult;
import com.tendersearch.search.model.DuplicatePolicy;
import com.tendersearch.search.model.SearchParams;
import com.tendersearch.search.model.SearchRequest;
import com.tendersearch.search.model.SourceApi;
import com.tendersearch.search.model.Tender;
import com.tendersearch.search.source.RawTenderRecord;
import com.tendersearch.search.source.SamRawRecord;
import com.tendersearch.search.source.SourceResponse;
import com.tendersearch.search.source.TedRawRecord;
import com.tendersearch.search.source.TenderSourceAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.tendersearch.fixture.TenderBuilder.aTender;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TenderSearchServiceTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);
    private static final LocalDate FROM = LocalDate.of(2024, 1, 1);
    private static final LocalDate TO = LocalDate.of(2024, 3, 15);

    private ExecutorService executor;
    private SearchProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new SearchProperties();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void duplicateAcrossSourcesKeepsTheFirstSourcesRecord() {
        TenderSourceAdapter ted =
                adapter(SourceApi.TED, SourceResponse.success(List.of(tedRecord("T-1", "Road Maintenance Contract", "City of Springfield"))));
        TenderSourceAdapter sam =
                adapter(
                        SourceApi.SAM,
                        SourceResponse.success(
                                List.of(new SamRawRecord("S-1", "Road Maintenance Contract", null, null, null, "City of Springfield", "USA", null))));

        ConsolidatedResult result =
                service(ted, sam).run("road", FROM, TO, 0, List.of(SourceApi.TED, SourceApi.SAM));

        assertThat(result.tenders()).hasSize(1);
        Tender kept = result.tenders().get(0);
        assertThat(kept.sourceApi()).isEqualTo(SourceApi.TED);
        assertThat(kept.id()).isEqualTo("T-1");
        assertThat(kept.relevanceScore()).isCloseTo(0.8, within(1e-9));
        assertThat(result.errors()).isEmpty();
        assertThat(result.sourceResults()).hasSize(2);
        assertThat(result.statistics().totalCount()).isEqualTo(1);
    }

    @Test
    void failingSourceIsReportedWhileOthersContribute() {
        TenderSourceAdapter ted =
                adapter(
                        SourceApi.TED,
                        SourceResponse.success(
                                List.of(
                                        tedRecord("T-1", "Road A", "Org"),
                                        tedRecord("T-2", "Road B", "Org"),
                                        tedRecord("T-3", "Road C", "Org"))));
        TenderSourceAdapter sam = adapter(SourceApi.SAM, SourceResponse.failure("sam_http_500"));

        ConsolidatedResult result =
                service(ted, sam).run("road", FROM, TO, 0, List.of(SourceApi.TED, SourceApi.SAM));

        assertThat(result.tenders()).hasSize(3);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).source()).isEqualTo(SourceApi.SAM);
        assertThat(result.errors().get(0).message()).isEqualTo("sam_http_500");
        assertThat(result.sourceResults())
                .extracting(r -> r.source().id() + ":" + r.success())
                .containsExactly("ted:true", "sam:false");
    }

    @Test
    void everySourceFailingGivesEmptyResultWithErrors() {
        TenderSourceAdapter ted = adapter(SourceApi.TED, SourceResponse.failure("ted_api_key_missing"));
        TenderSourceAdapter sam = adapter(SourceApi.SAM, SourceResponse.failure("sam_api_key_missing"));

        ConsolidatedResult result =
                service(ted, sam).run("road", FROM, TO, 0, List.of(SourceApi.TED, SourceApi.SAM));

        assertThat(result.tenders()).isEmpty();
        assertThat(result.errors()).hasSize(2);
        assertThat(result.statistics().totalCount()).isZero();
        assertThat(result.statistics().valueStatistics()).isNull();
    }

    @Test
    void adapterExceptionBecomesSourceError() {
        TenderSourceAdapter ted = mock(TenderSourceAdapter.class);
        when(ted.source()).thenReturn(SourceApi.TED);
        when(ted.search(any())).thenThrow(new IllegalStateException("boom"));

        ConsolidatedResult result = service(ted).run("road", FROM, TO, 0, List.of(SourceApi.TED));

        assertThat(result.tenders()).isEmpty();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).message()).isEqualTo("ted_exception: IllegalStateException boom");
    }

    @Test
    void slowSourceTimesOutAndItsWorkerIsInterrupted() throws Exception {
        properties.setSourceTimeoutSeconds(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch released = new CountDownLatch(1);
        TenderSourceAdapter ted = mock(TenderSourceAdapter.class);
        when(ted.source()).thenReturn(SourceApi.TED);
        when(ted.search(any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            } finally {
                released.countDown();
            }
            return SourceResponse.success(List.of());
        });

        ConsolidatedResult result = service(ted).run("road", FROM, TO, 0, List.of(SourceApi.TED));

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).message()).isEqualTo("ted_timeout: no response after 1s");
        assertThat(released.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted).isTrue();
    }

    @Test
    void timeoutIsMeasuredFromWhenTheSourceStartsRunning() {
        executor.shutdownNow();
        executor = Executors.newFixedThreadPool(1);
        properties.setGlobalConcurrency(1);
        properties.setSourceTimeoutSeconds(3);
        TenderSourceAdapter ted = slowAdapter(
            SourceApi.TED, 2_000, tedRecord("T-1", "Road A", "Org"));
        TenderSourceAdapter sam = slowAdapter(
            SourceApi.SAM, 2_000, new SamRawRecord("S-1", "Road B", null, null, null, "Agency", "USA", null));

        ConsolidatedResult result =
                service(ted, sam).run("road", FROM, TO, 0, List.of(SourceApi.TED, SourceApi.SAM));

        assertThat(result.errors()).isEmpty();
        assertThat(result.sourceResults()).allSatisfy(r -> assertThat(r.success()).isTrue());
        assertThat(result.tenders()).extracting(Tender::id).containsExactlyInAnyOrder("T-1", "S-1");
    }

    @Test
    void oversizedAmountFromASourceDegradesToZeroInsteadOfFailingTheRun() {
        TenderSourceAdapter sam = adapter(
            SourceApi.SAM,
            SourceResponse.success(List.of(
                new SamRawRecord("S-1", "Road A", null, null, "1000", "Agency", "USA", null),
                new SamRawRecord("S-2", "Road B", null, null, "1e999999999", "Agency", "USA", null))));

        ConsolidatedResult result = service(sam).run("road", FROM, TO, 0, List.of(SourceApi.SAM));

        assertThat(result.errors()).isEmpty();
        assertThat(result.tenders()).hasSize(2);
        assertThat(result.statistics().valueStatistics().total()).isEqualByComparingTo("1000");
        assertThat(result.statistics().valueStatistics().countWithValue()).isEqualTo(1);
    }

    @Test
    void degradedRecordsAreKeptAndCounted() {
        TenderSourceAdapter ted =
                adapter(
                        SourceApi.TED,
                        SourceResponse.success(
                                List.of(
                                        tedRecord("T-1", "Road A", "Org"),
                                        new SamRawRecord("S-1", "Wrong source", null, null, null, null, null, null))));

        ConsolidatedResult result = service(ted).run("road", FROM, TO, 0, List.of(SourceApi.TED));

        assertThat(result.tenders()).hasSize(2);
        assertThat(result.statistics().degradedCount()).isEqualTo(1);
        assertThat(result.sourceResults().get(0).rawCount()).isEqualTo(2);
    }

    @Test
    void metadataDescribesTheSearch() {
        TenderSourceAdapter ted = adapter(SourceApi.TED, SourceResponse.success(List.of()));

        ConsolidatedResult result = service(ted).run("  road  ", FROM, TO, 500, List.of(SourceApi.TED));

        assertThat(result.searchMetadata().searchId()).isEqualTo("search_20240315_103000");
        assertThat(result.searchMetadata().searchTerm()).isEqualTo("road");
        assertThat(result.searchMetadata().apisUsed()).containsExactly(SourceApi.TED);
        assertThat(result.searchMetadata().minValue()).isEqualTo(500);
        assertThat(result.searchMetadata().searchTimestamp()).isEqualTo(CLOCK.instant());
    }

    @Test
    void equalRelevanceOrdersByLaterPublishDateWithUndatedLast() {
        Tender older = aTender().title("Road A").description("road").publishDate("2024-01-10").build();
        Tender newer = aTender().title("Road B").description("road").publishDate("2024-03-01").build();
        Tender undated = aTender().title("Road C").description("road").publishDate(null).build();
        Tender unrelated = aTender().title("Catering").description("").publishDate("2024-03-10").build();

        List<Tender> result =
                TenderSearchService.consolidate(
                        List.of(older, undated, unrelated, newer), "road", DuplicatePolicy.FIRST_SEEN);

        assertThat(result).extracting(Tender::title).containsExactly("Road B", "Road A", "Road C", "Catering");
        assertThat(result.get(0).relevanceScore()).isCloseTo(0.8, within(1e-9));
        assertThat(result.get(3).relevanceScore()).isZero();
    }

    @Test
    void searchFillsDefaultsFromConfigurationAndClock() {
        properties.setDefaultSources(List.of("sam", "ted"));
        properties.setDefaultLookbackDays(30);
        TenderSourceAdapter ted = adapter(SourceApi.TED, SourceResponse.success(List.of()));
        TenderSourceAdapter sam = adapter(SourceApi.SAM, SourceResponse.success(List.of()));

        ConsolidatedResult result =
                service(ted, sam).search(new SearchRequest("road", null, null, null, null));

        assertThat(result.searchMetadata().apisUsed()).containsExactly(SourceApi.SAM, SourceApi.TED);
        assertThat(result.searchMetadata().dateTo()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(result.searchMetadata().dateFrom()).isEqualTo(LocalDate.of(2024, 2, 14));
        assertThat(result.searchMetadata().minValue()).isZero();

        ArgumentCaptor<SearchParams> params = ArgumentCaptor.forClass(SearchParams.class);
        verify(ted).search(params.capture());
        assertThat(params.getValue().searchTerm()).isEqualTo("road");
        assertThat(params.getValue().dateFrom()).isEqualTo(LocalDate.of(2024, 2, 14));
    }

    @Test
    void searchRejectsUnknownSourceId() {
        TenderSourceAdapter ted = mock(TenderSourceAdapter.class);
        when(ted.source()).thenReturn(SourceApi.TED);

        assertThatThrownBy(
                        () -> service(ted).search(new SearchRequest("road", List.of("ted", "ebay"), null, null, null)))
                .isInstanceOf(InvalidSearchRequestException.class)
                .hasMessageContaining("ebay");
        verify(ted, never()).search(any());
    }

    @Test
    void runValidatesItsArguments() {
        TenderSourceAdapter ted = mock(TenderSourceAdapter.class);
        when(ted.source()).thenReturn(SourceApi.TED);
        TenderSearchService service = service(ted);
        List<SourceApi> sources = List.of(SourceApi.TED);

        assertThatThrownBy(() -> service.run("  ", FROM, TO, 0, sources))
                .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.run("road", TO, FROM, 0, sources))
                .isInstanceOf(InvalidSearchRequestException.class)
                .hasMessageContaining("after");
        assertThatThrownBy(() -> service.run("road", FROM, TO, -1, sources))
                .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.run("road", FROM, TO, 0, List.of()))
                .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.run("road", FROM, TO, 0, List.of(SourceApi.SAM)))
                .isInstanceOf(InvalidSearchRequestException.class)
                .hasMessageContaining("sam");
        verify(ted, never()).search(any());
    }

    @Test
    void availableSourcesListsRegisteredAdapters() {
        TenderSourceAdapter sam = mock(TenderSourceAdapter.class);
        when(sam.source()).thenReturn(SourceApi.SAM);
        TenderSourceAdapter ted = mock(TenderSourceAdapter.class);
        when(ted.source()).thenReturn(SourceApi.TED);

        assertThat(service(sam, ted).availableSources()).containsExactly(SourceApi.TED, SourceApi.SAM);
    }

    private TenderSearchService service(TenderSourceAdapter... adapters) {
        return new TenderSearchService(List.of(adapters), new TenderNormalizer(), executor, properties, CLOCK);
    }

    private static TenderSourceAdapter slowAdapter(SourceApi source, long delayMillis, RawTenderRecord record) {
        TenderSourceAdapter adapter = mock(TenderSourceAdapter.class);
        when(adapter.source()).thenReturn(source);
        when(adapter.search(any())).thenAnswer(invocation -> {
            Thread.sleep(delayMillis);
            return SourceResponse.success(List.of(record));
        });
        return adapter;
    }

    private static TenderSourceAdapter adapter(SourceApi source, SourceResponse response) {
        TenderSourceAdapter adapter = mock(TenderSourceAdapter.class);
        when(adapter.source()).thenReturn(source);
        when(adapter.search(any())).thenReturn(response);
        return adapter;
    }

    private static RawTenderRecord tedRecord(String id, String title, String authority) {
        return new TedRawRecord(
                List.of(id),
                List.of(title),
                List.of("2024-02-01"),
                List.of(),
                List.of("1000"),
                List.of("EUR"),
                List.of("DE"),
                List.of(),
                List.of(authority));
    }
}
