package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.classify.SepticWellClassifier;
import com.ruralhome.listingtracker.scrape.graphql.ListingDetailFetcher;
import com.ruralhome.listingtracker.scrape.graphql.ListingSearchClient;
import com.ruralhome.listingtracker.scrape.http.ListingHttpClient;
import com.ruralhome.listingtracker.scrape.model.Candidate;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.RunState;
import com.ruralhome.listingtracker.scrape.model.RunStats;
import com.ruralhome.listingtracker.scrape.model.ScrapeRunRequest;
import com.ruralhome.listingtracker.scrape.model.ScrapeRunSummary;
import com.ruralhome.listingtracker.scrape.model.SearchResult;
import com.ruralhome.listingtracker.scrape.notify.RunNotifier;
import com.ruralhome.listingtracker.scrape.persistence.ScrapeRunJdbcRepository;
import com.ruralhome.listingtracker.scrape.support.InMemoryListingStore;
import com.ruralhome.listingtracker.scrape.support.ListingFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeRunOrchestratorTest {

    @Mock
    private ListingSearchClient searchClient;

    @Mock
    private ScrapeRunJdbcRepository runRepository;

    @Mock
    private RunNotifier notifier;

    private ExecutorService detailExecutor;
    private ExecutorService writerExecutor;
    private InMemoryListingStore store;
    private ScraperProperties properties;

    @BeforeEach
    void setUp() {
        detailExecutor = Executors.newFixedThreadPool(4);
        writerExecutor = Executors.newSingleThreadExecutor();
        store = new InMemoryListingStore();
        properties = new ScraperProperties();
        properties.getSearch().setPartitions(List.of("Kenosha"));
        properties.getSearch().setPartitionDelayMs(0);
        properties.setMaxConcurrentDetails(2);
        lenient().when(runRepository.insertRun(any(), anyList())).thenReturn(7L);
    }

    @AfterEach
    void tearDown() {
        detailExecutor.shutdownNow();
        writerExecutor.shutdownNow();
    }

    @Test
    void duplicateAndAbsentDetailStillPersistTwoListings() {
        Candidate a = ListingFixtures.candidate("A");
        Candidate b = ListingFixtures.candidate("B");
        when(searchClient.search(eq("Kenosha"), any(), anyInt()))
            .thenReturn(SearchResult.of("Kenosha", List.of(a, a, b)));
        ListingDetailFetcher fetcher = propertyId -> "A".equals(propertyId)
            ? Optional.of(ListingFixtures.detail("A", "Sewer: Septic"))
            : Optional.empty();

        ScrapeRunSummary summary = orchestrator(fetcher).run(ScrapeRunRequest.defaults());

        assertThat(summary.state()).isEqualTo(RunState.COMPLETED);
        assertThat(summary.stats().getTotalProcessed()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(2);
        assertThat(summary.records()).hasSize(2);
        assertThat(summary.newsworthy()).extracting(ListingRecord::propertyId).containsExactly("A");
        assertThat(summary.stats().getCompletedAt()).isNotNull();
        assertThat(summary.stats().getErrors()).isEmpty();
        verify(runRepository).completeRun(7L, RunState.COMPLETED, summary.stats());
        verify(notifier).reportSuccess(eq(summary.stats()), anyList(), anyList());
        verify(notifier, never()).reportFailure(anyString());
    }

    @Test
    void searchExceptionFailsRunAndNotifiesOnce() {
        properties.getSearch().setPartitions(List.of("Kenosha", "Racine", "Walworth"));
        when(searchClient.search(anyString(), any(), anyInt())).thenThrow(new IllegalStateException("search down"));

        ScrapeRunSummary summary = orchestrator(propertyId -> Optional.empty()).run(ScrapeRunRequest.defaults());

        RunStats stats = summary.stats();
        assertThat(summary.state()).isEqualTo(RunState.FAILED);
        assertThat(stats.getErrors()).isNotEmpty();
        assertThat(stats.getErrors().get(0)).contains("search down");
        assertThat(stats.getCompletedAt()).isNotNull();
        verify(notifier, times(1)).reportFailure(anyString());
        verify(notifier, never()).reportSuccess(any(), anyList(), anyList());
        verify(runRepository).completeRun(7L, RunState.FAILED, stats);
    }

    @Test
    void softSearchFailureIsRecordedButRunCompletes() {
        properties.getSearch().setPartitions(List.of("Kenosha", "Racine"));
        when(searchClient.search(eq("Kenosha"), any(), anyInt()))
            .thenReturn(SearchResult.of("Kenosha", List.of(ListingFixtures.candidate("K1"))));
        when(searchClient.search(eq("Racine"), any(), anyInt()))
            .thenReturn(SearchResult.failure("Racine", "http_503", null));

        ScrapeRunSummary summary = orchestrator(propertyId -> Optional.empty()).run(ScrapeRunRequest.defaults());

        assertThat(summary.state()).isEqualTo(RunState.COMPLETED);
        assertThat(summary.records()).hasSize(1);
        assertThat(summary.stats().getErrors()).containsExactly("search Racine: http_503");
    }

    @Test
    void notifierFailureDoesNotFailRun() {
        when(searchClient.search(eq("Kenosha"), any(), anyInt()))
            .thenReturn(SearchResult.of("Kenosha", List.of(ListingFixtures.candidate("N1"))));
        doThrow(new RuntimeException("smtp down")).when(notifier).reportSuccess(any(), anyList(), anyList());

        ScrapeRunSummary summary = orchestrator(propertyId -> Optional.empty()).run(ScrapeRunRequest.defaults());

        assertThat(summary.state()).isEqualTo(RunState.COMPLETED);
        verify(notifier, never()).reportFailure(anyString());
    }

    @Test
    void unreachableStoreFailsBeforeSearching() {
        store.setReachable(false);

        ScrapeRunSummary summary = orchestrator(propertyId -> Optional.empty()).run(ScrapeRunRequest.defaults());

        assertThat(summary.state()).isEqualTo(RunState.FAILED);
        assertThat(summary.runId()).isNull();
        assertThat(summary.stats().getErrors()).containsExactly("Listing store is not reachable");
        verifyNoInteractions(searchClient);
        verify(notifier).reportFailure("Listing store is not reachable");
    }

    @Test
    void requestPartitionsOverrideConfiguredOnes() {
        when(searchClient.search(eq("Waukesha"), any(), eq(50)))
            .thenReturn(SearchResult.of("Waukesha", List.of()));

        ScrapeRunSummary summary = orchestrator(propertyId -> Optional.empty())
            .run(new ScrapeRunRequest(List.of("Waukesha"), 0, 50));

        assertThat(summary.state()).isEqualTo(RunState.COMPLETED);
        ArgumentCaptor<String> partition = ArgumentCaptor.forClass(String.class);
        verify(searchClient).search(partition.capture(), eq(null), eq(50));
        assertThat(partition.getValue()).isEqualTo("Waukesha");
    }

    @Test
    void secondCallerIsRejectedWhileFirstRunContinues() throws Exception {
        CountDownLatch searching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(searchClient.search(eq("Kenosha"), any(), anyInt())).thenAnswer(invocation -> {
            searching.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return SearchResult.of("Kenosha", List.of(ListingFixtures.candidate("C1")));
        });
        ScrapeRunOrchestrator orchestrator = orchestrator(propertyId -> Optional.empty());
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<ScrapeRunSummary> firstRun = caller.submit(() -> orchestrator.run(ScrapeRunRequest.defaults()));
            assertTrue(searching.await(5, TimeUnit.SECONDS));

            assertThrows(ActiveScrapeRunException.class, () -> orchestrator.run(ScrapeRunRequest.defaults()));
            assertThat(orchestrator.currentState()).isEqualTo(RunState.SEARCHING);

            release.countDown();
            ScrapeRunSummary summary = firstRun.get(10, TimeUnit.SECONDS);
            assertThat(summary.state()).isEqualTo(RunState.COMPLETED);
            assertThat(summary.records()).hasSize(1);
            assertThat(summary.stats().getErrors()).isEmpty();
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
        verify(searchClient, times(1)).search(anyString(), any(), anyInt());
    }

    @Test
    void deadlineFailsRunAndSkipsUnstartedListings() {
        properties.getRun().setMaxDurationSeconds(1);
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            candidates.add(ListingFixtures.candidate("D" + i));
        }
        when(searchClient.search(eq("Kenosha"), any(), anyInt()))
            .thenReturn(SearchResult.of("Kenosha", candidates));
        ListingDetailFetcher slowFetcher = propertyId -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.empty();
        };

        ScrapeRunSummary summary = orchestrator(slowFetcher).run(ScrapeRunRequest.defaults());

        RunStats stats = summary.stats();
        assertThat(summary.state()).isEqualTo(RunState.FAILED);
        assertThat(stats.getErrors()).anySatisfy(error -> assertThat(error).startsWith("Run deadline"));
        assertThat(stats.getSkippedCount()).isPositive();
        assertThat(stats.getCompletedAt()).isNotNull();
        assertThat(store.size()).isLessThan(20);
        verify(notifier, times(1)).reportFailure(anyString());
        verify(notifier, never()).reportSuccess(any(), anyList(), anyList());
    }

    @Test
    void partitionsAreSearchedWithDelayBetweenThem() {
        properties.getSearch().setPartitions(List.of("Kenosha", "Racine"));
        properties.getSearch().setPartitionDelayMs(150);
        List<Long> callTimes = Collections.synchronizedList(new ArrayList<>());
        when(searchClient.search(anyString(), any(), anyInt())).thenAnswer(invocation -> {
            callTimes.add(System.nanoTime());
            return SearchResult.of(invocation.getArgument(0), List.of());
        });

        ScrapeRunSummary summary = orchestrator(propertyId -> Optional.empty()).run(ScrapeRunRequest.defaults());

        assertThat(summary.state()).isEqualTo(RunState.COMPLETED);
        assertThat(callTimes).hasSize(2);
        long gapMs = TimeUnit.NANOSECONDS.toMillis(callTimes.get(1) - callTimes.get(0));
        assertThat(gapMs).isGreaterThanOrEqualTo(150);
    }

    @Test
    void singlePartitionDoesNotWait() {
        properties.getSearch().setPartitionDelayMs(3000);
        when(searchClient.search(eq("Kenosha"), any(), anyInt()))
            .thenReturn(SearchResult.of("Kenosha", List.of()));

        long started = System.nanoTime();
        ScrapeRunSummary summary = orchestrator(propertyId -> Optional.empty()).run(ScrapeRunRequest.defaults());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(summary.state()).isEqualTo(RunState.COMPLETED);
        assertThat(elapsedMs).isLessThan(3000);
    }

    private ScrapeRunOrchestrator orchestrator(ListingDetailFetcher fetcher) {
        EnrichmentCoordinator coordinator = new EnrichmentCoordinator(
            fetcher,
            new SepticWellClassifier(),
            new AgentProfileService(store, mock(ListingHttpClient.class), properties),
            new ListingRecordAssembler(properties),
            store,
            store,
            detailExecutor,
            writerExecutor,
            properties
        );
        return new ScrapeRunOrchestrator(
            searchClient,
            new CandidateDeduplicator(),
            coordinator,
            new NewsworthyFilter(properties),
            store,
            runRepository,
            notifier,
            properties
        );
    }
}
