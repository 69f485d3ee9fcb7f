package com.patentintel.status.service;

import com.patentintel.status.cache.PatentCacheStore;
import com.patentintel.status.config.LookupConfig;
import com.patentintel.status.exception.CacheUnavailableException;
import com.patentintel.status.exception.PatentNotFoundException;
import com.patentintel.status.exception.ServiceDegradedException;
import com.patentintel.status.exception.UpstreamUnavailableException;
import com.patentintel.status.model.CacheEntry;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.LookupPath;
import com.patentintel.status.model.LookupResult;
import com.patentintel.status.model.PatentRecord;
import com.patentintel.status.model.PatentSource;
import com.patentintel.status.model.PatentStatus;
import com.patentintel.status.source.FetchResult;
import com.patentintel.status.source.SourceAdapter;
import com.patentintel.status.source.SourceRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PatentLookupServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    @Mock
    private PatentCacheStore cache;
    @Mock
    private SourceRouter router;
    @Mock
    private SourceAdapter epo;
    @Mock
    private SourceAdapter uspto;

    private PatentLookupService service;

    @BeforeEach
    void setUp() {
        lenient().when(epo.source()).thenReturn(PatentSource.EPO);
        lenient().when(uspto.source()).thenReturn(PatentSource.USPTO);
        service = new PatentLookupService(cache, router, LookupConfig.missRetry(Duration.ofMillis(1)),
                Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofDays(30));
    }

    @Test
    void freshHitIsServedWithoutCallingUpstream() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "1234567");
        PatentRecord cached = record(id, PatentStatus.EXPIRED, LocalDate.of(2021, 11, 4), PatentSource.EPO,
                NOW.minus(Duration.ofDays(5)));
        when(cache.get(id)).thenReturn(Optional.of(new CacheEntry(cached, 7, NOW.minus(Duration.ofDays(5)))));

        LookupResult result = service.lookup(id);

        assertThat(result.path()).isEqualTo(LookupPath.HIT_FRESH);
        assertThat(result.cacheHit()).isTrue();
        assertThat(result.degraded()).isFalse();
        assertThat(result.record().status()).isEqualTo(PatentStatus.EXPIRED);
        assertThat(result.record().expiryDate()).isEqualTo(LocalDate.of(2021, 11, 4));
        verify(cache).recordRead(id);
        verifyNoInteractions(router);
    }

    @Test
    void coldMissUsesTheUsptoAdapterOnlyAndWritesBack() {
        CanonicalIdentifier id = CanonicalIdentifier.of("US", "10000000");
        PatentRecord fetched = record(id, PatentStatus.GRANTED, LocalDate.of(2035, 3, 11), PatentSource.USPTO, NOW);
        when(cache.get(id)).thenReturn(Optional.empty());
        when(router.adapterFor(id)).thenReturn(uspto);
        when(uspto.fetch(id)).thenReturn(FetchResult.success(fetched));

        LookupResult result = service.lookup(id);

        assertThat(result.path()).isEqualTo(LookupPath.MISS);
        assertThat(result.cacheHit()).isFalse();
        assertThat(result.record().source()).isEqualTo(PatentSource.USPTO);
        verify(cache).put(id, fetched);
        verify(uspto, times(1)).fetch(id);
        verifyNoInteractions(epo);
    }

    @Test
    void staleEntryIsServedDegradedWhenRefreshFails() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "9999999");
        Instant lastFetched = NOW.minus(Duration.ofDays(45));
        PatentRecord stale = record(id, PatentStatus.GRANTED, LocalDate.of(2030, 1, 1), PatentSource.EPO, lastFetched);
        when(cache.get(id)).thenReturn(Optional.of(new CacheEntry(stale, 12, lastFetched)));
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id)).thenReturn(FetchResult.transientFailure("HTTP 503"));

        LookupResult result = service.lookup(id);

        assertThat(result.path()).isEqualTo(LookupPath.STALE_DEGRADED);
        assertThat(result.cacheHit()).isTrue();
        assertThat(result.degraded()).isTrue();
        assertThat(result.record()).isEqualTo(stale);
        verify(epo, times(1)).fetch(id);
        verify(cache, never()).put(any(), any());
    }

    @Test
    void staleEntryIsServedDegradedOnAuthFailure() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "9999999");
        Instant lastFetched = NOW.minus(Duration.ofDays(45));
        PatentRecord stale = record(id, PatentStatus.GRANTED, LocalDate.of(2030, 1, 1), PatentSource.EPO, lastFetched);
        when(cache.get(id)).thenReturn(Optional.of(new CacheEntry(stale, 1, lastFetched)));
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id)).thenReturn(FetchResult.authFailure("HTTP 401"));

        assertThat(service.lookup(id).degraded()).isTrue();
    }

    @Test
    void staleEntryIsRefreshedWhenUpstreamAnswers() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "9999999");
        Instant lastFetched = NOW.minus(Duration.ofDays(45));
        PatentRecord stale = record(id, PatentStatus.GRANTED, LocalDate.of(2030, 1, 1), PatentSource.EPO, lastFetched);
        PatentRecord fresh = record(id, PatentStatus.GRANTED, LocalDate.of(2030, 1, 1), PatentSource.EPO, NOW);
        when(cache.get(id)).thenReturn(Optional.of(new CacheEntry(stale, 2, lastFetched)));
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id)).thenReturn(FetchResult.success(fresh));

        LookupResult result = service.lookup(id);

        assertThat(result.path()).isEqualTo(LookupPath.STALE_REFRESHED);
        assertThat(result.cacheHit()).isTrue();
        assertThat(result.degraded()).isFalse();
        assertThat(result.record().fetchedAt()).isEqualTo(NOW);
        verify(cache).put(id, fresh);
    }

    @Test
    void notFoundIsNeverCached() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "0000001");
        when(cache.get(id)).thenReturn(Optional.empty());
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id)).thenReturn(FetchResult.notFound("HTTP 404"));

        assertThatThrownBy(() -> service.lookup(id))
                .isInstanceOf(PatentNotFoundException.class)
                .hasMessageContaining("EP0000001");

        verify(epo, times(1)).fetch(id);
        verify(cache, never()).put(any(), any());
    }

    @Test
    void transientMissIsRetriedOnceThenFails() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "7654321");
        when(cache.get(id)).thenReturn(Optional.empty());
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id)).thenReturn(FetchResult.transientFailure("HTTP 503"));

        assertThatThrownBy(() -> service.lookup(id))
                .isInstanceOf(UpstreamUnavailableException.class)
                .satisfies(e -> assertThat(((UpstreamUnavailableException) e).outcomeCode()).isEqualTo(503));

        verify(epo, times(2)).fetch(id);
        verify(cache, never()).put(any(), any());
    }

    @Test
    void transientMissRecoversOnRetry() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "7654321");
        PatentRecord fetched = record(id, PatentStatus.UNKNOWN, null, PatentSource.EPO, NOW);
        when(cache.get(id)).thenReturn(Optional.empty());
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id))
                .thenReturn(FetchResult.transientFailure("timeout"))
                .thenReturn(FetchResult.success(fetched));

        LookupResult result = service.lookup(id);

        assertThat(result.path()).isEqualTo(LookupPath.MISS);
        verify(epo, times(2)).fetch(id);
        verify(cache).put(id, fetched);
    }

    @Test
    void authFailureOnMissIsServiceDegraded() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "7654321");
        when(cache.get(id)).thenReturn(Optional.empty());
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id)).thenReturn(FetchResult.authFailure("HTTP 403"));

        assertThatThrownBy(() -> service.lookup(id)).isInstanceOf(ServiceDegradedException.class);
        verify(epo, times(1)).fetch(id);
    }

    @Test
    void unreadableCacheFallsBackToUpstreamAndSkipsTheWrite() {
        CanonicalIdentifier id = CanonicalIdentifier.of("US", "7654321");
        PatentRecord fetched = record(id, PatentStatus.GRANTED, LocalDate.of(2030, 5, 1), PatentSource.USPTO, NOW);
        when(cache.get(id)).thenThrow(new CacheUnavailableException("down", null));
        when(router.adapterFor(id)).thenReturn(uspto);
        when(uspto.fetch(id)).thenReturn(FetchResult.success(fetched));

        LookupResult result = service.lookup(id);

        assertThat(result.record()).isEqualTo(fetched);
        verify(cache, never()).put(any(), any());
    }

    @Test
    void failedCacheWriteStillReturnsTheFetchedRecord() {
        CanonicalIdentifier id = CanonicalIdentifier.of("US", "7654321");
        PatentRecord fetched = record(id, PatentStatus.GRANTED, LocalDate.of(2030, 5, 1), PatentSource.USPTO, NOW);
        when(cache.get(id)).thenReturn(Optional.empty());
        when(router.adapterFor(id)).thenReturn(uspto);
        when(uspto.fetch(id)).thenReturn(FetchResult.success(fetched));
        doThrow(new CacheUnavailableException("write failed", null)).when(cache).put(id, fetched);

        assertThat(service.lookup(id).record()).isEqualTo(fetched);
    }

    @Test
    void backgroundRefreshReplacesWithoutCounting() {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "1234567");
        PatentRecord fetched = record(id, PatentStatus.GRANTED, LocalDate.of(2030, 1, 1), PatentSource.EPO, NOW);
        when(router.adapterFor(id)).thenReturn(epo);
        when(epo.fetch(id)).thenReturn(FetchResult.success(fetched));

        assertThat(service.refresh(id)).isTrue();

        verify(cache).replace(id, fetched);
        verify(cache, never()).put(any(), any());
        verify(cache, never()).recordRead(any());
    }

    private static PatentRecord record(CanonicalIdentifier id, PatentStatus status, LocalDate expiry,
                                       PatentSource source, Instant fetchedAt) {
        return PatentRecord.builder()
                .identifier(id)
                .status(status)
                .expiryDate(expiry)
                .source(source)
                .fetchedAt(fetchedAt)
                .build();
    }
}
