package com.zcunsoft.clklog.behavior.eventlog;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.EventQuery;
import com.zcunsoft.clklog.behavior.bean.PlatformFilter;
import com.zcunsoft.clklog.behavior.bean.TimeRange;
import com.zcunsoft.clklog.behavior.exception.EventLogException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.zcunsoft.clklog.behavior.TestEvents.BASE;
import static com.zcunsoft.clklog.behavior.TestEvents.screen;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventFetcherTest {

    private static final EventQuery QUERY = EventQuery.prod(new TimeRange(BASE.minusSeconds(3600), BASE.plusSeconds(3600)), PlatformFilter.ALL);

    private final EventFetcher fetcher = EventFetcher.create(2);

    @AfterEach
    void tearDown() {
        fetcher.close();
    }

    @Test
    void returnsEventsFromLog() {
        List<BehaviorEvent> events = List.of(screen("s1", 0, "Landing"));

        assertThat(fetcher.fetch(query -> events, QUERY, 1000)).isEqualTo(events);
    }

    /**
     * 等待 latch 释放或线程被中断后才返回的事件日志
     */
    private static EventLog blockingLog(CountDownLatch latch) {
        return query -> {
            try {
                latch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(screen("s1", 0, "Landing"));
        };
    }

    @Test
    void slowLogTimesOut() {
        CountDownLatch never = new CountDownLatch(1);

        assertThatThrownBy(() -> fetcher.fetch(blockingLog(never), QUERY, 50))
                .isInstanceOfSatisfying(EventLogException.class, e -> assertThat(e.isTimeout()).isTrue());
    }

    @Test
    void failureIsWrappedWithoutRetry() {
        int[] calls = {0};
        EventLog failing = query -> {
            calls[0]++;
            throw new IllegalStateException("connection refused");
        };

        assertThatThrownBy(() -> fetcher.fetch(failing, QUERY, 1000))
                .isInstanceOfSatisfying(EventLogException.class, e -> {
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e).hasRootCauseInstanceOf(IllegalStateException.class);
                });
        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    void eventLogExceptionPropagatesUnchanged() {
        EventLogException failure = new EventLogException("table missing", null);

        assertThatThrownBy(() -> fetcher.fetch(query -> {
            throw failure;
        }, QUERY, 1000)).isSameAs(failure);
    }

    @Test
    void interruptedCallerGetsNoEvents() {
        CountDownLatch latch = new CountDownLatch(1);
        Thread.currentThread().interrupt();
        try {
            assertThat(fetcher.fetch(blockingLog(latch), QUERY, 1000)).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
            latch.countDown();
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void cancelledFetchGetsNoEvents() throws Exception {
        ExecutorService executor = mock(ExecutorService.class);
        Future<List<BehaviorEvent>> future = mock(Future.class);
        doReturn(future).when(executor).submit(any(Callable.class));
        when(future.get(anyLong(), any(TimeUnit.class))).thenThrow(new CancellationException());

        assertThat(new EventFetcher(executor).fetch(query -> List.of(), QUERY, 1000)).isEmpty();
    }

    @Test
    void logCancellingItsOwnReadGetsNoEvents() {
        EventLog cancelling = query -> {
            throw new CancellationException("cancelled by caller");
        };

        assertThat(fetcher.fetch(cancelling, QUERY, 1000)).isEmpty();
    }
}
