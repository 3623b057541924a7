package com.zcunsoft.clklog.behavior.eventlog;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.EventQuery;
import com.zcunsoft.clklog.behavior.exception.EventLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 带超时的事件读取
 * <p>
 * 1. 超时：取消读取并抛出 EventLogException
 * 2. 读取被取消或当前线程被中断：按无事件处理
 * 3. 读取失败：抛出 EventLogException，不重试
 */
public class EventFetcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventFetcher.class);

    private final ExecutorService executor;

    public EventFetcher(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * 创建固定大小线程池的读取器
     *
     * @param threadCount 线程数
     */
    public static EventFetcher create(int threadCount) {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount, r -> {
            Thread thread = new Thread(r, "event-fetch-" + seq.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, ex) -> logger.error("Thread " + t + " got uncaught exception: ", ex));
            return thread;
        });
        return new EventFetcher(executor);
    }

    public List<BehaviorEvent> fetch(EventLog eventLog, EventQuery query, long timeoutMs) {
        Future<List<BehaviorEvent>> future = executor.submit(() -> eventLog.fetch(query));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.error("Event log fetch timed out after {}ms, query: {}", timeoutMs, query);
            throw new EventLogException("Event log fetch timed out after " + timeoutMs + "ms", e, true);
        } catch (CancellationException e) {
            logger.warn("Event log fetch cancelled, treating as no events, query: {}", query);
            return Collections.emptyList();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Event log fetch interrupted, treating as no events, query: {}", query);
            return Collections.emptyList();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EventLogException) {
                throw (EventLogException) cause;
            }
            if (cause instanceof CancellationException) {
                logger.warn("Event log fetch cancelled by source, treating as no events, query: {}", query);
                return Collections.emptyList();
            }
            logger.error("Event log fetch failed, query: {}", query, cause);
            throw new EventLogException("Event log fetch failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        try {
            executor.shutdown();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
