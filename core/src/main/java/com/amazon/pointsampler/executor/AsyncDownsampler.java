/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.pointsampler.executor;

import static com.amazon.pointsampler.CommonUtils.checkArgument;
import static com.amazon.pointsampler.CommonUtils.checkNotNull;
import static com.amazon.pointsampler.CommonUtils.checkSamplingArguments;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.SamplingCancelledException;
import com.amazon.pointsampler.SamplingOrchestrator;
import com.amazon.pointsampler.config.DownsamplingPolicy;
import com.amazon.pointsampler.config.SamplingOptions;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.returntypes.DownsamplingResult;

/**
 * Runs sampling calls on a private pool of worker threads so that the caller,
 * typically a request handler, is never blocked by the computation.
 * <p>
 * The timeout of the options is measured from submission, so time spent waiting
 * for a free worker counts against it. Cancelling a returned future does not
 * stop the computation; a timeout or {@link #close()} does, and the future then
 * completes exceptionally with a {@link SamplingCancelledException}.
 * </p>
 */
public class AsyncDownsampler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncDownsampler.class);

    public static final int DEFAULT_THREAD_POOL_SIZE = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    /**
     * How long {@link #close()} waits for interrupted workers to finish.
     */
    public static final long SHUTDOWN_WAIT_MILLIS = 5_000;

    @Getter
    private final int threadPoolSize;

    private final ExecutorService executor;

    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();

    public AsyncDownsampler() {
        this(DEFAULT_THREAD_POOL_SIZE);
    }

    public AsyncDownsampler(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        this.executor = Executors.newFixedThreadPool(threadPoolSize, new WorkerThreadFactory());
    }

    /**
     * Asynchronous form of
     * {@link SamplingOrchestrator#sample(List, int, SamplingStrategy, SamplingOptions)}.
     * Precondition failures are thrown immediately rather than through the
     * future.
     */
    public CompletableFuture<List<Point>> sample(List<Point> points, int targetCount, SamplingStrategy strategy,
            SamplingOptions options) {
        checkSamplingArguments(points, targetCount);
        checkNotNull(strategy, "strategy must not be null");
        checkNotNull(options, "options must not be null");
        SamplingContext context = SamplingContext.from(options);
        return track(CompletableFuture.supplyAsync(
                () -> SamplingOrchestrator.sample(points, targetCount, strategy, options, context), executor));
    }

    /**
     * Asynchronous form of {@link DownsamplingPolicy#apply(List)}.
     */
    public CompletableFuture<DownsamplingResult> apply(DownsamplingPolicy policy, List<Point> points) {
        checkNotNull(policy, "policy must not be null");
        checkNotNull(points, "points must not be null");
        SamplingContext context = SamplingContext.from(policy.getOptions());
        return track(CompletableFuture.supplyAsync(() -> policy.apply(points, context), executor));
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /**
     * Interrupts running calls, discards queued ones and waits briefly for the
     * workers to stop. Every unfinished future completes exceptionally.
     */
    @Override
    public void close() {
        List<Runnable> discarded = executor.shutdownNow();
        if (!discarded.isEmpty()) {
            LOGGER.debug("Discarded {} queued sampling calls", discarded.size());
        }
        for (CompletableFuture<?> future : pending) {
            future.completeExceptionally(
                    new SamplingCancelledException(SamplingCancelledException.Reason.INTERRUPTED, "sampler closed"));
        }
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Sampling workers did not stop within {} ms", SHUTDOWN_WAIT_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        pending.add(future);
        future.whenComplete((result, error) -> pending.remove(future));
        return future;
    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL_NUMBER = new AtomicInteger(1);

        private final AtomicInteger threadNumber = new AtomicInteger(1);

        private final String prefix = "point-sampler-" + POOL_NUMBER.getAndIncrement() + "-";

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
