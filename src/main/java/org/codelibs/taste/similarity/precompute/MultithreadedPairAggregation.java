/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.codelibs.taste.similarity.precompute;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.codelibs.taste.common.MemoryUtil;
import org.codelibs.taste.exception.OperationFailedException;
import org.codelibs.taste.exception.TasteException;
import org.codelibs.taste.model.UserProfile;
import org.codelibs.taste.similarity.PairAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * <p>
 * Aggregates item pairs in parallel on a single machine. User profiles are handed to worker threads in
 * batches; every worker absorbs its batches into a private {@link PairAggregator}, so no lock is held while
 * aggregating. When all profiles are consumed, the private aggregators are merged into one.
 * </p>
 *
 * <p>
 * A failing worker aborts the whole run and its exception is rethrown to the caller. Partial results are
 * discarded.
 * </p>
 */
public class MultithreadedPairAggregation implements PairAggregation {

    private static final Logger log = LoggerFactory
            .getLogger(MultithreadedPairAggregation.class);

    private static final int DEFAULT_BATCH_SIZE = 100;

    private static final long POLL_INTERVAL = 100L;

    /** Marks the end of the input for one worker. */
    private static final List<UserProfile> END_OF_PROFILES = ImmutableList.of();

    private final int degreeOfParallelism;

    private final int batchSize;

    private final long maxDurationInMinutes;

    /**
     * @param degreeOfParallelism number of worker threads
     */
    public MultithreadedPairAggregation(final int degreeOfParallelism) {
        this(degreeOfParallelism, DEFAULT_BATCH_SIZE, 0);
    }

    /**
     * @param degreeOfParallelism number of worker threads
     * @param batchSize number of user profiles sent to a worker at once
     * @param maxDurationInMinutes time limit of the whole run, 0 for none
     */
    public MultithreadedPairAggregation(final int degreeOfParallelism,
            final int batchSize, final long maxDurationInMinutes) {
        Preconditions.checkArgument(degreeOfParallelism > 0,
                "degreeOfParallelism must be greater than 0");
        Preconditions.checkArgument(batchSize > 0,
                "batchSize must be greater than 0");
        Preconditions.checkArgument(maxDurationInMinutes >= 0,
                "maxDurationInMinutes must be at least 0");
        this.degreeOfParallelism = degreeOfParallelism;
        this.batchSize = batchSize;
        this.maxDurationInMinutes = maxDurationInMinutes;
    }

    @Override
    public PairAggregator aggregate(final Iterator<UserProfile> profiles) {
        Preconditions.checkArgument(profiles != null, "profiles is null");

        final long startTime = System.currentTimeMillis();
        final long deadline = maxDurationInMinutes == 0 ? Long.MAX_VALUE
                : startTime + TimeUnit.MINUTES.toMillis(maxDurationInMinutes);

        final ExecutorService executorService = Executors
                .newFixedThreadPool(degreeOfParallelism);
        final BlockingQueue<List<UserProfile>> profileBatches = new LinkedBlockingQueue<List<UserProfile>>(
                degreeOfParallelism * 2);
        final List<Future<PairAggregator>> futures = Lists
                .newArrayListWithCapacity(degreeOfParallelism);
        try {
            for (int n = 0; n < degreeOfParallelism; n++) {
                futures.add(executorService.submit(new AggregationWorker(n,
                        profileBatches)));
            }

            int numBatches = 0;
            List<UserProfile> batch = Lists
                    .newArrayListWithCapacity(batchSize);
            while (profiles.hasNext()) {
                batch.add(profiles.next());
                if (batch.size() == batchSize) {
                    enqueue(profileBatches, batch, futures, deadline);
                    numBatches++;
                    batch = Lists.newArrayListWithCapacity(batchSize);
                }
            }
            if (!batch.isEmpty()) {
                enqueue(profileBatches, batch, futures, deadline);
                numBatches++;
            }
            log.info("Queued {} batches for {} workers", numBatches,
                    degreeOfParallelism);
            for (int n = 0; n < degreeOfParallelism; n++) {
                enqueue(profileBatches, END_OF_PROFILES, futures, deadline);
            }

            final PairAggregator result = new PairAggregator();
            for (final Future<PairAggregator> future : futures) {
                result.merge(await(future, deadline));
            }
            result.finish();
            log.info("Aggregation with {} workers finished at {} ms.",
                    degreeOfParallelism, System.currentTimeMillis()
                            - startTime);
            return result;
        } finally {
            executorService.shutdownNow();
        }
    }

    private void enqueue(final BlockingQueue<List<UserProfile>> queue,
            final List<UserProfile> batch,
            final List<Future<PairAggregator>> futures, final long deadline) {
        try {
            while (!queue.offer(batch, POLL_INTERVAL, TimeUnit.MILLISECONDS)) {
                checkWorkers(futures);
                checkDeadline(deadline);
            }
        } catch (final InterruptedException e) {
            throw new OperationFailedException("Interrupted while queueing.",
                    e);
        }
    }

    /**
     * Rethrows the failure of a worker that is already done. A worker ends normally only after taking its end
     * marker.
     */
    private void checkWorkers(final List<Future<PairAggregator>> futures) {
        for (final Future<PairAggregator> future : futures) {
            if (future.isDone()) {
                await(future, Long.MAX_VALUE);
            }
        }
    }

    private void checkDeadline(final long deadline) {
        if (System.currentTimeMillis() > deadline) {
            throw new OperationFailedException(
                    "Unable to complete the aggregation in "
                            + maxDurationInMinutes + " minutes!");
        }
    }

    private PairAggregator await(final Future<PairAggregator> future,
            final long deadline) {
        try {
            if (deadline == Long.MAX_VALUE) {
                return future.get();
            }
            final long timeout = Math.max(0L,
                    deadline - System.currentTimeMillis());
            return future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof TasteException) {
                throw (TasteException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new OperationFailedException("A worker failed.", cause);
        } catch (final TimeoutException e) {
            throw new OperationFailedException(
                    "Unable to complete the aggregation in "
                            + maxDurationInMinutes + " minutes!", e);
        } catch (final InterruptedException e) {
            throw new OperationFailedException(
                    "Interrupted while waiting for workers.", e);
        }
    }

    @Override
    public String toString() {
        return "MultithreadedPairAggregation[threads:" + degreeOfParallelism
                + ", batchSize:" + batchSize + ", maxDuration:"
                + maxDurationInMinutes + "m]";
    }

    private static class AggregationWorker implements Callable<PairAggregator> {

        private final int number;

        private final BlockingQueue<List<UserProfile>> profileBatches;

        AggregationWorker(final int number,
                final BlockingQueue<List<UserProfile>> profileBatches) {
            this.number = number;
            this.profileBatches = profileBatches;
        }

        @Override
        public PairAggregator call() throws InterruptedException {
            final PairAggregator aggregator = new PairAggregator();
            int numBatchesProcessed = 0;
            log.info("Worker {} is started.", number);
            while (true) {
                final List<UserProfile> batch = profileBatches.take();
                if (batch == END_OF_PROFILES) {
                    break;
                }
                for (final UserProfile profile : batch) {
                    aggregator.addUser(profile);
                }
                if (++numBatchesProcessed % 5 == 0) {
                    log.info("worker {} processed {} batches", number,
                            numBatchesProcessed);
                    if (numBatchesProcessed % 100 == 0) {
                        MemoryUtil.logMemoryStatistics();
                    }
                }
            }
            log.info("worker {} processed {} batches. done.", number,
                    numBatchesProcessed);
            return aggregator;
        }
    }

}
