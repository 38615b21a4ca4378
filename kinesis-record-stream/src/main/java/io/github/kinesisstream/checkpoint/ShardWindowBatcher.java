/*
 * Copyright 2019 Amazon.com, Inc. or its affiliates.
 * Licensed under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.kinesisstream.checkpoint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import io.github.kinesisstream.processor.CommittableRecord;
import io.reactivex.rxjava3.core.BackpressureStrategy;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.FlowableEmitter;
import io.reactivex.rxjava3.core.FlowableTransformer;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;

/**
 * Collects the records of a single shard into windows. A window is opened by its first record and closed either when
 * it holds {@code maxBatchSize} records or {@code maxBatchWait} after that first record, whichever comes first. No
 * window is emitted empty.
 */
@Slf4j
class ShardWindowBatcher implements FlowableTransformer<CommittableRecord, List<CommittableRecord>> {
    private final int maxBatchSize;
    private final Duration maxBatchWait;
    private final Scheduler windowScheduler;

    ShardWindowBatcher(KinesisCheckpointSettings settings, Scheduler windowScheduler) {
        this.maxBatchSize = settings.maxBatchSize();
        this.maxBatchWait = settings.maxBatchWait();
        this.windowScheduler = windowScheduler;
    }

    @Override
    public Publisher<List<CommittableRecord>> apply(Flowable<CommittableRecord> upstream) {
        return Flowable.create(
                emitter -> {
                    CompositeDisposable resources = new CompositeDisposable();
                    emitter.setDisposable(resources);
                    Scheduler.Worker worker = windowScheduler.createWorker();
                    resources.add(worker);
                    Window window = new Window(emitter, worker);
                    resources.add(upstream.subscribe(window::add, window::fail, window::complete));
                },
                BackpressureStrategy.BUFFER);
    }

    /**
     * The open window of one subscription. Records arrive on the upstream thread and timeouts on the window
     * scheduler, so every transition holds the monitor.
     */
    private final class Window {
        private final FlowableEmitter<List<CommittableRecord>> emitter;
        private final Scheduler.Worker worker;

        private List<CommittableRecord> records = new ArrayList<>();
        private Disposable timeout = Disposable.disposed();
        private long generation;

        Window(FlowableEmitter<List<CommittableRecord>> emitter, Scheduler.Worker worker) {
            this.emitter = emitter;
            this.worker = worker;
        }

        synchronized void add(CommittableRecord record) {
            records.add(record);
            if (records.size() >= maxBatchSize) {
                timeout.dispose();
                close();
            } else if (records.size() == 1) {
                long opened = generation;
                timeout = worker.schedule(
                        () -> closeOnTimeout(opened), maxBatchWait.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        synchronized void complete() {
            timeout.dispose();
            if (!records.isEmpty()) {
                close();
            }
            emitter.onComplete();
        }

        synchronized void fail(Throwable t) {
            timeout.dispose();
            if (!records.isEmpty()) {
                log.debug("Discarding a window of {} records after an upstream failure", records.size());
            }
            records = new ArrayList<>();
            emitter.onError(t);
        }

        private synchronized void closeOnTimeout(long opened) {
            // A window closed by count may have been replaced while this timeout waited for the monitor.
            if (generation == opened && !records.isEmpty()) {
                close();
            }
        }

        private void close() {
            List<CommittableRecord> closed = records;
            records = new ArrayList<>();
            generation++;
            emitter.onNext(closed);
        }
    }
}
