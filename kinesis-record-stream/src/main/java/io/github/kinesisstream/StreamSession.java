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
package io.github.kinesisstream;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.kinesisstream.buffer.BufferClosedException;
import io.github.kinesisstream.buffer.RecordBuffer;
import io.github.kinesisstream.config.KinesisConsumerSettings;
import io.github.kinesisstream.coordinator.SchedulerFactory;
import io.github.kinesisstream.processor.ChunkedShardRecordProcessorFactory;
import io.github.kinesisstream.processor.CommittableRecord;
import io.reactivex.rxjava3.core.Emitter;
import lombok.extern.slf4j.Slf4j;
import software.amazon.kinesis.coordinator.Scheduler;

/**
 * One run of a Kinesis Client Library {@link Scheduler} feeding a {@link RecordBuffer}.
 *
 * <p>
 * The scheduler runs on a thread of its own for as long as the session is open. If it stops before {@link #close()}
 * is called the buffer is failed with a {@link SchedulerTerminatedException}, which the consumer then sees. Closing
 * the session, for whatever reason, closes the buffer and shuts the scheduler down exactly once.
 * </p>
 */
@Slf4j
class StreamSession {
    enum State {
        RUNNING,
        STOPPING,
        STOPPED
    }

    private final String workerIdentifier;
    private final RecordBuffer<List<CommittableRecord>> buffer;
    private final Scheduler scheduler;
    private final ExecutorService executorService;
    private final Duration shutdownGracePeriod;

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

    StreamSession(
            String workerIdentifier,
            RecordBuffer<List<CommittableRecord>> buffer,
            Scheduler scheduler,
            ExecutorService executorService,
            Duration shutdownGracePeriod) {
        this.workerIdentifier = workerIdentifier;
        this.buffer = buffer;
        this.scheduler = scheduler;
        this.executorService = executorService;
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    /**
     * Creates the buffer and the scheduler for a new worker, and starts the scheduler.
     */
    static StreamSession start(
            KinesisConsumerSettings settings, String workerIdentifier, SchedulerFactory schedulerFactory) {
        RecordBuffer<List<CommittableRecord>> buffer = new RecordBuffer<>(settings.bufferSize());
        Scheduler scheduler = schedulerFactory.createScheduler(
                settings, workerIdentifier, new ChunkedShardRecordProcessorFactory(buffer));
        ExecutorService executorService = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("kinesis-scheduler-" + workerIdentifier + "-%d")
                .setDaemon(true)
                .build());

        StreamSession session = new StreamSession(
                workerIdentifier, buffer, scheduler, executorService, settings.shutdownGracePeriod());
        log.info(
                "Starting scheduler {} for stream {} with a buffer of {} chunks",
                workerIdentifier,
                settings.streamName(),
                settings.bufferSize());
        executorService.execute(session::runScheduler);
        return session;
    }

    void runScheduler() {
        try {
            scheduler.run();
            if (state.get() == State.RUNNING) {
                log.error("Scheduler {} exited while the stream was still being consumed", workerIdentifier);
                buffer.fail(new SchedulerTerminatedException("Scheduler " + workerIdentifier + " exited unexpectedly"));
            } else {
                log.info("Scheduler {} has exited", workerIdentifier);
            }
        } catch (Throwable t) {
            log.error("Scheduler {} failed", workerIdentifier, t);
            buffer.fail(new SchedulerTerminatedException("Scheduler " + workerIdentifier + " failed", t));
        }
    }

    /**
     * Emits the next chunk, waiting for one if none is buffered. Completes quietly once the session has been closed,
     * and errors if the buffer was failed while the session was still open.
     */
    void emitNext(Emitter<List<CommittableRecord>> emitter) {
        try {
            emitter.onNext(buffer.take());
        } catch (BufferClosedException e) {
            if (state.get() != State.RUNNING) {
                emitter.onComplete();
            } else {
                emitter.onError(e.getCause() != null ? e.getCause() : e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (state.get() != State.RUNNING) {
                emitter.onComplete();
            } else {
                emitter.onError(e);
            }
        }
    }

    /**
     * Closes the buffer, releasing any blocked record processor, then shuts the scheduler down and waits for it to
     * exit. Only the first call has any effect.
     */
    void close() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) {
            return;
        }
        log.info("Stopping scheduler {}", workerIdentifier);
        buffer.close();
        try {
            scheduler.shutdown();
        } catch (RuntimeException e) {
            log.error("Encountered an error while shutting down scheduler {}", workerIdentifier, e);
        } finally {
            executorService.shutdown();
            awaitSchedulerExit();
            state.set(State.STOPPED);
        }
    }

    private void awaitSchedulerExit() {
        try {
            if (!executorService.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler {} did not exit within {}", workerIdentifier, shutdownGracePeriod);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for scheduler {} to exit", workerIdentifier);
            executorService.shutdownNow();
        }
    }

    State state() {
        return state.get();
    }

    String workerIdentifier() {
        return workerIdentifier;
    }

    RecordBuffer<List<CommittableRecord>> buffer() {
        return buffer;
    }
}
