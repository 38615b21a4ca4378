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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.github.kinesisstream.buffer.BufferClosedException;
import io.github.kinesisstream.buffer.RecordBuffer;
import io.github.kinesisstream.processor.CommittableRecord;
import io.reactivex.rxjava3.core.Emitter;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import software.amazon.kinesis.coordinator.Scheduler;
import software.amazon.kinesis.processor.RecordProcessorCheckpointer;

import static io.github.kinesisstream.utils.TestRecords.committableRecord;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@RunWith(MockitoJUnitRunner.class)
public class StreamSessionTest {
    private static final String WORKER = "worker-1";

    @Mock
    private Scheduler scheduler;

    @Mock
    private RecordProcessorCheckpointer checkpointer;

    @Mock
    private Emitter<List<CommittableRecord>> emitter;

    private RecordBuffer<List<CommittableRecord>> buffer;
    private ExecutorService executorService;
    private StreamSession session;

    @Before
    public void setup() {
        buffer = new RecordBuffer<>(1);
        executorService = Executors.newSingleThreadExecutor();
        session = new StreamSession(WORKER, buffer, scheduler, executorService, Duration.ofSeconds(1));
    }

    @After
    public void teardown() {
        executorService.shutdownNow();
    }

    @Test
    public void testEmitsBufferedChunks() throws Exception {
        List<CommittableRecord> chunk = Collections.singletonList(committableRecord("shard-0", "1", checkpointer));
        buffer.put(chunk);

        session.emitNext(emitter);

        verify(emitter).onNext(chunk);
    }

    @Test
    public void testCloseShutsDownTheSchedulerOnce() {
        session.close();
        session.close();

        verify(scheduler).shutdown();
        assertThat(session.state(), equalTo(StreamSession.State.STOPPED));
        assertThat(buffer.isClosed(), equalTo(true));
    }

    @Test
    public void testCloseReleasesBlockedRecordProcessors() throws Exception {
        buffer.put(Collections.singletonList(committableRecord("shard-0", "1", checkpointer)));
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            Future<?> blockedPut = producer.submit(() -> {
                buffer.put(Collections.singletonList(committableRecord("shard-0", "2", checkpointer)));
                return null;
            });

            session.close();

            ExecutionException e = assertThrows(ExecutionException.class, () -> blockedPut.get(5, TimeUnit.SECONDS));
            assertThat(e.getCause(), instanceOf(BufferClosedException.class));
        } finally {
            producer.shutdownNow();
        }
    }

    @Test
    public void testCompletesOnceClosed() {
        session.close();

        session.emitNext(emitter);

        verify(emitter).onComplete();
        verify(emitter, never()).onError(any());
    }

    @Test
    public void testErrorsWhenTheSchedulerStopsOnItsOwn() {
        session.runScheduler();

        session.emitNext(emitter);

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(emitter).onError(error.capture());
        assertThat(error.getValue(), instanceOf(SchedulerTerminatedException.class));
        assertThat(session.state(), equalTo(StreamSession.State.RUNNING));
    }

    @Test
    public void testErrorsWithTheSchedulerFailure() {
        IllegalStateException failure = new IllegalStateException("lease table missing");
        doThrow(failure).when(scheduler).run();

        session.runScheduler();
        session.emitNext(emitter);

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(emitter).onError(error.capture());
        assertThat(error.getValue(), instanceOf(SchedulerTerminatedException.class));
        assertThat(error.getValue().getCause(), sameInstance(failure));
    }

    @Test
    public void testSchedulerExitAfterCloseIsNotAnError() {
        session.close();

        session.runScheduler();

        assertThat(session.state(), equalTo(StreamSession.State.STOPPED));
    }

    @Test
    public void testShutdownFailureStillStopsTheSession() {
        doThrow(new IllegalStateException("already shut down")).when(scheduler).shutdown();

        session.close();

        assertThat(session.state(), equalTo(StreamSession.State.STOPPED));
        assertThat(executorService.isShutdown(), equalTo(true));
    }

    @Test
    public void testSchedulerThatDoesNotExitIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        CountDownLatch running = new CountDownLatch(1);
        doAnswer(invocation -> {
                    running.countDown();
                    try {
                        new CountDownLatch(1).await();
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                    }
                    return null;
                })
                .when(scheduler)
                .run();
        session = new StreamSession(WORKER, buffer, scheduler, executorService, Duration.ofMillis(100));
        executorService.execute(session::runScheduler);
        assertThat(running.await(5, TimeUnit.SECONDS), equalTo(true));

        session.close();

        assertThat(interrupted.await(5, TimeUnit.SECONDS), equalTo(true));
        verify(scheduler).shutdown();
    }
}
