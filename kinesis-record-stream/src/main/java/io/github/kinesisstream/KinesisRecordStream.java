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

import java.util.List;
import java.util.UUID;

import io.github.kinesisstream.config.KinesisConsumerSettings;
import io.github.kinesisstream.coordinator.DefaultSchedulerFactory;
import io.github.kinesisstream.coordinator.SchedulerFactory;
import io.github.kinesisstream.processor.CommittableRecord;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;

/**
 * Reads a Kinesis stream through the Kinesis Client Library as a {@link Flowable}.
 *
 * <p>
 * Every subscription starts a new Kinesis Client Library worker, with a new worker identifier, which takes leases on
 * the stream's shards alongside any other workers of the same application. Records delivered for those shards are
 * buffered, up to {@link KinesisConsumerSettings#bufferSize()} chunks, until requested downstream; a full buffer holds
 * the delivering record processors back.
 * </p>
 *
 * <p>
 * The returned flowables never complete on their own. They error with a {@link SchedulerTerminatedException} if the
 * worker stops, and stop the worker when cancelled. Either way the worker has been shut down before the subscriber is
 * notified. Records are not checkpointed by reading them, see
 * {@link io.github.kinesisstream.checkpoint.CheckpointRecords}.
 * </p>
 */
@Slf4j
public class KinesisRecordStream {
    private final SchedulerFactory schedulerFactory;
    private final Scheduler consumerScheduler;

    /**
     * @param kinesisClient client used to read the stream
     * @param dynamoDBClient client used for the lease table
     * @param cloudWatchClient client used to publish the Kinesis Client Library metrics
     */
    public KinesisRecordStream(
            KinesisAsyncClient kinesisClient,
            DynamoDbAsyncClient dynamoDBClient,
            CloudWatchAsyncClient cloudWatchClient) {
        this(new DefaultSchedulerFactory(kinesisClient, dynamoDBClient, cloudWatchClient));
    }

    public KinesisRecordStream(SchedulerFactory schedulerFactory) {
        this(schedulerFactory, Schedulers.io());
    }

    /**
     * @param schedulerFactory creates the Kinesis Client Library scheduler for every subscription
     * @param consumerScheduler where subscriptions wait on the buffer for records; it must tolerate blocking
     */
    public KinesisRecordStream(@NonNull SchedulerFactory schedulerFactory, @NonNull Scheduler consumerScheduler) {
        this.schedulerFactory = schedulerFactory;
        this.consumerScheduler = consumerScheduler;
    }

    /**
     * @param applicationName name of the consuming application, used by the Kinesis Client Library for its lease table
     * @param streamName name of the stream to read
     * @return the stream's records, with all other settings left at their defaults
     */
    public Flowable<CommittableRecord> read(String applicationName, String streamName) {
        return read(KinesisConsumerSettings.of(streamName, applicationName));
    }

    /**
     * @param settings what to read, and how
     * @return the stream's records, one at a time. At most one chunk is taken from the buffer ahead of demand.
     */
    public Flowable<CommittableRecord> read(KinesisConsumerSettings settings) {
        return readChunked(settings).concatMapIterable(chunk -> chunk, 1);
    }

    /**
     * @param settings what to read, and how
     * @return the stream's records, in the chunks the record processors received them in. Every chunk holds records
     *         of a single shard, in shard order.
     */
    public Flowable<List<CommittableRecord>> readChunked(@NonNull KinesisConsumerSettings settings) {
        return Flowable.defer(() -> {
                    String workerIdentifier = UUID.randomUUID().toString();
                    log.debug("Subscribing to stream {} as worker {}", settings.streamName(), workerIdentifier);
                    return Flowable.<List<CommittableRecord>, StreamSession>using(
                            () -> StreamSession.start(settings, workerIdentifier, schedulerFactory),
                            session -> Flowable.<List<CommittableRecord>>generate(session::emitNext),
                            StreamSession::close,
                            true);
                })
                .subscribeOn(consumerScheduler);
    }
}
