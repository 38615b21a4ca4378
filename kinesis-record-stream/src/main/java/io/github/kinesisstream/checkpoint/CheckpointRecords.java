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

import java.util.Collections;
import java.util.List;

import io.github.kinesisstream.processor.CommittableRecord;
import io.github.kinesisstream.processor.ExtendedSequenceNumberComparator;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.FlowableTransformer;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.flowables.GroupedFlowable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.kinesis.retrieval.KinesisClientRecord;

/**
 * Transformers that checkpoint {@link CommittableRecord}s.
 *
 * <p>
 * {@link #checkpointRecords(KinesisCheckpointSettings)} groups records by shard and collects each shard's records
 * into windows of at most {@link KinesisCheckpointSettings#maxBatchSize()} records, closing a window early once
 * {@link KinesisCheckpointSettings#maxBatchWait()} has passed since its first record. For every closed window only the
 * furthest record is checkpointed, which covers every earlier record of the shard. Once that checkpoint has succeeded
 * every record of the window is emitted, in the order it was received. Shards are handled independently of each
 * other; within a shard checkpoints happen one at a time, in window order.
 * </p>
 *
 * <p>
 * A failed checkpoint is not retried; it terminates the returned flowable with the Kinesis Client Library exception.
 * </p>
 */
@Slf4j
public final class CheckpointRecords {

    private CheckpointRecords() {}

    /**
     * @param settings when to checkpoint
     * @return a transformer checkpointing the records it receives, emitting every record once it has been checkpointed
     */
    public static FlowableTransformer<CommittableRecord, KinesisClientRecord> checkpointRecords(
            KinesisCheckpointSettings settings) {
        return checkpointRecords(settings, Schedulers.computation(), Schedulers.io());
    }

    /**
     * @param settings when to checkpoint
     * @param windowScheduler scheduler timing the {@link KinesisCheckpointSettings#maxBatchWait()}
     * @param checkpointScheduler scheduler the checkpoints, which are blocking calls, are made on
     * @return a transformer checkpointing the records it receives, emitting every record once it has been checkpointed
     */
    public static FlowableTransformer<CommittableRecord, KinesisClientRecord> checkpointRecords(
            @NonNull KinesisCheckpointSettings settings,
            @NonNull Scheduler windowScheduler,
            @NonNull Scheduler checkpointScheduler) {
        return upstream -> upstream.groupBy(CommittableRecord::shardId)
                .flatMap(shard -> checkpointShard(shard, settings, windowScheduler, checkpointScheduler),
                        Integer.MAX_VALUE);
    }

    /**
     * @return a transformer that unwraps records without checkpointing them
     */
    public static FlowableTransformer<CommittableRecord, KinesisClientRecord> bypass() {
        return upstream -> upstream.map(CommittableRecord::record);
    }

    private static Flowable<KinesisClientRecord> checkpointShard(
            GroupedFlowable<String, CommittableRecord> shard,
            KinesisCheckpointSettings settings,
            Scheduler windowScheduler,
            Scheduler checkpointScheduler) {
        log.debug("Batching checkpoints for shard {}", shard.getKey());
        return shard.compose(new ShardWindowBatcher(settings, windowScheduler))
                .concatMapSingle(window -> checkpoint(window).subscribeOn(checkpointScheduler))
                .concatMapIterable(window -> window)
                .map(CommittableRecord::record);
    }

    static CommittableRecord latest(List<CommittableRecord> window) {
        return Collections.max(window, ExtendedSequenceNumberComparator.INSTANCE);
    }

    private static Single<List<CommittableRecord>> checkpoint(List<CommittableRecord> window) {
        return Single.fromCallable(() -> {
            CommittableRecord latest = latest(window);
            log.debug(
                    "Checkpointing shard {} at {} for a window of {} records",
                    latest.shardId(),
                    latest.extendedSequenceNumber(),
                    window.size());
            latest.checkpoint();
            return window;
        });
    }
}
