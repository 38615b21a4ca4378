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
package io.github.kinesisstream.processor;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;
import software.amazon.kinesis.exceptions.InvalidStateException;
import software.amazon.kinesis.exceptions.KinesisClientLibDependencyException;
import software.amazon.kinesis.exceptions.ShutdownException;
import software.amazon.kinesis.exceptions.ThrottlingException;
import software.amazon.kinesis.processor.RecordProcessorCheckpointer;
import software.amazon.kinesis.retrieval.KinesisClientRecord;
import software.amazon.kinesis.retrieval.kpl.ExtendedSequenceNumber;

/**
 * A record delivered by the Kinesis Client Library together with the shard it came from and the ability to checkpoint
 * the shard up to, and including, this record.
 */
@Builder
@Getter
@Accessors(fluent = true)
@ToString(exclude = "checkpointer")
public class CommittableRecord {
    /**
     * The shard this record was read from.
     */
    @NonNull
    private final String shardId;
    /**
     * The checkpoint the delivering record processor was initialized from. May be null if the processor was never
     * initialized with one.
     */
    private final ExtendedSequenceNumber recordProcessorStartingSequenceNumber;
    /**
     * How far behind the tip of the stream the delivering batch was. May be null.
     */
    private final Long millisBehindLatest;
    /**
     * The record as delivered by the Kinesis Client Library.
     */
    @NonNull
    private final KinesisClientRecord record;

    @NonNull
    private final RecordProcessorCheckpointer checkpointer;

    public String sequenceNumber() {
        return record.sequenceNumber();
    }

    public long subSequenceNumber() {
        return record.subSequenceNumber();
    }

    /**
     * @return the position of this record within its shard
     */
    public ExtendedSequenceNumber extendedSequenceNumber() {
        return new ExtendedSequenceNumber(sequenceNumber(), subSequenceNumber());
    }

    /**
     * Checkpoints the shard at this record. Every record delivered before this one on the same shard is considered
     * processed as well.
     *
     * @throws KinesisClientLibDependencyException the checkpoint could not be stored, it is safe to retry
     * @throws InvalidStateException the checkpoint could not be stored
     * @throws ThrottlingException checkpointing too frequently
     * @throws ShutdownException the record processor no longer holds the lease for this shard
     */
    public void checkpoint()
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException {
        checkpointer.checkpoint(sequenceNumber(), subSequenceNumber());
    }
}
