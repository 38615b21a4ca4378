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

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import io.github.kinesisstream.buffer.BufferClosedException;
import io.github.kinesisstream.buffer.RecordBuffer;
import lombok.extern.slf4j.Slf4j;
import software.amazon.kinesis.exceptions.InvalidStateException;
import software.amazon.kinesis.exceptions.KinesisClientLibDependencyException;
import software.amazon.kinesis.exceptions.ShutdownException;
import software.amazon.kinesis.exceptions.ThrottlingException;
import software.amazon.kinesis.lifecycle.events.InitializationInput;
import software.amazon.kinesis.lifecycle.events.LeaseLostInput;
import software.amazon.kinesis.lifecycle.events.ProcessRecordsInput;
import software.amazon.kinesis.lifecycle.events.ShardEndedInput;
import software.amazon.kinesis.lifecycle.events.ShutdownRequestedInput;
import software.amazon.kinesis.processor.ShardRecordProcessor;
import software.amazon.kinesis.retrieval.kpl.ExtendedSequenceNumber;

/**
 * A record processor that hands every batch of records it receives for its shard to a shared {@link RecordBuffer}, as a
 * single chunk of {@link CommittableRecord}s.
 *
 * <p>
 * The put into the buffer blocks while the buffer is full, so the Kinesis Client Library thread that calls
 * {@link #processRecords} is held back until the consumer catches up. Nothing is thrown back to the Kinesis Client
 * Library: if the buffer has been closed the batch is dropped and logged, and will be delivered again to whichever
 * worker next holds the lease.
 * </p>
 *
 * <p>
 * At shard end the shard is checkpointed as {@code SHARD_END} straight away, as the Kinesis Client Library requires
 * before it hands out the child shards. Chunks of the ending shard may still be in the buffer at that point; if the
 * process stops before they are consumed they are not delivered again, so records still buffered when their shard
 * ends are delivered at most once.
 * </p>
 */
@Slf4j
public class ChunkedShardRecordProcessor implements ShardRecordProcessor {
    private final RecordBuffer<List<CommittableRecord>> buffer;

    private volatile String shardId;
    private volatile ExtendedSequenceNumber startingSequenceNumber;

    public ChunkedShardRecordProcessor(RecordBuffer<List<CommittableRecord>> buffer) {
        this.buffer = buffer;
    }

    @Override
    public void initialize(InitializationInput initializationInput) {
        this.shardId = initializationInput.shardId();
        this.startingSequenceNumber = initializationInput.extendedSequenceNumber();
        log.info("Initializing record processor for shard {} at {}", shardId, startingSequenceNumber);
    }

    @Override
    public void processRecords(ProcessRecordsInput processRecordsInput) {
        if (processRecordsInput.records() == null || processRecordsInput.records().isEmpty()) {
            log.debug("No records delivered for shard {}", shardId);
            return;
        }
        List<CommittableRecord> chunk = Collections.unmodifiableList(processRecordsInput.records().stream()
                .map(record -> CommittableRecord.builder()
                        .shardId(shardId)
                        .recordProcessorStartingSequenceNumber(startingSequenceNumber)
                        .millisBehindLatest(processRecordsInput.millisBehindLatest())
                        .record(record)
                        .checkpointer(processRecordsInput.checkpointer())
                        .build())
                .collect(Collectors.toList()));
        try {
            buffer.put(chunk);
            log.debug("Buffered {} records for shard {}", chunk.size(), shardId);
        } catch (BufferClosedException e) {
            log.warn("Stream is no longer consuming, dropping {} records for shard {}", chunk.size(), shardId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while buffering {} records for shard {}", chunk.size(), shardId, e);
        }
    }

    @Override
    public void leaseLost(LeaseLostInput leaseLostInput) {
        log.info("Lease lost for shard {}", shardId);
    }

    @Override
    public void shardEnded(ShardEndedInput shardEndedInput) {
        log.info("Reached shard end for shard {}, checkpointing", shardId);
        try {
            shardEndedInput.checkpointer().checkpoint();
        } catch (KinesisClientLibDependencyException
                | InvalidStateException
                | ThrottlingException
                | ShutdownException e) {
            log.error("Unable to checkpoint at the end of shard {}", shardId, e);
        }
    }

    @Override
    public void shutdownRequested(ShutdownRequestedInput shutdownRequestedInput) {
        log.info("Shutdown requested for shard {}", shardId);
    }

    String shardId() {
        return shardId;
    }
}
