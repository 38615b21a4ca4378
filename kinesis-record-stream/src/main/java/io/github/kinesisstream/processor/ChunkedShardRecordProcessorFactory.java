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

import java.util.List;

import io.github.kinesisstream.buffer.RecordBuffer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.kinesis.processor.ShardRecordProcessor;
import software.amazon.kinesis.processor.ShardRecordProcessorFactory;

/**
 * Creates {@link ChunkedShardRecordProcessor}s that all deliver into the same buffer.
 */
@Slf4j
public class ChunkedShardRecordProcessorFactory implements ShardRecordProcessorFactory {
    private final RecordBuffer<List<CommittableRecord>> buffer;

    /**
     * @param buffer the buffer that every created record processor delivers into
     */
    public ChunkedShardRecordProcessorFactory(@NonNull RecordBuffer<List<CommittableRecord>> buffer) {
        this.buffer = buffer;
    }

    @Override
    public ShardRecordProcessor shardRecordProcessor() {
        log.debug("Creating new record processor");
        return new ChunkedShardRecordProcessor(buffer);
    }
}
