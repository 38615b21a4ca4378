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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.Validate;

/**
 * Controls how many records of a shard, or how much time, may go by before the shard is checkpointed.
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
public class KinesisCheckpointSettings {
    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;
    public static final Duration DEFAULT_MAX_BATCH_WAIT = Duration.ofSeconds(10);

    /**
     * Number of records of one shard after which the shard is checkpointed.
     */
    private final int maxBatchSize;
    /**
     * Longest time records of one shard are held before the shard is checkpointed.
     */
    private final Duration maxBatchWait;

    @Builder
    private KinesisCheckpointSettings(Integer maxBatchSize, Duration maxBatchWait) {
        this.maxBatchSize = maxBatchSize == null ? DEFAULT_MAX_BATCH_SIZE : maxBatchSize;
        this.maxBatchWait = maxBatchWait == null ? DEFAULT_MAX_BATCH_WAIT : maxBatchWait;
        Validate.isTrue(this.maxBatchSize > 0, "Max batch size must be positive but was %d", this.maxBatchSize);
        Validate.isTrue(
                !this.maxBatchWait.isNegative() && !this.maxBatchWait.isZero(),
                "Max batch wait must be positive but was %s",
                this.maxBatchWait);
    }

    public static KinesisCheckpointSettings defaultInstance() {
        return builder().build();
    }
}
