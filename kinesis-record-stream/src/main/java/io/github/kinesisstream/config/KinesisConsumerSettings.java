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
package io.github.kinesisstream.config;

import java.time.Duration;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.Validate;
import software.amazon.kinesis.common.InitialPositionInStream;
import software.amazon.kinesis.common.InitialPositionInStreamExtended;

/**
 * Settings for reading a Kinesis stream. Everything except the stream and application names has a default.
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
public class KinesisConsumerSettings {
    public static final int DEFAULT_BUFFER_SIZE = 10;
    public static final RetrievalMode DEFAULT_RETRIEVAL_MODE = RetrievalMode.FANOUT;
    public static final InitialPositionInStreamExtended DEFAULT_INITIAL_POSITION =
            InitialPositionInStreamExtended.newInitialPosition(InitialPositionInStream.LATEST);
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);

    /**
     * Name of the Kinesis stream to read.
     */
    private final String streamName;
    /**
     * Name of the consuming application. The Kinesis Client Library names its lease table, and the enhanced fan-out
     * consumer, after it.
     */
    private final String applicationName;
    /**
     * Number of record chunks held between the record processors and the consumer before the record processors block.
     */
    private final int bufferSize;
    private final RetrievalMode retrievalMode;
    /**
     * Where to start reading shards that have no checkpoint yet.
     */
    private final InitialPositionInStreamExtended initialPosition;
    /**
     * How long to wait for the scheduler to stop once the stream is torn down.
     */
    private final Duration shutdownGracePeriod;

    @Builder
    private KinesisConsumerSettings(
            @NonNull String streamName,
            @NonNull String applicationName,
            Integer bufferSize,
            RetrievalMode retrievalMode,
            InitialPositionInStreamExtended initialPosition,
            Duration shutdownGracePeriod) {
        Validate.notBlank(streamName, "Stream name is required");
        Validate.notBlank(applicationName, "Application name is required");
        this.streamName = streamName;
        this.applicationName = applicationName;
        this.bufferSize = bufferSize == null ? DEFAULT_BUFFER_SIZE : bufferSize;
        Validate.isTrue(this.bufferSize > 0, "Buffer size must be positive but was %d", this.bufferSize);
        this.retrievalMode = retrievalMode == null ? DEFAULT_RETRIEVAL_MODE : retrievalMode;
        this.initialPosition = initialPosition == null ? DEFAULT_INITIAL_POSITION : initialPosition;
        this.shutdownGracePeriod = shutdownGracePeriod == null ? DEFAULT_SHUTDOWN_GRACE_PERIOD : shutdownGracePeriod;
        Validate.isTrue(
                !this.shutdownGracePeriod.isNegative() && !this.shutdownGracePeriod.isZero(),
                "Shutdown grace period must be positive but was %s",
                this.shutdownGracePeriod);
    }

    /**
     * @return settings reading the given stream with every other setting left at its default
     */
    public static KinesisConsumerSettings of(String streamName, String applicationName) {
        return builder().streamName(streamName).applicationName(applicationName).build();
    }
}
