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

import java.util.Arrays;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import org.apache.commons.lang3.Validate;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;
import software.amazon.kinesis.retrieval.RetrievalSpecificConfig;
import software.amazon.kinesis.retrieval.fanout.FanOutConfig;
import software.amazon.kinesis.retrieval.polling.PollingConfig;

/**
 * How the Kinesis Client Library retrieves records from the stream.
 */
public enum RetrievalMode {
    /**
     * Enhanced fan-out: records are pushed to a registered stream consumer named after the application.
     */
    FANOUT((settings, kinesisClient) -> new FanOutConfig(kinesisClient)
            .streamName(settings.streamName())
            .applicationName(settings.applicationName())),
    /**
     * Shared throughput: records are polled with GetRecords.
     */
    POLLING((settings, kinesisClient) -> new PollingConfig(settings.streamName(), kinesisClient));

    private final BiFunction<KinesisConsumerSettings, KinesisAsyncClient, RetrievalSpecificConfig> configFor;

    RetrievalMode(BiFunction<KinesisConsumerSettings, KinesisAsyncClient, RetrievalSpecificConfig> configFor) {
        this.configFor = configFor;
    }

    public RetrievalSpecificConfig retrievalSpecificConfig(
            KinesisConsumerSettings settings, KinesisAsyncClient kinesisClient) {
        return configFor.apply(settings, kinesisClient);
    }

    public static RetrievalMode from(String source) {
        Validate.notEmpty(source);
        try {
            return RetrievalMode.valueOf(source.trim().toUpperCase());
        } catch (IllegalArgumentException iae) {
            throw new IllegalArgumentException(
                    "Unknown retrieval type '" + source + "'. Available retrieval types: " + availableRetrievalModes());
        }
    }

    private static String availableRetrievalModes() {
        return "(" + Arrays.stream(RetrievalMode.values()).map(Enum::name).collect(Collectors.joining(", ")) + ")";
    }
}
