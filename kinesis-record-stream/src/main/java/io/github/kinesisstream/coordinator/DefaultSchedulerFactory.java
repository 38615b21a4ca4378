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
package io.github.kinesisstream.coordinator;

import io.github.kinesisstream.config.KinesisConsumerSettings;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;
import software.amazon.kinesis.common.ConfigsBuilder;
import software.amazon.kinesis.coordinator.Scheduler;
import software.amazon.kinesis.processor.ShardRecordProcessorFactory;
import software.amazon.kinesis.processor.SingleStreamTracker;
import software.amazon.kinesis.retrieval.RetrievalConfig;
import software.amazon.kinesis.retrieval.RetrievalSpecificConfig;

/**
 * Builds a single stream {@link Scheduler} from the Kinesis Client Library defaults, applying the retrieval mode and
 * initial position of the {@link KinesisConsumerSettings}.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultSchedulerFactory implements SchedulerFactory {
    @NonNull
    private final KinesisAsyncClient kinesisClient;

    @NonNull
    private final DynamoDbAsyncClient dynamoDBClient;

    @NonNull
    private final CloudWatchAsyncClient cloudWatchClient;

    @Override
    public Scheduler createScheduler(
            @NonNull KinesisConsumerSettings settings,
            @NonNull String workerIdentifier,
            @NonNull ShardRecordProcessorFactory shardRecordProcessorFactory) {
        ConfigsBuilder configsBuilder = new ConfigsBuilder(
                new SingleStreamTracker(settings.streamName(), settings.initialPosition()),
                settings.applicationName(),
                kinesisClient,
                dynamoDBClient,
                cloudWatchClient,
                workerIdentifier,
                shardRecordProcessorFactory);

        RetrievalConfig retrievalConfig =
                configsBuilder.retrievalConfig().retrievalSpecificConfig(retrievalSpecificConfig(settings));

        log.info(
                "Creating scheduler {} for application {} reading stream {} with {} retrieval from {}",
                workerIdentifier,
                settings.applicationName(),
                settings.streamName(),
                settings.retrievalMode(),
                settings.initialPosition());
        return new Scheduler(
                configsBuilder.checkpointConfig(),
                configsBuilder.coordinatorConfig(),
                configsBuilder.leaseManagementConfig(),
                configsBuilder.lifecycleConfig(),
                configsBuilder.metricsConfig(),
                configsBuilder.processorConfig(),
                retrievalConfig);
    }

    RetrievalSpecificConfig retrievalSpecificConfig(KinesisConsumerSettings settings) {
        return settings.retrievalMode().retrievalSpecificConfig(settings, kinesisClient);
    }
}
