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
import software.amazon.kinesis.coordinator.Scheduler;
import software.amazon.kinesis.processor.ShardRecordProcessorFactory;

/**
 * Creates the Kinesis Client Library {@link Scheduler} that drives one stream subscription.
 */
@FunctionalInterface
public interface SchedulerFactory {

    /**
     * @param settings the settings of the stream being read
     * @param workerIdentifier a new, unique identifier for this worker
     * @param shardRecordProcessorFactory the factory the scheduler must use for every shard it leases
     * @return a scheduler that has not been started
     */
    Scheduler createScheduler(
            KinesisConsumerSettings settings,
            String workerIdentifier,
            ShardRecordProcessorFactory shardRecordProcessorFactory);
}
