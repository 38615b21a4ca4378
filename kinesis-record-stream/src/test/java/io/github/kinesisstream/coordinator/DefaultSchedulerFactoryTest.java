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
import io.github.kinesisstream.config.RetrievalMode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;
import software.amazon.kinesis.retrieval.RetrievalSpecificConfig;
import software.amazon.kinesis.retrieval.fanout.FanOutConfig;
import software.amazon.kinesis.retrieval.polling.PollingConfig;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;

@RunWith(MockitoJUnitRunner.class)
public class DefaultSchedulerFactoryTest {

    @Mock
    private KinesisAsyncClient kinesisClient;

    @Mock
    private DynamoDbAsyncClient dynamoDBClient;

    @Mock
    private CloudWatchAsyncClient cloudWatchClient;

    private DefaultSchedulerFactory schedulerFactory;

    @Before
    public void setup() {
        schedulerFactory = new DefaultSchedulerFactory(kinesisClient, dynamoDBClient, cloudWatchClient);
    }

    @Test
    public void testFanOutRetrievalUsesTheApplicationAsConsumer() {
        RetrievalSpecificConfig config =
                schedulerFactory.retrievalSpecificConfig(KinesisConsumerSettings.of("orders", "order-auditor"));

        assertThat(config, instanceOf(FanOutConfig.class));
        assertThat(((FanOutConfig) config).applicationName(), equalTo("order-auditor"));
        assertThat(((FanOutConfig) config).streamName(), equalTo("orders"));
    }

    @Test
    public void testPollingRetrieval() {
        KinesisConsumerSettings settings = KinesisConsumerSettings.builder()
                .streamName("orders")
                .applicationName("order-auditor")
                .retrievalMode(RetrievalMode.POLLING)
                .build();

        RetrievalSpecificConfig config = schedulerFactory.retrievalSpecificConfig(settings);

        assertThat(config, instanceOf(PollingConfig.class));
        assertThat(((PollingConfig) config).streamName(), equalTo("orders"));
    }

    @Test(expected = NullPointerException.class)
    public void testKinesisClientIsRequired() {
        new DefaultSchedulerFactory(null, dynamoDBClient, cloudWatchClient);
    }

    @Test(expected = NullPointerException.class)
    public void testSettingsAreRequired() {
        schedulerFactory.createScheduler(null, "worker", () -> null);
    }
}
