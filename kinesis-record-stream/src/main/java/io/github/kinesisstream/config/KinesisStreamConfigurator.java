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

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Date;
import java.util.Properties;

import io.github.kinesisstream.checkpoint.KinesisCheckpointSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import software.amazon.kinesis.common.InitialPositionInStream;
import software.amazon.kinesis.common.InitialPositionInStreamExtended;

/**
 * Builds {@link KinesisConsumerSettings} and {@link KinesisCheckpointSettings} from java properties. Only
 * "streamName" and "applicationName" are required:
 *
 * <pre>
 * streamName = words
 * applicationName = WordCounter
 * # Optional
 * bufferSize = 10
 * retrievalMode = POLLING
 * initialPositionInStream = AT_TIMESTAMP
 * # Seconds since the epoch, required with AT_TIMESTAMP
 * initialPositionInStreamTimestamp = 1700000000
 * shutdownGraceMillis = 30000
 * checkpointMaxBatchSize = 1000
 * checkpointMaxBatchWaitMillis = 10000
 * </pre>
 */
@Slf4j
public class KinesisStreamConfigurator {
    static final String PROP_STREAM_NAME = "streamName";
    static final String PROP_APPLICATION_NAME = "applicationName";
    static final String PROP_BUFFER_SIZE = "bufferSize";
    static final String PROP_RETRIEVAL_MODE = "retrievalMode";
    static final String PROP_INITIAL_POSITION = "initialPositionInStream";
    static final String PROP_INITIAL_POSITION_TIMESTAMP = "initialPositionInStreamTimestamp";
    static final String PROP_SHUTDOWN_GRACE_MILLIS = "shutdownGraceMillis";
    static final String PROP_CHECKPOINT_MAX_BATCH_SIZE = "checkpointMaxBatchSize";
    static final String PROP_CHECKPOINT_MAX_BATCH_WAIT_MILLIS = "checkpointMaxBatchWaitMillis";

    /**
     * @param properties the properties to read
     * @return consumer settings, with defaults for anything not set
     * @throws IllegalArgumentException if a required property is missing or a property value is invalid
     */
    public KinesisConsumerSettings getConsumerSettings(Properties properties) {
        String streamName = properties.getProperty(PROP_STREAM_NAME);
        String applicationName = properties.getProperty(PROP_APPLICATION_NAME);
        Validate.isTrue(StringUtils.isNotBlank(streamName), "Property %s is required", PROP_STREAM_NAME);
        Validate.isTrue(StringUtils.isNotBlank(applicationName), "Property %s is required", PROP_APPLICATION_NAME);

        KinesisConsumerSettings.KinesisConsumerSettingsBuilder builder = KinesisConsumerSettings.builder()
                .streamName(streamName.trim())
                .applicationName(applicationName.trim())
                .bufferSize(integerProperty(properties, PROP_BUFFER_SIZE))
                .initialPosition(initialPosition(properties));

        String retrievalMode = properties.getProperty(PROP_RETRIEVAL_MODE);
        if (StringUtils.isNotBlank(retrievalMode)) {
            builder.retrievalMode(RetrievalMode.from(retrievalMode));
        }
        Long shutdownGraceMillis = longProperty(properties, PROP_SHUTDOWN_GRACE_MILLIS);
        if (shutdownGraceMillis != null) {
            builder.shutdownGracePeriod(Duration.ofMillis(shutdownGraceMillis));
        }

        KinesisConsumerSettings settings = builder.build();
        log.info("Using consumer settings {}", settings);
        return settings;
    }

    /**
     * @param properties the properties to read
     * @return checkpoint settings, with defaults for anything not set
     * @throws IllegalArgumentException if a property value is invalid
     */
    public KinesisCheckpointSettings getCheckpointSettings(Properties properties) {
        KinesisCheckpointSettings.KinesisCheckpointSettingsBuilder builder =
                KinesisCheckpointSettings.builder().maxBatchSize(integerProperty(properties, PROP_CHECKPOINT_MAX_BATCH_SIZE));
        Long maxBatchWaitMillis = longProperty(properties, PROP_CHECKPOINT_MAX_BATCH_WAIT_MILLIS);
        if (maxBatchWaitMillis != null) {
            builder.maxBatchWait(Duration.ofMillis(maxBatchWaitMillis));
        }

        KinesisCheckpointSettings settings = builder.build();
        log.info("Using checkpoint settings {}", settings);
        return settings;
    }

    /**
     * Loads a properties file, looking for it on the classpath first and then on the file system.
     *
     * @param propertiesFile the name of the properties file
     * @return the loaded properties
     * @throws IOException if the file can't be found or read
     */
    public Properties loadProperties(String propertiesFile) throws IOException {
        return loadProperties(Thread.currentThread().getContextClassLoader(), propertiesFile);
    }

    Properties loadProperties(ClassLoader classLoader, String propertiesFile) throws IOException {
        InputStream propertyStream = classLoader.getResourceAsStream(propertiesFile);
        if (propertyStream == null) {
            File propertyFile = new File(propertiesFile);
            if (propertyFile.exists()) {
                propertyStream = new FileInputStream(propertyFile);
            }
        }
        if (propertyStream == null) {
            throw new FileNotFoundException(
                    "Unable to find property file in classpath, or file system: '" + propertiesFile + "'");
        }

        Properties properties = new Properties();
        try (InputStream in = propertyStream) {
            properties.load(in);
        }
        return properties;
    }

    private static InitialPositionInStreamExtended initialPosition(Properties properties) {
        String position = properties.getProperty(PROP_INITIAL_POSITION);
        if (StringUtils.isBlank(position)) {
            return null;
        }
        InitialPositionInStream initialPosition;
        try {
            initialPosition = InitialPositionInStream.valueOf(position.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown initial position '" + position + "'", e);
        }
        if (initialPosition == InitialPositionInStream.AT_TIMESTAMP) {
            Long epochSeconds = longProperty(properties, PROP_INITIAL_POSITION_TIMESTAMP);
            Validate.isTrue(
                    epochSeconds != null, "Property %s is required with AT_TIMESTAMP", PROP_INITIAL_POSITION_TIMESTAMP);
            return InitialPositionInStreamExtended.newInitialPositionAtTimestamp(new Date(epochSeconds * 1000L));
        }
        return InitialPositionInStreamExtended.newInitialPosition(initialPosition);
    }

    private static Integer integerProperty(Properties properties, String key) {
        Long value = longProperty(properties, key);
        if (value == null) {
            return null;
        }
        Validate.isTrue(
                value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE, "Property %s is out of range", key);
        return value.intValue();
    }

    private static Long longProperty(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be numeric but was '" + value + "'", e);
        }
    }
}
