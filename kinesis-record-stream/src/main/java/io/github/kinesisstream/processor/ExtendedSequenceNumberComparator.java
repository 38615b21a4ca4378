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

import java.io.Serializable;
import java.util.Comparator;

import software.amazon.kinesis.retrieval.kpl.ExtendedSequenceNumber;

/**
 * Orders records of the same shard by their position in that shard.
 *
 * <p>
 * Sequence numbers are compared by their numeric value, the way {@link ExtendedSequenceNumber} defines it, and not
 * lexicographically. Records with the same sequence number, which happens for records de-aggregated from a KPL
 * aggregate, are then ordered by sub-sequence number.
 * </p>
 */
public class ExtendedSequenceNumberComparator implements Comparator<CommittableRecord>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final ExtendedSequenceNumberComparator INSTANCE = new ExtendedSequenceNumberComparator();

    /**
     * @throws IllegalArgumentException if either sequence number is neither a number nor a sentinel checkpoint
     */
    @Override
    public int compare(CommittableRecord first, CommittableRecord second) {
        return first.extendedSequenceNumber().compareTo(second.extendedSequenceNumber());
    }
}
