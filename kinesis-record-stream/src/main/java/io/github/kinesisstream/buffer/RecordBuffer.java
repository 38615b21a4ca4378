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
package io.github.kinesisstream.buffer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * A bounded, thread safe, first in first out buffer with any number of producers and a single consumer.
 *
 * <p>
 * Producers block in {@link #put(Object)} while the buffer is full, which is how a slow consumer pushes back on the
 * Kinesis Client Library threads delivering records. The consumer blocks in {@link #take()} while the buffer is empty.
 * </p>
 *
 * <p>
 * Once closed, either through {@link #close()} or {@link #fail(Throwable)}, every blocked producer and consumer is
 * woken up and every subsequent put or take throws a {@link BufferClosedException}. Items still buffered at that point
 * are discarded; they have not been checkpointed and will be delivered again by the Kinesis Client Library.
 * </p>
 *
 * @param <T> the type of item held in this buffer
 */
@Slf4j
public class RecordBuffer<T> {
    private final int capacity;
    private final Deque<T> items;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed;
    private Throwable failure;

    /**
     * @param capacity the maximum number of items held before producers block; must be positive
     */
    public RecordBuffer(int capacity) {
        Validate.isTrue(capacity > 0, "Buffer capacity must be positive but was %d", capacity);
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Appends an item, waiting for space to become available if the buffer is full.
     *
     * @param item the item to append
     * @throws InterruptedException if interrupted while waiting
     * @throws BufferClosedException if the buffer is closed, or is closed while waiting
     */
    public void put(@NonNull T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                throw closedException("put");
            }
            items.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest item, waiting for one to arrive if the buffer is empty.
     *
     * @return the oldest item in the buffer
     * @throws InterruptedException if interrupted while waiting
     * @throws BufferClosedException if the buffer is closed, or is closed while waiting
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && items.isEmpty()) {
                notEmpty.await();
            }
            if (closed) {
                throw closedException("take");
            }
            T item = items.removeFirst();
            notFull.signal();
            return item;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the buffer. Calling this on a closed buffer has no effect.
     */
    public void close() {
        closeWith(null);
    }

    /**
     * Closes the buffer because of a failure. The failure becomes the cause of every {@link BufferClosedException}
     * thrown afterwards. Has no effect if the buffer is already closed.
     *
     * @param cause the reason the buffer is being closed
     */
    public void fail(@NonNull Throwable cause) {
        closeWith(cause);
    }

    private void closeWith(Throwable cause) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            failure = cause;
            if (!items.isEmpty()) {
                log.debug("Discarding {} buffered items on close", items.size());
                items.clear();
            }
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private BufferClosedException closedException(String operation) {
        String message = "Unable to " + operation + ", the buffer has been closed";
        return failure == null ? new BufferClosedException(message) : new BufferClosedException(message, failure);
    }
}
