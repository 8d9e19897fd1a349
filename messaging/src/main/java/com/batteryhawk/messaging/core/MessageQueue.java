/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.QueueFullException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO buffer of undelivered outbound messages.
 *
 * <p>The lock only guards the in-memory deque; callers deliver outside it. When the queue
 * is full the oldest message is evicted, or with {@link ReconnectionConfig.OverflowPolicy#REJECT}
 * the new message is refused.</p>
 */
public class MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(MessageQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueuedMessage> deque = new ArrayDeque<>();
    private int capacity;
    private ReconnectionConfig.OverflowPolicy overflowPolicy;

    public MessageQueue(int capacity, ReconnectionConfig.OverflowPolicy overflowPolicy) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        this.capacity = capacity;
        this.overflowPolicy = overflowPolicy;
    }

    /**
     * Append at the tail.
     *
     * @return the evicted oldest message, or {@code null} if nothing had to go
     * @throws QueueFullException if the queue is full and the policy is {@code REJECT}
     */
    public QueuedMessage enqueue(QueuedMessage msg) {
        QueuedMessage evicted = null;
        lock.lock();
        try {
            if (deque.size() >= capacity) {
                if (overflowPolicy == ReconnectionConfig.OverflowPolicy.REJECT) {
                    throw new QueueFullException(msg.topic(), capacity);
                }
                evicted = deque.pollFirst();
            }
            deque.addLast(msg);
        } finally {
            lock.unlock();
        }
        if (evicted != null) {
            log.warn("Message queue full, dropping oldest message to topic '{}'", evicted.topic());
        }
        return evicted;
    }

    /** Remove and return the head, or {@code null} when empty. */
    public QueuedMessage poll() {
        lock.lock();
        try {
            return deque.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a message back at the head so it keeps its place ahead of everything queued after it.
     *
     * @return {@code false} if the queue filled up in the meantime; the message is then the oldest
     *         entry and is dropped instead
     */
    public boolean requeueAtHead(QueuedMessage msg) {
        lock.lock();
        try {
            if (deque.size() >= capacity) {
                return false;
            }
            deque.addFirst(msg);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public QueuedMessage peek() {
        lock.lock();
        try {
            return deque.peekFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Change capacity in place. A smaller capacity evicts the oldest overflow.
     *
     * @return the evicted messages, oldest first
     */
    public List<QueuedMessage> resize(int newCapacity, ReconnectionConfig.OverflowPolicy newPolicy) {
        if (newCapacity < 1) throw new IllegalArgumentException("capacity must be >= 1, got " + newCapacity);
        List<QueuedMessage> evicted = new ArrayList<>();
        lock.lock();
        try {
            this.capacity = newCapacity;
            this.overflowPolicy = newPolicy;
            while (deque.size() > newCapacity) {
                evicted.add(deque.pollFirst());
            }
        } finally {
            lock.unlock();
        }
        if (!evicted.isEmpty()) {
            log.warn("Message queue shrunk to {}, dropped {} oldest message(s)", newCapacity, evicted.size());
        }
        return evicted;
    }

    public int size() {
        lock.lock();
        try {
            return deque.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int capacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the queue contents, head first. */
    public List<QueuedMessage> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(deque);
        } finally {
            lock.unlock();
        }
    }
}
