/*
 * Where: Relay broadcast hub
 * What: Bounded per-subscriber frame queue with non-blocking offer and closable blocking take
 * Why: Publishers must never wait on a slow subscriber; closing wakes the writer so it can exit
 */
package com.example.relay.hub;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

public final class OutboundQueue {

  private final int capacity;
  private final ArrayDeque<PushMessage> buffer;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private boolean closed;

  public OutboundQueue(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.buffer = new ArrayDeque<>(capacity);
  }

  /** Returns {@code false} without waiting when the queue is full or closed. */
  public boolean offer(PushMessage message) {
    lock.lock();
    try {
      if (closed || buffer.size() >= capacity) {
        return false;
      }
      buffer.addLast(message);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the next frame.
   *
   * @return the next frame, or empty once the queue has been closed
   */
  public Optional<PushMessage> take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (buffer.isEmpty() && !closed) {
        notEmpty.await();
      }
      if (closed) {
        return Optional.empty();
      }
      return Optional.of(buffer.removeFirst());
    } finally {
      lock.unlock();
    }
  }

  /** Idempotent. Pending frames are discarded. */
  public void close() {
    lock.lock();
    try {
      closed = true;
      buffer.clear();
      notEmpty.signalAll();
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
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }
}
