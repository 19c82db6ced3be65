/*
 * Copyright 2021 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.telemetry.gateway.services;

import com.rackspace.telemetry.gateway.config.QueryProperties;
import com.rackspace.telemetry.gateway.exceptions.AdmissionTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Bounds the number of bulk queries served at once. Waiting requests are admitted in arrival
 * order.
 * <p>
 * Waiting does not occupy a thread. Each waiter is parked in a queue and either handed the
 * slot of a finishing request or failed by a timer started when it subscribed, so the wait is
 * bounded regardless of how busy the schedulers doing the query work are.
 * </p>
 */
@Component
@Slf4j
public class AdmissionController {

  private enum State {
    WAITING,
    ADMITTED,
    EXPIRED,
    CANCELLED
  }

  private final int capacity;
  private final Duration timeout;
  private final Scheduler timer;
  private final Deque<Waiter> waiters = new ArrayDeque<>();
  private int available;

  @Autowired
  public AdmissionController(QueryProperties queryProperties) {
    this(queryProperties.getRequestQueueSize(), queryProperties.getRequestQueueTimeout());
  }

  public AdmissionController(int capacity, Duration timeout) {
    this(capacity, timeout, Schedulers.parallel());
  }

  AdmissionController(int capacity, Duration timeout, Scheduler timer) {
    this.capacity = capacity;
    this.timeout = timeout;
    this.timer = timer;
    this.available = capacity;
    log.info("Request queue size is {} with {} timeout", capacity, timeout);
  }

  /**
   * @return the acquired slot, which must be closed when the request finishes. Fails with
   * {@link AdmissionTimeoutException} if no slot freed up within the timeout, measured from
   * subscription.
   */
  public Mono<Slot> admit() {
    return Mono.create(sink -> {
      final Waiter waiter = new Waiter(sink);
      sink.onCancel(() -> cancel(waiter));

      final boolean admitted;
      synchronized (this) {
        if (waiter.state != State.WAITING) {
          return;
        }
        admitted = available > 0 && waiters.isEmpty();
        if (admitted) {
          available--;
          waiter.admit(new Slot());
        } else {
          waiters.addLast(waiter);
        }
      }

      if (admitted) {
        sink.success(waiter.slot);
      } else {
        waiter.expiry = timer.schedule(() -> expire(waiter), timeout.toNanos(),
            TimeUnit.NANOSECONDS);
      }
    });
  }

  public synchronized int getAvailableSlots() {
    return available;
  }

  public synchronized int getWaiting() {
    return waiters.size();
  }

  public int getCapacity() {
    return capacity;
  }

  private void expire(Waiter waiter) {
    synchronized (this) {
      if (waiter.state != State.WAITING) {
        return;
      }
      waiter.state = State.EXPIRED;
      waiters.remove(waiter);
    }
    waiter.sink.error(new AdmissionTimeoutException(timeout));
  }

  private void cancel(Waiter waiter) {
    final Slot orphaned;
    synchronized (this) {
      if (waiter.state == State.WAITING) {
        waiter.state = State.CANCELLED;
        waiters.remove(waiter);
      }
      // admitted but the slot never reached the subscriber
      orphaned = waiter.state == State.ADMITTED ? waiter.slot : null;
    }
    waiter.disposeExpiry();
    if (orphaned != null) {
      orphaned.close();
    }
  }

  private void release() {
    final Waiter next;
    synchronized (this) {
      next = waiters.pollFirst();
      if (next == null) {
        available++;
        return;
      }
      next.admit(new Slot());
    }
    next.disposeExpiry();
    next.sink.success(next.slot);
  }

  private static final class Waiter {

    private final MonoSink<Slot> sink;
    private State state = State.WAITING;
    private Slot slot;
    private volatile Disposable expiry;

    private Waiter(MonoSink<Slot> sink) {
      this.sink = sink;
    }

    private void admit(Slot slot) {
      this.state = State.ADMITTED;
      this.slot = slot;
    }

    private void disposeExpiry() {
      final Disposable scheduled = expiry;
      if (scheduled != null) {
        scheduled.dispose();
      }
    }
  }

  public final class Slot implements AutoCloseable {

    private final AtomicBoolean released = new AtomicBoolean();

    private Slot() {
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        release();
      }
    }
  }
}
