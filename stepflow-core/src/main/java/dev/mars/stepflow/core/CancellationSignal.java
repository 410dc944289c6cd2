/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.stepflow.core;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative cancellation flag shared by every step of one flow execution.
 *
 * <p>The engine never interrupts a running unit of work. Steps that perform long
 * waits should poll {@link #isCancelled()} or wait through
 * {@link #awaitCancellation(Duration)} so they can exit once the flow deadline fires.</p>
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Lock lock = new ReentrantLock();
    private final Condition cancelledCondition = lock.newCondition();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Raises the signal and wakes every waiter.
     *
     * @return true if this call raised the signal, false if it was already raised
     */
    public boolean cancel() {
        lock.lock();
        try {
            boolean changed = cancelled.compareAndSet(false, true);
            cancelledCondition.signalAll();
            return changed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code maxWait} for the signal.
     * Usable as a cancellable sleep inside a unit of work.
     *
     * @param maxWait maximum time to wait
     * @return true if cancelled (or the waiting thread was interrupted), false if the wait elapsed
     */
    public boolean awaitCancellation(Duration maxWait) {
        if (cancelled.get()) {
            return true;
        }

        lock.lock();
        try {
            long remainingNanos = maxWait.toNanos();

            while (!cancelled.get() && remainingNanos > 0) {
                try {
                    remainingNanos = cancelledCondition.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return true;
                }
            }

            return cancelled.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + cancelled.get() + '}';
    }
}
