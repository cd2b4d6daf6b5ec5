package io.dvid.client.throttle;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.dvid.client.DvidException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/// Admission control for expensive volume transfers.
///
/// At most one transfer runs through a gate at a time; waiters are admitted
/// in arrival order. Node services built without an explicit gate share
/// [#processWide()], so throttled transfers are serialized across every
/// service instance and thread in the process. Tests and callers that need
/// isolation can construct their own gate.
///
/// The gate is held only for the duration of the transfer passed to
/// [#call(Transfer)] and is released on every exit path.
public final class ThrottleGate {

    private static final Logger logger = LogManager.getLogger(ThrottleGate.class);

    private static final ThrottleGate PROCESS_WIDE = new ThrottleGate("process");

    private final String name;
    private final Semaphore permit = new Semaphore(1, true);
    private final AtomicLong admitted = new AtomicLong();

    /// A work unit run while holding the gate.
    /// @param <T> result type
    @FunctionalInterface
    public interface Transfer<T> {
        T run() throws IOException;
    }

    /// Creates an independent gate.
    /// @param name label used in log messages
    public ThrottleGate(String name) {
        this.name = name;
    }

    /// The gate shared by every node service that is not given one explicitly.
    public static ThrottleGate processWide() {
        return PROCESS_WIDE;
    }

    /// Runs a transfer while holding the gate.
    /// @param transfer the work to run
    /// @param <T> result type
    /// @return the transfer's result
    /// @throws IOException if the transfer throws it
    /// @throws DvidException if the thread is interrupted while waiting
    public <T> T call(Transfer<T> transfer) throws IOException {
        try {
            permit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DvidException("Interrupted while waiting for throttle gate '" + name + "'", e);
        }
        long ticket = admitted.incrementAndGet();
        logger.trace("throttle gate '{}' acquired (#{})", name, ticket);
        try {
            return transfer.run();
        } finally {
            permit.release();
            logger.trace("throttle gate '{}' released (#{})", name, ticket);
        }
    }

    /// @return true if a transfer currently holds the gate
    public boolean isHeld() {
        return permit.availablePermits() == 0;
    }

    /// @return an estimate of the threads waiting for the gate
    public int getQueueLength() {
        return permit.getQueueLength();
    }

    /// @return the number of transfers admitted so far
    public long getAdmittedCount() {
        return admitted.get();
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "ThrottleGate[" + name + "]";
    }
}
