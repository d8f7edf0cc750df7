/*
 *  Copyright (c) 2025 Think-it GmbH
 *
 *  This program and the accompanying materials are made available under the
 *  terms of the Apache License, Version 2.0 which is available at
 *  https://www.apache.org/licenses/LICENSE-2.0
 *
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Contributors:
 *       Think-it GmbH - initial API and implementation
 *
 */

package org.eclipse.dataspace.port.lease;

import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.port.exception.ConcurrentModification;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer-per-id: every state transition runs while holding the exclusive lease on its process id.
 * Conflicting callers queue for at most the lease timeout, then fail with {@link ConcurrentModification}.
 * A lease is dropped as soon as nobody holds or waits for it.
 */
public class LeaseManager {

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final Duration timeout;

    public LeaseManager(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> Result<T> withLease(String processId, Supplier<Result<T>> action) {
        var lease = acquire(processId);
        try {
            if (!lease.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return Result.failure(new ConcurrentModification(processId, null,
                        "lease not acquired within %d ms".formatted(timeout.toMillis())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(new ConcurrentModification(processId, null, "interrupted while waiting for the lease", e));
        } finally {
            if (!lease.lock.isHeldByCurrentThread()) {
                release(processId);
            }
        }

        try {
            return action.get();
        } finally {
            lease.lock.unlock();
            release(processId);
        }
    }

    public boolean isHeld(String processId) {
        var lease = leases.get(processId);
        return lease != null && lease.lock.isLocked();
    }

    /**
     * Number of ids somebody currently holds or waits for.
     */
    public int size() {
        return leases.size();
    }

    private Lease acquire(String processId) {
        return leases.compute(processId, (id, lease) -> {
            var current = lease == null ? new Lease() : lease;
            current.users++;
            return current;
        });
    }

    private void release(String processId) {
        leases.computeIfPresent(processId, (id, lease) -> --lease.users == 0 ? null : lease);
    }

    private static final class Lease {

        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per-key compute
        private int users;
    }
}
