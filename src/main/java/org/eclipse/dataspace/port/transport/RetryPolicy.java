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

package org.eclipse.dataspace.port.transport;

import java.time.Duration;

/**
 * Bounded exponential backoff for outbound messages.
 *
 * @param maxRetries     retries after the first attempt, zero disables retrying
 * @param initialDelay   delay before the first retry
 * @param maxDelay       ceiling of the delay between two attempts
 * @param attemptTimeout how long one attempt may take before it counts as failed
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, Duration attemptTimeout) {

    private static final int MULTIPLIER = 2;

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofMillis(200), Duration.ofSeconds(5), Duration.ofSeconds(2));
    }

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }

    /**
     * Delay before the given retry, counting from 1.
     */
    public Duration delayBefore(int retry) {
        var delay = initialDelay.toMillis();
        for (var i = 1; i < retry && delay < maxDelay.toMillis(); i++) {
            delay *= MULTIPLIER;
        }
        return Duration.ofMillis(Math.min(delay, maxDelay.toMillis()));
    }
}
