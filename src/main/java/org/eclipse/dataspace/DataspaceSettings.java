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

package org.eclipse.dataspace;

import org.eclipse.dataspace.port.transport.RetryPolicy;

import java.time.Duration;
import java.util.Properties;

/**
 * Tunables of a connector.
 */
public record DataspaceSettings(
        int maxOfferCount,
        Duration leaseTimeout,
        Duration tokenTtl,
        Duration credentialTtl,
        RetryPolicy retryPolicy
) {

    public static final String MAX_OFFER_COUNT = "dataspace.negotiation.max-offer-count";
    public static final String LEASE_TIMEOUT_MS = "dataspace.lease.timeout-ms";
    public static final String TOKEN_TTL_SECONDS = "dataspace.token.ttl-seconds";
    public static final String CREDENTIAL_TTL_DAYS = "dataspace.credential.ttl-days";
    public static final String RETRY_MAX_RETRIES = "dataspace.retry.max-retries";
    public static final String RETRY_INITIAL_DELAY_MS = "dataspace.retry.initial-delay-ms";
    public static final String RETRY_MAX_DELAY_MS = "dataspace.retry.max-delay-ms";
    public static final String RETRY_ATTEMPT_TIMEOUT_MS = "dataspace.retry.attempt-timeout-ms";

    public static DataspaceSettings defaults() {
        return new DataspaceSettings(5, Duration.ofSeconds(5), Duration.ofMinutes(10), Duration.ofDays(365), RetryPolicy.defaults());
    }

    /**
     * Read settings from {@code dataspace.*} properties. Missing keys keep their default.
     *
     * @throws IllegalArgumentException when a value is not a number, or out of range
     */
    public static DataspaceSettings fromProperties(Properties properties) {
        var defaults = defaults();
        var retry = defaults.retryPolicy();
        var retryPolicy = new RetryPolicy(
                (int) read(properties, RETRY_MAX_RETRIES, retry.maxRetries()),
                Duration.ofMillis(read(properties, RETRY_INITIAL_DELAY_MS, retry.initialDelay().toMillis())),
                Duration.ofMillis(read(properties, RETRY_MAX_DELAY_MS, retry.maxDelay().toMillis())),
                Duration.ofMillis(read(properties, RETRY_ATTEMPT_TIMEOUT_MS, retry.attemptTimeout().toMillis())));

        return new DataspaceSettings(
                (int) read(properties, MAX_OFFER_COUNT, defaults.maxOfferCount()),
                Duration.ofMillis(read(properties, LEASE_TIMEOUT_MS, defaults.leaseTimeout().toMillis())),
                Duration.ofSeconds(read(properties, TOKEN_TTL_SECONDS, defaults.tokenTtl().toSeconds())),
                Duration.ofDays(read(properties, CREDENTIAL_TTL_DAYS, defaults.credentialTtl().toDays())),
                retryPolicy);
    }

    public DataspaceSettings {
        if (maxOfferCount < 1) {
            throw new IllegalArgumentException("maxOfferCount must be at least 1");
        }
    }

    private static long read(Properties properties, String key, long defaultValue) {
        var value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            var parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException("%s must not be negative, was %s".formatted(key, value));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("%s is not a number: %s".formatted(key, value), e);
        }
    }
}
