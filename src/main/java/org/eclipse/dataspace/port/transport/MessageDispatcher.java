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

import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.port.exception.CounterpartyUnreachable;
import org.eclipse.dataspace.port.exception.DeliveryFailed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Sends protocol messages on behalf of a process. The first attempt runs inline within the attempt timeout;
 * when it fails the message is queued and retried with exponential backoff. Once the retry budget is spent the
 * owner is told through its exhaustion callback. {@link #cancel(String)} abandons every pending delivery of a
 * process without waiting for attempts in flight.
 */
public class MessageDispatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageDispatcher.class);

    private final Transport transport;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService senders;
    private final Map<String, Set<PendingDelivery>> pending = new ConcurrentHashMap<>();

    public MessageDispatcher(Transport transport, RetryPolicy retryPolicy) {
        this(transport, retryPolicy, Executors.newSingleThreadScheduledExecutor(), Executors.newCachedThreadPool());
    }

    public MessageDispatcher(Transport transport, RetryPolicy retryPolicy, ScheduledExecutorService scheduler, ExecutorService senders) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.senders = senders;
    }

    /**
     * Deliver the message, or queue it for retry.
     *
     * @return success when delivered or queued, failure with {@link CounterpartyUnreachable} when retrying is
     *         disabled and the only attempt failed
     */
    public Result<Void> dispatch(String processId, String counterpartyId, ProtocolMessage message, Consumer<CounterpartyUnreachable> onExhausted) {
        var first = attempt(counterpartyId, message);
        if (first.succeeded()) {
            return first;
        }
        if (retryPolicy.maxRetries() == 0) {
            return Result.failure(unreachable(processId, counterpartyId, first.getCause()));
        }

        LOGGER.debug("Delivery of {} to {} failed, queued for retry: {}", message.messageId(), counterpartyId, first.getCause().getMessage());
        var delivery = new PendingDelivery(processId, counterpartyId, message, onExhausted);
        pending.computeIfAbsent(processId, id -> ConcurrentHashMap.newKeySet()).add(delivery);
        schedule(delivery, 1);
        return Result.success();
    }

    /**
     * Abandon all queued deliveries of the process. Effective immediately, in-flight attempts are not awaited.
     */
    public void cancel(String processId) {
        var deliveries = pending.remove(processId);
        if (deliveries == null) {
            return;
        }
        deliveries.forEach(PendingDelivery::cancel);
        LOGGER.debug("Cancelled {} pending deliveries of process {}", deliveries.size(), processId);
    }

    public boolean hasPending(String processId) {
        var deliveries = pending.get(processId);
        return deliveries != null && !deliveries.isEmpty();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        senders.shutdownNow();
    }

    private void schedule(PendingDelivery delivery, int retry) {
        if (delivery.cancelled) {
            return;
        }
        var delay = retryPolicy.delayBefore(retry);
        delivery.future = scheduler.schedule(() -> senders.execute(() -> retry(delivery, retry)), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void retry(PendingDelivery delivery, int retry) {
        if (delivery.cancelled) {
            return;
        }
        var result = attempt(delivery.counterpartyId, delivery.message);
        if (delivery.cancelled) {
            return;
        }
        if (result.succeeded()) {
            remove(delivery);
            LOGGER.debug("Delivered {} to {} on retry {}", delivery.message.messageId(), delivery.counterpartyId, retry);
            return;
        }
        if (retry >= retryPolicy.maxRetries()) {
            remove(delivery);
            var failure = unreachable(delivery.processId, delivery.counterpartyId, result.getCause());
            LOGGER.warn("Giving up delivery of {} to {} after {} retries", delivery.message.messageId(), delivery.counterpartyId, retry);
            delivery.onExhausted.accept(failure);
            return;
        }
        schedule(delivery, retry + 1);
    }

    private Result<Void> attempt(String counterpartyId, ProtocolMessage message) {
        var timeout = retryPolicy.attemptTimeout();
        var future = CompletableFuture.supplyAsync(() -> transport.send(counterpartyId, message), senders);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Result.failure(new DeliveryFailed(message.messageId(), null, "no acknowledgement from %s within %d ms".formatted(counterpartyId, timeout.toMillis()), e));
        } catch (ExecutionException e) {
            return Result.failure(new DeliveryFailed(message.messageId(), null, "send to %s failed".formatted(counterpartyId), e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(new DeliveryFailed(message.messageId(), null, "interrupted while sending to %s".formatted(counterpartyId), e));
        }
    }

    private void remove(PendingDelivery delivery) {
        pending.computeIfPresent(delivery.processId, (id, deliveries) -> {
            deliveries.remove(delivery);
            return deliveries.isEmpty() ? null : deliveries;
        });
    }

    private CounterpartyUnreachable unreachable(String processId, String counterpartyId, Throwable cause) {
        return new CounterpartyUnreachable(processId, null, "%s did not acknowledge".formatted(counterpartyId), cause);
    }

    private static final class PendingDelivery {
        private final String processId;
        private final String counterpartyId;
        private final ProtocolMessage message;
        private final Consumer<CounterpartyUnreachable> onExhausted;
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        private PendingDelivery(String processId, String counterpartyId, ProtocolMessage message, Consumer<CounterpartyUnreachable> onExhausted) {
            this.processId = processId;
            this.counterpartyId = counterpartyId;
            this.message = message;
            this.onExhausted = onExhausted;
        }

        private void cancel() {
            cancelled = true;
            var scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
