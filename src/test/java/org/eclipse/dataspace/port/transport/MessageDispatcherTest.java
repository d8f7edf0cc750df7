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
import org.eclipse.dataspace.domain.message.PresentationQueryMessage;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.port.exception.CounterpartyUnreachable;
import org.eclipse.dataspace.port.exception.DeliveryFailed;
import org.eclipse.dataspace.port.exception.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class MessageDispatcherTest {

    private final FlakyTransport transport = new FlakyTransport();
    private final ProtocolMessage message = new PresentationQueryMessage("message-1", "query-1");
    private MessageDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Nested
    class Dispatch {

        @Test
        void shouldDeliverInline_whenCounterpartyAcknowledges() {
            dispatcher = new MessageDispatcher(transport, new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(1)));

            var result = dispatcher.dispatch("P1", "provider", message, failure -> { });

            assertThat(result.succeeded()).isTrue();
            assertThat(transport.attempts.get()).isEqualTo(1);
            assertThat(dispatcher.hasPending("P1")).isFalse();
        }

        @Test
        void shouldRetryWithBackoff_untilDelivered() {
            transport.failures.set(2);
            dispatcher = new MessageDispatcher(transport, new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(1)));

            var result = dispatcher.dispatch("P1", "provider", message, failure -> { });

            assertThat(result.succeeded()).isTrue();
            await().untilAsserted(() -> assertThat(transport.delivered).containsExactly(message));
            assertThat(transport.attempts.get()).isEqualTo(3);
            await().untilAsserted(() -> assertThat(dispatcher.hasPending("P1")).isFalse());
        }

        @Test
        void shouldReportUnreachable_whenRetriesAreExhausted() {
            transport.failures.set(Integer.MAX_VALUE);
            var exhausted = new CopyOnWriteArrayList<CounterpartyUnreachable>();
            dispatcher = new MessageDispatcher(transport, new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(1)));

            dispatcher.dispatch("P1", "provider", message, exhausted::add);

            await().untilAsserted(() -> assertThat(exhausted).hasSize(1));
            assertThat(exhausted.get(0).getProcessId()).isEqualTo("P1");
            assertThat(exhausted.get(0).getKind()).isEqualTo(ErrorKind.COUNTERPARTY_UNREACHABLE);
            assertThat(transport.attempts.get()).isEqualTo(3);
        }

        @Test
        void shouldFailRightAway_whenRetryingIsDisabled() {
            transport.failures.set(1);
            dispatcher = new MessageDispatcher(transport, new RetryPolicy(0, Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(1)));

            var result = dispatcher.dispatch("P1", "provider", message, failure -> { });

            assertThatThrownBy(result::orElseThrow).isExactlyInstanceOf(CounterpartyUnreachable.class);
        }

        @Test
        void shouldCountAttempt_whenCounterpartyDoesNotAnswerInTime() {
            transport.delay = Duration.ofMillis(500);
            dispatcher = new MessageDispatcher(transport, new RetryPolicy(0, Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofMillis(50)));

            var result = dispatcher.dispatch("P1", "provider", message, failure -> { });

            assertThat(result.failed()).isTrue();
        }
    }

    @Nested
    class Cancel {

        @Test
        void shouldAbandonPendingRetries() {
            transport.failures.set(Integer.MAX_VALUE);
            var exhausted = new CopyOnWriteArrayList<CounterpartyUnreachable>();
            dispatcher = new MessageDispatcher(transport, new RetryPolicy(5, Duration.ofMillis(200), Duration.ofSeconds(1), Duration.ofSeconds(1)));
            dispatcher.dispatch("P1", "provider", message, exhausted::add);

            dispatcher.cancel("P1");

            assertThat(dispatcher.hasPending("P1")).isFalse();
            await().during(Duration.ofMillis(400)).atMost(Duration.ofSeconds(1)).untilAsserted(() -> assertThat(transport.attempts.get()).isEqualTo(1));
            assertThat(exhausted).isEmpty();
        }
    }

    @Nested
    class Backoff {

        @Test
        void shouldDoubleDelayUpToCeiling() {
            var policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(500), Duration.ofSeconds(1));

            assertThat(policy.delayBefore(1)).isEqualTo(Duration.ofMillis(100));
            assertThat(policy.delayBefore(2)).isEqualTo(Duration.ofMillis(200));
            assertThat(policy.delayBefore(3)).isEqualTo(Duration.ofMillis(400));
            assertThat(policy.delayBefore(4)).isEqualTo(Duration.ofMillis(500));
        }

        @Test
        void shouldRejectNegativeRetries() {
            assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static class FlakyTransport implements Transport {

        private final AtomicInteger failures = new AtomicInteger();
        private final AtomicInteger attempts = new AtomicInteger();
        private final CopyOnWriteArrayList<ProtocolMessage> delivered = new CopyOnWriteArrayList<>();
        private volatile Duration delay = Duration.ZERO;

        @Override
        public Result<Void> send(String counterpartyId, ProtocolMessage message) {
            attempts.incrementAndGet();
            if (!delay.isZero()) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Result.failure(e);
                }
            }
            if (failures.getAndUpdate(remaining -> remaining == Integer.MAX_VALUE ? remaining : Math.max(0, remaining - 1)) > 0) {
                return Result.failure(new DeliveryFailed(message.messageId(), null, counterpartyId + " is down"));
            }
            delivered.add(message);
            return Result.success();
        }

        @Override
        public void register(InboundHandler handler) {
        }
    }
}
