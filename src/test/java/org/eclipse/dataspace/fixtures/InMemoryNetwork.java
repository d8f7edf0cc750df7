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

package org.eclipse.dataspace.fixtures;

import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.port.exception.DeliveryFailed;
import org.eclipse.dataspace.port.transport.InboundHandler;
import org.eclipse.dataspace.port.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Participants exchanging messages in memory. Sending acknowledges right away, delivery happens on another thread,
 * like a server that accepts a message before processing it.
 */
public class InMemoryNetwork implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryNetwork.class);

    private final Map<String, InboundHandler> handlers = new ConcurrentHashMap<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public Transport transportFor(String participantId) {
        return new Transport() {
            @Override
            public Result<Void> send(String counterpartyId, ProtocolMessage message) {
                var handler = handlers.get(counterpartyId);
                if (handler == null || unreachable.contains(counterpartyId)) {
                    return Result.failure(new DeliveryFailed(message.messageId(), null, counterpartyId + " is not reachable"));
                }
                deliveries.add(new Delivery(participantId, counterpartyId, message));
                executor.execute(() -> handler.handle(participantId, message)
                        .onFailure(failure -> LOGGER.debug("{} rejected {}: {}", counterpartyId, message.getClass().getSimpleName(), failure.getMessage())));
                return Result.success();
            }

            @Override
            public void register(InboundHandler handler) {
                handlers.put(participantId, handler);
            }
        };
    }

    public void disconnect(String participantId) {
        unreachable.add(participantId);
    }

    public void reconnect(String participantId) {
        unreachable.remove(participantId);
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public <M extends ProtocolMessage> List<M> sent(Class<M> type) {
        return deliveries.stream().map(Delivery::message).filter(type::isInstance).map(type::cast).toList();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    public record Delivery(String senderId, String recipientId, ProtocolMessage message) {
    }
}
