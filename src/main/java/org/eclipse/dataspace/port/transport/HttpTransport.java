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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.port.exception.DeliveryFailed;
import org.eclipse.dataspace.port.store.ObjectMappers;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Posts every message as JSON to {@code <counterparty endpoint>/messages/<message type>}. Receiving is left to
 * the hosting server, which hands the raw body to {@link #receive(String, String)}.
 */
public class HttpTransport implements Transport {

    public static final String PARTICIPANT_HEADER = "x-participant-id";

    private String participantId;
    private final Map<String, String> endpoints = new HashMap<>();
    private HttpClient httpClient;
    private ObjectMapper objectMapper = ObjectMappers.defaultMapper();
    private Duration requestTimeout = Duration.ofSeconds(2);
    private volatile InboundHandler handler;

    public static Builder newInstance() {
        return new Builder();
    }

    @Override
    public Result<Void> send(String counterpartyId, ProtocolMessage message) {
        var endpoint = endpoints.get(counterpartyId);
        if (endpoint == null) {
            return Result.failure(new DeliveryFailed(message.messageId(), null, "no endpoint known for %s".formatted(counterpartyId)));
        }

        return toJson(message)
                .map(body -> HttpRequest.newBuilder()
                        .uri(URI.create(endpoint + "/messages/" + message.getClass().getSimpleName()))
                        .timeout(requestTimeout)
                        .header("content-type", "application/json")
                        .header(PARTICIPANT_HEADER, participantId)
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build())
                .compose(request -> {
                    try {
                        var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
                        var successful = response.statusCode() >= 200 && response.statusCode() < 300;
                        if (successful) {
                            return Result.success();
                        }
                        return Result.failure(new DeliveryFailed(message.messageId(), null,
                                "%s responded with %s".formatted(counterpartyId, response.statusCode())));
                    } catch (IOException e) {
                        return Result.failure(new DeliveryFailed(message.messageId(), null, "%s is not reachable".formatted(counterpartyId), e));
                    }
                });
    }

    @Override
    public void register(InboundHandler handler) {
        this.handler = handler;
    }

    /**
     * Entry point for the hosting server: parse the body and pass it on to the registered handler.
     */
    public Result<Void> receive(String senderId, String body) {
        var current = handler;
        if (current == null) {
            return Result.failure(new IllegalStateException("no inbound handler registered"));
        }
        try {
            return current.handle(senderId, objectMapper.readValue(body, ProtocolMessage.class));
        } catch (JsonProcessingException e) {
            return Result.failure(e);
        }
    }

    private Result<String> toJson(ProtocolMessage message) {
        try {
            return Result.success(objectMapper.writerFor(ProtocolMessage.class).writeValueAsString(message));
        } catch (JsonProcessingException e) {
            return Result.failure(e);
        }
    }

    public static class Builder {

        private final HttpTransport transport = new HttpTransport();

        private Builder() {
        }

        public HttpTransport build() {
            Objects.requireNonNull(transport.participantId, "participantId");
            if (transport.httpClient == null) {
                transport.httpClient = HttpClient.newBuilder().connectTimeout(transport.requestTimeout).build();
            }
            return transport;
        }

        public Builder participantId(String participantId) {
            transport.participantId = participantId;
            return this;
        }

        public Builder endpoint(String counterpartyId, String baseUrl) {
            transport.endpoints.put(counterpartyId, baseUrl);
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            transport.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            transport.objectMapper = objectMapper;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            transport.requestTimeout = requestTimeout;
            return this;
        }
    }
}
