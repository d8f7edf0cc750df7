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

package org.eclipse.dataspace.claims;

import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.claims.Credential;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.eclipse.dataspace.domain.message.CredentialOfferMessage;
import org.eclipse.dataspace.domain.message.CredentialRequestMessage;
import org.eclipse.dataspace.domain.message.PresentationQueryMessage;
import org.eclipse.dataspace.domain.message.PresentationResponseMessage;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.domain.message.RevocationCheckMessage;
import org.eclipse.dataspace.domain.message.RevocationStatusMessage;
import org.eclipse.dataspace.logic.PresentationProvider;
import org.eclipse.dataspace.logic.RevocationRegistry;
import org.eclipse.dataspace.port.exception.IssuanceDenied;
import org.eclipse.dataspace.port.exception.VerificationFailed;
import org.eclipse.dataspace.port.transport.MessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The claims protocol seen from one participant: it answers credential requests, presentation queries and
 * revocation checks with its {@link ClaimsAuthority}, and keeps the credentials it received as holder.
 * Outgoing requests are correlated with their answers by request id.
 */
public class CredentialService implements PresentationProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(CredentialService.class);

    private String participantId;
    private ClaimsAuthority claimsAuthority;
    private MessageDispatcher dispatcher;
    private Duration responseTimeout = Duration.ofSeconds(10);
    private Clock clock = Clock.systemUTC();

    private final Map<String, Credential> wallet = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();

    public static Builder newInstance() {
        return new Builder();
    }

    public CompletableFuture<Credential> requestCredential(String issuerId, Map<String, Object> claims) {
        var requestId = UUID.randomUUID().toString();
        return this.<Credential>send(issuerId, requestId, new CredentialRequestMessage(newMessageId(), requestId, claims))
                .thenApply(credential -> {
                    store(credential);
                    return credential;
                });
    }

    public CompletableFuture<Presentation> queryPresentation(String counterpartyId) {
        var queryId = UUID.randomUUID().toString();
        return send(counterpartyId, queryId, new PresentationQueryMessage(newMessageId(), queryId));
    }

    public CompletableFuture<Boolean> checkRevocation(String issuerId, String credentialId) {
        var queryId = UUID.randomUUID().toString();
        return send(issuerId, queryId, new RevocationCheckMessage(newMessageId(), queryId, credentialId));
    }

    /**
     * Revocation checks against a remote issuer. Blocks until the issuer answers or the response timeout expires.
     */
    public RevocationRegistry revocationRegistry(String issuerId) {
        return credentialId -> {
            try {
                return Result.success(checkRevocation(issuerId, credentialId).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Result.failure(e);
            } catch (ExecutionException e) {
                return Result.failure(e.getCause());
            }
        };
    }

    public void store(Credential credential) {
        wallet.put(credential.id(), credential);
    }

    public List<Credential> credentials() {
        return List.copyOf(wallet.values());
    }

    /**
     * Presents every held credential that has not expired yet.
     */
    @Override
    public Result<Presentation> presentationFor(String counterpartyId) {
        var now = clock.instant();
        var held = wallet.values().stream().filter(credential -> !credential.isExpiredAt(now)).toList();
        return Result.success(Presentation.ofCredentials(participantId, held));
    }

    public Result<Void> handle(String senderId, ProtocolMessage message) {
        if (message instanceof CredentialRequestMessage request) {
            var issued = claimsAuthority.issueCredential(senderId, request.claims());
            var reply = issued.succeeded()
                    ? new CredentialOfferMessage(newMessageId(), request.requestId(), issued.getContent(), null)
                    : new CredentialOfferMessage(newMessageId(), request.requestId(), null, issued.getCause().getMessage());
            return reply(senderId, reply);
        } else if (message instanceof PresentationQueryMessage query) {
            return presentationFor(senderId)
                    .compose(presentation -> reply(senderId, new PresentationResponseMessage(newMessageId(), query.queryId(), presentation)));
        } else if (message instanceof RevocationCheckMessage check) {
            var revoked = claimsAuthority.checkRevocation(check.credentialId())
                    .onFailure(failure -> LOGGER.debug("Revocation status of {} unknown: {}", check.credentialId(), failure.getMessage()));
            return reply(senderId, new RevocationStatusMessage(newMessageId(), check.queryId(), check.credentialId(),
                    revoked.succeeded() ? revoked.getContent() : null));
        } else if (message instanceof CredentialOfferMessage offer) {
            if (offer.credential() == null) {
                return fail(offer.requestId(), new IssuanceDenied(offer.requestId(), null, Objects.toString(offer.denialReason(), "denied by " + senderId)));
            }
            return complete(offer.requestId(), offer.credential());
        } else if (message instanceof PresentationResponseMessage response) {
            return complete(response.queryId(), response.presentation());
        } else if (message instanceof RevocationStatusMessage status) {
            if (status.revoked() == null) {
                return fail(status.queryId(), new VerificationFailed(status.credentialId(), null,
                        "%s does not know credential %s".formatted(senderId, status.credentialId())));
            }
            return complete(status.queryId(), status.revoked());
        }
        return Result.failure(new IllegalArgumentException("not a claims message: " + message.getClass().getSimpleName()));
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> send(String counterpartyId, String correlationId, ProtocolMessage message) {
        var future = new CompletableFuture<Object>();
        pending.put(correlationId, future);
        future.orTimeout(responseTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> pending.remove(correlationId));

        dispatcher.dispatch(correlationId, counterpartyId, message, future::completeExceptionally)
                .onFailure(future::completeExceptionally);
        return (CompletableFuture<T>) (CompletableFuture<?>) future;
    }

    private Result<Void> reply(String counterpartyId, ProtocolMessage message) {
        return dispatcher.dispatch(message.messageId(), counterpartyId, message,
                failure -> LOGGER.warn("Reply {} to {} not delivered: {}", message.messageId(), counterpartyId, failure.getMessage()));
    }

    private Result<Void> complete(String correlationId, Object value) {
        var future = pending.remove(correlationId);
        if (future == null) {
            LOGGER.debug("No pending request {}, answer ignored", correlationId);
            return Result.success();
        }
        future.complete(value);
        return Result.success();
    }

    private Result<Void> fail(String correlationId, Throwable failure) {
        var future = pending.remove(correlationId);
        if (future != null) {
            future.completeExceptionally(failure);
        }
        return Result.success();
    }

    private static String newMessageId() {
        return UUID.randomUUID().toString();
    }

    public static class Builder {

        private final CredentialService service = new CredentialService();

        private Builder() {
        }

        public CredentialService build() {
            Objects.requireNonNull(service.participantId, "participantId");
            Objects.requireNonNull(service.claimsAuthority, "claimsAuthority");
            Objects.requireNonNull(service.dispatcher, "dispatcher");
            return service;
        }

        public Builder participantId(String participantId) {
            service.participantId = participantId;
            return this;
        }

        public Builder claimsAuthority(ClaimsAuthority claimsAuthority) {
            service.claimsAuthority = claimsAuthority;
            return this;
        }

        public Builder dispatcher(MessageDispatcher dispatcher) {
            service.dispatcher = dispatcher;
            return this;
        }

        public Builder responseTimeout(Duration responseTimeout) {
            service.responseTimeout = responseTimeout;
            return this;
        }

        public Builder clock(Clock clock) {
            service.clock = clock;
            return this;
        }
    }
}
