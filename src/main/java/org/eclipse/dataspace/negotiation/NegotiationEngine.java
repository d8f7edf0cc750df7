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

package org.eclipse.dataspace.negotiation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.dataspace.claims.ClaimsAuthority;
import org.eclipse.dataspace.claims.Signer;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.eclipse.dataspace.domain.claims.VerificationResult;
import org.eclipse.dataspace.domain.message.ContractAgreementMessage;
import org.eclipse.dataspace.domain.message.ContractAgreementVerificationMessage;
import org.eclipse.dataspace.domain.message.ContractNegotiationEventMessage;
import org.eclipse.dataspace.domain.message.ContractNegotiationTerminationMessage;
import org.eclipse.dataspace.domain.message.ContractOfferMessage;
import org.eclipse.dataspace.domain.message.ContractRequestMessage;
import org.eclipse.dataspace.domain.message.EventType;
import org.eclipse.dataspace.domain.message.ProcessMessage;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.domain.negotiation.ContractAgreement;
import org.eclipse.dataspace.domain.negotiation.ContractOffer;
import org.eclipse.dataspace.domain.negotiation.NegotiationProcess;
import org.eclipse.dataspace.domain.negotiation.NegotiationRole;
import org.eclipse.dataspace.logic.OfferResolver;
import org.eclipse.dataspace.logic.PresentationProvider;
import org.eclipse.dataspace.port.exception.CounterpartyUnreachable;
import org.eclipse.dataspace.port.exception.InvalidStateTransition;
import org.eclipse.dataspace.port.exception.ProcessNotFoundException;
import org.eclipse.dataspace.port.exception.VerificationFailed;
import org.eclipse.dataspace.port.lease.LeaseManager;
import org.eclipse.dataspace.port.policy.PolicyDecision;
import org.eclipse.dataspace.port.policy.PolicyEngine;
import org.eclipse.dataspace.port.store.InMemoryProcessStore;
import org.eclipse.dataspace.port.store.ObjectMappers;
import org.eclipse.dataspace.port.store.ProcessStore;
import org.eclipse.dataspace.port.transport.MessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

import static org.eclipse.dataspace.domain.TerminationReasons.AGREEMENT_INVALID;
import static org.eclipse.dataspace.domain.TerminationReasons.COUNTERPARTY_UNREACHABLE;
import static org.eclipse.dataspace.domain.TerminationReasons.OFFER_LIMIT_EXCEEDED;
import static org.eclipse.dataspace.domain.TerminationReasons.POLICY_DENIED;
import static org.eclipse.dataspace.domain.TerminationReasons.VERIFICATION_FAILED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.ACCEPTED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.AGREED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.FINALIZED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.OFFERED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.TERMINATED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.VERIFIED;

/**
 * Runs this participant's side of contract negotiations, as consumer or provider. Every transition happens
 * under the lease of the local process id; inbound messages already applied are acknowledged without effect.
 */
public class NegotiationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(NegotiationEngine.class);

    private String participantId;
    private ProcessStore<NegotiationProcess> store;
    private ClaimsAuthority claimsAuthority;
    private PolicyEngine policyEngine = (claims, assetId) -> PolicyDecision.allow();
    private OfferResolver offerResolver = (consumerId, requested) -> requested;
    private Signer signer;
    private PresentationProvider presentationProvider;
    private MessageDispatcher dispatcher;
    private LeaseManager leases = new LeaseManager(Duration.ofSeconds(5));
    private int maxOfferCount = 5;
    private boolean autoAgree = true;
    private Clock clock = Clock.systemUTC();

    private final ObjectMapper canonicalMapper = ObjectMappers.canonicalMapper();

    public static Builder newInstance() {
        return new Builder();
    }

    public Result<NegotiationProcess> requestContract(String providerId, ContractOffer offer) {
        var process = NegotiationProcess.newInstance()
                .id(UUID.randomUUID().toString())
                .role(NegotiationRole.CONSUMER)
                .counterpartyId(providerId)
                .offer(offer)
                .build();

        return leases.withLease(process.getId(), () -> sendAndSave(process,
                presentation -> new ContractRequestMessage(newMessageId(), process.getId(), null, offer, presentation)));
    }

    public Result<NegotiationProcess> accept(String processId) {
        return leases.withLease(processId, () -> load(processId).compose(process -> {
            var check = expect(process, NegotiationRole.CONSUMER, OFFERED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            var offer = process.getLastOffer();
            return Result.attempt(() -> signer.sign(canonicalMapper.writeValueAsBytes(offer)))
                    .compose(signature -> {
                        process.transitionToAccepted(signature, clock.instant());
                        return sendAndSave(process, presentation -> new ContractNegotiationEventMessage(newMessageId(),
                                process.getId(), process.getCounterpartyPid(), EventType.ACCEPTED, signature, presentation));
                    });
        }));
    }

    /**
     * Decline the current offer with a counter offer, which goes back to the provider as a new request.
     */
    public Result<NegotiationProcess> decline(String processId, ContractOffer counterOffer) {
        return leases.withLease(processId, () -> load(processId).compose(process -> {
            var check = expect(process, NegotiationRole.CONSUMER, OFFERED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            process.transitionToDeclined(counterOffer, clock.instant());
            return sendAndSave(process, presentation -> new ContractRequestMessage(newMessageId(),
                    process.getId(), process.getCounterpartyPid(), counterOffer, presentation));
        }));
    }

    /**
     * Provider countersigns an accepted offer. Only needed when automatic agreement is disabled.
     */
    public Result<NegotiationProcess> agree(String processId) {
        return leases.withLease(processId, () -> load(processId).compose(process -> {
            var check = expect(process, NegotiationRole.PROVIDER, ACCEPTED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            return sendAgreement(process);
        }));
    }

    public Result<NegotiationProcess> terminate(String processId, String reason) {
        return leases.withLease(processId, () -> load(processId).compose(process -> {
            if (process.getState() == TERMINATED) {
                return Result.success(process);
            }
            if (process.getState() == FINALIZED) {
                return Result.failure(new InvalidStateTransition(processId, FINALIZED.name(), "finalized negotiations are immutable"));
            }
            return terminateAndNotify(process, reason);
        }));
    }

    public Result<NegotiationProcess> findById(String processId) {
        return store.findById(processId);
    }

    public List<NegotiationProcess> listByState(NegotiationProcess.State state) {
        return store.listByState(state);
    }

    public Result<NegotiationProcess> findByAgreementId(String agreementId) {
        return store.findFirst(process -> process.getAgreement() != null && agreementId.equals(process.getAgreement().id()))
                .recover(failure -> Result.failure(new ProcessNotFoundException(agreementId, null, "no negotiation produced agreement " + agreementId)));
    }

    /**
     * Entry point for inbound negotiation messages.
     */
    public Result<Void> handle(String senderId, ProcessMessage message) {
        if (message instanceof ContractRequestMessage request) {
            return request.providerPid() == null ? onInitialRequest(senderId, request) : onCounterRequest(senderId, request);
        } else if (message instanceof ContractOfferMessage offer) {
            return onOffer(senderId, offer);
        } else if (message instanceof ContractNegotiationEventMessage event) {
            return event.eventType() == EventType.ACCEPTED ? onAccepted(senderId, event) : onFinalized(senderId, event);
        } else if (message instanceof ContractAgreementMessage agreement) {
            return onAgreement(senderId, agreement);
        } else if (message instanceof ContractAgreementVerificationMessage verification) {
            return onVerification(senderId, verification);
        } else if (message instanceof ContractNegotiationTerminationMessage termination) {
            return onTermination(senderId, termination);
        }
        return Result.failure(new IllegalArgumentException("not a negotiation message: " + message.getClass().getSimpleName()));
    }

    /**
     * Opens at most one provider negotiation per consumer process, also when the request is redelivered concurrently.
     */
    private Result<Void> onInitialRequest(String senderId, ContractRequestMessage request) {
        return leases.withLease("contract-request:" + senderId + ":" + request.consumerPid(), () -> {
            var existing = store.findFirst(process -> process.getRole() == NegotiationRole.PROVIDER
                    && senderId.equals(process.getCounterpartyId())
                    && request.consumerPid().equals(process.getCounterpartyPid()));
            if (existing.succeeded()) {
                LOGGER.debug("Contract request {} from {} already opened negotiation {}", request.messageId(), senderId, existing.getContent().getId());
                return Result.success();
            }

            var process = NegotiationProcess.newInstance()
                    .id(UUID.randomUUID().toString())
                    .role(NegotiationRole.PROVIDER)
                    .counterpartyId(senderId)
                    .counterpartyPid(request.consumerPid())
                    .offer(request.offer())
                    .build();

            return leases.withLease(process.getId(), () -> {
                process.markProcessed(request.messageId());
                var verified = authenticate(senderId, request);
                if (verified.failed()) {
                    LOGGER.warn("Rejecting contract request from {}: {}", senderId, verified.getCause().getMessage());
                    return terminateAndNotify(process, VERIFICATION_FAILED).<Void>map(it -> null);
                }
                return offerOrTerminate(process, request.offer(), verified.getContent()).<Void>map(it -> null);
            });
        });
    }

    private Result<Void> onCounterRequest(String senderId, ContractRequestMessage request) {
        return onInbound(senderId, request.providerPid(), request, (process, verified) -> {
            var check = expect(process, NegotiationRole.PROVIDER, OFFERED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            process.transitionToDeclined(request.offer(), clock.instant());
            if (process.getOfferCount() >= maxOfferCount) {
                return terminateAndNotify(process, OFFER_LIMIT_EXCEEDED);
            }
            return offerOrTerminate(process, request.offer(), verified);
        });
    }

    private Result<Void> onOffer(String senderId, ContractOfferMessage message) {
        return onInbound(senderId, message.consumerPid(), message, (process, verified) -> {
            if (process.getRole() != NegotiationRole.CONSUMER || !process.canTransitionTo(OFFERED)) {
                return invalid(process, "unexpected offer");
            }
            if (process.getCounterpartyPid() == null) {
                process.setCounterpartyPid(message.providerPid());
            }
            if (process.getOfferCount() >= maxOfferCount) {
                process.recordOffer(message.offer());
                return terminateAndNotify(process, OFFER_LIMIT_EXCEEDED);
            }
            process.transitionToOffered(message.offer(), clock.instant());
            return save(process);
        });
    }

    private Result<Void> onAccepted(String senderId, ContractNegotiationEventMessage event) {
        return onInbound(senderId, event.providerPid(), event, (process, verified) -> {
            var check = expect(process, NegotiationRole.PROVIDER, OFFERED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            var signed = verifySignature(senderId, process.getLastOffer(), event.signature());
            if (signed.failed()) {
                LOGGER.warn("Acceptance of negotiation {} carries no valid signature of {}: {}", process.getId(), senderId, signed.getCause().getMessage());
                return terminateAndNotify(process, VERIFICATION_FAILED);
            }
            process.transitionToAccepted(event.signature(), clock.instant());
            return autoAgree ? sendAgreement(process) : save(process);
        });
    }

    private Result<Void> onAgreement(String senderId, ContractAgreementMessage message) {
        return onInbound(senderId, message.consumerPid(), message, (process, verified) -> {
            var check = expect(process, NegotiationRole.CONSUMER, ACCEPTED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            var agreement = message.agreement();
            if (agreement == null || !agreement.isSignedByBoth()) {
                return Result.failure(new VerificationFailed(process.getId(), process.getState().name(), "agreement is not signed by both parties"));
            }
            if (!Objects.equals(agreement.consumerSignature(), process.getConsumerSignature())
                    || !Objects.equals(agreement.offerId(), process.getLastOffer().id())) {
                return terminateAndNotify(process, AGREEMENT_INVALID);
            }
            var signed = verifySignature(senderId, agreement.unsigned(), agreement.providerSignature());
            if (signed.failed()) {
                LOGGER.warn("Agreement {} carries no valid signature of {}: {}", agreement.id(), senderId, signed.getCause().getMessage());
                return terminateAndNotify(process, AGREEMENT_INVALID);
            }
            process.transitionToAgreed(agreement, clock.instant());
            process.transitionToVerified(clock.instant());
            return sendAndSave(process, presentation -> new ContractAgreementVerificationMessage(newMessageId(),
                    process.getId(), process.getCounterpartyPid(), presentation));
        });
    }

    private Result<Void> onVerification(String senderId, ContractAgreementVerificationMessage message) {
        return onInbound(senderId, message.providerPid(), message, (process, verified) -> {
            var check = expect(process, NegotiationRole.PROVIDER, AGREED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            process.transitionToVerified(clock.instant());
            process.transitionToFinalized(clock.instant());
            return sendAndSave(process, presentation -> new ContractNegotiationEventMessage(newMessageId(),
                    process.getCounterpartyPid(), process.getId(), EventType.FINALIZED, null, presentation));
        });
    }

    private Result<Void> onFinalized(String senderId, ContractNegotiationEventMessage event) {
        return onInbound(senderId, event.consumerPid(), event, (process, verified) -> {
            var check = expect(process, NegotiationRole.CONSUMER, VERIFIED);
            if (check.failed()) {
                return Result.failure(check.getCause());
            }
            process.transitionToFinalized(clock.instant());
            return save(process);
        });
    }

    private Result<Void> onTermination(String senderId, ContractNegotiationTerminationMessage message) {
        var localPid = store.findById(message.providerPid() == null ? "" : message.providerPid())
                .map(process -> process.getRole() == NegotiationRole.PROVIDER ? process.getId() : message.consumerPid())
                .recover(failure -> Result.success(message.consumerPid()))
                .getContent();

        return onInbound(senderId, localPid, message, (process, verified) -> {
            if (process.getState() == TERMINATED) {
                return Result.success();
            }
            if (process.getState() == FINALIZED) {
                return invalid(process, "finalized negotiations cannot be terminated");
            }
            dispatcher.cancel(process.getId());
            process.transitionToTerminated(message.reason(), clock.instant());
            return save(process);
        });
    }

    private Result<Void> onInbound(String senderId, String localPid, ProtocolMessage message, InboundTransition transition) {
        if (localPid == null) {
            return Result.failure(new ProcessNotFoundException("unknown", null, "message %s names no local process".formatted(message.messageId())));
        }
        return leases.withLease(localPid, () -> store.findById(localPid).compose(process -> {
            if (!senderId.equals(process.getCounterpartyId())) {
                return Result.<Void>failure(new VerificationFailed(localPid, process.getState().name(), "%s is not the counterparty".formatted(senderId)));
            }
            if (process.hasProcessed(message.messageId())) {
                LOGGER.debug("Message {} already applied to negotiation {}", message.messageId(), localPid);
                return Result.<Void>success();
            }
            process.markProcessed(message.messageId());

            var verified = authenticate(senderId, message);
            if (verified.failed()) {
                LOGGER.warn("Authentication of {} on negotiation {} failed: {}", senderId, localPid, verified.getCause().getMessage());
                return process.isFinal() ? Result.<Void>success() : terminateAndNotify(process, VERIFICATION_FAILED).<Void>map(it -> null);
            }
            return transition.apply(process, verified.getContent()).<Void>map(it -> null);
        }));
    }

    private Result<NegotiationProcess> offerOrTerminate(NegotiationProcess process, ContractOffer requested, VerificationResult verified) {
        PolicyDecision decision = policyEngine.evaluate(verified.claims(), requested.assetId());
        if (!decision.allowed()) {
            LOGGER.debug("Policy denied asset {} to {}: {}", requested.assetId(), process.getCounterpartyId(), decision.reason());
            return terminateAndNotify(process, POLICY_DENIED);
        }
        var offer = offerResolver.resolve(process.getCounterpartyId(), requested);
        process.transitionToOffered(offer, clock.instant());
        return sendAndSave(process, presentation -> new ContractOfferMessage(newMessageId(),
                process.getCounterpartyPid(), process.getId(), offer, presentation));
    }

    private Result<NegotiationProcess> sendAgreement(NegotiationProcess process) {
        var draft = ContractAgreement.draft(UUID.randomUUID().toString(), process.getLastOffer(),
                process.getCounterpartyId(), participantId, clock.instant());
        return Result.attempt(() -> signer.sign(canonicalMapper.writeValueAsBytes(draft)))
                .compose(providerSignature -> {
                    var agreement = draft.withConsumerSignature(process.getConsumerSignature()).withProviderSignature(providerSignature);
                    if (!agreement.isSignedByBoth()) {
                        LOGGER.debug("Negotiation {} stays ACCEPTED, consumer signature missing", process.getId());
                        return save(process).<NegotiationProcess>map(it -> process);
                    }
                    process.transitionToAgreed(agreement, clock.instant());
                    return sendAndSave(process, presentation -> new ContractAgreementMessage(newMessageId(),
                            process.getCounterpartyPid(), process.getId(), agreement, presentation));
                });
    }

    private Result<Void> verifySignature(String participantId, Object signed, String signature) {
        return Result.attempt(() -> canonicalMapper.writeValueAsBytes(signed))
                .compose(payload -> claimsAuthority.verifySignature(participantId, payload, signature));
    }

    private Result<NegotiationProcess> terminateAndNotify(NegotiationProcess process, String reason) {
        dispatcher.cancel(process.getId());
        process.transitionToTerminated(reason, clock.instant());
        var consumerPid = process.isConsumer() ? process.getId() : process.getCounterpartyPid();
        var providerPid = process.isConsumer() ? process.getCounterpartyPid() : process.getId();
        var presentation = presentationProvider.presentationFor(process.getCounterpartyId())
                .recover(failure -> Result.success(null))
                .getContent();
        var message = new ContractNegotiationTerminationMessage(newMessageId(), consumerPid, providerPid, reason, presentation);
        dispatcher.dispatch(process.getId(), process.getCounterpartyId(), message,
                        failure -> LOGGER.debug("Termination of negotiation {} not delivered: {}", process.getId(), failure.getMessage()))
                .onFailure(failure -> LOGGER.debug("Termination of negotiation {} not delivered: {}", process.getId(), failure.getMessage()));
        LOGGER.debug("Negotiation {} terminated: {}", process.getId(), reason);
        return store.save(process).map(it -> process);
    }

    private Result<NegotiationProcess> sendAndSave(NegotiationProcess process, Function<Presentation, ProtocolMessage> messageFactory) {
        var counterpartyId = process.getCounterpartyId();
        return presentationProvider.presentationFor(counterpartyId)
                .compose(presentation -> dispatcher.dispatch(process.getId(), counterpartyId, messageFactory.apply(presentation),
                        failure -> onCounterpartyUnreachable(process.getId(), failure)))
                .recover(failure -> {
                    if (failure instanceof CounterpartyUnreachable) {
                        if (!process.isFinal()) {
                            process.transitionToTerminated(COUNTERPARTY_UNREACHABLE, clock.instant());
                        }
                        store.save(process);
                    }
                    return Result.failure(failure);
                })
                .compose(it -> save(process).map(saved -> process));
    }

    private void onCounterpartyUnreachable(String processId, CounterpartyUnreachable failure) {
        leases.withLease(processId, () -> store.findById(processId).compose(process -> {
            if (process.isFinal()) {
                return Result.<Void>success();
            }
            LOGGER.warn("Negotiation {} terminated, {}", processId, failure.getMessage());
            process.transitionToTerminated(COUNTERPARTY_UNREACHABLE, clock.instant());
            return store.save(process);
        })).onFailure(error -> LOGGER.warn("Could not terminate unreachable negotiation {}: {}", processId, error.getMessage()));
    }

    private Result<VerificationResult> authenticate(String senderId, ProtocolMessage message) {
        var presentation = message.presentation();
        if (presentation == null) {
            return Result.failure(new VerificationFailed(message.messageId(), null, "message carries no presentation"));
        }
        if (!senderId.equals(presentation.holderId())) {
            return Result.failure(new VerificationFailed(message.messageId(), null, "presentation holder is not the sender"));
        }
        return claimsAuthority.verifyPresentation(presentation);
    }

    private Result<NegotiationProcess> load(String processId) {
        return store.findById(processId);
    }

    private Result<Void> save(NegotiationProcess process) {
        LOGGER.debug("Negotiation {} is now {}", process.getId(), process.getState());
        return store.save(process);
    }

    private Result<Void> expect(NegotiationProcess process, NegotiationRole role, NegotiationProcess.State state) {
        if (process.getRole() != role || process.getState() != state) {
            return invalid(process, "expected %s in %s".formatted(role, state));
        }
        return Result.success();
    }

    private <T> Result<T> invalid(NegotiationProcess process, String detail) {
        return Result.failure(new InvalidStateTransition(process.getId(), process.getState().name(), detail));
    }

    private static String newMessageId() {
        return UUID.randomUUID().toString();
    }

    @FunctionalInterface
    private interface InboundTransition {
        Result<?> apply(NegotiationProcess process, VerificationResult verified);
    }

    public static class Builder {

        private final NegotiationEngine engine = new NegotiationEngine();

        private Builder() {
        }

        public NegotiationEngine build() {
            Objects.requireNonNull(engine.participantId, "participantId");
            Objects.requireNonNull(engine.claimsAuthority, "claimsAuthority");
            Objects.requireNonNull(engine.signer, "signer");
            Objects.requireNonNull(engine.presentationProvider, "presentationProvider");
            Objects.requireNonNull(engine.dispatcher, "dispatcher");
            if (engine.store == null) {
                engine.store = new InMemoryProcessStore<>(ObjectMappers.defaultMapper(), NegotiationProcess.class);
            }
            return engine;
        }

        public Builder participantId(String participantId) {
            engine.participantId = participantId;
            return this;
        }

        public Builder store(ProcessStore<NegotiationProcess> store) {
            engine.store = store;
            return this;
        }

        public Builder claimsAuthority(ClaimsAuthority claimsAuthority) {
            engine.claimsAuthority = claimsAuthority;
            return this;
        }

        public Builder policyEngine(PolicyEngine policyEngine) {
            engine.policyEngine = policyEngine;
            return this;
        }

        public Builder offerResolver(OfferResolver offerResolver) {
            engine.offerResolver = offerResolver;
            return this;
        }

        public Builder signer(Signer signer) {
            engine.signer = signer;
            return this;
        }

        public Builder presentationProvider(PresentationProvider presentationProvider) {
            engine.presentationProvider = presentationProvider;
            return this;
        }

        public Builder dispatcher(MessageDispatcher dispatcher) {
            engine.dispatcher = dispatcher;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            engine.leases = new LeaseManager(leaseTimeout);
            return this;
        }

        public Builder maxOfferCount(int maxOfferCount) {
            engine.maxOfferCount = maxOfferCount;
            return this;
        }

        public Builder autoAgree(boolean autoAgree) {
            engine.autoAgree = autoAgree;
            return this;
        }

        public Builder clock(Clock clock) {
            engine.clock = clock;
            return this;
        }
    }
}
