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

package org.eclipse.dataspace.transfer;

import org.eclipse.dataspace.claims.ClaimsAuthority;
import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.TransferType;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.eclipse.dataspace.domain.dataflow.DataFlowStartMessage;
import org.eclipse.dataspace.domain.message.ProcessMessage;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.domain.message.TransferCompletionMessage;
import org.eclipse.dataspace.domain.message.TransferRequestMessage;
import org.eclipse.dataspace.domain.message.TransferStartMessage;
import org.eclipse.dataspace.domain.message.TransferSuspensionMessage;
import org.eclipse.dataspace.domain.message.TransferTerminationMessage;
import org.eclipse.dataspace.domain.negotiation.NegotiationProcess;
import org.eclipse.dataspace.domain.transfer.TransferProcess;
import org.eclipse.dataspace.domain.transfer.TransferRole;
import org.eclipse.dataspace.logic.PresentationProvider;
import org.eclipse.dataspace.negotiation.NegotiationEngine;
import org.eclipse.dataspace.port.exception.ContractNotAgreed;
import org.eclipse.dataspace.port.exception.CounterpartyUnreachable;
import org.eclipse.dataspace.port.exception.InvalidStateTransition;
import org.eclipse.dataspace.port.exception.ProcessNotFoundException;
import org.eclipse.dataspace.port.exception.VerificationFailed;
import org.eclipse.dataspace.port.lease.LeaseManager;
import org.eclipse.dataspace.port.store.InMemoryProcessStore;
import org.eclipse.dataspace.port.store.ObjectMappers;
import org.eclipse.dataspace.port.store.ProcessStore;
import org.eclipse.dataspace.port.transport.MessageDispatcher;
import org.eclipse.dataspace.signaling.SignalingController;
import org.eclipse.dataspace.signaling.Trigger;
import org.eclipse.dataspace.signaling.TriggerHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

import static org.eclipse.dataspace.domain.TerminationReasons.COMPLETED;
import static org.eclipse.dataspace.domain.TerminationReasons.COUNTERPARTY_UNREACHABLE;
import static org.eclipse.dataspace.domain.TerminationReasons.VERIFICATION_FAILED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.REQUESTED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.STARTED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.SUSPENDED;

/**
 * Supervises transfers across the organizational boundary. On the provider every transition is first applied to the
 * local data flow through the {@link SignalingController} and then mirrored here; the consumer only mirrors what
 * the provider reports. Transfers are only possible on agreements whose negotiation is FINALIZED.
 */
public class TransferCoordinator implements TriggerHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransferCoordinator.class);

    private ProcessStore<TransferProcess> store;
    private NegotiationEngine negotiations;
    private SignalingController signaling;
    private ClaimsAuthority claimsAuthority;
    private PresentationProvider presentationProvider;
    private MessageDispatcher dispatcher;
    private LeaseManager leases = new LeaseManager(Duration.ofSeconds(5));
    private Clock clock = Clock.systemUTC();

    public static Builder newInstance() {
        return new Builder();
    }

    /**
     * Start a transfer on a local agreement, provisioning the data plane right away.
     *
     * @return the STARTED process, carrying the EDR for PULL transfers
     */
    public Result<TransferProcess> requestTransfer(String agreementId, TransferType transferType, DataAddress dataAddress) {
        return requireFinalized(agreementId).compose(negotiation -> {
            var process = TransferProcess.newInstance()
                    .id(UUID.randomUUID().toString())
                    .role(TransferRole.PROVIDER)
                    .counterpartyId(negotiation.getCounterpartyId())
                    .agreementId(agreementId)
                    .transferType(transferType)
                    .dataAddress(dataAddress)
                    .build();
            return leases.withLease(process.getId(), () -> startProvider(process));
        });
    }

    /**
     * Ask the provider of the agreement to start a transfer. The returned process stays REQUESTED until the
     * provider's start message arrives.
     */
    public Result<TransferProcess> requestRemoteTransfer(String agreementId, TransferType transferType, DataAddress dataAddress) {
        return requireFinalized(agreementId).compose(negotiation -> {
            var process = TransferProcess.newInstance()
                    .id(UUID.randomUUID().toString())
                    .role(TransferRole.CONSUMER)
                    .counterpartyId(negotiation.getCounterpartyId())
                    .agreementId(agreementId)
                    .transferType(transferType)
                    .dataAddress(dataAddress)
                    .build();
            return leases.withLease(process.getId(), () -> sendAndSave(process, presentation -> new TransferRequestMessage(
                    newMessageId(), process.getId(), null, agreementId, transferType, dataAddress, presentation)));
        });
    }

    @Override
    public Result<TransferProcess> suspend(String processId, String reason) {
        return leases.withLease(processId, () -> load(processId).compose(process -> {
            if (process.getState() == SUSPENDED) {
                return Result.success(process);
            }
            if (process.getState() != STARTED) {
                return invalid(process, "only started transfers can be suspended");
            }
            var suspended = process.isProvider()
                    ? signaling.suspend(processId, reason).<Void>map(it -> null)
                    : Result.<Void>success();
            return suspended.compose(it -> {
                process.transitionToSuspended(reason, clock.instant());
                return notifyAndSave(process, presentation -> new TransferSuspensionMessage(newMessageId(),
                        consumerPid(process), providerPid(process), reason, presentation));
            });
        }));
    }

    /**
     * Restart a suspended transfer. The agreement is checked again, so a transfer can not outlive its contract.
     */
    public Result<TransferProcess> resume(String processId) {
        return leases.withLease(processId, () -> load(processId).compose(process -> {
            if (process.getState() != SUSPENDED) {
                return invalid(process, "only suspended transfers can be resumed");
            }
            return requireFinalized(process.getAgreementId()).compose(negotiation -> {
                if (process.isProvider()) {
                    return resumeProvider(process);
                }
                return presentationProvider.presentationFor(process.getCounterpartyId())
                        .compose(presentation -> dispatcher.dispatch(processId, process.getCounterpartyId(),
                                new TransferStartMessage(newMessageId(), processId, process.getCounterpartyPid(), null, presentation),
                                failure -> onCounterpartyUnreachable(processId, failure)))
                        .<TransferProcess>map(it -> process);
            });
        }));
    }

    /**
     * Terminate the transfer. {@link org.eclipse.dataspace.domain.TerminationReasons#COMPLETED} ends it in
     * COMPLETED, every other reason in TERMINATED. Ending an already ended transfer is a successful no-op.
     */
    @Override
    public Result<TransferProcess> terminate(String processId, String reason) {
        return leases.withLease(processId, () -> load(processId).compose(process -> {
            if (process.isFinal()) {
                return Result.success(process);
            }
            dispatcher.cancel(processId);
            var stopped = process.isProvider()
                    ? signaling.terminate(processId, reason).<Void>map(it -> null)
                    : Result.<Void>success();
            return stopped.compose(it -> endAndNotify(process, reason));
        }));
    }

    public Result<TransferProcess> complete(String processId) {
        return terminate(processId, COMPLETED);
    }

    public Result<TransferProcess> findById(String processId) {
        return store.findById(processId);
    }

    public List<TransferProcess> listByState(TransferProcess.State state) {
        return store.listByState(state);
    }

    /**
     * Entry point for inbound transfer messages.
     */
    public Result<Void> handle(String senderId, ProcessMessage message) {
        if (message instanceof TransferRequestMessage request) {
            return onRequest(senderId, request);
        }
        var localPid = localPid(message);
        if (message instanceof TransferStartMessage start) {
            return onInbound(senderId, localPid, start, process -> process.isProvider() ? onResumeRequest(process) : onStart(process, start));
        } else if (message instanceof TransferSuspensionMessage suspension) {
            return onInbound(senderId, localPid, suspension, process -> onSuspension(process, suspension.reason()));
        } else if (message instanceof TransferTerminationMessage termination) {
            return onInbound(senderId, localPid, termination, process -> onEnd(process, termination.reason()));
        } else if (message instanceof TransferCompletionMessage completion) {
            return onInbound(senderId, localPid, completion, process -> onEnd(process, COMPLETED));
        }
        return Result.failure(new IllegalArgumentException("not a transfer message: " + message.getClass().getSimpleName()));
    }

    /**
     * Opens at most one provider transfer per consumer process, also when the request is redelivered concurrently.
     */
    private Result<Void> onRequest(String senderId, TransferRequestMessage request) {
        return leases.withLease("transfer-request:" + senderId + ":" + request.consumerPid(), () -> {
            var existing = store.findFirst(process -> process.isProvider()
                    && senderId.equals(process.getCounterpartyId())
                    && request.consumerPid().equals(process.getCounterpartyPid()));
            if (existing.succeeded()) {
                LOGGER.debug("Transfer request {} from {} already opened transfer {}", request.messageId(), senderId, existing.getContent().getId());
                return Result.success();
            }

            var verified = authenticate(senderId, request);
            if (verified.failed()) {
                LOGGER.warn("Rejecting transfer request from {}: {}", senderId, verified.getCause().getMessage());
                refuse(senderId, request, VERIFICATION_FAILED);
                return Result.failure(verified.getCause());
            }

            var agreed = requireFinalized(request.agreementId())
                    .compose(negotiation -> senderId.equals(negotiation.getCounterpartyId())
                            ? Result.success(negotiation)
                            : Result.<NegotiationProcess>failure(new ContractNotAgreed(request.agreementId(), negotiation.getState().name(),
                            "agreement was not concluded with " + senderId)));
            if (agreed.failed()) {
                refuse(senderId, request, "ContractNotAgreed");
                return Result.failure(agreed.getCause());
            }

            var process = TransferProcess.newInstance()
                    .id(UUID.randomUUID().toString())
                    .role(TransferRole.PROVIDER)
                    .counterpartyId(senderId)
                    .counterpartyPid(request.consumerPid())
                    .agreementId(request.agreementId())
                    .transferType(request.transferType())
                    .dataAddress(request.dataAddress())
                    .build();
            process.markProcessed(request.messageId());
            return leases.withLease(process.getId(), () -> startProvider(process)).<Void>map(it -> null);
        });
    }

    private Result<TransferProcess> onStart(TransferProcess process, TransferStartMessage start) {
        if (process.getCounterpartyPid() == null) {
            process.setCounterpartyPid(start.providerPid());
        }
        if (process.getState() == REQUESTED) {
            process.transitionToProvisioned(clock.instant());
        } else if (process.getState() != SUSPENDED) {
            return invalid(process, "unexpected start");
        }
        process.transitionToStarted(start.edr(), clock.instant());
        return save(process);
    }

    private Result<TransferProcess> onResumeRequest(TransferProcess process) {
        if (process.getState() == STARTED) {
            return Result.success(process);
        }
        if (process.getState() != SUSPENDED) {
            return invalid(process, "only suspended transfers can be resumed");
        }
        return requireFinalized(process.getAgreementId()).compose(negotiation -> resumeProvider(process));
    }

    private Result<TransferProcess> onSuspension(TransferProcess process, String reason) {
        if (process.getState() == SUSPENDED) {
            return Result.success(process);
        }
        if (process.getState() != STARTED) {
            return invalid(process, "only started transfers can be suspended");
        }
        var suspended = process.isProvider()
                ? signaling.suspend(process.getId(), reason).<Void>map(it -> null)
                : Result.<Void>success();
        return suspended.compose(it -> {
            process.transitionToSuspended(reason, clock.instant());
            return save(process);
        });
    }

    private Result<TransferProcess> onEnd(TransferProcess process, String reason) {
        if (process.isFinal()) {
            return Result.success(process);
        }
        dispatcher.cancel(process.getId());
        var stopped = process.isProvider()
                ? signaling.terminate(process.getId(), reason).<Void>map(it -> null)
                : Result.<Void>success();
        return stopped.compose(it -> {
            end(process, reason);
            return save(process);
        });
    }

    private Result<Void> onInbound(String senderId, String localPid, ProtocolMessage message, Function<TransferProcess, Result<TransferProcess>> transition) {
        if (localPid == null) {
            return Result.failure(new ProcessNotFoundException("unknown", null, "message %s names no local process".formatted(message.messageId())));
        }
        return leases.withLease(localPid, () -> store.findById(localPid).compose(process -> {
            if (!senderId.equals(process.getCounterpartyId())) {
                return Result.<Void>failure(new VerificationFailed(localPid, process.getState().name(), "%s is not the counterparty".formatted(senderId)));
            }
            if (process.hasProcessed(message.messageId())) {
                LOGGER.debug("Message {} already applied to transfer {}", message.messageId(), localPid);
                return Result.<Void>success();
            }
            process.markProcessed(message.messageId());

            var verified = authenticate(senderId, message);
            if (verified.failed()) {
                LOGGER.warn("Authentication of {} on transfer {} failed: {}", senderId, localPid, verified.getCause().getMessage());
                if (process.isFinal()) {
                    return Result.<Void>success();
                }
                if (process.isProvider()) {
                    stopDataFlow(localPid, VERIFICATION_FAILED);
                }
                return endAndNotify(process, VERIFICATION_FAILED).<Void>map(it -> null);
            }
            return transition.apply(process).<Void>map(it -> null);
        }));
    }

    private Result<TransferProcess> startProvider(TransferProcess process) {
        var processId = process.getId();
        var saved = store.save(process);
        if (saved.failed()) {
            return Result.failure(saved.getCause());
        }

        var started = signaling.start(new DataFlowStartMessage(processId, process.getAgreementId(), process.getCounterpartyId(),
                process.getTransferType(), process.getDataAddress()));
        if (started.failed()) {
            LOGGER.warn("Transfer {} could not be started: {}", processId, started.getCause().getMessage());
            endAndNotify(process, "StartFailed: " + started.getCause().getMessage());
            return Result.failure(started.getCause());
        }

        var edr = started.getContent().edr();
        process.transitionToProvisioned(clock.instant());
        process.transitionToStarted(edr, clock.instant());
        return notifyAndSave(process, presentation -> new TransferStartMessage(newMessageId(),
                process.getCounterpartyPid(), processId, edr, presentation));
    }

    private Result<TransferProcess> resumeProvider(TransferProcess process) {
        var processId = process.getId();
        return signaling.start(new DataFlowStartMessage(processId, process.getAgreementId(), process.getCounterpartyId(),
                        process.getTransferType(), null))
                .compose(response -> {
                    process.transitionToStarted(response.edr(), clock.instant());
                    return notifyAndSave(process, presentation -> new TransferStartMessage(newMessageId(),
                            process.getCounterpartyPid(), processId, response.edr(), presentation));
                });
    }

    /**
     * Send when a counterparty mirrors this process, then save. Local-only provider transfers are just saved.
     */
    private Result<TransferProcess> notifyAndSave(TransferProcess process, Function<Presentation, ProtocolMessage> messageFactory) {
        if (!process.isRemote()) {
            return save(process);
        }
        return sendAndSave(process, messageFactory);
    }

    private Result<TransferProcess> sendAndSave(TransferProcess process, Function<Presentation, ProtocolMessage> messageFactory) {
        var counterpartyId = process.getCounterpartyId();
        return presentationProvider.presentationFor(counterpartyId)
                .compose(presentation -> dispatcher.dispatch(process.getId(), counterpartyId, messageFactory.apply(presentation),
                        failure -> onCounterpartyUnreachable(process.getId(), failure)))
                .recover(failure -> {
                    if (failure instanceof CounterpartyUnreachable && !process.isFinal()) {
                        if (process.isProvider()) {
                            stopDataFlow(process.getId(), COUNTERPARTY_UNREACHABLE);
                        }
                        process.transitionToTerminated(COUNTERPARTY_UNREACHABLE, clock.instant());
                        store.save(process);
                    }
                    return Result.failure(failure);
                })
                .compose(it -> save(process));
    }

    private Result<TransferProcess> endAndNotify(TransferProcess process, String reason) {
        end(process, reason);
        if (process.isRemote() || !process.isProvider()) {
            var presentation = presentationProvider.presentationFor(process.getCounterpartyId())
                    .recover(failure -> Result.success(null))
                    .getContent();
            ProtocolMessage message = COMPLETED.equals(reason)
                    ? new TransferCompletionMessage(newMessageId(), consumerPid(process), providerPid(process), presentation)
                    : new TransferTerminationMessage(newMessageId(), consumerPid(process), providerPid(process), reason, presentation);
            dispatcher.dispatch(process.getId(), process.getCounterpartyId(), message,
                            failure -> LOGGER.debug("End of transfer {} not delivered: {}", process.getId(), failure.getMessage()))
                    .onFailure(failure -> LOGGER.debug("End of transfer {} not delivered: {}", process.getId(), failure.getMessage()));
        }
        return save(process);
    }

    private void end(TransferProcess process, String reason) {
        if (COMPLETED.equals(reason)) {
            process.transitionToCompleted(reason, clock.instant());
        } else {
            process.transitionToTerminated(reason, clock.instant());
        }
    }

    private void refuse(String senderId, TransferRequestMessage request, String reason) {
        var presentation = presentationProvider.presentationFor(senderId)
                .recover(failure -> Result.success(null))
                .getContent();
        var message = new TransferTerminationMessage(newMessageId(), request.consumerPid(), null, reason, presentation);
        dispatcher.dispatch(request.consumerPid(), senderId, message,
                        failure -> LOGGER.debug("Refusal of transfer request {} not delivered: {}", request.messageId(), failure.getMessage()))
                .onFailure(failure -> LOGGER.debug("Refusal of transfer request {} not delivered: {}", request.messageId(), failure.getMessage()));
    }

    /**
     * Mirror a suspension or termination that reached the data flow without passing through this coordinator,
     * e.g. from a policy monitor, and tell the consumer about it.
     */
    private void onDataFlowTriggered(Trigger trigger) {
        var processId = trigger.processId();
        leases.withLease(processId, () -> load(processId).compose(process -> {
            if (!process.isProvider() || process.isFinal()) {
                return Result.success(process);
            }
            if (trigger.action() == Trigger.Action.TERMINATE) {
                dispatcher.cancel(processId);
                return endAndNotify(process, trigger.reason());
            }
            if (process.getState() != STARTED) {
                return Result.success(process);
            }
            process.transitionToSuspended(trigger.reason(), clock.instant());
            return notifyAndSave(process, presentation -> new TransferSuspensionMessage(newMessageId(),
                    consumerPid(process), providerPid(process), trigger.reason(), presentation));
        })).onFailure(failure -> LOGGER.debug("{} of data flow {} not mirrored: {}", trigger.action(), processId, failure.getMessage()));
    }

    private void stopDataFlow(String processId, String reason) {
        signaling.terminate(processId, reason)
                .onFailure(failure -> LOGGER.warn("Data flow {} could not be terminated: {}", processId, failure.getMessage()));
    }

    private void onCounterpartyUnreachable(String processId, CounterpartyUnreachable failure) {
        leases.withLease(processId, () -> store.findById(processId).compose(process -> {
            if (process.isFinal()) {
                return Result.<Void>success();
            }
            LOGGER.warn("Transfer {} terminated, {}", processId, failure.getMessage());
            if (process.isProvider()) {
                stopDataFlow(processId, COUNTERPARTY_UNREACHABLE);
            }
            process.transitionToTerminated(COUNTERPARTY_UNREACHABLE, clock.instant());
            return store.save(process);
        })).onFailure(error -> LOGGER.warn("Could not terminate unreachable transfer {}: {}", processId, error.getMessage()));
    }

    private Result<NegotiationProcess> requireFinalized(String agreementId) {
        return negotiations.findByAgreementId(agreementId)
                .recover(failure -> Result.failure(new ContractNotAgreed(agreementId, null, "no negotiation produced this agreement")))
                .compose(negotiation -> negotiation.getState() == NegotiationProcess.State.FINALIZED
                        ? Result.success(negotiation)
                        : Result.<NegotiationProcess>failure(new ContractNotAgreed(agreementId, negotiation.getState().name(), "negotiation is not finalized")));
    }

    private Result<?> authenticate(String senderId, ProtocolMessage message) {
        var presentation = message.presentation();
        if (presentation == null || !senderId.equals(presentation.holderId())) {
            return Result.failure(new VerificationFailed(message.messageId(), null, "sender presented no presentation of its own"));
        }
        return claimsAuthority.verifyPresentation(presentation);
    }

    private String localPid(ProcessMessage message) {
        if (message.providerPid() != null) {
            var provider = store.findById(message.providerPid());
            if (provider.succeeded() && provider.getContent().isProvider()) {
                return message.providerPid();
            }
        }
        return message.consumerPid();
    }

    private Result<TransferProcess> load(String processId) {
        return store.findById(processId);
    }

    private Result<TransferProcess> save(TransferProcess process) {
        LOGGER.debug("Transfer {} is now {}", process.getId(), process.getState());
        return store.save(process).map(it -> process);
    }

    private <T> Result<T> invalid(TransferProcess process, String detail) {
        return Result.failure(new InvalidStateTransition(process.getId(), process.getState().name(), detail));
    }

    private static String consumerPid(TransferProcess process) {
        return process.isProvider() ? process.getCounterpartyPid() : process.getId();
    }

    private static String providerPid(TransferProcess process) {
        return process.isProvider() ? process.getId() : process.getCounterpartyPid();
    }

    private static String newMessageId() {
        return UUID.randomUUID().toString();
    }

    public static class Builder {

        private final TransferCoordinator coordinator = new TransferCoordinator();

        private Builder() {
        }

        public TransferCoordinator build() {
            Objects.requireNonNull(coordinator.negotiations, "negotiations");
            Objects.requireNonNull(coordinator.signaling, "signaling");
            Objects.requireNonNull(coordinator.claimsAuthority, "claimsAuthority");
            Objects.requireNonNull(coordinator.presentationProvider, "presentationProvider");
            Objects.requireNonNull(coordinator.dispatcher, "dispatcher");
            if (coordinator.store == null) {
                coordinator.store = new InMemoryProcessStore<>(ObjectMappers.defaultMapper(), TransferProcess.class);
            }
            coordinator.signaling.register(coordinator::onDataFlowTriggered);
            return coordinator;
        }

        public Builder store(ProcessStore<TransferProcess> store) {
            coordinator.store = store;
            return this;
        }

        public Builder negotiations(NegotiationEngine negotiations) {
            coordinator.negotiations = negotiations;
            return this;
        }

        public Builder signaling(SignalingController signaling) {
            coordinator.signaling = signaling;
            return this;
        }

        public Builder claimsAuthority(ClaimsAuthority claimsAuthority) {
            coordinator.claimsAuthority = claimsAuthority;
            return this;
        }

        public Builder presentationProvider(PresentationProvider presentationProvider) {
            coordinator.presentationProvider = presentationProvider;
            return this;
        }

        public Builder dispatcher(MessageDispatcher dispatcher) {
            coordinator.dispatcher = dispatcher;
            return this;
        }

        public Builder clock(Clock clock) {
            coordinator.clock = clock;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            coordinator.leases = new LeaseManager(leaseTimeout);
            return this;
        }
    }
}
