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

package org.eclipse.dataspace.signaling;

import org.eclipse.dataspace.claims.ClaimsAuthority;
import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.EndpointDataReference;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.TransferType;
import org.eclipse.dataspace.domain.claims.Token;
import org.eclipse.dataspace.domain.dataflow.DataFlow;
import org.eclipse.dataspace.domain.dataflow.DataFlowResponseMessage;
import org.eclipse.dataspace.domain.dataflow.DataFlowStartMessage;
import org.eclipse.dataspace.domain.dataflow.DataFlowStatusResponseMessage;
import org.eclipse.dataspace.port.dataplane.DataPlane;
import org.eclipse.dataspace.port.exception.InvalidStateTransition;
import org.eclipse.dataspace.port.exception.ProcessNotFoundException;
import org.eclipse.dataspace.port.lease.LeaseManager;
import org.eclipse.dataspace.port.store.InMemoryProcessStore;
import org.eclipse.dataspace.port.store.ObjectMappers;
import org.eclipse.dataspace.port.store.ProcessStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drives the control-plane to data-plane lifecycle of every transfer: start, suspend, resume and terminate.
 * Resume is a start on an existing process id. A transition is only saved once its token and data-plane side
 * effects went through.
 */
public class SignalingController implements TriggerHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SignalingController.class);

    private ProcessStore<DataFlow> store;
    private ClaimsAuthority claimsAuthority;
    private DataPlane dataPlane;
    private LeaseManager leases = new LeaseManager(Duration.ofSeconds(5));
    private Clock clock = Clock.systemUTC();
    private final List<DataFlowListener> listeners = new CopyOnWriteArrayList<>();

    public static Builder newInstance() {
        return new Builder();
    }

    public Result<DataFlowResponseMessage> start(String processId, TransferType transferType, DataAddress dataAddress) {
        return start(new DataFlowStartMessage(processId, null, null, transferType, dataAddress));
    }

    public Result<DataFlowResponseMessage> start(DataFlowStartMessage message) {
        var processId = message.processId();
        return leases.withLease(processId, () -> {
            var existing = store.findById(processId);
            if (existing.failed()) {
                if (!(existing.getCause() instanceof ProcessNotFoundException)) {
                    return Result.failure(existing.getCause());
                }
                var dataFlow = DataFlow.newInstance()
                        .id(processId)
                        .transferType(message.transferType())
                        .agreementId(message.agreementId())
                        .counterPartyId(message.counterPartyId())
                        .dataAddress(message.dataAddress())
                        .build();
                return store.save(dataFlow).compose(it -> activate(dataFlow, false));
            }

            var dataFlow = existing.getContent();
            return switch (dataFlow.getState()) {
                case REQUESTED -> activate(dataFlow, false);
                case SUSPENDED -> dataFlow.hasSameParameters(message)
                        ? activate(dataFlow, true)
                        : Result.<DataFlowResponseMessage>failure(new InvalidStateTransition(processId, dataFlow.getState().name(), "resume with different parameters"));
                case STARTED -> dataFlow.hasSameParameters(message)
                        ? currentResponse(dataFlow)
                        : Result.<DataFlowResponseMessage>failure(new InvalidStateTransition(processId, dataFlow.getState().name(), "already started with different parameters"));
                case TERMINATED -> Result.<DataFlowResponseMessage>failure(new InvalidStateTransition(processId, dataFlow.getState().name(),
                        "terminated flows cannot be restarted, a new process id is required"));
            };
        });
    }

    @Override
    public Result<DataFlowStatusResponseMessage> suspend(String processId, String reason) {
        return leases.withLease(processId, () -> load(processId).compose(dataFlow -> switch (dataFlow.getState()) {
            case SUSPENDED -> Result.<DataFlowStatusResponseMessage>success(status(dataFlow));
            case STARTED -> revokeCurrentToken(dataFlow)
                    .compose(it -> dataPlane.pause(processId))
                    .compose(it -> {
                        dataFlow.transitionToSuspended(reason, clock.instant());
                        return save(dataFlow);
                    });
            default -> Result.<DataFlowStatusResponseMessage>failure(new InvalidStateTransition(processId, dataFlow.getState().name(), "only started flows can be suspended"));
        }));
    }

    /**
     * Terminate the flow from any non-terminal state. Terminating twice is a successful no-op.
     */
    @Override
    public Result<DataFlowStatusResponseMessage> terminate(String processId, String reason) {
        return leases.withLease(processId, () -> load(processId).compose(dataFlow -> {
            if (dataFlow.isTerminated()) {
                return Result.success(status(dataFlow));
            }
            return revokeCurrentToken(dataFlow)
                    .compose(it -> dataPlane.teardown(processId))
                    .compose(it -> {
                        dataFlow.transitionToTerminated(reason, clock.instant());
                        return save(dataFlow);
                    });
        }));
    }

    /**
     * Apply the trigger and tell the registered listeners once it went through.
     */
    @Override
    public Result<?> handle(Trigger trigger) {
        return TriggerHandler.super.handle(trigger)
                .onSuccess(it -> listeners.forEach(listener -> listener.triggered(trigger)));
    }

    public void register(DataFlowListener listener) {
        listeners.add(listener);
    }

    public Result<DataFlowStatusResponseMessage> status(String processId) {
        return store.findById(processId).map(this::status);
    }

    public Result<DataFlow> getById(String processId) {
        return store.findById(processId);
    }

    private Result<DataFlowResponseMessage> activate(DataFlow dataFlow, boolean resume) {
        var processId = dataFlow.getId();
        var retired = revokeCurrentToken(dataFlow);
        if (retired.failed()) {
            LOGGER.warn("Flow {} not activated, its previous token could not be revoked: {}", processId, retired.getCause().getMessage());
            return Result.failure(retired.getCause());
        }

        return claimsAuthority.issueToken(processId, dataFlow.getTransferType())
                .compose(token -> {
                    var provisioned = resume
                            ? dataPlane.resume(processId, token)
                            : dataPlane.provision(dataFlow.getDataAddress(), token);
                    if (provisioned.failed()) {
                        LOGGER.warn("Data plane rejected {} of flow {}: {}", resume ? "resume" : "provisioning", processId, provisioned.getCause().getMessage());
                        revokeUnused(token);
                        return Result.failure(provisioned.getCause());
                    }

                    dataFlow.transitionToStarted(token.getId(), provisioned.getContent(), clock.instant());
                    var saved = store.save(dataFlow);
                    if (saved.failed()) {
                        revokeUnused(token);
                        return Result.failure(saved.getCause());
                    }
                    LOGGER.debug("Data flow {} {}", processId, resume ? "resumed" : "started");
                    return Result.success(response(dataFlow, token));
                });
    }

    private void revokeUnused(Token token) {
        claimsAuthority.revokeToken(token.getId())
                .onFailure(failure -> LOGGER.warn("Unused token {} of flow {} stays valid until {}: {}",
                        token.getId(), token.getTransferProcessId(), token.getExpiresAt(), failure.getMessage()));
    }

    private Result<DataFlowResponseMessage> currentResponse(DataFlow dataFlow) {
        return claimsAuthority.findToken(dataFlow.getTokenId()).map(token -> response(dataFlow, token));
    }

    private DataFlowResponseMessage response(DataFlow dataFlow, Token token) {
        var provisioned = dataFlow.getProvisionedAddress();
        if (dataFlow.isPull()) {
            var endpoint = provisioned == null ? null : provisioned.endpoint();
            var edr = new EndpointDataReference(dataFlow.getId(), endpoint, token.getId(), token.getValue());
            return new DataFlowResponseMessage(dataFlow.getId(), dataFlow.getState().name(), null, edr);
        }
        return new DataFlowResponseMessage(dataFlow.getId(), dataFlow.getState().name(), provisioned, null);
    }

    private Result<Void> revokeCurrentToken(DataFlow dataFlow) {
        return dataFlow.getTokenId() == null ? Result.success() : claimsAuthority.revokeToken(dataFlow.getTokenId());
    }

    private Result<DataFlow> load(String processId) {
        return store.findById(processId)
                .recover(failure -> Result.failure(failure instanceof ProcessNotFoundException
                        ? new InvalidStateTransition(processId, null, "no data flow with this id")
                        : failure));
    }

    private Result<DataFlowStatusResponseMessage> save(DataFlow dataFlow) {
        LOGGER.debug("Data flow {} is now {}", dataFlow.getId(), dataFlow.getState());
        return store.save(dataFlow).map(it -> status(dataFlow));
    }

    private DataFlowStatusResponseMessage status(DataFlow dataFlow) {
        return new DataFlowStatusResponseMessage(dataFlow.getId(), dataFlow.getState().name());
    }

    public static class Builder {

        private final SignalingController controller = new SignalingController();

        private Builder() {
        }

        public SignalingController build() {
            Objects.requireNonNull(controller.claimsAuthority, "claimsAuthority");
            Objects.requireNonNull(controller.dataPlane, "dataPlane");
            if (controller.store == null) {
                controller.store = new InMemoryProcessStore<>(ObjectMappers.defaultMapper(), DataFlow.class);
            }
            return controller;
        }

        public Builder store(ProcessStore<DataFlow> store) {
            controller.store = store;
            return this;
        }

        public Builder claimsAuthority(ClaimsAuthority claimsAuthority) {
            controller.claimsAuthority = claimsAuthority;
            return this;
        }

        public Builder dataPlane(DataPlane dataPlane) {
            controller.dataPlane = dataPlane;
            return this;
        }

        public Builder clock(Clock clock) {
            controller.clock = clock;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            controller.leases = new LeaseManager(leaseTimeout);
            return this;
        }
    }
}
