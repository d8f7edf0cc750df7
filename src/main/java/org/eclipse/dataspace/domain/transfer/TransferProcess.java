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

package org.eclipse.dataspace.domain.transfer;

import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.EndpointDataReference;
import org.eclipse.dataspace.domain.StateTransition;
import org.eclipse.dataspace.domain.StatefulEntity;
import org.eclipse.dataspace.domain.TransferType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inter-organization view of one transfer. On the provider it supervises the local data flow with the same id,
 * on the consumer it mirrors what the provider reported.
 */
public class TransferProcess implements StatefulEntity<TransferProcess.State> {

    private String id;
    private TransferRole role;
    private String counterpartyId;
    private String counterpartyPid;
    private String agreementId;
    private TransferType transferType;
    private DataAddress dataAddress;
    private EndpointDataReference edr;
    private State state;
    private String terminationReason;
    private final Set<String> processedMessages = new LinkedHashSet<>();
    private final List<StateTransition> history = new ArrayList<>();

    public static TransferProcess.Builder newInstance() {
        return new Builder();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public State getState() {
        return state;
    }

    public TransferRole getRole() {
        return role;
    }

    public String getCounterpartyId() {
        return counterpartyId;
    }

    public String getCounterpartyPid() {
        return counterpartyPid;
    }

    public String getAgreementId() {
        return agreementId;
    }

    public TransferType getTransferType() {
        return transferType;
    }

    public DataAddress getDataAddress() {
        return dataAddress;
    }

    public EndpointDataReference getEdr() {
        return edr;
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    public List<StateTransition> getHistory() {
        return List.copyOf(history);
    }

    public boolean isProvider() {
        return role == TransferRole.PROVIDER;
    }

    public boolean isFinal() {
        return state == State.COMPLETED || state == State.TERMINATED;
    }

    /**
     * Whether a counterparty holds a mirrored process that has to be told about transitions.
     */
    public boolean isRemote() {
        return counterpartyPid != null;
    }

    public boolean hasProcessed(String messageId) {
        return processedMessages.contains(messageId);
    }

    public void markProcessed(String messageId) {
        if (messageId != null) {
            processedMessages.add(messageId);
        }
    }

    public void setCounterpartyPid(String counterpartyPid) {
        this.counterpartyPid = counterpartyPid;
    }

    public void transitionToProvisioned(Instant at) {
        transition(State.PROVISIONED, "provisioned", at);
    }

    public void transitionToStarted(EndpointDataReference edr, Instant at) {
        this.edr = edr;
        transition(State.STARTED, state == State.SUSPENDED ? "resumed" : "started", at);
    }

    public void transitionToSuspended(String reason, Instant at) {
        this.edr = null;
        transition(State.SUSPENDED, reason, at);
    }

    public void transitionToCompleted(String reason, Instant at) {
        this.edr = null;
        this.terminationReason = reason;
        transition(State.COMPLETED, reason, at);
    }

    public void transitionToTerminated(String reason, Instant at) {
        this.edr = null;
        this.terminationReason = reason;
        transition(State.TERMINATED, reason, at);
    }

    public boolean canTransitionTo(State target) {
        return state.successors().contains(target);
    }

    private void transition(State target, String cause, Instant at) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("transfer %s cannot go from %s to %s".formatted(id, state, target));
        }
        history.add(new StateTransition(state.name(), target.name(), at, cause));
        state = target;
    }

    public static class Builder {
        private final TransferProcess process = new TransferProcess();

        private Builder() {

        }

        public TransferProcess build() {
            Objects.requireNonNull(process.id);
            Objects.requireNonNull(process.role);
            Objects.requireNonNull(process.agreementId);
            Objects.requireNonNull(process.transferType);

            if (process.state == null) {
                process.state = State.REQUESTED;
            }

            return process;
        }

        public Builder id(String id) {
            process.id = id;
            return this;
        }

        public Builder role(TransferRole role) {
            process.role = role;
            return this;
        }

        public Builder counterpartyId(String counterpartyId) {
            process.counterpartyId = counterpartyId;
            return this;
        }

        public Builder counterpartyPid(String counterpartyPid) {
            process.counterpartyPid = counterpartyPid;
            return this;
        }

        public Builder agreementId(String agreementId) {
            process.agreementId = agreementId;
            return this;
        }

        public Builder transferType(TransferType transferType) {
            process.transferType = transferType;
            return this;
        }

        public Builder dataAddress(DataAddress dataAddress) {
            process.dataAddress = dataAddress;
            return this;
        }
    }

    public enum State {
        REQUESTED,
        PROVISIONED,
        STARTED,
        SUSPENDED,
        COMPLETED,
        TERMINATED;

        Set<State> successors() {
            return switch (this) {
                case REQUESTED -> EnumSet.of(PROVISIONED, TERMINATED);
                case PROVISIONED -> EnumSet.of(STARTED, TERMINATED);
                case STARTED -> EnumSet.of(SUSPENDED, COMPLETED, TERMINATED);
                case SUSPENDED -> EnumSet.of(STARTED, COMPLETED, TERMINATED);
                case COMPLETED, TERMINATED -> EnumSet.noneOf(State.class);
            };
        }
    }
}
