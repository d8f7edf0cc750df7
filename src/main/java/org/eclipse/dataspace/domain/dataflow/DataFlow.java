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
 *       Fraunhofer-Gesellschaft zur Förderung der angewandten Forschung e.V. - data flow properties
 *
 */

package org.eclipse.dataspace.domain.dataflow;

import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.StateTransition;
import org.eclipse.dataspace.domain.StatefulEntity;
import org.eclipse.dataspace.domain.TransferType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Local view of one transfer on the data-plane signaling side. The current token is referenced by id only.
 */
public class DataFlow implements StatefulEntity<DataFlow.State> {

    private String id;
    private State state;
    private TransferType transferType;
    private String agreementId;
    private String counterPartyId;
    private String suspensionReason;
    private String terminationReason;
    private DataAddress dataAddress;
    private DataAddress provisionedAddress;
    private String tokenId;
    private final List<StateTransition> history = new ArrayList<>();

    public static DataFlow.Builder newInstance() {
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

    public DataAddress getDataAddress() {
        return dataAddress;
    }

    public DataAddress getProvisionedAddress() {
        return provisionedAddress;
    }

    public TransferType getTransferType() {
        return transferType;
    }

    public String getAgreementId() {
        return agreementId;
    }

    public String getCounterPartyId() {
        return counterPartyId;
    }

    public String getSuspensionReason() {
        return suspensionReason;
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    public String getTokenId() {
        return tokenId;
    }

    public List<StateTransition> getHistory() {
        return List.copyOf(history);
    }

    public void transitionToStarted(String tokenId, DataAddress provisionedAddress, Instant at) {
        this.tokenId = tokenId;
        this.provisionedAddress = provisionedAddress;
        this.suspensionReason = null;
        transition(State.STARTED, "start", at);
    }

    public void transitionToSuspended(String reason, Instant at) {
        this.tokenId = null;
        this.suspensionReason = reason;
        transition(State.SUSPENDED, reason, at);
    }

    public void transitionToTerminated(String reason, Instant at) {
        this.tokenId = null;
        this.terminationReason = reason;
        transition(State.TERMINATED, reason, at);
    }

    public boolean isPull() {
        return transferType == TransferType.PULL;
    }

    public boolean isTerminated() {
        return state == State.TERMINATED;
    }

    /**
     * Whether a start message carries the same parameters this flow was started with. A missing address means
     * "keep the current one".
     */
    public boolean hasSameParameters(DataFlowStartMessage message) {
        return transferType == message.transferType()
                && Objects.equals(agreementId, message.agreementId())
                && (message.dataAddress() == null || Objects.equals(dataAddress, message.dataAddress()));
    }

    private void transition(State target, String cause, Instant at) {
        history.add(new StateTransition(state.name(), target.name(), at, cause));
        state = target;
    }

    public static class Builder {
        private final DataFlow dataFlow = new DataFlow();

        private Builder() {

        }

        public DataFlow build() {
            Objects.requireNonNull(dataFlow.id);
            Objects.requireNonNull(dataFlow.transferType);

            if (dataFlow.state == null) {
                dataFlow.state = State.REQUESTED;
            }

            return dataFlow;
        }

        public Builder id(String id) {
            dataFlow.id = id;
            return this;
        }

        public Builder state(State state) {
            dataFlow.state = state;
            return this;
        }

        public Builder transferType(TransferType transferType) {
            dataFlow.transferType = transferType;
            return this;
        }

        public Builder agreementId(String agreementId) {
            dataFlow.agreementId = agreementId;
            return this;
        }

        public Builder counterPartyId(String counterPartyId) {
            dataFlow.counterPartyId = counterPartyId;
            return this;
        }

        public Builder dataAddress(DataAddress dataAddress) {
            dataFlow.dataAddress = dataAddress;
            return this;
        }
    }

    public enum State {
        REQUESTED,
        STARTED,
        SUSPENDED,
        TERMINATED
    }
}
