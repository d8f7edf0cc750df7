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

package org.eclipse.dataspace.domain.negotiation;

import org.eclipse.dataspace.domain.StateTransition;
import org.eclipse.dataspace.domain.StatefulEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One side's view of a contract negotiation. The counterparty keeps its own, they are only kept in step through
 * protocol messages.
 */
public class NegotiationProcess implements StatefulEntity<NegotiationProcess.State> {

    private String id;
    private NegotiationRole role;
    private String counterpartyId;
    private String counterpartyPid;
    private State state;
    private final List<ContractOffer> offers = new ArrayList<>();
    private int offerCount;
    private String consumerSignature;
    private ContractAgreement agreement;
    private String terminationReason;
    private final Set<String> processedMessages = new LinkedHashSet<>();
    private final List<StateTransition> history = new ArrayList<>();

    public static NegotiationProcess.Builder newInstance() {
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

    public NegotiationRole getRole() {
        return role;
    }

    public String getCounterpartyId() {
        return counterpartyId;
    }

    public String getCounterpartyPid() {
        return counterpartyPid;
    }

    public List<ContractOffer> getOffers() {
        return List.copyOf(offers);
    }

    public ContractOffer getLastOffer() {
        return offers.isEmpty() ? null : offers.get(offers.size() - 1);
    }

    public int getOfferCount() {
        return offerCount;
    }

    public String getConsumerSignature() {
        return consumerSignature;
    }

    public ContractAgreement getAgreement() {
        return agreement;
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    public List<StateTransition> getHistory() {
        return List.copyOf(history);
    }

    public boolean isConsumer() {
        return role == NegotiationRole.CONSUMER;
    }

    public boolean isFinal() {
        return state == State.FINALIZED || state == State.TERMINATED;
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

    public void recordOffer(ContractOffer offer) {
        offers.add(offer);
    }

    public void transitionToOffered(ContractOffer offer, Instant at) {
        recordOffer(offer);
        offerCount++;
        transition(State.OFFERED, "offer " + offer.id(), at);
    }

    public void transitionToDeclined(ContractOffer counterOffer, Instant at) {
        recordOffer(counterOffer);
        transition(State.DECLINED, "counter offer " + counterOffer.id(), at);
    }

    public void transitionToAccepted(String consumerSignature, Instant at) {
        this.consumerSignature = consumerSignature;
        transition(State.ACCEPTED, "accepted", at);
    }

    public void transitionToAgreed(ContractAgreement agreement, Instant at) {
        if (!agreement.isSignedByBoth()) {
            throw new IllegalStateException("agreement %s lacks a signature".formatted(agreement.id()));
        }
        this.agreement = agreement;
        transition(State.AGREED, "agreement " + agreement.id(), at);
    }

    public void transitionToVerified(Instant at) {
        transition(State.VERIFIED, "verified", at);
    }

    public void transitionToFinalized(Instant at) {
        transition(State.FINALIZED, "finalized", at);
    }

    public void transitionToTerminated(String reason, Instant at) {
        this.terminationReason = reason;
        transition(State.TERMINATED, reason, at);
    }

    public boolean canTransitionTo(State target) {
        return state.successors().contains(target);
    }

    private void transition(State target, String cause, Instant at) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("negotiation %s cannot go from %s to %s".formatted(id, state, target));
        }
        history.add(new StateTransition(state.name(), target.name(), at, cause));
        state = target;
    }

    public static class Builder {
        private final NegotiationProcess process = new NegotiationProcess();

        private Builder() {

        }

        public NegotiationProcess build() {
            Objects.requireNonNull(process.id);
            Objects.requireNonNull(process.role);
            Objects.requireNonNull(process.counterpartyId);

            if (process.state == null) {
                process.state = State.REQUESTED;
            }

            return process;
        }

        public Builder id(String id) {
            process.id = id;
            return this;
        }

        public Builder role(NegotiationRole role) {
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

        public Builder offer(ContractOffer offer) {
            process.offers.add(offer);
            return this;
        }
    }

    public enum State {
        REQUESTED,
        OFFERED,
        ACCEPTED,
        DECLINED,
        AGREED,
        VERIFIED,
        FINALIZED,
        TERMINATED;

        Set<State> successors() {
            return switch (this) {
                case REQUESTED -> EnumSet.of(OFFERED, TERMINATED);
                case OFFERED -> EnumSet.of(OFFERED, ACCEPTED, DECLINED, TERMINATED);
                case DECLINED -> EnumSet.of(OFFERED, TERMINATED);
                case ACCEPTED -> EnumSet.of(AGREED, TERMINATED);
                case AGREED -> EnumSet.of(VERIFIED, TERMINATED);
                case VERIFIED -> EnumSet.of(FINALIZED, TERMINATED);
                case FINALIZED, TERMINATED -> EnumSet.noneOf(State.class);
            };
        }
    }
}
