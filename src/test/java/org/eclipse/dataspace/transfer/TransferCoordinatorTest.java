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

import org.eclipse.dataspace.DataspaceConnector;
import org.eclipse.dataspace.domain.TransferType;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.eclipse.dataspace.domain.dataflow.DataFlow;
import org.eclipse.dataspace.domain.negotiation.ContractAgreement;
import org.eclipse.dataspace.domain.negotiation.ContractOffer;
import org.eclipse.dataspace.domain.negotiation.NegotiationProcess;
import org.eclipse.dataspace.domain.negotiation.NegotiationRole;
import org.eclipse.dataspace.domain.transfer.TransferProcess;
import org.eclipse.dataspace.fixtures.DataspaceFixture;
import org.eclipse.dataspace.port.exception.ContractNotAgreed;
import org.eclipse.dataspace.port.store.InMemoryProcessStore;
import org.eclipse.dataspace.port.store.ObjectMappers;
import org.eclipse.dataspace.signaling.Trigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.COMPLETED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.PROVISIONED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.STARTED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.SUSPENDED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.TERMINATED;

class TransferCoordinatorTest {

    private final DataspaceFixture dataspace = new DataspaceFixture();
    private final InMemoryProcessStore<NegotiationProcess> negotiationStore =
            new InMemoryProcessStore<>(ObjectMappers.defaultMapper(), NegotiationProcess.class);
    private final ContractOffer offer = new ContractOffer("offer-1", "asset-1", Map.of("permission", "use"));
    private NegotiationProcess negotiation;
    private DataspaceConnector provider;
    private TransferCoordinator transfers;

    @BeforeEach
    void setUp() {
        negotiation = NegotiationProcess.newInstance()
                .id("N1")
                .role(NegotiationRole.PROVIDER)
                .counterpartyId("consumer")
                .counterpartyPid("C1")
                .offer(offer)
                .build();
        negotiation.transitionToOffered(offer, Instant.now());
        negotiation.transitionToAccepted("consumer-signature", Instant.now());
        negotiation.transitionToAgreed(ContractAgreement.draft("A1", offer, "consumer", "provider", Instant.now())
                .withConsumerSignature("consumer-signature")
                .withProviderSignature("provider-signature"), Instant.now());
        negotiation.transitionToVerified(Instant.now());
        negotiationStore.save(negotiation);

        provider = dataspace.connector("provider", builder -> builder.negotiationStore(negotiationStore));
        transfers = provider.getTransfers();
    }

    @AfterEach
    void tearDown() {
        dataspace.close();
    }

    private void finalizeNegotiation() {
        negotiation.transitionToFinalized(Instant.now());
        negotiationStore.save(negotiation);
    }

    @Nested
    class RequestTransfer {

        @Test
        void shouldFailWithContractNotAgreed_whenNegotiationIsNotFinalized() {
            var result = transfers.requestTransfer("A1", TransferType.PULL, null);

            assertThatThrownBy(result::orElseThrow).isExactlyInstanceOf(ContractNotAgreed.class);
            assertThat(Arrays.stream(TransferProcess.State.values()).flatMap(state -> transfers.listByState(state).stream())).isEmpty();
        }

        @Test
        void shouldFailWithContractNotAgreed_whenAgreementIsUnknown() {
            finalizeNegotiation();

            var result = transfers.requestTransfer("unknown", TransferType.PULL, null);

            assertThatThrownBy(result::orElseThrow).isExactlyInstanceOf(ContractNotAgreed.class);
        }

        @Test
        void shouldStartPullTransferWithVerifiableEdr() {
            finalizeNegotiation();

            var process = transfers.requestTransfer("A1", TransferType.PULL, null).orElseThrow();

            assertThat(process.getState()).isEqualTo(STARTED);
            assertThat(process.getHistory()).extracting("to").containsExactly(PROVISIONED.name(), STARTED.name());
            var edr = process.getEdr();
            assertThat(edr).isNotNull();
            assertThat(provider.getClaimsAuthority().verifyPresentation(Presentation.ofToken("consumer", edr.authorization())).succeeded()).isTrue();
            assertThat(provider.getSignaling().getById(process.getId()).getContent().getState()).isEqualTo(DataFlow.State.STARTED);
        }

        @Test
        void shouldTerminate_whenDataPlaneCannotProvision() {
            finalizeNegotiation();
            dataspace.dataPlane("provider").failing(true);

            var result = transfers.requestTransfer("A1", TransferType.PULL, null);

            assertThat(result.failed()).isTrue();
            assertThat(transfers.listByState(TERMINATED)).singleElement()
                    .satisfies(process -> assertThat(process.getTerminationReason()).startsWith("StartFailed"));
        }
    }

    @Nested
    class Lifecycle {

        private TransferProcess process;

        @BeforeEach
        void start() {
            finalizeNegotiation();
            process = transfers.requestTransfer("A1", TransferType.PULL, null).orElseThrow();
        }

        @Test
        void shouldMirrorSuspension_andRevokeEdr() {
            var result = transfers.suspend(process.getId(), "maintenance").orElseThrow();

            assertThat(result.getState()).isEqualTo(SUSPENDED);
            assertThat(provider.getSignaling().getById(process.getId()).getContent().getState()).isEqualTo(DataFlow.State.SUSPENDED);
            assertThat(provider.getClaimsAuthority().verifyToken(process.getEdr().authorization()).failed()).isTrue();
        }

        @Test
        void shouldResumeWithNewEdr() {
            transfers.suspend(process.getId(), "maintenance");

            var resumed = transfers.resume(process.getId()).orElseThrow();

            assertThat(resumed.getState()).isEqualTo(STARTED);
            assertThat(resumed.getEdr().tokenId()).isNotEqualTo(process.getEdr().tokenId());
            assertThat(provider.getClaimsAuthority().verifyToken(resumed.getEdr().authorization()).succeeded()).isTrue();
        }

        @Test
        void shouldFail_whenResumingStartedTransfer() {
            assertThat(transfers.resume(process.getId()).failed()).isTrue();
        }

        @Test
        void shouldEndInCompleted_whenCompleted() {
            var completed = transfers.complete(process.getId()).orElseThrow();

            assertThat(completed.getState()).isEqualTo(COMPLETED);
            assertThat(provider.getSignaling().getById(process.getId()).getContent().getState()).isEqualTo(DataFlow.State.TERMINATED);
            assertThat(provider.getClaimsAuthority().verifyToken(process.getEdr().authorization()).failed()).isTrue();
        }

        @Test
        void shouldEndInTerminatedWithReason_whenTerminatedForOtherReason() {
            var terminated = transfers.terminate(process.getId(), "ProviderShutdown").orElseThrow();

            assertThat(terminated.getState()).isEqualTo(TERMINATED);
            assertThat(terminated.getTerminationReason()).isEqualTo("ProviderShutdown");
        }

        @Test
        void shouldKeepFirstOutcome_whenEndedTwice() {
            transfers.complete(process.getId());

            var result = transfers.terminate(process.getId(), "late");

            assertThat(result.succeeded()).isTrue();
            assertThat(result.getContent().getState()).isEqualTo(COMPLETED);
        }

        @Test
        void shouldTerminate_whenPolicyExpires() {
            transfers.handle(Trigger.policyExpired(process.getId()));

            var terminated = transfers.findById(process.getId()).getContent();
            assertThat(terminated.getState()).isEqualTo(TERMINATED);
            assertThat(terminated.getTerminationReason()).isEqualTo("PolicyExpired");
        }

        @Test
        void shouldMirrorSuspension_whenDataFlowIsSuspendedThroughSignaling() {
            provider.getSignaling().handle(Trigger.policyViolated(process.getId(), "quota exceeded")).orElseThrow();

            assertThat(transfers.findById(process.getId()).getContent().getState()).isEqualTo(SUSPENDED);
            assertThat(transfers.resume(process.getId()).orElseThrow().getState()).isEqualTo(STARTED);
        }

        @Test
        void shouldMirrorTermination_whenDataFlowIsTerminatedThroughSignaling() {
            provider.getSignaling().handle(Trigger.manual(Trigger.Action.TERMINATE, process.getId(), "OperatorStop")).orElseThrow();

            var terminated = transfers.findById(process.getId()).getContent();
            assertThat(terminated.getState()).isEqualTo(TERMINATED);
            assertThat(terminated.getTerminationReason()).isEqualTo("OperatorStop");
            assertThat(dataspace.dataPlane("provider").count("teardown")).isEqualTo(1);
        }
    }
}
