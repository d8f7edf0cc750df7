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

package org.eclipse.dataspace.scenario;

import org.eclipse.dataspace.DataspaceConnector;
import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.TransferType;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.eclipse.dataspace.domain.message.TransferRequestMessage;
import org.eclipse.dataspace.domain.message.TransferStartMessage;
import org.eclipse.dataspace.domain.negotiation.ContractOffer;
import org.eclipse.dataspace.domain.negotiation.NegotiationProcess;
import org.eclipse.dataspace.domain.transfer.TransferProcess;
import org.eclipse.dataspace.fixtures.DataspaceFixture;
import org.eclipse.dataspace.signaling.Trigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.COMPLETED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.STARTED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.SUSPENDED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.TERMINATED;

class TransferProcessTest {

    private final DataspaceFixture dataspace = new DataspaceFixture();
    private DataspaceConnector provider;
    private DataspaceConnector consumer;
    private String agreementId;

    @BeforeEach
    void setUp() {
        provider = dataspace.connector("provider");
        consumer = dataspace.connector("consumer");

        var offer = new ContractOffer("offer-1", "asset-1", Map.of("permission", "use"));
        var negotiationId = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
        await().untilAsserted(() -> assertThat(consumer.getNegotiations().findById(negotiationId).getContent().getState())
                .isEqualTo(NegotiationProcess.State.OFFERED));
        consumer.getNegotiations().accept(negotiationId).orElseThrow();
        await().untilAsserted(() -> assertThat(consumer.getNegotiations().findById(negotiationId).getContent().getState())
                .isEqualTo(NegotiationProcess.State.FINALIZED));
        agreementId = consumer.getNegotiations().findById(negotiationId).getContent().getAgreement().id();
        await().untilAsserted(() -> assertThat(provider.getNegotiations().findByAgreementId(agreementId).getContent().getState())
                .isEqualTo(NegotiationProcess.State.FINALIZED));
    }

    @AfterEach
    void tearDown() {
        dataspace.close();
    }

    @Test
    void shouldDeliverEdrToConsumer_whenPullTransferIsRequested() {
        var consumerPid = consumer.getTransfers().requestRemoteTransfer(agreementId, TransferType.PULL, null).orElseThrow().getId();

        var started = awaitState(consumer, consumerPid, STARTED);
        assertThat(started.getEdr()).isNotNull();
        assertThat(provider.getClaimsAuthority().verifyPresentation(Presentation.ofToken("consumer", started.getEdr().authorization())).succeeded())
                .isTrue();
        assertThat(provider.getTransfers().listByState(STARTED)).singleElement()
                .satisfies(process -> assertThat(process.getCounterpartyPid()).isEqualTo(consumerPid));
    }

    @Test
    void shouldMirrorSuspensionAndResumption() {
        var consumerPid = consumer.getTransfers().requestRemoteTransfer(agreementId, TransferType.PULL, null).orElseThrow().getId();
        var originalEdr = awaitState(consumer, consumerPid, STARTED).getEdr();
        var providerPid = provider.getTransfers().listByState(STARTED).get(0).getId();

        provider.getTransfers().suspend(providerPid, "maintenance").orElseThrow();

        awaitState(consumer, consumerPid, SUSPENDED);
        assertThat(provider.getClaimsAuthority().verifyToken(originalEdr.authorization()).failed()).isTrue();

        consumer.getTransfers().resume(consumerPid).orElseThrow();

        var resumed = awaitState(consumer, consumerPid, STARTED);
        assertThat(resumed.getEdr().tokenId()).isNotEqualTo(originalEdr.tokenId());
        assertThat(provider.getClaimsAuthority().verifyToken(resumed.getEdr().authorization()).succeeded()).isTrue();
        assertThat(provider.getTransfers().findById(providerPid).getContent().getState()).isEqualTo(STARTED);
    }

    @Test
    void shouldSuspendConsumerView_whenProviderDataFlowIsSuspendedByPolicy() {
        var consumerPid = consumer.getTransfers().requestRemoteTransfer(agreementId, TransferType.PULL, null).orElseThrow().getId();
        var edr = awaitState(consumer, consumerPid, STARTED).getEdr();
        var providerPid = provider.getTransfers().listByState(STARTED).get(0).getId();

        provider.getSignaling().handle(Trigger.policyViolated(providerPid, "quota exceeded")).orElseThrow();

        awaitState(consumer, consumerPid, SUSPENDED);
        assertThat(provider.getTransfers().findById(providerPid).getContent().getState()).isEqualTo(SUSPENDED);
        assertThat(provider.getClaimsAuthority().verifyToken(edr.authorization()).failed()).isTrue();
    }

    @Test
    void shouldCompleteOnBothSides_whenConsumerCompletes() {
        var consumerPid = consumer.getTransfers().requestRemoteTransfer(agreementId, TransferType.PULL, null).orElseThrow().getId();
        awaitState(consumer, consumerPid, STARTED);
        var providerPid = provider.getTransfers().listByState(STARTED).get(0).getId();

        consumer.getTransfers().complete(consumerPid).orElseThrow();

        awaitState(provider, providerPid, COMPLETED);
        assertThat(dataspace.dataPlane("provider").count("teardown")).isEqualTo(1);
    }

    @Test
    void shouldTerminateConsumerView_whenProviderTerminates() {
        var consumerPid = consumer.getTransfers().requestRemoteTransfer(agreementId, TransferType.PUSH,
                new DataAddress("HttpData", "https://consumer.example/inbox", List.of())).orElseThrow().getId();
        awaitState(consumer, consumerPid, STARTED);
        var providerPid = provider.getTransfers().listByState(STARTED).get(0).getId();

        provider.getTransfers().terminate(providerPid, "ProviderShutdown").orElseThrow();

        var terminated = awaitState(consumer, consumerPid, TERMINATED);
        assertThat(terminated.getTerminationReason()).isEqualTo("ProviderShutdown");
    }

    @Test
    void shouldStartOneTransfer_whenRequestIsRedeliveredConcurrently() throws InterruptedException {
        var presentation = consumer.getCredentials().presentationFor("provider").orElseThrow();
        var request = new TransferRequestMessage(UUID.randomUUID().toString(), "consumer-transfer-1", null, agreementId,
                TransferType.PULL, null, presentation);

        DataspaceFixture.deliverConcurrently(provider, "consumer", request, 8);

        assertThat(provider.getTransfers().listByState(STARTED)).singleElement()
                .extracting(TransferProcess::getCounterpartyPid).isEqualTo("consumer-transfer-1");
        assertThat(dataspace.dataPlane("provider").count("provision")).isEqualTo(1);
        assertThat(dataspace.network().sent(TransferStartMessage.class)).hasSize(1);
    }

    @Test
    void shouldNotContactProvider_whenAgreementIsUnknown() {
        var result = consumer.getTransfers().requestRemoteTransfer("unknown-agreement", TransferType.PULL, null);

        assertThat(result.failed()).isTrue();
        assertThat(dataspace.network().sent(TransferRequestMessage.class)).isEmpty();
    }

    private static TransferProcess awaitState(DataspaceConnector connector, String processId, TransferProcess.State state) {
        await().untilAsserted(() -> assertThat(connector.getTransfers().findById(processId).getContent().getState()).isEqualTo(state));
        return connector.getTransfers().findById(processId).getContent();
    }
}
