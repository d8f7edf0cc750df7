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
import org.eclipse.dataspace.claims.ClaimsAuthority;
import org.eclipse.dataspace.claims.HmacSigner;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.eclipse.dataspace.domain.message.ContractAgreementMessage;
import org.eclipse.dataspace.domain.message.ContractNegotiationEventMessage;
import org.eclipse.dataspace.domain.message.ContractOfferMessage;
import org.eclipse.dataspace.domain.message.ContractRequestMessage;
import org.eclipse.dataspace.domain.message.EventType;
import org.eclipse.dataspace.domain.negotiation.ContractAgreement;
import org.eclipse.dataspace.domain.negotiation.ContractOffer;
import org.eclipse.dataspace.domain.negotiation.NegotiationProcess;
import org.eclipse.dataspace.fixtures.DataspaceFixture;
import org.eclipse.dataspace.port.exception.VerificationFailed;
import org.eclipse.dataspace.port.policy.PolicyDecision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.ACCEPTED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.FINALIZED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.OFFERED;
import static org.eclipse.dataspace.domain.negotiation.NegotiationProcess.State.TERMINATED;

class ContractNegotiationTest {

    private final DataspaceFixture dataspace = new DataspaceFixture();
    private final ContractOffer offer = new ContractOffer("offer-1", "asset-1", Map.of("permission", "use"));

    @AfterEach
    void tearDown() {
        dataspace.close();
    }

    @Nested
    class Agreement {

        @Test
        void shouldFinalizeOnBothSides_whenConsumerAccepts() {
            var provider = dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");

            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);
            consumer.getNegotiations().accept(consumerPid).orElseThrow();

            awaitState(consumer, consumerPid, FINALIZED);
            var consumerView = consumer.getNegotiations().findById(consumerPid).getContent();
            var agreement = consumerView.getAgreement();
            assertThat(agreement.isSignedByBoth()).isTrue();
            assertThat(agreement.consumerId()).isEqualTo("consumer");
            assertThat(agreement.providerId()).isEqualTo("provider");
            assertThat(consumerView.getHistory()).extracting("to")
                    .containsExactly(OFFERED.name(), ACCEPTED.name(), "AGREED", "VERIFIED", FINALIZED.name());

            await().untilAsserted(() -> {
                var providerView = provider.getNegotiations().findByAgreementId(agreement.id()).orElseThrow();
                assertThat(providerView.getState()).isEqualTo(FINALIZED);
                assertThat(providerView.getAgreement()).isEqualTo(agreement);
            });
        }

        @Test
        void shouldStayAccepted_untilProviderSigns() {
            var provider = dataspace.connector("provider", builder -> builder.autoAgree(false));
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);

            consumer.getNegotiations().accept(consumerPid).orElseThrow();

            await().untilAsserted(() -> assertThat(provider.getNegotiations().listByState(ACCEPTED)).hasSize(1));
            assertThat(consumer.getNegotiations().findById(consumerPid).getContent().getAgreement()).isNull();
            assertThat(consumer.getNegotiations().findById(consumerPid).getContent().getState()).isEqualTo(ACCEPTED);

            var providerPid = provider.getNegotiations().listByState(ACCEPTED).get(0).getId();
            provider.getNegotiations().agree(providerPid).orElseThrow();

            awaitState(consumer, consumerPid, FINALIZED);
            awaitState(provider, providerPid, FINALIZED);
        }

        @Test
        void shouldApplyCounterOffer_whenConsumerDeclines() {
            var provider = dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);

            var counter = new ContractOffer("offer-2", "asset-1", Map.of("permission", "use", "duration", "P30D"));
            consumer.getNegotiations().decline(consumerPid, counter).orElseThrow();

            await().untilAsserted(() -> {
                var consumerView = consumer.getNegotiations().findById(consumerPid).getContent();
                assertThat(consumerView.getState()).isEqualTo(OFFERED);
                assertThat(consumerView.getOfferCount()).isEqualTo(2);
                assertThat(consumerView.getLastOffer()).isEqualTo(counter);
            });
            assertThat(provider.getNegotiations().listByState(OFFERED)).singleElement()
                    .extracting(NegotiationProcess::getOfferCount).isEqualTo(2);
        }
    }

    @Nested
    class OfferLimit {

        @Test
        void shouldTerminateWithOfferLimitExceeded_whenCounterOffersExceedMaximum() {
            var provider = dataspace.connector("provider", builder -> builder.settings(DataspaceFixture.settings(2)));
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();

            for (var round = 1; round <= 2; round++) {
                var offerCount = round;
                await().untilAsserted(() -> assertThat(consumer.getNegotiations().findById(consumerPid).getContent())
                        .matches(process -> process.getState() == OFFERED && process.getOfferCount() == offerCount));
                consumer.getNegotiations().decline(consumerPid, new ContractOffer("counter-" + round, "asset-1", Map.of())).orElseThrow();
            }

            await().untilAsserted(() -> {
                var consumerView = consumer.getNegotiations().findById(consumerPid).getContent();
                assertThat(consumerView.getState()).isEqualTo(TERMINATED);
                assertThat(consumerView.getTerminationReason()).isEqualTo("OfferLimitExceeded");
            });
            assertThat(provider.getNegotiations().listByState(TERMINATED)).singleElement()
                    .extracting(NegotiationProcess::getTerminationReason).isEqualTo("OfferLimitExceeded");
            assertThat(provider.getNegotiations().listByState(OFFERED)).isEmpty();
        }
    }

    @Nested
    class Termination {

        @Test
        void shouldTerminateWithPolicyDenied_whenPolicyRejectsRequester() {
            var provider = dataspace.connector("provider", builder -> builder
                    .policyEngine((claims, assetId) -> PolicyDecision.deny("asset restricted to partners")));
            var consumer = dataspace.connector("consumer");

            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();

            await().untilAsserted(() -> {
                var consumerView = consumer.getNegotiations().findById(consumerPid).getContent();
                assertThat(consumerView.getState()).isEqualTo(TERMINATED);
                assertThat(consumerView.getTerminationReason()).isEqualTo("PolicyDenied");
            });
            assertThat(provider.getNegotiations().listByState(TERMINATED)).singleElement()
                    .extracting(NegotiationProcess::getTerminationReason).isEqualTo("PolicyDenied");
            assertThat(dataspace.network().sent(ContractOfferMessage.class)).isEmpty();
        }

        @Test
        void shouldTerminateWithVerificationFailed_whenRequesterPresentsUntrustedCredential() {
            var provider = dataspace.connector("provider");
            var rogue = ClaimsAuthority.newInstance()
                    .issuerId("rogue")
                    .attestationSource((subject, claims) -> Result.success(claims))
                    .build();
            var credential = rogue.issueCredential("intruder", Map.of("membership", "active")).orElseThrow();
            var request = new ContractRequestMessage(UUID.randomUUID().toString(), "intruder-pid", null, offer,
                    Presentation.ofCredentials("intruder", List.of(credential)));

            provider.handle("intruder", request);

            assertThat(provider.getNegotiations().listByState(TERMINATED)).singleElement()
                    .extracting(NegotiationProcess::getTerminationReason).isEqualTo("VerificationFailed");
        }

        @Test
        void shouldTerminateWithVerificationFailed_whenAnchorRevokedConsumerMembership() {
            var provider = dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var membership = consumer.getCredentials().credentials().get(0);
            dataspace.anchor().revokeCredential(membership.id()).orElseThrow();

            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();

            awaitState(consumer, consumerPid, TERMINATED);
            assertThat(consumer.getNegotiations().findById(consumerPid).getContent().getTerminationReason()).isEqualTo("VerificationFailed");
            assertThat(provider.getNegotiations().listByState(TERMINATED)).singleElement()
                    .extracting(NegotiationProcess::getTerminationReason).isEqualTo("VerificationFailed");
            assertThat(dataspace.network().sent(ContractOfferMessage.class)).isEmpty();
        }

        @Test
        void shouldTerminateOnBothSides_whenConsumerTerminates() {
            var provider = dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);

            consumer.getNegotiations().terminate(consumerPid, "changed mind").orElseThrow();

            await().untilAsserted(() -> assertThat(provider.getNegotiations().listByState(TERMINATED)).singleElement()
                    .extracting(NegotiationProcess::getTerminationReason).isEqualTo("changed mind"));
            assertThat(consumer.getNegotiations().terminate(consumerPid, "again").succeeded()).isTrue();
        }

        @Test
        void shouldTerminateWithCounterpartyUnreachable_whenRetriesAreExhausted() {
            dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            dataspace.network().disconnect("provider");

            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();

            await().untilAsserted(() -> {
                var consumerView = consumer.getNegotiations().findById(consumerPid).getContent();
                assertThat(consumerView.getState()).isEqualTo(TERMINATED);
                assertThat(consumerView.getTerminationReason()).isEqualTo("CounterpartyUnreachable");
            });
        }

        @Test
        void shouldRejectTermination_whenFinalized() {
            dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);
            consumer.getNegotiations().accept(consumerPid);
            awaitState(consumer, consumerPid, FINALIZED);

            var result = consumer.getNegotiations().terminate(consumerPid, "too late");

            assertThat(result.failed()).isTrue();
            assertThat(consumer.getNegotiations().findById(consumerPid).getContent().getState()).isEqualTo(FINALIZED);
        }
    }

    @Nested
    class Idempotency {

        @Test
        void shouldAcknowledgeRedeliveredOffer_withoutStateChange() {
            dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);
            var offerMessage = dataspace.network().sent(ContractOfferMessage.class).get(0);

            var result = consumer.handle("provider", offerMessage);

            assertThat(result.succeeded()).isTrue();
            var consumerView = consumer.getNegotiations().findById(consumerPid).getContent();
            assertThat(consumerView.getOfferCount()).isEqualTo(1);
            assertThat(consumerView.getHistory()).hasSize(1);
        }

        @Test
        void shouldOpenOneNegotiation_whenRequestIsRedelivered() {
            var provider = dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);
            var request = dataspace.network().sent(ContractRequestMessage.class).get(0);

            provider.handle("consumer", request);

            assertThat(provider.getNegotiations().listByState(OFFERED)).hasSize(1);
        }

        @Test
        void shouldOpenOneNegotiation_whenRequestIsRedeliveredConcurrently() throws InterruptedException {
            var provider = dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var presentation = consumer.getCredentials().presentationFor("provider").orElseThrow();
            var request = new ContractRequestMessage(UUID.randomUUID().toString(), "consumer-pid-1", null, offer, presentation);

            DataspaceFixture.deliverConcurrently(provider, "consumer", request, 8);

            assertThat(provider.getNegotiations().listByState(OFFERED)).singleElement()
                    .extracting(NegotiationProcess::getCounterpartyPid).isEqualTo("consumer-pid-1");
            assertThat(dataspace.network().sent(ContractOfferMessage.class)).hasSize(1);
        }

        @Test
        void shouldStampProviderHistoryWithProviderClock() {
            var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
            var provider = dataspace.connector("provider", builder -> builder.clock(Clock.fixed(now, ZoneOffset.UTC)));
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);

            assertThat(provider.getNegotiations().listByState(OFFERED)).singleElement()
                    .satisfies(process -> assertThat(process.getHistory()).extracting("at").containsOnly(now));
        }

        @Test
        void shouldTerminate_whenAcceptanceIsNotSignedByConsumer() {
            var provider = dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);
            var providerPid = consumer.getNegotiations().findById(consumerPid).getContent().getCounterpartyPid();
            awaitState(provider, providerPid, OFFERED);
            var presentation = consumer.getCredentials().presentationFor("provider").orElseThrow();

            provider.handle("consumer", new ContractNegotiationEventMessage(UUID.randomUUID().toString(), consumerPid, providerPid,
                    EventType.ACCEPTED, new HmacSigner("someone-else").sign("offer".getBytes(StandardCharsets.UTF_8)), presentation));

            var providerView = provider.getNegotiations().findById(providerPid).getContent();
            assertThat(providerView.getState()).isEqualTo(TERMINATED);
            assertThat(providerView.getTerminationReason()).isEqualTo("VerificationFailed");
        }

        @Test
        void shouldTerminate_whenAgreementIsNotSignedByProvider() {
            var provider = dataspace.connector("provider", builder -> builder.autoAgree(false));
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);
            consumer.getNegotiations().accept(consumerPid).orElseThrow();
            var consumerView = consumer.getNegotiations().findById(consumerPid).getContent();
            var unsigned = ContractAgreement.draft(UUID.randomUUID().toString(), consumerView.getLastOffer(), "consumer", "provider", Instant.now());
            var forged = unsigned.withConsumerSignature(consumerView.getConsumerSignature())
                    .withProviderSignature(new HmacSigner("impostor").sign("agreement".getBytes(StandardCharsets.UTF_8)));
            var presentation = provider.getCredentials().presentationFor("consumer").orElseThrow();

            consumer.handle("provider", new ContractAgreementMessage(UUID.randomUUID().toString(), consumerPid,
                    consumerView.getCounterpartyPid(), forged, presentation));

            var terminated = consumer.getNegotiations().findById(consumerPid).getContent();
            assertThat(terminated.getState()).isEqualTo(TERMINATED);
            assertThat(terminated.getTerminationReason()).isEqualTo("AgreementInvalid");
        }

        @Test
        void shouldRejectMessage_fromParticipantOtherThanCounterparty() {
            dataspace.connector("provider");
            var consumer = dataspace.connector("consumer");
            var consumerPid = consumer.getNegotiations().requestContract("provider", offer).orElseThrow().getId();
            awaitState(consumer, consumerPid, OFFERED);
            var offerMessage = dataspace.network().sent(ContractOfferMessage.class).get(0);
            var forged = new ContractOfferMessage(UUID.randomUUID().toString(), offerMessage.consumerPid(), offerMessage.providerPid(),
                    new ContractOffer("forged", "asset-1", Map.of()), offerMessage.presentation());

            var result = consumer.handle("intruder", forged);

            assertThatThrownBy(result::orElseThrow).isExactlyInstanceOf(VerificationFailed.class);
            assertThat(consumer.getNegotiations().findById(consumerPid).getContent().getOfferCount()).isEqualTo(1);
        }
    }

    private static void awaitState(DataspaceConnector connector, String processId, NegotiationProcess.State state) {
        await().untilAsserted(() -> assertThat(connector.getNegotiations().findById(processId).getContent().getState()).isEqualTo(state));
    }
}
