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

package org.eclipse.dataspace;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.dataspace.claims.ClaimsAuthority;
import org.eclipse.dataspace.claims.CredentialService;
import org.eclipse.dataspace.claims.HmacSigner;
import org.eclipse.dataspace.claims.KeyResolver;
import org.eclipse.dataspace.claims.Signer;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.StatefulEntity;
import org.eclipse.dataspace.domain.claims.CredentialRecord;
import org.eclipse.dataspace.domain.claims.Token;
import org.eclipse.dataspace.domain.dataflow.DataFlow;
import org.eclipse.dataspace.domain.message.ContractAgreementMessage;
import org.eclipse.dataspace.domain.message.ContractAgreementVerificationMessage;
import org.eclipse.dataspace.domain.message.ContractNegotiationEventMessage;
import org.eclipse.dataspace.domain.message.ContractNegotiationTerminationMessage;
import org.eclipse.dataspace.domain.message.ContractOfferMessage;
import org.eclipse.dataspace.domain.message.ContractRequestMessage;
import org.eclipse.dataspace.domain.message.ProcessMessage;
import org.eclipse.dataspace.domain.message.ProtocolMessage;
import org.eclipse.dataspace.domain.message.TransferCompletionMessage;
import org.eclipse.dataspace.domain.message.TransferRequestMessage;
import org.eclipse.dataspace.domain.message.TransferStartMessage;
import org.eclipse.dataspace.domain.message.TransferSuspensionMessage;
import org.eclipse.dataspace.domain.message.TransferTerminationMessage;
import org.eclipse.dataspace.domain.negotiation.NegotiationProcess;
import org.eclipse.dataspace.domain.transfer.TransferProcess;
import org.eclipse.dataspace.logic.AttestationSource;
import org.eclipse.dataspace.logic.OfferResolver;
import org.eclipse.dataspace.logic.RevocationRegistry;
import org.eclipse.dataspace.negotiation.NegotiationEngine;
import org.eclipse.dataspace.port.dataplane.DataPlane;
import org.eclipse.dataspace.port.policy.PolicyEngine;
import org.eclipse.dataspace.port.store.InMemoryProcessStore;
import org.eclipse.dataspace.port.store.ObjectMappers;
import org.eclipse.dataspace.port.store.ProcessStore;
import org.eclipse.dataspace.port.transport.InboundHandler;
import org.eclipse.dataspace.port.transport.MessageDispatcher;
import org.eclipse.dataspace.port.transport.Transport;
import org.eclipse.dataspace.signaling.SignalingController;
import org.eclipse.dataspace.transfer.TransferCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires the components of one participant and routes every inbound protocol message to the component owning it.
 */
public class DataspaceConnector implements InboundHandler, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataspaceConnector.class);

    private static final Set<Class<? extends ProcessMessage>> NEGOTIATION_MESSAGES = Set.of(
            ContractRequestMessage.class, ContractOfferMessage.class, ContractNegotiationEventMessage.class,
            ContractAgreementMessage.class, ContractAgreementVerificationMessage.class, ContractNegotiationTerminationMessage.class);

    private static final Set<Class<? extends ProcessMessage>> TRANSFER_MESSAGES = Set.of(
            TransferRequestMessage.class, TransferStartMessage.class, TransferSuspensionMessage.class,
            TransferTerminationMessage.class, TransferCompletionMessage.class);

    private final String participantId;
    private final ClaimsAuthority claimsAuthority;
    private final CredentialService credentials;
    private final SignalingController signaling;
    private final NegotiationEngine negotiations;
    private final TransferCoordinator transfers;
    private final MessageDispatcher dispatcher;

    private DataspaceConnector(String participantId, ClaimsAuthority claimsAuthority, CredentialService credentials,
                               SignalingController signaling, NegotiationEngine negotiations, TransferCoordinator transfers,
                               MessageDispatcher dispatcher) {
        this.participantId = participantId;
        this.claimsAuthority = claimsAuthority;
        this.credentials = credentials;
        this.signaling = signaling;
        this.negotiations = negotiations;
        this.transfers = transfers;
        this.dispatcher = dispatcher;
    }

    public static Builder newInstance() {
        return new Builder();
    }

    @Override
    public Result<Void> handle(String senderId, ProtocolMessage message) {
        LOGGER.debug("{} received {} from {}", participantId, message.getClass().getSimpleName(), senderId);
        if (NEGOTIATION_MESSAGES.contains(message.getClass())) {
            return negotiations.handle(senderId, (ProcessMessage) message);
        }
        if (TRANSFER_MESSAGES.contains(message.getClass())) {
            return transfers.handle(senderId, (ProcessMessage) message);
        }
        return credentials.handle(senderId, message);
    }

    public String getParticipantId() {
        return participantId;
    }

    public ClaimsAuthority getClaimsAuthority() {
        return claimsAuthority;
    }

    public CredentialService getCredentials() {
        return credentials;
    }

    public SignalingController getSignaling() {
        return signaling;
    }

    public NegotiationEngine getNegotiations() {
        return negotiations;
    }

    public TransferCoordinator getTransfers() {
        return transfers;
    }

    @Override
    public void close() {
        dispatcher.close();
    }

    public static class Builder {

        private String participantId;
        private DataspaceSettings settings = DataspaceSettings.defaults();
        private Transport transport;
        private DataPlane dataPlane;
        private Signer signer;
        private final Map<String, Signer> trustedIssuers = new HashMap<>();
        private final Map<String, RevocationRegistry> revocationRegistries = new HashMap<>();
        private KeyResolver keyResolver;
        private AttestationSource attestationSource;
        private PolicyEngine policyEngine;
        private OfferResolver offerResolver;
        private boolean autoAgree = true;
        private Clock clock = Clock.systemUTC();
        private MessageDispatcher dispatcher;
        private ProcessStore<NegotiationProcess> negotiationStore;
        private ProcessStore<TransferProcess> transferStore;
        private ProcessStore<DataFlow> dataFlowStore;
        private ProcessStore<Token> tokenStore;
        private ProcessStore<CredentialRecord> credentialStore;

        private Builder() {
        }

        public DataspaceConnector build() {
            Objects.requireNonNull(participantId, "participantId");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(dataPlane, "dataPlane");

            var objectMapper = ObjectMappers.defaultMapper();
            if (signer == null) {
                signer = new HmacSigner(UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8));
            }
            if (dispatcher == null) {
                dispatcher = new MessageDispatcher(transport, settings.retryPolicy());
            }

            var authorityBuilder = ClaimsAuthority.newInstance()
                    .issuerId(participantId)
                    .signer(signer)
                    .clock(clock)
                    .tokenTtl(settings.tokenTtl())
                    .credentialTtl(settings.credentialTtl())
                    .leaseTimeout(settings.leaseTimeout())
                    .tokenStore(orInMemory(tokenStore, objectMapper, Token.class))
                    .credentialStore(orInMemory(credentialStore, objectMapper, CredentialRecord.class));
            // issuers without an explicit registry are asked over the claims protocol
            var credentialsRef = new AtomicReference<CredentialService>();
            trustedIssuers.forEach((issuerId, verifier) -> authorityBuilder
                    .trustIssuer(issuerId, verifier)
                    .revocationRegistry(issuerId, revocationRegistries.getOrDefault(issuerId,
                            credentialId -> credentialsRef.get().revocationRegistry(issuerId).isRevoked(credentialId))));
            if (keyResolver != null) {
                authorityBuilder.keyResolver(keyResolver);
            }
            if (attestationSource != null) {
                authorityBuilder.attestationSource(attestationSource);
            }
            var claimsAuthority = authorityBuilder.build();

            var credentials = CredentialService.newInstance()
                    .participantId(participantId)
                    .claimsAuthority(claimsAuthority)
                    .dispatcher(dispatcher)
                    .clock(clock)
                    .build();
            credentialsRef.set(credentials);

            var signaling = SignalingController.newInstance()
                    .store(orInMemory(dataFlowStore, objectMapper, DataFlow.class))
                    .claimsAuthority(claimsAuthority)
                    .dataPlane(dataPlane)
                    .clock(clock)
                    .leaseTimeout(settings.leaseTimeout())
                    .build();

            var negotiationBuilder = NegotiationEngine.newInstance()
                    .participantId(participantId)
                    .store(orInMemory(negotiationStore, objectMapper, NegotiationProcess.class))
                    .claimsAuthority(claimsAuthority)
                    .signer(signer)
                    .presentationProvider(credentials)
                    .dispatcher(dispatcher)
                    .maxOfferCount(settings.maxOfferCount())
                    .autoAgree(autoAgree)
                    .leaseTimeout(settings.leaseTimeout())
                    .clock(clock);
            if (policyEngine != null) {
                negotiationBuilder.policyEngine(policyEngine);
            }
            if (offerResolver != null) {
                negotiationBuilder.offerResolver(offerResolver);
            }
            var negotiations = negotiationBuilder.build();

            var transfers = TransferCoordinator.newInstance()
                    .store(orInMemory(transferStore, objectMapper, TransferProcess.class))
                    .negotiations(negotiations)
                    .signaling(signaling)
                    .claimsAuthority(claimsAuthority)
                    .presentationProvider(credentials)
                    .dispatcher(dispatcher)
                    .clock(clock)
                    .leaseTimeout(settings.leaseTimeout())
                    .build();

            var connector = new DataspaceConnector(participantId, claimsAuthority, credentials, signaling, negotiations, transfers, dispatcher);
            transport.register(connector);
            return connector;
        }

        public Builder participantId(String participantId) {
            this.participantId = participantId;
            return this;
        }

        public Builder settings(DataspaceSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder dataPlane(DataPlane dataPlane) {
            this.dataPlane = dataPlane;
            return this;
        }

        public Builder signer(Signer signer) {
            this.signer = signer;
            return this;
        }

        public Builder trustIssuer(String issuerId, Signer verifier) {
            trustedIssuers.put(issuerId, verifier);
            return this;
        }

        public Builder revocationRegistry(String issuerId, RevocationRegistry registry) {
            revocationRegistries.put(issuerId, registry);
            return this;
        }

        public Builder keyResolver(KeyResolver keyResolver) {
            this.keyResolver = keyResolver;
            return this;
        }

        public Builder attestationSource(AttestationSource attestationSource) {
            this.attestationSource = attestationSource;
            return this;
        }

        public Builder policyEngine(PolicyEngine policyEngine) {
            this.policyEngine = policyEngine;
            return this;
        }

        public Builder offerResolver(OfferResolver offerResolver) {
            this.offerResolver = offerResolver;
            return this;
        }

        public Builder autoAgree(boolean autoAgree) {
            this.autoAgree = autoAgree;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder dispatcher(MessageDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder negotiationStore(ProcessStore<NegotiationProcess> negotiationStore) {
            this.negotiationStore = negotiationStore;
            return this;
        }

        public Builder transferStore(ProcessStore<TransferProcess> transferStore) {
            this.transferStore = transferStore;
            return this;
        }

        public Builder dataFlowStore(ProcessStore<DataFlow> dataFlowStore) {
            this.dataFlowStore = dataFlowStore;
            return this;
        }

        public Builder tokenStore(ProcessStore<Token> tokenStore) {
            this.tokenStore = tokenStore;
            return this;
        }

        public Builder credentialStore(ProcessStore<CredentialRecord> credentialStore) {
            this.credentialStore = credentialStore;
            return this;
        }

        private static <P extends StatefulEntity<?>> ProcessStore<P> orInMemory(ProcessStore<P> store, ObjectMapper objectMapper, Class<P> type) {
            return store != null ? store : new InMemoryProcessStore<>(objectMapper, type);
        }
    }
}
