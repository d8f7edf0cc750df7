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

package org.eclipse.dataspace.domain.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.jspecify.annotations.Nullable;

/**
 * A structured document exchanged between participants. The message id identifies the logical message, so
 * redeliveries of the same message carry the same id.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(ContractRequestMessage.class),
        @JsonSubTypes.Type(ContractOfferMessage.class),
        @JsonSubTypes.Type(ContractNegotiationEventMessage.class),
        @JsonSubTypes.Type(ContractAgreementMessage.class),
        @JsonSubTypes.Type(ContractAgreementVerificationMessage.class),
        @JsonSubTypes.Type(ContractNegotiationTerminationMessage.class),
        @JsonSubTypes.Type(TransferRequestMessage.class),
        @JsonSubTypes.Type(TransferStartMessage.class),
        @JsonSubTypes.Type(TransferSuspensionMessage.class),
        @JsonSubTypes.Type(TransferTerminationMessage.class),
        @JsonSubTypes.Type(TransferCompletionMessage.class),
        @JsonSubTypes.Type(CredentialRequestMessage.class),
        @JsonSubTypes.Type(CredentialOfferMessage.class),
        @JsonSubTypes.Type(PresentationQueryMessage.class),
        @JsonSubTypes.Type(PresentationResponseMessage.class),
        @JsonSubTypes.Type(RevocationCheckMessage.class),
        @JsonSubTypes.Type(RevocationStatusMessage.class)
})
public interface ProtocolMessage {

    String messageId();

    /**
     * Credentials or token the sender authenticates with, when the message type requires one.
     */
    default @Nullable Presentation presentation() {
        return null;
    }
}
