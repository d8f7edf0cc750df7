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

import java.time.Instant;
import java.util.Map;

/**
 * The mutually signed outcome of a negotiation. It only exists as such once both signatures are present.
 */
public record ContractAgreement(
        String id,
        String offerId,
        String assetId,
        String consumerId,
        String providerId,
        Map<String, Object> policy,
        Instant signedAt,
        String consumerSignature,
        String providerSignature
) {

    public static ContractAgreement draft(String id, ContractOffer offer, String consumerId, String providerId, Instant signedAt) {
        return new ContractAgreement(id, offer.id(), offer.assetId(), consumerId, providerId, offer.policy(), signedAt, null, null);
    }

    public ContractAgreement withConsumerSignature(String signature) {
        return new ContractAgreement(id, offerId, assetId, consumerId, providerId, policy, signedAt, signature, providerSignature);
    }

    public ContractAgreement withProviderSignature(String signature) {
        return new ContractAgreement(id, offerId, assetId, consumerId, providerId, policy, signedAt, consumerSignature, signature);
    }

    /**
     * The agreement as the provider signed it, without any signature.
     */
    public ContractAgreement unsigned() {
        return new ContractAgreement(id, offerId, assetId, consumerId, providerId, policy, signedAt, null, null);
    }

    public boolean isSignedByBoth() {
        return isPresent(consumerSignature) && isPresent(providerSignature);
    }

    private static boolean isPresent(String signature) {
        return signature != null && !signature.isBlank();
    }
}
