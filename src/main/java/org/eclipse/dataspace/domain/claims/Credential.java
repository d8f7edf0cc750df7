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

package org.eclipse.dataspace.domain.claims;

import java.time.Instant;
import java.util.Map;

/**
 * Verifiable claim about a participant, signed by its issuer.
 */
public record Credential(
        String id,
        String issuer,
        String subject,
        Map<String, Object> claims,
        Instant issuedAt,
        Instant expiresAt,
        String signature
) {

    public Credential withSignature(String signature) {
        return new Credential(id, issuer, subject, claims, issuedAt, expiresAt, signature);
    }

    public Credential unsigned() {
        return withSignature(null);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
