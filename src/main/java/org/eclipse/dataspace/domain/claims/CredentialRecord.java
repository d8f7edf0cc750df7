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

import org.eclipse.dataspace.domain.StatefulEntity;

import java.time.Instant;

/**
 * Durable issuance record of a credential. Expiry is not stored as a state, it is evaluated on read.
 */
public class CredentialRecord implements StatefulEntity<CredentialStatus> {

    private String id;
    private Credential credential;
    private CredentialStatus state;
    private Instant revokedAt;

    private CredentialRecord() {
    }

    public static CredentialRecord issued(Credential credential) {
        var record = new CredentialRecord();
        record.id = credential.id();
        record.credential = credential;
        record.state = CredentialStatus.VALID;
        return record;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public CredentialStatus getState() {
        return state;
    }

    public Credential getCredential() {
        return credential;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public CredentialStatus statusAt(Instant now) {
        if (state == CredentialStatus.REVOKED) {
            return CredentialStatus.REVOKED;
        }
        return credential.isExpiredAt(now) ? CredentialStatus.EXPIRED : CredentialStatus.VALID;
    }

    public void revoke(Instant at) {
        state = CredentialStatus.REVOKED;
        revokedAt = at;
    }
}
