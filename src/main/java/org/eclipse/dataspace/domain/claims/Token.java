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
import org.eclipse.dataspace.domain.TransferType;

import java.time.Instant;
import java.util.Objects;

/**
 * Capability bound to exactly one transfer process and one direction. Minted on start or resume,
 * revoked on suspend or terminate, never reused.
 */
public class Token implements StatefulEntity<Token.State> {

    private String id;
    private String value;
    private String issuer;
    private String transferProcessId;
    private TransferType direction;
    private Instant issuedAt;
    private Instant expiresAt;
    private State state;
    private Instant revokedAt;

    public static Token.Builder newInstance() {
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

    public String getValue() {
        return value;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getTransferProcessId() {
        return transferProcessId;
    }

    public TransferType getDirection() {
        return direction;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public boolean isRevoked() {
        return state == State.REVOKED;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public void revoke(Instant at) {
        state = State.REVOKED;
        revokedAt = at;
    }

    public static class Builder {
        private final Token token = new Token();

        private Builder() {

        }

        public Token build() {
            Objects.requireNonNull(token.id);
            Objects.requireNonNull(token.transferProcessId);
            Objects.requireNonNull(token.expiresAt);

            if (token.state == null) {
                token.state = State.ACTIVE;
            }

            return token;
        }

        public Builder id(String id) {
            token.id = id;
            return this;
        }

        public Builder value(String value) {
            token.value = value;
            return this;
        }

        public Builder issuer(String issuer) {
            token.issuer = issuer;
            return this;
        }

        public Builder transferProcessId(String transferProcessId) {
            token.transferProcessId = transferProcessId;
            return this;
        }

        public Builder direction(TransferType direction) {
            token.direction = direction;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            token.issuedAt = issuedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            token.expiresAt = expiresAt;
            return this;
        }
    }

    public enum State {
        ACTIVE,
        REVOKED
    }
}
