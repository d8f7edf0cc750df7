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

package org.eclipse.dataspace.claims;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.TransferType;
import org.eclipse.dataspace.domain.claims.Credential;
import org.eclipse.dataspace.domain.claims.CredentialRecord;
import org.eclipse.dataspace.domain.claims.CredentialStatus;
import org.eclipse.dataspace.domain.claims.Presentation;
import org.eclipse.dataspace.domain.claims.Token;
import org.eclipse.dataspace.domain.claims.VerificationResult;
import org.eclipse.dataspace.logic.AttestationSource;
import org.eclipse.dataspace.logic.RevocationRegistry;
import org.eclipse.dataspace.port.exception.IssuanceDenied;
import org.eclipse.dataspace.port.exception.ProcessNotFoundException;
import org.eclipse.dataspace.port.exception.VerificationFailed;
import org.eclipse.dataspace.port.lease.LeaseManager;
import org.eclipse.dataspace.port.store.InMemoryProcessStore;
import org.eclipse.dataspace.port.store.ObjectMappers;
import org.eclipse.dataspace.port.store.ProcessStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues, verifies and revokes credentials and transfer tokens. Every issuance and revocation is saved to the
 * backing store before it is returned, so nothing is handed out without a durable trace.
 */
public class ClaimsAuthority {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClaimsAuthority.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private String issuerId;
    private Signer signer;
    private final Map<String, Signer> trustedIssuers = new HashMap<>();
    private final Map<String, RevocationRegistry> revocationRegistries = new HashMap<>();
    private KeyResolver keyResolver = participantId -> Optional.empty();
    private AttestationSource attestationSource = (subject, claims) ->
            Result.failure(new UnsupportedOperationException("no attestation source configured"));
    private ProcessStore<Token> tokenStore;
    private ProcessStore<CredentialRecord> credentialStore;
    private Clock clock = Clock.systemUTC();
    private Duration tokenTtl = Duration.ofMinutes(10);
    private Duration credentialTtl = Duration.ofDays(365);
    private LeaseManager leases = new LeaseManager(Duration.ofSeconds(5));

    private final ObjectMapper canonicalMapper = ObjectMappers.canonicalMapper();

    public static Builder newInstance() {
        return new Builder();
    }

    public String getIssuerId() {
        return issuerId;
    }

    public Result<Credential> issueCredential(String subjectId, Map<String, Object> claimSet) {
        var attested = attestationSource.evaluate(subjectId, claimSet);
        if (attested.failed()) {
            LOGGER.warn("Credential issuance denied for {}: {}", subjectId, attested.getCause().getMessage());
            return Result.failure(new IssuanceDenied(subjectId, null, "attestation rejected the subject", attested.getCause()));
        }

        var now = clock.instant();
        var unsigned = new Credential(UUID.randomUUID().toString(), issuerId, subjectId,
                Map.copyOf(attested.getContent()), now, now.plus(credentialTtl), null);

        return canonical(unsigned)
                .map(payload -> unsigned.withSignature(signer.sign(payload)))
                .compose(credential -> credentialStore.save(CredentialRecord.issued(credential))
                        .map(it -> credential))
                .onSuccess(credential -> LOGGER.debug("Issued credential {} to {}", credential.id(), subjectId));
    }

    public Result<Presentation> createPresentation(String holderId, List<Credential> credentials) {
        var foreign = credentials.stream().filter(c -> !holderId.equals(c.subject())).findFirst();
        if (foreign.isPresent()) {
            return Result.failure(new VerificationFailed(holderId, null,
                    "credential %s is not held by %s".formatted(foreign.get().id(), holderId)));
        }
        return Result.success(Presentation.ofCredentials(holderId, credentials));
    }

    public Result<VerificationResult> verifyPresentation(Presentation presentation) {
        if (presentation == null || presentation.isEmpty()) {
            return Result.failure(new VerificationFailed("unknown", null, "empty presentation"));
        }

        var claims = new LinkedHashMap<String, Object>();
        for (var credential : presentation.credentials()) {
            var verified = verifyCredential(presentation.holderId(), credential);
            if (verified.failed()) {
                return Result.failure(verified.getCause());
            }
            claims.putAll(credential.claims());
        }

        if (presentation.token() != null) {
            var token = verifyToken(presentation.token());
            if (token.failed()) {
                return Result.failure(token.getCause());
            }
            claims.put("tokenId", token.getContent().getId());
            claims.put("transferProcessId", token.getContent().getTransferProcessId());
            claims.put("direction", token.getContent().getDirection().name());
        }

        return Result.success(new VerificationResult(true, presentation.holderId(), Map.copyOf(claims)));
    }

    /**
     * Revocation status of a credential issued by this authority. Fails when the credential is unknown.
     */
    public Result<Boolean> checkRevocation(String credentialId) {
        return credentialStore.findById(credentialId)
                .map(record -> record.getState() == CredentialStatus.REVOKED);
    }

    /**
     * Check a participant's signature with the verifier of a trusted issuer or, failing that, a resolved key.
     */
    public Result<Void> verifySignature(String participantId, byte[] payload, String signature) {
        var verifier = Optional.ofNullable(trustedIssuers.get(participantId)).or(() -> keyResolver.resolve(participantId));
        if (verifier.isEmpty()) {
            return Result.failure(new VerificationFailed(participantId, null, "no verification key for %s".formatted(participantId)));
        }
        if (signature == null || !verifier.get().verify(payload, signature)) {
            return Result.failure(new VerificationFailed(participantId, null, "signature of %s is invalid".formatted(participantId)));
        }
        return Result.success();
    }

    public Result<CredentialStatus> credentialStatus(String credentialId) {
        return credentialStore.findById(credentialId).map(record -> record.statusAt(clock.instant()));
    }

    public Result<Void> revokeCredential(String credentialId) {
        return leases.withLease(credentialId, () -> {
            var found = credentialStore.findById(credentialId);
            if (found.failed()) {
                return found.getCause() instanceof ProcessNotFoundException ? Result.success() : Result.failure(found.getCause());
            }
            if (found.getContent().getState() == CredentialStatus.REVOKED) {
                return Result.success();
            }
            var record = found.getContent();
            record.revoke(clock.instant());
            return credentialStore.save(record)
                    .onSuccess(it -> LOGGER.debug("Revoked credential {}", credentialId));
        });
    }

    /**
     * Mint a new token for the transfer process. Prior tokens of the same process are not touched.
     */
    public Result<Token> issueToken(String transferProcessId, TransferType direction) {
        var now = clock.instant();
        var tokenId = UUID.randomUUID().toString();
        var expiresAt = now.plus(tokenTtl);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("jti", tokenId);
        payload.put("iss", issuerId);
        payload.put("sub", transferProcessId);
        payload.put("dir", direction.name());
        payload.put("iat", now.getEpochSecond());
        payload.put("exp", expiresAt.getEpochSecond());

        return Result.attempt(() -> canonicalMapper.writeValueAsBytes(payload))
                .map(bytes -> encode(bytes) + "." + signer.sign(bytes))
                .map(value -> Token.newInstance()
                        .id(tokenId)
                        .value(value)
                        .issuer(issuerId)
                        .transferProcessId(transferProcessId)
                        .direction(direction)
                        .issuedAt(now)
                        .expiresAt(expiresAt)
                        .build())
                .compose(token -> tokenStore.save(token).map(it -> token))
                .onSuccess(token -> LOGGER.debug("Issued token {} for transfer process {}", tokenId, transferProcessId));
    }

    /**
     * Revoke a token. Revoking an unknown or already revoked token is a successful no-op.
     */
    public Result<Void> revokeToken(String tokenId) {
        return leases.withLease(tokenId, () -> {
            var found = tokenStore.findById(tokenId);
            if (found.failed()) {
                return found.getCause() instanceof ProcessNotFoundException ? Result.success() : Result.failure(found.getCause());
            }
            if (found.getContent().isRevoked()) {
                return Result.success();
            }
            var token = found.getContent();
            token.revoke(clock.instant());
            return tokenStore.save(token)
                    .onSuccess(it -> LOGGER.debug("Revoked token {} of transfer process {}", tokenId, token.getTransferProcessId()));
        });
    }

    public Result<Token> findToken(String tokenId) {
        return tokenStore.findById(tokenId);
    }

    public Result<Token> verifyToken(String tokenValue) {
        var parts = tokenValue == null ? new String[0] : tokenValue.split("\\.");
        if (parts.length != 2) {
            return Result.failure(new VerificationFailed("unknown", null, "malformed token"));
        }

        byte[] payloadBytes;
        Map<String, Object> payload;
        try {
            payloadBytes = Base64.getUrlDecoder().decode(parts[0]);
            payload = canonicalMapper.readValue(payloadBytes, PAYLOAD_TYPE);
        } catch (IllegalArgumentException | IOException e) {
            return Result.failure(new VerificationFailed("unknown", null, "malformed token", e));
        }

        var processId = String.valueOf(payload.get("sub"));
        var issuer = String.valueOf(payload.get("iss"));
        var verifier = trustedIssuers.get(issuer);
        if (verifier == null) {
            return Result.failure(new VerificationFailed(processId, null, "token issuer %s is not trusted".formatted(issuer)));
        }
        if (!verifier.verify(payloadBytes, parts[1])) {
            return Result.failure(new VerificationFailed(processId, null, "token signature is invalid"));
        }

        var tokenId = String.valueOf(payload.get("jti"));
        var record = tokenStore.findById(tokenId);
        if (record.failed()) {
            return Result.failure(new VerificationFailed(processId, null, "token %s has no issuance record".formatted(tokenId), record.getCause()));
        }
        var token = record.getContent();
        if (token.isRevoked()) {
            return Result.failure(new VerificationFailed(processId, token.getState().name(), "token %s is revoked".formatted(tokenId)));
        }
        if (token.isExpiredAt(clock.instant())) {
            return Result.failure(new VerificationFailed(processId, token.getState().name(), "token %s is expired".formatted(tokenId)));
        }
        return Result.success(token);
    }

    private Result<Void> verifyCredential(String holderId, Credential credential) {
        var verifier = trustedIssuers.get(credential.issuer());
        if (verifier == null) {
            return Result.failure(new VerificationFailed(holderId, null, "issuer %s is not trusted".formatted(credential.issuer())));
        }
        if (!Objects.equals(holderId, credential.subject())) {
            return Result.failure(new VerificationFailed(holderId, null, "credential %s was issued to %s".formatted(credential.id(), credential.subject())));
        }

        var signatureValid = canonical(credential.unsigned())
                .map(payload -> verifier.verify(payload, credential.signature()));
        if (signatureValid.failed() || !signatureValid.getContent()) {
            return Result.failure(new VerificationFailed(holderId, null, "credential %s signature is invalid".formatted(credential.id())));
        }
        if (credential.isExpiredAt(clock.instant())) {
            return Result.failure(new VerificationFailed(holderId, CredentialStatus.EXPIRED.name(), "credential %s is expired".formatted(credential.id())));
        }

        var registry = revocationRegistries.get(credential.issuer());
        var revoked = registry == null
                ? Result.<Boolean>failure(new IllegalStateException("no revocation registry for " + credential.issuer()))
                : registry.isRevoked(credential.id());
        if (revoked.failed()) {
            LOGGER.warn("Revocation status of credential {} unknown: {}", credential.id(), revoked.getCause().getMessage());
            return Result.failure(new VerificationFailed(holderId, null,
                    "revocation status of credential %s is unknown".formatted(credential.id()), revoked.getCause()));
        }
        if (Boolean.TRUE.equals(revoked.getContent())) {
            return Result.failure(new VerificationFailed(holderId, CredentialStatus.REVOKED.name(), "credential %s is revoked".formatted(credential.id())));
        }
        return Result.success();
    }

    private Result<byte[]> canonical(Credential credential) {
        try {
            return Result.success(canonicalMapper.writeValueAsBytes(credential));
        } catch (JsonProcessingException e) {
            return Result.failure(e);
        }
    }

    private static String encode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public static class Builder {

        private final ClaimsAuthority authority = new ClaimsAuthority();

        private Builder() {
        }

        public ClaimsAuthority build() {
            Objects.requireNonNull(authority.issuerId, "issuerId");
            if (authority.signer == null) {
                authority.signer = new HmacSigner(UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8));
            }
            authority.trustedIssuers.put(authority.issuerId, authority.signer);
            authority.revocationRegistries.put(authority.issuerId, authority::checkRevocation);

            var objectMapper = ObjectMappers.defaultMapper();
            if (authority.tokenStore == null) {
                authority.tokenStore = new InMemoryProcessStore<>(objectMapper, Token.class);
            }
            if (authority.credentialStore == null) {
                authority.credentialStore = new InMemoryProcessStore<>(objectMapper, CredentialRecord.class);
            }
            return authority;
        }

        public Builder issuerId(String issuerId) {
            authority.issuerId = issuerId;
            return this;
        }

        public Builder signer(Signer signer) {
            authority.signer = signer;
            return this;
        }

        public Builder trustIssuer(String issuerId, Signer verifier) {
            authority.trustedIssuers.put(issuerId, verifier);
            return this;
        }

        public Builder revocationRegistry(String issuerId, RevocationRegistry registry) {
            authority.revocationRegistries.put(issuerId, registry);
            return this;
        }

        public Builder keyResolver(KeyResolver keyResolver) {
            authority.keyResolver = keyResolver;
            return this;
        }

        public Builder attestationSource(AttestationSource attestationSource) {
            authority.attestationSource = attestationSource;
            return this;
        }

        public Builder tokenStore(ProcessStore<Token> tokenStore) {
            authority.tokenStore = tokenStore;
            return this;
        }

        public Builder credentialStore(ProcessStore<CredentialRecord> credentialStore) {
            authority.credentialStore = credentialStore;
            return this;
        }

        public Builder clock(Clock clock) {
            authority.clock = clock;
            return this;
        }

        public Builder tokenTtl(Duration tokenTtl) {
            authority.tokenTtl = tokenTtl;
            return this;
        }

        public Builder credentialTtl(Duration credentialTtl) {
            authority.credentialTtl = credentialTtl;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            authority.leases = new LeaseManager(leaseTimeout);
            return this;
        }
    }
}
