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

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * What a holder presents to be authenticated: a set of credentials, a transfer token, or both.
 */
public record Presentation(
        String holderId,
        List<Credential> credentials,
        @Nullable String token
) {

    public static Presentation ofCredentials(String holderId, List<Credential> credentials) {
        return new Presentation(holderId, List.copyOf(credentials), null);
    }

    public static Presentation ofToken(String holderId, String token) {
        return new Presentation(holderId, List.of(), token);
    }

    public boolean isEmpty() {
        return (credentials == null || credentials.isEmpty()) && token == null;
    }
}
