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

import java.util.Optional;

/**
 * Looks up the verifier of a participant's signing key, e.g. from its published identity document.
 */
@FunctionalInterface
public interface KeyResolver {

    Optional<Signer> resolve(String participantId);

}
