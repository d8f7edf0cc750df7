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

/**
 * Produces and checks signatures over canonical payloads. The key material stays inside the implementation.
 */
public interface Signer {

    String sign(byte[] payload);

    boolean verify(byte[] payload, String signature);

}
