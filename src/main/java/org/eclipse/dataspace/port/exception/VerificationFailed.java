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

package org.eclipse.dataspace.port.exception;

/**
 * A presentation or token could not be trusted: bad signature, untrusted issuer, expired or revoked.
 */
public class VerificationFailed extends ProcessException {

    public VerificationFailed(String processId, String state, String detail) {
        super(ErrorKind.VERIFICATION_FAILED, processId, state, detail);
    }

    public VerificationFailed(String processId, String state, String detail, Throwable cause) {
        super(ErrorKind.VERIFICATION_FAILED, processId, state, detail, cause);
    }
}
