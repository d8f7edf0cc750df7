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
 * Error taxonomy reported to operators together with process id and state.
 */
public enum ErrorKind {
    POLICY_DENIED,
    INVALID_STATE_TRANSITION,
    VERIFICATION_FAILED,
    ISSUANCE_DENIED,
    DELIVERY_FAILED,
    COUNTERPARTY_UNREACHABLE,
    CONCURRENT_MODIFICATION,
    CONTRACT_NOT_AGREED,
    NOT_FOUND
}
