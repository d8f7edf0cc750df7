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
 * A single outbound delivery attempt failed. Transient, retried with backoff.
 */
public class DeliveryFailed extends ProcessException {

    public DeliveryFailed(String processId, String state, String detail) {
        super(ErrorKind.DELIVERY_FAILED, processId, state, detail);
    }

    public DeliveryFailed(String processId, String state, String detail, Throwable cause) {
        super(ErrorKind.DELIVERY_FAILED, processId, state, detail, cause);
    }
}
