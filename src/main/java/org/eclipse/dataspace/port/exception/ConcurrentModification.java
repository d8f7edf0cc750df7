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
 * The exclusive lease on a process id could not be acquired in time. Callers may retry.
 */
public class ConcurrentModification extends ProcessException {

    public ConcurrentModification(String processId, String state, String detail) {
        super(ErrorKind.CONCURRENT_MODIFICATION, processId, state, detail);
    }

    public ConcurrentModification(String processId, String state, String detail, Throwable cause) {
        super(ErrorKind.CONCURRENT_MODIFICATION, processId, state, detail, cause);
    }
}
