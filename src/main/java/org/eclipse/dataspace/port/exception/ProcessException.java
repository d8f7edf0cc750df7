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

import org.jspecify.annotations.Nullable;

/**
 * Base of all failures surfaced by the protocol components. The message always names the error kind,
 * the process id and the state the process was in when the failure occurred.
 */
public abstract class ProcessException extends Exception {

    private final ErrorKind kind;
    private final String processId;
    private final @Nullable String state;

    protected ProcessException(ErrorKind kind, String processId, @Nullable String state, String detail) {
        this(kind, processId, state, detail, null);
    }

    protected ProcessException(ErrorKind kind, String processId, @Nullable String state, String detail, @Nullable Throwable cause) {
        super("%s on process %s in state %s: %s".formatted(kind, processId, state == null ? "NONE" : state, detail), cause);
        this.kind = kind;
        this.processId = processId;
        this.state = state;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getProcessId() {
        return processId;
    }

    public @Nullable String getState() {
        return state;
    }
}
