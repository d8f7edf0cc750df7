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

package org.eclipse.dataspace.signaling;

/**
 * An external reason to suspend or terminate a transfer. The state machines do not care where it came from.
 */
public record Trigger(Origin origin, Action action, String processId, String reason) {

    public static Trigger policyExpired(String processId) {
        return new Trigger(Origin.POLICY_MONITOR, Action.TERMINATE, processId, "PolicyExpired");
    }

    public static Trigger policyViolated(String processId, String detail) {
        return new Trigger(Origin.POLICY_MONITOR, Action.SUSPEND, processId, "PolicyViolation: " + detail);
    }

    public static Trigger remote(Action action, String processId, String reason) {
        return new Trigger(Origin.REMOTE_MESSAGE, action, processId, reason);
    }

    public static Trigger manual(Action action, String processId, String reason) {
        return new Trigger(Origin.MANUAL_INVOCATION, action, processId, reason);
    }

    public static Trigger systemError(String processId, Throwable error) {
        return new Trigger(Origin.SYSTEM_ERROR, Action.TERMINATE, processId, "SystemError: " + error.getMessage());
    }

    public enum Origin {
        POLICY_MONITOR,
        REMOTE_MESSAGE,
        MANUAL_INVOCATION,
        SYSTEM_ERROR
    }

    public enum Action {
        SUSPEND,
        TERMINATE
    }
}
