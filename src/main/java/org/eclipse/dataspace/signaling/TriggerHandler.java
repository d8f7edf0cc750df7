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

import org.eclipse.dataspace.domain.Result;

/**
 * Anything that can be suspended or terminated by a {@link Trigger}.
 */
public interface TriggerHandler {

    Result<?> suspend(String processId, String reason);

    Result<?> terminate(String processId, String reason);

    default Result<?> handle(Trigger trigger) {
        return switch (trigger.action()) {
            case SUSPEND -> suspend(trigger.processId(), trigger.reason());
            case TERMINATE -> terminate(trigger.processId(), trigger.reason());
        };
    }
}
