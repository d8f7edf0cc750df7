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

package org.eclipse.dataspace.domain.dataflow;

import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.EndpointDataReference;
import org.jspecify.annotations.Nullable;

/**
 * Answer to a start: the resulting state, the confirmed destination for PUSH or the EDR for PULL.
 */
public record DataFlowResponseMessage(
        String processId,
        String state,
        @Nullable DataAddress dataAddress,
        @Nullable EndpointDataReference edr
) {
}
