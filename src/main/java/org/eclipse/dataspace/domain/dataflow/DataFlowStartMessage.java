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
import org.eclipse.dataspace.domain.TransferType;

/**
 * Control-plane request to start, or resume, the data flow of a transfer process.
 */
public record DataFlowStartMessage(
        String processId,
        String agreementId,
        String counterPartyId,
        TransferType transferType,
        DataAddress dataAddress
) {
}
