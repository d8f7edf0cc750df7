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

package org.eclipse.dataspace.domain.message;

import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.TransferType;
import org.eclipse.dataspace.domain.claims.Presentation;

public record TransferRequestMessage(
        String messageId,
        String consumerPid,
        String providerPid,
        String agreementId,
        TransferType transferType,
        DataAddress dataAddress,
        Presentation presentation
) implements ProcessMessage {
}
