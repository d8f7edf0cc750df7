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

import org.eclipse.dataspace.domain.claims.Presentation;

public record ContractAgreementVerificationMessage(
        String messageId,
        String consumerPid,
        String providerPid,
        Presentation presentation
) implements ProcessMessage {
}
