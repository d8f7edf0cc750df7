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

package org.eclipse.dataspace.port.transport;

import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.message.ProtocolMessage;

/**
 * Authenticated channel to other participants. A successful send means the counterparty acknowledged the
 * message, a failed one carries a {@link org.eclipse.dataspace.port.exception.DeliveryFailed}.
 */
public interface Transport {

    Result<Void> send(String counterpartyId, ProtocolMessage message);

    void register(InboundHandler handler);

}
