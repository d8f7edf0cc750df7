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

package org.eclipse.dataspace.port.dataplane;

import org.eclipse.dataspace.domain.DataAddress;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.claims.Token;

/**
 * The tier that actually moves (PUSH) or serves (PULL) data. Tokens are passed in, never minted here.
 */
public interface DataPlane {

    /**
     * Set up the flow bound to the token's transfer process.
     *
     * @return for PUSH the confirmed destination, for PULL the address the consumer fetches from
     */
    Result<DataAddress> provision(DataAddress address, Token token);

    Result<Void> pause(String processId);

    /**
     * Resume a paused flow accepting only the new token from now on.
     */
    Result<DataAddress> resume(String processId, Token newToken);

    Result<Void> teardown(String processId);

}
