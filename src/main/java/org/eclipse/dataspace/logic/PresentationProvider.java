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

package org.eclipse.dataspace.logic;

import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.claims.Presentation;

/**
 * Supplies the presentation this participant authenticates with towards a counterparty.
 */
@FunctionalInterface
public interface PresentationProvider {

    Result<Presentation> presentationFor(String counterpartyId);

}
