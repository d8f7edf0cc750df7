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

package org.eclipse.dataspace.port.policy;

import java.util.Map;

/**
 * Decides whether a requester with the given verified claims may obtain an offer for the asset.
 */
@FunctionalInterface
public interface PolicyEngine {

    PolicyDecision evaluate(Map<String, Object> claims, String assetId);

}
