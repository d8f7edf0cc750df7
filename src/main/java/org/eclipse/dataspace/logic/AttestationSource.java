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

import java.util.Map;

/**
 * Single-shot onboarding check run before a credential is issued: returns the claims to certify,
 * or a failure when the subject is not entitled to them.
 */
public interface AttestationSource {

    Result<Map<String, Object>> evaluate(String subjectId, Map<String, Object> requestedClaims);

}
