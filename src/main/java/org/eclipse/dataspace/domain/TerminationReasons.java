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

package org.eclipse.dataspace.domain;

/**
 * Reasons recorded on terminated processes that the engines themselves produce.
 */
public final class TerminationReasons {

    public static final String POLICY_DENIED = "PolicyDenied";
    public static final String OFFER_LIMIT_EXCEEDED = "OfferLimitExceeded";
    public static final String COUNTERPARTY_UNREACHABLE = "CounterpartyUnreachable";
    public static final String VERIFICATION_FAILED = "VerificationFailed";
    public static final String AGREEMENT_INVALID = "AgreementInvalid";
    /**
     * The only reason that ends a transfer in COMPLETED rather than TERMINATED.
     */
    public static final String COMPLETED = "Completed";

    private TerminationReasons() {
    }
}
