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

/**
 * A message about one negotiation or transfer, carrying both sides' process ids. The recipient's own id may be
 * missing on the very first message.
 */
public interface ProcessMessage extends ProtocolMessage {

    String consumerPid();

    String providerPid();

}
