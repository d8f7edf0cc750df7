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
 * Anything the process store keeps: identified by id and currently in one state of its state machine.
 *
 * @param <S> the state enum
 */
public interface StatefulEntity<S extends Enum<S>> {

    String getId();

    S getState();

}
