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

package org.eclipse.dataspace.port.store;

import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.StatefulEntity;

import java.util.List;
import java.util.function.Predicate;

/**
 * Durable record of processes. Implementations must be read-after-write consistent per id and must
 * never hand out references to the stored state.
 *
 * @param <P> the stored entity type
 */
public interface ProcessStore<P extends StatefulEntity<?>> {

    Result<Void> save(P process);

    Result<P> findById(String id);

    List<P> listByState(Enum<?> state);

    Result<P> findFirst(Predicate<P> predicate);

}
