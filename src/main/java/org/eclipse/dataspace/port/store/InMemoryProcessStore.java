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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.StatefulEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProcessStore<P extends StatefulEntity<?>> extends JsonProcessStore<P> {

    private final Map<String, String> store = new ConcurrentHashMap<>();

    public InMemoryProcessStore(ObjectMapper objectMapper, Class<P> type) {
        super(objectMapper, type);
    }

    @Override
    protected Result<Void> write(String id, String document) {
        store.put(id, document);
        return Result.success();
    }

    @Override
    protected Result<Optional<String>> read(String id) {
        return Result.success(Optional.ofNullable(store.get(id)));
    }

    @Override
    protected Result<List<String>> readAll() {
        return Result.success(List.copyOf(store.values()));
    }
}
