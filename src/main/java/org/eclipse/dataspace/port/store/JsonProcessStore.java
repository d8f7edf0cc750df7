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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.dataspace.domain.Result;
import org.eclipse.dataspace.domain.StatefulEntity;
import org.eclipse.dataspace.port.exception.ProcessNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Base for stores that keep every process as a JSON document, so a read always yields a fresh copy.
 * Read errors of the backing medium come back as failed results; {@link #listByState} throws them as
 * {@link IllegalStateException}.
 */
abstract class JsonProcessStore<P extends StatefulEntity<?>> implements ProcessStore<P> {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonProcessStore.class);

    protected final ObjectMapper objectMapper;
    private final Class<P> type;

    protected JsonProcessStore(ObjectMapper objectMapper, Class<P> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    protected abstract Result<Void> write(String id, String document);

    /**
     * The stored document, empty when there is none.
     */
    protected abstract Result<Optional<String>> read(String id);

    protected abstract Result<List<String>> readAll();

    @Override
    public Result<Void> save(P process) {
        try {
            return write(process.getId(), objectMapper.writeValueAsString(process));
        } catch (JsonProcessingException e) {
            return Result.failure(e);
        }
    }

    @Override
    public Result<P> findById(String id) {
        return read(id).compose(document -> document
                .map(this::deserialize)
                .orElseGet(() -> Result.<P>failure(new ProcessNotFoundException(id, null, "%s %s not found".formatted(type.getSimpleName(), id)))));
    }

    @Override
    public List<P> listByState(Enum<?> state) {
        return all()
                .orElseThrow(failure -> new IllegalStateException("%s store is not readable".formatted(type.getSimpleName()), failure))
                .stream()
                .filter(it -> it.getState().name().equals(state.name()))
                .toList();
    }

    @Override
    public Result<P> findFirst(Predicate<P> predicate) {
        return all().compose(processes -> processes.stream().filter(predicate).findFirst()
                .map(Result::success)
                .orElseGet(() -> Result.<P>failure(new ProcessNotFoundException("unknown", null, "no %s matches the query".formatted(type.getSimpleName())))));
    }

    // a corrupt document must not hide every other process
    private Result<List<P>> all() {
        return readAll().map(documents -> documents.stream()
                .map(this::deserialize)
                .flatMap(result -> {
                    if (result.failed()) {
                        LOGGER.warn("Skipping unreadable {} document: {}", type.getSimpleName(), result.getCause().getMessage());
                        return Stream.<P>empty();
                    }
                    return Stream.of(result.getContent());
                })
                .toList());
    }

    private Result<P> deserialize(String document) {
        try {
            return Result.success(objectMapper.readValue(document, type));
        } catch (JsonProcessingException e) {
            return Result.failure(e);
        }
    }
}
