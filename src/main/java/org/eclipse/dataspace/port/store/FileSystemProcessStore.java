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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * One JSON file per process id. Writes go to a temporary sibling that is flushed to disk and then atomically
 * moved in place, so a crash leaves either the previous or the new record, never a torn one.
 */
public class FileSystemProcessStore<P extends StatefulEntity<?>> extends JsonProcessStore<P> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemProcessStore.class);
    private static final String SUFFIX = ".json";

    private final Path root;

    public FileSystemProcessStore(Path root, ObjectMapper objectMapper, Class<P> type) throws IOException {
        super(objectMapper, type);
        this.root = Files.createDirectories(root);
    }

    @Override
    protected Result<Void> write(String id, String document) {
        Path temp;
        try {
            temp = Files.createTempFile(root, "write-", ".tmp");
        } catch (IOException e) {
            return Result.failure(e);
        }

        try {
            try (var channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                var buffer = ByteBuffer.wrap(document.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, root.resolve(fileName(id)), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return Result.success();
        } catch (IOException e) {
            return Result.failure(e);
        } finally {
            deleteLeftover(temp);
        }
    }

    @Override
    protected Result<Optional<String>> read(String id) {
        return readFile(root.resolve(fileName(id)));
    }

    @Override
    protected Result<List<String>> readAll() {
        List<Path> paths;
        try (var files = Files.list(root)) {
            paths = files.filter(it -> it.getFileName().toString().endsWith(SUFFIX)).toList();
        } catch (IOException e) {
            return Result.failure(e);
        }

        var documents = new ArrayList<String>();
        for (var path : paths) {
            var document = readFile(path);
            if (document.failed()) {
                return Result.failure(document.getCause());
            }
            document.getContent().ifPresent(documents::add);
        }
        return Result.success(documents);
    }

    private Result<Optional<String>> readFile(Path path) {
        try {
            return Result.success(Optional.of(Files.readString(path, StandardCharsets.UTF_8)));
        } catch (NoSuchFileException e) {
            return Result.success(Optional.empty());
        } catch (IOException e) {
            return Result.failure(e);
        }
    }

    private void deleteLeftover(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.warn("Temporary file {} could not be removed: {}", temp, e.getMessage());
        }
    }

    // ids are arbitrary strings, keep them filesystem safe
    private String fileName(String id) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(id.getBytes(StandardCharsets.UTF_8)) + SUFFIX;
    }
}
