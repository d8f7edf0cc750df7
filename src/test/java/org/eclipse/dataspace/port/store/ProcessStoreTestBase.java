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

import org.eclipse.dataspace.domain.TransferType;
import org.eclipse.dataspace.domain.transfer.TransferProcess;
import org.eclipse.dataspace.domain.transfer.TransferRole;
import org.eclipse.dataspace.port.exception.ProcessNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.REQUESTED;
import static org.eclipse.dataspace.domain.transfer.TransferProcess.State.STARTED;

/**
 * Behaviour every {@link ProcessStore} shares, run against each implementation.
 */
abstract class ProcessStoreTestBase {

    private ProcessStore<TransferProcess> store;

    protected abstract ProcessStore<TransferProcess> createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
    }

    @Test
    void shouldFindSavedProcess() {
        store.save(process("T1"));

        var found = store.findById("T1");

        assertThat(found.succeeded()).isTrue();
        assertThat(found.getContent().getAgreementId()).isEqualTo("A1");
        assertThat(found.getContent().getState()).isEqualTo(REQUESTED);
    }

    @Test
    void shouldFail_whenProcessDoesNotExist() {
        var found = store.findById("missing");

        assertThatThrownBy(found::orElseThrow).isExactlyInstanceOf(ProcessNotFoundException.class);
    }

    @Test
    void shouldOverwrite_whenSavedAgain() {
        var process = process("T1");
        store.save(process);
        process.transitionToProvisioned(Instant.now());
        process.transitionToStarted(null, Instant.now());

        store.save(process);

        var found = store.findById("T1").getContent();
        assertThat(found.getState()).isEqualTo(STARTED);
        assertThat(found.getHistory()).hasSize(2);
    }

    @Test
    void shouldNotShareStateWithCallers() {
        var process = process("T1");
        store.save(process);
        process.transitionToProvisioned(Instant.now());

        var loaded = store.findById("T1").getContent();
        loaded.transitionToTerminated("local change", Instant.now());

        assertThat(store.findById("T1").getContent().getState()).isEqualTo(REQUESTED);
    }

    @Test
    void shouldListByState() {
        var started = process("T1");
        started.transitionToProvisioned(Instant.now());
        started.transitionToStarted(null, Instant.now());
        store.save(started);
        store.save(process("T2"));
        store.save(process("T3"));

        assertThat(store.listByState(REQUESTED)).extracting(TransferProcess::getId).containsExactlyInAnyOrder("T2", "T3");
        assertThat(store.listByState(STARTED)).extracting(TransferProcess::getId).containsExactly("T1");
    }

    @Test
    void shouldFindFirstMatchingProcess() {
        store.save(process("T1"));
        var other = TransferProcess.newInstance().id("T2").role(TransferRole.CONSUMER).agreementId("A2")
                .transferType(TransferType.PUSH).build();
        store.save(other);

        assertThat(store.findFirst(it -> "A2".equals(it.getAgreementId())).getContent().getId()).isEqualTo("T2");
        assertThat(store.findFirst(it -> "A3".equals(it.getAgreementId())).failed()).isTrue();
    }

    private TransferProcess process(String id) {
        return TransferProcess.newInstance()
                .id(id)
                .role(TransferRole.PROVIDER)
                .counterpartyId("consumer")
                .agreementId("A1")
                .transferType(TransferType.PULL)
                .build();
    }
}
