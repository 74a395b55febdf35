/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.reader;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FitsContextTest {

    @Test
    void testRunsTasksOnNamedDaemonThreads() {
        try (FitsContext context = FitsContext.create(2, 100)) {
            Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, context.executor()).join();

            assertThat(worker.getName()).startsWith("fitswood-");
            assertThat(worker.isDaemon()).isTrue();
            assertThat(context.threads()).isEqualTo(2);
            assertThat(context.rowsPerTask()).isEqualTo(100);
        }
    }

    @Test
    void testRejectsNonPositiveSettings() {
        assertThatThrownBy(() -> FitsContext.create(0, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FitsContext.create(1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
