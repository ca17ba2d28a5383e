/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TimberContextTest {

    @Test
    void testWorkerThreads() throws Exception {
        try (TimberContext context = TimberContext.create(3)) {
            assertThat(context.parallelism()).isEqualTo(3);

            Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, context.executor()).get();

            assertThat(worker.getName()).startsWith("timber-");
            assertThat(worker.isDaemon()).isTrue();
        }
    }

    @Test
    void testCloseShutsDownExecutor() {
        TimberContext context = TimberContext.create(1);
        context.close();

        assertThat(context.executor().isShutdown()).isTrue();
    }

    @Test
    void testThreadCountFromSystemProperty() {
        System.setProperty("timber.threads", "2");
        try (TimberContext context = TimberContext.create()) {
            assertThat(context.parallelism()).isEqualTo(2);
        }
        finally {
            System.clearProperty("timber.threads");
        }
    }

    @Test
    void testInvalidThreadCount() {
        assertThatThrownBy(() -> TimberContext.create(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
