/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.statesync.logicgen.runtime;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link CancellationToken}. */
public class CancellationTokenTest {

    @Test
    public void testAwaitCompletesWhenNotCancelled() throws Exception {
        CancellationToken token = CancellationToken.create();
        long start = System.nanoTime();
        token.await(20);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                .isGreaterThanOrEqualTo(15);
        assertThat(token.isCancelled()).isFalse();
    }

    @Test
    public void testAwaitAfterCancelThrowsImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        token.cancel();
        assertThat(token.isCancelled()).isTrue();
        assertThatThrownBy(() -> token.await(60_000))
                .isInstanceOf(HandlerCancelledException.class);
        assertThatThrownBy(token::throwIfCancelled).isInstanceOf(HandlerCancelledException.class);
    }

    @Test
    public void testCancelWakesWaitingThread() throws Exception {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<Throwable> waiter =
                CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                token.await(60_000);
                                return null;
                            } catch (HandlerCancelledException e) {
                                return e;
                            }
                        });
        Thread.sleep(50);
        token.cancel();
        assertThat(waiter.get(10, TimeUnit.SECONDS))
                .isInstanceOf(HandlerCancelledException.class);
    }

    @Test
    public void testNonPositiveWaitOnlyChecks() throws Exception {
        CancellationToken token = CancellationToken.create();
        token.await(0);
        token.await(-5);
        assertThat(token.isCancelled()).isFalse();
    }
}
