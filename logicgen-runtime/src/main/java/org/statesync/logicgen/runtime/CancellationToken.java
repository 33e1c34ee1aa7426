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

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.concurrent.ThreadSafe;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal threaded through every suspension point of a generated handler. Waiting
 * races a timer against {@link #cancel()}: whichever happens first wins, and cancellation
 * surfaces as a {@link HandlerCancelledException}.
 */
@PublicEvolving
@ThreadSafe
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    private CancellationToken() {}

    /** Signals cancellation. Idempotent. */
    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /** Throws if the token has been cancelled. */
    public void throwIfCancelled() throws HandlerCancelledException {
        if (isCancelled()) {
            throw new HandlerCancelledException("handler cancelled");
        }
    }

    /**
     * Blocks for the given duration unless cancelled first.
     *
     * @param millis how long to wait, non-positive values only check for cancellation
     * @throws HandlerCancelledException if the token is cancelled before or during the wait, or
     *     the waiting thread is interrupted
     */
    public void await(long millis) throws HandlerCancelledException {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        boolean wasCancelled;
        try {
            wasCancelled = cancelled.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandlerCancelledException("handler interrupted while waiting", e);
        }
        if (wasCancelled) {
            throw new HandlerCancelledException("handler cancelled");
        }
    }
}
