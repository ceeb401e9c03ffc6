/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.domain.tool;

import me.golemcore.agent.domain.exception.OperationCancelledException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation token threaded through every blocking step of a
 * turn: confirmation waits, tool execution, process waits and LLM calls.
 */
public final class CancellationSignal {

    private final CompletableFuture<String> cancelled = new CompletableFuture<>();

    public void cancel(String reason) {
        cancelled.complete(reason != null ? reason : "cancelled");
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    public String getReason() {
        return cancelled.getNow(null);
    }

    /**
     * Completes with the reason once cancelled. Completing the returned future
     * does not cancel the signal.
     */
    public CompletableFuture<String> whenCancelled() {
        return cancelled.thenApply(reason -> reason);
    }

    /**
     * Runs the callback once on cancellation, immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        cancelled.thenRun(callback);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException(getReason());
        }
    }

    /**
     * Waits for the future unless the signal fires first, in which case the
     * future is cancelled and {@link OperationCancelledException} is thrown.
     *
     * @param timeout
     *            maximum wait; zero or negative waits indefinitely
     */
    public <T> T await(CompletableFuture<T> future, long timeout, TimeUnit unit)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<Object> first = CompletableFuture.anyOf(future, cancelled);
        try {
            if (timeout > 0) {
                first.get(timeout, unit);
            } else {
                first.get();
            }
        } catch (ExecutionException e) {
            // The future itself failed; rethrown below with its own cause
            if (!future.isDone()) {
                throw e;
            }
        }
        if (future.isDone()) {
            return future.get();
        }
        future.cancel(true);
        throw new OperationCancelledException(getReason());
    }

    /**
     * Sleeps for the given time or until cancelled.
     *
     * @return true if the signal fired during the wait
     */
    public boolean sleep(long millis) throws InterruptedException {
        if (millis <= 0) {
            return isCancelled();
        }
        try {
            cancelled.get(millis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }
}
