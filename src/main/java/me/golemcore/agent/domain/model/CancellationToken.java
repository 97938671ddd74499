package me.golemcore.agent.domain.model;

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

import me.golemcore.agent.domain.exception.SessionCancelledException;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Session-level cancellation signal. Futures registered while a run is in
 * flight (the pending reasoning call, tool invocations) are cancelled with
 * interruption when the token fires; backoff sleeps wake up immediately.
 */
public class CancellationToken {

    private final CountDownLatch signal = new CountDownLatch(1);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void cancel() {
        if (isCancelled()) {
            return;
        }
        signal.countDown();
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    public <F extends Future<?>> F register(F future) {
        inFlight.add(future);
        if (isCancelled()) {
            future.cancel(true);
        }
        return future;
    }

    public void unregister(Future<?> future) {
        inFlight.remove(future);
    }

    /**
     * Sleeps for the given duration unless cancelled first.
     *
     * @return true if the token fired during the wait
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return signal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void throwIfCancelled(String sessionId) {
        if (isCancelled()) {
            throw new SessionCancelledException(sessionId);
        }
    }
}
