////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmux;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspmux.util.MdcServerContext;

/**
 * Thread pools owned by one {@link LspRuntime}:
 *
 * <ul>
 *   <li><b>Scheduling pool</b>: request timeouts, diagnostics debounce and
 *       other short timers. Tasks only complete futures.</li>
 *   <li><b>Spawn pool</b>: process launch, npm auto-install and other
 *       blocking bootstrap work.</li>
 * </ul>
 *
 * <p>Both pools use daemon threads and propagate the caller's MDC.
 * {@link #shutdownAll()} is called by {@link LspRuntime#close()}.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ScheduledExecutorService schedulingPool;

    private final ExecutorService spawnPool;

    public ExecutorPools() {
        ScheduledExecutorService rawSchedulingPool = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "lspmux-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.schedulingPool = new MdcScheduledExecutorService(rawSchedulingPool);

        ExecutorService rawSpawnPool = Executors.newFixedThreadPool(
                Math.max(2, Math.min(4, Runtime.getRuntime().availableProcessors())), r -> {
                    Thread t = new Thread(r, "lspmux-spawn");
                    t.setDaemon(true);
                    return t;
                });
        this.spawnPool = new MdcExecutorService(rawSpawnPool);
    }

    /** Scheduled executor for timeouts and debounce timers. */
    public ScheduledExecutorService getSchedulingPool() {
        return schedulingPool;
    }

    /** Pool for process launch and auto-install. */
    public ExecutorService getSpawnPool() {
        return spawnPool;
    }

    /**
     * Shut down both pools, waiting up to 5 seconds each.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        schedulingPool.shutdownNow();
        spawnPool.shutdownNow();
        try {
            schedulingPool.awaitTermination(5, TimeUnit.SECONDS);
            spawnPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -----------------------------------------------------------------------
    // MDC-propagating executor wrappers
    // -----------------------------------------------------------------------

    /**
     * Wraps an {@link ExecutorService} so that every submitted task
     * automatically inherits the caller thread's SLF4J MDC context.
     */
    private static class MdcExecutorService implements ExecutorService {
        protected final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcServerContext.wrap(command));
        }

        @Override public Future<?> submit(Runnable task) {
            return delegate.submit(MdcServerContext.wrap(task));
        }

        @Override public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(MdcServerContext.wrap(task), result);
        }

        @Override public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrapCallable(task));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks)
                throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks), timeout, unit);
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapCallables(tasks));
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapCallables(tasks), timeout, unit);
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }

        private static <T> Callable<T> wrapCallable(Callable<T> task) {
            java.util.Map<String, String> ctx = MdcServerContext.snapshot();
            return () -> {
                java.util.Map<String, String> prev = MdcServerContext.snapshot();
                MdcServerContext.restore(ctx);
                try {
                    return task.call();
                } finally {
                    MdcServerContext.restore(prev);
                }
            };
        }

        private static <T> Collection<Callable<T>> wrapCallables(Collection<? extends Callable<T>> tasks) {
            List<Callable<T>> wrapped = new java.util.ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                wrapped.add(wrapCallable(task));
            }
            return wrapped;
        }
    }

    /**
     * Wraps a {@link ScheduledExecutorService} so that every scheduled task
     * automatically inherits the caller thread's SLF4J MDC context.
     */
    private static class MdcScheduledExecutorService extends MdcExecutorService
            implements ScheduledExecutorService {
        private final ScheduledExecutorService scheduledDelegate;

        MdcScheduledExecutorService(ScheduledExecutorService delegate) {
            super(delegate);
            this.scheduledDelegate = delegate;
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcServerContext.wrap(command), delay, unit);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            java.util.Map<String, String> ctx = MdcServerContext.snapshot();
            Callable<V> wrapped = () -> {
                java.util.Map<String, String> prev = MdcServerContext.snapshot();
                MdcServerContext.restore(ctx);
                try {
                    return callable.call();
                } finally {
                    MdcServerContext.restore(prev);
                }
            };
            return scheduledDelegate.schedule(wrapped, delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay,
                long period, TimeUnit unit) {
            return scheduledDelegate.scheduleAtFixedRate(
                    MdcServerContext.wrap(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay,
                long delay, TimeUnit unit) {
            return scheduledDelegate.scheduleWithFixedDelay(
                    MdcServerContext.wrap(command), initialDelay, delay, unit);
        }
    }
}
