/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jetbrains.helixgraph.traversal.dispatch;

import jetbrains.helixgraph.GraphException;
import jetbrains.helixgraph.store.GraphStorage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runs registered queries on a fixed pool of workers. New requests go to the primary queue, continuations
 * of handlers which waited for an external future go to the continuation queue. Both queues are guarded by
 * one lock and signalled through one condition, and every worker alternates which queue it serves first,
 * so neither queue starves the other.
 * <p>
 * On {@linkplain #close() close} no new requests are accepted, queued work and continuations of
 * requests in flight are still run, then the workers stop.
 */
public class QueryDispatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryDispatcher.class);

    @NotNull
    private final GraphStorage storage;
    @NotNull
    private final Map<String, QueryHandler> handlers = new ConcurrentHashMap<>();
    @NotNull
    private final ArrayDeque<Runnable> primary = new ArrayDeque<>();
    @NotNull
    private final ArrayDeque<Runnable> continuations = new ArrayDeque<>();
    @NotNull
    private final ReentrantLock lock = new ReentrantLock();
    @NotNull
    private final Condition notEmpty = lock.newCondition();
    @NotNull
    private final AtomicInteger awaiting = new AtomicInteger();
    @NotNull
    private final List<Thread> workers;
    private boolean stopping;

    public QueryDispatcher(@NotNull final GraphStorage storage) {
        this(storage, Runtime.getRuntime().availableProcessors());
    }

    public QueryDispatcher(@NotNull final GraphStorage storage, final int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count should be positive: " + workerCount);
        }
        this.storage = storage;
        workers = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; ++i) {
            final boolean continuationsFirst = (i & 1) == 1;
            final Thread worker = new Thread(() -> work(continuationsFirst), "helixgraph query worker #" + i);
            worker.setDaemon(true);
            workers.add(worker);
        }
        workers.forEach(Thread::start);
        if (logger.isInfoEnabled()) {
            logger.info("Query dispatcher started with " + workerCount + " workers over " + storage.getLocation());
        }
    }

    public void register(@NotNull final String name, @NotNull final QueryHandler handler) {
        handlers.put(name, handler);
    }

    public boolean unregister(@NotNull final String name) {
        return handlers.remove(name) != null;
    }

    /**
     * Queues the request. The returned future is completed once, with the query result or with the error:
     * {@link UnknownQueryException} if no query of the name is registered, the failure of the handler
     * otherwise.
     */
    @NotNull
    public CompletableFuture<Object> submit(@NotNull final QueryRequest request) {
        final CompletableFuture<Object> reply = new CompletableFuture<>();
        lock.lock();
        try {
            if (stopping) {
                reply.completeExceptionally(new IllegalStateException("Query dispatcher is closed"));
                return reply;
            }
            primary.addLast(() -> run(request, reply));
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        return reply;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (stopping) {
                return;
            }
            stopping = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        boolean interrupted = false;
        for (final Thread worker : workers) {
            while (worker.isAlive()) {
                try {
                    worker.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (logger.isInfoEnabled()) {
            logger.info("Query dispatcher stopped");
        }
    }

    private void work(boolean continuationsFirst) {
        while (true) {
            final Runnable task;
            lock.lock();
            try {
                while (primary.isEmpty() && continuations.isEmpty()) {
                    if (stopping && awaiting.get() == 0) {
                        notEmpty.signalAll();
                        return;
                    }
                    notEmpty.awaitUninterruptibly();
                }
                task = poll(continuationsFirst);
            } finally {
                lock.unlock();
            }
            continuationsFirst = !continuationsFirst;
            task.run();
        }
    }

    @NotNull
    private Runnable poll(final boolean continuationsFirst) {
        final Runnable first = continuationsFirst ? continuations.pollFirst() : primary.pollFirst();
        if (first != null) {
            return first;
        }
        //noinspection ConstantConditions
        return continuationsFirst ? primary.pollFirst() : continuations.pollFirst();
    }

    private void run(@NotNull final QueryRequest request, @NotNull final CompletableFuture<Object> reply) {
        final QueryHandler handler = handlers.get(request.name());
        if (handler == null) {
            fail(request, reply, new UnknownQueryException(request.name()));
            return;
        }
        final HandlerResult result;
        try {
            result = handler.handle(storage, request);
        } catch (RuntimeException e) {
            fail(request, reply, e);
            return;
        }
        proceed(request, reply, result);
    }

    private void proceed(@NotNull final QueryRequest request,
                         @NotNull final CompletableFuture<Object> reply,
                         @NotNull final HandlerResult result) {
        if (result.isDone()) {
            reply.complete(result.getValue());
            return;
        }
        final CompletableFuture<Object> awaited = result.getAwaited();
        final Function<Object, HandlerResult> continuation = result.getContinuation();
        awaiting.incrementAndGet();
        //noinspection ConstantConditions
        awaited.whenComplete((value, error) -> {
            lock.lock();
            try {
                continuations.addLast(() -> resume(request, reply, continuation, value, error));
                awaiting.decrementAndGet();
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        });
    }

    private void resume(@NotNull final QueryRequest request,
                        @NotNull final CompletableFuture<Object> reply,
                        @NotNull final Function<Object, HandlerResult> continuation,
                        @Nullable final Object value,
                        @Nullable final Throwable error) {
        if (error != null) {
            fail(request, reply, error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
            return;
        }
        final HandlerResult result;
        try {
            result = continuation.apply(value);
        } catch (RuntimeException e) {
            fail(request, reply, e);
            return;
        }
        proceed(request, reply, result);
    }

    private static void fail(@NotNull final QueryRequest request,
                             @NotNull final CompletableFuture<Object> reply,
                             @NotNull final Throwable error) {
        if (logger.isWarnEnabled()) {
            logger.warn("Query " + request.name() + " failed", error);
        }
        reply.completeExceptionally(error instanceof GraphException ? error : GraphException.wrap(error));
    }
}
