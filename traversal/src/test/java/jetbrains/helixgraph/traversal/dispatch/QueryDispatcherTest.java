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

import jetbrains.helixgraph.NodeNotFoundException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.traversal.G;
import jetbrains.helixgraph.traversal.TraversalArena;
import jetbrains.helixgraph.traversal.TraversalTestBase;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

public class QueryDispatcherTest extends TraversalTestBase {

    private QueryDispatcher dispatcher;

    @Before
    public void startDispatcher() {
        dispatcher = new QueryDispatcher(storage, 4);
        dispatcher.register("addPerson", (storage, request) -> HandlerResult.done(storage.computeInWriteTransaction(txn -> {
            try (TraversalArena arena = new TraversalArena()) {
                return G.write(storage, txn, arena).addN("person", request.params()).first().getId();
            }
        })));
        dispatcher.register("getPerson", (storage, request) -> HandlerResult.done(storage.computeInReadonlyTransaction(txn -> {
            try (TraversalArena arena = new TraversalArena()) {
                return G.read(storage, txn, arena).nFromId(request.getParam("id").asId()).collect().get(0);
            }
        })));
    }

    @After
    public void stopDispatcher() {
        dispatcher.close();
    }

    @Test
    public void success() throws Exception {
        final UUID id = (UUID) dispatcher.submit(new QueryRequest("addPerson", Map.of("name", Value.of("John"))))
            .get(10, TimeUnit.SECONDS);
        final Node node = (Node) dispatcher.submit(new QueryRequest("getPerson", Map.of("id", Value.of(id))))
            .get(10, TimeUnit.SECONDS);
        Assert.assertEquals(Value.of("John"), node.getProperty("name"));
    }

    @Test
    public void manyRequests() throws Exception {
        final List<CompletableFuture<Object>> replies = new ArrayList<>();
        for (int i = 0; i < 100; ++i) {
            replies.add(dispatcher.submit(new QueryRequest("addPerson", Map.of("n", Value.of(i)))));
        }
        for (final CompletableFuture<Object> reply : replies) {
            Assert.assertTrue(reply.get(10, TimeUnit.SECONDS) instanceof UUID);
        }
        Assert.assertEquals(100L, (long) read(g -> g.nFromType("person").count()));
    }

    @Test
    public void unknownQuery() throws Exception {
        try {
            dispatcher.submit(new QueryRequest("nope")).get(10, TimeUnit.SECONDS);
            Assert.fail();
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof UnknownQueryException);
        }
    }

    @Test
    public void failure() throws Exception {
        try {
            dispatcher.submit(new QueryRequest("getPerson", Map.of("id", Value.of(UUID.randomUUID())))).get(10, TimeUnit.SECONDS);
            Assert.fail();
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof NodeNotFoundException);
        }
    }

    @Test
    public void continuation() throws Exception {
        final CompletableFuture<double[]> embedding = new CompletableFuture<>();
        dispatcher.register("insertEmbedded", (storage, request) -> HandlerResult.await(embedding, data ->
            HandlerResult.done(storage.computeInWriteTransaction(txn -> {
                try (TraversalArena arena = new TraversalArena()) {
                    return G.write(storage, txn, arena).insertV("doc", data, request.params()).first().getId();
                }
            }))));
        final CompletableFuture<Object> reply = dispatcher.submit(new QueryRequest("insertEmbedded", Map.of("title", Value.of("t"))));
        // other requests are served while the continuation waits
        Assert.assertTrue(dispatcher.submit(new QueryRequest("addPerson", Map.of())).get(10, TimeUnit.SECONDS) instanceof UUID);
        Assert.assertFalse(reply.isDone());
        embedding.complete(new double[]{1, 2, 3});
        final UUID id = (UUID) reply.get(10, TimeUnit.SECONDS);
        Assert.assertEquals(1L, (long) read(g -> g.vFromId(id, false).count()));
    }

    @Test
    public void failedContinuation() throws Exception {
        final CompletableFuture<double[]> embedding = new CompletableFuture<>();
        dispatcher.register("insertEmbedded", (storage, request) -> HandlerResult.await(embedding, data -> HandlerResult.done(data)));
        final CompletableFuture<Object> reply = dispatcher.submit(new QueryRequest("insertEmbedded"));
        embedding.completeExceptionally(new IllegalStateException("embedding service is down"));
        try {
            reply.get(10, TimeUnit.SECONDS);
            Assert.fail();
        } catch (ExecutionException e) {
            Assert.assertEquals("embedding service is down", e.getCause().getCause().getMessage());
        }
    }

    @Test
    public void closedDispatcherRejects() throws Exception {
        dispatcher.close();
        try {
            dispatcher.submit(new QueryRequest("addPerson", Map.of())).get(10, TimeUnit.SECONDS);
            Assert.fail();
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }
}
