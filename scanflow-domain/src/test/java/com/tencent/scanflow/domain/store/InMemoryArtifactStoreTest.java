package com.tencent.scanflow.domain.store;

import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryArtifactStoreTest {

    private static Message message(String id) {
        return Message.builder().id(id).schema(Schema.of("standard_input")).entry("data", List.of(id)).build();
    }

    @Test
    void putGetExistsDelete() {
        ArtifactStore store = new InMemoryArtifactStore();

        assertThat(store.exists("run-1", "a")).isFalse();
        assertThat(store.get("run-1", "a")).isEmpty();

        store.put("run-1", "a", message("a"));

        assertThat(store.exists("run-1", "a")).isTrue();
        assertThat(store.get("run-1", "a")).contains(message("a"));
        assertThat(store.exists("run-2", "a")).isFalse();

        store.delete("run-1", "a");
        assertThat(store.exists("run-1", "a")).isFalse();
    }

    @Test
    void listAndClearAreScopedToRun() {
        ArtifactStore store = new InMemoryArtifactStore();
        store.put("run-1", "b", message("b"));
        store.put("run-1", "a", message("a"));
        store.put("run-2", "c", message("c"));

        assertThat(store.listArtifacts("run-1")).containsExactly("a", "b");

        store.clear("run-1");
        assertThat(store.listArtifacts("run-1")).isEmpty();
        assertThat(store.listArtifacts("run-2")).containsExactly("c");
    }

    @Test
    void concurrentWritersWithDistinctKeys() throws Exception {
        ArtifactStore store = new InMemoryArtifactStore();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> writes = new ArrayList<>();
            IntStream.range(0, 200).forEach(i -> writes.add(CompletableFuture.runAsync(
                    () -> store.put("run-1", "artifact-" + i, message("artifact-" + i)), pool)));
            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get();
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.listArtifacts("run-1")).hasSize(200);
        assertThat(store.get("run-1", "artifact-42")).contains(message("artifact-42"));
    }

    @Test
    void asyncStoreHasSameSemantics() throws Exception {
        AsyncArtifactStore store = new InMemoryAsyncArtifactStore();

        store.put("run-1", "a", message("a")).get();

        assertThat(store.exists("run-1", "a").get()).isTrue();
        assertThat(store.get("run-1", "a").get()).contains(message("a"));
        assertThat(store.listArtifacts("run-1").get()).containsExactly("a");

        store.clear("run-1").get();
        assertThat(store.exists("run-1", "a").get()).isFalse();
    }

    @Test
    void blockingAdapterDelegatesToAsyncStore() throws Exception {
        AsyncArtifactStore async = new InMemoryAsyncArtifactStore();
        ArtifactStore store = new BlockingArtifactStore(async);

        store.put("run-1", "a", message("a"));

        assertThat(async.get("run-1", "a").get()).contains(message("a"));
        assertThat(store.exists("run-1", "a")).isTrue();
        store.delete("run-1", "a");
        assertThat(store.get("run-1", "a")).isEmpty();
    }
}
