package com.taskgraph.engine.persistence;

import com.taskgraph.core.exception.DuplicateResultException;
import com.taskgraph.core.exception.TaskFailureException;
import com.taskgraph.core.model.GraphResult;
import com.taskgraph.core.model.GraphResults;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.engine.test.SolverTestTask;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryResultStoreTest {

    private final InMemoryResultStore store = new InMemoryResultStore();
    private final Instant start = Instant.parse("2024-05-01T10:00:00Z");

    private GraphResult done(String name, long completedAfterSeconds) {
        return GraphResult.done(SolverTestTask.build(name), TaskStatus.ready(), true,
            start, start.plusSeconds(completedAfterSeconds), GraphResults.empty());
    }

    @Test
    void put_shouldBeWriteOnce() {
        store.put(done("a", 1));

        assertThatThrownBy(() -> store.put(done("a", 2)))
            .isInstanceOf(DuplicateResultException.class)
            .hasMessageContaining("build.a");
        assertThat(store.get("build.a").orElseThrow().completedAt()).isEqualTo(start.plusSeconds(1));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void getAll_shouldOrderByCompletion() {
        store.put(done("late", 5));
        store.put(done("early", 1));
        store.put(done("middle", 3));

        assertThat(store.getAll().keySet()).containsExactly("build.early", "build.middle", "build.late");
    }

    @Test
    void pick_shouldReturnOnlyRequestedKeysThatHaveResults() {
        store.put(done("a", 1));
        store.put(done("b", 2));
        store.put(GraphResult.failed(SolverTestTask.build("c"), new TaskFailureException("nope"),
            start, start.plusSeconds(3), GraphResults.empty()));

        GraphResults picked = store.pick(List.of("build.b", "build.c", "build.missing"));

        assertThat(picked.keys()).containsExactly("build.b", "build.c");
        assertThat(store.contains("build.a")).isTrue();
        assertThat(store.contains("build.missing")).isFalse();
    }
}
