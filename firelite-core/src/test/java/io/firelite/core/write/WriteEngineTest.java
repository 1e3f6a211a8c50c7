package io.firelite.core.write;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.firelite.core.document.Document;
import io.firelite.core.error.ErrorStatus;
import io.firelite.core.error.FireliteException;
import io.firelite.core.storage.InMemoryDocumentStore;
import io.firelite.core.value.Value;

class WriteEngineTest {
    private static final String ROOT = "projects/demo/databases/(default)/documents/";
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-01T00:00:01Z");

    private InMemoryDocumentStore store;
    private WriteEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        engine = new WriteEngine(store);
    }

    private static Document doc(String path, Map<String, Value> fields) {
        return new Document(ROOT + path, fields, null, null);
    }

    private List<WriteResult> commit(List<Write> writes, Instant time) {
        return engine.apply(engine.prepare(writes, time));
    }

    @Test
    void updateSetsTimestamps() {
        commit(List.of(Write.update(doc("users/a", Map.of("n", Value.of(1L))))), T0);
        commit(List.of(Write.update(doc("users/a", Map.of("n", Value.of(2L))))), T1);
        Document stored = store.get(ROOT + "users/a");
        assertThat(stored.createTime()).isEqualTo(T0);
        assertThat(stored.updateTime()).isEqualTo(T1);
        assertThat(stored.fields()).isEqualTo(Map.of("n", Value.of(2L)));
    }

    @Test
    void failedPreconditionLeavesStoreUntouched() {
        List<Write> writes = List.of(
                Write.update(doc("users/a", Map.of("n", Value.of(1L)))),
                Write.update(doc("users/b", Map.of("n", Value.of(1L)))).withPrecondition(Precondition.exists(true)),
                Write.update(doc("users/c", Map.of("n", Value.of(1L)))));
        assertThatThrownBy(() -> commit(writes, T0))
                .isInstanceOf(FireliteException.class)
                .extracting(e -> ((FireliteException) e).getStatus())
                .isEqualTo(ErrorStatus.FAILED_PRECONDITION);
        assertThat(store.size()).isZero();
    }

    @Test
    void existsFalseOnPresentDocumentIsAlreadyExists() {
        commit(List.of(Write.update(doc("users/a", Map.of()))), T0);
        assertThatThrownBy(() -> commit(List.of(
                Write.update(doc("users/a", Map.of())).withPrecondition(Precondition.exists(false))), T1))
                .extracting(e -> ((FireliteException) e).getStatus())
                .isEqualTo(ErrorStatus.ALREADY_EXISTS);
    }

    @Test
    void updateTimePreconditionMustMatch() {
        commit(List.of(Write.update(doc("users/a", Map.of()))), T0);
        assertThatThrownBy(() -> commit(List.of(
                Write.delete(ROOT + "users/a").withPrecondition(Precondition.updateTime(T1))), T1))
                .hasMessageContaining("updateTime");
        commit(List.of(Write.delete(ROOT + "users/a").withPrecondition(Precondition.updateTime(T0))), T1);
        assertThat(store.exists(ROOT + "users/a")).isFalse();
    }

    @Test
    void updateMaskMergesIntoExistingDocument() {
        commit(List.of(Write.update(doc("users/a", Map.of("a", Value.of(1L), "b", Value.of(2L))))), T0);
        commit(List.of(Write.update(doc("users/a", Map.of("a", Value.of(99L), "b", Value.of(99L), "c", Value.of(99L))))
                .withUpdateMask(List.of("a"))), T1);
        assertThat(store.get(ROOT + "users/a").fields()).isEqualTo(Map.of("a", Value.of(99L), "b", Value.of(2L)));
    }

    @Test
    void updateTransformsProduceResultsOnlyWhenPresent() {
        List<WriteResult> results = commit(List.of(
                Write.update(doc("users/a", Map.of("n", Value.of(1L)))),
                Write.update(doc("users/b", Map.of("n", Value.of(1L))))
                        .withTransforms(List.of(FieldTransform.increment("n", Value.of(2L))))), T0);
        assertThat(results.get(0).transformResults()).isNull();
        assertThat(results.get(1).transformResults()).containsExactly(Value.of(3L));
        assertThat(store.get(ROOT + "users/b").fields()).isEqualTo(Map.of("n", Value.of(3L)));
    }

    @Test
    void transformWriteStartsFromCurrentDocument() {
        commit(List.of(Write.update(doc("counters/c", Map.of("n", Value.of(5L), "keep", Value.of(true))))), T0);
        List<WriteResult> results = commit(List.of(Write.transform(ROOT + "counters/c",
                List.of(FieldTransform.increment("n", Value.of(1L)), FieldTransform.requestTime("at")))), T1);
        assertThat(results.get(0).transformResults()).containsExactly(Value.of(6L), Value.of(T1));
        assertThat(store.get(ROOT + "counters/c").fields())
                .containsEntry("keep", Value.of(true))
                .containsEntry("n", Value.of(6L));
    }

    @Test
    void writesInOneBatchAreCheckedAgainstCommittedState() {
        commit(List.of(
                Write.update(doc("users/a", Map.of("n", Value.of(1L)))),
                Write.update(doc("users/a", Map.of("n", Value.of(2L)))).withPrecondition(Precondition.exists(false))),
                T0);
        assertThat(store.get(ROOT + "users/a").fields()).isEqualTo(Map.of("n", Value.of(2L)));
    }

    @Test
    void transformAfterUpdateInSameBatchStartsFromCommittedDocument() {
        commit(List.of(Write.update(doc("users/a", Map.of("n", Value.of(5L))))), T0);
        List<WriteResult> results = commit(List.of(
                Write.update(doc("users/a", Map.of("n", Value.of(100L)))),
                Write.transform(ROOT + "users/a", List.of(FieldTransform.increment("n", Value.of(1L))))), T1);
        assertThat(results.get(1).transformResults()).containsExactly(Value.of(6L));
        assertThat(store.get(ROOT + "users/a").fields()).isEqualTo(Map.of("n", Value.of(6L)));
        assertThat(store.get(ROOT + "users/a").createTime()).isEqualTo(T0);
    }

    @Test
    void invalidPathsAndDatabasesAreRejectedBeforeAnyWrite() {
        assertThatThrownBy(() -> commit(List.of(
                Write.update(doc("users/a", Map.of())),
                Write.delete("projects/demo/databases/other/documents/users/a")), T0))
                .extracting(e -> ((FireliteException) e).getStatus())
                .isEqualTo(ErrorStatus.NOT_FOUND);
        assertThatThrownBy(() -> commit(List.of(Write.delete(ROOT + "users")), T0))
                .extracting(e -> ((FireliteException) e).getStatus())
                .isEqualTo(ErrorStatus.INVALID_ARGUMENT);
        assertThat(store.size()).isZero();
    }
}
