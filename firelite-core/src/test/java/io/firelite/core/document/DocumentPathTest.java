package io.firelite.core.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.firelite.core.error.ErrorStatus;
import io.firelite.core.error.FireliteException;

class DocumentPathTest {

    @Test
    void parsesNestedDocumentNames() {
        DocumentPath path = DocumentPath.resolve("projects/demo-1/databases/(default)/documents/users/alice/posts/p1");
        assertThat(path.projectId()).isEqualTo("demo-1");
        assertThat(path.collectionPath()).isEqualTo("users/alice/posts");
        assertThat(path.documentId()).isEqualTo("p1");
        assertThat(path.name()).isEqualTo("projects/demo-1/databases/(default)/documents/users/alice/posts/p1");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "projects/demo/databases/(default)/documents/users",
            "projects/demo/databases/(default)/documents/users//alice",
            "projects/de_mo/databases/(default)/documents/users/alice",
            "users/alice",
            "projects/demo/databases/(default)/documents/users/alice/"
    })
    void rejectsMalformedNames(String name) {
        assertThatThrownBy(() -> DocumentPath.parse(name))
                .isInstanceOf(FireliteException.class)
                .extracting(e -> ((FireliteException) e).getStatus())
                .isEqualTo(ErrorStatus.INVALID_ARGUMENT);
    }

    @Test
    void otherDatabasesAreNotFound() {
        assertThatThrownBy(() -> DocumentPath.resolve("projects/demo/databases/other/documents/users/alice"))
                .isInstanceOf(FireliteException.class)
                .extracting(e -> ((FireliteException) e).getStatus())
                .isEqualTo(ErrorStatus.NOT_FOUND);
    }
}
