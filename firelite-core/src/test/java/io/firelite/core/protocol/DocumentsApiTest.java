package io.firelite.core.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.firelite.core.Engine;

class DocumentsApiTest {
    private static final String U1 = "projects/demo/databases/(default)/documents/users/u1";
    private static final String U2 = "projects/demo/databases/(default)/documents/users/u2";

    private DocumentsApi api;

    @BeforeEach
    void setUp() {
        api = new DocumentsApi(new DocumentHandlers(new Engine()));
    }

    private static String update(String name, String fields) {
        return "{\"update\":{\"name\":\"" + name + "\",\"fields\":" + fields + "}}";
    }

    @Test
    void endToEndConflictReturns409Aborted() {
        ProtocolResponse begin = api.handle("beginTransaction", "{}");
        assertThat(begin.status()).isEqualTo(200);
        String tx = begin.body().get("transaction").asText();

        ProtocolResponse read = api.handle("batchGet",
                "{\"documents\":[\"" + U1 + "\"],\"transaction\":\"" + tx + "\"}");
        assertThat(read.status()).isEqualTo(200);
        assertThat(read.body().get(0).get("missing").asText()).isEqualTo(U1);
        assertThat(read.body().get(0).has("readTime")).isTrue();

        ProtocolResponse outside = api.handle("commit",
                "{\"writes\":[" + update(U1, "{\"name\":{\"stringValue\":\"outside\"}}") + "]}");
        assertThat(outside.status()).isEqualTo(200);

        ProtocolResponse commit = api.handle("commit", "{\"writes\":["
                + update(U1, "{\"name\":{\"stringValue\":\"inside\"}}") + "],\"transaction\":\"" + tx + "\"}");
        assertThat(commit.status()).isEqualTo(409);
        JsonNode error = commit.body().get("error");
        assertThat(error.get("code").asInt()).isEqualTo(409);
        assertThat(error.get("status").asText()).isEqualTo("ABORTED");
        assertThat(error.get("message").asText()).isEqualTo("Transaction aborted due to conflicting modifications");
    }

    @Test
    void commitReturnsWriteResultsAndTransformResults() {
        api.handle("commit", "{\"writes\":[" + update(U1, "{\"n\":{\"integerValue\":\"15\"}}") + "]}");
        String body = "{\"writes\":["
                + "{\"update\":{\"name\":\"" + U2 + "\",\"fields\":{\"n\":{\"integerValue\":\"10\"}}},"
                + "\"updateTransforms\":[{\"fieldPath\":\"n\",\"increment\":{\"integerValue\":\"5\"}}]},"
                + "{\"transform\":{\"document\":\"" + U1 + "\",\"fieldTransforms\":["
                + "{\"fieldPath\":\"n\",\"increment\":{\"doubleValue\":0.5}},"
                + "{\"fieldPath\":\"at\",\"setToServerValue\":\"REQUEST_TIME\"}]}}]}";
        ProtocolResponse response = api.handle("commit", body);
        assertThat(response.status()).isEqualTo(200);
        JsonNode results = response.body().get("writeResults");
        assertThat(results.get(0).get("transformResults").get(0).get("integerValue").asText()).isEqualTo("15");
        assertThat(results.get(1).get("transformResults").get(0).get("doubleValue").asDouble()).isEqualTo(15.5);
        assertThat(results.get(1).get("transformResults").get(1).get("timestampValue").asText())
                .isEqualTo(response.body().get("commitTime").asText());
    }

    @Test
    void deleteWithoutTransformsHasNoTransformResults() {
        ProtocolResponse response = api.handle("commit", "{\"writes\":[{\"delete\":\"" + U1 + "\"}]}");
        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body().get("writeResults").get(0).has("transformResults")).isFalse();
    }

    @Test
    void fieldMaskScenario() {
        api.handle("commit", "{\"writes\":[" + update(U1,
                "{\"a\":{\"integerValue\":\"1\"},\"b\":{\"integerValue\":\"2\"}}") + "]}");
        ProtocolResponse masked = api.handle("commit", "{\"writes\":[{\"update\":{\"name\":\"" + U1 + "\",\"fields\":"
                + "{\"a\":{\"integerValue\":\"99\"},\"b\":{\"integerValue\":\"99\"},\"c\":{\"integerValue\":\"99\"}}},"
                + "\"updateMask\":{\"fieldPaths\":[\"a\"]}}]}");
        assertThat(masked.status()).isEqualTo(200);

        JsonNode found = api.handle("batchGet", "{\"documents\":[\"" + U1 + "\"]}").body().get(0).get("found");
        assertThat(found.get("fields").get("a").get("integerValue").asText()).isEqualTo("99");
        assertThat(found.get("fields").get("b").get("integerValue").asText()).isEqualTo("2");
        assertThat(found.get("fields").has("c")).isFalse();
        assertThat(found.has("createTime")).isTrue();
        assertThat(found.has("updateTime")).isTrue();
    }

    @Test
    void preconditionFailuresMapToStatuses() {
        ProtocolResponse missing = api.handle("commit", "{\"writes\":[{\"delete\":\"" + U1 + "\","
                + "\"currentDocument\":{\"exists\":true}}]}");
        assertThat(missing.status()).isEqualTo(400);
        assertThat(missing.body().get("error").get("status").asText()).isEqualTo("FAILED_PRECONDITION");

        api.handle("commit", "{\"writes\":[" + update(U1, "{}") + "]}");
        ProtocolResponse exists = api.handle("commit", "{\"writes\":[{\"update\":{\"name\":\"" + U1
                + "\",\"fields\":{}},\"currentDocument\":{\"exists\":false}}]}");
        assertThat(exists.status()).isEqualTo(409);
        assertThat(exists.body().get("error").get("status").asText()).isEqualTo("ALREADY_EXISTS");
    }

    @Test
    void malformedRequestsAreInvalidArgument() {
        assertThat(api.handle("commit", "{not json").status()).isEqualTo(400);
        assertThat(api.handle("commit", "{}").body().get("error").get("message").asText())
                .isEqualTo("writes is required");
        assertThat(api.handle("commit", "{\"writes\":[{}]}").status()).isEqualTo(400);
        assertThat(api.handle("commit", "{\"writes\":[" + update(U1, "{\"x\":{}}") + "]}").status())
                .isEqualTo(400);
        assertThat(api.handle("rollback", "{}").status()).isEqualTo(400);
    }

    @Test
    void unknownDatabaseAndActionAreNotFound() {
        ProtocolResponse response = api.handle("batchGet",
                "{\"documents\":[\"projects/demo/databases/other/documents/users/u1\"]}");
        assertThat(response.status()).isEqualTo(404);
        assertThat(response.body().get("error").get("status").asText()).isEqualTo("NOT_FOUND");
        assertThat(api.handle("listen", "{}").status()).isEqualTo(404);
    }

    @Test
    void readOnlyOptionsAndRollback() {
        String tx = api.handle("beginTransaction", "{\"options\":{\"readOnly\":{}}}").body().get("transaction").asText();
        ProtocolResponse commit = api.handle("commit",
                "{\"writes\":[" + update(U1, "{}") + "],\"transaction\":\"" + tx + "\"}");
        assertThat(commit.status()).isEqualTo(400);

        String other = api.handle("beginTransaction", "{}").body().get("transaction").asText();
        ProtocolResponse rollback = api.handle("rollback", "{\"transaction\":\"" + other + "\"}");
        assertThat(rollback.status()).isEqualTo(200);
        assertThat(rollback.body().size()).isZero();
    }

    @Test
    void undecodableTransactionalCommitRollsBackTransaction() {
        String tx = api.handle("beginTransaction", "{}").body().get("transaction").asText();
        ProtocolResponse commit = api.handle("commit", "{\"writes\":[" + update(U1, "{\"x\":{}}")
                + "],\"transaction\":\"" + tx + "\"}");
        assertThat(commit.status()).isEqualTo(400);

        ProtocolResponse rollback = api.handle("rollback", "{\"transaction\":\"" + tx + "\"}");
        assertThat(rollback.status()).isEqualTo(400);
        assertThat(rollback.body().get("error").get("message").asText()).isEqualTo("Invalid transaction ID");
    }
}
