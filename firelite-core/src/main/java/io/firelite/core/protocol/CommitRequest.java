package io.firelite.core.protocol;

import java.util.List;

import io.firelite.core.write.Write;

public record CommitRequest(List<Write> writes, String transaction) {

    public static CommitRequest of(List<Write> writes) {
        return new CommitRequest(writes, null);
    }
}
