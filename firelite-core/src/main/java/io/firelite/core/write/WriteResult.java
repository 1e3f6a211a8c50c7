package io.firelite.core.write;

import java.time.Instant;
import java.util.List;

import io.firelite.core.value.Value;

/**
 * Outcome of one write. {@code transformResults} is null when the write
 * carried no transforms; otherwise entry i belongs to transform i.
 */
public record WriteResult(Instant updateTime, List<Value> transformResults) {

    public WriteResult {
        transformResults = transformResults == null ? null : List.copyOf(transformResults);
    }
}
