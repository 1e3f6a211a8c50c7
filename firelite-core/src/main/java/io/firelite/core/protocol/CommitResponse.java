package io.firelite.core.protocol;

import java.time.Instant;
import java.util.List;

import io.firelite.core.write.WriteResult;

public record CommitResponse(List<WriteResult> writeResults, Instant commitTime) {
}
