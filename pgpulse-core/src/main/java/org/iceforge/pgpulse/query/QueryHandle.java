package org.iceforge.pgpulse.query;

import java.util.concurrent.CompletableFuture;

/** A statement submitted with {@link QueryExecutor#submit(QueryRequest)}. */
public interface QueryHandle {
    /** Best-effort: cancels the in-flight statement, or prevents it from starting. */
    void cancel();

    CompletableFuture<QueryResult> completion();
}
