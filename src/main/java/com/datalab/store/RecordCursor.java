package com.datalab.store;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Forward-only cursor over records in ascending id order. Holds at most one record at a time.
 */
public interface RecordCursor<T> extends Closeable {

    /**
     * @return the next record, or empty once the cursor is exhausted
     */
    Optional<T> next() throws IOException;
}
