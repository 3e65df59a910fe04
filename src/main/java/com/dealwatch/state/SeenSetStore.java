package com.dealwatch.state;

/**
 * Durable home of the {@link SeenSet}: one named blob, read whole and written by full overwrite.
 */
public interface SeenSetStore extends AutoCloseable {

    /**
     * Reads the persisted set. A missing blob is a successful load of an empty set; only an
     * unreachable store or an unreadable payload is a failure.
     */
    LoadResult load();

    /**
     * Overwrites the persisted set.
     *
     * @throws SeenSetStoreException when the write does not complete
     */
    void save(SeenSet seenSet);

    /** Human-readable location for logs, e.g. {@code s3://bucket/key}. */
    String describe();

    /** Releases client resources held by the store. */
    @Override
    default void close() {
    }

    final class LoadResult {
        public final SeenSet seenSet;
        public final boolean success;
        public final boolean existed;
        public final String error;

        private LoadResult(SeenSet seenSet, boolean success, boolean existed, String error) {
            this.seenSet = seenSet == null ? SeenSet.empty() : seenSet;
            this.success = success;
            this.existed = existed;
            this.error = error == null ? "" : error;
        }

        public static LoadResult loaded(SeenSet seenSet) {
            return new LoadResult(seenSet, true, true, "");
        }

        public static LoadResult absent() {
            return new LoadResult(SeenSet.empty(), true, false, "");
        }

        public static LoadResult failed(String error) {
            return new LoadResult(SeenSet.empty(), false, false, error);
        }
    }
}
