package com.landingzone.orchestrator.storage;

import java.time.Duration;
import java.util.List;

/**
 * The three storage capabilities the pipeline needs: an existence check for
 * sensing, and list + move for archival.
 *
 * Implementations throw {@link StorageException} for every backend failure;
 * callers decide whether that failure is transient or fatal.
 */
public interface ObjectStore {

    /**
     * True if at least one object whose name starts with {@code prefix} exists.
     * The call gives up with a {@link StorageException} once {@code timeout}
     * has elapsed.
     */
    boolean exists(String bucket, String prefix, Duration timeout);

    /** Names of all objects under {@code prefix}, in backend order. */
    List<String> list(String bucket, String prefix);

    /**
     * Move one object. The source is removed only after the copy succeeded.
     *
     * @throws StorageException if the copy or the delete fails
     */
    void move(String sourceBucket, String sourceName, String targetBucket, String targetName);
}
