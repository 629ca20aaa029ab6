package com.landingzone.orchestrator.pipeline;

import com.landingzone.orchestrator.storage.ObjectLocation;
import com.landingzone.orchestrator.storage.ObjectPattern;

/**
 * Source wildcard and destination of the terminal archive step.
 *
 * @param failWhenEmpty report a failure instead of success when nothing matches
 */
public record ArchiveSpec(ObjectPattern source, ObjectLocation destination, boolean failWhenEmpty) {

    public ArchiveSpec {
        if (source == null || destination == null) {
            throw new IllegalArgumentException("Archive source and destination are required");
        }
    }
}
