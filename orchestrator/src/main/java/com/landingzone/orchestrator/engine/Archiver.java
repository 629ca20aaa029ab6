package com.landingzone.orchestrator.engine;

import com.landingzone.orchestrator.storage.ObjectLocation;
import com.landingzone.orchestrator.storage.ObjectPattern;
import com.landingzone.orchestrator.storage.ObjectStore;
import com.landingzone.orchestrator.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves every object matching a wildcard into the archive location.
 *
 * Safe to re-run: objects already moved no longer match, so a second call
 * after success moves nothing and still reports OK. A failed object does not
 * stop the others; the next invocation picks up whatever is left.
 *
 * Objects whose archive name would collide with another match, or with the
 * object itself, are left in place and reported as failures.
 */
@Component
public class Archiver {

    private static final Logger log = LoggerFactory.getLogger(Archiver.class);

    private final ObjectStore store;

    public Archiver(ObjectStore store) {
        this.store = store;
    }

    public ExecutionResult archive(ObjectPattern source, ObjectLocation destination) {
        return archive(source, destination, false);
    }

    public ExecutionResult archive(ObjectPattern source, ObjectLocation destination, boolean failWhenEmpty) {
        List<String> matches;
        try {
            matches = store.list(source.bucket(), source.literalPrefix()).stream()
                    .filter(source::matches)
                    .toList();
        } catch (StorageException e) {
            return ExecutionResult.failed(ErrorKind.ARCHIVE_FAILED,
                    "Could not list " + source + ": " + e.getMessage());
        }

        if (matches.isEmpty()) {
            if (failWhenEmpty) {
                return ExecutionResult.failed(ErrorKind.ARCHIVE_FAILED, "No objects match " + source);
            }
            log.info("Nothing to archive: no objects match {}", source);
            return ExecutionResult.archived(0, "No objects match " + source);
        }

        // Targets are fixed before anything moves, so a conflict never costs data.
        Map<String, Integer> claims = new HashMap<>();
        for (String name : matches) {
            claims.merge(destination.resolve(fileName(name)), 1, Integer::sum);
        }

        int moved = 0;
        List<String> failures = new ArrayList<>();
        for (String name : matches) {
            String target = destination.resolve(fileName(name));
            if (source.bucket().equals(destination.bucket()) && name.equals(target)) {
                log.warn("Not archiving gs://{}/{}: it is already at its archive location", source.bucket(), name);
                failures.add(name + " (source and archive location are the same object)");
                continue;
            }
            if (claims.get(target) > 1) {
                log.warn("Not archiving gs://{}/{}: another match also maps to gs://{}/{}",
                        source.bucket(), name, destination.bucket(), target);
                failures.add(name + " (archive name " + target + " is shared with another match)");
                continue;
            }
            try {
                store.move(source.bucket(), name, destination.bucket(), target);
                moved++;
                log.info("Archived gs://{}/{} -> gs://{}/{}", source.bucket(), name, destination.bucket(), target);
            } catch (StorageException e) {
                log.warn("Could not archive gs://{}/{}: {}", source.bucket(), name, e.getMessage());
                failures.add(name + " (" + e.getMessage() + ")");
            }
        }

        if (!failures.isEmpty()) {
            return new ExecutionResult(ResultStatus.FAILED, ErrorKind.ARCHIVE_FAILED,
                    "Moved " + moved + " of " + matches.size() + " objects to " + destination
                            + "; failed: " + String.join(", ", failures),
                    moved);
        }
        return ExecutionResult.archived(moved, "Moved " + moved + " objects to " + destination);
    }

    // gsutil mv into a bucket URL keeps only the last path segment.
    private static String fileName(String objectName) {
        int slash = objectName.lastIndexOf('/');
        return slash < 0 ? objectName : objectName.substring(slash + 1);
    }
}
