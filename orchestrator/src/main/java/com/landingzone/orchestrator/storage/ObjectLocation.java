package com.landingzone.orchestrator.storage;

/**
 * A bucket plus an optional folder prefix, parsed from {@code gs://bucket/}
 * or {@code gs://bucket/some/folder/}.
 */
public record ObjectLocation(String bucket, String prefix) {

    static final String SCHEME = "gs://";

    public ObjectLocation {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Bucket is required");
        }
        if (prefix == null) prefix = "";
        if (!prefix.isEmpty() && !prefix.endsWith("/")) prefix = prefix + "/";
    }

    public static ObjectLocation parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Expected a gs:// location, got: " + uri);
        }
        String rest = uri.substring(SCHEME.length());
        if (ObjectPattern.hasWildcard(rest)) {
            throw new IllegalArgumentException("Destination must not contain wildcards: " + uri);
        }
        int slash = rest.indexOf('/');
        return slash < 0
                ? new ObjectLocation(rest, "")
                : new ObjectLocation(rest.substring(0, slash), rest.substring(slash + 1));
    }

    /** Object name for {@code fileName} placed in this location. */
    public String resolve(String fileName) {
        return prefix + fileName;
    }

    @Override
    public String toString() {
        return SCHEME + bucket + "/" + prefix;
    }
}
