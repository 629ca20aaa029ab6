package com.landingzone.orchestrator.storage;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A gsutil-style wildcard URL such as {@code gs://raw/input_data/logistics_*.csv}.
 *
 * {@code *} and {@code ?} match within one path segment, {@code **} matches
 * across segments. Listing only needs the literal part before the first
 * wildcard; {@link #matches} does the rest.
 */
public final class ObjectPattern {

    private final String  bucket;
    private final String  glob;
    private final String  literalPrefix;
    private final Pattern regex;

    private ObjectPattern(String bucket, String glob) {
        this.bucket        = bucket;
        this.glob          = glob;
        this.literalPrefix = literalPrefixOf(glob);
        this.regex         = Pattern.compile(toRegex(glob));
    }

    public static ObjectPattern parse(String uri) {
        if (uri == null || !uri.startsWith(ObjectLocation.SCHEME)) {
            throw new IllegalArgumentException("Expected a gs:// pattern, got: " + uri);
        }
        String rest  = uri.substring(ObjectLocation.SCHEME.length());
        int    slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1) {
            throw new IllegalArgumentException("Pattern must name a bucket and an object: " + uri);
        }
        return new ObjectPattern(rest.substring(0, slash), rest.substring(slash + 1));
    }

    public String bucket()        { return bucket; }
    public String literalPrefix() { return literalPrefix; }

    public boolean matches(String objectName) {
        return regex.matcher(objectName).matches();
    }

    static boolean hasWildcard(String s) {
        return s.indexOf('*') >= 0 || s.indexOf('?') >= 0;
    }

    private static String literalPrefixOf(String glob) {
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') return glob.substring(0, i);
        }
        return glob;
    }

    private static String toRegex(String glob) {
        StringBuilder sb      = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c != '*' && c != '?') {
                literal.append(c);
                continue;
            }
            if (!literal.isEmpty()) {
                sb.append(Pattern.quote(literal.toString()));
                literal.setLength(0);
            }
            if (c == '?') {
                sb.append("[^/]");
            } else if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                sb.append(".*");
                i++;
            } else {
                sb.append("[^/]*");
            }
        }
        if (!literal.isEmpty()) sb.append(Pattern.quote(literal.toString()));
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectPattern other)) return false;
        return bucket.equals(other.bucket) && glob.equals(other.glob);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, glob);
    }

    @Override
    public String toString() {
        return ObjectLocation.SCHEME + bucket + "/" + glob;
    }
}
