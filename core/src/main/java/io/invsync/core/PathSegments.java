package io.invsync.core;

/** Path splitting shared by {@link CollectionRef} and {@link DocumentRef}. */
final class PathSegments {

    private PathSegments() {
        // utility
    }

    static String[] split(String path) {
        if (path.isEmpty() || path.startsWith("/") || path.endsWith("/")) {
            throw new IllegalArgumentException("invalid path: '" + path + "'");
        }
        String[] segments = path.split("/", -1);
        for (String s : segments) {
            if (s.isBlank()) {
                throw new IllegalArgumentException("empty segment in path: '" + path + "'");
            }
        }
        return segments;
    }

    static String join(String first, String... more) {
        StringBuilder sb = new StringBuilder(first);
        for (String s : more) {
            sb.append('/').append(s);
        }
        return sb.toString();
    }
}
