package com.storyloop.core.merge;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Overlap rules for file-scope patterns.
 *
 * <p>Two patterns overlap when they:
 * <ul>
 *   <li>are equal after normalisation, or one is a path suffix of the other
 *       ({@code src/App.java} vs {@code ./app/src/App.java}). Scopes are often written relative
 *       to a module rather than the repository root, so a bare {@code App.java} overlaps every
 *       {@code App.java}; unrelated files with the same name are serialised.</li>
 *   <li>one names a directory (trailing {@code /}) containing the other</li>
 *   <li>one is a glob matching the other, or a glob reaching into the other's directory</li>
 *   <li>both are globs whose literal prefixes are nested; this is conservative</li>
 * </ul>
 */
public final class FileScopes {

    private static final String GLOB_CHARS = "*?[{";

    private FileScopes() {}

    public static boolean overlap(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }

        boolean globA = isGlob(a);
        boolean globB = isGlob(b);
        if (globA && globB) {
            return nested(literalPrefix(a), literalPrefix(b));
        }
        if (globA) {
            return globMatches(a, b) || (isDirectory(b) && nested(literalPrefix(a), b));
        }
        if (globB) {
            return globMatches(b, a) || (isDirectory(a) && nested(literalPrefix(b), a));
        }

        if (isDirectory(a) && b.startsWith(a)) {
            return true;
        }
        if (isDirectory(b) && a.startsWith(b)) {
            return true;
        }
        String ta = stripTrailingSlash(a);
        String tb = stripTrailingSlash(b);
        if (ta.equals(tb)) {
            return true;
        }
        return ta.endsWith("/" + tb) || tb.endsWith("/" + ta);
    }

    /** True when no pattern in one scope overlaps a pattern in the other. */
    public static boolean disjoint(Collection<String> first, Collection<String> second) {
        for (String a : first) {
            for (String b : second) {
                if (overlap(a, b)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns the normalised patterns involved in any overlap between the two scopes, sorted.
     */
    public static List<String> intersection(Collection<String> first, Collection<String> second) {
        TreeSet<String> shared = new TreeSet<>();
        for (String a : first) {
            for (String b : second) {
                if (overlap(a, b)) {
                    shared.add(normalize(a));
                    shared.add(normalize(b));
                }
            }
        }
        return List.copyOf(shared);
    }

    static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String n = path.trim().replace('\\', '/');
        while (n.startsWith("./")) {
            n = n.substring(2);
        }
        return n;
    }

    static boolean isGlob(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (GLOB_CHARS.indexOf(pattern.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDirectory(String path) {
        return path.endsWith("/");
    }

    private static boolean nested(String first, String second) {
        return first.startsWith(second) || second.startsWith(first);
    }

    private static String stripTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static String literalPrefix(String glob) {
        for (int i = 0; i < glob.length(); i++) {
            if (GLOB_CHARS.indexOf(glob.charAt(i)) >= 0) {
                return glob.substring(0, i);
            }
        }
        return glob;
    }

    private static boolean globMatches(String glob, String path) {
        try {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            return matcher.matches(Path.of(stripTrailingSlash(path)));
        } catch (IllegalArgumentException e) {
            // unparseable pattern: fall back to comparing literal prefixes
            return path.startsWith(literalPrefix(glob));
        }
    }
}
