package com.devflow.core.safety;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Matches project-relative paths against protected-file globs.
 * <p>
 * Patterns use {@link java.nio.file.FileSystem#getPathMatcher glob} syntax and are anchored:
 * {@code *.env} matches {@code .env} files in the project root only, {@code **}{@code /*.env} at any depth.
 * A leading {@code **}{@code /} also matches zero directories. Patterns are compiled once.
 */
public class ProtectedFileMatcher {

    private final List<PathMatcher> matchers;

    public ProtectedFileMatcher(Collection<String> globs) {
        List<PathMatcher> compiled = new ArrayList<>();
        if (globs != null) {
            for (String glob : globs) {
                if (glob == null || glob.isBlank()) {
                    continue;
                }
                compiled.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
                if (glob.startsWith("**/")) {
                    compiled.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
                }
            }
        }
        this.matchers = List.copyOf(compiled);
    }

    public boolean isEmpty() {
        return matchers.isEmpty();
    }

    public boolean matches(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || matchers.isEmpty()) {
            return false;
        }
        String normalized = relativePath.replace('\\', '/');
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        try {
            var path = Paths.get(normalized);
            return matchers.stream().anyMatch(m -> m.matches(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    public boolean matchesAny(Collection<String> relativePaths) {
        return relativePaths != null && relativePaths.stream().anyMatch(this::matches);
    }
}
