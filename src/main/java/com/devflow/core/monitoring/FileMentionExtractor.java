package com.devflow.core.monitoring;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls file paths out of free text.
 * <p>
 * Recognizes backtick-quoted tokens and bare path-shaped tokens ({@code src/App.java}),
 * keeps only those with a known source or documentation extension, and returns them
 * de-duplicated in the order they first appear.
 */
public final class FileMentionExtractor {

    /** Group 1: backtick-quoted; group 2: bare path with an extension. */
    private static final Pattern MENTION = Pattern.compile("`([^`]+)`|([\\w./-]+\\.\\w+)");

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            "ts", "js", "tsx", "jsx", "py", "java", "kt", "go", "rs",
            "cpp", "c", "h", "cs", "rb", "php", "swift", "scala", "groovy",
            "md", "json", "yaml", "yml", "xml", "properties", "html", "css",
            "scss", "less", "sql", "sh", "bash", "ps1", "gradle");

    private FileMentionExtractor() {}

    public static List<String> extract(String message) {
        if (message == null || message.isBlank()) {
            return List.of();
        }
        Set<String> files = new LinkedHashSet<>();
        Matcher matcher = MENTION.matcher(message);
        while (matcher.find()) {
            String candidate = matcher.group(1) != null ? matcher.group(1).trim() : matcher.group(2);
            if (isLikelyFilePath(candidate)) {
                files.add(candidate);
            }
        }
        return new ArrayList<>(files);
    }

    static boolean isLikelyFilePath(String candidate) {
        if (candidate.isEmpty() || candidate.contains(" ")) {
            return false;
        }
        int dot = candidate.lastIndexOf('.');
        if (dot <= 0 || dot == candidate.length() - 1) {
            return false;
        }
        return CODE_EXTENSIONS.contains(candidate.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
