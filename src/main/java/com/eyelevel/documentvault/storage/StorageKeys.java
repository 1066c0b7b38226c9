package com.eyelevel.documentvault.storage;

import org.apache.commons.io.FilenameUtils;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds and parses storage keys of the form {@code <userId>/<documentToken>/<sanitizedFileName>}.
 *
 * <p>The document token is a random UUID minted per upload, so two uploads of the same file by the
 * same user never collide.
 */
public final class StorageKeys {

    public static final String THUMBNAIL_FOLDER = "thumbnails";

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^a-zA-Z0-9.\\-]");
    private static final Pattern LEADING_DOTS = Pattern.compile("^\\.+");
    private static final String FALLBACK_SEGMENT = "file";

    private StorageKeys() {
    }

    public static String forDocument(String userId, String documentToken, String fileName) {
        return String.join("/", sanitizeSegment(userId), sanitizeSegment(documentToken), sanitizeFileName(fileName));
    }

    /**
     * Derives the key under which the thumbnail of a document is stored, next to the document itself.
     */
    public static String forThumbnail(String documentKey) {
        ParsedKey parsed = parse(documentKey).orElseThrow(
                () -> new IllegalArgumentException("Not a document key: " + documentKey));
        String baseName = FilenameUtils.getBaseName(parsed.fileName());
        return String.join("/", parsed.userId(), parsed.documentToken(), THUMBNAIL_FOLDER,
                           (StringUtils.hasText(baseName) ? baseName : FALLBACK_SEGMENT) + ".png");
    }

    /**
     * Strips any directory part of a client-supplied name and replaces every character outside
     * {@code [A-Za-z0-9.-]} with an underscore. Leading dots are replaced so the result can never be
     * a relative path segment or a hidden file.
     */
    public static String sanitizeFileName(String fileName) {
        String baseName = FilenameUtils.getName(fileName == null ? "" : fileName.replace('\\', '/'));
        return sanitizeSegment(baseName);
    }

    public static Optional<ParsedKey> parse(String key) {
        if (!StringUtils.hasText(key)) {
            return Optional.empty();
        }
        String[] parts = key.split("/");
        if (parts.length != 3) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                return Optional.empty();
            }
        }
        return Optional.of(new ParsedKey(parts[0], parts[1], parts[2]));
    }

    private static String sanitizeSegment(String segment) {
        if (!StringUtils.hasText(segment)) {
            return FALLBACK_SEGMENT;
        }
        String sanitized = UNSAFE_CHARACTERS.matcher(segment.trim()).replaceAll("_");
        return LEADING_DOTS.matcher(sanitized).replaceFirst("_");
    }

    public record ParsedKey(String userId, String documentToken, String fileName) {
    }
}
