package br.edu.ifba.mindgraph.export;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Export formats.
 */
public enum ExportFormat {
    JSON("application/json", "json"),
    CSV("text/csv", "csv"),
    MARKDOWN("text/markdown", "md");

    private final String mimeType;
    private final String extension;

    ExportFormat(String mimeType, String extension) {
        this.mimeType = mimeType;
        this.extension = extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Parses format from string, case-insensitive. Blank means JSON.
     *
     * @throws IllegalArgumentException if value doesn't match
     */
    public static ExportFormat fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("MD".equals(normalized)) {
            return MARKDOWN;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid export format: '" + value + "'. Valid values: json, csv, markdown");
        }
    }
}
