package com.example.spacefinder.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed set of file categories. Each category except {@link #OTHER} owns a set of extensions.
 */
public enum Category {
    VIDEO("Video", Set.of(".mp4", ".mkv", ".avi", ".mov", ".wmv", ".flv", ".webm", ".m4v", ".mpeg", ".mpg", ".3gp")),
    AUDIO("Audio", Set.of(".mp3", ".wav", ".flac", ".aac", ".ogg", ".wma", ".m4a", ".opus")),
    IMAGE("Image", Set.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp", ".svg", ".ico", ".tiff", ".raw", ".psd")),
    DOCUMENT("Document", Set.of(".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx", ".txt", ".rtf", ".odt", ".ods")),
    ARCHIVE("Archive", Set.of(".zip", ".rar", ".7z", ".tar", ".gz", ".bz2", ".xz", ".iso")),
    CODE("Code", Set.of(".py", ".js", ".ts", ".java", ".cpp", ".c", ".h", ".cs", ".go", ".rs", ".rb", ".php")),
    // Executables only land here when their path points at a game installation.
    GAME("Game", Set.of()),
    OTHER("Other", Set.of());

    private final String label;
    private final Set<String> extensions;

    Category(String label, Set<String> extensions) {
        this.label = label;
        this.extensions = extensions;
    }

    @JsonValue
    public String label() {
        return label;
    }

    boolean matches(String extension) {
        return extensions.contains(extension);
    }

    /**
     * Looks up a category by its display label or enum name, ignoring case.
     */
    public static Optional<Category> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.label.toLowerCase(Locale.ROOT).equals(normalized)
                    || category.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
