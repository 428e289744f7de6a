package org.pseudoforge.compiler.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of conversion targets.
 */
public enum TargetLanguage {
    PSEUDOCODE("pseudocode", "Pseudocode"),
    PYTHON("python", "Python"),
    JAVASCRIPT("javascript", "JavaScript"),
    JAVA("java", "Java"),
    CSHARP("csharp", "C#"),
    CPP("cpp", "C++"),
    GO("go", "Go"),
    RUST("rust", "Rust");

    private final String id;
    private final String displayName;

    TargetLanguage(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * @return The identifier callers use to request this target, e.g. {@code csharp}.
     */
    public String id() {
        return id;
    }

    /**
     * @return The human readable name, e.g. {@code C#}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a target identifier, ignoring case and surrounding whitespace.
     *
     * @param id The identifier to resolve.
     * @return The matching target, or empty if the identifier is not supported.
     */
    public static Optional<TargetLanguage> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(normalized))
                .findFirst();
    }
}
