package work.lcod.scriptgen.config;

import java.util.Objects;

/**
 * Immutable presentation settings for the generator.
 */
public record GeneratorSettings(
    int indentWidth,
    boolean includeHeader,
    String headerTitle,
    int suffixLength
) {
    public static final int DEFAULT_INDENT = 4;
    public static final String DEFAULT_HEADER_TITLE = "Auto-generated PowerShell 5.1 Script";
    public static final int DEFAULT_SUFFIX_LENGTH = 4;

    public GeneratorSettings {
        Objects.requireNonNull(headerTitle, "headerTitle");
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must be >= 0: " + indentWidth);
        }
        if (suffixLength < 1) {
            throw new IllegalArgumentException("suffixLength must be >= 1: " + suffixLength);
        }
    }

    public static GeneratorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .indentWidth(indentWidth)
            .includeHeader(includeHeader)
            .headerTitle(headerTitle)
            .suffixLength(suffixLength);
    }

    public static final class Builder {
        private int indentWidth = DEFAULT_INDENT;
        private boolean includeHeader = true;
        private String headerTitle = DEFAULT_HEADER_TITLE;
        private int suffixLength = DEFAULT_SUFFIX_LENGTH;

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder includeHeader(boolean includeHeader) {
            this.includeHeader = includeHeader;
            return this;
        }

        public Builder headerTitle(String headerTitle) {
            this.headerTitle = headerTitle;
            return this;
        }

        public Builder suffixLength(int suffixLength) {
            this.suffixLength = suffixLength;
            return this;
        }

        public GeneratorSettings build() {
            return new GeneratorSettings(indentWidth, includeHeader, headerTitle, suffixLength);
        }
    }
}
