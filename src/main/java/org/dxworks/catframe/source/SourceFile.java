package org.dxworks.catframe.source;

import java.util.Objects;

/**
 * A named cat text supplied by the caller. The name is the key other files use in {@code include}.
 */
public final class SourceFile {

    private final String name;
    private final String text;

    public SourceFile(String name, String text) {
        this.name = Objects.requireNonNull(name, "name");
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceFile other)) return false;
        return name.equals(other.name) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, text);
    }

    @Override
    public String toString() {
        return "SourceFile{" + name + "}";
    }
}
