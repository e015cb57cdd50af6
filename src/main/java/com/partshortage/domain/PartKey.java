package com.partshortage.domain;

/**
 * Join key for a part number: the raw identifier with every whitespace character
 * removed, including the full-width space (U+3000).
 */
public record PartKey(String value) implements Comparable<PartKey> {

    public PartKey {
        value = value == null ? "" : value;
    }

    public static PartKey of(Object raw) {
        if (raw == null) {
            return new PartKey("");
        }
        String text = raw.toString();
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\u3000' || Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                continue;
            }
            sb.append(c);
        }
        return new PartKey(sb.toString());
    }

    public boolean isBlank() {
        return value.isEmpty();
    }

    @Override
    public int compareTo(PartKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
