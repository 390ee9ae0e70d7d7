package de.julielab.jules.ae.placemapping.extraction;

/**
 * A raw place-like entity as returned by an {@link ExternalNERSource}. The end
 * offset is exclusive.
 */
public class NamedEntitySpan {
    private final String text;
    private final int begin;
    private final int end;

    public NamedEntitySpan(String text, int begin, int end) {
        this.text = text;
        this.begin = begin;
        this.end = end;
    }

    public String getText() {
        return text;
    }

    public int getBegin() {
        return begin;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "NamedEntitySpan [text=" + text + ", begin=" + begin + ", end=" + end + "]";
    }
}
