package de.julielab.jules.ae.placemapping.knowledge;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The characters and words that decide whether the text around a compound
 * place name match is a valid boundary.
 */
public class BoundaryLexicon {

    public enum Kind {
        /**
         * Punctuation and brackets; always a valid boundary.
         */
        PUNCTUATION,
        /**
         * Grammatical particles; always a valid boundary.
         */
        PARTICLE,
        /**
         * Kanji numerals; a valid boundary after a match, e.g. before a year.
         */
        NUMERAL,
        /**
         * Kanji that may directly follow a place name, e.g. <tt>出身</tt>.
         */
        TRAILING_ALLOW,
        /**
         * Parts of personal names. A name marker right after a match shows that
         * the following kanji start a personal name; a name marker before a
         * match shows that the match is embedded in a name.
         */
        NAME_MARKER
    }

    private final Set<Character> punctuation;
    private final Set<Character> particles;
    private final Set<Character> numerals;
    private final Set<Character> trailingAllow;
    private final Set<String> nameMarkers;

    private BoundaryLexicon(Builder builder) {
        this.punctuation = Collections.unmodifiableSet(new HashSet<>(builder.punctuation));
        this.particles = Collections.unmodifiableSet(new HashSet<>(builder.particles));
        this.numerals = Collections.unmodifiableSet(new HashSet<>(builder.numerals));
        this.trailingAllow = Collections.unmodifiableSet(new HashSet<>(builder.trailingAllow));
        this.nameMarkers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.nameMarkers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPunctuation(char c) {
        return punctuation.contains(c);
    }

    public boolean isParticle(char c) {
        return particles.contains(c);
    }

    public boolean isNumeral(char c) {
        return numerals.contains(c);
    }

    public boolean isTrailingAllowed(char c) {
        return trailingAllow.contains(c);
    }

    /**
     * @return whether <tt>window</tt> contains any of the name markers
     */
    public boolean containsNameMarker(String window) {
        for (String marker : nameMarkers) {
            if (window.contains(marker))
                return true;
        }
        return false;
    }

    public Set<String> getNameMarkers() {
        return nameMarkers;
    }

    public boolean isEmpty() {
        return punctuation.isEmpty() && particles.isEmpty() && numerals.isEmpty() && trailingAllow.isEmpty()
                && nameMarkers.isEmpty();
    }

    public static class Builder {
        private final Set<Character> punctuation = new HashSet<>();
        private final Set<Character> particles = new HashSet<>();
        private final Set<Character> numerals = new HashSet<>();
        private final Set<Character> trailingAllow = new HashSet<>();
        private final Set<String> nameMarkers = new LinkedHashSet<>();

        /**
         * Adds an entry. For {@link Kind#NAME_MARKER} the value is one word, for
         * all other kinds every character of the value is added.
         */
        public Builder add(Kind kind, String value) {
            switch (kind) {
                case NAME_MARKER:
                    nameMarkers.add(value);
                    break;
                case PUNCTUATION:
                    addChars(punctuation, value);
                    break;
                case PARTICLE:
                    addChars(particles, value);
                    break;
                case NUMERAL:
                    addChars(numerals, value);
                    break;
                case TRAILING_ALLOW:
                    addChars(trailingAllow, value);
                    break;
                default:
                    throw new IllegalArgumentException("Unhandled boundary kind " + kind);
            }
            return this;
        }

        private void addChars(Set<Character> set, String value) {
            for (int i = 0; i < value.length(); i++)
                set.add(value.charAt(i));
        }

        public BoundaryLexicon build() {
            return new BoundaryLexicon(this);
        }
    }
}
