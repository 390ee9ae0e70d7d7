package de.julielab.jules.ae.placemapping.extraction;

import de.julielab.jules.ae.placemapping.knowledge.BoundaryLexicon;

/**
 * Decides whether a match is delimited properly or is a part of a longer
 * compound word or personal name.
 * <p>
 * Before a match, whitespace, punctuation, particles and non-kanji characters
 * are valid boundaries. A preceding kanji is accepted unless the window before
 * the match contains a name marker.
 * </p>
 * <p>
 * After a match, whitespace, punctuation, particles and non-kanji characters
 * are valid boundaries as well as kanji numerals and the trailing allow list.
 * Any other following kanji is only accepted if the window after the match
 * contains a name marker, i.e. the place is directly followed by a personal
 * name as in <tt>福岡県京都郡真崎村小川三四郎</tt>.
 * </p>
 */
public class BoundaryValidator {
    private final BoundaryLexicon lexicon;
    private final int windowSize;

    public BoundaryValidator(BoundaryLexicon lexicon, int windowSize) {
        this.lexicon = lexicon;
        this.windowSize = windowSize;
    }

    public boolean isValid(String sentence, int begin, int end) {
        return isValidStart(sentence, begin) && isValidEnd(sentence, end);
    }

    public boolean isValidStart(String sentence, int begin) {
        if (begin == 0)
            return true;
        char c = sentence.charAt(begin - 1);
        if (isDelimiter(c) || !isKanji(c))
            return true;
        String window = sentence.substring(Math.max(0, begin - windowSize), begin);
        return !lexicon.containsNameMarker(window);
    }

    public boolean isValidEnd(String sentence, int end) {
        if (end >= sentence.length())
            return true;
        char c = sentence.charAt(end);
        if (isDelimiter(c) || !isKanji(c))
            return true;
        if (lexicon.isNumeral(c) || lexicon.isTrailingAllowed(c))
            return true;
        String window = sentence.substring(end, Math.min(sentence.length(), end + windowSize));
        return lexicon.containsNameMarker(window);
    }

    private boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || lexicon.isPunctuation(c) || lexicon.isParticle(c);
    }

    static boolean isKanji(char c) {
        return Character.UnicodeScript.of(c) == Character.UnicodeScript.HAN;
    }
}
