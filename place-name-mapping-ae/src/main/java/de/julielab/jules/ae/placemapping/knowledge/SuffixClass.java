package de.julielab.jules.ae.placemapping.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A name at one hierarchy level: a stem of <tt>minStem</tt> to <tt>maxStem</tt>
 * characters from the stem character class, immediately followed by one of the
 * suffix characters, e.g. <tt>真崎</tt> + <tt>村</tt>.
 */
public class SuffixClass {
    private final SuffixLevel level;
    private final String suffixes;
    private final int minStem;
    private final int maxStem;
    private final String stemCharClass;
    private final Pattern stemCharPattern;

    public SuffixClass(SuffixLevel level, String suffixes, int minStem, int maxStem, String stemCharClass) {
        if (suffixes == null || suffixes.isEmpty())
            throw new IllegalArgumentException("No suffix characters given for level " + level);
        if (minStem < 1 || maxStem < minStem)
            throw new IllegalArgumentException("Invalid stem length bounds [" + minStem + ", " + maxStem + "] for level " + level);
        this.level = level;
        this.suffixes = suffixes;
        this.minStem = minStem;
        this.maxStem = maxStem;
        this.stemCharClass = stemCharClass;
        this.stemCharPattern = Pattern.compile(stemCharClass);
    }

    public SuffixLevel getLevel() {
        return level;
    }

    public String getSuffixes() {
        return suffixes;
    }

    public int getMinStem() {
        return minStem;
    }

    public int getMaxStem() {
        return maxStem;
    }

    public String getStemCharClass() {
        return stemCharClass;
    }

    public boolean isStemChar(char c) {
        return stemCharPattern.matcher(String.valueOf(c)).matches();
    }

    /**
     * Returns all offsets at which a name of this level that starts exactly at
     * <tt>from</tt> ends, longest first.
     *
     * @param text the text to search
     * @param from the offset the name must start at
     * @return the exclusive end offsets of all matches, in descending order
     */
    public List<Integer> matchEnds(String text, int from) {
        List<Integer> ends = new ArrayList<>();
        int stemLength = 0;
        while (stemLength < maxStem && from + stemLength < text.length() && isStemChar(text.charAt(from + stemLength)))
            ++stemLength;
        for (int length = stemLength; length >= minStem; --length) {
            int suffixPos = from + length;
            if (suffixPos < text.length() && suffixes.indexOf(text.charAt(suffixPos)) >= 0)
                ends.add(suffixPos + 1);
        }
        return ends;
    }

    /**
     * @return a regular expression matching a name of this level
     */
    public String toRegex() {
        return stemCharClass + "{" + minStem + "," + maxStem + "}[" + suffixes + "]";
    }

    @Override
    public String toString() {
        return "SuffixClass [level=" + level + ", suffixes=" + suffixes + ", stem=" + stemCharClass + "{" + minStem
                + "," + maxStem + "}]";
    }
}
