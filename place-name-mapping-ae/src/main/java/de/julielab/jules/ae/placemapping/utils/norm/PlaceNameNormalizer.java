/**
 * PlaceNameNormalizer.java
 * <p>
 * Copyright (c) 2026, JULIE Lab.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Common Public License v1.0
 * <p>
 * Used by the place mapper to build cache keys and canonical names from
 * place name mentions.
 **/
package de.julielab.jules.ae.placemapping.utils.norm;

import java.text.Normalizer;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

public class PlaceNameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u3000]+");

    /**
     * The province marker of classical place names, e.g. the last character of
     * <tt>伊勢国</tt>.
     */
    public static final String PROVINCE_MARKER = "国";

    /**
     * NFKC normalization (full width latin and digits become half width, half
     * width katakana becomes full width) followed by the removal of all
     * whitespace including the ideographic space.
     *
     * @param name the place name, may be <tt>null</tt>
     * @return the normalized name, the empty string for <tt>null</tt> input
     */
    public String normalize(String name) {
        if (StringUtils.isBlank(name))
            return "";
        String normalized = Normalizer.normalize(name, Normalizer.Form.NFKC);
        return WHITESPACE.matcher(normalized).replaceAll("");
    }

    /**
     * Removes a trailing province marker, <tt>伊勢国</tt> becomes <tt>伊勢</tt>.
     * Names consisting of the marker only are returned unchanged.
     */
    public String stripProvinceMarker(String name) {
        if (name != null && name.length() > PROVINCE_MARKER.length() && name.endsWith(PROVINCE_MARKER))
            return name.substring(0, name.length() - PROVINCE_MARKER.length());
        return name;
    }

}
