package com.sitesmith.core.generation;

import java.util.regex.Pattern;

/**
 * Removes markdown code fences that chat models sometimes wrap around HTML
 * despite being told not to.
 */
public final class HtmlFences {

    private static final Pattern OPENING = Pattern.compile("^\\s*```[a-zA-Z]*\\s*\\n");
    private static final Pattern CLOSING = Pattern.compile("\\n?\\s*```\\s*$");

    private HtmlFences() {}

    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        String result = text;
        var opening = OPENING.matcher(result);
        if (opening.find()) {
            result = result.substring(opening.end());
            result = CLOSING.matcher(result).replaceFirst("");
        }
        return result.trim();
    }
}
