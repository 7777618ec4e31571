package com.dcruver.beliefgraph.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Slug titles for leaf nodes.
 */
public final class TitleSlugs {

    public static final int DEFAULT_MAX_WORDS = 5;

    private TitleSlugs() {
    }

    /**
     * Lowercase, keep the first maxWords whitespace-separated words, strip everything but
     * letters and digits from each, drop words left empty and join with hyphens.
     * Returns an empty string when nothing survives.
     */
    public static String slugify(String text, int maxWords) {
        if (text == null || text.isBlank() || maxWords <= 0) {
            return "";
        }

        String[] words = text.toLowerCase(Locale.ROOT).strip().split("\\s+");
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < Math.min(maxWords, words.length); i++) {
            StringBuilder word = new StringBuilder();
            words[i].codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(word::appendCodePoint);
            if (word.length() > 0) {
                kept.add(word.toString());
            }
        }
        return String.join("-", kept);
    }

    public static String slugify(String text) {
        return slugify(text, DEFAULT_MAX_WORDS);
    }
}
