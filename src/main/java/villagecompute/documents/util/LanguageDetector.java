/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight language guesser based on common-word frequency.
 *
 * <p>
 * Scores the first {@value #SAMPLE_WORDS} words of the text against short stop-word lists and returns the language with
 * the highest score. Falls back to {@value #DEFAULT_LANGUAGE} when nothing matches. Good enough to tag uploads; not a
 * substitute for a real language identification model.
 */
public final class LanguageDetector {

    public static final String DEFAULT_LANGUAGE = "en";

    static final int SAMPLE_WORDS = 100;

    /**
     * Language codes documents may report.
     */
    public static final List<String> SUPPORTED_LANGUAGES = List.of("en", "es", "fr", "de", "it", "pt", "zh", "ja",
            "ko", "ar");

    private static final Map<String, Set<String>> COMMON_WORDS = new LinkedHashMap<>();

    static {
        // Insertion order decides ties: earlier languages win.
        COMMON_WORDS.put("en", Set.of("the", "and", "is", "in", "to", "of", "a", "that", "it"));
        COMMON_WORDS.put("es", Set.of("el", "la", "de", "que", "y", "en", "un", "es", "se"));
        COMMON_WORDS.put("fr", Set.of("le", "de", "et", "à", "un", "il", "être", "en"));
        COMMON_WORDS.put("de", Set.of("der", "die", "und", "in", "den", "von", "zu", "das", "mit"));
    }

    private LanguageDetector() {
    }

    /**
     * Guesses the language of a text.
     *
     * @param text
     *            text to inspect, may be null
     * @return ISO 639-1 code, {@value #DEFAULT_LANGUAGE} when undetermined
     */
    public static String detect(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT_LANGUAGE;
        }

        String[] words = text.toLowerCase(Locale.ROOT).trim().split("\\s+");
        int sample = Math.min(words.length, SAMPLE_WORDS);

        String detected = DEFAULT_LANGUAGE;
        int maxScore = 0;
        for (Map.Entry<String, Set<String>> entry : COMMON_WORDS.entrySet()) {
            int score = 0;
            for (int i = 0; i < sample; i++) {
                if (entry.getValue().contains(words[i])) {
                    score++;
                }
            }
            if (score > maxScore) {
                maxScore = score;
                detected = entry.getKey();
            }
        }
        return detected;
    }

    /**
     * Counts whitespace-separated words.
     *
     * @param text
     *            text to count, may be null
     * @return word count, 0 for null or blank text
     */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
