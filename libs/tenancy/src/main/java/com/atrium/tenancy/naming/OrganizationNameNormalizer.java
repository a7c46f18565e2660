package com.atrium.tenancy.naming;

import com.atrium.tenancy.InvalidNameException;
import com.ibm.icu.text.Transliterator;
import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the canonical slug of an organization name.
 * <p>
 * Apostrophes separate words ({@code "C'est"} becomes {@code "c-est"}), any script is
 * transliterated to ASCII ({@code "Straße"} becomes {@code "strasse"}, {@code "北京"} becomes
 * {@code "bei-jing"}), commas between digits are dropped ({@code "1,000"} becomes {@code "1000"})
 * and everything else outside {@code [a-z0-9]} collapses into single hyphens. The function is
 * idempotent. Two names with the same slug are the same organization for every uniqueness check.
 */
public final class OrganizationNameNormalizer {

    private static final String TO_ASCII = "Any-Latin; Latin-ASCII";

    private static final Pattern APOSTROPHES = Pattern.compile("['‘’]+");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\p{ASCII}]");
    private static final Pattern DIGIT_COMMA = Pattern.compile("(?<=\\d),(?=\\d)");
    private static final Pattern DISALLOWED_RUN = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");
    private static final Pattern SLUG = Pattern.compile("^[a-z0-9-]+$");

    private static final Transliterator TRANSLITERATOR = Transliterator.getInstance(TO_ASCII);

    private OrganizationNameNormalizer() {
        // utility class
    }

    /**
     * @param name human-supplied organization name
     * @return lower-case slug matching {@code [a-z0-9-]+}
     * @throws InvalidNameException if the name is null or has no usable characters
     */
    public static String normalize(String name) {
        if (name == null) {
            throw new InvalidNameException(null);
        }
        String composed = Normalizer.normalize(name, Normalizer.Form.NFKC);
        String latin = transliterate(APOSTROPHES.matcher(composed).replaceAll("-"));
        String ascii = NON_ASCII.matcher(Normalizer.normalize(
                APOSTROPHES.matcher(latin).replaceAll("-"), Normalizer.Form.NFKD)).replaceAll("");
        String lower = DIGIT_COMMA.matcher(ascii).replaceAll("").toLowerCase(Locale.ROOT);
        String hyphenated = DISALLOWED_RUN.matcher(lower).replaceAll("-");
        String slug = EDGE_HYPHENS.matcher(hyphenated).replaceAll("");
        if (slug.isEmpty() || !SLUG.matcher(slug).matches()) {
            throw new InvalidNameException(name);
        }
        return slug;
    }

    private static String transliterate(String text) {
        synchronized (TRANSLITERATOR) {
            return TRANSLITERATOR.transliterate(text);
        }
    }
}
