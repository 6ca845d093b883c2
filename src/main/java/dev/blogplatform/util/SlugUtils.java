package dev.blogplatform.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL slug normalisation shared by posts, categories and tags.
 */
public final class SlugUtils {

    private static final Pattern DIACRITICALS = Pattern.compile("\\p{InCombiningDiacriticalMarks}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^a-z0-9_-]");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-{2,}");
    private static final Pattern LEADING_TRAILING_HYPHENS = Pattern.compile("^-+|-+$");

    private SlugUtils() {
        // Utility class
    }

    /**
     * Lowercases, turns whitespace into hyphens, strips anything that is not a word
     * character or hyphen, collapses hyphen runs and trims hyphens at both ends.
     *
     * @return the slug, or an empty string when nothing slug-worthy is left
     */
    public static String slugify(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String normalized = Normalizer.normalize(text.trim(), Normalizer.Form.NFD);
        String slug = DIACRITICALS.matcher(normalized).replaceAll("").toLowerCase(Locale.ROOT);
        slug = WHITESPACE.matcher(slug).replaceAll("-");
        slug = NON_SLUG_CHARS.matcher(slug).replaceAll("");
        slug = REPEATED_HYPHENS.matcher(slug).replaceAll("-");
        return LEADING_TRAILING_HYPHENS.matcher(slug).replaceAll("");
    }

    /**
     * Slug from an explicit value when one is given, otherwise derived from the fallback text.
     */
    public static String slugOrDerive(String explicitSlug, String fallbackText) {
        String slug = slugify(explicitSlug);
        return slug.isEmpty() ? slugify(fallbackText) : slug;
    }
}
