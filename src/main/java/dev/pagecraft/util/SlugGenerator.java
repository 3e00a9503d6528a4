package dev.pagecraft.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives URL-safe path segments for pages.
 *
 * <p>A generated slug is never empty, is at most {@value #MAX_LENGTH} characters
 * long, matches {@code [a-z0-9]([a-z0-9-]*[a-z0-9])?} and does not collide with
 * any slug in the sibling set it was generated for. Collisions are resolved by
 * appending {@code -2}, {@code -3}, ... and shortening the base when the suffix
 * would not fit.</p>
 */
public final class SlugGenerator {

    public static final int MAX_LENGTH = 100;
    public static final String FALLBACK_SLUG = "untitled";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern VALID_SLUG = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?$");

    private SlugGenerator() {}

    /**
     * Generate a slug that is unique within {@code siblingSlugs}.
     *
     * @param title        page title, used when no explicit slug is given
     * @param explicitSlug caller-supplied slug; sanitized, never taken verbatim
     * @param siblingSlugs slugs currently used by the children of the target parent
     */
    public static String generate(String title, String explicitSlug, Set<String> siblingSlugs) {
        String base = explicitSlug != null && !explicitSlug.isBlank()
                ? sanitize(explicitSlug)
                : sanitize(title);

        if (siblingSlugs == null || !siblingSlugs.contains(base)) {
            return base;
        }

        for (int n = 2; ; n++) {
            String suffix = "-" + n;
            String candidate = truncate(base, MAX_LENGTH - suffix.length()) + suffix;
            if (!siblingSlugs.contains(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * Lower-case the text, collapse every run of characters outside {@code [a-z0-9]}
     * into a single hyphen, trim hyphens and cap the length. Falls back to
     * {@value #FALLBACK_SLUG} when nothing usable is left.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return FALLBACK_SLUG;
        }
        String slug = NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = stripHyphens(slug);
        if (slug.isEmpty()) {
            return FALLBACK_SLUG;
        }
        return truncate(slug, MAX_LENGTH);
    }

    public static boolean isValid(String slug) {
        return slug != null && slug.length() <= MAX_LENGTH && VALID_SLUG.matcher(slug).matches();
    }

    private static String truncate(String slug, int maxLength) {
        if (slug.length() <= maxLength) {
            return slug;
        }
        return stripTrailingHyphens(slug.substring(0, maxLength));
    }

    private static String stripHyphens(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '-') {
            start++;
        }
        return stripTrailingHyphens(value.substring(start));
    }

    private static String stripTrailingHyphens(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(0, end);
    }
}
