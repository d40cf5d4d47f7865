package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.shared.Preconditions;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which native markup tags are tracked.
 *
 * <p>The exclude list always wins; then {@code includeAll} accepts every
 * other tag; otherwise only the include list is accepted. Tags are
 * compared case-insensitively.</p>
 *
 * @param includeAll accept every tag that is not excluded
 * @param includeTags the tags to accept when includeAll is off
 * @param excludeTags the tags never accepted
 * @param captureTextContent whether static text children are captured
 * @param maxTextLength the captured text limit, truncated past it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MarkupElementFilter(
        boolean includeAll,
        Set<String> includeTags,
        Set<String> excludeTags,
        boolean captureTextContent,
        int maxTextLength) {

    private static final List<String> DEFAULT_INCLUDE = List.of(
            "div", "section", "article", "main", "aside", "header",
            "footer", "nav", "h1", "h2", "h3", "h4", "h5", "h6", "p",
            "span", "button", "a", "input", "select", "textarea", "form",
            "img", "video", "audio", "picture", "ul", "ol", "li", "table",
            "thead", "tbody", "tr", "td", "th");

    private static final List<String> DEFAULT_EXCLUDE = List.of(
            "br", "hr", "meta", "link", "style", "script");

    /** Default text capture limit. */
    public static final int DEFAULT_MAX_TEXT_LENGTH = 100;

    /** Validates and normalizes the tag sets. */
    public MarkupElementFilter {
        Preconditions.requireNonNegative(maxTextLength,
                "maxTextLength must be >= 0");
        includeTags = lowerCase(includeTags);
        excludeTags = lowerCase(excludeTags);
    }

    /**
     * Creates the default filter: common layout, text, form, media, list
     * and table tags; void and head tags excluded; text captured up to
     * {@value #DEFAULT_MAX_TEXT_LENGTH} characters.
     *
     * @return the default filter
     */
    public static MarkupElementFilter defaults() {
        return new MarkupElementFilter(false, Set.copyOf(DEFAULT_INCLUDE),
                Set.copyOf(DEFAULT_EXCLUDE), true, DEFAULT_MAX_TEXT_LENGTH);
    }

    /**
     * Checks whether a tag is tracked.
     *
     * @param tagName the tag name, may be null
     * @return true when the tag passes the filter
     */
    public boolean accepts(final String tagName) {
        if (tagName == null || tagName.isBlank()) {
            return false;
        }
        final String tag = tagName.toLowerCase(Locale.ROOT);
        if (excludeTags.contains(tag)) {
            return false;
        }
        return includeAll || includeTags.contains(tag);
    }

    /**
     * Applies the text capture rules.
     *
     * @param text the raw text, may be null
     * @return the text, truncated and suffixed with {@code ...} past the
     *         limit; null when capture is off or the text is blank
     */
    public String capture(final String text) {
        if (!captureTextContent || text == null) {
            return null;
        }
        final String normalized = text.trim().replaceAll("\\s+", " ");
        if (normalized.isEmpty()) {
            return null;
        }
        if (normalized.length() > maxTextLength) {
            return normalized.substring(0, maxTextLength) + "...";
        }
        return normalized;
    }

    private static Set<String> lowerCase(final Set<String> tags) {
        if (tags == null) {
            return Set.of();
        }
        return tags.stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
