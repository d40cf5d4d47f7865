package co.fanki.componentflow.analysis.domain;

import java.util.Map;

/**
 * Markup element counts of one file.
 *
 * @param filePath the normalized file path
 * @param totalElements how many tracked elements the components render
 * @param byTag the count per tag, sorted by tag
 * @param withTextContent how many elements carry captured text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MarkupElementStats(
        String filePath,
        int totalElements,
        Map<String, Integer> byTag,
        int withTextContent) {
}
