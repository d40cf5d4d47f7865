package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.analysis.domain.imports.ImportClassificationPolicy;
import co.fanki.componentflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregates the external leaves of several flow graphs by package.
 *
 * <p>Each internal node is walked once per entry, so a shared subtree
 * counts its external leaves once for every entry that reaches it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ExternalDependencyCollector {

    private final Map<String, Set<String>> usedIn = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new LinkedHashMap<>();

    /**
     * Adds the external leaves reachable from an entry.
     *
     * @param entryFile the entry file the graph was built from
     * @param root the root of the graph, may be null
     */
    public void collect(final String entryFile, final FlowNode root) {
        Preconditions.requireNonNull(entryFile, "Entry file is required");
        if (root != null) {
            walk(entryFile, root, new HashSet<>());
        }
    }

    /**
     * Returns the aggregated dependencies.
     *
     * @return one entry per package, in first-seen order
     */
    public List<ExternalDependency> dependencies() {
        final List<ExternalDependency> result = new ArrayList<>();
        for (final Map.Entry<String, Set<String>> entry : usedIn.entrySet()) {
            result.add(new ExternalDependency(entry.getKey(),
                    new ArrayList<>(entry.getValue()),
                    counts.get(entry.getKey())));
        }
        return result;
    }

    private void walk(final String entryFile, final FlowNode node,
            final Set<String> visited) {
        if (node.external()) {
            final String pkg = packageOf(node);
            usedIn.computeIfAbsent(pkg, k -> new LinkedHashSet<>())
                    .add(entryFile);
            counts.merge(pkg, 1, Integer::sum);
            return;
        }
        if (!visited.add(node.filePath())) {
            return;
        }
        for (final FlowNode child : node.children()) {
            walk(entryFile, child, visited);
        }
    }

    private static String packageOf(final FlowNode node) {
        if (node.source() == null || node.source().isBlank()) {
            return node.name();
        }
        return ImportClassificationPolicy.packageName(node.source());
    }
}
