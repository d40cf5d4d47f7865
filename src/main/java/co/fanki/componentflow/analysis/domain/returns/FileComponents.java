package co.fanki.componentflow.analysis.domain.returns;

import java.util.List;

/**
 * The component functions declared in one file.
 *
 * @param components the components, in source order
 * @param defaultExportName the identifier exported by default
 *        ({@code export default Page}), or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileComponents(
        List<ComponentFunction> components,
        String defaultExportName) {

    /** Copies. */
    public FileComponents {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    /**
     * Returns the name that identifies the file's main component: the
     * default-exported identifier, else the name of a default-exported
     * function.
     *
     * @return the name, or null when the file has no named default export
     */
    public String primaryName() {
        if (defaultExportName != null) {
            return defaultExportName;
        }
        for (final ComponentFunction component : components) {
            if (component.defaultExport() && component.name() != null) {
                return component.name();
            }
        }
        return null;
    }
}
