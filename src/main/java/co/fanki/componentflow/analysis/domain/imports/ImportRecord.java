package co.fanki.componentflow.analysis.domain.imports;

import co.fanki.componentflow.shared.Preconditions;

/**
 * One binding introduced by an import declaration.
 *
 * <p>{@code import Button from './Button'} gives local and imported name
 * {@code Button} (default); {@code import { Card as Tile } from 'ui'}
 * gives local {@code Tile}, imported {@code Card};
 * {@code import * as Icons from 'icons'} gives local {@code Icons}
 * (namespace).</p>
 *
 * @param localName the name bound in the importing file
 * @param importedName the exported name, {@code default} or {@code *}
 * @param modulePath the module specifier as written
 * @param isDefault whether this is a default import
 * @param isNamespace whether this is a namespace import
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportRecord(
        String localName,
        String importedName,
        String modulePath,
        boolean isDefault,
        boolean isNamespace) {

    /** Validates. */
    public ImportRecord {
        Preconditions.requireNonBlank(localName, "Local name is required");
        Preconditions.requireNonBlank(importedName,
                "Imported name is required");
        Preconditions.requireNonBlank(modulePath, "Module path is required");
    }

    /**
     * Checks whether a reference name is bound by this import.
     *
     * <p>Matches the local or imported name, and for namespace imports
     * or dotted references ({@code Icons.Home}), the first segment.</p>
     *
     * @param referenceName the reference name
     * @return true when this import provides the reference
     */
    public boolean provides(final String referenceName) {
        if (referenceName == null) {
            return false;
        }
        if (referenceName.equals(localName)
                || referenceName.equals(importedName)) {
            return true;
        }
        final int dot = referenceName.indexOf('.');
        return dot > 0 && referenceName.substring(0, dot).equals(localName);
    }
}
