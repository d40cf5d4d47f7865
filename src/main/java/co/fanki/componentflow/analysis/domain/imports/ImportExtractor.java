package co.fanki.componentflow.analysis.domain.imports;

import co.fanki.componentflow.analysis.domain.ast.SyntaxKind;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import co.fanki.componentflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the value imports of a parsed file. Type-only imports are
 * skipped since they never render anything.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportExtractor {

    /**
     * Extracts the import records of a file.
     *
     * @param program the program node, never null
     * @return the import records in declaration order
     */
    public List<ImportRecord> extract(final SyntaxNode program) {
        Preconditions.requireNonNull(program, "Program node is required");

        final List<ImportRecord> records = new ArrayList<>();
        for (final SyntaxNode statement : program.children()) {
            if (!statement.is(SyntaxKind.IMPORT)
                    || "type".equals(statement.flags())
                    || statement.value() == null
                    || statement.value().isBlank()) {
                continue;
            }
            final String modulePath = statement.value();
            for (final SyntaxNode binding : statement.children()) {
                final ImportRecord record = toRecord(binding, modulePath);
                if (record != null) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    private static ImportRecord toRecord(final SyntaxNode binding,
            final String modulePath) {
        if (binding.name() == null) {
            return null;
        }
        switch (binding.kind()) {
            case IMPORT_DEFAULT:
                return new ImportRecord(binding.name(), "default",
                        modulePath, true, false);
            case IMPORT_NAMESPACE:
                return new ImportRecord(binding.name(), "*",
                        modulePath, false, true);
            case IMPORT_SPECIFIER:
                final String imported = binding.value() == null
                        ? binding.name() : binding.value();
                return new ImportRecord(binding.name(), imported,
                        modulePath, "default".equals(imported), false);
            default:
                return null;
        }
    }
}
