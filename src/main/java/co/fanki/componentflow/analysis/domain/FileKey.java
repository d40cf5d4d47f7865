package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.shared.Preconditions;
import co.fanki.componentflow.shared.ValueObject;

import java.nio.file.Path;

/**
 * The memoization key of a scanned file: its absolute, normalized path
 * with forward slashes.
 *
 * @param value the normalized path
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileKey(String value) implements ValueObject {

    /** Validates. */
    public FileKey {
        Preconditions.requireNonBlank(value, "File key is required");
    }

    /**
     * Creates the key of a file.
     *
     * @param file the file path, never null
     * @return the key
     */
    public static FileKey of(final Path file) {
        Preconditions.requireNonNull(file, "File path is required");
        return new FileKey(normalize(file));
    }

    /**
     * Normalizes a path the way keys and flow nodes present it.
     *
     * @param file the file path, never null
     * @return the absolute, normalized path with forward slashes
     */
    public static String normalize(final Path file) {
        return file.toAbsolutePath().normalize().toString()
                .replace('\\', '/');
    }

    /**
     * Returns the file this key stands for.
     *
     * @return the path
     */
    public Path toPath() {
        return Path.of(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
