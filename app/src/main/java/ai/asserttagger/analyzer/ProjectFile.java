package ai.asserttagger.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Abstraction for a source file relative to the package that compiles it. This exists to make it less difficult to
 * ensure that different filename objects can be meaningfully compared, unlike bare Paths which may or may not be
 * absolute, or may be relative to the jvm root rather than the package root.
 */
public class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /** root must be absolute and pre-normalized; relPath is normalized if it is not already */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }

        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public String read() throws IOException {
        return Files.readString(absPath(), StandardCharsets.UTF_8);
    }

    /** The file name with {@code /} separators regardless of platform, used for extension checks and sorting. */
    public String portablePath() {
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public int compareTo(ProjectFile other) {
        return portablePath().compareTo(other.portablePath());
    }

    @Override
    public String toString() {
        return relPath.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
