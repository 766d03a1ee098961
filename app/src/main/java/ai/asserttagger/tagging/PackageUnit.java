package ai.asserttagger.tagging;

import ai.asserttagger.analyzer.ProjectFile;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A selected package: its root, the assertion functions it uses and, once collected, the files that still contain
 * untagged messages.
 */
public final class PackageUnit {
    private final Path root;
    private final AssertionFunctionTable assertionFunctions;
    private final @Nullable String skipReason;
    private final Set<ProjectFile> pendingFiles = new LinkedHashSet<>();

    private PackageUnit(Path root, AssertionFunctionTable assertionFunctions, @Nullable String skipReason) {
        this.root = root.toAbsolutePath().normalize();
        this.assertionFunctions = assertionFunctions;
        this.skipReason = skipReason;
    }

    public static PackageUnit of(Path root, AssertionFunctionTable assertionFunctions) {
        return new PackageUnit(root, assertionFunctions, null);
    }

    public static PackageUnit skipped(Path root, String reason) {
        return new PackageUnit(root, AssertionFunctionTable.DEFAULT, reason);
    }

    public Path root() {
        return root;
    }

    public AssertionFunctionTable assertionFunctions() {
        return assertionFunctions;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public @Nullable String skipReason() {
        return skipReason;
    }

    void markPending(ProjectFile file) {
        pendingFiles.add(file);
    }

    /** Files found to contain at least one untagged literal, in scan order. */
    public Set<ProjectFile> pendingFiles() {
        return Collections.unmodifiableSet(pendingFiles);
    }

    @Override
    public String toString() {
        return isSkipped() ? root + " (skipped: " + skipReason + ")" : root.toString();
    }
}
