package ai.asserttagger.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class AtomicWrites {

    private AtomicWrites() {
        // no instances
    }

    /**
     * Overwrites the content of a file with the provided bytes.
     *
     * <p>The bytes are written to a temporary file in the same directory as the target, which is then moved over the
     * target. The move is atomic where the filesystem supports it and a plain replace otherwise. Missing parent
     * directories are created.
     *
     * @param targetPath the file to overwrite
     * @param content the new content
     * @throws IOException if writing or moving fails; the temporary file is removed in that case
     */
    public static void atomicOverwrite(Path targetPath, byte[] content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, "temp-", ".tmp");

        try {
            Files.write(tempFile, content);
            try {
                Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    /** UTF-8 convenience overload of {@link #atomicOverwrite(Path, byte[])}. */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        atomicOverwrite(targetPath, content.getBytes(StandardCharsets.UTF_8));
    }
}
