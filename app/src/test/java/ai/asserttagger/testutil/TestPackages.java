package ai.asserttagger.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds throwaway TypeScript packages under a temp directory. */
public final class TestPackages {
    public static final String DEFAULT_TSCONFIG =
            """
            {
              // sources only
              "compilerOptions": { "outDir": "lib" },
              "include": ["src/**/*"],
            }
            """;

    private TestPackages() {}

    /** Creates {@code parent/name} with the default tsconfig and the given files (relative path to content). */
    public static Path create(Path parent, String name, Map<String, String> files) throws IOException {
        var all = new LinkedHashMap<String, String>();
        all.put("tsconfig.json", DEFAULT_TSCONFIG);
        all.putAll(files);
        return createRaw(parent, name, all);
    }

    /** Creates {@code parent/name} with exactly the given files. */
    public static Path createRaw(Path parent, String name, Map<String, String> files) throws IOException {
        var root = parent.resolve(name).toAbsolutePath().normalize();
        Files.createDirectories(root);
        for (var entry : files.entrySet()) {
            write(root.resolve(entry.getKey()), entry.getValue());
        }
        return root;
    }

    public static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    public static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
