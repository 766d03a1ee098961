package ai.asserttagger.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class TsGlobTest {
    private static final Path BASE = Path.of("/repo/pkg").toAbsolutePath().normalize();

    private static boolean matches(String glob, String relative) {
        return TsGlob.resolve(BASE, glob, true).matches(BASE.resolve(relative));
    }

    @Test
    void doubleStarMatchesZeroOrMoreDirectories() {
        assertTrue(matches("src/**/*", "src/index.ts"));
        assertTrue(matches("src/**/*", "src/a/b/c.ts"));
        assertFalse(matches("src/**/*", "test/index.ts"));
    }

    @Test
    void singleStarStaysWithinASegment() {
        assertTrue(matches("src/*.ts", "src/index.ts"));
        assertFalse(matches("src/*.ts", "src/nested/index.ts"));
        assertTrue(matches("src/?.ts", "src/a.ts"));
        assertFalse(matches("src/?.ts", "src/ab.ts"));
    }

    @Test
    void dotsAreLiteral() {
        assertTrue(matches("**/*.spec.ts", "src/a.spec.ts"));
        assertFalse(matches("**/*.spec.ts", "src/aXspec.ts"));
    }

    @Test
    void bareDirectoryEntryIncludesEverythingBelowIt() {
        assertTrue(matches("src", "src/deep/file.ts"));
        assertTrue(matches("./src", "src/file.ts"));
        assertFalse(TsGlob.resolve(BASE, "src", false).matches(BASE.resolve("src/file.ts")));
    }

    @Test
    void parentSegmentsAreNormalized() {
        assertTrue(matches("../shared/*.ts", "../shared/util.ts"));
    }

    @Test
    void excludeMatchesEverythingBelowAMatchingDirectory() {
        var exclude = TsGlob.resolve(BASE, "node_modules", false);
        assertTrue(exclude.matchesOrContains(BASE.resolve("node_modules")));
        assertTrue(exclude.matchesOrContains(BASE.resolve("node_modules/dep/index.ts")));
        assertFalse(exclude.matchesOrContains(BASE.resolve("src/node_modules_like.ts")));
    }

    @Test
    void walkRootIsTheLiteralPrefix() {
        assertEquals(BASE.resolve("src"), TsGlob.resolve(BASE, "src/**/*.ts", false).walkRoot());
        assertEquals(BASE.resolve("src"), TsGlob.resolve(BASE, "src/index.ts", false).walkRoot());
    }
}
