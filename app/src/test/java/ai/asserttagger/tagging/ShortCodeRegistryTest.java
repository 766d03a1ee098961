package ai.asserttagger.tagging;

import static org.junit.jupiter.api.Assertions.*;

import ai.asserttagger.analyzer.ProjectFile;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ShortCodeRegistryTest {
    private static final Path ROOT = Path.of("/repo/pkg").toAbsolutePath().normalize();

    private static AssertionSite site(String file, int line, String text) {
        return new AssertionSite(
                new ProjectFile(ROOT, file), line, "number", 0, text.length(), text, SiteKind.TAGGED_CODE, null, null);
    }

    @Test
    void emptyRegistryStartsAtZero() {
        var registry = new ShortCodeRegistry();
        assertEquals(-1, registry.maxCode());
        assertEquals(0, registry.nextCode());
    }

    @Test
    void nextCodeFollowsTheHighestRegisteredCode() throws Exception {
        var registry = new ShortCodeRegistry();
        registry.register(0x20, site("a.ts", 1, "0x020"));
        registry.register(0x05, site("a.ts", 2, "0x005"));
        assertEquals(0x20, registry.maxCode());
        assertEquals(0x21, registry.nextCode());
        assertEquals(2, registry.size());
    }

    @Test
    void duplicateNamesBothSitesAndLeavesRegistryUnchanged() throws Exception {
        var registry = new ShortCodeRegistry();
        var original = site("a.ts", 3, "0x005");
        var duplicate = site("b.ts", 7, "0x005");
        registry.register(5, original);

        var e = assertThrows(DuplicateShortcodeException.class, () -> registry.register(5, duplicate));
        assertEquals(5, e.getCode());
        assertSame(original, e.getOriginal());
        assertSame(duplicate, e.getDuplicate());
        assertSame(original, registry.owner(5));
        assertEquals(1, registry.size());

        var problem = e.toProblem();
        assertEquals(TaggingProblem.Kind.DUPLICATE_SHORTCODE, problem.kind());
        assertEquals(2, problem.locations().size());
        assertTrue(problem.locations().get(0).endsWith("a.ts:3"), problem.render());
        assertTrue(problem.locations().get(1).endsWith("b.ts:7"), problem.render());
        assertTrue(problem.render().startsWith("Duplicate shortcode 0x005 detected\n\t"));
    }

    @Test
    void nextCodeRefusesToOverflow() throws Exception {
        var registry = new ShortCodeRegistry();
        registry.register(Integer.MAX_VALUE, site("a.ts", 1, "0x7fffffff"));
        assertEquals(Integer.MAX_VALUE, registry.maxCode());
        assertThrows(IllegalStateException.class, registry::nextCode);
    }

    @Test
    void maxCodeNeverDecreases() throws Exception {
        var registry = new ShortCodeRegistry();
        registry.register(9, site("a.ts", 1, "0x009"));
        registry.register(1, site("a.ts", 2, "0x001"));
        assertEquals(9, registry.maxCode());
    }
}
