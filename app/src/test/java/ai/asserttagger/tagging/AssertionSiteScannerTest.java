package ai.asserttagger.tagging;

import static org.junit.jupiter.api.Assertions.*;

import ai.asserttagger.analyzer.ProjectFile;
import ai.asserttagger.analyzer.TypescriptParser;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssertionSiteScannerTest {

    @TempDir
    Path tempDir;

    private final TypescriptParser parser = new TypescriptParser();
    private final AssertionSiteScanner scanner = new AssertionSiteScanner(parser);
    private ProjectFile file;

    @BeforeEach
    void setUp() {
        file = new ProjectFile(tempDir.toAbsolutePath().normalize(), "src/index.ts");
    }

    private List<AssertionSite> scan(String source) {
        return scan(source, AssertionFunctionTable.DEFAULT);
    }

    private List<AssertionSite> scan(String source, AssertionFunctionTable table) {
        return scanner.scan(parser.parse(file, source), table);
    }

    private AssertionSite single(String source) {
        var sites = scan(source);
        assertEquals(1, sites.size(), () -> "expected one site in: " + source + " but got " + sites);
        return sites.get(0);
    }

    @Test
    void plainStringIsUntagged() {
        var site = single("assert(x, \"boom\");\n");
        assertEquals(SiteKind.UNTAGGED_LITERAL, site.kind());
        assertEquals("boom", site.message());
        assertEquals("\"boom\"", site.text());
        assertNull(site.problem());
    }

    @Test
    void singleQuotedAndNoSubstitutionTemplatesAreUntagged() {
        var sites = scan("""
                assert(a, 'single');
                assert(b, `template without substitutions`);
                """);
        assertEquals(2, sites.size());
        assertEquals(SiteKind.UNTAGGED_LITERAL, sites.get(0).kind());
        assertEquals("single", sites.get(0).message());
        assertEquals(SiteKind.UNTAGGED_LITERAL, sites.get(1).kind());
        assertEquals("template without substitutions", sites.get(1).message());
    }

    @Test
    void hexLiteralIsTaggedAndCommentBecomesMessage() {
        var site = single("assert(x, 0x005 /* foo */);\n");
        assertEquals(SiteKind.TAGGED_CODE, site.kind());
        assertEquals(5, site.code());
        assertEquals("foo", site.message());
    }

    @Test
    void taggedCodeWithoutCommentHasNoMessage() {
        var site = single("assert(x, 0x01f);\n");
        assertEquals(SiteKind.TAGGED_CODE, site.kind());
        assertEquals(0x1f, site.code());
        assertNull(site.message());
    }

    @Test
    void enclosingQuotesAreStrippedFromCommentMessage() {
        var sites = scan("""
                assert(a, 0x001 /* "quoted message" */);
                assert(b, 0x002 /* `backticked` */);
                assert(c, 0x003 /* keeps "inner" quotes */);
                assert(d, 0x004 /* "mismatched` */);
                """);
        assertEquals(List.of("quoted message", "backticked", "keeps \"inner\" quotes", "\"mismatched`"),
                sites.stream().map(AssertionSite::message).toList());
    }

    @Test
    void commentOpenerInsideMessageIsKept() {
        var sites = scan("""
                assert(a, 0x001 /* use a /* b style */);
                assert(b, "use a /* b style");
                """);
        assertEquals(SiteKind.TAGGED_CODE, sites.get(0).kind());
        assertEquals("use a /* b style", sites.get(0).message());
        assertEquals(SiteKind.UNTAGGED_LITERAL, sites.get(1).kind());
        assertEquals("use a /* b style", sites.get(1).message());
    }

    @Test
    void commentOnFollowingLineIsNotAMessage() {
        var site = single("""
                assert(
                    x,
                    0x007
                    /* unrelated */
                );
                """);
        assertEquals(SiteKind.TAGGED_CODE, site.kind());
        assertNull(site.message());
        assertEquals(3, site.line());
    }

    @Test
    void decimalLiteralIsMalformed() {
        var site = single("assert(x, 5);\n");
        assertEquals(SiteKind.UNSUPPORTED, site.kind());
        assertNotNull(site.problem());
        assertEquals(TaggingProblem.Kind.MALFORMED_SHORTCODE, site.problem().kind());
        assertTrue(site.problem().locations().get(0).endsWith("index.ts:1"));
    }

    @Test
    void interpolatedTemplateIsRejected() {
        var site = single("const y = 1;\nassert(x, `bad ${y}`);\n");
        assertEquals(SiteKind.INTERPOLATED_LITERAL, site.kind());
        assertNotNull(site.problem());
        assertEquals(TaggingProblem.Kind.UNSUPPORTED_INTERPOLATION, site.problem().kind());
        assertTrue(site.problem().render().contains("Use a string literal instead"));
        assertTrue(site.problem().locations().get(0).endsWith("index.ts:2"));
    }

    @Test
    void binaryAndCallMessagesPassThrough() {
        var sites = scan("""
                assert(a, "prefix" + suffix);
                assert(b, makeMessage());
                """);
        assertEquals(2, sites.size());
        assertTrue(sites.stream().allMatch(s -> s.kind() == SiteKind.PASS_THROUGH));
        assertTrue(sites.stream().allMatch(s -> s.problem() == null));
    }

    @Test
    void otherArgumentKindsAreUnsupported() {
        var site = single("assert(x, message);\n");
        assertEquals(SiteKind.UNSUPPORTED, site.kind());
        assertNotNull(site.problem());
        assertEquals(TaggingProblem.Kind.UNSUPPORTED_ARGUMENT_KIND, site.problem().kind());
        assertTrue(site.problem().message().contains("identifier"));
    }

    @Test
    void messageContainingCommentTerminatorIsUnsupported() {
        var site = single("assert(x, \"closes */ early\");\n");
        assertEquals(SiteKind.UNSUPPORTED, site.kind());
        assertNotNull(site.problem());
        assertEquals(TaggingProblem.Kind.UNSUPPORTED_ARGUMENT_KIND, site.problem().kind());
    }

    @Test
    void callsWithoutMessageOrWithOtherCalleesAreIgnored() {
        var sites = scan("""
                assert(x);
                console.assert(x, "not ours");
                check(x, "not in table");
                assert`tagged template`;
                """);
        assertTrue(sites.isEmpty(), () -> "unexpected sites " + sites);
    }

    @Test
    void customTableUsesConfiguredIndex() {
        var table = AssertionFunctionTable.DEFAULT.extendedWith(Map.of("fail", 0));
        var sites = scan("""
                fail("oops");
                assert(x, "still recognized");
                """, table);
        assertEquals(2, sites.size());
        assertEquals("oops", sites.get(0).message());
        assertEquals(SiteKind.UNTAGGED_LITERAL, sites.get(0).kind());
        assertEquals("still recognized", sites.get(1).message());
    }

    @Test
    void commentsDoNotCountAsArguments() {
        var site = single("assert(/* condition */ x, \"msg\");\n");
        assertEquals("msg", site.message());
    }

    @Test
    void sitesAreInDocumentOrderIncludingNestedCalls() {
        var sites = scan("""
                function f() {
                    assert(a, "first");
                    if (b) {
                        assert(c, "second");
                    }
                }
                assert(d, "third");
                """);
        assertEquals(List.of("first", "second", "third"), sites.stream().map(AssertionSite::message).toList());
        assertEquals(List.of(2, 4, 7), sites.stream().map(AssertionSite::line).toList());
    }

    @Test
    void byteOffsetsAccountForMultiByteCharacters() {
        var source = "const s = \"héllo wörld\";\nassert(x, \"naïve\");\n";
        var site = single(source);
        var bytes = source.getBytes(java.nio.charset.StandardCharsets.UTF_8);
        var slice = new String(bytes, site.startByte(), site.endByte() - site.startByte(),
                java.nio.charset.StandardCharsets.UTF_8);
        assertEquals("\"naïve\"", slice);
        assertEquals("naïve", site.message());
    }
}
