package com.bashnorm.output;

import com.bashnorm.error.ErrorKind;
import com.bashnorm.error.NormalizationException;
import com.bashnorm.grammar.ArgType;
import com.bashnorm.grammar.JsonGrammarLookup;
import com.bashnorm.normalize.Normalizer;
import com.bashnorm.raw.RawTrees;
import com.bashnorm.tree.Node;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenCodecTest {

    private static JsonGrammarLookup grammar;
    private static Normalizer normalizer;
    private static TokenCodec codec;

    @BeforeAll
    static void setUp() {
        grammar = JsonGrammarLookup.bundled();
        normalizer = new Normalizer(grammar);
        codec = new TokenCodec(grammar);
    }

    private static Node.Root tree(String command) {
        return normalizer.normalize(RawTrees.parse(command), command).tree();
    }

    private static String surface(String command) {
        return codec.toCommand(tree(command), TokenOptions.strict());
    }

    // ============================================================
    // Surface tokens
    // ============================================================

    @Test
    public void testSplitFlagsAreSeparateTokens() {
        assertEquals("ls -l -a /tmp", surface("ls -la /tmp"));
    }

    @Test
    public void testBinaryOperatorIsBracketed() {
        assertEquals("find . \\( -name '*.txt' -or -iname '*.TXT' \\)",
                surface("find . -name '*.txt' -o -iname '*.TXT'"));
    }

    @Test
    public void testPruneFollowsItsOperand() {
        assertEquals("find . \\( -name .git -prune -or -print \\)",
                surface("find . -name .git -prune -o -print"));
    }

    @Test
    public void testNegationPrecedesItsOperand() {
        assertEquals("find . ! -name '*.bak'", surface("find . ! -name '*.bak'"));
    }

    @Test
    public void testEmbeddedCommandKeepsDelimiter() {
        assertEquals("find . -name '*.log' -exec rm {} \\;", surface("find . -name '*.log' -exec rm {} \\;"));
        assertEquals("find . -exec grep -l TODO {} + -print", surface("find . -exec grep -l TODO {} + -print"));
    }

    @Test
    public void testPipelineAndSubstitutions() {
        assertEquals("cat access.log | sort | wc -l", surface("cat access.log | sort | wc -l"));
        assertEquals("rm $( find . -name '*.o' )", surface("rm $(find . -name '*.o')"));
        assertEquals("cat <( ls /tmp )", surface("cat <(ls /tmp)"));
    }

    @Test
    public void testDoubleDashIsRegenerated() {
        assertEquals("ls -- -la", surface("ls -- -la"));
        assertEquals(surface("ls -- -la"), surface(surface("ls -- -la")));
    }

    @Test
    public void testSubstitutedSearchPathGetsNoImplicitPath() {
        assertEquals("find $( pwd ) -name x", surface("find $(pwd) -name x"));
    }

    @Test
    public void testShellCommandUnderXargs() {
        assertEquals("find . -type f | xargs sh -c _LONG_PATTERN", surface("find . -type f | xargs sh -c 'wc -l'"));
    }

    @Test
    public void testDigitsAreNormalized() {
        assertEquals("head -n _NUM file.txt", surface("head -n 10 file.txt"));
    }

    @Test
    public void testTokensAreListed() {
        MutableList<String> tokens = codec.toTokens(tree("ls -la /tmp"), TokenOptions.strict());

        assertEquals(List.of("ls", "-l", "-a", "/tmp"), tokens);
    }

    @Test
    public void testNullTreeHasNoTokens() {
        assertTrue(codec.toTokens(null, TokenOptions.strict()).isEmpty());
    }

    // ============================================================
    // Token options
    // ============================================================

    @Test
    public void testArgTypeOnly() {
        TokenOptions options = TokenOptions.strict().withArgTypeOnly(true);

        assertEquals("head -n Number File", codec.toCommand(tree("head -n 10 file.txt"), options));
        assertEquals("find File -exec rm {} \\;",
                codec.toCommand(tree("find . -exec rm {} \\;"), options));
    }

    @Test
    public void testArgTypeSymbols() {
        TokenOptions options = TokenOptions.strict().withArgTypeSymbols(true);

        assertEquals("head -n ARGUMENT__NUM ARGUMENT_file.txt", codec.toCommand(tree("head -n 10 file.txt"), options));
    }

    @Test
    public void testIgnoreFlagOrder() {
        TokenOptions options = TokenOptions.strict().withIgnoreFlagOrder(true);

        assertEquals(codec.toCommand(tree("ls /tmp -l -a"), options), codec.toCommand(tree("ls -a /tmp -l"), options));
        assertEquals("ls -a -l /tmp", codec.toCommand(tree("ls /tmp -l -a"), options));
    }

    // ============================================================
    // Structural constraints
    // ============================================================

    @Test
    public void testStrictRejectsRootWithTwoCommands() {
        Node.Root root = new Node.Root();
        root.addChild(new Node.HeadCommand("ls"));
        root.addChild(new Node.HeadCommand("pwd"));

        NormalizationException e = assertThrows(NormalizationException.class,
                () -> codec.toTokens(root, TokenOptions.strict()));
        assertEquals(ErrorKind.STRUCTURAL_INCONSISTENCY, e.kind());
        assertEquals("ls pwd", codec.toCommand(root, TokenOptions.loose()));
    }

    @Test
    public void testStrictRejectsBinaryWithOneOperand() {
        Node.Root root = new Node.Root();
        Node.HeadCommand find = new Node.HeadCommand("find");
        root.addChild(find);
        Node.BinaryLogicOp or = new Node.BinaryLogicOp("-or");
        find.addChild(or);
        or.addChild(new Node.Flag("-print"));

        assertThrows(NormalizationException.class, () -> codec.toTokens(root, TokenOptions.strict()));
        assertEquals("find -print", codec.toCommand(root, TokenOptions.loose()));
    }

    @Test
    public void testStrictRejectsArgumentWithChildren() {
        Node.Root root = new Node.Root();
        Node.HeadCommand ls = new Node.HeadCommand("ls");
        root.addChild(ls);
        Node.Argument file = new Node.Argument("/tmp", ArgType.FILE);
        ls.addChild(file);
        file.addChild(new Node.Flag("-l"));

        assertThrows(NormalizationException.class, () -> codec.toTokens(root, TokenOptions.strict()));
        assertEquals("ls /tmp -l", codec.toCommand(root, TokenOptions.loose()));
    }

    @Test
    public void testLooseEmptyPipeline() {
        Node.Root root = new Node.Root();
        root.addChild(new Node.Pipeline());

        assertEquals("|", codec.toCommand(root, TokenOptions.loose()));
        assertThrows(NormalizationException.class, () -> codec.encode(root));
    }

    // ============================================================
    // Prefix encoding
    // ============================================================

    @Test
    public void testEncode() {
        assertEquals(List.of("ROOT_root", "HEADCOMMAND_ls", "FLAG_-l", TokenCodec.POP,
                        "ARGUMENT_/tmp", TokenCodec.POP, TokenCodec.POP, TokenCodec.POP),
                codec.encode(tree("ls -l /tmp")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "ls -la /tmp",
            "head -n 10 file.txt",
            "chmod 755 script.sh",
            "grep \"error\" app.log",
            "find . -name '*.txt' -o -iname '*.TXT'",
            "find . -name .git -prune -o -print",
            "find . ! \\( -name a -o -name b \\) -type f",
            "find . -name '*.log' -exec rm {} \\;",
            "find . -type f | xargs -n 2 rm -f",
            "xargs sh -c 'wc -l'",
            "rm -f -- -weird",
            "cat <(ls /tmp) >(wc -l)",
            "rm $(find . -name '*.o')",
            "tar -xzf archive.tar.gz"
    })
    public void testDecodeRebuildsEncodedTree(String command) {
        Node.Root original = tree(command);

        Node.Root decoded = codec.decode(codec.encode(original));

        assertTrue(original.sameShape(decoded, false), () -> "Expected\n" + original + "\nbut got\n" + decoded);
    }

    @Test
    public void testDecodeDerivesArgumentTypes() {
        Node.Root decoded = codec.decode(List.of("HEADCOMMAND_chmod", "ARGUMENT_755", TokenCodec.POP,
                "ARGUMENT_run.sh", TokenCodec.POP, TokenCodec.POP));

        Node chmod = decoded.firstChild();
        assertEquals(ArgType.PERMISSION, ((Node.Argument) chmod.child(0)).argType());
        assertEquals(ArgType.FILE, ((Node.Argument) chmod.child(1)).argType());
    }

    @Test
    public void testDecodeFlagArgumentType() {
        Node.Root decoded = codec.decode(List.of("HEADCOMMAND_head", "FLAG_-n", "ARGUMENT__NUM",
                TokenCodec.POP, TokenCodec.POP, TokenCodec.POP));

        Node.Argument count = (Node.Argument) decoded.firstChild().firstChild().firstChild();
        assertEquals("_NUM", count.value());
        assertEquals(ArgType.NUMBER, count.argType());
    }

    @Test
    public void testDecodeStopsWhenCursorLeavesRoot() {
        Node.Root decoded = codec.decode(List.of("HEADCOMMAND_ls", "FLAG_-l", TokenCodec.POP, "garbage",
                TokenCodec.POP, TokenCodec.POP, TokenCodec.POP, "HEADCOMMAND_cat"));

        assertEquals(1, decoded.numChildren());
        Node ls = decoded.firstChild();
        assertEquals(2, ls.numChildren());
        Node.Argument garbage = (Node.Argument) ls.child(1);
        assertEquals("garbage", garbage.value());
        assertEquals(ArgType.UNKNOWN, garbage.argType());
    }

    @Test
    public void testDecodeToleratesMissingPops() {
        Node.Root decoded = codec.decode(List.of("ROOT_root", "HEADCOMMAND_ls", "FLAG_-l"));

        assertEquals("-l", decoded.firstChild().firstChild().value());
        assertEquals("ls -l", codec.toCommand(decoded, TokenOptions.strict()));
    }

    @Test
    public void testDecodeEmptyStream() {
        assertFalse(codec.decode(List.of()).hasChildren());
    }
}
