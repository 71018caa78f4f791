package com.bashnorm.normalize;

import com.bashnorm.grammar.JsonGrammarLookup;
import com.bashnorm.raw.RawNode;
import com.bashnorm.raw.Span;
import com.bashnorm.tree.Node;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FlagSplitterTest {

    private final FlagSplitter splitter = new FlagSplitter(JsonGrammarLookup.bundled());

    private MutableList<Node.Flag> split(String word, String head) {
        return splitter.split(RawNode.word(word, new Span(0, word.length())), new Node.HeadCommand(head));
    }

    @Test
    public void testClusterIsSplitInOrder() {
        MutableList<Node.Flag> flags = split("-rvf", "rm");

        assertEquals("[-r, -v, -f]", flags.collect(Node::value).toString());
        assertEquals(new Span(0, 4), flags.get(0).span());
        assertNull(flags.get(1).span());
        assertNull(flags.get(2).span());
    }

    @Test
    public void testSingleShortFlagIsKept() {
        MutableList<Node.Flag> flags = split("-l", "ls");

        assertEquals(1, flags.size());
        assertEquals("-l", flags.getFirst().value());
    }

    @Test
    public void testLongOptionIsKept() {
        assertEquals(1, split("--recursive", "grep").size());
    }

    @Test
    public void testCommandThatForbidsSplitting() {
        MutableList<Node.Flag> flags = split("-name", "find");

        assertEquals(1, flags.size());
        assertEquals("-name", flags.getFirst().value());
    }

    @Test
    public void testOperatorSpellingSplitsOutsidePredicateCommands() {
        assertEquals("[-n, -o, -t]", split("-not", "ls").collect(Node::value).toString());
        assertEquals("[-a, -n, -d]", split("-and", "ls").collect(Node::value).toString());
        assertTrue(splitter.isSplittable("-or", new Node.HeadCommand("grep")));
    }

    @Test
    public void testLogicOperatorIsNotSplittableInPredicateCommand() {
        assertFalse(splitter.isSplittable("-not", new Node.HeadCommand("find")));
        assertFalse(splitter.isSplittable("-and", new Node.HeadCommand("find")));
    }

    @Test
    public void testUnknownCommandSplits() {
        assertEquals(3, split("-abc", "frobnicate").size());
    }
}
