package com.bashnorm.normalize;

import com.bashnorm.grammar.ArgType;
import com.bashnorm.raw.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentClassifierTest {

    private static final Set<ArgType> ALL = EnumSet.allOf(ArgType.class);

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "10, NUMBER",
            "+7d, TIME",
            "30m, TIME",
            "100k, SIZE",
            "2G, SIZE",
            "755, NUMBER",
            "u=rwx, PERMISSION",
            "/var/log, FILE",
            "'{}', RESERVED_WORD",
            "+, RESERVED_WORD",
            "';', RESERVED_WORD"
    })
    public void testClassifyAgainstAllTypes(String word, ArgType expected) {
        assertEquals(expected, ArgumentClassifier.classify(word, ALL));
    }

    @Test
    public void testNumberNeedsNumberSlot() {
        assertEquals(ArgType.PERMISSION, ArgumentClassifier.classify("644", EnumSet.of(ArgType.PERMISSION, ArgType.FILE)));
        assertEquals(ArgType.FILE, ArgumentClassifier.classify("644", EnumSet.of(ArgType.FILE)));
    }

    @Test
    public void testSuffixRequiresDigit() {
        assertEquals(ArgType.FILE, ArgumentClassifier.classify("bak", EnumSet.of(ArgType.SIZE, ArgType.TIME, ArgType.FILE)));
    }

    @Test
    public void testQuotedWordIsPattern() {
        // '*.txt' in the source, *.txt after unquoting
        assertEquals(ArgType.PATTERN,
                ArgumentClassifier.classify("*.txt", new Span(5, 12), EnumSet.of(ArgType.PATTERN, ArgType.FILE)));
    }

    @Test
    public void testUnquotedWordIsNotPattern() {
        assertEquals(ArgType.FILE,
                ArgumentClassifier.classify("notes.txt", new Span(5, 14), EnumSet.of(ArgType.PATTERN, ArgType.FILE)));
    }

    @Test
    public void testUtilityWhenNothingElseFits() {
        assertEquals(ArgType.UTILITY, ArgumentClassifier.classify("rm", EnumSet.of(ArgType.UTILITY)));
    }

    @Test
    public void testUnknownWhenNoTypeAllowed() {
        assertEquals(ArgType.UNKNOWN, ArgumentClassifier.classify("widget", EnumSet.noneOf(ArgType.class)));
    }

    @Test
    public void testReservedWordsIgnoreAllowedTypes() {
        assertEquals(ArgType.RESERVED_WORD, ArgumentClassifier.classify("{}", EnumSet.noneOf(ArgType.class)));
    }
}
