package com.bashnorm.normalize;

import com.bashnorm.grammar.GrammarLookup;
import com.bashnorm.raw.RawNode;
import com.bashnorm.tree.LogicOperators;
import com.bashnorm.tree.Node;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Turns a flag word into Flag nodes, splitting clustered short options
 * ({@code -la} into {@code -l} and {@code -a}).
 */
final class FlagSplitter {
    private final GrammarLookup grammar;

    FlagSplitter(GrammarLookup grammar) {
        this.grammar = grammar;
    }

    /**
     * Flags for {@code word} under {@code head}, in order. Only the first flag of
     * a split keeps the word's source span.
     */
    MutableList<Node.Flag> split(RawNode word, Node.HeadCommand head) {
        String text = word.word();
        if (!isSplittable(text, head)) {
            return Lists.mutable.of(new Node.Flag(text, word.pos()));
        }

        MutableList<Node.Flag> flags = Lists.mutable.empty();
        for (int i = 1; i < text.length(); i++) {
            RawNode option = i == 1 ? word : word.withoutPos();
            option = option.withWord("-" + text.charAt(i));
            flags.add(new Node.Flag(option.word(), option.pos()));
        }
        return flags;
    }

    boolean isSplittable(String text, Node.HeadCommand head) {
        return text.startsWith("-")
                && text.length() > 2
                && !grammar.isLongOption(text)
                && !(grammar.isPredicateCommand(head.value()) && LogicOperators.isOperator(text))
                && grammar.splitsFlags(head.value());
    }
}
