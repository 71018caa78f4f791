package com.bashnorm.normalize;

import com.bashnorm.error.Diagnostic;
import com.bashnorm.error.ErrorKind;
import com.bashnorm.error.NormalizationException;
import com.bashnorm.grammar.ArgSlot;
import com.bashnorm.grammar.ArgType;
import com.bashnorm.grammar.GrammarLookup;
import com.bashnorm.raw.ParsedCommand;
import com.bashnorm.raw.RawKind;
import com.bashnorm.raw.RawNode;
import com.bashnorm.tree.LogicOperators;
import com.bashnorm.tree.Node;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the external parser's tree of a shell command into a canonical tree.
 *
 * <p>A command's words are consumed left to right against an
 * {@link AttachmentState}: the first word is the head command, later words are
 * flags, flag arguments or positional arguments depending on the grammar.
 * Predicate-style commands are then handed to the {@link LogicOperatorResolver}.
 *
 * <p>Instances hold no per-call state and may be shared between threads.
 */
public final class Normalizer {
    private static final Logger logger = LoggerFactory.getLogger(Normalizer.class);
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final ImmutableSet<String> NUMERIC_FLAG_COMMANDS = Sets.immutable.of("head", "tail");
    private static final ImmutableSet<String> EMBEDDED_COMMAND_DELIMITERS = Sets.immutable.of(";", "+");
    private static final String DOUBLE_DASH = "--";

    private final GrammarLookup grammar;
    private final NormalizerOptions options;
    private final FlagSplitter flagSplitter;
    private final LogicOperatorResolver resolver = new LogicOperatorResolver();

    public Normalizer(GrammarLookup grammar, NormalizerOptions options) {
        this.grammar = grammar;
        this.options = options;
        this.flagSplitter = new FlagSplitter(grammar);
    }

    public Normalizer(GrammarLookup grammar) {
        this(grammar, NormalizerOptions.defaults());
    }

    public NormalizeResult normalize(ParsedCommand command) {
        if (command.isRejected()) {
            logger.debug("normalize.rejected reason={} command={}", command.rejection(), command.text());
            return new NormalizeResult.Failed(ErrorKind.PARSE_REJECTED, command.text(),
                    "Cannot parse: " + command.rejection());
        }
        return normalize(command.tree(), command.text());
    }

    /**
     * Normalizes one parsed command. Never throws: unsupported syntax and broken
     * structure come back as {@link NormalizeResult.Failed}.
     *
     * @param tree   the parser's tree, or {@code null} if the parser produced none
     * @param source the command text the tree's offsets point into
     */
    public NormalizeResult normalize(RawNode tree, String source) {
        if (tree == null) {
            return new NormalizeResult.Failed(ErrorKind.PARSE_REJECTED, source, "Cannot parse: no parse tree");
        }

        Pass pass = new Pass(source);
        Node.Root root = new Node.Root();
        try {
            pass.normalizeNode(tree, root, null);
            if (root.numChildren() > 1) {
                throw NormalizationException.structural("multiple root nodes");
            }
        } catch (NormalizationException e) {
            logger.debug("normalize.failed kind={} reason={} command={}", e.kind(), e.getMessage(), source);
            return new NormalizeResult.Failed(e.kind(), source, e.getMessage());
        }

        for (Diagnostic diagnostic : pass.diagnostics) {
            logger.debug("normalize.repair message={} command={}", diagnostic.message(), source);
        }
        return new NormalizeResult.Normalized(root, pass.diagnostics.toImmutable());
    }

    /** State of a single normalization call. */
    private final class Pass {
        private final String source;
        private final MutableList<Diagnostic> diagnostics = Lists.mutable.empty();

        Pass(String source) {
            this.source = source;
        }

        void normalizeNode(RawNode node, Node current, ArgType argType) {
            switch (node.kind()) {
                case WORD -> normalizeWord(node, current, argType);
                case PIPELINE -> normalizePipeline(node, current);
                case LIST -> {
                    // a single command followed by ';' or '&'
                    if (node.parts().size() > 2) {
                        throw NormalizationException.unsupported("list of length >= 2");
                    }
                    if (node.parts().isEmpty()) {
                        throw NormalizationException.structural("empty list");
                    }
                    normalizeNode(node.parts().getFirst(), current, argType);
                }
                case COMMANDSUBSTITUTION, PROCESSSUBSTITUTION -> {
                    if (node.command() == null) {
                        throw NormalizationException.structural(node.kind().jsonName() + " without a command");
                    }
                    normalizeNode(node.command(), current, null);
                }
                case COMMAND -> normalizeCommand(node, current);
                default -> throw NormalizationException.unsupported(node.kind().jsonName());
            }
        }

        private void normalizeWord(RawNode word, Node current, ArgType argType) {
            if (!word.hasParts()) {
                attachArgument(word, current, argType);
                return;
            }
            RawKind first = word.parts().getFirst().kind();
            switch (first) {
                case PROCESSSUBSTITUTION -> {
                    Node.ProcessSubstitution wrapper =
                            new Node.ProcessSubstitution(word.word().startsWith(">") ? ">" : "<");
                    current.addChild(wrapper);
                    word.parts().each(part -> normalizeNode(part, wrapper, null));
                }
                case COMMANDSUBSTITUTION -> {
                    Node.CommandSubstitution wrapper = new Node.CommandSubstitution();
                    current.addChild(wrapper);
                    word.parts().each(part -> normalizeNode(part, wrapper, null));
                }
                case PARAMETER, TILDE -> attachArgument(word, current, argType);
                default -> word.parts().each(part -> normalizeNode(part, current, argType));
            }
        }

        private void normalizePipeline(RawNode pipeline, Node current) {
            if (pipeline.parts().size() % 2 == 0) {
                throw NormalizationException.structural("pipeline node must have an odd number of parts");
            }
            Node.Pipeline node = new Node.Pipeline();
            current.addChild(node);
            for (RawNode part : pipeline.parts()) {
                if (part.kind() == RawKind.COMMAND) {
                    normalizeNode(part, node, null);
                } else if (part.kind() != RawKind.PIPE) {
                    throw NormalizationException.unsupported(part.kind().jsonName() + " inside a pipeline");
                }
            }
        }

        private void normalizeCommand(RawNode command, Node current) {
            CommandScope scope = new CommandScope(current);
            ImmutableList<RawNode> parts = command.parts();
            int i = 0;
            while (i < parts.size()) {
                RawNode part = parts.get(i);
                if (part.kind() != RawKind.WORD) {
                    throw NormalizationException.unsupported(part.kind().jsonName());
                }
                i = attachWord(scope, parts, i);
            }

            if (scope.head == null) {
                throw NormalizationException.structural("command without a head command");
            }
            if (scope.state.expectsFlagArgument() && scope.state.argTypes().contains(ArgType.UTILITY)) {
                throw NormalizationException.structural(scope.state.point().value() + " without an embedded command");
            }
            if (grammar.isPredicateCommand(scope.head.value())) {
                resolver.resolve(scope.head, diagnostics);
            }
            insertImplicitArgument(scope);
        }

        /** Attaches {@code parts[index]} and returns the index of the next unconsumed part. */
        private int attachWord(CommandScope scope, ImmutableList<RawNode> parts, int index) {
            RawNode word = parts.get(index);
            AttachmentState state = scope.state;

            if (state.expectsHeadCommand()) {
                attachHeadCommand(scope, word);
                return index + 1;
            }

            if (state.expectsFlagArgument()) {
                Node.Flag flag = (Node.Flag) state.point();
                ArgType type = state.argTypes().iterator().next();
                scope.state = scope.commandLevel();
                if (type == ArgType.UTILITY) {
                    return attachDelimitedCommand(flag, parts, index);
                }
                normalizeNode(word, flag, type);
                return index + 1;
            }

            String text = word.word();
            if (state.accepts(AttachmentState.Expect.FLAG)) {
                if (isPredicateContext(scope.head) && attachLogicOperator(scope.head, text)) {
                    return index + 1;
                }
                if (DOUBLE_DASH.equals(text)) {
                    // kept so the regenerated command still ends option parsing
                    scope.head.addChild(new Node.Flag(text, word.pos()));
                    scope.optionsEnded = true;
                    scope.state = scope.commandLevel();
                    return index + 1;
                }
                if (isFlag(text, scope.head)) {
                    attachFlags(scope, word);
                    return index + 1;
                }
            }

            if (scope.slots.expecting(ArgType.UTILITY)) {
                // the rest of the command line is the utility's own command (xargs, sh)
                MutableList<RawNode> rest = Lists.mutable.empty();
                for (int j = index; j < parts.size(); j++) {
                    rest.add(parts.get(j));
                }
                Node.Root nested = new Node.Root();
                scope.head.addChild(nested);
                normalizeCommand(RawNode.command(rest.toImmutable()), nested);
                return parts.size();
            }
            attachPositionalArgument(scope, word);
            return index + 1;
        }

        private void attachHeadCommand(CommandScope scope, RawNode word) {
            if (scope.head != null) {
                throw NormalizationException.structural("multiple head commands in one command");
            }
            Node.HeadCommand head = new Node.HeadCommand(word.word(), word.pos());
            scope.attachPoint.addChild(head);
            scope.head = head;
            scope.slots = new ArgumentSlots(grammar.argTypesFor(head.value()));
            scope.state = AttachmentState.flagsOrArguments(head);
        }

        private boolean attachLogicOperator(Node.HeadCommand head, String text) {
            if (LogicOperatorResolver.OPEN.equals(text) || LogicOperatorResolver.CLOSE.equals(text)) {
                head.addChild(new Node.Argument(text, ArgType.RESERVED_WORD));
                return true;
            }
            if (LogicOperators.isUnary(text)) {
                head.addChild(new Node.UnaryLogicOp(text));
                return true;
            }
            if (LogicOperators.isBinary(text)) {
                head.addChild(new Node.BinaryLogicOp(LogicOperators.canonicalBinary(text)));
                return true;
            }
            return false;
        }

        private void attachFlags(CommandScope scope, RawNode word) {
            MutableList<Node.Flag> flags = flagSplitter.split(word, scope.head);
            if (flags.size() > 1) {
                logger.debug("normalize.flag.split flag={} into={}", word.word(), flags.collect(Node::value));
            }
            flags.each(scope.head::addChild);

            Node.Flag last = flags.getLast();
            Optional<ArgType> argType = grammar.flagArgTypeFor(scope.head.value(), last.value());
            scope.state = argType
                    .map(type -> AttachmentState.argumentOf(last, type))
                    .orElseGet(scope::commandLevel);
        }

        private void attachPositionalArgument(CommandScope scope, RawNode word) {
            if (isSubstitution(word)) {
                normalizeNode(word, scope.head, null);
                return;
            }
            Set<ArgType> open = scope.slots.openTypes();
            ArgType type = ArgumentClassifier.classify(word.word(), word.pos(), open);
            if (type == ArgType.UNKNOWN) {
                diagnostics.add(Diagnostic.repair("unable to decide type for '" + word.word()
                        + "' of " + scope.head.value() + ", using Unknown"));
            }
            scope.slots.fill(type);
            normalizeNode(word, scope.head, type);
        }

        /**
         * Normalizes the words from {@code start} up to a {@code ;} or {@code +}
         * as the embedded command of {@code flag} and records the delimiter on it.
         */
        private int attachDelimitedCommand(Node.Flag flag, ImmutableList<RawNode> parts, int start) {
            MutableList<RawNode> slice = Lists.mutable.empty();
            String delimiter = null;
            int end = start;
            while (end < parts.size()) {
                RawNode part = parts.get(end);
                if (part.kind() == RawKind.WORD && EMBEDDED_COMMAND_DELIMITERS.contains(part.word())) {
                    delimiter = part.word();
                    break;
                }
                slice.add(part);
                end++;
            }
            if (delimiter == null) {
                diagnostics.add(Diagnostic.repair(flag.value() + " missing terminating ';'"));
                delimiter = ";";
            }

            Node.Root nested = new Node.Root();
            flag.addChild(nested);
            normalizeCommand(RawNode.command(slice.toImmutable()), nested);
            flag.recordDelimiter(delimiter);
            return end + 1;
        }

        private void attachArgument(RawNode word, Node current, ArgType argType) {
            current.addChild(new Node.Argument(normalizeArgumentText(word, argType), argType, word.pos()));
        }

        private String normalizeArgumentText(RawNode word, ArgType argType) {
            String text = options.recoverQuotation() ? QuoteRecovery.recover(word, source) : word.word();
            if (argType == ArgType.PERMISSION) {
                return text;
            }
            if (text.indexOf(' ') >= 0) {
                if (!QuoteRecovery.isQuoted(word, source)) {
                    diagnostics.add(Diagnostic.repair("space inside unquoted word " + text));
                }
                if (options.normalizeLongPatterns()) {
                    text = options.longPatternPlaceholder();
                }
            }
            if (options.normalizeDigits()) {
                text = DIGITS.matcher(text).replaceAll(Matcher.quoteReplacement(options.numberPlaceholder()));
            }
            return text;
        }

        /** Gives a command with options but no positional argument its implicit one ({@code find -name x}). */
        private void insertImplicitArgument(CommandScope scope) {
            Node.HeadCommand head = scope.head;
            Optional<String> implicit = grammar.implicitArgumentFor(head.value());
            if (implicit.isEmpty() || !head.hasChildren()
                    || head.children().anySatisfy(Normalizer::isPositional)) {
                return;
            }
            ArgType type = ArgumentClassifier.classify(implicit.get(), grammar.argTypesFor(head.value())
                    .collect(ArgSlot::type).toSet());
            head.insertChild(0, new Node.Argument(implicit.get(), type));
        }

        private boolean isFlag(String text, Node.HeadCommand head) {
            if (!text.startsWith("-") || text.length() < 2) {
                return false;
            }
            // head -10, tail -5
            return !(NUMERIC_FLAG_COMMANDS.contains(head.value()) && isDigits(text.substring(1)));
        }

        private boolean isPredicateContext(Node.HeadCommand head) {
            return grammar.isPredicateCommand(head.value());
        }
    }

    /** Per-command attachment bookkeeping. */
    private static final class CommandScope {
        private final Node attachPoint;
        private Node.HeadCommand head;
        private ArgumentSlots slots;
        private AttachmentState state;
        private boolean optionsEnded;

        CommandScope(Node attachPoint) {
            this.attachPoint = attachPoint;
            this.state = AttachmentState.headCommand(attachPoint);
        }

        AttachmentState commandLevel() {
            return optionsEnded ? AttachmentState.argumentsOnly(head) : AttachmentState.flagsOrArguments(head);
        }
    }

    private static boolean isSubstitution(RawNode word) {
        if (!word.hasParts()) {
            return false;
        }
        RawKind first = word.parts().getFirst().kind();
        return first == RawKind.COMMANDSUBSTITUTION || first == RawKind.PROCESSSUBSTITUTION;
    }

    private static boolean isPositional(Node child) {
        return child instanceof Node.Argument
                || child instanceof Node.CommandSubstitution
                || child instanceof Node.ProcessSubstitution;
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
