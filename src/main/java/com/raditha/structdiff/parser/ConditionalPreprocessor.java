package com.raditha.structdiff.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates line-oriented conditional compilation directives.
 * <p>
 * Supported: {@code #if}, {@code #elif}, {@code #else}, {@code #endif}, {@code #define},
 * {@code #undef}. Expressions use symbols, {@code true}, {@code false}, {@code !},
 * {@code &&}, {@code ||}, {@code ==}, {@code !=} and parentheses.
 * <p>
 * Directive lines and inactive lines are blanked, line terminators are kept, so every
 * active line keeps its line number and columns.
 */
public class ConditionalPreprocessor {

    private static final Pattern DIRECTIVE = Pattern.compile(
            "^\\s*#\\s*(if|elif|else|endif|define|undef)(?![\\w$])(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SYMBOL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * One open {@code #if} block.
     */
    private static final class Block {
        final int line;
        final boolean parentActive;
        boolean branchTaken;
        boolean active;
        boolean elseSeen;

        Block(int line, boolean parentActive, boolean active) {
            this.line = line;
            this.parentActive = parentActive;
            this.active = active;
            this.branchTaken = active;
        }
    }

    /**
     * Preprocessed text together with the lines that were blanked.
     *
     * @param text         The input with directive and inactive lines blanked
     * @param blankedLines 1-based numbers of the directive and inactive lines
     */
    public record Result(String text, BitSet blankedLines) {
    }

    /**
     * Return {@code text} with inactive code blanked out.
     *
     * @throws SourceParseException on unbalanced directives or malformed expressions
     */
    public String process(String text, Set<String> activeSymbols) throws SourceParseException {
        return preprocess(text, activeSymbols).text();
    }

    /**
     * Blank directive and inactive lines, recording which lines were blanked.
     *
     * @throws SourceParseException on unbalanced directives or malformed expressions
     */
    public Result preprocess(String text, Set<String> activeSymbols) throws SourceParseException {
        Set<String> symbols = new HashSet<>(activeSymbols);
        Deque<Block> blocks = new ArrayDeque<>();
        StringBuilder out = new StringBuilder(text.length());
        BitSet blanked = new BitSet();

        int lineNumber = 0;
        for (String[] line : splitLines(text)) {
            lineNumber++;
            String content = line[0];
            String terminator = line[1];
            boolean active = blocks.isEmpty() || blocks.peek().active;

            Matcher m = DIRECTIVE.matcher(content);
            if (!m.matches()) {
                if (active) {
                    out.append(content);
                } else {
                    blanked.set(lineNumber);
                }
                out.append(terminator);
                continue;
            }
            blanked.set(lineNumber);

            String keyword = m.group(1).toLowerCase(Locale.ROOT);
            String argument = stripComment(m.group(2)).trim();

            switch (keyword) {
                case "if" -> {
                    boolean condition = evaluate(argument, symbols, lineNumber);
                    blocks.push(new Block(lineNumber, active, active && condition));
                }
                case "elif" -> {
                    Block block = requireOpen(blocks, "#elif", lineNumber);
                    if (block.elseSeen) {
                        throw error("#elif after #else", lineNumber);
                    }
                    boolean condition = evaluate(argument, symbols, lineNumber);
                    block.active = block.parentActive && !block.branchTaken && condition;
                    block.branchTaken |= block.active;
                }
                case "else" -> {
                    Block block = requireOpen(blocks, "#else", lineNumber);
                    if (block.elseSeen) {
                        throw error("#else after #else", lineNumber);
                    }
                    block.elseSeen = true;
                    block.active = block.parentActive && !block.branchTaken;
                    block.branchTaken = true;
                }
                case "endif" -> requireOpen(blocks, "#endif", lineNumber);
                case "define" -> {
                    String symbol = requireSymbol(argument, "#define", lineNumber);
                    if (active) {
                        symbols.add(symbol);
                    }
                }
                case "undef" -> {
                    String symbol = requireSymbol(argument, "#undef", lineNumber);
                    if (active) {
                        symbols.remove(symbol);
                    }
                }
                default -> throw error("unknown directive #" + keyword, lineNumber);
            }
            if ("endif".equals(keyword)) {
                blocks.pop();
            }
            out.append(terminator);
        }

        if (!blocks.isEmpty()) {
            throw error("missing #endif for #if", blocks.peek().line);
        }
        return new Result(out.toString(), blanked);
    }

    private static Block requireOpen(Deque<Block> blocks, String directive, int line) throws SourceParseException {
        if (blocks.isEmpty()) {
            throw error(directive + " without matching #if", line);
        }
        return blocks.peek();
    }

    private static String requireSymbol(String argument, String directive, int line) throws SourceParseException {
        if (!SYMBOL.matcher(argument).matches()) {
            throw error(directive + " expects a single symbol but got '" + argument + "'", line);
        }
        return argument;
    }

    private static String stripComment(String argument) {
        int comment = argument.indexOf("//");
        return comment < 0 ? argument : argument.substring(0, comment);
    }

    private static SourceParseException error(String message, int line) {
        return new SourceParseException("Line " + line + ": " + message);
    }

    /**
     * Split into [content, terminator] pairs; the terminator is "\n", "\r\n", "\r" or "".
     */
    static List<String[]> splitLines(String text) {
        List<String[]> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                int end = i;
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                lines.add(new String[] { text.substring(start, end), text.substring(end, i + 1) });
                start = i + 1;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(new String[] { text.substring(start), "" });
        }
        return lines;
    }

    static boolean evaluate(String expression, Set<String> symbols, int line) throws SourceParseException {
        if (expression.isEmpty()) {
            throw error("missing condition", line);
        }
        return new ExpressionParser(expression, symbols, line).parse();
    }

    /**
     * Recursive descent over {@code or := and ('||' and)*}, {@code and := eq ('&&' eq)*},
     * {@code eq := unary (('=='|'!=') unary)*}, {@code unary := '!' unary | primary}.
     */
    private static final class ExpressionParser {
        private static final Pattern TOKEN = Pattern.compile("\\s*([A-Za-z_][A-Za-z0-9_]*|&&|\\|\\||==|!=|!|\\(|\\))");

        private final List<String> tokens = new ArrayList<>();
        private final Set<String> symbols;
        private final String expression;
        private final int line;
        private int pos;

        ExpressionParser(String expression, Set<String> symbols, int line) throws SourceParseException {
            this.expression = expression;
            this.symbols = symbols;
            this.line = line;
            Matcher m = TOKEN.matcher(expression);
            int index = 0;
            while (index < expression.length()) {
                if (!m.find(index) || m.start() != index) {
                    if (expression.substring(index).isBlank()) {
                        break;
                    }
                    throw fail("unexpected character at offset " + index);
                }
                tokens.add(m.group(1));
                index = m.end();
            }
        }

        boolean parse() throws SourceParseException {
            boolean value = or();
            if (pos != tokens.size()) {
                throw fail("unexpected '" + tokens.get(pos) + "'");
            }
            return value;
        }

        private boolean or() throws SourceParseException {
            boolean value = and();
            while (accept("||")) {
                boolean right = and();
                value = value || right;
            }
            return value;
        }

        private boolean and() throws SourceParseException {
            boolean value = equality();
            while (accept("&&")) {
                boolean right = equality();
                value = value && right;
            }
            return value;
        }

        private boolean equality() throws SourceParseException {
            boolean value = unary();
            while (true) {
                if (accept("==")) {
                    value = value == unary();
                } else if (accept("!=")) {
                    value = value != unary();
                } else {
                    return value;
                }
            }
        }

        private boolean unary() throws SourceParseException {
            if (accept("!")) {
                return !unary();
            }
            return primary();
        }

        private boolean primary() throws SourceParseException {
            if (pos >= tokens.size()) {
                throw fail("unexpected end of expression");
            }
            String token = tokens.get(pos++);
            if ("(".equals(token)) {
                boolean value = or();
                if (!accept(")")) {
                    throw fail("missing ')'");
                }
                return value;
            }
            if ("true".equals(token)) {
                return true;
            }
            if ("false".equals(token)) {
                return false;
            }
            if (SYMBOL.matcher(token).matches()) {
                return symbols.contains(token);
            }
            throw fail("unexpected '" + token + "'");
        }

        private boolean accept(String token) {
            if (pos < tokens.size() && tokens.get(pos).equals(token)) {
                pos++;
                return true;
            }
            return false;
        }

        private SourceParseException fail(String message) {
            return error("malformed condition '" + expression + "': " + message, line);
        }
    }
}
