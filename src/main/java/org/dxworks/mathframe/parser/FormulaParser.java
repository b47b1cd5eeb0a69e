package org.dxworks.mathframe.parser;

import org.dxworks.mathframe.model.BigOperatorNode;
import org.dxworks.mathframe.model.FractionNode;
import org.dxworks.mathframe.model.IntegralNode;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.RowNode;
import org.dxworks.mathframe.model.ScalingFenceNode;
import org.dxworks.mathframe.model.ScriptNode;
import org.dxworks.mathframe.model.SqrtNode;
import org.dxworks.mathframe.model.TextNode;

import java.util.Set;

/**
 * Recursive-descent parser from LaTeX-like markup to a {@link RowNode} tree.
 * <p>
 * The parser never fails: unknown commands become a {@code ?} glyph, missing
 * arguments fall back to a single character and an unmatched {@code \left}
 * runs to the end of the input. Parsing stops quietly at an unmatched
 * closing brace or bracket.
 * <p>
 * Command arguments are handed to a fresh parser over their own substring, so
 * no cursor state is shared between nesting levels.
 */
public class FormulaParser {

    private static final String SUM_GLYPH = "∑";
    private static final String LEFT = "\\left";
    private static final String RIGHT = "\\right";

    private static final Set<String> FUNCTION_NAMES = Set.of(
            "sin", "cos", "tan", "log", "ln", "lg", "exp", "sinh", "cosh", "asin", "acos");

    private final String source;
    private final int fontSize;
    private final SymbolTable symbols;
    private int pos;

    public FormulaParser(String source, int fontSize) {
        this(source, fontSize, SymbolTable.standard());
    }

    public FormulaParser(String source, int fontSize, SymbolTable symbols) {
        this.source = source == null ? "" : source;
        this.fontSize = fontSize;
        this.symbols = symbols;
    }

    public static RowNode parse(String markup, int baseFontSize) {
        return new FormulaParser(markup, baseFontSize).parse();
    }

    public RowNode parse() {
        RowNode row = new RowNode();
        while (pos < source.length()) {
            char c = peek();
            if (c == '}' || c == ']') {
                break;
            }
            MathNode item = parseItem();
            if (item != null) {
                row.add(attachScripts(item));
            }
        }
        return row;
    }

    private char peek() {
        return pos < source.length() ? source.charAt(pos) : 0;
    }

    private char next() {
        return pos < source.length() ? source.charAt(pos++) : 0;
    }

    private int peekCodePoint() {
        return pos < source.length() ? source.codePointAt(pos) : 0;
    }

    /**
     * Consumes one whole code point, so surrogate pairs are never split.
     */
    private String nextCodePoint() {
        if (atEnd()) {
            return "";
        }
        int codePoint = source.codePointAt(pos);
        pos += Character.charCount(codePoint);
        return new String(Character.toChars(codePoint));
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private FormulaParser subParser(String text, int size) {
        return new FormulaParser(text, size, symbols);
    }

    private MathNode parseItem() {
        if (atEnd()) {
            return null;
        }
        int c = peekCodePoint();
        String item = nextCodePoint();

        if (c == '\\') {
            return parseCommand();
        }

        if (Character.isDigit(c)) {
            StringBuilder number = new StringBuilder(item);
            while (Character.isDigit(peekCodePoint()) || peek() == '.') {
                number.append(nextCodePoint());
            }
            return new TextNode(number.toString(), false, fontSize);
        }

        if (Character.isLetter(c)) {
            return new TextNode(item, true, fontSize);
        }

        return new TextNode(item, false, fontSize);
    }

    /**
     * Consumes every {@code ^} and {@code _} directly following an item.
     * Big operators take scripts as limits; anything else is wrapped in a
     * single {@link ScriptNode}. A repeated script of the same kind replaces the earlier one.
     */
    private MathNode attachScripts(MathNode base) {
        MathNode result = base;
        while (peek() == '^' || peek() == '_') {
            boolean upper = next() == '^';
            RowNode script = subParser(readBlock(), fontSize * 7 / 10).parse();

            if (result instanceof BigOperatorNode operator) {
                if (upper) {
                    operator.upper = script;
                } else {
                    operator.lower = script;
                }
            } else if (result instanceof IntegralNode integral) {
                if (upper) {
                    integral.upper = script;
                } else {
                    integral.lower = script;
                }
            } else {
                ScriptNode scripted = result instanceof ScriptNode existing ? existing : new ScriptNode(result);
                if (upper) {
                    scripted.superscript = script;
                } else {
                    scripted.subscript = script;
                }
                result = scripted;
            }
        }
        return result;
    }

    /**
     * Reads one argument: a brace block with nesting, a bracket block without
     * nesting, or else exactly one character.
     */
    private String readBlock() {
        StringBuilder block = new StringBuilder();
        if (peek() == '{') {
            next();
            int depth = 1;
            while (!atEnd() && depth > 0) {
                char c = next();
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                }
                if (depth > 0) {
                    block.append(c);
                }
            }
        } else if (peek() == '[') {
            next();
            while (!atEnd() && peek() != ']') {
                block.append(next());
            }
            if (!atEnd()) {
                next();
            }
        } else {
            block.append(nextCodePoint());
        }
        return block.toString();
    }

    private String readCommandName() {
        StringBuilder name = new StringBuilder();
        while (!atEnd() && Character.isLetter(peekCodePoint())) {
            name.append(nextCodePoint());
        }
        // control symbols such as \! and \, are named by one non-letter
        if (name.length() == 0) {
            name.append(nextCodePoint());
        }
        return name.toString();
    }

    private MathNode parseCommand() {
        String command = readCommandName();

        return switch (command) {
            case "left" -> parseFence();
            case "frac" -> parseFraction();
            case "sqrt" -> parseSqrt();
            case "int" -> new IntegralNode(fontSize);
            case "sum", "prod" -> new BigOperatorNode(SUM_GLYPH, fontSize, false);
            case "lim" -> new BigOperatorNode("lim", fontSize, true);
            case "mathrm" -> new TextNode(readBlock(), false, fontSize);
            case "!" -> new TextNode("", false, fontSize, -(fontSize * 15 / 100));
            case "," -> new TextNode("", false, fontSize, fontSize * 15 / 100);
            default -> parseSymbol(command);
        };
    }

    private MathNode parseSymbol(String command) {
        if (FUNCTION_NAMES.contains(command)) {
            return new TextNode(command, false, fontSize);
        }
        return symbols.lookup(command)
                .map(symbol -> new TextNode(symbol, false, fontSize))
                .orElseGet(() -> new TextNode("?", false, fontSize));
    }

    private MathNode parseFraction() {
        RowNode numerator = subParser(readBlock(), fontSize).parse();
        RowNode denominator = subParser(readBlock(), fontSize).parse();
        return new FractionNode(numerator, denominator, fontSize);
    }

    private MathNode parseSqrt() {
        RowNode index = null;
        if (peek() == '[') {
            index = subParser(readBlock(), fontSize * 6 / 10).parse();
        }
        RowNode radicand = subParser(readBlock(), fontSize).parse();
        return new SqrtNode(radicand, index);
    }

    /**
     * Parses {@code \left<d> ... \right<d>}, matching nested fences by depth.
     */
    private MathNode parseFence() {
        String leftDelimiter = nextCodePoint();

        int start = pos;
        int depth = 0;
        while (pos < source.length()) {
            if (source.startsWith(LEFT, pos)) {
                depth++;
            }
            if (source.startsWith(RIGHT, pos)) {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            pos++;
        }

        RowNode content = subParser(source.substring(start, pos), fontSize).parse();

        if (source.startsWith(RIGHT, pos)) {
            pos += RIGHT.length();
        }
        String rightDelimiter = nextCodePoint();

        return new ScalingFenceNode(content, leftDelimiter, rightDelimiter);
    }
}
