package de.psi.bv2int.smt;

import java.util.List;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.ErrorSyntax;
import edu.mit.csail.sdg.alloy4.Pos;

/**
 * Reads SMT-LIB text into s-expressions. Atoms (symbols, numerals, binary and
 * hexadecimal literals, keywords, string literals) become {@link SExpr.Symbol}s;
 * bars around quoted symbols are removed.
 */
public class SExprParser {
    private final String filename;
    private final String text;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    private SExprParser(String filename, String text) {
        this.filename = filename;
        this.text = text;
    }

    public static List<SExpr<String>> parse(String filename, String text) throws ErrorSyntax {
        SExprParser p = new SExprParser(filename, text);
        List<SExpr<String>> result = new Vector<SExpr<String>>();
        while (true) {
            p.skipWhitespace();
            if (p.atEnd()) break;
            result.add(p.parseExpr());
        }
        return result;
    }

    private boolean atEnd() {
        return offset >= text.length();
    }

    private char peek() {
        return text.charAt(offset);
    }

    private char next() {
        char c = text.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private Pos pos() {
        return new Pos(filename, column, line);
    }

    private void skipWhitespace() {
        while (!atEnd()) {
            char c = peek();
            if (c == ';') {
                while (!atEnd() && peek() != '\n') next();
            } else if (Character.isWhitespace(c)) {
                next();
            } else {
                break;
            }
        }
    }

    /**
     * Parses one expression. Lists are collected with an explicit stack so
     * that deeply nested input does not exhaust the call stack.
     */
    private SExpr<String> parseExpr() throws ErrorSyntax {
        Vector<List<SExpr<String>>> open = new Vector<List<SExpr<String>>>();
        Vector<Pos> openedAt = new Vector<Pos>();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                if (open.isEmpty()) throw new ErrorSyntax(pos(), "Unexpected end of input");
                throw new ErrorSyntax(openedAt.lastElement(), "Unbalanced parenthesis");
            }
            char c = peek();
            SExpr<String> done;
            if (c == '(') {
                openedAt.add(pos());
                next();
                open.add(new Vector<SExpr<String>>());
                continue;
            } else if (c == ')') {
                if (open.isEmpty()) throw new ErrorSyntax(pos(), "Unexpected ')'");
                next();
                openedAt.remove(openedAt.size() - 1);
                done = new SExpr.SList<String>(open.remove(open.size() - 1));
            } else {
                done = parseAtom();
            }
            if (open.isEmpty()) return done;
            open.lastElement().add(done);
        }
    }

    private SExpr<String> parseAtom() throws ErrorSyntax {
        final Pos start = pos();
        StringBuilder sb = new StringBuilder();
        char c = peek();
        if (c == '|') {
            next();
            while (!atEnd() && peek() != '|') sb.append(next());
            if (atEnd()) throw new ErrorSyntax(start, "Unterminated quoted symbol");
            next();
            return new SExpr.Symbol<String>(sb.toString());
        }
        if (c == '"') {
            sb.append(next());
            while (true) {
                if (atEnd()) throw new ErrorSyntax(start, "Unterminated string literal");
                char d = next();
                sb.append(d);
                if (d == '"') {
                    // "" is an escaped quote inside a string
                    if (!atEnd() && peek() == '"') {
                        sb.append(next());
                    } else {
                        break;
                    }
                }
            }
            return new SExpr.Symbol<String>(sb.toString());
        }
        while (!atEnd()) {
            char d = peek();
            if (Character.isWhitespace(d) || d == '(' || d == ')' || d == ';' || d == '|' || d == '"') break;
            sb.append(next());
        }
        return new SExpr.Symbol<String>(sb.toString());
    }
}
