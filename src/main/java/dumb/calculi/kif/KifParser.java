package dumb.calculi.kif;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads S-expressions. Symbols run up to whitespace, a parenthesis or a {@code ;}, which starts a
 * comment running to the end of the line. Lines and columns in errors count from 1.
 */
public class KifParser {
    private final String text;
    private int pos;
    private int line = 1;
    private int lineStart;

    private KifParser(String text) {
        this.text = text;
    }

    /** Every top-level expression in the text, in order. */
    public static List<Sexp> parse(String kif) throws ParseException {
        var parser = new KifParser(kif);
        var out = new ArrayList<Sexp>();
        for (var x = parser.next(); x != null; x = parser.next()) out.add(x);
        return out;
    }

    /** Exactly one expression. */
    public static Sexp parseOne(String kif) throws ParseException {
        var all = parse(kif);
        if (all.size() != 1)
            throw new ParseException("Expected a single expression, found " + all.size(), kif);
        return all.get(0);
    }

    /** An open list: where its '(' stands and what it holds so far. */
    private record Open(int line, int col, List<Sexp> items) {
    }

    /** The next top-level expression, or null once only blanks and comments remain. */
    private @Nullable Sexp next() throws ParseException {
        var open = new ArrayDeque<Open>();
        while (true) {
            skipBlank();
            if (pos == text.length()) {
                if (open.isEmpty()) return null;
                var unclosed = open.peek();
                throw error("Unexpected EOF, '(' at line " + unclosed.line() + ", col " + unclosed.col() + " is not closed");
            }

            Sexp done;
            var c = text.charAt(pos);
            if (c == '(') {
                open.push(new Open(line, col(), new ArrayList<>()));
                advance();
                continue;
            } else if (c == ')') {
                if (open.isEmpty()) throw error("Unbalanced ')'");
                advance();
                done = new Sexp.Lst(open.pop().items());
            } else {
                done = symbol();
            }

            if (open.isEmpty()) return done;
            open.peek().items().add(done);
        }
    }

    private Sexp.Symbol symbol() throws ParseException {
        var start = pos;
        while (pos < text.length() && !delimiter(text.charAt(pos))) advance();
        var name = text.substring(start, pos);
        if (name.equals("?") || name.equals("@"))
            throw error("'" + name + "' must be followed by a name");
        return new Sexp.Symbol(name);
    }

    private static boolean delimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == ';';
    }

    private void skipBlank() {
        while (pos < text.length()) {
            var c = text.charAt(pos);
            if (c == ';') {
                while (pos < text.length() && text.charAt(pos) != '\n') advance();
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return;
            }
        }
    }

    private void advance() {
        if (text.charAt(pos++) == '\n') {
            line++;
            lineStart = pos;
        }
    }

    private int col() {
        return pos - lineStart + 1;
    }

    private ParseException error(String message) {
        var end = text.indexOf('\n', lineStart);
        var source = text.substring(lineStart, end < 0 ? text.length() : end);
        return new ParseException(message, line, col(), source);
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String source;

        public ParseException(String message) {
            this(message, "");
        }

        public ParseException(String message, String source) {
            this(message, -1, -1, source);
        }

        public ParseException(String message, int line, int col, String source) {
            super(message);
            this.line = line;
            this.col = col;
            this.source = source;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var at = line != -1 ? " at line " + line + ", col " + col : "";
            var in = source != null && !source.isBlank() ? " in '" + source.strip() + "'" : "";
            return super.getMessage() + at + in;
        }
    }
}
