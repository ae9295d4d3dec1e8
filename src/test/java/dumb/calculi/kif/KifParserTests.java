package dumb.calculi.kif;

import dumb.calculi.kif.KifParser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KifParserTests {

    @Test
    void parsesSeveralExpressionsAndSkipsComments() throws ParseException {
        var all = KifParser.parse("""
                ; two formulas
                (not p)   ; trailing
                (and ?A
                     (or q r))
                """);
        assertEquals(2, all.size());
        assertEquals("(not p)", all.get(0).toKif());
        assertEquals("(and ?A (or q r))", all.get(1).toKif());
    }

    @Test
    void lists() throws ParseException {
        var l = assertInstanceOf(Sexp.Lst.class, KifParser.parseOne("(sequent () (p))"));
        assertEquals("sequent", l.op());
        assertEquals(3, l.size());
        assertEquals(List.of(), ((Sexp.Lst) l.get(1)).items());
        assertNull(((Sexp.Lst) l.get(1)).op());
        assertEquals(new Sexp.Symbol("p"), KifParser.parseOne("  p  "));
    }

    @Test
    void unbalancedReportsPosition() {
        var e = assertThrows(ParseException.class, () -> KifParser.parseOne("(and p\n  (not q)"));
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("EOF"), e.getMessage());
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());

        assertTrue(e.getMessage().contains("'(' at line 1, col 1 is not closed"), e.getMessage());

        var close = assertThrows(ParseException.class, () -> KifParser.parse("p)"));
        assertEquals(1, close.line());
        assertEquals(2, close.col());
        assertTrue(close.getMessage().contains("in 'p)'"), close.getMessage());
    }

    @Test
    void columnsRestartOnEachLine() {
        var e = assertThrows(ParseException.class, () -> KifParser.parse("(not p)\n  (and ? q)"));
        assertEquals(2, e.line());
        assertEquals(9, e.col());
    }

    @Test
    void bareSigils() {
        assertThrows(ParseException.class, () -> KifParser.parseOne("(and ? p)"));
        assertThrows(ParseException.class, () -> KifParser.parseOne("@"));
    }

    @Test
    void exactlyOne() {
        assertThrows(ParseException.class, () -> KifParser.parseOne("p q"));
        assertThrows(ParseException.class, () -> KifParser.parseOne("; nothing"));
    }
}
