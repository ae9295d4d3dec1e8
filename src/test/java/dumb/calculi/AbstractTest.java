package dumb.calculi;

import dumb.calculi.kif.KifParser.ParseException;
import dumb.calculi.kif.Notation;
import dumb.calculi.tableau.Standard;

import java.util.List;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * KIF helpers shared by the tests. A parse failure fails the test with the location of the error.
 */
public abstract class AbstractTest {

    protected static Formula f(String kif) {
        try {
            return Notation.formula(kif);
        } catch (ParseException e) {
            return fail(parseFailure(kif, e));
        }
    }

    protected static Inference inf(String kif) {
        try {
            return Notation.inference(kif);
        } catch (ParseException e) {
            return fail(parseFailure(kif, e));
        }
    }

    protected static Claim claim(String kif) {
        try {
            return Notation.claim(kif);
        } catch (ParseException e) {
            return fail(parseFailure(kif, e));
        }
    }

    protected static Sequent seq(String kif) {
        try {
            return Notation.sequent(kif);
        } catch (ParseException e) {
            return fail(parseFailure(kif, e));
        }
    }

    protected static Standard std(String kif) {
        try {
            return Notation.standard(kif);
        } catch (ParseException e) {
            return fail(parseFailure(kif, e));
        }
    }

    protected static List<Sequent.Item> side(String... kif) {
        return seq("(sequent (" + String.join(" ", kif) + ") ())").side(0);
    }

    private static String parseFailure(String kif, ParseException e) {
        return "Failed to parse KIF string:\n" + kif + "\n" + e.getMessage();
    }
}
