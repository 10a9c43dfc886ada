package de.psi.bv2int.preprocessing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import de.psi.bv2int.smt.SmtLibReader;
import de.psi.bv2int.term.Evaluator;
import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;

public class OperatorEliminatorTest {
    private TermManager tm;
    private SmtLibReader reader;
    private OperatorEliminator eliminator;
    private Term a;
    private Term b;

    @Before
    public void setUp() throws Err {
        tm = new TermManager();
        reader = new SmtLibReader(tm);
        reader.read("<decls>", "(declare-fun a () (_ BitVec 3)) (declare-fun b () (_ BitVec 3))");
        a = tm.lookupVar("a");
        b = tm.lookupVar("b");
        eliminator = new OperatorEliminator(new PassContext(tm, new Bv2IntOptions()));
    }

    private static final String[] TERMS = {
            "(bvudiv a #b000)", "(bvsdiv a b)", "(bvsrem a b)", "(bvsmod a b)",
            "(bvxnor a b)", "(bvnand a b)", "(bvnor a b)", "(bvneg a)", "(bvxor a b)",
            "(bvxor a b a)", "(bvor a b)", "(bvor a b (bvnot a))", "(bvsub a b)",
            "((_ repeat 3) a)", "((_ rotate_right 1) a)", "((_ rotate_left 2) a)",
            "((_ rotate_left 4) a)", "(bvcomp a b)", "(bvsle a b)", "(bvslt a b)",
            "(bvsgt a b)", "(bvsge a b)", "(bvshl a #b010)", "(bvlshr a #b001)",
            "(bvashr a #b010)", "(bvashr a #b111)", "(bvshl a #b011)",
            "(bvsub (bvneg a) (bvxor a (bvsmod b a)))"
    };

    private void checkEquivalent(Term original, Term eliminated) throws Err {
        for (int x = 0; x < 8; x++) {
            for (int y = 0; y < 8; y++) {
                Map<Term, Object> m = new HashMap<Term, Object>();
                m.put(a, BigInteger.valueOf(x));
                m.put(b, BigInteger.valueOf(y));
                assertEquals(original + " at a=" + x + ", b=" + y,
                        Evaluator.evaluate(original, m), Evaluator.evaluate(eliminated, m));
            }
        }
    }

    private static boolean hasDerivedOperator(Term t) {
        for (EliminationRule rule : EliminationRule.values()) {
            if (rule == EliminationRule.UDIV_ZERO || rule.name().endsWith("_BY_CONST")) continue;
            if (Helpers.containsKind(t, rule.kind)) return true;
        }
        return false;
    }

    @Test
    public void eliminationPreservesMeaning() throws Err {
        for (String text : TERMS) {
            Term original = reader.readTerm(text);
            Term eliminated = eliminator.eliminate(original);
            checkEquivalent(original, eliminated);
            assertFalse(eliminated.toString(), hasDerivedOperator(eliminated));
        }
    }

    @Test
    public void eliminationIsIdempotent() throws Err {
        for (String text : TERMS) {
            Term eliminated = eliminator.eliminate(reader.readTerm(text));
            assertSame(text, eliminated, eliminator.eliminate(eliminated));
        }
    }

    @Test
    public void primitiveOperatorsAreKept() throws Err {
        String[] primitive = { "(bvadd a b)", "(bvmul a b)", "(bvand a (bvnot b))", "(bvult a b)",
                "(concat a ((_ extract 1 0) b))", "(bvshl a b)", "((_ sign_extend 1) a)" };
        for (String text : primitive) {
            Term t = reader.readTerm(text);
            assertSame(t, eliminator.eliminate(t));
        }
    }

    @Test
    public void divisionByZeroIsAllOnes() throws Err {
        assertSame(tm.mkBitVector(3, 7), eliminator.eliminate(reader.readTerm("(bvudiv a #b000)")));
    }

    @Test
    public void constantShiftsBecomeSlicing() throws Err {
        assertEquals("(concat ((_ extract 0 0) a) #b00)", eliminator.eliminate(reader.readTerm("(bvshl a #b010)")).toString());
        assertEquals("((_ zero_extend 1) ((_ extract 2 1) a))", eliminator.eliminate(reader.readTerm("(bvlshr a #b001)")).toString());
        assertEquals("((_ sign_extend 2) ((_ extract 2 2) a))", eliminator.eliminate(reader.readTerm("(bvashr a #b101)")).toString());
        assertSame(tm.mkBitVector(3, 0), eliminator.eliminate(reader.readTerm("(bvshl a #b100)")));
        assertSame(a, eliminator.eliminate(reader.readTerm("(bvlshr a #b000)")));
    }

    @Test
    public void subtractionIsAdditionOfNegation() throws Err {
        assertEquals("(bvadd a (bvadd (bvnot b) #b001))", eliminator.eliminate(reader.readTerm("(bvsub a b)")).toString());
    }
}
