package de.psi.bv2int.preprocessing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

import org.junit.Before;
import org.junit.Test;

import de.psi.bv2int.term.Evaluator;
import de.psi.bv2int.term.FunctionDefinition;
import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Term;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.ErrorType;

public class BvToIntTest {

    private static final String DECLS =
            "(declare-fun x () (_ BitVec 4))\n" +
            "(declare-fun y () (_ BitVec 4))\n" +
            "(declare-fun f ((_ BitVec 4)) (_ BitVec 4))\n" +
            "(declare-fun p ((_ BitVec 4) Int) Bool)\n";

    private TranslationChecker c;

    @Before
    public void setUp() throws Err {
        c = new TranslationChecker(DECLS, 1);
    }

    private static Map<Term, Object> assign(Term var, long value) {
        Map<Term, Object> m = new HashMap<Term, Object>();
        m.put(var, BigInteger.valueOf(value));
        return m;
    }

    /** Results r in [0, 16) for which some carry makes the ranges and t = r hold. */
    private List<Integer> possibleResults(Term t, Term var, long value) throws Err {
        List<Term> roots = new Vector<Term>();
        roots.add(t);
        roots.addAll(c.pass.getRangeAssertions());
        Term sigma = null;
        for (Term s : Helpers.collectSymbols(roots)) {
            if (s.getName().startsWith(BvToInt.SIGMA_PREFIX)) sigma = s;
        }
        List<Integer> result = new Vector<Integer>();
        for (int r = 0; r < 16; r++) {
            boolean sat = false;
            for (int s = 0; s <= 1 && !sat; s++) {
                Map<Term, Object> m = assign(var, value);
                m.put(sigma, BigInteger.valueOf(s));
                Evaluator ev = new Evaluator(m);
                boolean ok = ev.eval(t).equals(BigInteger.valueOf(r));
                for (Term range : c.pass.getRangeAssertions()) ok = ok && ev.holds(range);
                sat = ok;
            }
            if (sat) result.add(r);
        }
        return result;
    }

    @Test
    public void additionOfConstant() throws Err {
        Term x = c.term("x");
        Term translated = c.context.getRewriter().rewrite(c.pass.bvToInt(c.term("(bvadd (_ bv3 4) x)")));
        Term tx = c.pass.bvToInt(x);
        assertEquals("(- (+ 3 " + tx + ") (* 16 __bvToInt_sigma_var_0))", translated.toString());
        assertEquals("[3]", possibleResults(translated, tx, 0).toString());
        assertEquals("[2]", possibleResults(translated, tx, 15).toString());
        assertEquals("[0]", possibleResults(translated, tx, 13).toString());
    }

    @Test
    public void extractOfConstant() throws Err {
        Term translated = c.pass.bvToInt(c.term("((_ extract 3 1) (_ bv13 4))"));
        assertEquals(BigInteger.valueOf(6), new Evaluator().eval(translated));
        assertSame(c.tm.mkConst(6), c.context.getRewriter().rewrite(translated));
    }

    @Test
    public void variablesAreBounded() throws Err {
        Term tx = c.pass.bvToInt(c.term("x"));
        assertEquals(Kind.VARIABLE, tx.kind);
        assertTrue(tx.sort.isInteger());
        assertTrue(tx.getName().startsWith(BvToInt.VAR_PREFIX));
        assertEquals(1, c.pass.getRangeAssertions().size());
        assertEquals("(and (<= 0 " + tx + ") (< " + tx + " 16))", c.pass.getRangeAssertions().get(0).toString());
        // the same variable maps to the same integer
        assertSame(tx, c.pass.bvToInt(c.term("x")));
    }

    @Test
    public void arithmeticResultsAreBounded() throws Err {
        Term t = c.pass.bvToInt(c.term("(bvmul x y)"));
        ConstList<Term> ranges = c.pass.getRangeAssertions();
        assertTrue(ranges.contains(c.context.getRewriter().rewrite(
                c.tm.mkNode(Kind.AND,
                        c.tm.mkNode(Kind.LEQ, c.tm.mkConst(0), t),
                        c.tm.mkNode(Kind.LT, t, c.tm.mkConst(16))))));
        // variables, carry lower/upper bound, result
        assertEquals(4, ranges.size());
    }

    private String rangesText() {
        StringBuilder sb = new StringBuilder();
        for (Term r : c.pass.getRangeAssertions()) sb.append(r).append('\n');
        return sb.toString();
    }

    @Test
    public void multiplicationByConstantHasTightCarry() throws Err {
        c.pass.bvToInt(c.term("(bvmul x (_ bv3 4))"));
        String ranges = rangesText();
        assertTrue(ranges, ranges.contains("(< __bvToInt_sigma_var_0 3)"));
    }

    @Test
    public void signExtendOfConstantIsFolded() throws Err {
        Term negative = c.pass.bvToInt(c.term("((_ sign_extend 2) #b101)"));
        assertSame(c.tm.mkConst(5 + 3 * 8), negative);
        Term positive = c.pass.bvToInt(c.term("((_ sign_extend 2) #b011)"));
        assertSame(c.tm.mkConst(3), positive);
    }

    @Test
    public void rangeAssertionIsAppendedOnce() throws Err {
        AssertionPipeline p = new AssertionPipeline();
        p.push(c.term("(bvult x y)"));
        p.push(c.term("(= x (_ bv1 4))"));
        c.pass.apply(p);
        assertEquals(3, p.size());
        assertEquals(Kind.AND, p.get(2).kind);
        // nothing new to bound
        AssertionPipeline q = new AssertionPipeline();
        q.push(c.term("(bvugt x y)"));
        c.pass.apply(q);
        assertEquals(1, q.size());
        // a single new bound is appended as is
        AssertionPipeline r = new AssertionPipeline();
        r.push(c.term("(= (bvnot x) (bvnot y))"));
        r.push(c.term("(= (f x) y)"));
        c.pass.apply(r);
        assertEquals(3, r.size());
        assertEquals(Kind.AND, r.get(2).kind);
    }

    @Test
    public void nonBitVectorFormulasAreKept() throws Err {
        AssertionPipeline p = new AssertionPipeline();
        p.push(c.term("(and true (= 1 (+ 0 1)))"));
        c.pass.apply(p);
        assertEquals(1, p.size());
        assertSame(c.tm.mkTrue(), p.get(0));
    }

    @Test
    public void functionsGetIntegerCounterparts() throws Err {
        Term app = c.pass.bvToInt(c.term("(f x)"));
        assertEquals(Kind.APPLY_UF, app.kind);
        assertEquals("__bvToInt_fun_f_int_0", app.op.getName());
        assertTrue(app.sort.isInteger());
        String ranges = rangesText();
        assertTrue(ranges, ranges.contains("(< (__bvToInt_fun_f_int_0 __bvToInt_var_0) 16)"));

        ConstList<FunctionDefinition> defs = c.context.takeDefinitions();
        assertEquals(2, defs.size());
        // the argument is translated, and its variable defined, before the application
        assertEquals("x", defs.get(0).symbol.getName());
        FunctionDefinition def = defs.get(1);
        assertEquals("f", def.symbol.getName());
        assertEquals(1, def.formals.size());
        assertEquals("((_ int2bv 4) (__bvToInt_fun_f_int_0 (bv2nat " + def.formals.get(0) + ")))", def.body.toString());

        // the counterpart is reused
        Term again = c.pass.bvToInt(c.term("(f y)"));
        assertSame(app.op, again.op);
        // only y is new
        assertEquals(1, c.context.takeDefinitions().size());
    }

    @Test
    public void mixedSignatureKeepsOtherArguments() throws Err {
        Term app = c.pass.bvToInt(c.term("(p x 7)"));
        assertTrue(app.sort.isBoolean());
        assertEquals("(__bvToInt_fun_p_int_0 __bvToInt_var_0 7)", app.toString());
    }

    @Test
    public void higherOrderRejectsChangedSignature() throws Err {
        c.options.higherOrder = true;
        try {
            c.pass.bvToInt(c.term("(= (f x) y)"));
            fail("expected a type error");
        } catch (ErrorType e) {
            assertTrue(e.msg, e.msg.contains("Cannot translate to Int"));
            assertTrue(e.msg, e.msg.contains("(f x)"));
        }
    }

    @Test
    public void rejectedFormulaCanBeTranslatedLater() throws Err {
        c.options.higherOrder = true;
        try {
            c.pass.bvToInt(c.term("(= (f x) y)"));
            fail("expected a type error");
        } catch (ErrorType e) {
            // expected
        }
        // x was translated before the failure; f got no counterpart
        for (FunctionDefinition def : c.context.takeDefinitions()) {
            assertFalse(def.toString(), def.symbol.getName().equals("f"));
        }

        c.options.higherOrder = false;
        Term t = c.pass.bvToInt(c.term("(and (= (f x) y) (= x y))"));
        assertTrue(t.toString(), t.toString().contains("(__bvToInt_fun_f_int_0 __bvToInt_var_0)"));
        boolean fDefined = false;
        for (FunctionDefinition def : c.context.takeDefinitions()) {
            if (def.symbol.getName().equals("f")) fDefined = true;
        }
        assertTrue(fDefined);
    }

    @Test
    public void popForgetsTranslations() throws Err {
        c.context.getUserContext().push();
        Term first = c.pass.bvToInt(c.term("x"));
        assertEquals(1, c.pass.getRangeAssertions().size());
        c.context.getUserContext().pop();
        assertEquals(0, c.pass.getRangeAssertions().size());
        Term second = c.pass.bvToInt(c.term("x"));
        assertNotSame(first, second);
    }

    @Test
    public void translationsBelowPushSurvivePop() throws Err {
        Term first = c.pass.bvToInt(c.term("x"));
        c.context.getUserContext().push();
        c.pass.bvToInt(c.term("y"));
        c.context.getUserContext().pop();
        assertSame(first, c.pass.bvToInt(c.term("x")));
        assertEquals(1, c.pass.getRangeAssertions().size());
    }

    @Test
    public void rangesAreEmittedAgainAfterPop() throws Err {
        c.context.getUserContext().push();
        AssertionPipeline p = new AssertionPipeline();
        p.push(c.term("(bvult x (_ bv3 4))"));
        c.pass.apply(p);
        assertEquals(2, p.size());
        c.context.getUserContext().pop();
        AssertionPipeline q = new AssertionPipeline();
        q.push(c.term("(bvult x (_ bv3 4))"));
        c.pass.apply(q);
        assertEquals(2, q.size());
    }

    @Test
    public void granularityOutOfRange() throws Err {
        Bv2IntOptions options = new Bv2IntOptions();
        options.granularity = 9;
        try {
            new BvToInt(new PassContext(c.tm, options));
            fail("expected a fatal error");
        } catch (ErrorFatal e) {
            assertTrue(e.msg, e.msg.contains("granularity"));
        }
    }

    @Test
    public void granularityZeroFailsOnAnd() throws Err {
        c.options.granularity = 0;
        BvToInt pass = new BvToInt(new PassContext(c.tm, c.options));
        pass.bvToInt(c.term("(bvadd x y)"));
        try {
            pass.bvToInt(c.term("(bvand x y)"));
            fail("expected a fatal error");
        } catch (ErrorFatal e) {
            assertTrue(e.msg, e.msg.contains("granularity"));
        }
    }

    @Test
    public void listenersSeeEveryStep() throws Err {
        final List<RewriteStep> steps = new Vector<RewriteStep>();
        c.context.addListener(new RewriteListener() {
            public void rewritten(RewriteStep step) {
                steps.add(step);
            }
        });
        c.pass.bvToInt(c.term("(bvsub x y)"));
        List<String> rules = new Vector<String>();
        for (RewriteStep s : steps) rules.add(s.rule);
        assertTrue(rules.toString(), rules.contains(EliminationRule.SUB.name()));
        assertTrue(rules.toString(), rules.contains(EliminationRule.NEG.name()));
        assertTrue(rules.toString(), rules.contains(BvToInt.RULE));
        for (RewriteStep s : steps) {
            if (s.rule.equals(BvToInt.RULE)) assertFalse(s.to.sort.isBitVector());
        }
    }

    @Test
    public void shiftChainCoversEveryAmount() throws Err {
        Term t = c.pass.bvToInt(c.term("(bvshl x y)"));
        Term tx = c.pass.bvToInt(c.term("x"));
        Term ty = c.pass.bvToInt(c.term("y"));
        for (int a = 0; a < 16; a++) {
            for (int b = 0; b < 16; b++) {
                Map<Term, Object> m = assign(tx, a);
                m.put(ty, BigInteger.valueOf(b));
                long expected = b >= 4 ? 0 : (a << b) & 15;
                assertEquals(BigInteger.valueOf(expected), Evaluator.evaluate(t, m));
            }
        }
    }
}
