package de.psi.bv2int.preprocessing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Before;
import org.junit.Test;

import de.psi.bv2int.smt.SmtLibReader;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;

public class RewriterTest {
    private TermManager tm;
    private SmtLibReader reader;
    private Rewriter rewriter;

    @Before
    public void setUp() throws Err {
        tm = new TermManager();
        reader = new SmtLibReader(tm);
        reader.read("<decls>", "(declare-fun x () Int) (declare-fun y () Int)"
                + " (declare-fun p () Bool) (declare-fun q () Bool)");
        rewriter = new Rewriter(tm);
    }

    private String rw(String text) throws Err {
        return rewriter.rewrite(reader.readTerm(text)).toString();
    }

    @Test
    public void foldsConstants() throws Err {
        assertEquals("5", rw("(+ 2 3)"));
        assertEquals("#b00", rw("(bvadd #b11 #b01)"));
        assertEquals("true", rw("(< (* 2 3) 7)"));
        assertEquals("1", rw("(div 7 4)"));
    }

    @Test
    public void arithmetic() throws Err {
        assertEquals("x", rw("(+ x 0)"));
        assertEquals("(* 6 x)", rw("(* x 2 3)"));
        assertEquals("(+ 3 x)", rw("(+ 1 (+ x 2))"));
        assertEquals("(* 16 y)", rw("(* y 16)"));
        assertEquals("0", rw("(* 0 x)"));
        assertEquals("0", rw("(- x x)"));
        assertEquals("x", rw("(- x 0)"));
        assertEquals("x", rw("(div x 1)"));
        assertEquals("0", rw("(mod x 1)"));
        assertEquals("(+ x y)", rw("(+ x y)"));
    }

    @Test
    public void booleanStructure() throws Err {
        assertEquals("(and p q)", rw("(and true p (and q p))"));
        assertEquals("p", rw("(or p false)"));
        assertEquals("false", rw("(and p false)"));
        assertEquals("true", rw("(or q true)"));
        assertEquals("p", rw("(not (not p))"));
        assertEquals("(not p)", rw("(=> p false)"));
        assertEquals("q", rw("(=> true q)"));
    }

    @Test
    public void comparisonsAndIte() throws Err {
        assertEquals("true", rw("(= x x)"));
        assertEquals("false", rw("(< x x)"));
        assertEquals("true", rw("(>= y y)"));
        assertEquals("x", rw("(ite p x x)"));
        assertEquals("y", rw("(ite false x y)"));
        assertEquals("(ite p x y)", rw("(ite (not (not p)) (+ 0 x) y)"));
    }

    @Test
    public void rewritingIsIdempotent() throws Err {
        String[] texts = { "(and (<= 0 (+ x 1 2)) (< (* 1 (+ 3 x)) 16))", "(ite (and p true) (* x 2 y 3) (- y 0))" };
        for (String text : texts) {
            Term once = rewriter.rewrite(reader.readTerm(text));
            assertSame(once, rewriter.rewrite(once));
            assertSame(once, new Rewriter(tm).rewrite(once));
        }
    }
}
