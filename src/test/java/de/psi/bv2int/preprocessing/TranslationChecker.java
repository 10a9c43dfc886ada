package de.psi.bv2int.preprocessing;

import static org.junit.Assert.assertEquals;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

import de.psi.bv2int.smt.SmtLibReader;
import de.psi.bv2int.term.Evaluator;
import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;

/**
 * Compares a bit-vector formula with its translation on every assignment of
 * its (small) bit-vector variables: the formula must hold exactly when some
 * values of the fresh carry variables satisfy the translated formula together
 * with its range constraints.
 */
class TranslationChecker {
    final TermManager tm = new TermManager();
    final SmtLibReader reader = new SmtLibReader(tm);
    final Bv2IntOptions options = new Bv2IntOptions();
    PassContext context;
    BvToInt pass;

    TranslationChecker(String declarations, int granularity) throws Err {
        reader.read("<decls>", declarations);
        options.granularity = granularity;
        context = new PassContext(tm, options);
        pass = new BvToInt(context);
    }

    Term term(String text) throws Err {
        return reader.readTerm(text);
    }

    void check(String formula) throws Err {
        check(term(formula));
    }

    void check(Term phi) throws Err {
        AssertionPipeline pipeline = new AssertionPipeline();
        pipeline.push(phi);
        pass.apply(pipeline);
        Term translated = tm.mkNode(Kind.AND, pipeline.getAssertions());

        List<Term> bvVars = new Vector<Term>();
        List<Term> intVars = new Vector<Term>();
        List<Term> roots = new Vector<Term>();
        roots.add(phi);
        for (Term s : Helpers.collectSymbols(roots)) {
            if (s.sort.isBitVector()) {
                bvVars.add(s);
                intVars.add(pass.bvToInt(s));
            }
        }
        List<Term> troots = new Vector<Term>();
        troots.add(translated);
        Set<Term> known = new HashSet<Term>(intVars);
        List<Term> carries = new Vector<Term>();
        for (Term s : Helpers.collectSymbols(troots)) {
            if (!known.contains(s)) carries.add(s);
        }
        final int carryBound = 1 << maxWidth(phi);

        int[] values = new int[bvVars.size()];
        do {
            Map<Term, Object> bvAssignment = new HashMap<Term, Object>();
            Map<Term, Object> intAssignment = new HashMap<Term, Object>();
            for (int i = 0; i < values.length; i++) {
                bvAssignment.put(bvVars.get(i), BigInteger.valueOf(values[i]));
                intAssignment.put(intVars.get(i), BigInteger.valueOf(values[i]));
            }
            boolean expected = (Boolean) Evaluator.evaluate(phi, bvAssignment);
            boolean actual = existsCarries(translated, intAssignment, carries, 0, carryBound);
            assertEquals(phi + " under " + bvAssignment, expected, actual);
        } while (next(values, bvVars));
    }

    private static boolean next(int[] values, List<Term> vars) {
        for (int i = 0; i < values.length; i++) {
            values[i]++;
            if (values[i] < (1 << vars.get(i).sort.getBitVectorSize())) return true;
            values[i] = 0;
        }
        return false;
    }

    private static boolean existsCarries(Term formula, Map<Term, Object> assignment, List<Term> carries, int i, int bound) throws Err {
        if (i == carries.size()) return new Evaluator(assignment).holds(formula);
        for (int v = 0; v < bound; v++) {
            assignment.put(carries.get(i), BigInteger.valueOf(v));
            if (existsCarries(formula, assignment, carries, i + 1, bound)) return true;
        }
        assignment.remove(carries.get(i));
        return false;
    }

    /** Widest bit-vector sort below t. */
    static int maxWidth(Term t) {
        int max = 0;
        Set<Term> visited = new HashSet<Term>();
        Vector<Term> toVisit = new Vector<Term>();
        toVisit.add(t);
        while (!toVisit.isEmpty()) {
            Term current = toVisit.remove(toVisit.size() - 1);
            if (!visited.add(current)) continue;
            if (current.sort.isBitVector()) max = Math.max(max, current.sort.getBitVectorSize());
            toVisit.addAll(current.children);
        }
        return max;
    }
}
