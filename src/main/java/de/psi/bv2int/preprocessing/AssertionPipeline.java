package de.psi.bv2int.preprocessing;

import java.util.List;
import java.util.Vector;

import de.psi.bv2int.term.Term;
import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * The ordered list of formulas a preprocessing pass works on.
 */
public class AssertionPipeline {
    private final List<Term> assertions = new Vector<Term>();

    public int size() {
        return assertions.size();
    }

    public Term get(int i) {
        return assertions.get(i);
    }

    public void replace(int i, Term formula) {
        assertions.set(i, formula);
    }

    public void push(Term formula) {
        assertions.add(formula);
    }

    public void clear() {
        assertions.clear();
    }

    public ConstList<Term> getAssertions() {
        return ConstList.make(assertions);
    }
}
