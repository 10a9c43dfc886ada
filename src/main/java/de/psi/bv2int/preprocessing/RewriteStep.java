package de.psi.bv2int.preprocessing;

import de.psi.bv2int.term.Term;

/**
 * One rewrite made by the translation: which rule turned which term into
 * which. Enough for a proof producer to replay the step.
 */
public class RewriteStep {
    public final String rule;
    public final Term from;
    public final Term to;

    public RewriteStep(String rule, Term from, Term to) {
        this.rule = rule;
        this.from = from;
        this.to = to;
    }

    @Override
    public String toString() {
        return rule + ": " + from + " ~> " + to;
    }
}
