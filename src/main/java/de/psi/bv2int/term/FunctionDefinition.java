package de.psi.bv2int.term;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * {@code (define-fun symbol ((x1 S1) ... (xn Sn)) R body)}: the meaning of a
 * function symbol in terms of other symbols.
 */
public class FunctionDefinition {
    public final Term symbol;
    public final ConstList<Term> formals;
    public final Term body;

    public FunctionDefinition(Term symbol, ConstList<Term> formals, Term body) {
        this.symbol = symbol;
        this.formals = formals;
        this.body = body;
    }

    @Override
    public String toString() {
        return "define " + symbol + formals + " := " + body;
    }
}
