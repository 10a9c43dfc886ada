package de.psi.bv2int.preprocessing;

import java.util.List;
import java.util.Vector;

import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Sort;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Conversions at the border between translated and untranslated terms, and
 * the range constraints that keep integers inside their bit-vector width.
 */
public class Casts {
    private final TermManager tm;
    private final Rewriter rewriter;

    public Casts(TermManager tm, Rewriter rewriter) {
        this.tm = tm;
        this.rewriter = rewriter;
    }

    /**
     * Converts n to the given sort. Only Int to bit-vector (int2bv) and
     * bit-vector to Int (bv2nat) are possible.
     */
    public Term cast(Term n, Sort target) throws Err {
        if (n.sort.equals(target)) return n;
        if (n.sort.isInteger() && target.isBitVector()) {
            return tm.mkIndexed(Kind.INT_TO_BITVECTOR, target.getBitVectorSize(), n);
        }
        if (n.sort.isBitVector() && target.isInteger()) {
            return tm.mkNode(Kind.BITVECTOR_TO_NAT, n);
        }
        throw new ErrorFatal("Cannot cast " + n + " of sort " + n.sort + " to " + target);
    }

    /**
     * Rebuilds an operator that is not translated: each translated child is
     * cast back to the sort of the original child, and the rebuilt node is
     * cast to resultSort.
     */
    public Term reconstruct(Term original, Sort resultSort, List<Term> translatedChildren) throws Err {
        List<Term> adjusted = new Vector<Term>();
        for (int i = 0; i < original.getNumChildren(); i++) {
            adjusted.add(cast(translatedChildren.get(i), original.get(i).sort));
        }
        Term rebuilt = original.kind == Kind.APPLY_UF
                ? tm.mkApply(original.op, adjusted)
                : tm.mkLike(original, adjusted);
        return cast(rebuilt, resultSort);
    }

    /** 0 <= v < 2^k, normalized. */
    public Term rangeConstraint(Term v, int k) throws Err {
        Term lower = tm.mkNode(Kind.LEQ, tm.mkConst(0), v);
        Term upper = tm.mkNode(Kind.LT, v, tm.mkConst(Helpers.pow2(k)));
        return rewriter.rewrite(tm.mkNode(Kind.AND, lower, upper));
    }
}
