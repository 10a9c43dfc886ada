package de.psi.bv2int.preprocessing;

import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Lifts a one-bit boolean function to integers standing for k-bit vectors.
 * <p>
 * Both operands are cut into k/g chunks of g bits. For every chunk position
 * the result chunk is looked up in a table of all 2^g * 2^g operand pairs,
 * written as a chain of ite terms, and the chunks are summed back with their
 * weights. A larger g means fewer chunks but a quadratically larger table.
 */
public class BitwiseEncoder {

    public interface BitFunction {
        boolean apply(boolean a, boolean b);
    }

    public static final BitFunction AND = new BitFunction() {
        public boolean apply(boolean a, boolean b) {
            return a && b;
        }
    };

    private final TermManager tm;

    public BitwiseEncoder(TermManager tm) {
        this.tm = tm;
    }

    /**
     * The largest divisor of k that does not exceed the requested granularity.
     */
    public static int normalizeGranularity(int k, int granularity) throws ErrorFatal {
        if (granularity <= 0) throw new ErrorFatal("Bitwise granularity must be positive but is " + granularity);
        if (granularity > Bv2IntOptions.MAX_GRANULARITY)
            throw new ErrorFatal("Bitwise granularity must not exceed " + Bv2IntOptions.MAX_GRANULARITY + " but is " + granularity);
        if (granularity > k) return k;
        int g = granularity;
        while (k % g != 0) g--;
        return g;
    }

    /** table[i][j] is f applied bit by bit to the g-bit values i and j. */
    public static int[][] table(int g, BitFunction f) {
        final int size = 1 << g;
        int[][] table = new int[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                int packed = 0;
                for (int n = 0; n < g; n++) {
                    if (f.apply(((i >> n) & 1) == 1, ((j >> n) & 1) == 1)) packed += 1 << n;
                }
                table[i][j] = packed;
            }
        }
        return table;
    }

    public Term encodeBitwise(Term x, Term y, int k, int granularity, BitFunction f) throws Err {
        final int g = normalizeGranularity(k, granularity);
        final int[][] table = table(g, f);
        Term sum = tm.mkConst(0);
        for (int i = 0; i < k / g; i++) {
            Term xChunk = chunk(x, i, g);
            Term yChunk = chunk(y, i, g);
            Term value = lookup(xChunk, yChunk, table);
            sum = tm.mkNode(Kind.PLUS, sum, tm.mkNode(Kind.MULT, tm.mkConst(Helpers.pow2(i * g)), value));
        }
        return sum;
    }

    /** Bits [i*g, (i+1)*g) of t. */
    private Term chunk(Term t, int i, int g) throws Err {
        Term shifted = tm.mkNode(Kind.INTS_DIVISION_TOTAL, t, tm.mkConst(Helpers.pow2(i * g)));
        return tm.mkNode(Kind.INTS_MODULUS_TOTAL, shifted, tm.mkConst(Helpers.pow2(g)));
    }

    private Term lookup(Term x, Term y, int[][] table) throws Err {
        Term ite = tm.mkConst(table[0][0]);
        for (int i = 0; i < table.length; i++) {
            for (int j = 0; j < table.length; j++) {
                if (i == 0 && j == 0) continue;
                Term cond = tm.mkNode(Kind.AND,
                        tm.mkNode(Kind.EQUAL, x, tm.mkConst(i)),
                        tm.mkNode(Kind.EQUAL, y, tm.mkConst(j)));
                ite = tm.mkNode(Kind.ITE, cond, tm.mkConst(table[i][j]), ite);
            }
        }
        return ite;
    }
}
