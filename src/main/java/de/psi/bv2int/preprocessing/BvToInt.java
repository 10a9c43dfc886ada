package de.psi.bv2int.preprocessing;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Vector;

import org.apache.log4j.Logger;

import de.psi.bv2int.context.ContextMap;
import de.psi.bv2int.context.ContextSet;
import de.psi.bv2int.term.FunctionDefinition;
import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Sort;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Replaces bit-vector reasoning by integer reasoning.
 * <p>
 * Every bit-vector term of width k becomes an integer term whose value is the
 * unsigned value of the bit-vector. Fresh integer variables stand for
 * bit-vector variables and for the carries dropped by modular addition and
 * multiplication; their ranges are collected while translating and appended
 * as one extra assertion after all formulas are done.
 * <p>
 * All caches live in the user context: popping a level forgets the
 * translations made in it.
 */
public class BvToInt extends PreprocessingPass {
    private static final Logger log = Logger.getLogger(BvToInt.class);

    public static final String VAR_PREFIX = "__bvToInt_var";
    public static final String SIGMA_PREFIX = "__bvToInt_sigma_var";
    public static final String RULE = "bv-to-int";

    private static final Comparator<Term> BY_ID = new Comparator<Term>() {
        public int compare(Term a, Term b) {
            return Integer.compare(a.id, b.id);
        }
    };

    private final TermManager tm;
    private final OperatorEliminator eliminator;
    private final Binarizer binarizer;
    private final BitwiseEncoder bitwise;
    private final Casts casts;
    private final UfBridge ufBridge;
    /** null while the node is on the stack */
    private final ContextMap<Term, Term> cache;
    private final ContextSet<Term> rangeAssertions;
    private final ContextSet<Term> emitted;
    private final Term zero;
    private final Term one;

    public BvToInt(PassContext context) throws ErrorFatal {
        super(context, RULE);
        final int g = context.getOptions().granularity;
        if (g < 0 || g > Bv2IntOptions.MAX_GRANULARITY)
            throw new ErrorFatal("Bitwise granularity must be in [0, " + Bv2IntOptions.MAX_GRANULARITY + "] but is " + g);
        this.tm = context.getTermManager();
        this.eliminator = new OperatorEliminator(context);
        this.binarizer = new Binarizer(context);
        this.bitwise = new BitwiseEncoder(tm);
        this.casts = new Casts(tm, context.getRewriter());
        this.ufBridge = new UfBridge(context, casts);
        this.cache = new ContextMap<Term, Term>(context.getUserContext());
        this.rangeAssertions = new ContextSet<Term>(context.getUserContext());
        this.emitted = new ContextSet<Term>(context.getUserContext());
        this.zero = tm.mkConst(0);
        this.one = tm.mkConst(1);
    }

    @Override
    protected void applyInternal(AssertionPipeline assertions) throws Err {
        for (int i = 0; i < assertions.size(); ++i) {
            Term bvNode = assertions.get(i);
            Term intNode = bvToInt(bvNode);
            Term rwNode = context.getRewriter().rewrite(intNode);
            if (log.isDebugEnabled()) {
                log.debug("bv node: " + bvNode);
                log.debug("int node: " + intNode);
                log.debug("rw node: " + rwNode);
            }
            assertions.replace(i, rwNode);
        }
        addFinalizeRangeAssertions(assertions);
    }

    /**
     * Appends the range constraints not yet emitted at the current level: as
     * is when there is one, as a conjunction when there are more.
     */
    private void addFinalizeRangeAssertions(AssertionPipeline assertions) throws Err {
        List<Term> pending = new Vector<Term>();
        for (Term r : rangeAssertions) {
            if (!emitted.contains(r)) pending.add(r);
        }
        if (pending.isEmpty()) return;
        Collections.sort(pending, BY_ID);
        for (Term r : pending) emitted.insert(r);
        Term range = pending.size() == 1 ? pending.get(0) : context.getRewriter().rewrite(tm.mkNode(Kind.AND, pending));
        log.debug("range constraints: " + range);
        assertions.push(range);
    }

    /** All range constraints collected and still in scope, oldest first. */
    public ConstList<Term> getRangeAssertions() {
        List<Term> result = new Vector<Term>();
        for (Term r : rangeAssertions) result.add(r);
        Collections.sort(result, BY_ID);
        return ConstList.make(result);
    }

    /** The translation of n, without normalization. */
    public Term bvToInt(Term n) throws Err {
        n = eliminator.eliminate(n);
        n = binarizer.binarize(n);
        Vector<Term> toVisit = new Vector<Term>();
        List<Term> started = new Vector<Term>();
        toVisit.add(n);
        try {
            while (!toVisit.isEmpty()) {
                Term current = toVisit.lastElement();
                if (!cache.containsKey(current)) {
                    cache.put(current, null);
                    started.add(current);
                    toVisit.addAll(current.children);
                } else if (cache.get(current) != null) {
                    toVisit.remove(toVisit.size() - 1);
                } else {
                    List<Term> translated = new Vector<Term>();
                    for (Term child : current.children) {
                        Term t = cache.get(child);
                        if (t == null) throw new ErrorFatal("Child " + child + " of " + current + " is not translated yet");
                        translated.add(t);
                    }
                    Term result = current.getNumChildren() == 0 ? translateLeaf(current) : translateNode(current, translated);
                    cache.put(current, result);
                    if (result != current && context.hasListeners()) context.notify(new RewriteStep(RULE, current, result));
                    toVisit.remove(toVisit.size() - 1);
                }
            }
        } catch (Err e) {
            // nodes left pending would look half-translated to the next call
            for (Term t : started) {
                if (cache.containsKey(t) && cache.get(t) == null) cache.remove(t);
            }
            throw e;
        }
        return cache.get(n);
    }

    private Term translateLeaf(Term current) throws Err {
        if (current.isVar()) {
            if (!current.sort.isBitVector()) return current;
            Term v = tm.mkSkolem(VAR_PREFIX, Sort.INT);
            rangeAssertions.insert(casts.rangeConstraint(v, current.sort.getBitVectorSize()));
            if (current.kind == Kind.VARIABLE) {
                // keeps the original name meaningful for get-value and get-model
                context.defineFunction(new FunctionDefinition(current, ConstList.<Term>make(), casts.cast(v, current.sort)));
            }
            return v;
        }
        if (current.kind == Kind.CONST_BITVECTOR) return tm.mkConst(current.getValue());
        return current;
    }

    private static int width(Term t) {
        return t.sort.getBitVectorSize();
    }

    private Term pow2(int k) {
        return tm.mkConst(Helpers.pow2(k));
    }

    private Term translateNode(Term current, List<Term> tr) throws Err {
        switch (current.kind) {
            case BITVECTOR_PLUS: {
                final int k = width(current.get(0));
                Term sigma = tm.mkSkolem(SIGMA_PREFIX, Sort.INT);
                Term result = tm.mkNode(Kind.MINUS, tm.mkNode(Kind.PLUS, tr), tm.mkNode(Kind.MULT, sigma, pow2(k)));
                rangeAssertions.insert(tm.mkNode(Kind.LEQ, zero, sigma));
                rangeAssertions.insert(tm.mkNode(Kind.LEQ, sigma, one));
                rangeAssertions.insert(casts.rangeConstraint(result, k));
                return result;
            }
            case BITVECTOR_MULT: {
                final int k = width(current.get(0));
                Term sigma = tm.mkSkolem(SIGMA_PREFIX, Sort.INT);
                Term result = tm.mkNode(Kind.MINUS, tm.mkNode(Kind.MULT, tr), tm.mkNode(Kind.MULT, sigma, pow2(k)));
                rangeAssertions.insert(casts.rangeConstraint(result, k));
                if (tr.get(0).isConst() || tr.get(1).isConst()) {
                    // a * c < c * 2^k, so the dropped multiple of 2^k is below c
                    Term c = tr.get(0).isConst() ? tr.get(0) : tr.get(1);
                    if (c.getValue().signum() == 0) c = one;
                    rangeAssertions.insert(tm.mkNode(Kind.LEQ, zero, sigma));
                    rangeAssertions.insert(tm.mkNode(Kind.LT, sigma, c));
                } else {
                    rangeAssertions.insert(casts.rangeConstraint(sigma, k));
                }
                return result;
            }
            case BITVECTOR_UDIV: {
                final int k = width(current.get(0));
                return tm.mkNode(Kind.ITE, tm.mkNode(Kind.EQUAL, tr.get(1), zero),
                        tm.mkNode(Kind.MINUS, pow2(k), one),
                        tm.mkNode(Kind.INTS_DIVISION_TOTAL, tr));
            }
            case BITVECTOR_UREM:
                return tm.mkNode(Kind.ITE, tm.mkNode(Kind.EQUAL, tr.get(1), zero),
                        tr.get(0),
                        tm.mkNode(Kind.INTS_MODULUS_TOTAL, tr));
            case BITVECTOR_NOT:
                return bvNot(tr.get(0), width(current));
            case BITVECTOR_TO_NAT:
                return tr.get(0);
            case BITVECTOR_AND:
                return bitwise.encodeBitwise(tr.get(0), tr.get(1), width(current), context.getOptions().granularity, BitwiseEncoder.AND);
            case BITVECTOR_SHL:
                return shift(tr.get(0), tr.get(1), width(current), true);
            case BITVECTOR_LSHR:
                return shift(tr.get(0), tr.get(1), width(current), false);
            case BITVECTOR_ASHR: {
                // (ite (bvult s 10..0) (bvlshr s t) (bvnot (bvlshr (bvnot s) t)))
                final int k = width(current);
                Term condition = tm.mkNode(Kind.LT, tr.get(0), pow2(k - 1));
                Term thenNode = shift(tr.get(0), tr.get(1), k, false);
                Term elseNode = bvNot(shift(bvNot(tr.get(0), k), tr.get(1), k, false), k);
                return tm.mkNode(Kind.ITE, condition, thenNode, elseNode);
            }
            case BITVECTOR_ITE:
                return tm.mkNode(Kind.ITE, tm.mkNode(Kind.EQUAL, tr.get(0), one), tr.get(1), tr.get(2));
            case BITVECTOR_ZERO_EXTEND:
                return tr.get(0);
            case BITVECTOR_SIGN_EXTEND:
                return signExtend(current, tr.get(0));
            case BITVECTOR_CONCAT: {
                final int rightWidth = width(current.get(1));
                return tm.mkNode(Kind.PLUS, tm.mkNode(Kind.MULT, tr.get(0), pow2(rightWidth)), tr.get(1));
            }
            case BITVECTOR_EXTRACT: {
                final int high = current.getIndex(0), low = current.getIndex(1);
                Term div = tm.mkNode(Kind.INTS_DIVISION_TOTAL, tr.get(0), pow2(low));
                return tm.mkNode(Kind.INTS_MODULUS_TOTAL, div, pow2(high - low + 1));
            }
            case EQUAL:
            case DISTINCT:
            case LT:
            case LEQ:
            case GT:
            case GEQ:
            case ITE:
                return tm.mkNode(current.kind, tr);
            case BITVECTOR_ULT:
                return tm.mkNode(Kind.LT, tr);
            case BITVECTOR_ULE:
                return tm.mkNode(Kind.LEQ, tr);
            case BITVECTOR_UGT:
                return tm.mkNode(Kind.GT, tr);
            case BITVECTOR_UGE:
                return tm.mkNode(Kind.GEQ, tr);
            case APPLY_UF:
                if (current.op.sort.involvesBitVector()) {
                    Term result = ufBridge.translate(current, tr, context.getOptions().higherOrder);
                    if (current.sort.isBitVector()) rangeAssertions.insert(casts.rangeConstraint(result, width(current)));
                    return result;
                }
                return casts.reconstruct(current, current.sort, tr);
            default:
                return casts.reconstruct(current, current.sort.isBitVector() ? Sort.INT : current.sort, tr);
        }
    }

    /** 2^k - 1 - x */
    private Term bvNot(Term x, int k) throws Err {
        return tm.mkNode(Kind.MINUS, tm.mkConst(Helpers.maxUnsigned(k)), x);
    }

    /**
     * x shifted by y, as a chain over the k possible in-range amounts. Larger
     * amounts fall through to 0. An amount that translated to a constant, such
     * as an extended literal, is applied directly.
     */
    private Term shift(Term x, Term y, int k, boolean left) throws Err {
        if (y.isConst()) {
            if (y.getValue().compareTo(BigInteger.valueOf(k)) >= 0) return zero;
            final int amount = y.getValue().intValue();
            return left
                    ? tm.mkNode(Kind.INTS_MODULUS_TOTAL, tm.mkNode(Kind.MULT, x, pow2(amount)), pow2(k))
                    : tm.mkNode(Kind.INTS_DIVISION_TOTAL, x, pow2(amount));
        }
        Term ite = zero;
        for (int i = 0; i < k; i++) {
            Term body = left
                    ? tm.mkNode(Kind.INTS_MODULUS_TOTAL, tm.mkNode(Kind.MULT, x, pow2(i)), pow2(k))
                    : tm.mkNode(Kind.INTS_DIVISION_TOTAL, x, pow2(i));
            ite = tm.mkNode(Kind.ITE, tm.mkNode(Kind.EQUAL, y, tm.mkConst(i)), body, ite);
        }
        return ite;
    }

    private Term signExtend(Term current, Term arg) throws Err {
        final int k = width(current.get(0));
        final int amount = current.getIndex(0);
        if (amount == 0) return arg;
        final BigInteger minSigned = Helpers.pow2(k - 1);
        // ones in the new high bits
        final BigInteger highBits = Helpers.maxUnsigned(amount).multiply(Helpers.pow2(k));
        if (arg.isConst()) {
            if (arg.getValue().compareTo(minSigned) < 0) return arg;
            return tm.mkConst(highBits.add(arg.getValue()));
        }
        Term condition = tm.mkNode(Kind.LT, arg, tm.mkConst(minSigned));
        Term negative = tm.mkNode(Kind.PLUS, tm.mkConst(highBits), arg);
        return tm.mkNode(Kind.ITE, condition, arg, negative);
    }
}
