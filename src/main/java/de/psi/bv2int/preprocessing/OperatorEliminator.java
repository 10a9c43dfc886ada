package de.psi.bv2int.preprocessing;

import java.math.BigInteger;
import java.util.List;
import java.util.Vector;

import de.psi.bv2int.context.ContextMap;
import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Rewrites derived bit-vector operators into the primitive set the
 * translation handles: add, multiply, unsigned division and remainder, not,
 * and, shifts by a variable amount, concat, extract, extensions, ite and the
 * unsigned comparisons.
 * <p>
 * Every node is first rewritten at its root until no {@link EliminationRule}
 * applies; its children are then processed the same way and the node is
 * rebuilt over the results. Both steps are memoized.
 */
public class OperatorEliminator {
    private final PassContext context;
    private final TermManager tm;
    /** original node to the fixpoint of the rules at its root */
    private final ContextMap<Term, Term> eliminationCache;
    /** eliminated node to the node rebuilt over eliminated children; null while pending */
    private final ContextMap<Term, Term> rebuildCache;

    public OperatorEliminator(PassContext context) {
        this.context = context;
        this.tm = context.getTermManager();
        this.eliminationCache = new ContextMap<Term, Term>(context.getUserContext());
        this.rebuildCache = new ContextMap<Term, Term>(context.getUserContext());
    }

    public Term eliminate(Term n) throws Err {
        Term current = eliminationPass(n);
        // rebuilding can expose new redexes, e.g. a shift whose amount became a constant
        Term next = eliminationPass(current);
        while (next != current) {
            current = next;
            next = eliminationPass(current);
        }
        return current;
    }

    private Term eliminationPass(Term n) throws Err {
        Vector<Term> toVisit = new Vector<Term>();
        toVisit.add(n);
        while (!toVisit.isEmpty()) {
            Term current = toVisit.remove(toVisit.size() - 1);
            final boolean inEliminationCache = eliminationCache.containsKey(current);
            final boolean inRebuildCache = rebuildCache.containsKey(current);
            if (!inEliminationCache) {
                Term eliminated = applyRules(current);
                eliminationCache.put(current, eliminated);
                eliminationCache.put(eliminated, eliminated);
                if (!rebuildCache.containsKey(eliminated) || rebuildCache.get(eliminated) == null) {
                    rebuildCache.put(eliminated, null);
                    toVisit.add(eliminated);
                    toVisit.addAll(eliminated.children);
                }
            }
            if (inRebuildCache && rebuildCache.get(current) == null) {
                if (current.getNumChildren() == 0) {
                    rebuildCache.put(current, current);
                } else {
                    List<Term> children = new Vector<Term>();
                    for (Term child : current.children) {
                        Term eliminatedChild = eliminationCache.get(child);
                        Term rebuilt = eliminatedChild == null ? null : rebuildCache.get(eliminatedChild);
                        if (rebuilt == null) throw new ErrorFatal("Operator elimination reached " + current + " before its child " + child);
                        children.add(rebuilt);
                    }
                    rebuildCache.put(current, tm.mkLike(current, children));
                }
            }
        }
        Term result = rebuildCache.get(eliminationCache.get(n));
        if (result == null) throw new ErrorFatal("Operator elimination left " + n + " unfinished");
        return result;
    }

    /** Applies the rules at the root of t until none matches. */
    private Term applyRules(Term t) throws Err {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (EliminationRule rule : EliminationRule.values()) {
                if (rule.matches(t)) {
                    Term next = apply(rule, t);
                    if (context.hasListeners()) context.notify(new RewriteStep(rule.name(), t, next));
                    t = next;
                    changed = true;
                    break;
                }
            }
        }
        return t;
    }

    private Term bv(int width, BigInteger value) {
        return tm.mkBitVector(width, value);
    }

    private Term bvNot(Term a) throws Err {
        return tm.mkNode(Kind.BITVECTOR_NOT, a);
    }

    private Term bvNeg(Term a) throws Err {
        return tm.mkNode(Kind.BITVECTOR_NEG, a);
    }

    /** The sign bit of a is set. */
    private Term isNegative(Term a, int width) throws Err {
        return tm.mkNode(Kind.BITVECTOR_UGE, a, bv(width, Helpers.pow2(width - 1)));
    }

    private Term abs(Term a, Term negative) throws Err {
        return tm.mkNode(Kind.ITE, negative, bvNeg(a), a);
    }

    private Term apply(EliminationRule rule, Term t) throws Err {
        final int width = t.kind == Kind.BITVECTOR_COMP || !t.sort.isBitVector()
                ? t.get(0).sort.getBitVectorSize() : t.sort.getBitVectorSize();
        switch (rule) {
            case UDIV_ZERO:
                return bv(width, Helpers.maxUnsigned(width));
            case SDIV: {
                Term a = t.get(0), b = t.get(1);
                Term aNeg = isNegative(a, width), bNeg = isNegative(b, width);
                Term quotient = tm.mkNode(Kind.BITVECTOR_UDIV, abs(a, aNeg), abs(b, bNeg));
                return tm.mkNode(Kind.ITE, tm.mkNode(Kind.XOR, aNeg, bNeg), bvNeg(quotient), quotient);
            }
            case SREM: {
                Term a = t.get(0), b = t.get(1);
                Term aNeg = isNegative(a, width), bNeg = isNegative(b, width);
                Term rem = tm.mkNode(Kind.BITVECTOR_UREM, abs(a, aNeg), abs(b, bNeg));
                return tm.mkNode(Kind.ITE, aNeg, bvNeg(rem), rem);
            }
            case SMOD: {
                Term s = t.get(0), u = t.get(1);
                Term sNeg = isNegative(s, width), uNeg = isNegative(u, width);
                Term rem = tm.mkNode(Kind.BITVECTOR_UREM, abs(s, sNeg), abs(u, uNeg));
                Term remIsZero = tm.mkNode(Kind.EQUAL, rem, bv(width, BigInteger.ZERO));
                Term sPos = tm.mkNode(Kind.NOT, sNeg), uPos = tm.mkNode(Kind.NOT, uNeg);
                Term bothPos = tm.mkNode(Kind.AND, sPos, uPos);
                Term onlySNeg = tm.mkNode(Kind.AND, sNeg, uPos);
                Term onlyUNeg = tm.mkNode(Kind.AND, sPos, uNeg);
                Term last = tm.mkNode(Kind.ITE, onlyUNeg, tm.mkNode(Kind.BITVECTOR_PLUS, rem, u), bvNeg(rem));
                Term middle = tm.mkNode(Kind.ITE, onlySNeg, tm.mkNode(Kind.BITVECTOR_PLUS, bvNeg(rem), u), last);
                return tm.mkNode(Kind.ITE, tm.mkNode(Kind.OR, remIsZero, bothPos), rem, middle);
            }
            case XNOR:
                return bvNot(tm.mkNode(Kind.BITVECTOR_XOR, t.get(0), t.get(1)));
            case NAND:
                return bvNot(tm.mkNode(Kind.BITVECTOR_AND, t.get(0), t.get(1)));
            case NOR:
                return bvNot(tm.mkNode(Kind.BITVECTOR_OR, t.get(0), t.get(1)));
            case NEG:
                return tm.mkNode(Kind.BITVECTOR_PLUS, bvNot(t.get(0)), bv(width, BigInteger.ONE));
            case XOR: {
                if (t.getNumChildren() > 2) {
                    // left-associate, the next round handles the binary root
                    List<Term> rest = new Vector<Term>();
                    rest.add(tm.mkNode(Kind.BITVECTOR_XOR, t.get(0), t.get(1)));
                    rest.addAll(t.children.subList(2, t.getNumChildren()));
                    return tm.mkNode(Kind.BITVECTOR_XOR, rest);
                }
                Term a = t.get(0), b = t.get(1);
                return tm.mkNode(Kind.BITVECTOR_OR,
                        tm.mkNode(Kind.BITVECTOR_AND, a, bvNot(b)),
                        tm.mkNode(Kind.BITVECTOR_AND, bvNot(a), b));
            }
            case OR: {
                List<Term> negated = new Vector<Term>();
                for (Term c : t.children) negated.add(bvNot(c));
                return bvNot(tm.mkNode(Kind.BITVECTOR_AND, negated));
            }
            case SUB:
                return tm.mkNode(Kind.BITVECTOR_PLUS, t.get(0), bvNeg(t.get(1)));
            case REPEAT: {
                int n = t.getIndex(0);
                if (n == 1) return t.get(0);
                List<Term> copies = new Vector<Term>();
                for (int i = 0; i < n; i++) copies.add(t.get(0));
                return tm.mkNode(Kind.BITVECTOR_CONCAT, copies);
            }
            case ROTATE_RIGHT: {
                int amount = t.getIndex(0) % width;
                if (amount == 0) return t.get(0);
                Term a = t.get(0);
                return tm.mkNode(Kind.BITVECTOR_CONCAT, tm.mkExtract(amount - 1, 0, a), tm.mkExtract(width - 1, amount, a));
            }
            case ROTATE_LEFT: {
                int amount = t.getIndex(0) % width;
                if (amount == 0) return t.get(0);
                Term a = t.get(0);
                return tm.mkNode(Kind.BITVECTOR_CONCAT, tm.mkExtract(width - 1 - amount, 0, a), tm.mkExtract(width - 1, width - amount, a));
            }
            case COMP:
                return tm.mkNode(Kind.ITE, tm.mkNode(Kind.EQUAL, t.get(0), t.get(1)), bv(1, BigInteger.ONE), bv(1, BigInteger.ZERO));
            case SLE:
                return tm.mkNode(Kind.NOT, tm.mkNode(Kind.BITVECTOR_SLT, t.get(1), t.get(0)));
            case SLT: {
                // flipping the sign bit maps the signed order onto the unsigned one
                Term bias = bv(width, Helpers.pow2(width - 1));
                return tm.mkNode(Kind.BITVECTOR_ULT,
                        tm.mkNode(Kind.BITVECTOR_PLUS, t.get(0), bias),
                        tm.mkNode(Kind.BITVECTOR_PLUS, t.get(1), bias));
            }
            case SGT:
                return tm.mkNode(Kind.BITVECTOR_SLT, t.get(1), t.get(0));
            case SGE:
                return tm.mkNode(Kind.BITVECTOR_SLE, t.get(1), t.get(0));
            case SHL_BY_CONST: {
                BigInteger amount = t.get(1).getValue();
                if (amount.signum() == 0) return t.get(0);
                if (amount.compareTo(BigInteger.valueOf(width)) >= 0) return bv(width, BigInteger.ZERO);
                int n = amount.intValue();
                return tm.mkNode(Kind.BITVECTOR_CONCAT, tm.mkExtract(width - 1 - n, 0, t.get(0)), bv(n, BigInteger.ZERO));
            }
            case LSHR_BY_CONST: {
                BigInteger amount = t.get(1).getValue();
                if (amount.signum() == 0) return t.get(0);
                if (amount.compareTo(BigInteger.valueOf(width)) >= 0) return bv(width, BigInteger.ZERO);
                int n = amount.intValue();
                return tm.mkIndexed(Kind.BITVECTOR_ZERO_EXTEND, n, tm.mkExtract(width - 1, n, t.get(0)));
            }
            case ASHR_BY_CONST: {
                BigInteger amount = t.get(1).getValue();
                if (amount.signum() == 0) return t.get(0);
                int n = amount.compareTo(BigInteger.valueOf(width)) >= 0 ? width - 1 : amount.intValue();
                if (n == 0) return t.get(0);
                return tm.mkIndexed(Kind.BITVECTOR_SIGN_EXTEND, n, tm.mkExtract(width - 1, n, t.get(0)));
            }
            default:
                throw new AssertionError("unhandled rule " + rule);
        }
    }
}
