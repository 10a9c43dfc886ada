package de.psi.bv2int.preprocessing;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

import de.psi.bv2int.term.Evaluator;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;

/**
 * Equivalence-preserving simplifier. Works bottom-up: every node is rebuilt
 * over its simplified children and then simplified locally until no local
 * rule applies. Results are cached for the lifetime of the rewriter.
 */
public class Rewriter {
    private final TermManager tm;
    private final Map<Term, Term> cache = new HashMap<Term, Term>();

    public Rewriter(TermManager tm) {
        this.tm = tm;
    }

    public Term rewrite(Term root) throws Err {
        Vector<Term> toVisit = new Vector<Term>();
        toVisit.add(root);
        while (!toVisit.isEmpty()) {
            Term current = toVisit.lastElement();
            if (cache.containsKey(current)) {
                toVisit.remove(toVisit.size() - 1);
                continue;
            }
            boolean ready = true;
            for (Term child : current.children) {
                if (!cache.containsKey(child)) {
                    toVisit.add(child);
                    ready = false;
                }
            }
            if (!ready) continue;
            toVisit.remove(toVisit.size() - 1);
            List<Term> children = new Vector<Term>();
            for (Term child : current.children) children.add(cache.get(child));
            Term result = tm.mkLike(current, children);
            Term next = simplify(result);
            while (next != result) {
                result = next;
                next = simplify(result);
            }
            cache.put(current, result);
            cache.put(result, result);
        }
        return cache.get(root);
    }

    private static boolean allConst(Term t) {
        for (Term c : t.children) {
            if (!c.isConst()) return false;
        }
        return true;
    }

    private Term mkValue(Term t, Object value) {
        if (t.sort.isBoolean()) return tm.mkBool((Boolean) value);
        if (t.sort.isInteger()) return tm.mkConst((BigInteger) value);
        return tm.mkBitVector(t.sort.getBitVectorSize(), (BigInteger) value);
    }

    private static boolean isConst(Term t, long value) {
        return t.kind == Kind.CONST_INTEGER && t.getValue().equals(BigInteger.valueOf(value));
    }

    /** One local simplification step; returns t itself if nothing applies. */
    private Term simplify(Term t) throws Err {
        if (t.getNumChildren() == 0) return t;
        if (t.kind != Kind.APPLY_UF && allConst(t)) {
            return mkValue(t, new Evaluator().eval(t));
        }
        switch (t.kind) {
            case NOT:
                if (t.get(0).kind == Kind.NOT) return t.get(0).get(0);
                return t;
            case AND:
            case OR:
                return simplifyJunction(t);
            case IMPLIES:
                if (t.get(0).isConst()) return t.get(0).getBooleanValue() ? t.get(1) : tm.mkTrue();
                if (t.get(1).isConst()) return t.get(1).getBooleanValue() ? tm.mkTrue() : tm.mkNode(Kind.NOT, t.get(0));
                return t;
            case ITE:
            case BITVECTOR_ITE:
                if (t.get(1) == t.get(2)) return t.get(1);
                if (t.get(0).isConst()) {
                    boolean cond = t.kind == Kind.ITE ? t.get(0).getBooleanValue() : t.get(0).getValue().signum() != 0;
                    return cond ? t.get(1) : t.get(2);
                }
                return t;
            case EQUAL: {
                for (Term c : t.children) {
                    if (c != t.get(0)) return t;
                }
                return tm.mkTrue();
            }
            case LEQ:
            case GEQ:
                return t.get(0) == t.get(1) ? tm.mkTrue() : t;
            case LT:
            case GT:
                return t.get(0) == t.get(1) ? tm.mkFalse() : t;
            case PLUS:
            case MULT:
                return simplifyArith(t);
            case MINUS:
                if (t.get(0) == t.get(1)) return tm.mkConst(0);
                if (isConst(t.get(1), 0)) return t.get(0);
                return t;
            case INTS_DIVISION_TOTAL:
                return isConst(t.get(1), 1) ? t.get(0) : t;
            case INTS_MODULUS_TOTAL:
                return isConst(t.get(1), 1) ? tm.mkConst(0) : t;
            default:
                return t;
        }
    }

    private Term simplifyJunction(Term t) throws Err {
        final boolean isAnd = t.kind == Kind.AND;
        Set<Term> operands = new LinkedHashSet<Term>();
        boolean changed = false;
        for (Term c : t.children) {
            if (c.kind == t.kind) {
                operands.addAll(c.children);
                changed = true;
            } else if (c.isConst()) {
                // a neutral element disappears, an absorbing one decides the result
                if (c.getBooleanValue() != isAnd) return c;
                changed = true;
            } else if (!operands.add(c)) {
                changed = true;
            }
        }
        if (!changed) return t;
        if (operands.isEmpty()) return tm.mkBool(isAnd);
        if (operands.size() == 1) return operands.iterator().next();
        return tm.mkNode(t.kind, new Vector<Term>(operands));
    }

    private Term simplifyArith(Term t) throws Err {
        final boolean isPlus = t.kind == Kind.PLUS;
        final BigInteger neutral = isPlus ? BigInteger.ZERO : BigInteger.ONE;
        BigInteger constant = neutral;
        int constants = 0;
        boolean nested = false;
        List<Term> operands = new Vector<Term>();
        for (Term c : t.children) {
            if (c.kind == t.kind) {
                nested = true;
                for (Term cc : c.children) {
                    if (cc.kind == Kind.CONST_INTEGER) {
                        constant = isPlus ? constant.add(cc.getValue()) : constant.multiply(cc.getValue());
                        constants++;
                    } else {
                        operands.add(cc);
                    }
                }
            } else if (c.kind == Kind.CONST_INTEGER) {
                constant = isPlus ? constant.add(c.getValue()) : constant.multiply(c.getValue());
                constants++;
            } else {
                operands.add(c);
            }
        }
        if (!isPlus && constant.signum() == 0) return tm.mkConst(0);
        boolean dropConstant = constant.equals(neutral);
        // nothing to do: no nesting, and at most one constant which already leads
        if (!nested && (constants == 0 || (constants == 1 && !dropConstant && t.get(0).isConst()))) return t;
        List<Term> result = new Vector<Term>();
        if (!dropConstant) result.add(tm.mkConst(constant));
        result.addAll(operands);
        if (result.isEmpty()) return tm.mkConst(neutral);
        if (result.size() == 1) return result.get(0);
        return tm.mkNode(t.kind, result);
    }
}
