package de.psi.bv2int.term;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Evaluates ground terms. Booleans evaluate to {@link Boolean}, integers and
 * bit-vectors to {@link BigInteger} (bit-vectors as their unsigned value).
 * Free symbols take their value from the assignment given at construction;
 * function symbols must be bound to an {@link Interpretation}.
 */
public class Evaluator {

    public interface Interpretation {
        Object apply(List<Object> args);
    }

    private final Map<Term, Object> assignment;
    private final Map<Term, Object> cache = new HashMap<Term, Object>();

    public Evaluator(Map<Term, ?> assignment) {
        this.assignment = new HashMap<Term, Object>(assignment);
    }

    public Evaluator() {
        this(new HashMap<Term, Object>());
    }

    public static Object evaluate(Term t, Map<Term, ?> assignment) throws ErrorFatal {
        return new Evaluator(assignment).eval(t);
    }

    public boolean holds(Term formula) throws ErrorFatal {
        return (Boolean) eval(formula);
    }

    public Object eval(Term root) throws ErrorFatal {
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
            if (ready) {
                toVisit.remove(toVisit.size() - 1);
                Vector<Object> args = new Vector<Object>();
                for (Term child : current.children) args.add(cache.get(child));
                cache.put(current, apply(current, args));
            }
        }
        return cache.get(root);
    }

    private static BigInteger n(Object o) {
        return (BigInteger) o;
    }

    private static boolean b(Object o) {
        return (Boolean) o;
    }

    private static int width(Term t) {
        return t.sort.getBitVectorSize();
    }

    private Object apply(Term t, List<Object> a) throws ErrorFatal {
        switch (t.kind) {
            case VARIABLE:
            case BOUND_VARIABLE: {
                Object value = assignment.get(t);
                if (value == null) throw new ErrorFatal("No value assigned to " + t.getName());
                return value;
            }
            case CONST_BOOLEAN:
                return t.getBooleanValue();
            case CONST_INTEGER:
            case CONST_BITVECTOR:
                return t.getValue();
            case EQUAL: {
                for (int i = 1; i < a.size(); ++i) {
                    if (!a.get(0).equals(a.get(i))) return false;
                }
                return true;
            }
            case DISTINCT: {
                for (int i = 0; i < a.size(); ++i) {
                    for (int j = i + 1; j < a.size(); ++j) {
                        if (a.get(i).equals(a.get(j))) return false;
                    }
                }
                return true;
            }
            case NOT:
                return !b(a.get(0));
            case AND: {
                for (Object o : a) if (!b(o)) return false;
                return true;
            }
            case OR: {
                for (Object o : a) if (b(o)) return true;
                return false;
            }
            case XOR:
                return b(a.get(0)) != b(a.get(1));
            case IMPLIES:
                return !b(a.get(0)) || b(a.get(1));
            case ITE:
                return b(a.get(0)) ? a.get(1) : a.get(2);
            case APPLY_UF: {
                Object f = assignment.get(t.op);
                if (!(f instanceof Interpretation)) throw new ErrorFatal("No interpretation for " + t.op.getName());
                return ((Interpretation) f).apply(a);
            }
            case PLUS: {
                BigInteger r = BigInteger.ZERO;
                for (Object o : a) r = r.add(n(o));
                return r;
            }
            case MULT: {
                BigInteger r = BigInteger.ONE;
                for (Object o : a) r = r.multiply(n(o));
                return r;
            }
            case MINUS:
                return n(a.get(0)).subtract(n(a.get(1)));
            case UMINUS:
                return n(a.get(0)).negate();
            case INTS_DIVISION_TOTAL:
                return Helpers.divTotal(n(a.get(0)), n(a.get(1)));
            case INTS_MODULUS_TOTAL:
                return Helpers.modTotal(n(a.get(0)), n(a.get(1)));
            case LT:
                return n(a.get(0)).compareTo(n(a.get(1))) < 0;
            case LEQ:
                return n(a.get(0)).compareTo(n(a.get(1))) <= 0;
            case GT:
                return n(a.get(0)).compareTo(n(a.get(1))) > 0;
            case GEQ:
                return n(a.get(0)).compareTo(n(a.get(1))) >= 0;
            case INT_TO_BITVECTOR:
                return n(a.get(0)).mod(Helpers.pow2(t.getIndex(0)));
            case BITVECTOR_TO_NAT:
                return a.get(0);
            default:
                return applyBitVector(t, a);
        }
    }

    private static Object applyBitVector(Term t, List<Object> a) {
        final int k = width(t.get(0));
        final BigInteger mod = Helpers.pow2(k);
        final BigInteger ones = Helpers.maxUnsigned(k);
        switch (t.kind) {
            case BITVECTOR_CONCAT: {
                BigInteger r = BigInteger.ZERO;
                for (int i = 0; i < a.size(); ++i) {
                    r = r.shiftLeft(width(t.get(i))).or(n(a.get(i)));
                }
                return r;
            }
            case BITVECTOR_AND: {
                BigInteger r = ones;
                for (Object o : a) r = r.and(n(o));
                return r;
            }
            case BITVECTOR_OR: {
                BigInteger r = BigInteger.ZERO;
                for (Object o : a) r = r.or(n(o));
                return r;
            }
            case BITVECTOR_XOR: {
                BigInteger r = BigInteger.ZERO;
                for (Object o : a) r = r.xor(n(o));
                return r;
            }
            case BITVECTOR_NOT:
                return ones.xor(n(a.get(0)));
            case BITVECTOR_NAND:
                return ones.xor(n(a.get(0)).and(n(a.get(1))));
            case BITVECTOR_NOR:
                return ones.xor(n(a.get(0)).or(n(a.get(1))));
            case BITVECTOR_XNOR:
                return ones.xor(n(a.get(0)).xor(n(a.get(1))));
            case BITVECTOR_COMP:
                return a.get(0).equals(a.get(1)) ? BigInteger.ONE : BigInteger.ZERO;
            case BITVECTOR_PLUS: {
                BigInteger r = BigInteger.ZERO;
                for (Object o : a) r = r.add(n(o));
                return r.mod(mod);
            }
            case BITVECTOR_MULT: {
                BigInteger r = BigInteger.ONE;
                for (Object o : a) r = r.multiply(n(o));
                return r.mod(mod);
            }
            case BITVECTOR_SUB:
                return n(a.get(0)).subtract(n(a.get(1))).mod(mod);
            case BITVECTOR_NEG:
                return n(a.get(0)).negate().mod(mod);
            case BITVECTOR_UDIV:
                return udiv(n(a.get(0)), n(a.get(1)), k);
            case BITVECTOR_UREM:
                return urem(n(a.get(0)), n(a.get(1)));
            case BITVECTOR_SDIV: {
                BigInteger s = n(a.get(0)), u = n(a.get(1));
                boolean ns = s.testBit(k - 1), nu = u.testBit(k - 1);
                BigInteger as = ns ? s.negate().mod(mod) : s;
                BigInteger au = nu ? u.negate().mod(mod) : u;
                BigInteger q = udiv(as, au, k);
                return ns != nu ? q.negate().mod(mod) : q;
            }
            case BITVECTOR_SREM: {
                BigInteger s = n(a.get(0)), u = n(a.get(1));
                boolean ns = s.testBit(k - 1), nu = u.testBit(k - 1);
                BigInteger as = ns ? s.negate().mod(mod) : s;
                BigInteger au = nu ? u.negate().mod(mod) : u;
                BigInteger r = urem(as, au);
                return ns ? r.negate().mod(mod) : r;
            }
            case BITVECTOR_SMOD: {
                BigInteger s = n(a.get(0)), u = n(a.get(1));
                boolean ns = s.testBit(k - 1), nu = u.testBit(k - 1);
                BigInteger as = ns ? s.negate().mod(mod) : s;
                BigInteger au = nu ? u.negate().mod(mod) : u;
                BigInteger r = urem(as, au);
                if (r.signum() == 0 || (!ns && !nu)) return r;
                if (ns && !nu) return r.negate().add(u).mod(mod);
                if (!ns) return r.add(u).mod(mod);
                return r.negate().mod(mod);
            }
            case BITVECTOR_SHL: {
                BigInteger s = n(a.get(1));
                if (s.compareTo(BigInteger.valueOf(k)) >= 0) return BigInteger.ZERO;
                return n(a.get(0)).shiftLeft(s.intValue()).mod(mod);
            }
            case BITVECTOR_LSHR: {
                BigInteger s = n(a.get(1));
                if (s.compareTo(BigInteger.valueOf(k)) >= 0) return BigInteger.ZERO;
                return n(a.get(0)).shiftRight(s.intValue());
            }
            case BITVECTOR_ASHR: {
                BigInteger s = n(a.get(1));
                int amount = s.compareTo(BigInteger.valueOf(k)) >= 0 ? k : s.intValue();
                return Helpers.toSigned(n(a.get(0)), k).shiftRight(amount).mod(mod);
            }
            case BITVECTOR_ULT:
                return n(a.get(0)).compareTo(n(a.get(1))) < 0;
            case BITVECTOR_ULE:
                return n(a.get(0)).compareTo(n(a.get(1))) <= 0;
            case BITVECTOR_UGT:
                return n(a.get(0)).compareTo(n(a.get(1))) > 0;
            case BITVECTOR_UGE:
                return n(a.get(0)).compareTo(n(a.get(1))) >= 0;
            case BITVECTOR_SLT:
                return Helpers.toSigned(n(a.get(0)), k).compareTo(Helpers.toSigned(n(a.get(1)), k)) < 0;
            case BITVECTOR_SLE:
                return Helpers.toSigned(n(a.get(0)), k).compareTo(Helpers.toSigned(n(a.get(1)), k)) <= 0;
            case BITVECTOR_SGT:
                return Helpers.toSigned(n(a.get(0)), k).compareTo(Helpers.toSigned(n(a.get(1)), k)) > 0;
            case BITVECTOR_SGE:
                return Helpers.toSigned(n(a.get(0)), k).compareTo(Helpers.toSigned(n(a.get(1)), k)) >= 0;
            case BITVECTOR_ITE:
                return n(a.get(0)).signum() != 0 ? a.get(1) : a.get(2);
            case BITVECTOR_EXTRACT: {
                int high = t.getIndex(0), low = t.getIndex(1);
                return n(a.get(0)).shiftRight(low).mod(Helpers.pow2(high - low + 1));
            }
            case BITVECTOR_REPEAT: {
                BigInteger r = BigInteger.ZERO;
                for (int i = 0; i < t.getIndex(0); ++i) r = r.shiftLeft(k).or(n(a.get(0)));
                return r;
            }
            case BITVECTOR_ZERO_EXTEND:
                return a.get(0);
            case BITVECTOR_SIGN_EXTEND:
                return Helpers.toSigned(n(a.get(0)), k).mod(Helpers.pow2(k + t.getIndex(0)));
            case BITVECTOR_ROTATE_LEFT: {
                int r = t.getIndex(0) % k;
                BigInteger v = n(a.get(0));
                return v.shiftLeft(r).or(v.shiftRight(k - r)).mod(mod);
            }
            case BITVECTOR_ROTATE_RIGHT: {
                int r = t.getIndex(0) % k;
                BigInteger v = n(a.get(0));
                return v.shiftRight(r).or(v.shiftLeft(k - r)).mod(mod);
            }
            default:
                throw new AssertionError("cannot evaluate " + t.kind);
        }
    }

    private static BigInteger udiv(BigInteger a, BigInteger b, int k) {
        if (b.signum() == 0) return Helpers.maxUnsigned(k);
        return a.divide(b);
    }

    private static BigInteger urem(BigInteger a, BigInteger b) {
        if (b.signum() == 0) return a;
        return a.mod(b);
    }
}
