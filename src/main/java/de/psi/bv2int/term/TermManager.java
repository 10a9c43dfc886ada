package de.psi.bv2int.term;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstList.TempList;
import edu.mit.csail.sdg.alloy4.ErrorType;

/**
 * Creates terms. Every node is hash-consed: asking twice for the same
 * operator over the same children (and indices, symbol, constant) yields the
 * same object. The sort of a node is computed from its kind and children, and
 * ill-sorted requests are rejected with an {@link ErrorType}.
 */
public class TermManager {
    private final Map<NodeKey, Term> nodes = new HashMap<NodeKey, Term>();
    private final Map<String, Term> symbols = new HashMap<String, Term>();
    private final Map<String, Integer> skolemCounters = new HashMap<String, Integer>();
    private final ConstList<Term> noChildren = ConstList.make();
    private final ConstList<Integer> noIndices = ConstList.make();
    private int nextId = 0;
    private int boundVarCounter = 0;

    private final Term trueTerm;
    private final Term falseTerm;

    public TermManager() {
        trueTerm = intern(Kind.CONST_BOOLEAN, Sort.BOOL, noChildren, noIndices, null, Boolean.TRUE);
        falseTerm = intern(Kind.CONST_BOOLEAN, Sort.BOOL, noChildren, noIndices, null, Boolean.FALSE);
    }

    private static final class NodeKey {
        final Kind kind;
        final Term[] children;
        final int[] indices;
        final Term op;
        final Object payload;
        final Sort sort;
        final int hash;

        NodeKey(Kind kind, Sort sort, List<Term> children, ConstList<Integer> indices, Term op, Object payload) {
            this.kind = kind;
            this.sort = sort;
            this.children = children.toArray(new Term[children.size()]);
            this.indices = new int[indices.size()];
            for (int i = 0; i < this.indices.length; ++i) this.indices[i] = indices.get(i);
            this.op = op;
            this.payload = payload;
            int h = kind.hashCode();
            for (Term t : this.children) h = 31 * h + t.id;
            h = 31 * h + Arrays.hashCode(this.indices);
            if (op != null) h = 31 * h + op.id;
            if (payload != null) h = 31 * h + payload.hashCode();
            if (sort != null) h = 31 * h + sort.hashCode();
            this.hash = h;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof NodeKey)) return false;
            NodeKey that = (NodeKey) o;
            if (kind != that.kind || op != that.op || children.length != that.children.length) return false;
            for (int i = 0; i < children.length; ++i) {
                if (children[i] != that.children[i]) return false;
            }
            if (!Arrays.equals(indices, that.indices)) return false;
            if (payload == null ? that.payload != null : !payload.equals(that.payload)) return false;
            return sort == null ? that.sort == null : sort.equals(that.sort);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    private Term intern(Kind kind, Sort sort, ConstList<Term> children, ConstList<Integer> indices, Term op, Object payload) {
        // the sort only distinguishes leaves; inner nodes derive it from their children
        Sort keySort = kind.isLeaf() ? sort : null;
        NodeKey key = new NodeKey(kind, keySort, children, indices, op, payload);
        Term result = nodes.get(key);
        if (result == null) {
            result = new Term(nextId++, kind, sort, children, indices, op, payload);
            nodes.put(key, result);
        }
        return result;
    }

    /** Number of distinct nodes created so far. */
    public int size() {
        return nodes.size();
    }

    // ------------------------------------------------------------------ leaves

    public Term mkTrue() {
        return trueTerm;
    }

    public Term mkFalse() {
        return falseTerm;
    }

    public Term mkBool(boolean value) {
        return value ? trueTerm : falseTerm;
    }

    public Term mkConst(BigInteger value) {
        return intern(Kind.CONST_INTEGER, Sort.INT, noChildren, noIndices, null, value);
    }

    public Term mkConst(long value) {
        return mkConst(BigInteger.valueOf(value));
    }

    /** A bit-vector literal; the value is reduced modulo 2^width. */
    public Term mkBitVector(int width, BigInteger value) {
        BigInteger v = value.mod(Helpers.pow2(width));
        return intern(Kind.CONST_BITVECTOR, Sort.bitvector(width), noChildren, noIndices, null, v);
    }

    public Term mkBitVector(int width, long value) {
        return mkBitVector(width, BigInteger.valueOf(value));
    }

    /**
     * Declares (or looks up) the free symbol with the given name. A name can
     * only ever be bound to one sort.
     */
    public Term mkVar(String name, Sort sort) throws ErrorType {
        Term old = symbols.get(name);
        if (old != null) {
            if (!old.sort.equals(sort))
                throw new ErrorType("Symbol " + name + " is already declared with sort " + old.sort);
            return old;
        }
        Term var = intern(Kind.VARIABLE, sort, noChildren, noIndices, null, name);
        symbols.put(name, var);
        return var;
    }

    /** Returns the declared symbol with this name, or null. */
    public Term lookupVar(String name) {
        return symbols.get(name);
    }

    /**
     * Allocates a fresh free symbol whose name starts with the prefix and does
     * not clash with any symbol declared so far.
     */
    public Term mkSkolem(String prefix, Sort sort) {
        Integer counter = skolemCounters.get(prefix);
        int n = counter == null ? 0 : counter;
        String name;
        do {
            name = prefix + "_" + n++;
        } while (symbols.containsKey(name));
        skolemCounters.put(prefix, n);
        Term var = intern(Kind.VARIABLE, sort, noChildren, noIndices, null, name);
        symbols.put(name, var);
        return var;
    }

    /** A fresh bound variable, for formal parameters of definitions. */
    public Term mkBoundVar(Sort sort) {
        String name = "_bv_" + boundVarCounter++;
        return intern(Kind.BOUND_VARIABLE, sort, noChildren, noIndices, null, name);
    }

    // ------------------------------------------------------------------ inner nodes

    public Term mkNode(Kind kind, Term... children) throws ErrorType {
        return mkNode(kind, Arrays.asList(children));
    }

    public Term mkNode(Kind kind, List<Term> children) throws ErrorType {
        return mkIndexed(kind, noIndices, children);
    }

    public Term mkIndexed(Kind kind, int index, Term child) throws ErrorType {
        TempList<Integer> idx = new TempList<Integer>();
        idx.add(index);
        return mkIndexed(kind, idx.makeConst(), Arrays.asList(child));
    }

    public Term mkExtract(int high, int low, Term child) throws ErrorType {
        TempList<Integer> idx = new TempList<Integer>();
        idx.add(high);
        idx.add(low);
        return mkIndexed(Kind.BITVECTOR_EXTRACT, idx.makeConst(), Arrays.asList(child));
    }

    public Term mkIndexed(Kind kind, List<Integer> indices, List<Term> children) throws ErrorType {
        if (kind.isLeaf() || kind == Kind.APPLY_UF) throw new AssertionError("use the dedicated factory for " + kind);
        if (indices.size() != kind.numIndices)
            throw new ErrorType(kind + " expects " + kind.numIndices + " indices but got " + indices.size());
        ConstList<Integer> idx = ConstList.make(indices);
        ConstList<Term> ch = ConstList.make(children);
        Sort sort = computeSort(kind, idx, ch);
        return intern(kind, sort, ch, idx, null, null);
    }

    /** Rebuilds a node of the same kind and indices as {@code original} over new children. */
    public Term mkLike(Term original, List<Term> children) throws ErrorType {
        if (original.kind == Kind.APPLY_UF) return mkApply(original.op, children);
        if (children.isEmpty()) return original;
        return mkIndexed(original.kind, original.indices, children);
    }

    public Term mkApply(Term function, List<Term> args) throws ErrorType {
        if (!function.isVar() || !function.sort.isFunction())
            throw new ErrorType("Not a function symbol: " + function);
        List<Sort> domain = function.sort.getArgTypes();
        if (domain.size() != args.size())
            throw new ErrorType("Function " + function + " expects " + domain.size() + " arguments but got " + args.size());
        for (int i = 0; i < args.size(); ++i) {
            if (!args.get(i).sort.equals(domain.get(i)))
                throw new ErrorType("Argument " + (i + 1) + " of " + function + " must have sort " + domain.get(i)
                        + " but " + args.get(i) + " has sort " + args.get(i).sort);
        }
        return intern(Kind.APPLY_UF, function.sort.getRangeType(), ConstList.make(args), noIndices, function, null);
    }

    // ------------------------------------------------------------------ sort inference

    private static ErrorType illSorted(Kind kind, List<Term> children, String why) {
        StringBuilder sb = new StringBuilder();
        sb.append("Ill-sorted application of ").append(kind.smtName != null ? kind.smtName : kind.toString());
        sb.append(" to");
        for (Term t : children) sb.append(" ").append(t.sort);
        sb.append(": ").append(why);
        return new ErrorType(sb.toString());
    }

    private static void checkArity(Kind kind, List<Term> children, int min, int max) throws ErrorType {
        int n = children.size();
        if (n < min || (max >= 0 && n > max)) {
            String expected = max < 0 ? "at least " + min : (min == max ? String.valueOf(min) : min + " to " + max);
            throw illSorted(kind, children, "expected " + expected + " arguments");
        }
    }

    private static void checkAll(Kind kind, List<Term> children, Sort sort) throws ErrorType {
        for (Term t : children) {
            if (!t.sort.equals(sort)) throw illSorted(kind, children, "expected arguments of sort " + sort);
        }
    }

    private static int checkBitVectors(Kind kind, List<Term> children) throws ErrorType {
        int width = -1;
        for (Term t : children) {
            if (!t.sort.isBitVector()) throw illSorted(kind, children, "expected bit-vector arguments");
            if (width < 0) width = t.sort.getBitVectorSize();
            else if (width != t.sort.getBitVectorSize()) throw illSorted(kind, children, "widths differ");
        }
        return width;
    }

    private static Sort computeSort(Kind kind, ConstList<Integer> idx, List<Term> ch) throws ErrorType {
        switch (kind) {
            case EQUAL:
            case DISTINCT:
                checkArity(kind, ch, 2, -1);
                checkAll(kind, ch, ch.get(0).sort);
                if (ch.get(0).sort.isFunction()) throw illSorted(kind, ch, "functions cannot be compared");
                return Sort.BOOL;
            case NOT:
                checkArity(kind, ch, 1, 1);
                checkAll(kind, ch, Sort.BOOL);
                return Sort.BOOL;
            case AND:
            case OR:
                checkArity(kind, ch, 1, -1);
                checkAll(kind, ch, Sort.BOOL);
                return Sort.BOOL;
            case XOR:
            case IMPLIES:
                checkArity(kind, ch, 2, 2);
                checkAll(kind, ch, Sort.BOOL);
                return Sort.BOOL;
            case ITE:
                checkArity(kind, ch, 3, 3);
                if (!ch.get(0).sort.isBoolean()) throw illSorted(kind, ch, "condition must be Bool");
                if (!ch.get(1).sort.equals(ch.get(2).sort)) throw illSorted(kind, ch, "branches differ");
                return ch.get(1).sort;
            case PLUS:
            case MULT:
                checkArity(kind, ch, 2, -1);
                checkAll(kind, ch, Sort.INT);
                return Sort.INT;
            case MINUS:
            case INTS_DIVISION_TOTAL:
            case INTS_MODULUS_TOTAL:
                checkArity(kind, ch, 2, 2);
                checkAll(kind, ch, Sort.INT);
                return Sort.INT;
            case UMINUS:
                checkArity(kind, ch, 1, 1);
                checkAll(kind, ch, Sort.INT);
                return Sort.INT;
            case LT:
            case LEQ:
            case GT:
            case GEQ:
                checkArity(kind, ch, 2, 2);
                checkAll(kind, ch, Sort.INT);
                return Sort.BOOL;
            case INT_TO_BITVECTOR:
                checkArity(kind, ch, 1, 1);
                checkAll(kind, ch, Sort.INT);
                if (idx.get(0) < 1) throw illSorted(kind, ch, "width must be positive");
                return Sort.bitvector(idx.get(0));
            case BITVECTOR_TO_NAT:
                checkArity(kind, ch, 1, 1);
                checkBitVectors(kind, ch);
                return Sort.INT;
            case BITVECTOR_CONCAT: {
                checkArity(kind, ch, 2, -1);
                int width = 0;
                for (Term t : ch) {
                    if (!t.sort.isBitVector()) throw illSorted(kind, ch, "expected bit-vector arguments");
                    width += t.sort.getBitVectorSize();
                }
                return Sort.bitvector(width);
            }
            case BITVECTOR_AND:
            case BITVECTOR_OR:
            case BITVECTOR_XOR:
            case BITVECTOR_PLUS:
            case BITVECTOR_MULT:
                checkArity(kind, ch, 2, -1);
                return Sort.bitvector(checkBitVectors(kind, ch));
            case BITVECTOR_NAND:
            case BITVECTOR_NOR:
            case BITVECTOR_XNOR:
            case BITVECTOR_SUB:
            case BITVECTOR_UDIV:
            case BITVECTOR_UREM:
            case BITVECTOR_SDIV:
            case BITVECTOR_SREM:
            case BITVECTOR_SMOD:
            case BITVECTOR_SHL:
            case BITVECTOR_LSHR:
            case BITVECTOR_ASHR:
                checkArity(kind, ch, 2, 2);
                return Sort.bitvector(checkBitVectors(kind, ch));
            case BITVECTOR_NOT:
            case BITVECTOR_NEG:
                checkArity(kind, ch, 1, 1);
                return Sort.bitvector(checkBitVectors(kind, ch));
            case BITVECTOR_COMP:
                checkArity(kind, ch, 2, 2);
                checkBitVectors(kind, ch);
                return Sort.bitvector(1);
            case BITVECTOR_ULT:
            case BITVECTOR_ULE:
            case BITVECTOR_UGT:
            case BITVECTOR_UGE:
            case BITVECTOR_SLT:
            case BITVECTOR_SLE:
            case BITVECTOR_SGT:
            case BITVECTOR_SGE:
                checkArity(kind, ch, 2, 2);
                checkBitVectors(kind, ch);
                return Sort.BOOL;
            case BITVECTOR_ITE:
                checkArity(kind, ch, 3, 3);
                if (!ch.get(0).sort.equals(Sort.bitvector(1))) throw illSorted(kind, ch, "condition must be (_ BitVec 1)");
                return Sort.bitvector(checkBitVectors(kind, ch.subList(1, 3)));
            case BITVECTOR_EXTRACT: {
                checkArity(kind, ch, 1, 1);
                int width = checkBitVectors(kind, ch);
                int high = idx.get(0), low = idx.get(1);
                if (low < 0 || high < low || high >= width) throw illSorted(kind, ch, "bad extract range [" + high + ":" + low + "]");
                return Sort.bitvector(high - low + 1);
            }
            case BITVECTOR_REPEAT: {
                checkArity(kind, ch, 1, 1);
                int width = checkBitVectors(kind, ch);
                if (idx.get(0) < 1) throw illSorted(kind, ch, "repeat count must be positive");
                return Sort.bitvector(width * idx.get(0));
            }
            case BITVECTOR_ZERO_EXTEND:
            case BITVECTOR_SIGN_EXTEND: {
                checkArity(kind, ch, 1, 1);
                int width = checkBitVectors(kind, ch);
                if (idx.get(0) < 0) throw illSorted(kind, ch, "extension must not be negative");
                return Sort.bitvector(width + idx.get(0));
            }
            case BITVECTOR_ROTATE_LEFT:
            case BITVECTOR_ROTATE_RIGHT:
                checkArity(kind, ch, 1, 1);
                if (idx.get(0) < 0) throw illSorted(kind, ch, "rotation must not be negative");
                return Sort.bitvector(checkBitVectors(kind, ch));
            default:
                throw new AssertionError("no sort rule for " + kind);
        }
    }
}
