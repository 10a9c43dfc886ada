package de.psi.bv2int.term;

import java.math.BigInteger;

import de.psi.bv2int.smt.SExpr;
import de.psi.bv2int.smt.TermPrinter;
import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Immutable node of the term DAG. Terms are created by a {@link TermManager}
 * which hash-conses them, so two terms denote the same expression iff they
 * are the same object.
 */
public final class Term {
    /** Creation order; unique within one TermManager. */
    public final int id;
    public final Kind kind;
    public final Sort sort;
    public final ConstList<Term> children;
    public final ConstList<Integer> indices;
    /** The function symbol of an APPLY_UF node, null otherwise. */
    public final Term op;
    /** Name of a symbol, value of a constant, null otherwise. */
    private final Object payload;

    Term(int id, Kind kind, Sort sort, ConstList<Term> children, ConstList<Integer> indices, Term op, Object payload) {
        this.id = id;
        this.kind = kind;
        this.sort = sort;
        this.children = children;
        this.indices = indices;
        this.op = op;
        this.payload = payload;
    }

    public int getNumChildren() {
        return children.size();
    }

    public Term get(int i) {
        return children.get(i);
    }

    public int getIndex(int i) {
        return indices.get(i);
    }

    public boolean isVar() {
        return kind == Kind.VARIABLE || kind == Kind.BOUND_VARIABLE;
    }

    public boolean isConst() {
        return kind.isConst();
    }

    public String getName() {
        if (!isVar()) throw new AssertionError("not a symbol: " + this);
        return (String) payload;
    }

    /** Value of an integer or bit-vector constant (unsigned for bit-vectors). */
    public BigInteger getValue() {
        if (kind != Kind.CONST_INTEGER && kind != Kind.CONST_BITVECTOR)
            throw new AssertionError("not a numeric constant: " + this);
        return (BigInteger) payload;
    }

    public boolean getBooleanValue() {
        if (kind != Kind.CONST_BOOLEAN) throw new AssertionError("not a boolean constant: " + this);
        return (Boolean) payload;
    }

    Object payload() {
        return payload;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        if (isVar()) return SExpr.quote((String) payload);
        return TermPrinter.print(this).toString();
    }
}
