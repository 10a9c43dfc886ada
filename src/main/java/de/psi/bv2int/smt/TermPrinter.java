package de.psi.bv2int.smt;

import java.math.BigInteger;
import java.util.List;
import java.util.Vector;

import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Sort;
import de.psi.bv2int.term.Term;

/**
 * Renders terms and sorts as SMT-LIB s-expressions. Symbols become leaves so
 * that callers can still find them in the printed form.
 */
public class TermPrinter {

    public static SExpr<Term> print(Term t) {
        switch (t.kind) {
            case VARIABLE:
            case BOUND_VARIABLE:
                return SExpr.leaf(t);
            case CONST_BOOLEAN:
                return SExpr.sym(t.getBooleanValue() ? "true" : "false");
            case CONST_INTEGER:
                return SExpr.num(t.getValue());
            case CONST_BITVECTOR:
                return SExpr.sym(bitvectorLiteral(t.getValue(), t.sort.getBitVectorSize()));
            default:
                break;
        }
        List<SExpr<Term>> args = new Vector<SExpr<Term>>();
        for (Term child : t.children) {
            args.add(print(child));
        }
        SExpr<Term> head;
        if (t.kind == Kind.APPLY_UF) {
            head = SExpr.leaf(t.op);
        } else if (t.kind.isIndexed()) {
            head = SExpr.indexed(t.kind.smtName, t.indices);
        } else {
            head = SExpr.sym(t.kind.smtName);
        }
        return SExpr.call(head, args);
    }

    public static String bitvectorLiteral(BigInteger value, int width) {
        StringBuilder sb = new StringBuilder(value.toString(2));
        while (sb.length() < width) sb.insert(0, '0');
        return "#b" + sb;
    }

    public static SExpr<Term> print(Sort sort) {
        if (sort.isBitVector()) {
            List<Integer> width = new Vector<Integer>();
            width.add(sort.getBitVectorSize());
            return SExpr.indexed("BitVec", width);
        }
        if (sort.isFunction()) throw new AssertionError("function sorts have no s-expression form: " + sort);
        return SExpr.sym(sort.toString());
    }

    /** The parameter list of a declare-fun: the domain of a function, or () for a constant. */
    public static SExpr<Term> printDomain(Sort sort) {
        List<SExpr<Term>> items = new Vector<SExpr<Term>>();
        if (sort.isFunction()) {
            for (Sort s : sort.getArgTypes()) items.add(print(s));
        }
        return SExpr.list(items);
    }

    public static SExpr<Term> printRange(Sort sort) {
        return print(sort.isFunction() ? sort.getRangeType() : sort);
    }
}
