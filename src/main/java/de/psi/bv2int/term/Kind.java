package de.psi.bv2int.term;

import java.util.HashMap;
import java.util.Map;

/**
 * Operator kinds of the term language.
 */
public enum Kind {
    // leaves
    VARIABLE(null, 0),
    BOUND_VARIABLE(null, 0),
    CONST_BOOLEAN(null, 0),
    CONST_INTEGER(null, 0),
    CONST_BITVECTOR(null, 0),

    // core
    EQUAL("=", 0),
    DISTINCT("distinct", 0),
    NOT("not", 0),
    AND("and", 0),
    OR("or", 0),
    XOR("xor", 0),
    IMPLIES("=>", 0),
    ITE("ite", 0),
    APPLY_UF(null, 0),

    // integer arithmetic
    PLUS("+", 0),
    MINUS("-", 0),
    UMINUS("-", 0),
    MULT("*", 0),
    INTS_DIVISION_TOTAL("div", 0),
    INTS_MODULUS_TOTAL("mod", 0),
    LT("<", 0),
    LEQ("<=", 0),
    GT(">", 0),
    GEQ(">=", 0),
    INT_TO_BITVECTOR("int2bv", 1),
    BITVECTOR_TO_NAT("bv2nat", 0),

    // bit-vectors
    BITVECTOR_CONCAT("concat", 0),
    BITVECTOR_AND("bvand", 0),
    BITVECTOR_OR("bvor", 0),
    BITVECTOR_XOR("bvxor", 0),
    BITVECTOR_NOT("bvnot", 0),
    BITVECTOR_NAND("bvnand", 0),
    BITVECTOR_NOR("bvnor", 0),
    BITVECTOR_XNOR("bvxnor", 0),
    BITVECTOR_COMP("bvcomp", 0),
    BITVECTOR_PLUS("bvadd", 0),
    BITVECTOR_SUB("bvsub", 0),
    BITVECTOR_NEG("bvneg", 0),
    BITVECTOR_MULT("bvmul", 0),
    BITVECTOR_UDIV("bvudiv", 0),
    BITVECTOR_UREM("bvurem", 0),
    BITVECTOR_SDIV("bvsdiv", 0),
    BITVECTOR_SREM("bvsrem", 0),
    BITVECTOR_SMOD("bvsmod", 0),
    BITVECTOR_SHL("bvshl", 0),
    BITVECTOR_LSHR("bvlshr", 0),
    BITVECTOR_ASHR("bvashr", 0),
    BITVECTOR_ULT("bvult", 0),
    BITVECTOR_ULE("bvule", 0),
    BITVECTOR_UGT("bvugt", 0),
    BITVECTOR_UGE("bvuge", 0),
    BITVECTOR_SLT("bvslt", 0),
    BITVECTOR_SLE("bvsle", 0),
    BITVECTOR_SGT("bvsgt", 0),
    BITVECTOR_SGE("bvsge", 0),
    BITVECTOR_ITE("bvite", 0),
    BITVECTOR_EXTRACT("extract", 2),
    BITVECTOR_REPEAT("repeat", 1),
    BITVECTOR_ZERO_EXTEND("zero_extend", 1),
    BITVECTOR_SIGN_EXTEND("sign_extend", 1),
    BITVECTOR_ROTATE_LEFT("rotate_left", 1),
    BITVECTOR_ROTATE_RIGHT("rotate_right", 1);

    /** SMT-LIB name, null for leaves and applications. */
    public final String smtName;
    /** Number of integer indices, as in {@code (_ extract i j)}. */
    public final int numIndices;

    Kind(String smtName, int numIndices) {
        this.smtName = smtName;
        this.numIndices = numIndices;
    }

    public boolean isLeaf() {
        return ordinal() <= CONST_BITVECTOR.ordinal();
    }

    public boolean isConst() {
        return this == CONST_BOOLEAN || this == CONST_INTEGER || this == CONST_BITVECTOR;
    }

    public boolean isIndexed() {
        return numIndices > 0;
    }

    private static final Map<String, Kind> byName = new HashMap<String, Kind>();

    static {
        for (Kind k : values()) {
            // unary minus shares "-" with binary minus and is picked by arity
            if (k.smtName != null && k != UMINUS) byName.put(k.smtName, k);
        }
    }

    /** Looks up an operator by its SMT-LIB name, or returns null. */
    public static Kind fromSmtName(String name) {
        return byName.get(name);
    }
}
