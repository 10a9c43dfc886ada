package de.psi.bv2int.preprocessing;

import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Term;

/**
 * The rewrites of the {@link OperatorEliminator}, in the order they are tried.
 */
public enum EliminationRule {
    UDIV_ZERO(Kind.BITVECTOR_UDIV),
    SDIV(Kind.BITVECTOR_SDIV),
    SREM(Kind.BITVECTOR_SREM),
    SMOD(Kind.BITVECTOR_SMOD),
    XNOR(Kind.BITVECTOR_XNOR),
    NAND(Kind.BITVECTOR_NAND),
    NOR(Kind.BITVECTOR_NOR),
    NEG(Kind.BITVECTOR_NEG),
    XOR(Kind.BITVECTOR_XOR),
    OR(Kind.BITVECTOR_OR),
    SUB(Kind.BITVECTOR_SUB),
    REPEAT(Kind.BITVECTOR_REPEAT),
    ROTATE_RIGHT(Kind.BITVECTOR_ROTATE_RIGHT),
    ROTATE_LEFT(Kind.BITVECTOR_ROTATE_LEFT),
    COMP(Kind.BITVECTOR_COMP),
    SLE(Kind.BITVECTOR_SLE),
    SLT(Kind.BITVECTOR_SLT),
    SGT(Kind.BITVECTOR_SGT),
    SGE(Kind.BITVECTOR_SGE),
    SHL_BY_CONST(Kind.BITVECTOR_SHL),
    LSHR_BY_CONST(Kind.BITVECTOR_LSHR),
    ASHR_BY_CONST(Kind.BITVECTOR_ASHR);

    public final Kind kind;

    private EliminationRule(Kind kind) {
        this.kind = kind;
    }

    /** Whether the rule rewrites the root of t. */
    public boolean matches(Term t) {
        if (t.kind != kind) return false;
        switch (this) {
            case UDIV_ZERO:
                return t.get(1).kind == Kind.CONST_BITVECTOR && t.get(1).getValue().signum() == 0;
            case SHL_BY_CONST:
            case LSHR_BY_CONST:
            case ASHR_BY_CONST:
                return t.get(1).kind == Kind.CONST_BITVECTOR;
            default:
                return true;
        }
    }
}
