package de.psi.bv2int.term;

import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Sort of a term. Sorts are plain values: two sorts are equal iff they
 * print the same.
 */
public final class Sort {

    public enum Tag { BOOLEAN, INTEGER, BITVECTOR, FUNCTION, UNINTERPRETED }

    public static final Sort BOOL = new Sort(Tag.BOOLEAN, 0, null, null, "Bool");
    public static final Sort INT = new Sort(Tag.INTEGER, 0, null, null, "Int");

    public final Tag tag;
    private final int width;
    private final ConstList<Sort> domain;
    private final Sort range;
    private final String name;

    private Sort(Tag tag, int width, ConstList<Sort> domain, Sort range, String name) {
        this.tag = tag;
        this.width = width;
        this.domain = domain;
        this.range = range;
        this.name = name;
    }

    public static Sort bitvector(int width) {
        if (width < 1) throw new IllegalArgumentException("bit-vector width must be positive: " + width);
        return new Sort(Tag.BITVECTOR, width, null, null, null);
    }

    public static Sort function(List<Sort> domain, Sort range) {
        if (domain.isEmpty()) return range;
        if (range.isFunction()) throw new IllegalArgumentException("function sorts cannot return functions");
        return new Sort(Tag.FUNCTION, 0, ConstList.make(domain), range, null);
    }

    public static Sort uninterpreted(String name) {
        return new Sort(Tag.UNINTERPRETED, 0, null, null, name);
    }

    public boolean isBoolean() { return tag == Tag.BOOLEAN; }
    public boolean isInteger() { return tag == Tag.INTEGER; }
    public boolean isBitVector() { return tag == Tag.BITVECTOR; }
    public boolean isFunction() { return tag == Tag.FUNCTION; }

    public int getBitVectorSize() {
        if (tag != Tag.BITVECTOR) throw new AssertionError("not a bit-vector sort: " + this);
        return width;
    }

    public ConstList<Sort> getArgTypes() {
        if (tag != Tag.FUNCTION) throw new AssertionError("not a function sort: " + this);
        return domain;
    }

    public Sort getRangeType() {
        if (tag != Tag.FUNCTION) throw new AssertionError("not a function sort: " + this);
        return range;
    }

    /** True if this sort mentions a bit-vector anywhere. */
    public boolean involvesBitVector() {
        if (tag == Tag.BITVECTOR) return true;
        if (tag != Tag.FUNCTION) return false;
        if (range.isBitVector()) return true;
        for (Sort s : domain) {
            if (s.isBitVector()) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sort)) return false;
        Sort that = (Sort) o;
        if (tag != that.tag) return false;
        switch (tag) {
            case BITVECTOR:
                return width == that.width;
            case FUNCTION:
                if (!range.equals(that.range) || domain.size() != that.domain.size()) return false;
                for (int i = 0; i < domain.size(); ++i) {
                    if (!domain.get(i).equals(that.domain.get(i))) return false;
                }
                return true;
            case UNINTERPRETED:
                return name.equals(that.name);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        switch (tag) {
            case BITVECTOR:
                return "(_ BitVec " + width + ")";
            case FUNCTION: {
                StringBuilder sb = new StringBuilder("(");
                boolean first = true;
                for (Sort s : domain) {
                    if (first) first = false; else sb.append(" ");
                    sb.append(s);
                }
                sb.append(") ").append(range);
                return sb.toString();
            }
            default:
                return name;
        }
    }
}
