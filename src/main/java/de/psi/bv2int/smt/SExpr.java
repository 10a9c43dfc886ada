package de.psi.bv2int.smt;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.Err;

public abstract class SExpr<V> {

    public static<V> SExpr<V> num(long i) {
        return num(BigInteger.valueOf(i));
    }

    public static<V> SExpr<V> num(BigInteger i) {
        if (i.signum() < 0) return SExpr.<V>call("-", new Symbol<V>(i.negate().toString()));
        return new Symbol<V>(i.toString());
    }

    public static<V> SExpr<V> sym(String name) {
        return new Symbol<V>(name);
    }

    public static<V> SExpr<V> leaf(V leaf) {
        return new Leaf<V>(leaf);
    }

    public static<V> SExpr<V> list(List<SExpr<V>> items) {
        return new SList<V>(new Vector<SExpr<V>>(items));
    }

    public static<V> SExpr<V> call(String funcName, SExpr<V>... args) {
        return call(new Symbol<V>(funcName), Arrays.asList(args));
    }

    public static<V> SExpr<V> call(SExpr<V> head, List<SExpr<V>> args) {
        List<SExpr<V>> l = new Vector<SExpr<V>>();
        l.add(head);
        l.addAll(args);
        return new SList<V>(l);
    }

    /** The indexed identifier {@code (_ name i1 ... in)}. */
    public static<V> SExpr<V> indexed(String name, List<Integer> indices) {
        List<SExpr<V>> l = new Vector<SExpr<V>>();
        l.add(new Symbol<V>("_"));
        l.add(new Symbol<V>(name));
        for (Integer i : indices) l.add(new Symbol<V>(String.valueOf(i)));
        return new SList<V>(l);
    }

    public static<V> SExpr<V> and(SExpr<V>... args) {
        if (args.length > 1) {
            return call("and", args);
        } else if (args.length == 1) {
            return args[0];
        } else {
            return new Symbol<V>("true");
        }
    }

    public static<V> SExpr<V> add(SExpr<V>... args) {
        return SExpr.<V>call("+", args);
    }

    /** Wraps a symbol in bars when SMT-LIB would not read it as a simple symbol. */
    public static String quote(String name) {
        if (name.isEmpty()) return "||";
        if (Character.isDigit(name.charAt(0))) return "|" + name + "|";
        for (int i = 0; i < name.length(); ++i) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && "~!@$%^&*_-+=<>.?/".indexOf(c) < 0) return "|" + name + "|";
        }
        return name;
    }

    public boolean isSymbol() {
        return false;
    }

    public boolean isSymbol(String name) {
        return false;
    }

    public static class Symbol<V> extends SExpr<V> {
        private final String name;

        public Symbol(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean isSymbol() {
            return true;
        }

        @Override
        public boolean isSymbol(String other) {
            return name.equals(other);
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public <T> T accept(Visitor<V, T> vtVisitor) throws Err {
            return vtVisitor.visit(this);
        }
    }

    public static class Leaf<V> extends SExpr<V> {
        private final V value;

        public Leaf(V item) {
            this.value = item;
        }

        public V getValue() {
            return value;
        }

        @Override
        public <T> T accept(Visitor<V, T> vtVisitor) throws Err {
            return vtVisitor.visit(this);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static class SList<V> extends SExpr<V> {
        private final List<SExpr<V>> items;

        public SList(List<SExpr<V>> items) {
            this.items = items;
        }

        public List<SExpr<V>> getItems() {
            return items;
        }

        public int size() {
            return items.size();
        }

        public SExpr<V> get(int i) {
            return items.get(i);
        }

        @Override
        public String toString() {
            boolean first = true;
            StringBuilder sb = new StringBuilder();
            sb.append("(");
            for (SExpr<V> expr : items) {
                if (first) first = false; else sb.append(" ");
                sb.append(expr.toString());
            }
            sb.append(")");
            return sb.toString();
        }

        @Override
        public <T> T accept(Visitor<V, T> vtVisitor) throws Err {
            return vtVisitor.visit(this);
        }
    }
    
    public static abstract class Visitor<V, T> {
        public final T visitThis(SExpr<V> x) throws Err { return x.accept(this); }

        public abstract T visit(Symbol<V> vSymbol) throws Err;

        public abstract T visit(Leaf<V> vLeaf) throws Err;

        public abstract T visit(SList<V> vsList) throws Err;
    }

    public abstract<T> T accept(Visitor<V, T> vtVisitor) throws Err;

}
