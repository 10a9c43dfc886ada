package de.psi.bv2int.smt;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Sort;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstList.TempList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;
import edu.mit.csail.sdg.alloy4.ErrorType;

/**
 * Interprets an SMT-LIB script. Declarations go straight into the term
 * manager and {@code define-fun}s are kept as macros that are expanded at
 * every use; everything the caller has to act on comes back as a list of
 * {@link Command}s.
 */
public class SmtLibReader {

    public static class Command {
        public enum Type { SET_LOGIC, ASSERT, PUSH, POP, CHECK_SAT, PASS_THROUGH, EXIT }

        public final Type type;
        public final Term term;
        public final int count;
        public final String text;

        private Command(Type type, Term term, int count, String text) {
            this.type = type;
            this.term = term;
            this.count = count;
            this.text = text;
        }

        @Override
        public String toString() {
            switch (type) {
                case ASSERT: return "(assert " + term + ")";
                case PUSH: return "(push " + count + ")";
                case POP: return "(pop " + count + ")";
                case CHECK_SAT: return "(check-sat)";
                case EXIT: return "(exit)";
                default: return text;
            }
        }
    }

    private static class Macro {
        final ConstList<String> params;
        final ConstList<Sort> sorts;
        final Sort range;
        final SExpr<String> body;

        Macro(ConstList<String> params, ConstList<Sort> sorts, Sort range, SExpr<String> body) {
            this.params = params;
            this.sorts = sorts;
            this.range = range;
            this.body = body;
        }
    }

    private final TermManager tm;
    private final Map<String, Macro> macros = new HashMap<String, Macro>();
    private final Set<String> sorts = new HashSet<String>();
    private String logic = null;

    public SmtLibReader(TermManager tm) {
        this.tm = tm;
    }

    /** The logic named by the last set-logic command, or null. */
    public String getLogic() {
        return logic;
    }

    public List<Command> read(String filename, String document) throws Err {
        List<Command> result = new Vector<Command>();
        for (SExpr<String> cmd : SExprParser.parse(filename, document)) {
            Command c = readCommand(cmd);
            if (c != null) result.add(c);
        }
        return result;
    }

    /** Reads a single term over the symbols declared so far. */
    public Term readTerm(String text) throws Err {
        List<SExpr<String>> exprs = SExprParser.parse("<term>", text);
        if (exprs.size() != 1) throw new ErrorSyntax("Expected exactly one term but got " + exprs.size());
        return new TermBuilder(new HashMap<String, Term>()).visitThis(exprs.get(0));
    }

    private static SExpr.SList<String> asList(SExpr<String> e, String what) throws ErrorSyntax {
        if (!(e instanceof SExpr.SList)) throw new ErrorSyntax("Expected " + what + " but got " + e);
        return (SExpr.SList<String>) e;
    }

    private static String asSymbol(SExpr<String> e, String what) throws ErrorSyntax {
        if (!e.isSymbol()) throw new ErrorSyntax("Expected " + what + " but got " + e);
        return e.toString();
    }

    private static int asNumeral(SExpr<String> e, String what) throws ErrorSyntax {
        String s = asSymbol(e, what);
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException ex) {
            throw new ErrorSyntax("Expected " + what + " but got " + s);
        }
    }

    private static void expectSize(SExpr.SList<String> l, int size, String command) throws ErrorSyntax {
        if (l.size() != size) throw new ErrorSyntax("Malformed " + command + ": " + l);
    }

    private Command readCommand(SExpr<String> expr) throws Err {
        SExpr.SList<String> l = asList(expr, "a command");
        if (l.size() == 0) throw new ErrorSyntax("Empty command");
        String name = asSymbol(l.get(0), "a command name");
        if (name.equals("set-logic")) {
            expectSize(l, 2, name);
            logic = asSymbol(l.get(1), "a logic");
            return new Command(Command.Type.SET_LOGIC, null, 0, l.toString());
        } else if (name.equals("set-option") || name.equals("set-info")) {
            return null;
        } else if (name.equals("declare-sort")) {
            sorts.add(asSymbol(l.get(1), "a sort name"));
            return null;
        } else if (name.equals("declare-const")) {
            expectSize(l, 3, name);
            tm.mkVar(asSymbol(l.get(1), "a symbol"), readSort(l.get(2)));
            return null;
        } else if (name.equals("declare-fun")) {
            expectSize(l, 4, name);
            List<Sort> domain = new Vector<Sort>();
            for (SExpr<String> s : asList(l.get(2), "a sort list").getItems()) {
                domain.add(readSort(s));
            }
            tm.mkVar(asSymbol(l.get(1), "a symbol"), Sort.function(domain, readSort(l.get(3))));
            return null;
        } else if (name.equals("define-fun")) {
            expectSize(l, 5, name);
            readDefinition(asSymbol(l.get(1), "a symbol"), asList(l.get(2), "a parameter list"), l.get(3), l.get(4));
            return null;
        } else if (name.equals("assert")) {
            expectSize(l, 2, name);
            Term t = new TermBuilder(new HashMap<String, Term>()).visitThis(l.get(1));
            if (!t.sort.isBoolean()) throw new ErrorType("Asserted term is not a formula: " + t);
            return new Command(Command.Type.ASSERT, t, 0, null);
        } else if (name.equals("push") || name.equals("pop")) {
            int n = l.size() > 1 ? asNumeral(l.get(1), "a numeral") : 1;
            return new Command(name.equals("push") ? Command.Type.PUSH : Command.Type.POP, null, n, null);
        } else if (name.equals("check-sat")) {
            return new Command(Command.Type.CHECK_SAT, null, 0, null);
        } else if (name.equals("exit")) {
            return new Command(Command.Type.EXIT, null, 0, null);
        } else if (name.equals("get-model") || name.equals("get-value") || name.equals("get-info") || name.equals("echo")
                || name.equals("get-assertions") || name.equals("get-unsat-core")) {
            return new Command(Command.Type.PASS_THROUGH, null, 0, l.toString());
        }
        throw new ErrorSyntax("Unsupported command: " + name);
    }

    private void readDefinition(String name, SExpr.SList<String> params, SExpr<String> range, SExpr<String> body) throws Err {
        TempList<String> names = new TempList<String>();
        TempList<Sort> psorts = new TempList<Sort>();
        for (SExpr<String> p : params.getItems()) {
            SExpr.SList<String> decl = asList(p, "a sorted parameter");
            expectSize(decl, 2, "parameter");
            names.add(asSymbol(decl.get(0), "a parameter name"));
            psorts.add(readSort(decl.get(1)));
        }
        Macro m = new Macro(names.makeConst(), psorts.makeConst(), readSort(range), body);
        if (macros.containsKey(name) || tm.lookupVar(name) != null)
            throw new ErrorSyntax("Symbol " + name + " is already defined");
        macros.put(name, m);
    }

    public Sort readSort(SExpr<String> s) throws ErrorSyntax {
        if (s.isSymbol("Bool")) return Sort.BOOL;
        if (s.isSymbol("Int")) return Sort.INT;
        if (s.isSymbol()) {
            if (sorts.contains(s.toString())) return Sort.uninterpreted(s.toString());
            throw new ErrorSyntax("Unknown sort " + s);
        }
        SExpr.SList<String> l = asList(s, "a sort");
        if (l.size() == 3 && l.get(0).isSymbol("_") && l.get(1).isSymbol("BitVec")) {
            int width = asNumeral(l.get(2), "a bit-vector width");
            if (width < 1) throw new ErrorSyntax("Bit-vector width must be positive: " + l);
            return Sort.bitvector(width);
        }
        throw new ErrorSyntax("Unsupported sort " + s);
    }

    /** Builds terms from s-expressions under a set of local bindings. */
    private class TermBuilder extends SExpr.Visitor<String, Term> {
        private final Map<String, Term> bindings;

        TermBuilder(Map<String, Term> bindings) {
            this.bindings = bindings;
        }

        @Override
        public Term visit(SExpr.Symbol<String> x) throws Err {
            final String name = x.getName();
            Term bound = bindings.get(name);
            if (bound != null) return bound;
            if (name.equals("true")) return tm.mkTrue();
            if (name.equals("false")) return tm.mkFalse();
            if (name.startsWith("#b")) {
                String digits = name.substring(2);
                if (digits.isEmpty()) throw new ErrorSyntax("Empty binary literal");
                return tm.mkBitVector(digits.length(), parseDigits(digits, 2, name));
            }
            if (name.startsWith("#x")) {
                String digits = name.substring(2);
                if (digits.isEmpty()) throw new ErrorSyntax("Empty hexadecimal literal");
                return tm.mkBitVector(4 * digits.length(), parseDigits(digits, 16, name));
            }
            if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
                return tm.mkConst(parseDigits(name, 10, name));
            }
            Term var = tm.lookupVar(name);
            if (var != null) {
                if (var.sort.isFunction()) throw new ErrorType("Function " + name + " used without arguments");
                return var;
            }
            if (macros.containsKey(name)) return expand(name, new Vector<Term>());
            throw new ErrorSyntax("Unknown symbol " + name);
        }

        @Override
        public Term visit(SExpr.Leaf<String> x) throws Err {
            throw new AssertionError("the parser produces no leaves");
        }

        @Override
        public Term visit(SExpr.SList<String> x) throws Err {
            if (x.size() == 0) throw new ErrorSyntax("Empty application");
            SExpr<String> head = x.get(0);
            if (head.isSymbol("_")) return readIndexedConstant(x);
            if (head.isSymbol("let")) return readLet(x);
            if (head.isSymbol("!")) return visitThis(x.get(1));
            if (head.isSymbol("forall") || head.isSymbol("exists"))
                throw new ErrorSyntax("Quantifiers are not supported: " + head);

            List<Term> args = new Vector<Term>();
            for (int i = 1; i < x.size(); ++i) {
                args.add(visitThis(x.get(i)));
            }
            if (head instanceof SExpr.SList) {
                return applyIndexed(asList(head, "an indexed operator"), args);
            }
            final String name = head.toString();
            if (!bindings.containsKey(name)) {
                if (macros.containsKey(name)) return expand(name, args);
                Term f = tm.lookupVar(name);
                if (f != null) return tm.mkApply(f, args);
            }
            return applyBuiltin(name, args);
        }

        private Term readIndexedConstant(SExpr.SList<String> x) throws Err {
            if (x.size() == 3) {
                String name = asSymbol(x.get(1), "an indexed identifier");
                if (name.startsWith("bv")) {
                    BigInteger value = parseDigits(name.substring(2), 10, name);
                    int width = asNumeral(x.get(2), "a bit-vector width");
                    if (width < 1) throw new ErrorSyntax("Bit-vector width must be positive: " + x);
                    return tm.mkBitVector(width, value);
                }
            }
            throw new ErrorSyntax("Unsupported indexed identifier " + x);
        }

        private Term readLet(SExpr.SList<String> x) throws Err {
            if (x.size() != 3) throw new ErrorSyntax("Malformed let: " + x);
            Map<String, Term> inner = new HashMap<String, Term>(bindings);
            for (SExpr<String> b : asList(x.get(1), "let bindings").getItems()) {
                SExpr.SList<String> binding = asList(b, "a let binding");
                expectSize(binding, 2, "let binding");
                // bindings are parallel: each one is read in the outer scope
                inner.put(asSymbol(binding.get(0), "a variable name"), visitThis(binding.get(1)));
            }
            return new TermBuilder(inner).visitThis(x.get(2));
        }

        private Term applyIndexed(SExpr.SList<String> head, List<Term> args) throws Err {
            if (head.size() < 3 || !head.get(0).isSymbol("_"))
                throw new ErrorSyntax("Malformed indexed operator " + head);
            String name = asSymbol(head.get(1), "an operator name");
            Kind kind = Kind.fromSmtName(name);
            if (kind == null || !kind.isIndexed()) throw new ErrorSyntax("Unknown indexed operator " + name);
            List<Integer> indices = new Vector<Integer>();
            for (int i = 2; i < head.size(); ++i) {
                indices.add(asNumeral(head.get(i), "an index"));
            }
            return tm.mkIndexed(kind, indices, args);
        }

        private Term applyBuiltin(String name, List<Term> args) throws Err {
            Kind kind = Kind.fromSmtName(name);
            if (kind == null || kind.isIndexed()) throw new ErrorSyntax("Unknown function " + name);
            if (kind == Kind.MINUS && args.size() == 1) return tm.mkNode(Kind.UMINUS, args);
            if ((kind == Kind.MINUS || kind == Kind.XOR) && args.size() > 2) {
                Term result = args.get(0);
                for (int i = 1; i < args.size(); ++i) {
                    result = tm.mkNode(kind, result, args.get(i));
                }
                return result;
            }
            if (kind == Kind.IMPLIES && args.size() > 2) {
                Term result = args.get(args.size() - 1);
                for (int i = args.size() - 2; i >= 0; --i) {
                    result = tm.mkNode(kind, args.get(i), result);
                }
                return result;
            }
            return tm.mkNode(kind, args);
        }

        private Term expand(String name, List<Term> args) throws Err {
            Macro m = macros.get(name);
            if (m.params.size() != args.size())
                throw new ErrorType(name + " expects " + m.params.size() + " arguments but got " + args.size());
            Map<String, Term> env = new HashMap<String, Term>();
            for (int i = 0; i < args.size(); ++i) {
                if (!args.get(i).sort.equals(m.sorts.get(i)))
                    throw new ErrorType("Argument " + (i + 1) + " of " + name + " must have sort " + m.sorts.get(i));
                env.put(m.params.get(i), args.get(i));
            }
            Term body = new TermBuilder(env).visitThis(m.body);
            if (!body.sort.equals(m.range))
                throw new ErrorType("Body of " + name + " has sort " + body.sort + " but " + m.range + " was declared");
            return body;
        }
    }

    private static BigInteger parseDigits(String digits, int radix, String literal) throws ErrorSyntax {
        try {
            BigInteger v = new BigInteger(digits, radix);
            if (v.signum() < 0) throw new ErrorSyntax("Malformed literal " + literal);
            return v;
        } catch (NumberFormatException ex) {
            throw new ErrorSyntax("Malformed literal " + literal);
        }
    }
}
