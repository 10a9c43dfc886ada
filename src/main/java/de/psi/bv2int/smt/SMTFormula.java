package de.psi.bv2int.smt;

import java.util.List;
import java.util.Vector;

import de.psi.bv2int.context.ContextSet;
import de.psi.bv2int.context.UserContext;
import de.psi.bv2int.term.FunctionDefinition;
import de.psi.bv2int.term.Helpers;
import de.psi.bv2int.term.Term;

/**
 * An SMT-LIB script under construction. Symbols are declared right before
 * the first command that needs them; declarations made inside a
 * {@code push} are forgotten by the matching {@code pop}, so symbols used
 * again afterwards get declared again.
 */
public class SMTFormula {
    private final String logic;
    private final UserContext context;
    private final ContextSet<Term> declared;
    private final List<SExpr<Term>> declarations = new Vector<SExpr<Term>>();
    private final List<SExpr<Term>> constraints = new Vector<SExpr<Term>>();
    private final List<SExpr<Term>> commands = new Vector<SExpr<Term>>();

    public SMTFormula(String logic, UserContext context) {
        this.logic = logic;
        this.context = context;
        this.declared = new ContextSet<Term>(context);
    }

    public SMTFormula(String logic) {
        this(logic, new UserContext());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("(set-logic ").append(logic).append(")\n");
        sb.append("(set-info :smt-lib-version 2.6)\n");
        for (SExpr<Term> c : commands)
            sb.append(c.toString()).append("\n");
        return sb.toString();
    }

    public String getDeclarations() {
        return render(declarations);
    }

    public String getConstraints() {
        return render(constraints);
    }

    private static String render(List<SExpr<Term>> exprs) {
        StringBuilder sb = new StringBuilder();
        for (SExpr<Term> e : exprs)
            sb.append(e.toString()).append("\n");
        return sb.toString();
    }

    public void declare(Term symbol) {
        if (!symbol.isVar()) throw new AssertionError("not a symbol: " + symbol);
        if (!declared.insert(symbol)) return;
        SExpr<Term> decl = SExpr.call("declare-fun", SExpr.leaf(symbol),
                TermPrinter.printDomain(symbol.sort), TermPrinter.printRange(symbol.sort));
        declarations.add(decl);
        commands.add(decl);
    }

    private void declareSymbolsOf(List<Term> terms) {
        for (Term s : Helpers.collectSymbols(terms)) {
            declare(s);
        }
    }

    public void define(FunctionDefinition def) {
        List<Term> body = new Vector<Term>();
        body.add(def.body);
        declareSymbolsOf(body);
        declared.insert(def.symbol);
        List<SExpr<Term>> formals = new Vector<SExpr<Term>>();
        for (Term f : def.formals) {
            formals.add(SExpr.call(SExpr.leaf(f), list(TermPrinter.print(f.sort))));
        }
        SExpr<Term> d = SExpr.call("define-fun", SExpr.leaf(def.symbol), SExpr.list(formals),
                TermPrinter.printRange(def.symbol.sort), TermPrinter.print(def.body));
        declarations.add(d);
        commands.add(d);
    }

    private static List<SExpr<Term>> list(SExpr<Term> single) {
        List<SExpr<Term>> l = new Vector<SExpr<Term>>();
        l.add(single);
        return l;
    }

    public void addConstraint(Term formula) {
        List<Term> roots = new Vector<Term>();
        roots.add(formula);
        declareSymbolsOf(roots);
        SExpr<Term> c = SExpr.call("assert", TermPrinter.print(formula));
        constraints.add(c);
        commands.add(c);
    }

    public void push(int n) {
        for (int i = 0; i < n; ++i) context.push();
        commands.add(SExpr.call("push", SExpr.<Term>num(n)));
    }

    public void pop(int n) {
        for (int i = 0; i < n; ++i) context.pop();
        commands.add(SExpr.call("pop", SExpr.<Term>num(n)));
    }

    /** Appends a command that needs no translation, such as check-sat. */
    public void addCommand(SExpr<Term> command) {
        commands.add(command);
    }
}
