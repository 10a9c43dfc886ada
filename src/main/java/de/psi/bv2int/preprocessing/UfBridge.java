package de.psi.bv2int.preprocessing;

import java.util.List;
import java.util.Vector;

import org.apache.log4j.Logger;

import de.psi.bv2int.context.ContextMap;
import de.psi.bv2int.term.FunctionDefinition;
import de.psi.bv2int.term.Sort;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorType;

/**
 * Replaces function symbols with bit-vectors in their signature by symbols
 * over integers. The original symbol is defined in terms of its replacement
 * so that models of the translated formula can still be read back.
 */
public class UfBridge {
    private static final Logger log = Logger.getLogger(UfBridge.class);

    public static final String FUN_PREFIX = "__bvToInt_fun_";

    private final PassContext context;
    private final TermManager tm;
    private final Casts casts;
    private final ContextMap<Term, Term> symbols;

    public UfBridge(PassContext context, Casts casts) {
        this.context = context;
        this.tm = context.getTermManager();
        this.casts = casts;
        this.symbols = new ContextMap<Term, Term>(context.getUserContext());
    }

    private static Sort toInt(Sort s) {
        return s.isBitVector() ? Sort.INT : s;
    }

    /** The integer replacement of a function symbol, created on first use. */
    public Term getIntSymbol(Term bvSymbol) {
        Term intSymbol = symbols.get(bvSymbol);
        if (intSymbol != null) return intSymbol;
        List<Sort> domain = new Vector<Sort>();
        for (Sort d : bvSymbol.sort.getArgTypes()) domain.add(toInt(d));
        Sort range = toInt(bvSymbol.sort.getRangeType());
        intSymbol = tm.mkSkolem(FUN_PREFIX + bvSymbol.getName() + "_int", Sort.function(domain, range));
        symbols.put(bvSymbol, intSymbol);
        return intSymbol;
    }

    /**
     * Translates an application of a bit-vector signature function whose
     * arguments have already been translated.
     *
     * @throws ErrorType if functions may be compared (higher-order) and the
     *             signature of the application changes
     */
    public Term translate(Term application, List<Term> translatedArgs, boolean higherOrder) throws Err {
        if (higherOrder && signatureChanged(application, translatedArgs)) {
            throw new ErrorType("Cannot translate to Int: " + application);
        }
        final Term bvSymbol = application.op;
        final boolean fresh = !symbols.containsKey(bvSymbol);
        final Term intSymbol = getIntSymbol(bvSymbol);
        if (fresh) define(bvSymbol, intSymbol);
        return tm.mkApply(intSymbol, translatedArgs);
    }

    private static boolean signatureChanged(Term application, List<Term> translatedArgs) {
        if (application.sort.isBitVector()) return true;
        for (int i = 0; i < translatedArgs.size(); i++) {
            if (!translatedArgs.get(i).sort.equals(application.get(i).sort)) return true;
        }
        return false;
    }

    /** f(x1..xn) := cast(f_int(cast(x1)..cast(xn))) over fresh bound variables */
    private void define(Term bvSymbol, Term intSymbol) throws Err {
        List<Term> formals = new Vector<Term>();
        List<Term> args = new Vector<Term>();
        for (Sort d : bvSymbol.sort.getArgTypes()) {
            Term formal = tm.mkBoundVar(d);
            formals.add(formal);
            args.add(casts.cast(formal, toInt(d)));
        }
        Term body = casts.cast(tm.mkApply(intSymbol, args), bvSymbol.sort.getRangeType());
        FunctionDefinition def = new FunctionDefinition(bvSymbol, ConstList.make(formals), body);
        log.debug("defining " + def);
        context.defineFunction(def);
    }
}
