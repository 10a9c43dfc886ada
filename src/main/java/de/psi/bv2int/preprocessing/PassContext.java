package de.psi.bv2int.preprocessing;

import java.util.List;
import java.util.Vector;

import de.psi.bv2int.context.UserContext;
import de.psi.bv2int.term.FunctionDefinition;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Everything a preprocessing pass may use besides the formulas themselves.
 */
public class PassContext {
    private final TermManager tm;
    private final UserContext userContext;
    private final Bv2IntOptions options;
    private final Rewriter rewriter;
    private final List<FunctionDefinition> pendingDefinitions = new Vector<FunctionDefinition>();
    private final List<RewriteListener> listeners = new Vector<RewriteListener>();

    public PassContext(TermManager tm, UserContext userContext, Bv2IntOptions options) {
        this.tm = tm;
        this.userContext = userContext;
        this.options = options;
        this.rewriter = new Rewriter(tm);
    }

    public PassContext(TermManager tm, Bv2IntOptions options) {
        this(tm, new UserContext(), options);
    }

    public TermManager getTermManager() {
        return tm;
    }

    public UserContext getUserContext() {
        return userContext;
    }

    public Bv2IntOptions getOptions() {
        return options;
    }

    public Rewriter getRewriter() {
        return rewriter;
    }

    /** Registers the meaning of a function symbol with the solver side. */
    public void defineFunction(FunctionDefinition def) {
        pendingDefinitions.add(def);
    }

    /** Returns the definitions registered since the last call and forgets them. */
    public ConstList<FunctionDefinition> takeDefinitions() {
        ConstList<FunctionDefinition> result = ConstList.make(pendingDefinitions);
        pendingDefinitions.clear();
        return result;
    }

    public void addListener(RewriteListener l) {
        listeners.add(l);
    }

    public boolean hasListeners() {
        return !listeners.isEmpty();
    }

    void notify(RewriteStep step) {
        for (RewriteListener l : listeners) {
            l.rewritten(step);
        }
    }
}
