package de.psi.bv2int.preprocessing;

import java.util.List;
import java.util.Vector;

import de.psi.bv2int.context.ContextMap;
import de.psi.bv2int.term.Kind;
import de.psi.bv2int.term.Term;
import de.psi.bv2int.term.TermManager;
import edu.mit.csail.sdg.alloy4.Err;

/**
 * Turns applications of the associative bit-vector operators with more than
 * two arguments into left-nested binary chains.
 */
public class Binarizer {
    private final TermManager tm;
    private final ContextMap<Term, Term> cache;

    public Binarizer(PassContext context) {
        this.tm = context.getTermManager();
        this.cache = new ContextMap<Term, Term>(context.getUserContext());
    }

    public static boolean isAssociative(Kind k) {
        switch (k) {
            case BITVECTOR_PLUS:
            case BITVECTOR_MULT:
            case BITVECTOR_AND:
            case BITVECTOR_OR:
            case BITVECTOR_XOR:
            case BITVECTOR_CONCAT:
                return true;
            default:
                return false;
        }
    }

    public Term binarize(Term n) throws Err {
        Vector<Term> toVisit = new Vector<Term>();
        toVisit.add(n);
        while (!toVisit.isEmpty()) {
            Term current = toVisit.lastElement();
            if (!cache.containsKey(current)) {
                cache.put(current, null);
                toVisit.addAll(current.children);
            } else if (cache.get(current) == null) {
                toVisit.remove(toVisit.size() - 1);
                if (current.getNumChildren() > 2 && isAssociative(current.kind)) {
                    Term result = cache.get(current.get(0));
                    for (int i = 1; i < current.getNumChildren(); i++) {
                        result = tm.mkNode(current.kind, result, cache.get(current.get(i)));
                    }
                    cache.put(current, result);
                } else if (current.getNumChildren() > 0) {
                    List<Term> children = new Vector<Term>();
                    for (Term child : current.children) children.add(cache.get(child));
                    cache.put(current, tm.mkLike(current, children));
                } else {
                    cache.put(current, current);
                }
            } else {
                toVisit.remove(toVisit.size() - 1);
            }
        }
        return cache.get(n);
    }
}
