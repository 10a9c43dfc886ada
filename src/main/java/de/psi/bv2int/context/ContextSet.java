package de.psi.bv2int.context;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.Vector;

/**
 * An insertion-ordered set whose insertions are undone when the user context
 * pops the level they were made in.
 */
public class ContextSet<T> implements UserContext.Scoped, Iterable<T> {
    private final UserContext context;
    private final Set<T> set = new LinkedHashSet<T>();
    private final Vector<T> trail = new Vector<T>();
    private final Vector<Integer> trailLevels = new Vector<Integer>();

    public ContextSet(UserContext context) {
        this.context = context;
        context.register(this);
    }

    /** Returns true if the element was not yet present. */
    public boolean insert(T elem) {
        if (!set.add(elem)) return false;
        final int level = context.getLevel();
        if (level > 0) {
            trail.add(elem);
            trailLevels.add(level);
        }
        return true;
    }

    public boolean contains(T elem) {
        return set.contains(elem);
    }

    public int size() {
        return set.size();
    }

    public boolean isEmpty() {
        return set.isEmpty();
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableSet(set).iterator();
    }

    @Override
    public void popTo(int level) {
        while (!trail.isEmpty() && trailLevels.lastElement() > level) {
            set.remove(trail.remove(trail.size() - 1));
            trailLevels.remove(trailLevels.size() - 1);
        }
    }
}
