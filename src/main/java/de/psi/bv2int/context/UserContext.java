package de.psi.bv2int.context;

import java.util.List;
import java.util.Vector;

/**
 * Stack of assertion levels. Context-dependent structures register here and
 * undo their writes when the level they were made in is popped.
 */
public class UserContext {

    /** Something that can roll back to an earlier level. */
    public interface Scoped {
        void popTo(int level);
    }

    private final List<Scoped> scoped = new Vector<Scoped>();
    private int level = 0;

    public int getLevel() {
        return level;
    }

    public void push() {
        level++;
    }

    public void pop() {
        if (level == 0) throw new IllegalStateException("pop without matching push");
        level--;
        for (Scoped s : scoped) {
            s.popTo(level);
        }
    }

    public void popTo(int target) {
        while (level > target) pop();
    }

    void register(Scoped s) {
        scoped.add(s);
    }
}
