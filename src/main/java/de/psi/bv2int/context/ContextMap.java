package de.psi.bv2int.context;

import java.util.HashMap;
import java.util.Map;
import java.util.Vector;

/**
 * A map whose writes are undone when the user context pops the level they
 * were made in. A key may be present with a null value.
 */
public class ContextMap<K, V> implements UserContext.Scoped {

    private static final class Undo<K, V> {
        final int level;
        final K key;
        final boolean wasPresent;
        final V oldValue;

        Undo(int level, K key, boolean wasPresent, V oldValue) {
            this.level = level;
            this.key = key;
            this.wasPresent = wasPresent;
            this.oldValue = oldValue;
        }
    }

    private final UserContext context;
    private final Map<K, V> map = new HashMap<K, V>();
    private final Vector<Undo<K, V>> trail = new Vector<Undo<K, V>>();

    public ContextMap(UserContext context) {
        this.context = context;
        context.register(this);
    }

    public boolean containsKey(K key) {
        return map.containsKey(key);
    }

    public V get(K key) {
        return map.get(key);
    }

    public void put(K key, V value) {
        final int level = context.getLevel();
        if (level > 0) {
            boolean present = map.containsKey(key);
            trail.add(new Undo<K, V>(level, key, present, present ? map.get(key) : null));
        }
        map.put(key, value);
    }

    public void remove(K key) {
        if (!map.containsKey(key)) return;
        final int level = context.getLevel();
        if (level > 0) trail.add(new Undo<K, V>(level, key, true, map.get(key)));
        map.remove(key);
    }

    public int size() {
        return map.size();
    }

    @Override
    public void popTo(int level) {
        while (!trail.isEmpty() && trail.lastElement().level > level) {
            Undo<K, V> u = trail.remove(trail.size() - 1);
            if (u.wasPresent) map.put(u.key, u.oldValue); else map.remove(u.key);
        }
    }
}
