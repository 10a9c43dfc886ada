package de.psi.bv2int.context;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ContextMapTest {

    @Test
    public void writesAtLevelZeroArePermanent() {
        UserContext ctx = new UserContext();
        ContextMap<String, Integer> map = new ContextMap<String, Integer>(ctx);
        map.put("a", 1);
        ctx.push();
        ctx.pop();
        assertEquals(Integer.valueOf(1), map.get("a"));
    }

    @Test
    public void popRestoresOldValues() {
        UserContext ctx = new UserContext();
        ContextMap<String, Integer> map = new ContextMap<String, Integer>(ctx);
        map.put("a", 1);
        ctx.push();
        map.put("a", 2);
        map.put("b", 3);
        ctx.push();
        map.put("b", 4);
        map.put("c", null);
        assertTrue(map.containsKey("c"));
        assertEquals(3, map.size());

        ctx.pop();
        assertEquals(Integer.valueOf(2), map.get("a"));
        assertEquals(Integer.valueOf(3), map.get("b"));
        assertFalse(map.containsKey("c"));

        ctx.pop();
        assertEquals(Integer.valueOf(1), map.get("a"));
        assertNull(map.get("b"));
        assertEquals(1, map.size());
    }

    @Test
    public void removalIsUndoneByPop() {
        UserContext ctx = new UserContext();
        ContextMap<String, Integer> map = new ContextMap<String, Integer>(ctx);
        map.put("a", 1);
        map.remove("a");
        map.remove("missing");
        assertFalse(map.containsKey("a"));
        map.put("a", 2);
        ctx.push();
        map.remove("a");
        assertFalse(map.containsKey("a"));
        ctx.pop();
        assertEquals(Integer.valueOf(2), map.get("a"));

        ctx.push();
        map.put("b", null);
        map.remove("b");
        ctx.pop();
        assertFalse(map.containsKey("b"));
    }

    @Test
    public void popToUnwindsSeveralLevels() {
        UserContext ctx = new UserContext();
        ContextMap<String, String> map = new ContextMap<String, String>(ctx);
        for (int i = 0; i < 3; i++) {
            ctx.push();
            map.put("k" + i, "v" + i);
        }
        ctx.popTo(1);
        assertEquals(1, ctx.getLevel());
        assertTrue(map.containsKey("k0"));
        assertFalse(map.containsKey("k1"));
        assertFalse(map.containsKey("k2"));
    }
}
