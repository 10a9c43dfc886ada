package de.psi.bv2int.context;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class UserContextTest {

    @Test
    public void levels() {
        UserContext ctx = new UserContext();
        assertEquals(0, ctx.getLevel());
        ctx.push();
        ctx.push();
        assertEquals(2, ctx.getLevel());
        ctx.pop();
        assertEquals(1, ctx.getLevel());
        ctx.popTo(0);
        assertEquals(0, ctx.getLevel());
        ctx.popTo(3);
        assertEquals(0, ctx.getLevel());
    }

    @Test(expected = IllegalStateException.class)
    public void popBelowZero() {
        new UserContext().pop();
    }
}
