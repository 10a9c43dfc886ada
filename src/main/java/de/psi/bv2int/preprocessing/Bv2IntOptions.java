package de.psi.bv2int.preprocessing;

/**
 * Settings of the bit-vector to integer translation.
 */
public final class Bv2IntOptions {

    /** Largest accepted bitwise granularity. */
    public static final int MAX_GRANULARITY = 8;

    /**
     * Chunk width, in bits, of the lookup tables used for bitwise AND.
     * Larger values give fewer but bigger terms. Must be in [1, 8] whenever a
     * bitwise AND has to be translated.
     */
    public int granularity = 1;

    /**
     * Whether the surrounding solver compares functions (higher-order
     * logic). Translating a function application whose signature changes is
     * rejected in that mode.
     */
    public boolean higherOrder = false;

    /** Logic announced by the produced script. */
    public String logic = "ALL";

    public Bv2IntOptions dup() {
        Bv2IntOptions x = new Bv2IntOptions();
        x.granularity = granularity;
        x.higherOrder = higherOrder;
        x.logic = logic;
        return x;
    }
}
