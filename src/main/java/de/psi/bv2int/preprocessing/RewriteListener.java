package de.psi.bv2int.preprocessing;

public interface RewriteListener {
    void rewritten(RewriteStep step);
}
