package de.psi.bv2int.preprocessing;

import org.apache.log4j.Logger;

import edu.mit.csail.sdg.alloy4.Err;

/**
 * A transformation over all formulas of an {@link AssertionPipeline}.
 */
public abstract class PreprocessingPass {
    private static final Logger log = Logger.getLogger(PreprocessingPass.class);

    protected final PassContext context;
    private final String name;

    protected PreprocessingPass(PassContext context, String name) {
        this.context = context;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void apply(AssertionPipeline assertions) throws Err {
        log.info("running " + name + " on " + assertions.size() + " assertion(s)");
        final long start = System.currentTimeMillis();
        applyInternal(assertions);
        log.info(name + " done after " + (System.currentTimeMillis() - start) + " ms");
    }

    protected abstract void applyInternal(AssertionPipeline assertions) throws Err;
}
