package org.broadinstitute.haplomix.cmdline.argumentcollections;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.haplomix.mixture.HaplogroupMixtureModel;

import java.io.Serializable;

/**
 * Settings of the EM fit of {@link HaplogroupMixtureModel}.
 */
public final class MixtureModelArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_INIT_ALPHA = 1.0;
    public static final double DEFAULT_TOLERANCE = 1E-4;
    public static final int DEFAULT_MAX_ITER = 1000;
    public static final int DEFAULT_NUM_RESTARTS = 1;
    public static final int DEFAULT_SEED = 0;

    public static final String INIT_ALPHA_LONG_NAME = "init-alpha";
    public static final String TOLERANCE_LONG_NAME = "tolerance";
    public static final String MAX_ITER_LONG_NAME = "max-iter";
    public static final String NUM_RESTARTS_LONG_NAME = "num-restarts";
    public static final String SEED_LONG_NAME = "seed";
    public static final String VERBOSE_EM_LONG_NAME = "verbose-em";

    @Argument(fullName = INIT_ALPHA_LONG_NAME,
            doc = "Concentration of the flat Dirichlet from which the starting proportions of each restart are drawn.",
            optional = true, minValue = 0.0)
    public double initAlpha = DEFAULT_INIT_ALPHA;

    @Argument(fullName = TOLERANCE_LONG_NAME,
            doc = "A restart has converged when the summed absolute change of the proportions in one iteration is below this value.",
            optional = true, minValue = 0.0)
    public double tolerance = DEFAULT_TOLERANCE;

    @Argument(fullName = MAX_ITER_LONG_NAME,
            doc = "Maximum number of EM iterations per restart.",
            optional = true, minValue = 1)
    public int maxIter = DEFAULT_MAX_ITER;

    @Argument(fullName = NUM_RESTARTS_LONG_NAME,
            doc = "Number of EM restarts from random starting proportions; their log estimates are averaged.",
            optional = true, minValue = 1)
    public int numRestarts = DEFAULT_NUM_RESTARTS;

    @Argument(fullName = SEED_LONG_NAME,
            doc = "Seed of the random draws of starting proportions.",
            optional = true)
    public int seed = DEFAULT_SEED;

    @Argument(fullName = VERBOSE_EM_LONG_NAME,
            doc = "Log the progress of every tenth EM iteration.",
            optional = true)
    public boolean verboseEM = false;

    /**
     * Checks the constraints that the argument parser cannot express.
     *
     * @throws CommandLineException.BadArgumentValue if a value is out of range
     */
    public void validate() {
        if (!Double.isFinite(initAlpha) || initAlpha <= 0) {
            throw new CommandLineException.BadArgumentValue(INIT_ALPHA_LONG_NAME, "must be finite and positive but was " + initAlpha);
        }
        if (!Double.isFinite(tolerance) || tolerance <= 0) {
            throw new CommandLineException.BadArgumentValue(TOLERANCE_LONG_NAME, "must be finite and positive but was " + tolerance);
        }
    }

    /**
     * @return a model configured with these settings
     */
    public HaplogroupMixtureModel buildModel() {
        validate();
        return new HaplogroupMixtureModel.Builder()
                .initAlpha(initAlpha)
                .tolerance(tolerance)
                .maxIter(maxIter)
                .nMulti(numRestarts)
                .seed(seed)
                .verbose(verboseEM)
                .build();
    }
}
