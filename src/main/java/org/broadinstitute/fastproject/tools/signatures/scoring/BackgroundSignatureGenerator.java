package org.broadinstitute.fastproject.tools.signatures.scoring;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws random positive-sign signatures of fixed sizes from a gene universe.
 */
public final class BackgroundSignatureGenerator {
    private static final Logger logger = LogManager.getLogger(BackgroundSignatureGenerator.class);

    public static final int[] DEFAULT_SIZES = {5, 10, 20, 50, 100, 200};
    public static final int DEFAULT_REPETITIONS = 3000;
    public static final String NAME_PREFIX = "RANDOM_BG_";
    public static final String SOURCE = "random background";

    private final int[] sizes;
    private final int repetitions;
    private final RandomGenerator random;

    public BackgroundSignatureGenerator(final int[] sizes, final int repetitions, final RandomGenerator random) {
        Utils.nonNull(sizes);
        Utils.validateArg(sizes.length > 0, "at least one background size is required");
        Arrays.stream(sizes).forEach(s -> ParamUtils.isPositive(s, "background signature sizes must be > 0"));
        this.sizes = sizes.clone();
        this.repetitions = ParamUtils.isPositive(repetitions, "background repetitions must be > 0");
        this.random = Utils.nonNull(random);
    }

    /**
     * Generates {@code repetitions} signatures for each size, named {@code RANDOM_BG_<size>_<index>}.
     * Sizes larger than the universe are skipped.
     */
    public List<Signature> generate(final List<String> geneUniverse) {
        Utils.nonNull(geneUniverse);
        final String[] genes = geneUniverse.toArray(new String[0]);
        final List<Signature> result = new ArrayList<>();
        for (final int size : sizes) {
            if (size > genes.length) {
                logger.warn(String.format("Skipping background signatures of size %d: only %d genes are available", size, genes.length));
                continue;
            }
            for (int index = 0; index < repetitions; index++) {
                result.add(new Signature(NAME_PREFIX + size + "_" + index, draw(genes, size), true, SOURCE));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Partial Fisher-Yates shuffle of the first {@code size} positions; {@code genes} is permuted in place.
     */
    private Map<String, Integer> draw(final String[] genes, final int size) {
        final Map<String, Integer> signs = new LinkedHashMap<>(size * 2);
        for (int i = 0; i < size; i++) {
            final int j = i + random.nextInt(genes.length - i);
            final String tmp = genes[i];
            genes[i] = genes[j];
            genes[j] = tmp;
            signs.put(genes[i], 1);
        }
        return signs;
    }
}
