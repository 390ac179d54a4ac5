package org.broadinstitute.fastproject.tools.signatures.scoring;

import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named gene set with a sign (+1 or -1) per gene.
 */
public final class Signature {

    private final String name;
    private final Map<String, Integer> signs;
    private final boolean signed;
    private final String source;

    /**
     * @param name unique signature name
     * @param signs gene to sign map; iteration order is kept
     * @param signed whether the signs carry meaning (false for unsigned gene sets, where every sign is +1)
     * @param source free-text origin of the signature, e.g. the file it was read from
     * @throws IllegalArgumentException if {@code signs} is empty or contains a value other than +1 or -1
     */
    public Signature(final String name, final Map<String, Integer> signs, final boolean signed, final String source) {
        Utils.nonEmpty(name, "signature name");
        Utils.nonNull(signs, "the gene signs cannot be null");
        Utils.validateArg(!signs.isEmpty(), () -> String.format("signature '%s' has no genes", name));
        for (final Map.Entry<String, Integer> entry : signs.entrySet()) {
            Utils.nonNull(entry.getKey(), "gene names cannot be null");
            final Integer sign = entry.getValue();
            Utils.validateArg(sign != null && (sign == 1 || sign == -1),
                    () -> String.format("signature '%s' has an invalid sign %s for gene %s", name, sign, entry.getKey()));
        }
        this.name = name;
        this.signs = Collections.unmodifiableMap(new LinkedHashMap<>(signs));
        this.signed = signed;
        this.source = Utils.nonNull(source);
    }

    public String getName() {
        return name;
    }

    public Map<String, Integer> getSigns() {
        return signs;
    }

    public List<String> getGenes() {
        return Collections.unmodifiableList(new ArrayList<>(signs.keySet()));
    }

    public boolean isSigned() {
        return signed;
    }

    public String getSource() {
        return source;
    }

    public int size() {
        return signs.size();
    }

    @Override
    public String toString() {
        return String.format("Signature{name=%s, genes=%d, signed=%s, source=%s}", name, signs.size(), signed, source);
    }
}
