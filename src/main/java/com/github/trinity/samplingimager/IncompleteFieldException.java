package com.github.trinity.samplingimager;

import java.util.List;

/**
 * Raised by {@link ResultAssembler} when the merged results do not cover every
 * grid index exactly once. Indicates a scheduling bug.
 *
 * @author Sean Phillips
 */
public class IncompleteFieldException extends ImagingException {

    private final List<Integer> missing;
    private final List<Integer> unexpected;

    public IncompleteFieldException(int gridSize, List<Integer> missing, List<Integer> unexpected) {
        super(String.format("Indicator field of size %d is incomplete: missing %s, duplicate or out of range %s",
            gridSize, abbreviate(missing), abbreviate(unexpected)));
        this.missing = List.copyOf(missing);
        this.unexpected = List.copyOf(unexpected);
    }

    public List<Integer> getMissing() {
        return missing;
    }

    public List<Integer> getUnexpected() {
        return unexpected;
    }

    private static String abbreviate(List<Integer> indices) {
        if (indices.size() <= 10) {
            return indices.toString();
        }
        return indices.subList(0, 10) + " (+" + (indices.size() - 10) + " more)";
    }
}
