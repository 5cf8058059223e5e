package com.github.trinity.samplingimager;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Collects point evaluations into a frozen, grid-ordered field.
 *
 * @author Sean Phillips
 */
public class ResultAssembler {

    /**
     * @param gridSize number of search-grid points
     * @param results  evaluations in any order
     * @return field and diagnostics in grid order
     * @throws IncompleteFieldException if an index is missing, duplicated or out of range
     */
    public AssembledField assemble(int gridSize, Collection<PointEvaluation> results) {
        PointEvaluation[] slots = new PointEvaluation[gridSize];
        List<Integer> unexpected = new ArrayList<>();
        for (PointEvaluation result : results) {
            int index = result.getIndex();
            if (index < 0 || index >= gridSize || slots[index] != null) {
                unexpected.add(index);
                continue;
            }
            slots[index] = result;
        }
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < gridSize; i++) {
            if (slots[i] == null) {
                missing.add(i);
            }
        }
        if (!missing.isEmpty() || !unexpected.isEmpty()) {
            throw new IncompleteFieldException(gridSize, missing, unexpected);
        }

        double[] values = new double[gridSize];
        List<PointDiagnostics> diagnostics = new ArrayList<>(gridSize);
        for (int i = 0; i < gridSize; i++) {
            values[i] = slots[i].getIndicator();
            diagnostics.add(slots[i].getDiagnostics());
        }
        return new AssembledField(new IndicatorField(values), new Diagnostics(diagnostics));
    }

    /**
     * Convenience overload for evaluations held in an array.
     */
    public AssembledField assemble(int gridSize, PointEvaluation... results) {
        return assemble(gridSize, Arrays.asList(results));
    }
}
