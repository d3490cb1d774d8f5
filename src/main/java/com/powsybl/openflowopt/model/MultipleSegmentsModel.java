/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.equations.Equation;
import com.powsybl.openflowopt.equations.EquationType;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Element;
import com.powsybl.openflowopt.network.Segment;

import java.util.*;

/**
 * Piecewise linear relation between variables: each variable is the weighted sum of the sample points of
 * the selected segment, at most one segment being selected.
 */
public class MultipleSegmentsModel<E extends Element> extends AbstractElementModel<E> {

    public static final String DEFAULT_LABEL = "MultipleSegments";

    private final Map<Variable, List<Segment>> samplePoints;

    private final boolean asTimeSeries;

    private final boolean createOutsideSegments;

    private Variable outsideSegments;

    private final List<SegmentModel<E>> segmentModels = new ArrayList<>();

    private final int nrOfSegments;

    /**
     * @param canBeOutsideSegments if true, a binary variable is created, all segments being unselected when it is 0
     */
    public MultipleSegmentsModel(E element, String label, Map<Variable, List<Segment>> samplePoints,
                                 boolean canBeOutsideSegments, boolean asTimeSeries) {
        this(element, label, samplePoints, null, canBeOutsideSegments, asTimeSeries);
    }

    /**
     * @param outsideSegments existing binary variable (an on variable for instance), all segments being unselected when it is 0
     */
    public MultipleSegmentsModel(E element, String label, Map<Variable, List<Segment>> samplePoints,
                                 Variable outsideSegments, boolean asTimeSeries) {
        this(element, label, samplePoints, Objects.requireNonNull(outsideSegments), false, asTimeSeries);
    }

    private MultipleSegmentsModel(E element, String label, Map<Variable, List<Segment>> samplePoints,
                                  Variable outsideSegments, boolean createOutsideSegments, boolean asTimeSeries) {
        super(element, label);
        this.samplePoints = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(samplePoints)));
        this.outsideSegments = outsideSegments;
        this.createOutsideSegments = createOutsideSegments;
        this.asTimeSeries = asTimeSeries;
        if (samplePoints.isEmpty()) {
            throw new PowsyblException("Segments model '" + getLabelFull() + "' needs at least one variable");
        }
        nrOfSegments = samplePoints.values().iterator().next().size();
        if (nrOfSegments == 0) {
            throw new PowsyblException("Segments model '" + getLabelFull() + "' needs at least one segment");
        }
        for (Map.Entry<Variable, List<Segment>> e : samplePoints.entrySet()) {
            if (e.getValue().size() != nrOfSegments) {
                throw new PowsyblException("Segments model '" + getLabelFull() + "': variable '" + e.getKey().getLabel() + "' has "
                        + e.getValue().size() + " segments instead of " + nrOfSegments);
            }
        }
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        for (int i = 0; i < nrOfSegments; i++) {
            Map<Variable, Segment> segmentSamplePoints = new LinkedHashMap<>();
            for (Map.Entry<Variable, List<Segment>> e : samplePoints.entrySet()) {
                segmentSamplePoints.put(e.getKey(), e.getValue().get(i));
            }
            SegmentModel<E> segmentModel = addSubModel(new SegmentModel<>(element, childLabel("Segment_" + i), segmentSamplePoints, asTimeSeries));
            segmentModel.doModeling(systemModel);
            segmentModels.add(segmentModel);
        }

        // -v(t) + sum_i(start_i * lambda0_i(t) + end_i * lambda1_i(t)) = 0
        for (Variable variable : samplePoints.keySet()) {
            Equation lambdaEquation = createEquation(systemModel, "lambda_" + variable.getLabel(), EquationType.EQUALITY)
                    .addTerm(variable, -1);
            for (SegmentModel<E> segmentModel : segmentModels) {
                Segment segment = segmentModel.getSamplePoints(variable);
                lambdaEquation.addTerm(segmentModel.getLambda0(), segment.start())
                        .addTerm(segmentModel.getLambda1(), segment.end());
            }
        }

        // sum_i(inSegment_i(t)) = 1, or sum_i(inSegment_i(t)) - outside(t) = 0 if all can be unselected
        Equation inSingleSegment = createEquation(systemModel, "in_single_Segment", EquationType.EQUALITY);
        for (SegmentModel<E> segmentModel : segmentModels) {
            inSingleSegment.addTerm(segmentModel.getInSegment(), 1);
        }
        if (outsideSegments == null && createOutsideSegments) {
            outsideSegments = (asTimeSeries ? createTimeSeriesVariable(systemModel, "outside_segments")
                    : createVariable(systemModel, "outside_segments")).setBinary(true);
        }
        if (outsideSegments != null) {
            inSingleSegment.addTerm(outsideSegments, -1);
        } else {
            inSingleSegment.addConstant(1);
        }
    }

    public List<SegmentModel<E>> getSegmentModels() {
        return Collections.unmodifiableList(segmentModels);
    }

    /**
     * Binary variable equal to the number of selected segments, null if a segment must always be selected.
     */
    public Variable getOutsideSegments() {
        return outsideSegments;
    }
}
