/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.openflowopt.equations.EquationType;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Element;
import com.powsybl.openflowopt.network.Segment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One linear segment shared by several variables: a binary telling whether the segment is selected and
 * two weights of the segment sample points summing to that binary.
 */
public class SegmentModel<E extends Element> extends AbstractElementModel<E> {

    private final Map<Variable, Segment> samplePoints;

    private final boolean asTimeSeries;

    private Variable inSegment;

    private Variable lambda0;

    private Variable lambda1;

    public SegmentModel(E element, String label, Map<Variable, Segment> samplePoints, boolean asTimeSeries) {
        super(element, label);
        this.samplePoints = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(samplePoints)));
        this.asTimeSeries = asTimeSeries;
    }

    private Variable createSegmentVariable(SystemModel systemModel, String shortLabel) {
        return asTimeSeries ? createTimeSeriesVariable(systemModel, shortLabel) : createVariable(systemModel, shortLabel);
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        inSegment = createSegmentVariable(systemModel, "inSegment").setBinary(true);
        lambda0 = createSegmentVariable(systemModel, "lambda0").setLowerBound(0).setUpperBound(1);
        lambda1 = createSegmentVariable(systemModel, "lambda1").setLowerBound(0).setUpperBound(1);

        // -inSegment(t) + lambda0(t) + lambda1(t) = 0
        createEquation(systemModel, "inSegment", EquationType.EQUALITY)
                .addTerm(inSegment, -1)
                .addTerm(lambda0, 1)
                .addTerm(lambda1, 1);
    }

    public Segment getSamplePoints(Variable variable) {
        return samplePoints.get(variable);
    }

    public Variable getInSegment() {
        return inSegment;
    }

    public Variable getLambda0() {
        return lambda0;
    }

    public Variable getLambda1() {
        return lambda1;
    }
}
