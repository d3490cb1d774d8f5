/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.openflowopt.equations.Equation;
import com.powsybl.openflowopt.equations.EquationType;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.*;
import com.powsybl.openflowopt.util.DoubleArrays;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component model adding the conversion relation between the flow rates of a linear converter.
 */
public class LinearConverterModel extends ComponentModel {

    private final LinearConverter converter;

    private MultipleSegmentsModel<Component> segments;

    public LinearConverterModel(LinearConverter converter) {
        super(converter);
        this.converter = converter;
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        super.doModeling(systemModel);
        if (converter.isSegmented()) {
            createSegmentedConversion(systemModel);
        } else {
            createConversionEquations(systemModel);
        }
    }

    private void createConversionEquations(SystemModel systemModel) {
        int nrOfTimeSteps = systemModel.getNrOfTimeSteps();
        List<Map<Flow, TimeSeries>> conversionFactors = converter.getConversionFactors();
        for (int i = 0; i < conversionFactors.size(); i++) {
            // sum(input flow rate(t) * factor(t)) - sum(output flow rate(t) * factor(t)) = 0
            Equation equation = createEquation(systemModel, "conversion_" + i, EquationType.EQUALITY);
            for (Map.Entry<Flow, TimeSeries> e : conversionFactors.get(i).entrySet()) {
                Flow flow = e.getKey();
                double[] factor = e.getValue().toArray(nrOfTimeSteps);
                equation.addTerm(flow.getModel().getFlowRate(), flow.isInputInComponent() ? factor : DoubleArrays.negate(factor));
            }
        }
    }

    private void createSegmentedConversion(SystemModel systemModel) {
        Map<Variable, List<Segment>> samplePoints = new LinkedHashMap<>();
        for (Map.Entry<Flow, List<Segment>> e : converter.getSegmentedConversionFactors().entrySet()) {
            samplePoints.put(e.getKey().getModel().getFlowRate(), e.getValue());
        }
        String segmentsLabel = MultipleSegmentsModel.DEFAULT_LABEL;
        segments = getOnOff() != null
                ? new MultipleSegmentsModel<>(element, segmentsLabel, samplePoints, getOnOff().getOn(), true)
                : new MultipleSegmentsModel<>(element, segmentsLabel, samplePoints, false, true);
        addSubModel(segments).doModeling(systemModel);
    }

    /**
     * Null if the conversion is not segmented.
     */
    public MultipleSegmentsModel<Component> getSegments() {
        return segments;
    }
}
