/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.model.ComponentModel;
import com.powsybl.openflowopt.model.LinearConverterModel;

import java.util.*;

/**
 * Component converting its input flows into its output flows. The relation is either a set of linear
 * conversion equations (sum of inputs times factor equals sum of outputs times factor) or a piecewise
 * linear relation between all the flow rates.
 */
public class LinearConverter extends Component {

    private final List<Map<Flow, TimeSeries>> conversionFactors;

    private final Map<Flow, List<Segment>> segmentedConversionFactors;

    public LinearConverter(String label, List<Flow> inputs, List<Flow> outputs,
                           List<Map<Flow, TimeSeries>> conversionFactors) {
        this(label, inputs, outputs, null, conversionFactors, Collections.emptyMap());
    }

    public LinearConverter(String label, List<Flow> inputs, List<Flow> outputs, OnOffParameters onOffParameters,
                           List<Map<Flow, TimeSeries>> conversionFactors,
                           Map<Flow, List<Segment>> segmentedConversionFactors) {
        super(label, inputs, outputs, onOffParameters, Collections.emptyList(), false);
        this.conversionFactors = Objects.requireNonNull(conversionFactors).stream()
                .map(factors -> Collections.unmodifiableMap(new LinkedHashMap<>(factors)))
                .toList();
        this.segmentedConversionFactors = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(segmentedConversionFactors)));
        checkPlausibility();
        attachFlows();
    }

    private void checkPlausibility() {
        if (conversionFactors.isEmpty() && segmentedConversionFactors.isEmpty()) {
            throw new PowsyblException("Linear converter '" + label + "': either conversion factors or segmented conversion factors must be defined");
        }
        if (!conversionFactors.isEmpty() && !segmentedConversionFactors.isEmpty()) {
            throw new PowsyblException("Linear converter '" + label + "': conversion factors and segmented conversion factors are exclusive");
        }
        List<Flow> flows = getFlows();
        if (!conversionFactors.isEmpty()) {
            if (conversionFactors.size() >= flows.size()) {
                throw new PowsyblException("Linear converter '" + label + "': too many conversion factors ("
                        + conversionFactors.size() + ") for " + flows.size() + " flows, the system would be over determined");
            }
            for (Map<Flow, TimeSeries> factors : conversionFactors) {
                checkFlowsBelongToComponent(factors.keySet(), flows);
            }
        } else {
            checkFlowsBelongToComponent(segmentedConversionFactors.keySet(), flows);
            int segmentCount = -1;
            for (Map.Entry<Flow, List<Segment>> e : segmentedConversionFactors.entrySet()) {
                if (e.getKey().isWithInvestment()) {
                    throw new PowsyblException("Linear converter '" + label + "': segmented conversion factors cannot be used with flow '"
                            + e.getKey().getLabel() + "' having invest parameters");
                }
                if (segmentCount != -1 && segmentCount != e.getValue().size()) {
                    throw new PowsyblException("Linear converter '" + label + "': segment count of flow '" + e.getKey().getLabel()
                            + "' (" + e.getValue().size() + ") differs from the others (" + segmentCount + ")");
                }
                segmentCount = e.getValue().size();
            }
        }
    }

    private void checkFlowsBelongToComponent(Collection<Flow> factorFlows, List<Flow> flows) {
        for (Flow flow : factorFlows) {
            if (!flows.contains(flow)) {
                throw new PowsyblException("Linear converter '" + label + "': flow '" + flow.getLabel() + "' is not a flow of the converter");
            }
        }
    }

    public List<Map<Flow, TimeSeries>> getConversionFactors() {
        return conversionFactors;
    }

    public Map<Flow, List<Segment>> getSegmentedConversionFactors() {
        return segmentedConversionFactors;
    }

    public boolean isSegmented() {
        return !segmentedConversionFactors.isEmpty();
    }

    @Override
    public ComponentModel createModel() {
        LinearConverterModel converterModel = new LinearConverterModel(this);
        setModel(converterModel);
        return converterModel;
    }
}
