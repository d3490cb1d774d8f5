/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.openflowopt.model.BusModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Balance node of the flow system: at every time step the sum of the input flow rates equals the sum of
 * the output flow rates, up to an optional penalized excess.
 */
public class Bus extends AbstractElement<BusModel> {

    public static final double DEFAULT_EXCESS_PENALTY_PER_FLOW_HOUR = 1e5;

    /**
     * null means no excess allowed
     */
    private final TimeSeries excessPenaltyPerFlowHour;

    private final List<Flow> inputs = new ArrayList<>();

    private final List<Flow> outputs = new ArrayList<>();

    public Bus(String label) {
        this(label, TimeSeries.of(DEFAULT_EXCESS_PENALTY_PER_FLOW_HOUR));
    }

    public Bus(String label, TimeSeries excessPenaltyPerFlowHour) {
        super(label);
        this.excessPenaltyPerFlowHour = excessPenaltyPerFlowHour;
    }

    public TimeSeries getExcessPenaltyPerFlowHour() {
        return excessPenaltyPerFlowHour;
    }

    public boolean isWithExcess() {
        return excessPenaltyPerFlowHour != null;
    }

    public List<Flow> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Flow> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    void addInput(Flow flow) {
        inputs.add(flow);
    }

    void addOutput(Flow flow) {
        outputs.add(flow);
    }
}
