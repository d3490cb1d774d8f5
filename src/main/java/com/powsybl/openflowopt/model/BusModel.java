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
import com.powsybl.openflowopt.network.Bus;
import com.powsybl.openflowopt.network.Flow;
import com.powsybl.openflowopt.util.DoubleArrays;
import com.powsybl.openflowopt.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Balance of a bus: sum of input flow rates minus sum of output flow rates, plus the penalized excess
 * variables if allowed, is zero at every time step.
 */
public class BusModel extends AbstractElementModel<Bus> {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusModel.class);

    private Variable excessInput;

    private Variable excessOutput;

    public BusModel(Bus bus) {
        super(bus, null);
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        // sum(inputs(t)) - sum(outputs(t)) = 0
        Equation balance = createEquation(systemModel, "busBalance", EquationType.EQUALITY);
        for (Flow flow : element.getInputs()) {
            balance.addTerm(flow.getModel().getFlowRate(), 1);
        }
        for (Flow flow : element.getOutputs()) {
            balance.addTerm(flow.getModel().getFlowRate(), -1);
        }

        if (element.isWithExcess()) {
            double[] penalty = element.getExcessPenaltyPerFlowHour().toArray(systemModel.getNrOfTimeSteps());
            if (element.getExcessPenaltyPerFlowHour().max() == 0 && element.getExcessPenaltyPerFlowHour().min() == 0) {
                LOGGER.warn("Excess penalty of bus '{}' is zero, excess is free: disable excess instead", element.getLabelFull());
                Reports.reportZeroExcessPenalty(systemModel.getReportNode(), element.getLabelFull());
            }
            double[] excessPenalty = DoubleArrays.multiply(systemModel.getDtInHours(), penalty);

            excessInput = createTimeSeriesVariable(systemModel, "excess_input").setLowerBound(0);
            excessOutput = createTimeSeriesVariable(systemModel, "excess_output").setLowerBound(0);

            // ... + excess input(t) - excess output(t) = 0
            balance.addTerm(excessOutput, -1)
                    .addTerm(excessInput, 1);

            EffectCollectionModel effects = systemModel.getEffectCollectionModel();
            effects.addShareToPenalty(systemModel, element.getLabelFull() + "__excess_input", excessInput, excessPenalty);
            effects.addShareToPenalty(systemModel, element.getLabelFull() + "__excess_output", excessOutput, excessPenalty);
        }
    }

    /**
     * Null if the bus has no excess.
     */
    public Variable getExcessInput() {
        return excessInput;
    }

    public Variable getExcessOutput() {
        return excessOutput;
    }
}
