/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.equations.EquationType;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Flow;
import com.powsybl.openflowopt.network.InvestParameters;
import com.powsybl.openflowopt.util.DoubleArrays;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

/**
 * Flow rate of a flow with its on/off and investment features, its flow hours total, load factor bounds
 * and effects per flow hour.
 */
public class FlowModel extends AbstractElementModel<Flow> {

    private Variable flowRate;

    private Variable sumFlowHours;

    private OnOffModel<Flow> onOff;

    private InvestmentModel<Flow> investment;

    private Pair<double[], double[]> relativeFlowRateBounds;

    private Pair<double[], double[]> absoluteFlowRateBounds;

    public FlowModel(Flow flow) {
        super(flow, null);
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        int nrOfTimeSteps = systemModel.getNrOfTimeSteps();
        relativeFlowRateBounds = computeRelativeFlowRateBounds(nrOfTimeSteps);
        absoluteFlowRateBounds = computeAbsoluteFlowRateBounds(systemModel.getParameters().getBig());

        // relative minimum(t) * size <= flow rate(t) <= relative maximum(t) * size, delegated to on/off if any
        flowRate = createTimeSeriesVariable(systemModel, "flow_rate")
                .setPreviousValues(element.getPreviousFlowRate());
        if (element.getOnOffParameters() == null) {
            flowRate.setLowerBound(absoluteFlowRateBounds.getLeft())
                    .setUpperBound(absoluteFlowRateBounds.getRight());
        } else {
            flowRate.setLowerBound(0);
        }

        if (element.getOnOffParameters() != null) {
            onOff = addSubModel(new OnOffModel<>(element, element.getOnOffParameters(), List.of(flowRate),
                    List.of(absoluteFlowRateBounds), OnOffModel.DEFAULT_LABEL));
            onOff.doModeling(systemModel);
        }

        if (element.isWithInvestment()) {
            double[] fixedRelativeProfile = element.getFixedRelativeProfile() != null
                    ? element.getFixedRelativeProfile().toArray(nrOfTimeSteps)
                    : null;
            investment = addSubModel(new InvestmentModel<>(element, InvestmentModel.DEFAULT_LABEL, element.getInvestParameters(),
                    flowRate, relativeFlowRateBounds, fixedRelativeProfile, onOff != null ? onOff.getOn() : null));
            investment.doModeling(systemModel);
        }

        sumFlowHours = createVariable(systemModel, "sumFlowHours");
        if (element.getFlowHoursTotalMin() != null) {
            sumFlowHours.setLowerBound(element.getFlowHoursTotalMin());
        }
        if (element.getFlowHoursTotalMax() != null) {
            sumFlowHours.setUpperBound(element.getFlowHoursTotalMax());
        }
        // sumFlowHours = sum(flow rate(t) * dt(t))
        createEquation(systemModel, "sumFlowHours", EquationType.EQUALITY)
                .addSumTerm(flowRate, systemModel.getDtInHours())
                .addTerm(sumFlowHours, -1);

        createBoundsForLoadFactor(systemModel);

        createShares(systemModel);
    }

    private void createBoundsForLoadFactor(SystemModel systemModel) {
        double dtInHoursTotal = systemModel.getDtInHoursTotal();

        // sumFlowHours <= size * total duration * load factor max
        if (element.getLoadFactorMax() != null) {
            double flowHoursPerSizeMax = dtInHoursTotal * element.getLoadFactorMax();
            var equation = createEquation(systemModel, "load_factor_max", EquationType.INEQUALITY)
                    .addTerm(sumFlowHours, 1);
            if (investment != null) {
                equation.addTerm(investment.getSize(), -flowHoursPerSizeMax);
            } else {
                equation.addConstant(getSize(systemModel) * flowHoursPerSizeMax);
            }
        }

        // size * total duration * load factor min <= sumFlowHours
        if (element.getLoadFactorMin() != null) {
            double flowHoursPerSizeMin = dtInHoursTotal * element.getLoadFactorMin();
            var equation = createEquation(systemModel, "load_factor_min", EquationType.INEQUALITY)
                    .addTerm(sumFlowHours, -1);
            if (investment != null) {
                equation.addTerm(investment.getSize(), flowHoursPerSizeMin);
            } else {
                equation.addConstant(-getSize(systemModel) * flowHoursPerSizeMin);
            }
        }
    }

    private void createShares(SystemModel systemModel) {
        if (!element.getEffectsPerFlowHour().isEmpty()) {
            systemModel.getEffectCollectionModel().addShareToOperation(systemModel, "effects_per_flow_hour", element,
                    element.getEffectsPerFlowHour(), systemModel.getDtInHours(), flowRate);
        }
    }

    private double getSize(SystemModel systemModel) {
        return element.getSize() != null ? element.getSize() : systemModel.getParameters().getBig();
    }

    /**
     * The fixed profile is both the relative minimum and maximum.
     */
    private Pair<double[], double[]> computeRelativeFlowRateBounds(int nrOfTimeSteps) {
        if (element.getFixedRelativeProfile() != null) {
            double[] profile = element.getFixedRelativeProfile().toArray(nrOfTimeSteps);
            return Pair.of(profile, profile);
        }
        return Pair.of(element.getRelativeMinimum().toArray(nrOfTimeSteps), element.getRelativeMaximum().toArray(nrOfTimeSteps));
    }

    /**
     * A not invested flow can always be zero.
     */
    private Pair<double[], double[]> computeAbsoluteFlowRateBounds(double defaultSize) {
        double[] relativeMinimum = relativeFlowRateBounds.getLeft();
        double[] relativeMaximum = relativeFlowRateBounds.getRight();
        if (!element.isWithInvestment()) {
            double size = element.getSize() != null ? element.getSize() : defaultSize;
            return Pair.of(DoubleArrays.scale(relativeMinimum, size), DoubleArrays.scale(relativeMaximum, size));
        }
        InvestParameters investParameters = element.getInvestParameters();
        double minimumSize = investParameters.isOptional() ? 0 : investParameters.getMinimumSize();
        double maximumSize = investParameters.getMaximumSize(defaultSize);
        return Pair.of(DoubleArrays.scale(relativeMinimum, minimumSize), DoubleArrays.scale(relativeMaximum, maximumSize));
    }

    public Variable getFlowRate() {
        return flowRate;
    }

    public Variable getSumFlowHours() {
        return sumFlowHours;
    }

    /**
     * Null if the flow has no on/off parameters.
     */
    public OnOffModel<Flow> getOnOff() {
        return onOff;
    }

    public InvestmentModel<Flow> getInvestment() {
        return investment;
    }

    public Variable getOn() {
        if (onOff == null) {
            throw new PowsyblException("Flow '" + element.getLabelFull() + "' has no on variable");
        }
        return onOff.getOn();
    }

    public Pair<double[], double[]> getRelativeFlowRateBounds() {
        return relativeFlowRateBounds;
    }

    /**
     * Absolute (lower, upper) bounds of the flow rate, also used by the on/off models.
     */
    public Pair<double[], double[]> getAbsoluteFlowRateBounds() {
        return absoluteFlowRateBounds;
    }
}
