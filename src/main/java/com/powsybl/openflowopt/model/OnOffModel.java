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
import com.powsybl.openflowopt.network.OnOffParameters;
import com.powsybl.openflowopt.network.TimeSeries;
import com.powsybl.openflowopt.util.DoubleArrays;
import com.powsybl.openflowopt.util.Reports;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * On/off state of one or several continuous variables: a binary on variable that is 0 only if all the
 * defining variables are (numerically) zero, and optionally an off variable, consecutive on/off durations
 * and switch on/off events.
 */
public class OnOffModel<E extends Element> extends AbstractElementModel<E> {

    private static final Logger LOGGER = LoggerFactory.getLogger(OnOffModel.class);

    public static final String DEFAULT_LABEL = "OnOff";

    private final OnOffParameters parameters;

    private final List<Variable> definingVariables;

    private final List<Pair<double[], double[]>> definingBounds;

    private Variable on;

    private Variable totalOnHours;

    private Variable off;

    private Variable consecutiveOnHours;

    private Variable consecutiveOffHours;

    private Variable switchOn;

    private Variable switchOff;

    private Variable nrSwitchOn;

    /**
     * @param definingBounds absolute (lower, upper) bounds of each defining variable
     */
    public OnOffModel(E element, OnOffParameters parameters, List<Variable> definingVariables,
                      List<Pair<double[], double[]>> definingBounds, String label) {
        super(element, label);
        this.parameters = Objects.requireNonNull(parameters);
        this.definingVariables = List.copyOf(Objects.requireNonNull(definingVariables));
        this.definingBounds = List.copyOf(Objects.requireNonNull(definingBounds));
        if (definingVariables.isEmpty()) {
            throw new PowsyblException("On/off model '" + getLabelFull() + "' needs at least one defining variable");
        }
        if (definingVariables.size() != definingBounds.size()) {
            throw new PowsyblException("On/off model '" + getLabelFull() + "': every defining variable needs bounds");
        }
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        double epsilon = systemModel.getParameters().getEpsilon();
        double[] previousOnValues = computePreviousOnValues(definingVariables, epsilon);

        on = createTimeSeriesVariable(systemModel, "on")
                .setBinary(true)
                .setPreviousValues(previousOnValues);

        totalOnHours = createVariable(systemModel, "totalOnHours");
        if (parameters.getOnHoursTotalMin() != null) {
            totalOnHours.setLowerBound(parameters.getOnHoursTotalMin());
        }
        if (parameters.getOnHoursTotalMax() != null) {
            totalOnHours.setUpperBound(parameters.getOnHoursTotalMax());
        }
        // totalOnHours = sum(on(t) * dt(t))
        createEquation(systemModel, "totalOnHours", EquationType.EQUALITY)
                .addSumTerm(on, systemModel.getDtInHours())
                .addTerm(totalOnHours, -1);

        addOnConstraints(systemModel);

        if (parameters.isUseOff()) {
            double[] previousOffValues = new double[previousOnValues.length];
            for (int i = 0; i < previousOnValues.length; i++) {
                previousOffValues[i] = 1 - previousOnValues[i];
            }
            off = createTimeSeriesVariable(systemModel, "off")
                    .setBinary(true)
                    .setPreviousValues(previousOffValues);

            // on(t) + off(t) = 1
            createEquation(systemModel, "var_off", EquationType.EQUALITY)
                    .addTerm(off, 1)
                    .addTerm(on, 1)
                    .addConstant(1);
        }

        if (parameters.isUseConsecutiveOnHours()) {
            consecutiveOnHours = createDurationVariable(systemModel, "consecutiveOnHours", on,
                    parameters.getConsecutiveOnHoursMin(), parameters.getConsecutiveOnHoursMax());
        }
        if (parameters.isUseConsecutiveOffHours()) {
            consecutiveOffHours = createDurationVariable(systemModel, "consecutiveOffHours", off,
                    parameters.getConsecutiveOffHoursMin(), parameters.getConsecutiveOffHoursMax());
        }

        if (parameters.isUseSwitchOn()) {
            switchOn = createTimeSeriesVariable(systemModel, "switchOn").setBinary(true);
            switchOff = createTimeSeriesVariable(systemModel, "switchOff").setBinary(true);
            nrSwitchOn = createVariable(systemModel, "nrSwitchOn").setLowerBound(0);
            if (parameters.getSwitchOnTotalMax() != null) {
                nrSwitchOn.setUpperBound(parameters.getSwitchOnTotalMax());
            }
            addSwitchConstraints(systemModel);
        }

        createShares(systemModel);
    }

    private void addOnConstraints(SystemModel systemModel) {
        double epsilon = systemModel.getParameters().getEpsilon();
        int n = definingVariables.size();
        Equation eqOn1 = createEquation(systemModel, "On_Constraint_1", EquationType.INEQUALITY);
        Equation eqOn2 = createEquation(systemModel, "On_Constraint_2", EquationType.INEQUALITY);
        double[] upperBound;
        if (n == 1) {
            Variable variable = definingVariables.get(0);
            Pair<double[], double[]> bounds = definingBounds.get(0);
            upperBound = bounds.getRight();

            // on(t) * max(epsilon, lower bound(t)) <= var(t)
            eqOn1.addTerm(variable, -1)
                    .addTerm(on, DoubleArrays.maximum(bounds.getLeft(), epsilon));

            // var(t) <= on(t) * upper bound(t)
            eqOn2.addTerm(variable, 1)
                    .addTerm(on, DoubleArrays.negate(upperBound));
        } else {
            // on is 0 when all defining variables are 0: - sum(var_i(t)) + epsilon * on(t) <= 0
            for (Variable variable : definingVariables) {
                eqOn1.addTerm(variable, -1);
            }
            eqOn1.addTerm(on, epsilon);

            // averaged by the number of variables to keep coefficients small:
            // sum(var_i(t) / n) - sum(upper bound_i(t)) / n * on(t) <= 0
            double[] absoluteMaximum = DoubleArrays.of(0);
            for (int i = 0; i < n; i++) {
                eqOn2.addTerm(definingVariables.get(i), 1.0 / n);
                absoluteMaximum = DoubleArrays.add(absoluteMaximum, definingBounds.get(i).getRight());
            }
            upperBound = DoubleArrays.scale(absoluteMaximum, 1.0 / n);
            eqOn2.addTerm(on, DoubleArrays.negate(upperBound));
        }

        double bigBinaryBound = systemModel.getParameters().getBigBinaryBound();
        double maxUpperBound = DoubleArrays.max(upperBound);
        if (maxUpperBound > bigBinaryBound) {
            LOGGER.warn("In '{}', a binary definition was created with a big upper bound ({}), this can lead to wrong "
                    + "on/off values, reduce the size (or the maximum invest size) of its flows", getLabelFull(), maxUpperBound);
            Reports.reportBigBinaryBound(systemModel.getReportNode(), getLabelFull(), maxUpperBound, bigBinaryBound);
        }
    }

    /**
     * Duration variable counting the consecutive hours the binary variable has been 1, for instance
     * [0, 0, 1, 1, 1, 1, 0, 1, 1, 1, 0] gives [0, 0, 1, 2, 3, 4, 0, 1, 2, 3, 0] with 1h time steps.
     * The minimum duration is not checked on the last time step.
     */
    private Variable createDurationVariable(SystemModel systemModel, String shortLabel, Variable binaryVariable,
                                            TimeSeries minimumDuration, TimeSeries maximumDuration) {
        int nrOfTimeSteps = systemModel.getNrOfTimeSteps();
        double[] dt = systemModel.getDtInHours();
        double previousDuration = computeConsecutiveDuration(binaryVariable.getPreviousValues(), systemModel.getPreviousDtInHours());
        double mega = systemModel.getDtInHoursTotal() + previousDuration;

        if (maximumDuration != null) {
            double firstStepMax = maximumDuration.get(0);
            if (previousDuration + dt[0] > firstStepMax) {
                LOGGER.warn("The maximum duration of '{}' is {}h, but the previous consecutive duration is {}h, this forces "
                        + "'{}' to 0 in the first time step (dt={}h)", getLabelFull() + "__" + shortLabel, firstStepMax,
                        previousDuration, binaryVariable.getLabel(), dt[0]);
                Reports.reportMaximumDurationInconsistency(systemModel.getReportNode(), getLabelFull() + "__" + shortLabel,
                        firstStepMax, previousDuration, dt[0]);
            }
        }

        Variable duration = createTimeSeriesVariable(systemModel, shortLabel)
                .setLowerBound(0)
                .setUpperBound(maximumDuration != null ? maximumDuration.toArray(nrOfTimeSteps) : DoubleArrays.of(mega))
                .setPreviousValues(DoubleArrays.of(previousDuration));

        // 1) duration(t) - binary(t) * mega <= 0
        createEquation(systemModel, shortLabel + "_constraint_1", EquationType.INEQUALITY)
                .addTerm(duration, 1)
                .addTerm(binaryVariable, -mega);

        if (nrOfTimeSteps > 1) {
            int[] current = DoubleArrays.range(1, nrOfTimeSteps);
            int[] before = DoubleArrays.range(0, nrOfTimeSteps - 1);
            double[] dtAfterFirst = DoubleArrays.slice(dt, 1, nrOfTimeSteps);

            // 2a) duration(t) - duration(t-1) <= dt(t)
            createEquation(systemModel, shortLabel + "_constraint_2a", EquationType.INEQUALITY)
                    .addTerm(duration, 1, current)
                    .addTerm(duration, -1, before)
                    .addConstant(dtAfterFirst);

            // 2b) dt(t) - mega * (1 - binary(t)) <= duration(t) - duration(t-1)
            createEquation(systemModel, shortLabel + "_constraint_2b", EquationType.INEQUALITY)
                    .addTerm(duration, -1, current)
                    .addTerm(duration, 1, before)
                    .addTerm(binaryVariable, mega, current)
                    .addConstant(DoubleArrays.add(DoubleArrays.negate(dtAfterFirst), DoubleArrays.of(mega)));

            // 3) duration(t) >= minimum(t) * (binary(t) - binary(t+1)), the last time step is not checked
            if (minimumDuration != null) {
                double[] minimum = minimumDuration.isScalar()
                        ? DoubleArrays.of(minimumDuration.get(0))
                        : DoubleArrays.slice(minimumDuration.toArray(nrOfTimeSteps), 0, nrOfTimeSteps - 1);
                createEquation(systemModel, shortLabel + "_minimum_duration", EquationType.INEQUALITY)
                        .addTerm(duration, -1, before)
                        .addTerm(binaryVariable, DoubleArrays.negate(minimum), current)
                        .addTerm(binaryVariable, minimum, before);
            }
        }

        // a duration started in the previous horizon and shorter than the minimum continues
        if (minimumDuration != null && previousDuration > 0 && previousDuration < minimumDuration.get(0)) {
            createEquation(systemModel, shortLabel + "_minimum_duration_initial", EquationType.EQUALITY)
                    .addTerm(binaryVariable, 1, new int[] {0})
                    .addConstant(1);
        }

        // 4) duration(0) = binary(0) * (dt(0) + previous duration)
        createEquation(systemModel, shortLabel + "_initial", EquationType.EQUALITY)
                .addTerm(duration, 1, new int[] {0})
                .addTerm(binaryVariable, -(dt[0] + previousDuration), new int[] {0});

        return duration;
    }

    private void addSwitchConstraints(SystemModel systemModel) {
        int nrOfTimeSteps = systemModel.getNrOfTimeSteps();

        // switchOn(t) - switchOff(t) = on(t) - on(t-1)
        if (nrOfTimeSteps > 1) {
            int[] current = DoubleArrays.range(1, nrOfTimeSteps);
            createEquation(systemModel, "Switch", EquationType.EQUALITY)
                    .addTerm(switchOn, 1, current)
                    .addTerm(switchOff, -1, current)
                    .addTerm(on, -1, current)
                    .addTerm(on, 1, DoubleArrays.range(0, nrOfTimeSteps - 1));
        }

        // switchOn(0) - switchOff(0) = on(0) - on(-1)
        double[] previousOnValues = on.getPreviousValues();
        createEquation(systemModel, "Initial_Switch", EquationType.EQUALITY)
                .addTerm(switchOn, 1, new int[] {0})
                .addTerm(switchOff, -1, new int[] {0})
                .addTerm(on, -1, new int[] {0})
                .addConstant(-previousOnValues[previousOnValues.length - 1]);

        // switchOn(t) + switchOff(t) <= 1 + slack
        createEquation(systemModel, "Switch_On_or_Off", EquationType.INEQUALITY)
                .addTerm(switchOn, 1)
                .addTerm(switchOff, 1)
                .addConstant(1 + systemModel.getParameters().getBinarySlack());

        // nrSwitchOn = sum(switchOn(t))
        createEquation(systemModel, "NrSwitchOn", EquationType.EQUALITY)
                .addTerm(nrSwitchOn, 1)
                .addSumTerm(switchOn, -1);
    }

    private void createShares(SystemModel systemModel) {
        EffectCollectionModel effects = systemModel.getEffectCollectionModel();
        if (!parameters.getEffectsPerSwitchOn().isEmpty()) {
            effects.addShareToOperation(systemModel, "switch_on_effects", element, parameters.getEffectsPerSwitchOn(),
                    DoubleArrays.of(1), switchOn);
        }
        if (!parameters.getEffectsPerRunningHour().isEmpty()) {
            effects.addShareToOperation(systemModel, "running_hour_effects", element, parameters.getEffectsPerRunningHour(),
                    systemModel.getDtInHours(), on);
        }
    }

    /**
     * Previous on states: 1 at the index where any of the defining variables was not zero, [0] if no
     * previous value is known.
     */
    static double[] computePreviousOnValues(List<Variable> variables, double epsilon) {
        double[] previousOnValues = null;
        for (Variable variable : variables) {
            double[] previousValues = variable.getPreviousValues();
            if (previousValues == null || previousValues.length == 0) {
                continue;
            }
            if (previousOnValues == null) {
                previousOnValues = new double[previousValues.length];
            } else if (previousOnValues.length != previousValues.length) {
                throw new PowsyblException("Previous values of '" + variable.getLabel() + "' have length " + previousValues.length
                        + ", other coupled variables have length " + previousOnValues.length);
            }
            for (int i = 0; i < previousValues.length; i++) {
                if (Math.abs(previousValues[i]) > epsilon) {
                    previousOnValues[i] = 1;
                }
            }
        }
        return previousOnValues != null ? previousOnValues : DoubleArrays.of(0);
    }

    /**
     * Duration in hours of the trailing run of ones of the binary values.
     *
     * @param dtInHours a single duration applying to every value, or one duration per value aligned on the end
     */
    static double computeConsecutiveDuration(double[] binaryValues, double[] dtInHours) {
        if (binaryValues == null || binaryValues.length == 0) {
            return 0;
        }
        int count = 0;
        for (int i = binaryValues.length - 1; i >= 0 && binaryValues[i] > 0.5; i--) {
            count++;
        }
        if (dtInHours.length == 1) {
            return count * dtInHours[0];
        }
        if (count > dtInHours.length) {
            throw new PowsyblException("Consecutive duration of " + count + " time steps is longer than the "
                    + dtInHours.length + " previous time step durations");
        }
        double duration = 0;
        for (int i = dtInHours.length - count; i < dtInHours.length; i++) {
            duration += dtInHours[i];
        }
        return duration;
    }

    public OnOffParameters getParameters() {
        return parameters;
    }

    public Variable getOn() {
        return on;
    }

    public Variable getTotalOnHours() {
        return totalOnHours;
    }

    public Variable getOff() {
        return off;
    }

    public Variable getConsecutiveOnHours() {
        return consecutiveOnHours;
    }

    public Variable getConsecutiveOffHours() {
        return consecutiveOffHours;
    }

    public Variable getSwitchOn() {
        return switchOn;
    }

    public Variable getSwitchOff() {
        return switchOff;
    }

    public Variable getNrSwitchOn() {
        return nrSwitchOn;
    }
}
