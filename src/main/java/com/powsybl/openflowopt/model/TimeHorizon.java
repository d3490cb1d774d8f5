/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.commons.PowsyblException;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered time steps of one optimization horizon with their durations in hours, and the durations of the
 * time steps of the previous horizon used to seed continuity constraints.
 */
public final class TimeHorizon {

    private static final double SECONDS_PER_HOUR = 3600;

    private final double[] dtInHours;

    private final double dtInHoursTotal;

    private final double[] previousDtInHours;

    private TimeHorizon(double[] dtInHours, double[] previousDtInHours) {
        if (dtInHours.length == 0) {
            throw new PowsyblException("A time horizon needs at least one time step");
        }
        checkPositive(dtInHours);
        if (previousDtInHours.length == 0) {
            throw new PowsyblException("Previous time step durations cannot be empty");
        }
        checkPositive(previousDtInHours);
        this.dtInHours = dtInHours;
        this.dtInHoursTotal = Arrays.stream(dtInHours).sum();
        this.previousDtInHours = previousDtInHours;
    }

    private static void checkPositive(double[] durations) {
        for (int i = 0; i < durations.length; i++) {
            if (!(durations[i] > 0)) {
                throw new PowsyblException("Time step " + i + " has a non positive duration: " + durations[i]);
            }
        }
    }

    /**
     * @param nrOfTimeSteps number of time steps
     * @param hoursPerTimeStep duration of each time step, also used for the previous time steps
     */
    public static TimeHorizon uniform(int nrOfTimeSteps, double hoursPerTimeStep) {
        double[] dt = new double[nrOfTimeSteps];
        Arrays.fill(dt, hoursPerTimeStep);
        return new TimeHorizon(dt, new double[] {hoursPerTimeStep});
    }

    /**
     * Previous time steps are assumed to last as long as the first time step.
     */
    public static TimeHorizon of(double... dtInHours) {
        Objects.requireNonNull(dtInHours);
        return new TimeHorizon(dtInHours.clone(), dtInHours.length > 0 ? new double[] {dtInHours[0]} : new double[0]);
    }

    public static TimeHorizon of(double[] dtInHours, double[] previousDtInHours) {
        return new TimeHorizon(Objects.requireNonNull(dtInHours).clone(), Objects.requireNonNull(previousDtInHours).clone());
    }

    /**
     * Build a horizon from the start instants of its time steps.
     *
     * @param hoursOfLastTimeStep duration of the last time step, if null the duration of the step before is used
     * @param hoursOfPreviousTimeSteps duration of the time steps before the horizon, if null the duration of the first step is used
     */
    public static TimeHorizon fromTimestamps(List<Instant> timestamps, Double hoursOfLastTimeStep, Double hoursOfPreviousTimeSteps) {
        Objects.requireNonNull(timestamps);
        if (timestamps.isEmpty()) {
            throw new PowsyblException("At least one timestamp is needed");
        }
        if (timestamps.size() == 1 && hoursOfLastTimeStep == null) {
            throw new PowsyblException("Duration of the last time step is needed with a single timestamp");
        }
        double[] dt = new double[timestamps.size()];
        for (int i = 0; i < timestamps.size() - 1; i++) {
            Duration duration = Duration.between(timestamps.get(i), timestamps.get(i + 1));
            if (duration.isNegative() || duration.isZero()) {
                throw new PowsyblException("Timestamps must be strictly increasing: " + timestamps.get(i) + " then " + timestamps.get(i + 1));
            }
            dt[i] = duration.toMillis() / 1000.0 / SECONDS_PER_HOUR;
        }
        dt[dt.length - 1] = hoursOfLastTimeStep != null ? hoursOfLastTimeStep : dt[dt.length - 2];
        double previous = hoursOfPreviousTimeSteps != null ? hoursOfPreviousTimeSteps : dt[0];
        return new TimeHorizon(dt, new double[] {previous});
    }

    public int getNrOfTimeSteps() {
        return dtInHours.length;
    }

    public double[] getDtInHours() {
        return dtInHours.clone();
    }

    public double getDtInHours(int step) {
        return dtInHours[step];
    }

    public double getDtInHoursTotal() {
        return dtInHoursTotal;
    }

    /**
     * Durations of the previous time steps, a single value applying to all of them or one per step
     * aligned on the end of the previous values.
     */
    public double[] getPreviousDtInHours() {
        return previousDtInHours.clone();
    }

    @Override
    public String toString() {
        return "TimeHorizon(dtInHours=" + Arrays.toString(dtInHours) + ", previousDtInHours=" + Arrays.toString(previousDtInHours) + ")";
    }
}
