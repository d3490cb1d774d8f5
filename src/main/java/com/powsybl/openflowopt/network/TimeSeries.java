/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.util.DoubleArrays;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable per-step data, either a single value valid for every step or one value per step.
 */
public final class TimeSeries {

    private final double[] data;

    private TimeSeries(double[] data) {
        this.data = data;
    }

    public static TimeSeries of(double value) {
        return new TimeSeries(new double[] {value});
    }

    public static TimeSeries of(double... values) {
        Objects.requireNonNull(values);
        if (values.length == 0) {
            throw new PowsyblException("Empty time series");
        }
        return new TimeSeries(values.clone());
    }

    public boolean isScalar() {
        return data.length == 1;
    }

    public int getLength() {
        return data.length;
    }

    public double get(int step) {
        return DoubleArrays.get(data, step);
    }

    public double max() {
        return DoubleArrays.max(data);
    }

    public double min() {
        return Arrays.stream(data).min().orElseThrow();
    }

    /**
     * Raw data, a one element array for a scalar series.
     */
    public double[] getData() {
        return data.clone();
    }

    /**
     * Per-step data expanded to the given number of steps.
     */
    public double[] toArray(int nrOfTimeSteps) {
        if (isScalar()) {
            double[] values = new double[nrOfTimeSteps];
            Arrays.fill(values, data[0]);
            return values;
        }
        if (data.length != nrOfTimeSteps) {
            throw new PowsyblException("Time series of length " + data.length + " does not match the "
                    + nrOfTimeSteps + " time steps of the horizon");
        }
        return data.clone();
    }

    /**
     * Check value by value that this series is lower than or equal to the other one, scalars being broadcast.
     */
    public boolean isLowerOrEqual(TimeSeries other) {
        Objects.requireNonNull(other);
        int length = DoubleArrays.broadcastLength(data, other.data);
        for (int i = 0; i < length; i++) {
            if (get(i) > other.get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof TimeSeries other) {
            return Arrays.equals(data, other.data);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return isScalar() ? Double.toString(data[0]) : Arrays.toString(data);
    }
}
