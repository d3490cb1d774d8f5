/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.equations;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.util.DoubleArrays;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.Objects;

/**
 * A decision variable of the optimization model, either scalar (length 1) or indexed by time step.
 * Identity is the full label.
 */
public class Variable {

    private final String label;

    private final String shortLabel;

    private final int length;

    private final boolean timeIndexed;

    /**
     * null means unbounded
     */
    private double[] lowerBound;

    private double[] upperBound;

    private boolean binary = false;

    private double[] fixedValue;

    /**
     * Values of the previous horizon, only used to seed continuity constraints
     */
    private double[] previousValues;

    Variable(String label, String shortLabel, int length, boolean timeIndexed) {
        this.label = Objects.requireNonNull(label);
        this.shortLabel = Objects.requireNonNull(shortLabel);
        if (length < 1) {
            throw new PowsyblException("Variable '" + label + "' must have a positive length: " + length);
        }
        this.length = length;
        this.timeIndexed = timeIndexed;
    }

    public String getLabel() {
        return label;
    }

    public String getShortLabel() {
        return shortLabel;
    }

    public int getLength() {
        return length;
    }

    public boolean isTimeIndexed() {
        return timeIndexed;
    }

    private double[] checkLength(double[] values, String name) {
        if (values != null && values.length != 1 && values.length != length) {
            throw new PowsyblException("Variable '" + label + "': " + name + " length " + values.length
                    + " does not match variable length " + length);
        }
        return values;
    }

    private void checkBounds() {
        if (lowerBound != null && upperBound != null) {
            for (int i = 0; i < length; i++) {
                if (DoubleArrays.get(lowerBound, i) > DoubleArrays.get(upperBound, i)) {
                    throw new PowsyblException("Variable '" + label + "': lower bound " + DoubleArrays.get(lowerBound, i)
                            + " is greater than upper bound " + DoubleArrays.get(upperBound, i) + " at index " + i);
                }
            }
        }
    }

    public Variable setLowerBound(double[] lowerBound) {
        this.lowerBound = checkLength(lowerBound, "lower bound");
        checkBounds();
        return this;
    }

    public Variable setLowerBound(double lowerBound) {
        return setLowerBound(DoubleArrays.of(lowerBound));
    }

    public Variable setUpperBound(double[] upperBound) {
        this.upperBound = checkLength(upperBound, "upper bound");
        checkBounds();
        return this;
    }

    public Variable setUpperBound(double upperBound) {
        return setUpperBound(DoubleArrays.of(upperBound));
    }

    public Variable setBinary(boolean binary) {
        this.binary = binary;
        return this;
    }

    public Variable setFixedValue(double[] fixedValue) {
        this.fixedValue = checkLength(fixedValue, "fixed value");
        return this;
    }

    public Variable setFixedValue(double fixedValue) {
        return setFixedValue(DoubleArrays.of(fixedValue));
    }

    public Variable setPreviousValues(double[] previousValues) {
        this.previousValues = previousValues;
        return this;
    }

    public boolean isBinary() {
        return binary;
    }

    public boolean isFixed() {
        return fixedValue != null;
    }

    public double[] getFixedValue() {
        return fixedValue;
    }

    public double[] getPreviousValues() {
        return previousValues;
    }

    public double getLowerBound(int i) {
        if (fixedValue != null) {
            return DoubleArrays.get(fixedValue, i);
        }
        double lb = lowerBound != null ? DoubleArrays.get(lowerBound, i) : Double.NEGATIVE_INFINITY;
        return binary ? Math.max(lb, 0) : lb;
    }

    public double getUpperBound(int i) {
        if (fixedValue != null) {
            return DoubleArrays.get(fixedValue, i);
        }
        double ub = upperBound != null ? DoubleArrays.get(upperBound, i) : Double.POSITIVE_INFINITY;
        return binary ? Math.min(ub, 1) : ub;
    }

    /**
     * Check that the given values respect the bounds (and integrality for binaries) of this variable.
     */
    public boolean isWithinBounds(double[] values, double tolerance) {
        Objects.requireNonNull(values);
        checkLength(values, "values");
        for (int i = 0; i < length; i++) {
            double value = DoubleArrays.get(values, i);
            if (value < getLowerBound(i) - tolerance || value > getUpperBound(i) + tolerance) {
                return false;
            }
            if (binary && Math.abs(value - Math.rint(value)) > tolerance) {
                return false;
            }
        }
        return true;
    }

    public void write(Writer writer) throws IOException {
        writer.write(label);
        writer.write(" in ");
        if (binary) {
            writer.write("{0, 1}");
        } else if (fixedValue != null) {
            writer.write("{" + format(fixedValue) + "}");
        } else {
            writer.write("[" + (lowerBound != null ? format(lowerBound) : "-inf") + ", "
                    + (upperBound != null ? format(upperBound) : "+inf") + "]");
        }
        writer.write(", length=");
        writer.write(Integer.toString(length));
    }

    private static String format(double[] values) {
        return values.length == 1 ? Double.toString(values[0]) : Arrays.toString(values);
    }

    @Override
    public int hashCode() {
        return label.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Variable variable) {
            return label.equals(variable.label);
        }
        return false;
    }

    @Override
    public String toString() {
        return "Variable(label=" + label + ", length=" + length + ", binary=" + binary + ")";
    }
}
