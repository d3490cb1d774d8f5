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
 * A summand of an {@link Equation}: variable times coefficient, restricted to a subset of the variable
 * indices and optionally summed over these indices.
 */
public final class EquationTerm {

    private final Variable variable;

    private final double[] coefficients;

    /**
     * null means all indices of the variable
     */
    private final int[] indices;

    private final boolean asSum;

    EquationTerm(Variable variable, double[] coefficients, int[] indices, boolean asSum) {
        this.variable = Objects.requireNonNull(variable);
        this.coefficients = Objects.requireNonNull(coefficients);
        this.indices = indices;
        this.asSum = asSum;
        if (indices != null) {
            if (indices.length == 0) {
                throw new PowsyblException("Empty index subset for variable '" + variable.getLabel() + "'");
            }
            for (int index : indices) {
                if (index < 0 || index >= variable.getLength()) {
                    throw new PowsyblException("Index " + index + " out of range for variable '" + variable.getLabel() + "'");
                }
            }
        }
        int selectedLength = getSelectedLength();
        if (coefficients.length != 1 && selectedLength != 1 && coefficients.length != selectedLength) {
            throw new PowsyblException("Coefficient length " + coefficients.length + " does not match selected length "
                    + selectedLength + " of variable '" + variable.getLabel() + "'");
        }
        if (asSum && coefficients.length != 1 && coefficients.length != selectedLength) {
            throw new PowsyblException("Summed variable '" + variable.getLabel() + "' needs one coefficient per index");
        }
    }

    public Variable getVariable() {
        return variable;
    }

    public double[] getCoefficients() {
        return coefficients;
    }

    public int[] getIndices() {
        return indices;
    }

    public boolean isAsSum() {
        return asSum;
    }

    private int getSelectedLength() {
        return indices != null ? indices.length : variable.getLength();
    }

    private int getVariableIndex(int i) {
        return indices != null ? indices[i] : i;
    }

    /**
     * Number of rows this term spans, 1 for a summed or a scalar term.
     */
    public int getLength() {
        if (asSum) {
            return 1;
        }
        return Math.max(getSelectedLength(), coefficients.length);
    }

    public double eval(VariableValues values, int row) {
        Objects.requireNonNull(values);
        if (asSum) {
            double sum = 0;
            for (int i = 0; i < getSelectedLength(); i++) {
                sum += DoubleArrays.get(coefficients, i) * values.get(variable, getVariableIndex(i));
            }
            return sum;
        }
        int i = getSelectedLength() == 1 ? 0 : row;
        return DoubleArrays.get(coefficients, row) * values.get(variable, getVariableIndex(i));
    }

    public void write(Writer writer) throws IOException {
        if (coefficients.length == 1) {
            writer.write(Double.toString(coefficients[0]));
        } else {
            writer.write(Arrays.toString(coefficients));
        }
        writer.write(" * ");
        if (asSum) {
            writer.write("sum(");
        }
        writer.write(variable.getLabel());
        if (indices != null) {
            writer.write(Arrays.toString(indices));
        }
        if (asSum) {
            writer.write(")");
        }
    }
}
