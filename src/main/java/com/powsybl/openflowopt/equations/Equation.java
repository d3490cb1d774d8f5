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
import java.util.*;

/**
 * A linear relation in canonical form: sum of terms (= or &lt;=) constant. The equation spans as many
 * rows as its non scalar terms, scalar terms and constants are broadcast to every row.
 *
 * @see EquationSystem#createEquation(String, EquationType)
 */
public class Equation {

    private final String label;

    private final EquationType type;

    private final List<EquationTerm> terms = new ArrayList<>();

    private double[] constant = {0};

    private int length = 1;

    Equation(String label, EquationType type) {
        this.label = Objects.requireNonNull(label);
        this.type = Objects.requireNonNull(type);
    }

    public String getLabel() {
        return label;
    }

    public EquationType getType() {
        return type;
    }

    public List<EquationTerm> getTerms() {
        return Collections.unmodifiableList(terms);
    }

    public double[] getConstant() {
        return constant;
    }

    public int getLength() {
        return length;
    }

    private void updateLength(int otherLength) {
        if (otherLength != 1) {
            if (length != 1 && length != otherLength) {
                throw new PowsyblException("Equation '" + label + "': length " + otherLength
                        + " is not compatible with length " + length);
            }
            length = otherLength;
        }
    }

    private Equation addTerm(EquationTerm term) {
        updateLength(term.getLength());
        terms.add(term);
        return this;
    }

    public Equation addTerm(Variable variable, double coefficient) {
        return addTerm(new EquationTerm(variable, DoubleArrays.of(coefficient), null, false));
    }

    public Equation addTerm(Variable variable, double[] coefficients) {
        return addTerm(new EquationTerm(variable, coefficients, null, false));
    }

    public Equation addTerm(Variable variable, double coefficient, int[] indices) {
        return addTerm(new EquationTerm(variable, DoubleArrays.of(coefficient), indices, false));
    }

    public Equation addTerm(Variable variable, double[] coefficients, int[] indices) {
        return addTerm(new EquationTerm(variable, coefficients, indices, false));
    }

    /**
     * Add the sum over all indices of variable times coefficient, a single row term.
     */
    public Equation addSumTerm(Variable variable, double coefficient) {
        return addTerm(new EquationTerm(variable, DoubleArrays.of(coefficient), null, true));
    }

    public Equation addSumTerm(Variable variable, double[] coefficients) {
        return addTerm(new EquationTerm(variable, coefficients, null, true));
    }

    public Equation addConstant(double value) {
        return addConstant(DoubleArrays.of(value));
    }

    /**
     * Add to the right-hand side constant.
     */
    public Equation addConstant(double[] value) {
        Objects.requireNonNull(value);
        updateLength(value.length);
        constant = DoubleArrays.add(constant, value);
        return this;
    }

    public double[] evalLhs(VariableValues values) {
        double[] lhs = new double[length];
        for (int row = 0; row < length; row++) {
            for (EquationTerm term : terms) {
                lhs[row] += term.eval(values, row);
            }
        }
        return lhs;
    }

    public double getRhs(int row) {
        return DoubleArrays.get(constant, row);
    }

    public boolean isSatisfied(VariableValues values, double tolerance) {
        double[] lhs = evalLhs(values);
        for (int row = 0; row < length; row++) {
            double rhs = getRhs(row);
            boolean satisfied = switch (type) {
                case EQUALITY -> Math.abs(lhs[row] - rhs) <= tolerance;
                case INEQUALITY -> lhs[row] <= rhs + tolerance;
            };
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    public void write(Writer writer) throws IOException {
        writer.write(label);
        writer.write(": ");
        for (Iterator<EquationTerm> it = terms.iterator(); it.hasNext();) {
            it.next().write(writer);
            if (it.hasNext()) {
                writer.write(" + ");
            }
        }
        writer.write(" ");
        writer.write(type.getSymbol());
        writer.write(" ");
        writer.write(constant.length == 1 ? Double.toString(constant[0]) : Arrays.toString(constant));
    }

    @Override
    public String toString() {
        return "Equation(label=" + label + ", type=" + type + ", length=" + length + ")";
    }
}
