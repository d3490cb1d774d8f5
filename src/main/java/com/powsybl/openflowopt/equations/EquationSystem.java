/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.equations;

import com.powsybl.commons.PowsyblException;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.*;

/**
 * Ordered collection of the variables and equations of a model, indexed by their unique label.
 */
public class EquationSystem {

    private final Map<String, Variable> variables = new LinkedHashMap<>();

    private final Map<String, Equation> equations = new LinkedHashMap<>();

    /**
     * Create a scalar variable.
     */
    public Variable createVariable(String label, String shortLabel) {
        return addVariable(new Variable(label, shortLabel, 1, false));
    }

    /**
     * Create a variable indexed by time step.
     */
    public Variable createTimeSeriesVariable(String label, String shortLabel, int nrOfTimeSteps) {
        return addVariable(new Variable(label, shortLabel, nrOfTimeSteps, true));
    }

    private Variable addVariable(Variable variable) {
        if (variables.containsKey(variable.getLabel())) {
            throw new PowsyblException("Variable '" + variable.getLabel() + "' already exists");
        }
        variables.put(variable.getLabel(), variable);
        return variable;
    }

    public Equation createEquation(String label, EquationType type) {
        Objects.requireNonNull(label);
        if (equations.containsKey(label)) {
            throw new PowsyblException("Equation '" + label + "' already exists");
        }
        Equation equation = new Equation(label, type);
        equations.put(label, equation);
        return equation;
    }

    public Collection<Variable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public Collection<Equation> getEquations() {
        return Collections.unmodifiableCollection(equations.values());
    }

    public Optional<Variable> getVariable(String label) {
        return Optional.ofNullable(variables.get(label));
    }

    public Optional<Equation> getEquation(String label) {
        return Optional.ofNullable(equations.get(label));
    }

    public List<Equation> getViolatedEquations(VariableValues values, double tolerance) {
        Objects.requireNonNull(values);
        return equations.values().stream()
                .filter(equation -> !equation.isSatisfied(values, tolerance))
                .toList();
    }

    public void write(Writer writer) {
        try {
            for (Variable variable : variables.values()) {
                variable.write(writer);
                writer.write(System.lineSeparator());
            }
            for (Equation equation : equations.values()) {
                equation.write(writer);
                writer.write(System.lineSeparator());
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String writeToString() {
        StringWriter writer = new StringWriter();
        write(writer);
        return writer.toString();
    }
}
