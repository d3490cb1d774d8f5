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

import java.util.List;
import java.util.Objects;

/**
 * At most one of several binary variables can be 1 at the same time.
 */
public class PreventSimultaneousUsageModel<E extends Element> extends AbstractElementModel<E> {

    public static final String DEFAULT_LABEL = "PreventSimultaneousUsage";

    private final List<Variable> variables;

    public PreventSimultaneousUsageModel(E element, String label, List<Variable> variables) {
        super(element, label);
        this.variables = List.copyOf(Objects.requireNonNull(variables));
        if (variables.size() < 2) {
            throw new PowsyblException("Model '" + getLabelFull() + "' needs at least two variables, got " + variables.size());
        }
        for (Variable variable : variables) {
            if (!variable.isBinary()) {
                throw new PowsyblException("Variable '" + variable.getLabel() + "' must be binary to prevent simultaneous usage");
            }
        }
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        // sum(binary_i(t)) <= 1 + slack
        Equation equation = createEquation(systemModel, "prevent_simultaneous_use", EquationType.INEQUALITY);
        for (Variable variable : variables) {
            equation.addTerm(variable, 1);
        }
        equation.addConstant(1 + systemModel.getParameters().getBinarySlack());
    }

    public List<Variable> getBinaryVariables() {
        return variables;
    }
}
