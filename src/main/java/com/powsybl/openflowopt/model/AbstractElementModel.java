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

import java.util.*;

/**
 * Variables and equations created for one element, or for one feature of an element. Variable and
 * equation labels are prefixed by the full label of the model so that they are unique in the system.
 */
public abstract class AbstractElementModel<E extends Element> {

    private static final String SEPARATOR = "__";

    protected final E element;

    protected final String label;

    private final Map<String, Variable> variables = new LinkedHashMap<>();

    private final Map<String, Equation> equations = new LinkedHashMap<>();

    private final List<AbstractElementModel<?>> subModels = new ArrayList<>();

    protected AbstractElementModel(E element, String label) {
        this.element = Objects.requireNonNull(element);
        this.label = label;
    }

    public E getElement() {
        return element;
    }

    /**
     * Label relative to the element, null for the main model of an element.
     */
    public String getLabel() {
        return label;
    }

    public String getLabelFull() {
        return label == null ? element.getLabelFull() : element.getLabelFull() + SEPARATOR + label;
    }

    /**
     * Label of a feature model owned by this model.
     */
    protected String childLabel(String name) {
        return label == null ? name : label + SEPARATOR + name;
    }

    public abstract void doModeling(SystemModel systemModel);

    protected Variable createVariable(SystemModel systemModel, String shortLabel) {
        Variable variable = systemModel.getEquationSystem().createVariable(getLabelFull() + SEPARATOR + shortLabel, shortLabel);
        return addVariable(variable);
    }

    protected Variable createTimeSeriesVariable(SystemModel systemModel, String shortLabel) {
        Variable variable = systemModel.getEquationSystem()
                .createTimeSeriesVariable(getLabelFull() + SEPARATOR + shortLabel, shortLabel, systemModel.getNrOfTimeSteps());
        return addVariable(variable);
    }

    private Variable addVariable(Variable variable) {
        variables.put(variable.getShortLabel(), variable);
        return variable;
    }

    protected Equation createEquation(SystemModel systemModel, String shortLabel, EquationType type) {
        Equation equation = systemModel.getEquationSystem().createEquation(getLabelFull() + SEPARATOR + shortLabel, type);
        equations.put(shortLabel, equation);
        return equation;
    }

    protected <M extends AbstractElementModel<?>> M addSubModel(M subModel) {
        subModels.add(Objects.requireNonNull(subModel));
        return subModel;
    }

    public Map<String, Variable> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Variable getVariable(String shortLabel) {
        Variable variable = variables.get(shortLabel);
        if (variable == null) {
            throw new PowsyblException("Variable '" + shortLabel + "' not found in model '" + getLabelFull() + "'");
        }
        return variable;
    }

    public Map<String, Equation> getEquations() {
        return Collections.unmodifiableMap(equations);
    }

    public Equation getEquation(String shortLabel) {
        Equation equation = equations.get(shortLabel);
        if (equation == null) {
            throw new PowsyblException("Equation '" + shortLabel + "' not found in model '" + getLabelFull() + "'");
        }
        return equation;
    }

    public List<AbstractElementModel<?>> getSubModels() {
        return Collections.unmodifiableList(subModels);
    }

    /**
     * Variables of this model and of all its sub models.
     */
    public List<Variable> getAllVariables() {
        List<Variable> all = new ArrayList<>(variables.values());
        for (AbstractElementModel<?> subModel : subModels) {
            all.addAll(subModel.getAllVariables());
        }
        return all;
    }

    public List<Equation> getAllEquations() {
        List<Equation> all = new ArrayList<>(equations.values());
        for (AbstractElementModel<?> subModel : subModels) {
            all.addAll(subModel.getAllEquations());
        }
        return all;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getLabelFull() + ")";
    }
}
