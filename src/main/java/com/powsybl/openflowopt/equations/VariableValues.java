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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An assignment of values to variables, used to evaluate equations (for instance a solution read back
 * from a solver). A single value is broadcast to every index of the variable.
 */
public class VariableValues {

    private final Map<Variable, double[]> values = new HashMap<>();

    public VariableValues set(Variable variable, double... values) {
        Objects.requireNonNull(variable);
        Objects.requireNonNull(values);
        if (values.length != 1 && values.length != variable.getLength()) {
            throw new PowsyblException("Expected " + variable.getLength() + " values for variable '"
                    + variable.getLabel() + "' but got " + values.length);
        }
        this.values.put(variable, values);
        return this;
    }

    public boolean contains(Variable variable) {
        return values.containsKey(variable);
    }

    public double[] get(Variable variable) {
        double[] v = values.get(variable);
        if (v == null) {
            throw new PowsyblException("No value assigned to variable '" + variable.getLabel() + "'");
        }
        return v;
    }

    public double get(Variable variable, int index) {
        return DoubleArrays.get(get(variable), index);
    }
}
