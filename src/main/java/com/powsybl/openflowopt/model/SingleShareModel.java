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
import com.powsybl.openflowopt.util.DoubleArrays;

import java.util.Objects;

/**
 * One named contribution to a ledger: a variable constrained to be equal to a variable times a factor,
 * or to the factor alone for a constant contribution.
 */
public class SingleShareModel<E extends Element> extends AbstractElementModel<E> {

    private final Variable variable;

    private final double[] factor;

    private final boolean asSum;

    private Variable share;

    public SingleShareModel(E element, String label, Variable variable, double[] factor, boolean asSum) {
        super(element, label);
        this.variable = variable;
        this.factor = Objects.requireNonNull(factor);
        this.asSum = asSum;
        if (variable != null && !variable.isTimeIndexed() && asSum) {
            throw new PowsyblException("Share '" + getLabelFull() + "': scalar variable '" + variable.getLabel() + "' cannot be summed up");
        }
    }

    private boolean isScalar() {
        return asSum
                || variable != null && !variable.isTimeIndexed()
                || variable == null && factor.length == 1;
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        share = isScalar() ? createVariable(systemModel, "share") : createTimeSeriesVariable(systemModel, "share");

        // share = variable * factor
        Equation equation = createEquation(systemModel, "share", EquationType.EQUALITY);
        equation.addTerm(share, -1);
        if (variable == null) {
            equation.addConstant(DoubleArrays.negate(asSum ? DoubleArrays.of(DoubleArrays.sum(factor)) : factor));
        } else if (asSum) {
            equation.addSumTerm(variable, factor);
        } else {
            equation.addTerm(variable, factor);
        }
    }

    public Variable getShare() {
        return share;
    }
}
