/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.*;
import com.powsybl.openflowopt.util.DoubleArrays;

import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the element models to the effect ledgers. Shares are registered under the full label of
 * the element they come from.
 */
public class EffectCollectionModel extends AbstractElementModel<EffectCollection> {

    private ShareAllocationModel<EffectCollection> penalty;

    public EffectCollectionModel(EffectCollection effects) {
        super(effects, null);
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        for (Effect effect : element.getEffects()) {
            EffectModel effectModel = addSubModel(new EffectModel(effect));
            effect.setModel(effectModel);
            effectModel.doModeling(systemModel);
        }
        penalty = addSubModel(new ShareAllocationModel<>(element, "penalty", false));
        penalty.doModeling(systemModel);
    }

    private EffectModel getEffectModel(Effect effect) {
        if (!element.contains(effect)) {
            throw new PowsyblException("Effect '" + effect.getLabel() + "' is not part of the flow system");
        }
        return effect.getModel();
    }

    /**
     * Add to the operation ledger of each effect the share variable times factor times effect value.
     */
    public void addShareToOperation(SystemModel systemModel, String name, Element source, EffectValues effectValues,
                                    double[] factor, Variable variable) {
        Objects.requireNonNull(source);
        Objects.requireNonNull(factor);
        int n = systemModel.getNrOfTimeSteps();
        for (Map.Entry<Effect, TimeSeries> e : effectValues.getValues().entrySet()) {
            TimeSeries value = e.getValue();
            double[] values = value.isScalar() ? DoubleArrays.of(value.get(0)) : value.toArray(n);
            getEffectModel(e.getKey()).getOperation()
                    .addShare(systemModel, source.getLabelFull() + "__" + name, variable, DoubleArrays.multiply(values, factor), false);
        }
    }

    /**
     * Add to the invest ledger of each effect the share variable times factor times effect value.
     */
    public void addShareToInvest(SystemModel systemModel, String name, Element source, EffectValues effectValues,
                                 double factor, Variable variable) {
        Objects.requireNonNull(source);
        for (Map.Entry<Effect, TimeSeries> e : effectValues.getValues().entrySet()) {
            TimeSeries value = e.getValue();
            if (!value.isScalar()) {
                throw new PowsyblException("Invest share '" + name + "' of '" + source.getLabelFull() + "' must be a scalar for effect '"
                        + e.getKey().getLabel() + "'");
            }
            getEffectModel(e.getKey()).getInvest()
                    .addShare(systemModel, source.getLabelFull() + "__" + name, variable, DoubleArrays.of(value.get(0) * factor), false);
        }
    }

    /**
     * Add a share to the penalty ledger, time series variables are summed over time.
     */
    public void addShareToPenalty(SystemModel systemModel, String name, Variable variable, double[] factor) {
        boolean asSum = variable != null && variable.isTimeIndexed();
        penalty.addShare(systemModel, name, variable, factor, asSum);
    }

    public ShareAllocationModel<EffectCollection> getPenalty() {
        return penalty;
    }
}
