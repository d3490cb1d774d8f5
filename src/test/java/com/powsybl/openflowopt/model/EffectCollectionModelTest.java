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
import com.powsybl.openflowopt.equations.VariableValues;
import com.powsybl.openflowopt.network.Effect;
import com.powsybl.openflowopt.network.EffectCollection;
import com.powsybl.openflowopt.network.EffectValues;
import com.powsybl.openflowopt.network.TimeSeries;
import com.powsybl.openflowopt.util.DoubleArrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.powsybl.openflowopt.model.ModelAssert.createSystemModel;
import static com.powsybl.openflowopt.model.ModelAssert.isFeasible;
import static org.junit.jupiter.api.Assertions.*;

class EffectCollectionModelTest {

    private final TestElement source = new TestElement("Source");

    private Effect costs;

    private SystemModel systemModel;

    private EffectCollectionModel model;

    private Variable x;

    @BeforeEach
    void setUp() {
        costs = new Effect("costs", "EUR", "Costs")
                .setMaximumOperationPerHour(TimeSeries.of(100))
                .setMaximumTotal(1000.0);
        systemModel = createSystemModel(TimeHorizon.uniform(2, 1), new EffectCollection().add(costs));
        model = systemModel.getEffectCollectionModel();
        x = systemModel.getEquationSystem().createTimeSeriesVariable("x", "x", 2);
    }

    @Test
    void testEffectLedgers() {
        EffectModel effectModel = costs.getModel();
        assertEquals("costs", effectModel.getLabelFull());
        assertEquals("costs__operation__sum_TS", effectModel.getOperation().getSumTimeSeries().getLabel());
        assertNull(effectModel.getInvest().getSumTimeSeries());
        assertEquals(100, effectModel.getOperation().getSumTimeSeries().getUpperBound(0));
        assertEquals(1000, effectModel.getTotal().getSum().getUpperBound(0));

        model.addShareToOperation(systemModel, "fuel", source, EffectValues.of(costs, 2), DoubleArrays.of(1), x);
        model.addShareToInvest(systemModel, "fix", source, EffectValues.of(costs, 3), 1, null);
        Variable operationShare = effectModel.getOperation().getShares().get("Source__fuel");
        Variable investShare = effectModel.getInvest().getShares().get("Source__fix");

        // total = operation + invest
        VariableValues values = new VariableValues()
                .set(x, 1, 1.5)
                .set(operationShare, 2, 3)
                .set(effectModel.getOperation().getSumTimeSeries(), 2, 3)
                .set(effectModel.getOperation().getSum(), 5)
                .set(investShare, 3)
                .set(effectModel.getInvest().getSum(), 3)
                .set(effectModel.getTotal().getShares().get("operation"), 5)
                .set(effectModel.getTotal().getShares().get("invest"), 3)
                .set(effectModel.getTotal().getSum(), 8);
        assertTrue(isFeasible(effectModel, values));

        values.set(effectModel.getTotal().getSum(), 9);
        assertFalse(isFeasible(effectModel, values));
    }

    @Test
    void testPenalty() {
        model.addShareToPenalty(systemModel, "excess", x, DoubleArrays.of(10));
        Variable share = model.getPenalty().getShares().get("excess");
        assertFalse(share.isTimeIndexed());
        assertEquals("Effects__penalty__sum", model.getPenalty().getSum().getLabel());

        VariableValues values = new VariableValues()
                .set(x, 1, 2)
                .set(share, 30)
                .set(model.getPenalty().getSum(), 30);
        assertTrue(isFeasible(model.getPenalty(), values));
    }

    @Test
    void testUnknownEffect() {
        Effect co2 = new Effect("CO2", "kg", "CO2 emissions");
        EffectValues effectValues = EffectValues.of(co2, 1);
        double[] factor = DoubleArrays.of(1);
        PowsyblException e = assertThrows(PowsyblException.class,
            () -> model.addShareToOperation(systemModel, "fuel", source, effectValues, factor, x));
        assertEquals("Effect 'CO2' is not part of the flow system", e.getMessage());
    }

    @Test
    void testTimeSeriesInvestEffect() {
        EffectValues effectValues = EffectValues.of(costs, TimeSeries.of(1, 2));
        assertThrows(PowsyblException.class, () -> model.addShareToInvest(systemModel, "fix", source, effectValues, 1, null));
    }
}
