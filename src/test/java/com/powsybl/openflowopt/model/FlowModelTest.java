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
import com.powsybl.openflowopt.network.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.openflowopt.model.ModelAssert.isFeasible;
import static org.junit.jupiter.api.Assertions.*;

class FlowModelTest {

    private Bus heat;

    private FlowSystem flowSystem;

    @BeforeEach
    void setUp() {
        heat = new Bus("heat");
        flowSystem = new FlowSystem();
    }

    private FlowModel createModel(Flow flow, int nrOfTimeSteps) {
        flowSystem.addComponent(new Component("Boiler", List.of(), List.of(flow)));
        flowSystem.createModel(TimeHorizon.uniform(nrOfTimeSteps, 1));
        return flow.getModel();
    }

    @Test
    void testFixedSize() {
        Flow q = Flow.builder("Q", heat)
                .setSize(100)
                .setRelativeMinimum(TimeSeries.of(0.2))
                .build();
        assertEquals("unknownComp__Q", q.getLabelFull());
        FlowModel model = createModel(q, 3);
        assertEquals("Boiler__Q", q.getLabelFull());
        Variable flowRate = model.getFlowRate();
        assertEquals("Boiler__Q__flow_rate", flowRate.getLabel());
        assertEquals("Boiler__Q__sumFlowHours", model.getSumFlowHours().getLabel());
        assertEquals(20, flowRate.getLowerBound(1));
        assertEquals(100, flowRate.getUpperBound(1));
        assertNull(model.getOnOff());
        assertNull(model.getInvestment());
        assertThrows(PowsyblException.class, model::getOn);

        VariableValues values = new VariableValues()
                .set(flowRate, 20, 50, 100)
                .set(model.getSumFlowHours(), 170);
        assertTrue(isFeasible(model, values));

        values.set(flowRate, 10, 50, 100).set(model.getSumFlowHours(), 160);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testDefaultSize() {
        FlowModel model = createModel(Flow.builder("Q", heat).build(), 1);
        assertEquals(0, model.getFlowRate().getLowerBound(0));
        assertEquals(1e7, model.getFlowRate().getUpperBound(0));
    }

    @Test
    void testFixedRelativeProfile() {
        FlowModel model = createModel(Flow.builder("Q", heat)
                .setSize(10)
                .setFixedRelativeProfile(TimeSeries.of(0.5, 1, 0))
                .build(), 3);
        Variable flowRate = model.getFlowRate();
        for (int t = 0; t < 3; t++) {
            assertEquals(flowRate.getLowerBound(t), flowRate.getUpperBound(t));
        }
        assertEquals(5, flowRate.getUpperBound(0));
        assertEquals(10, flowRate.getUpperBound(1));
        assertEquals(0, flowRate.getUpperBound(2));
    }

    @Test
    void testOnOff() {
        FlowModel model = createModel(Flow.builder("Q", heat)
                .setSize(100)
                .setRelativeMinimum(TimeSeries.of(0.3))
                .setOnOffParameters(new OnOffParameters())
                .build(), 2);
        assertEquals(0, model.getFlowRate().getLowerBound(0));
        assertEquals(Double.POSITIVE_INFINITY, model.getFlowRate().getUpperBound(0));
        assertEquals("Boiler__Q__OnOff__on", model.getOn().getLabel());
        assertArrayEquals(new double[] {30, 30}, model.getAbsoluteFlowRateBounds().getLeft());

        // either off or between the relative minimum and the size
        VariableValues values = new VariableValues()
                .set(model.getFlowRate(), 0, 50)
                .set(model.getSumFlowHours(), 50)
                .set(model.getOn(), 0, 1)
                .set(model.getOnOff().getTotalOnHours(), 1);
        assertTrue(isFeasible(model, values));

        values.set(model.getFlowRate(), 0, 20).set(model.getSumFlowHours(), 20);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testOptionalInvestment() {
        FlowModel model = createModel(Flow.builder("Q", heat)
                .setInvestParameters(new InvestParameters().setMinimumSize(10).setMaximumSize(50.0))
                .setRelativeMinimum(TimeSeries.of(0.5))
                .build(), 2);
        InvestmentModel<Flow> investment = model.getInvestment();
        assertNotNull(investment);
        assertEquals("Boiler__Q__Investment__size", investment.getSize().getLabel());

        // not investing must be possible
        assertEquals(0, model.getFlowRate().getLowerBound(0));
        assertEquals(50, model.getFlowRate().getUpperBound(0));
    }

    @Test
    void testLoadFactorMax() {
        FlowModel model = createModel(Flow.builder("Q", heat)
                .setSize(100)
                .setLoadFactorMax(0.5)
                .build(), 4);
        assertEquals(200, model.getEquation("load_factor_max").getRhs(0));

        VariableValues values = new VariableValues()
                .set(model.getFlowRate(), 50, 50, 50, 50)
                .set(model.getSumFlowHours(), 200);
        assertTrue(isFeasible(model, values));

        values.set(model.getFlowRate(), 60, 50, 50, 50).set(model.getSumFlowHours(), 210);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testLoadFactorMinWithInvestment() {
        FlowModel model = createModel(Flow.builder("Q", heat)
                .setInvestParameters(new InvestParameters().setMaximumSize(50.0).setOptional(false))
                .setLoadFactorMin(0.25)
                .build(), 4);
        Variable size = model.getInvestment().getSize();

        VariableValues values = new VariableValues()
                .set(model.getFlowRate(), 10, 10, 10, 10)
                .set(model.getSumFlowHours(), 40)
                .set(size, 40);
        assertTrue(isFeasible(model, values));

        values.set(model.getFlowRate(), 5, 5, 5, 5).set(model.getSumFlowHours(), 20);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testFlowHoursBounds() {
        FlowModel model = createModel(Flow.builder("Q", heat)
                .setSize(10)
                .setFlowHoursTotalMin(5.0)
                .setFlowHoursTotalMax(15.0)
                .build(), 2);
        assertEquals(5, model.getSumFlowHours().getLowerBound(0));
        assertEquals(15, model.getSumFlowHours().getUpperBound(0));
    }

    @Test
    void testEffectsPerFlowHour() {
        Effect costs = new Effect("costs", "EUR", "Costs").setStandard(true);
        Effect co2 = new Effect("CO2", "kg", "CO2 emissions");
        flowSystem.addEffect(costs).addEffect(co2);
        Flow q = Flow.builder("Q", heat)
                .setSize(10)
                .setEffectsPerFlowHour(EffectValues.ofStandard(2).with(co2, 0.2))
                .build();
        createModel(q, 2);
        assertTrue(q.getEffectsPerFlowHour().isResolved());
        assertTrue(costs.getModel().getOperation().getShares().containsKey("Boiler__Q__effects_per_flow_hour"));
        assertTrue(co2.getModel().getOperation().getShares().containsKey("Boiler__Q__effects_per_flow_hour"));
    }

    @Test
    void testPreviousFlowRate() {
        FlowModel model = createModel(Flow.builder("Q", heat).setSize(10).setPreviousFlowRate(5).build(), 2);
        assertArrayEquals(new double[] {5}, model.getFlowRate().getPreviousValues());
    }

    @Test
    void testEmptyPreviousFlowRate() {
        Flow.Builder builder = Flow.builder("Q", heat)
                .setSize(10)
                .setOnOffParameters(new OnOffParameters().setForceSwitchOn(true));
        PowsyblException e = assertThrows(PowsyblException.class, () -> builder.setPreviousFlowRate());
        assertEquals("Flow 'Q': previous flow rate is empty, use null if unknown", e.getMessage());

        double[] previousFlowRate = {0, 4};
        Flow q = builder.setPreviousFlowRate(previousFlowRate).build();
        previousFlowRate[1] = 0;
        q.getPreviousFlowRate()[0] = 7;
        assertArrayEquals(new double[] {0, 4}, q.getPreviousFlowRate());
        double[] empty = new double[0];
        assertThrows(PowsyblException.class, () -> q.setPreviousFlowRate(empty));

        FlowModel model = createModel(q, 3);
        assertArrayEquals(new double[] {0, 4}, model.getFlowRate().getPreviousValues());
        assertNotNull(model.getOnOff().getSwitchOn());
    }

    @Test
    void testInvalidFlows() {
        Flow.Builder inverted = Flow.builder("Q", heat)
                .setRelativeMinimum(TimeSeries.of(0.8))
                .setRelativeMaximum(TimeSeries.of(0.5));
        assertThrows(PowsyblException.class, inverted::build);

        Flow.Builder invertedOnce = Flow.builder("Q", heat)
                .setRelativeMinimum(TimeSeries.of(0.2, 0.8))
                .setRelativeMaximum(TimeSeries.of(1, 0.5));
        assertThrows(PowsyblException.class, invertedOnce::build);

        Flow.Builder sizeAndInvestment = Flow.builder("Q", heat)
                .setSize(10)
                .setInvestParameters(new InvestParameters());
        assertThrows(PowsyblException.class, sizeAndInvestment::build);

        Flow.Builder negativeSize = Flow.builder("Q", heat).setSize(-1);
        assertThrows(PowsyblException.class, negativeSize::build);

        Flow unattached = Flow.builder("Q", heat).build();
        assertThrows(PowsyblException.class, unattached::isInputInComponent);
    }
}
