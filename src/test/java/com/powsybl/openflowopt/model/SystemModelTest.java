/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openflowopt.ModelingParameters;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.*;
import com.powsybl.openflowopt.util.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SystemModelTest {

    private FlowSystem flowSystem;

    private Flow demand;

    @BeforeEach
    void setUp() {
        Effect costs = new Effect("costs", "EUR", "Costs").setStandard(true).setObjective(true);
        Bus gas = new Bus("gas");
        Bus heat = new Bus("heat");
        Flow gasSupply = Flow.builder("Q_gas", gas)
                .setEffectsPerFlowHour(EffectValues.ofStandard(0.04))
                .build();
        Flow fuel = Flow.builder("Q_fu", gas).build();
        Flow thermal = Flow.builder("Q_th", heat).setSize(50).build();
        demand = Flow.builder("Q_th", heat)
                .setSize(1)
                .setFixedRelativeProfile(TimeSeries.of(30, 0, 20))
                .build();
        flowSystem = new FlowSystem()
                .addEffect(costs)
                .addComponents(new Component("GasGrid", List.of(), List.of(gasSupply)),
                               new LinearConverter("Boiler", List.of(fuel), List.of(thermal),
                                       List.of(Map.of(fuel, TimeSeries.of(0.9), thermal, TimeSeries.of(1)))),
                               new Component("Demand", List.of(demand), List.of()));
    }

    @Test
    void test() {
        ReportNode reportNode = Reports.createRootReportNode();
        SystemModel systemModel = flowSystem.createModel(TimeHorizon.uniform(3, 1), new ModelingParameters(), reportNode);
        assertTrue(flowSystem.isDataTransformed());
        assertEquals(3, systemModel.getComponentModels().size());
        assertEquals(2, systemModel.getBusModels().size());
        assertEquals(List.of("costs__total__sum", "Effects__penalty__sum"),
                systemModel.getObjectiveVariables().stream().map(Variable::getLabel).toList());

        List<String> keys = ModelAssert.getMessageKeys(reportNode);
        assertTrue(keys.contains(Reports.SYSTEM_MODEL_KEY));
        assertTrue(keys.contains("ofo.modelSize"));

        String model = systemModel.getEquationSystem().writeToString();
        assertTrue(model.contains("Boiler__conversion_0"));
        assertTrue(model.contains("Demand__Q_th__flow_rate"));

        assertThrows(PowsyblException.class, () -> systemModel.doModeling(flowSystem));
    }

    @Test
    void testWithoutObjectiveEffect() {
        SystemModel systemModel = new FlowSystem()
                .addComponent(new Component("Demand", List.of(Flow.builder("Q_th", new Bus("heat")).build()), List.of()))
                .createModel(TimeHorizon.uniform(1, 1));
        assertEquals(List.of("Effects__penalty__sum"),
                systemModel.getObjectiveVariables().stream().map(Variable::getLabel).toList());
    }

    @Test
    void testDataNotTransformed() {
        SystemModel systemModel = new SystemModel(TimeHorizon.uniform(3, 1));
        assertThrows(PowsyblException.class, systemModel::getEffectCollectionModel);
        assertThrows(PowsyblException.class, () -> systemModel.doModeling(flowSystem));
    }

    @Test
    void testRollingHorizon() {
        TimeHorizon firstHorizon = TimeHorizon.uniform(3, 1);
        flowSystem.createModel(firstHorizon);
        FlowModel firstModel = demand.getModel();
        assertNull(firstModel.getFlowRate().getPreviousValues());

        // last value of the first horizon seeds the next one
        demand.setPreviousFlowRate(new double[] {20});
        SystemModel secondModel = flowSystem.createModel(TimeHorizon.uniform(3, 1));
        assertNotSame(firstModel, demand.getModel());
        assertArrayEquals(new double[] {20}, demand.getModel().getFlowRate().getPreviousValues());
        assertSame(secondModel.getEquationSystem().getVariable("Demand__Q_th__flow_rate").orElseThrow(),
                demand.getModel().getFlowRate());

        // elements cannot be added once transformed
        Component late = new Component("Late", List.of(), List.of(Flow.builder("Q", new Bus("late")).build()));
        assertThrows(PowsyblException.class, () -> flowSystem.addComponent(late));
    }

    @Test
    void testMissingStandardEffect() {
        Flow supply = Flow.builder("Q", new Bus("heat"))
                .setEffectsPerFlowHour(EffectValues.ofStandard(1))
                .build();
        FlowSystem system = new FlowSystem().addComponent(new Component("Source", List.of(), List.of(supply)));
        TimeHorizon timeHorizon = TimeHorizon.uniform(1, 1);
        assertThrows(PowsyblException.class, () -> system.createModel(timeHorizon));
    }
}
