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
import com.powsybl.openflowopt.network.InvestParameters;
import com.powsybl.openflowopt.network.Segment;
import com.powsybl.openflowopt.util.DoubleArrays;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.powsybl.openflowopt.model.ModelAssert.createSystemModel;
import static com.powsybl.openflowopt.model.ModelAssert.isFeasible;
import static org.junit.jupiter.api.Assertions.*;

class InvestmentModelTest {

    private final TestElement storage = new TestElement("Storage");

    private Effect costs;

    private SystemModel systemModel;

    private Variable q;

    @BeforeEach
    void setUp() {
        costs = new Effect("costs", "EUR", "Costs");
        systemModel = createSystemModel(TimeHorizon.uniform(3, 1), new EffectCollection().add(costs));
        q = systemModel.getEquationSystem().createTimeSeriesVariable("q", "q", 3).setLowerBound(0);
    }

    private InvestmentModel<TestElement> createModel(InvestParameters parameters, double relativeMinimum, double[] profile, Variable on) {
        InvestmentModel<TestElement> model = new InvestmentModel<>(storage, InvestmentModel.DEFAULT_LABEL, parameters, q,
                Pair.of(DoubleArrays.of(relativeMinimum), DoubleArrays.of(1)), profile, on);
        model.doModeling(systemModel);
        return model;
    }

    @Test
    void testOptionalFixedSize() {
        InvestmentModel<TestElement> model = createModel(new InvestParameters().setFixedSize(10.0).setOptional(true), 0, null, null);
        Variable size = model.getSize();
        Variable isInvested = model.getIsInvested();
        assertEquals("Storage__Investment__size", size.getLabel());
        assertTrue(isInvested.isBinary());
        assertEquals(0, size.getLowerBound(0));
        assertEquals(10, size.getUpperBound(0));

        VariableValues values = new VariableValues()
                .set(q, 0, 0, 0)
                .set(size, 0)
                .set(isInvested, 0);
        assertTrue(isFeasible(model, values));

        values.set(q, 5, 10, 0).set(size, 10).set(isInvested, 1);
        assertTrue(isFeasible(model, values));

        // only 0 or the fixed size
        values.set(q, 0, 0, 0).set(size, 5);
        assertFalse(isFeasible(model, values));
        values.set(isInvested, 0.5);
        assertFalse(isFeasible(model, values));

        // flow above the size
        values.set(q, 11, 0, 0).set(size, 10).set(isInvested, 1);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testMandatoryFixedSize() {
        InvestmentModel<TestElement> model = createModel(new InvestParameters().setFixedSize(10.0).setOptional(false), 0, null, null);
        assertNull(model.getIsInvested());
        assertTrue(model.getSize().isFixed());
        assertArrayEquals(new double[] {10}, model.getSize().getFixedValue());
    }

    @Test
    void testOptionalSizeRange() {
        InvestmentModel<TestElement> model = createModel(new InvestParameters()
                .setMinimumSize(2)
                .setMaximumSize(50.0)
                .setOptional(true), 0, null, null);
        assertTrue(model.getEquations().containsKey("is_invested_ub"));
        assertTrue(model.getEquations().containsKey("is_invested_lb"));

        VariableValues values = new VariableValues()
                .set(q, 0, 0, 0)
                .set(model.getSize(), 0)
                .set(model.getIsInvested(), 0);
        assertTrue(isFeasible(model, values));

        values.set(model.getSize(), 30).set(model.getIsInvested(), 1);
        assertTrue(isFeasible(model, values));

        // invested below the minimum size
        values.set(model.getSize(), 1);
        assertFalse(isFeasible(model, values));

        // size without investment
        values.set(model.getSize(), 30).set(model.getIsInvested(), 0);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testRelativeMinimumWithOnVariable() {
        Variable on = systemModel.getEquationSystem().createTimeSeriesVariable("on", "on", 3).setBinary(true);
        InvestmentModel<TestElement> model = createModel(new InvestParameters().setMaximumSize(50.0).setOptional(false), 0.2, null, on);

        // off: the relative minimum does not apply
        VariableValues values = new VariableValues()
                .set(q, 0, 0, 0)
                .set(on, 0, 0, 0)
                .set(model.getSize(), 50);
        assertTrue(isFeasible(model, values));

        // on: at least 20% of the size
        values.set(q, 10, 10, 10).set(on, 1, 1, 1);
        assertTrue(isFeasible(model, values));
        values.set(q, 5, 10, 10);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testFixedRelativeProfile() {
        InvestmentModel<TestElement> model = createModel(new InvestParameters().setMaximumSize(50.0).setOptional(false), 0,
                new double[] {0.5, 1, 0}, null);
        assertTrue(model.getEquations().containsKey("fixed_q"));
        assertFalse(model.getEquations().containsKey("ub_q"));

        VariableValues values = new VariableValues()
                .set(q, 10, 20, 0)
                .set(model.getSize(), 20);
        assertTrue(isFeasible(model, values));
        values.set(q, 10, 10, 0);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testEffects() {
        createModel(new InvestParameters()
                .setMaximumSize(50.0)
                .setOptional(true)
                .setFixEffects(EffectValues.of(costs, 100))
                .setSpecificEffects(EffectValues.of(costs, 5))
                .setDivestEffects(EffectValues.of(costs, 20)), 0, null, null);
        var shares = costs.getModel().getInvest().getShares();
        assertEquals(List.of("Storage__fix_effects", "Storage__divest_effects", "Storage__divest_cancellation_effects",
                "Storage__specific_effects"), List.copyOf(shares.keySet()));
        assertTrue(costs.getModel().getOperation().getShares().isEmpty());
    }

    @Test
    void testDivestEffectsOfMandatoryInvestment() {
        createModel(new InvestParameters()
                .setMaximumSize(50.0)
                .setOptional(false)
                .setDivestEffects(EffectValues.of(costs, 20)), 0, null, null);
        assertTrue(costs.getModel().getInvest().getShares().isEmpty());
    }

    @Test
    void testEffectsInSegments() {
        InvestmentModel<TestElement> model = createModel(new InvestParameters()
                .setMaximumSize(20.0)
                .setOptional(true)
                .setEffectsInSegments(List.of(Segment.of(0, 10), Segment.of(10, 20)),
                        Map.of(costs, List.of(Segment.of(0, 100), Segment.of(100, 150)))), 0, null, null);
        SegmentedSharesModel<TestElement> segmentedShares = model.getSegmentedShares();
        assertNotNull(segmentedShares);
        assertEquals("Storage__Investment__SegmentedShares", segmentedShares.getLabelFull());
        assertSame(model.getIsInvested(), segmentedShares.getSegmentsModel().getOutsideSegments());
        assertTrue(costs.getModel().getInvest().getShares().containsKey("Storage__segmented_effects"));

        Variable costsShare = segmentedShares.getShares().get(costs);
        List<SegmentModel<TestElement>> segments = segmentedShares.getSegmentsModel().getSegmentModels();
        VariableValues values = new VariableValues()
                .set(q, 0, 0, 0)
                .set(model.getSize(), 15)
                .set(model.getIsInvested(), 1)
                .set(costsShare, 125)
                .set(segments.get(0).getInSegment(), 0)
                .set(segments.get(0).getLambda0(), 0)
                .set(segments.get(0).getLambda1(), 0)
                .set(segments.get(1).getInSegment(), 1)
                .set(segments.get(1).getLambda0(), 0.5)
                .set(segments.get(1).getLambda1(), 0.5);
        assertTrue(isFeasible(model, values));

        values.set(costsShare, 120);
        assertFalse(isFeasible(model, values));
    }

    @Test
    void testSegmentLengthMismatch() {
        InvestParameters parameters = new InvestParameters();
        List<Segment> sizeSegments = List.of(Segment.of(0, 10), Segment.of(10, 20));
        Map<Effect, List<Segment>> effectSegments = Map.of(costs, List.of(Segment.of(0, 100)));
        assertThrows(PowsyblException.class, () -> parameters.setEffectsInSegments(sizeSegments, effectSegments));
    }
}
