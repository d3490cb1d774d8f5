/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EffectValuesTest {

    @Test
    void testResolveStandardValue() {
        Effect costs = new Effect("costs", "EUR", "Costs").setStandard(true);
        Effect co2 = new Effect("CO2", "kg", "CO2 emissions");
        EffectCollection effects = new EffectCollection(List.of(costs, co2));

        EffectValues values = EffectValues.ofStandard(20).with(co2, 0.3);
        assertFalse(values.isEmpty());
        assertFalse(values.isResolved());
        assertThrows(PowsyblException.class, values::getValues);

        EffectValues resolved = values.resolve(effects);
        assertTrue(resolved.isResolved());
        assertEquals(Map.of(costs, TimeSeries.of(20), co2, TimeSeries.of(0.3)), resolved.getValues());
        assertEquals(List.of(costs, co2), List.copyOf(resolved.getValues().keySet()));
        assertSame(resolved, resolved.resolve(effects));
    }

    @Test
    void testMissingStandardEffect() {
        EffectCollection effects = new EffectCollection(List.of(new Effect("costs", "EUR", "Costs")));
        EffectValues values = EffectValues.ofStandard(TimeSeries.of(1, 2));
        PowsyblException e = assertThrows(PowsyblException.class, () -> values.resolve(effects));
        assertEquals("A value is given for the standard effect but no standard effect is defined", e.getMessage());
    }

    @Test
    void testStandardValueGivenTwice() {
        Effect costs = new Effect("costs", "EUR", "Costs").setStandard(true);
        EffectCollection effects = new EffectCollection(List.of(costs));
        EffectValues values = EffectValues.ofStandard(1).with(costs, 2);
        PowsyblException e = assertThrows(PowsyblException.class, () -> values.resolve(effects));
        assertEquals("Value for effect 'costs' given twice", e.getMessage());
    }

    @Test
    void testEmpty() {
        assertTrue(EffectValues.empty().isEmpty());
        assertTrue(EffectValues.empty().getValues().isEmpty());
        Effect costs = new Effect("costs", "EUR", "Costs");
        EffectValues values = EffectValues.of(costs, 1);
        assertTrue(EffectValues.empty().isEmpty());
        assertEquals(Map.of(costs, TimeSeries.of(1)), values.getValues());
    }
}
