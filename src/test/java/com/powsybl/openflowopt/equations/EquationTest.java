/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.equations;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class EquationTest {

    private EquationSystem equationSystem;

    private Variable x;

    private Variable s;

    @BeforeEach
    void setUp() {
        equationSystem = new EquationSystem();
        x = equationSystem.createTimeSeriesVariable("x", "x", 3);
        s = equationSystem.createVariable("s", "s");
    }

    @Test
    void testBroadcast() {
        // x(t) - s <= 2
        Equation equation = equationSystem.createEquation("e", EquationType.INEQUALITY)
                .addTerm(x, 1)
                .addTerm(s, -1)
                .addConstant(2);
        assertEquals(3, equation.getLength());
        VariableValues values = new VariableValues().set(x, 1, 2, 3).set(s, 1);
        assertArrayEquals(new double[] {0, 1, 2}, equation.evalLhs(values));
        assertTrue(equation.isSatisfied(values, 1e-9));
        values.set(s, 0.5);
        assertFalse(equation.isSatisfied(values, 1e-9));
    }

    @Test
    void testPerRowCoefficientsAndConstants() {
        // 2 * x(t) = [2, 4, 6] + 1
        Equation equation = equationSystem.createEquation("e", EquationType.EQUALITY)
                .addTerm(x, new double[] {2, 2, 2})
                .addConstant(new double[] {2, 4, 6})
                .addConstant(1);
        assertArrayEquals(new double[] {3, 5, 7}, equation.getConstant());
        assertTrue(equation.isSatisfied(new VariableValues().set(x, 1.5, 2.5, 3.5), 1e-9));
    }

    @Test
    void testIndexSubsets() {
        // x(t) - x(t-1) <= 1 for t in 1..2
        Equation equation = equationSystem.createEquation("e", EquationType.INEQUALITY)
                .addTerm(x, 1, new int[] {1, 2})
                .addTerm(x, -1, new int[] {0, 1})
                .addConstant(1);
        assertEquals(2, equation.getLength());
        VariableValues values = new VariableValues().set(x, 0, 1, 2);
        assertArrayEquals(new double[] {1, 1}, equation.evalLhs(values));
        assertTrue(equation.isSatisfied(values, 1e-9));
        values.set(x, 0, 1, 3);
        assertFalse(equation.isSatisfied(values, 1e-9));

        Equation equation2 = equationSystem.createEquation("e2", EquationType.EQUALITY);
        int[] empty = {};
        assertThrows(PowsyblException.class, () -> equation2.addTerm(x, 1, empty));
        int[] outOfRange = {3};
        assertThrows(PowsyblException.class, () -> equation2.addTerm(x, 1, outOfRange));
    }

    @Test
    void testSumTerm() {
        // sum(x(t) * dt(t)) - s = 0
        Equation equation = equationSystem.createEquation("e", EquationType.EQUALITY)
                .addSumTerm(x, new double[] {1, 1, 2})
                .addTerm(s, -1);
        assertEquals(1, equation.getLength());
        assertTrue(equation.isSatisfied(new VariableValues().set(x, 1, 2, 3).set(s, 9), 1e-9));
        double[] wrongLength = {1, 2};
        assertThrows(PowsyblException.class, () -> equation.addSumTerm(x, wrongLength));
    }

    @Test
    void testIncompatibleLengths() {
        Equation equation = equationSystem.createEquation("e", EquationType.EQUALITY).addTerm(x, 1);
        double[] constant = {1, 2};
        assertThrows(PowsyblException.class, () -> equation.addConstant(constant));
    }

    @Test
    void testWrite() throws IOException {
        Equation equation = equationSystem.createEquation("e", EquationType.INEQUALITY)
                .addTerm(x, 1, new int[] {1, 2})
                .addSumTerm(x, 2)
                .addConstant(3);
        StringWriter writer = new StringWriter();
        equation.write(writer);
        assertEquals("e: 1.0 * x[1, 2] + 2.0 * sum(x) <= 3.0", writer.toString());
        assertEquals("Equation(label=e, type=INEQUALITY, length=2)", equation.toString());
    }
}
