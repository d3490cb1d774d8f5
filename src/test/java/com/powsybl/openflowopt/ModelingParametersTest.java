/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;

import static org.junit.jupiter.api.Assertions.*;

class ModelingParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultParameters() {
        ModelingParameters parameters = ModelingParameters.load(platformConfig);
        assertEquals(1e-5, parameters.getEpsilon());
        assertEquals(1e7, parameters.getBig());
        assertEquals(1e5, parameters.getBigBinaryBound());
        assertEquals(0.1, parameters.getBinarySlack());
    }

    @Test
    void testConfiguredParameters() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig("open-flowopt-default-parameters");
        moduleConfig.setStringProperty("epsilon", "1e-6");
        moduleConfig.setStringProperty("big", "1000");
        ModelingParameters parameters = ModelingParameters.load(platformConfig);
        assertEquals(1e-6, parameters.getEpsilon());
        assertEquals(1000, parameters.getBig());
        assertEquals(1e5, parameters.getBigBinaryBound());
        assertEquals(0.1, parameters.getBinarySlack());
    }

    @Test
    void testInvalidConfiguredParameters() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig("open-flowopt-default-parameters");
        moduleConfig.setStringProperty("binarySlack", "1.5");
        PowsyblException e = assertThrows(PowsyblException.class, () -> ModelingParameters.load(platformConfig));
        assertEquals("Invalid binarySlack value: 1.5", e.getMessage());
    }

    @Test
    void testSetters() {
        ModelingParameters parameters = new ModelingParameters()
                .setEpsilon(1e-4)
                .setBig(500)
                .setBigBinaryBound(100)
                .setBinarySlack(0);
        assertEquals("ModelingParameters(epsilon=1.0E-4, big=500.0, bigBinaryBound=100.0, binarySlack=0.0)", parameters.toString());
        assertThrows(PowsyblException.class, () -> parameters.setEpsilon(0));
        assertThrows(PowsyblException.class, () -> parameters.setBig(-1));
        assertThrows(PowsyblException.class, () -> parameters.setBigBinaryBound(Double.NaN));
        assertThrows(PowsyblException.class, () -> parameters.setBinarySlack(-0.1));
    }
}
