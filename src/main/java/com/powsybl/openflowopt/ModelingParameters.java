/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt;

import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.config.PlatformConfig;

/**
 * Numeric tolerances and default big values used while building a model.
 */
public class ModelingParameters {

    public static final String MODULE_NAME = "open-flowopt-default-parameters";

    public static final String EPSILON_PARAM_NAME = "epsilon";
    public static final String BIG_PARAM_NAME = "big";
    public static final String BIG_BINARY_BOUND_PARAM_NAME = "bigBinaryBound";
    public static final String BINARY_SLACK_PARAM_NAME = "binarySlack";

    public static final double EPSILON_DEFAULT_VALUE = 1e-5;
    public static final double BIG_DEFAULT_VALUE = 1e7;
    public static final double BIG_BINARY_BOUND_DEFAULT_VALUE = 1e5;
    public static final double BINARY_SLACK_DEFAULT_VALUE = 0.1;

    private double epsilon = EPSILON_DEFAULT_VALUE;

    private double big = BIG_DEFAULT_VALUE;

    private double bigBinaryBound = BIG_BINARY_BOUND_DEFAULT_VALUE;

    private double binarySlack = BINARY_SLACK_DEFAULT_VALUE;

    private static double checkPositive(double value, String name) {
        if (value <= 0 || Double.isNaN(value)) {
            throw new PowsyblException("Invalid " + name + " value: " + value);
        }
        return value;
    }

    /**
     * Tolerance under which a value is considered zero.
     */
    public double getEpsilon() {
        return epsilon;
    }

    public ModelingParameters setEpsilon(double epsilon) {
        this.epsilon = checkPositive(epsilon, EPSILON_PARAM_NAME);
        return this;
    }

    /**
     * Size of flows having no size assigned and maximum size of investments without upper bound.
     */
    public double getBig() {
        return big;
    }

    public ModelingParameters setBig(double big) {
        this.big = checkPositive(big, BIG_PARAM_NAME);
        return this;
    }

    /**
     * Upper bound of a variable coupled to a binary above which a warning is reported.
     */
    public double getBigBinaryBound() {
        return bigBinaryBound;
    }

    public ModelingParameters setBigBinaryBound(double bigBinaryBound) {
        this.bigBinaryBound = checkPositive(bigBinaryBound, BIG_BINARY_BOUND_PARAM_NAME);
        return this;
    }

    public double getBinarySlack() {
        return binarySlack;
    }

    public ModelingParameters setBinarySlack(double binarySlack) {
        if (binarySlack < 0 || binarySlack >= 1) {
            throw new PowsyblException("Invalid " + BINARY_SLACK_PARAM_NAME + " value: " + binarySlack);
        }
        this.binarySlack = binarySlack;
        return this;
    }

    public static ModelingParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static ModelingParameters load(PlatformConfig platformConfig) {
        ModelingParameters parameters = new ModelingParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setEpsilon(config.getDoubleProperty(EPSILON_PARAM_NAME, EPSILON_DEFAULT_VALUE))
                .setBig(config.getDoubleProperty(BIG_PARAM_NAME, BIG_DEFAULT_VALUE))
                .setBigBinaryBound(config.getDoubleProperty(BIG_BINARY_BOUND_PARAM_NAME, BIG_BINARY_BOUND_DEFAULT_VALUE))
                .setBinarySlack(config.getDoubleProperty(BINARY_SLACK_PARAM_NAME, BINARY_SLACK_DEFAULT_VALUE)));
        return parameters;
    }

    @Override
    public String toString() {
        return "ModelingParameters(" +
                "epsilon=" + epsilon +
                ", big=" + big +
                ", bigBinaryBound=" + bigBinaryBound +
                ", binarySlack=" + binarySlack +
                ')';
    }
}
