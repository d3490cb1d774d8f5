/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.openflowopt.model.EffectModel;

import java.util.Objects;

/**
 * A quantity accumulated over the flow system, like costs or CO2 emissions. Shares of operation
 * (per time step) and of investment (one time) are registered against it.
 */
public class Effect extends AbstractElement<EffectModel> {

    private final String unit;

    private final String description;

    private boolean standard = false;

    private boolean objective = false;

    private Double minimumOperation;

    private Double maximumOperation;

    private TimeSeries minimumOperationPerHour;

    private TimeSeries maximumOperationPerHour;

    private Double minimumInvest;

    private Double maximumInvest;

    private Double minimumTotal;

    private Double maximumTotal;

    public Effect(String label, String unit, String description) {
        super(label);
        this.unit = Objects.requireNonNull(unit);
        this.description = Objects.requireNonNull(description);
    }

    public String getUnit() {
        return unit;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Effect values given without explicit effect are allocated to the standard effect.
     */
    public boolean isStandard() {
        return standard;
    }

    public Effect setStandard(boolean standard) {
        this.standard = standard;
        return this;
    }

    public boolean isObjective() {
        return objective;
    }

    public Effect setObjective(boolean objective) {
        this.objective = objective;
        return this;
    }

    public Double getMinimumOperation() {
        return minimumOperation;
    }

    public Effect setMinimumOperation(Double minimumOperation) {
        this.minimumOperation = minimumOperation;
        return this;
    }

    public Double getMaximumOperation() {
        return maximumOperation;
    }

    public Effect setMaximumOperation(Double maximumOperation) {
        this.maximumOperation = maximumOperation;
        return this;
    }

    public TimeSeries getMinimumOperationPerHour() {
        return minimumOperationPerHour;
    }

    public Effect setMinimumOperationPerHour(TimeSeries minimumOperationPerHour) {
        this.minimumOperationPerHour = minimumOperationPerHour;
        return this;
    }

    public TimeSeries getMaximumOperationPerHour() {
        return maximumOperationPerHour;
    }

    public Effect setMaximumOperationPerHour(TimeSeries maximumOperationPerHour) {
        this.maximumOperationPerHour = maximumOperationPerHour;
        return this;
    }

    public Double getMinimumInvest() {
        return minimumInvest;
    }

    public Effect setMinimumInvest(Double minimumInvest) {
        this.minimumInvest = minimumInvest;
        return this;
    }

    public Double getMaximumInvest() {
        return maximumInvest;
    }

    public Effect setMaximumInvest(Double maximumInvest) {
        this.maximumInvest = maximumInvest;
        return this;
    }

    public Double getMinimumTotal() {
        return minimumTotal;
    }

    public Effect setMinimumTotal(Double minimumTotal) {
        this.minimumTotal = minimumTotal;
        return this;
    }

    public Double getMaximumTotal() {
        return maximumTotal;
    }

    public Effect setMaximumTotal(Double maximumTotal) {
        this.maximumTotal = maximumTotal;
        return this;
    }
}
