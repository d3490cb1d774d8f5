/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.openflowopt.network.Effect;
import com.powsybl.openflowopt.util.DoubleArrays;

/**
 * Ledgers of one effect: operation shares per time step, invest shares and their total.
 */
public class EffectModel extends AbstractElementModel<Effect> {

    private ShareAllocationModel<Effect> operation;

    private ShareAllocationModel<Effect> invest;

    private ShareAllocationModel<Effect> total;

    public EffectModel(Effect effect) {
        super(effect, null);
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        operation = addSubModel(new ShareAllocationModel<>(element, "operation", true,
                element.getMinimumOperation(), element.getMaximumOperation(),
                element.getMinimumOperationPerHour(), element.getMaximumOperationPerHour()));
        invest = addSubModel(new ShareAllocationModel<>(element, "invest", false,
                element.getMinimumInvest(), element.getMaximumInvest(), null, null));
        total = addSubModel(new ShareAllocationModel<>(element, "total", false,
                element.getMinimumTotal(), element.getMaximumTotal(), null, null));
        operation.doModeling(systemModel);
        invest.doModeling(systemModel);
        total.doModeling(systemModel);

        total.addShare(systemModel, "operation", operation.getSum(), DoubleArrays.of(1), false);
        total.addShare(systemModel, "invest", invest.getSum(), DoubleArrays.of(1), false);
    }

    public ShareAllocationModel<Effect> getOperation() {
        return operation;
    }

    public ShareAllocationModel<Effect> getInvest() {
        return invest;
    }

    public ShareAllocationModel<Effect> getTotal() {
        return total;
    }
}
