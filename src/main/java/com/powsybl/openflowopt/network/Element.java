/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

/**
 * An element of a flow system that contributes variables and equations to the model.
 */
public interface Element {

    String getLabel();

    /**
     * Label unique in the whole flow system, used as prefix of the model variable labels.
     */
    String getLabelFull();

    /**
     * Normalize raw input data. Called once, before any modeling.
     */
    void transformData(FlowSystem flowSystem);
}
