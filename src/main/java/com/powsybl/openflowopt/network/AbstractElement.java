/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * @param <M> type of the model built for this element
 */
public abstract class AbstractElement<M> implements Element {

    protected final String label;

    /**
     * Model of the current horizon, a lookup reference only, the model is owned by its parent model.
     */
    protected M model;

    protected AbstractElement(String label) {
        this.label = Objects.requireNonNull(label);
        if (label.isEmpty() || label.contains("__")) {
            throw new PowsyblException("Invalid element label '" + label + "'");
        }
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public String getLabelFull() {
        return label;
    }

    public M getModel() {
        if (model == null) {
            throw new PowsyblException("Element '" + getLabelFull() + "' has not been modeled yet");
        }
        return model;
    }

    public boolean hasModel() {
        return model != null;
    }

    public void setModel(M model) {
        this.model = Objects.requireNonNull(model);
    }

    @Override
    public void transformData(FlowSystem flowSystem) {
        // nothing by default
    }

    @Override
    public String toString() {
        return getLabelFull();
    }
}
