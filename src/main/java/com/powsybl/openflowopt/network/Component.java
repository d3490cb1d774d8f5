/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.model.ComponentModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A physical unit owning input and output flows. Input flows leave their bus and enter the component,
 * output flows leave the component and enter their bus.
 */
public class Component extends AbstractElement<ComponentModel> {

    private final List<Flow> inputs;

    private final List<Flow> outputs;

    private final OnOffParameters onOffParameters;

    private final List<Flow> preventSimultaneousFlows;

    public Component(String label, List<Flow> inputs, List<Flow> outputs) {
        this(label, inputs, outputs, null, Collections.emptyList());
    }

    /**
     * @param onOffParameters if not null, the component is on when any of its flows is on, every flow gets an on variable
     * @param preventSimultaneousFlows group of flows of which at most one can be on at a time
     */
    public Component(String label, List<Flow> inputs, List<Flow> outputs, OnOffParameters onOffParameters,
                     List<Flow> preventSimultaneousFlows) {
        this(label, inputs, outputs, onOffParameters, preventSimultaneousFlows, true);
    }

    /**
     * @param attachFlows if false, the subclass has to call {@link #attachFlows()} once its own checks passed
     */
    protected Component(String label, List<Flow> inputs, List<Flow> outputs, OnOffParameters onOffParameters,
                        List<Flow> preventSimultaneousFlows, boolean attachFlows) {
        super(label);
        this.inputs = List.copyOf(Objects.requireNonNull(inputs));
        this.outputs = List.copyOf(Objects.requireNonNull(outputs));
        this.onOffParameters = onOffParameters;
        this.preventSimultaneousFlows = List.copyOf(Objects.requireNonNull(preventSimultaneousFlows));
        for (Flow flow : this.preventSimultaneousFlows) {
            if (!this.inputs.contains(flow) && !this.outputs.contains(flow)) {
                throw new PowsyblException("Component '" + label + "': flow '" + flow.getLabel()
                        + "' of the simultaneous usage group is not a flow of the component");
            }
        }
        List<Flow> flows = getFlows();
        for (Flow flow : flows) {
            if (flows.stream().filter(f -> f.getLabel().equals(flow.getLabel())).count() > 1) {
                throw new PowsyblException("Component '" + label + "': flow label '" + flow.getLabel() + "' is not unique");
            }
        }
        if (attachFlows) {
            attachFlows();
        }
    }

    /**
     * Attach the flows to this component, none of them is attached if one already belongs to another component.
     */
    protected final void attachFlows() {
        List<Flow> flows = getFlows();
        for (Flow flow : flows) {
            if (flow.getComponent() != null && flow.getComponent() != this) {
                throw new PowsyblException("Flow '" + flow.getLabel() + "' already belongs to component '"
                        + flow.getComponent().getLabel() + "'");
            }
        }
        flows.forEach(flow -> flow.setComponent(this));
    }

    public List<Flow> getInputs() {
        return inputs;
    }

    public List<Flow> getOutputs() {
        return outputs;
    }

    /**
     * Inputs then outputs.
     */
    public List<Flow> getFlows() {
        List<Flow> flows = new ArrayList<>(inputs.size() + outputs.size());
        flows.addAll(inputs);
        flows.addAll(outputs);
        return flows;
    }

    public OnOffParameters getOnOffParameters() {
        return onOffParameters;
    }

    public List<Flow> getPreventSimultaneousFlows() {
        return preventSimultaneousFlows;
    }

    /**
     * Register the input flows as outputs of their bus and the output flows as inputs of their bus.
     */
    void connectFlowsToBuses() {
        for (Flow flow : inputs) {
            flow.getBus().addOutput(flow);
        }
        for (Flow flow : outputs) {
            flow.getBus().addInput(flow);
        }
    }

    public ComponentModel createModel() {
        ComponentModel componentModel = new ComponentModel(this);
        setModel(componentModel);
        return componentModel;
    }

    @Override
    public void transformData(FlowSystem flowSystem) {
        if (onOffParameters != null) {
            onOffParameters.transformData(flowSystem.getEffects());
        }
        for (Flow flow : getFlows()) {
            flow.transformData(flowSystem);
        }
    }
}
