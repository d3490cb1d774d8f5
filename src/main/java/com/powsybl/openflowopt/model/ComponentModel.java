/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Component;
import com.powsybl.openflowopt.network.Flow;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Models of the flows of a component, and the component level on/off state and mutual exclusivity of flows.
 */
public class ComponentModel extends AbstractElementModel<Component> {

    private final List<FlowModel> flowModels = new ArrayList<>();

    private OnOffModel<Component> onOff;

    private PreventSimultaneousUsageModel<Component> preventSimultaneousUsage;

    public ComponentModel(Component component) {
        super(component, null);
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        List<Flow> flows = element.getFlows();

        // component on/off and mutual exclusivity need an on variable per flow
        if (element.getOnOffParameters() != null) {
            flows.forEach(Flow::enableOnOff);
        }
        element.getPreventSimultaneousFlows().forEach(Flow::enableOnOff);

        for (Flow flow : flows) {
            FlowModel flowModel = addSubModel(new FlowModel(flow));
            flow.setModel(flowModel);
            flowModel.doModeling(systemModel);
            flowModels.add(flowModel);
        }

        if (element.getOnOffParameters() != null) {
            List<Variable> flowRates = new ArrayList<>(flows.size());
            List<Pair<double[], double[]>> bounds = new ArrayList<>(flows.size());
            for (FlowModel flowModel : flowModels) {
                flowRates.add(flowModel.getFlowRate());
                bounds.add(flowModel.getAbsoluteFlowRateBounds());
            }
            onOff = addSubModel(new OnOffModel<>(element, element.getOnOffParameters(), flowRates, bounds, OnOffModel.DEFAULT_LABEL));
            onOff.doModeling(systemModel);
        }

        if (!element.getPreventSimultaneousFlows().isEmpty()) {
            List<Variable> onVariables = element.getPreventSimultaneousFlows().stream()
                    .map(flow -> flow.getModel().getOn())
                    .toList();
            preventSimultaneousUsage = addSubModel(new PreventSimultaneousUsageModel<>(element,
                    PreventSimultaneousUsageModel.DEFAULT_LABEL, onVariables));
            preventSimultaneousUsage.doModeling(systemModel);
        }
    }

    public List<FlowModel> getFlowModels() {
        return Collections.unmodifiableList(flowModels);
    }

    /**
     * Null if the component has no on/off parameters.
     */
    public OnOffModel<Component> getOnOff() {
        return onOff;
    }

    public PreventSimultaneousUsageModel<Component> getPreventSimultaneousUsage() {
        return preventSimultaneousUsage;
    }
}
