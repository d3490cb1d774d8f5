/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openflowopt.ModelingParameters;
import com.powsybl.openflowopt.model.SystemModel;
import com.powsybl.openflowopt.model.TimeHorizon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Container of the whole energy system: components with their flows, buses and effects.
 */
public class FlowSystem {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlowSystem.class);

    private final EffectCollection effects = new EffectCollection();

    private final Map<String, Component> components = new LinkedHashMap<>();

    private final Map<String, Bus> buses = new LinkedHashMap<>();

    private boolean dataTransformed = false;

    public FlowSystem addEffect(Effect effect) {
        checkNotTransformed();
        effects.add(effect);
        return this;
    }

    public FlowSystem addBus(Bus bus) {
        Objects.requireNonNull(bus);
        checkNotTransformed();
        if (buses.containsKey(bus.getLabel())) {
            throw new PowsyblException("Bus '" + bus.getLabel() + "' already added");
        }
        checkLabelUniqueness(bus);
        buses.put(bus.getLabel(), bus);
        return this;
    }

    /**
     * Add a component and connect its flows: buses of the flows not yet added are added too.
     */
    public FlowSystem addComponent(Component component) {
        Objects.requireNonNull(component);
        checkNotTransformed();
        if (components.containsKey(component.getLabel())) {
            throw new PowsyblException("Component '" + component.getLabel() + "' already added");
        }
        checkLabelUniqueness(component);
        for (Flow flow : component.getFlows()) {
            Bus bus = buses.get(flow.getBus().getLabel());
            if (bus == null) {
                addBus(flow.getBus());
            } else if (bus != flow.getBus()) {
                throw new PowsyblException("Flow '" + flow.getLabelFull() + "' is connected to an unknown bus with label '"
                        + bus.getLabel() + "'");
            }
        }
        component.connectFlowsToBuses();
        components.put(component.getLabel(), component);
        return this;
    }

    public FlowSystem addComponents(Component... components) {
        for (Component component : components) {
            addComponent(component);
        }
        return this;
    }

    private void checkLabelUniqueness(Element element) {
        if (components.containsKey(element.getLabel()) || buses.containsKey(element.getLabel())
                || EffectCollection.LABEL.equals(element.getLabel())) {
            throw new PowsyblException("Label '" + element.getLabel() + "' is already used in the flow system");
        }
    }

    private void checkNotTransformed() {
        if (dataTransformed) {
            throw new PowsyblException("Flow system data has already been transformed, elements cannot be added anymore");
        }
    }

    public EffectCollection getEffects() {
        return effects;
    }

    public Collection<Component> getComponents() {
        return Collections.unmodifiableCollection(components.values());
    }

    public Optional<Component> getComponent(String label) {
        return Optional.ofNullable(components.get(label));
    }

    public Collection<Bus> getBuses() {
        return Collections.unmodifiableCollection(buses.values());
    }

    public Optional<Bus> getBus(String label) {
        return Optional.ofNullable(buses.get(label));
    }

    public List<Flow> getFlows() {
        return components.values().stream().flatMap(c -> c.getFlows().stream()).toList();
    }

    public boolean isDataTransformed() {
        return dataTransformed;
    }

    /**
     * Normalize raw element data, only the first call has an effect.
     */
    public void transformData() {
        if (dataTransformed) {
            return;
        }
        for (Effect effect : effects.getEffects()) {
            effect.transformData(this);
        }
        for (Component component : components.values()) {
            component.transformData(this);
        }
        for (Bus bus : buses.values()) {
            bus.transformData(this);
        }
        dataTransformed = true;
        LOGGER.debug("Flow system data transformed: {} components, {} buses, {} effects",
                components.size(), buses.size(), effects.getEffects().size());
    }

    /**
     * Build a fresh model of the flow system for the given horizon.
     */
    public SystemModel createModel(TimeHorizon timeHorizon, ModelingParameters parameters, ReportNode reportNode) {
        transformData();
        SystemModel systemModel = new SystemModel(timeHorizon, parameters, reportNode);
        systemModel.doModeling(this);
        return systemModel;
    }

    public SystemModel createModel(TimeHorizon timeHorizon) {
        return createModel(timeHorizon, new ModelingParameters(), ReportNode.NO_OP);
    }
}
