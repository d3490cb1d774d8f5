/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.model.FlowModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A directed flow between a bus and a component. Its rate is bounded by its size times relative
 * bounds, the size being either fixed or an investment decision.
 */
public final class Flow extends AbstractElement<FlowModel> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Flow.class);

    private final Bus bus;

    private final Double size;

    private final InvestParameters investParameters;

    private final TimeSeries relativeMinimum;

    private final TimeSeries relativeMaximum;

    private final TimeSeries fixedRelativeProfile;

    private EffectValues effectsPerFlowHour;

    private OnOffParameters onOffParameters;

    private final Double flowHoursTotalMin;

    private final Double flowHoursTotalMax;

    private final Double loadFactorMin;

    private final Double loadFactorMax;

    private double[] previousFlowRate;

    private Component component;

    public static final class Builder {

        private final String label;

        private final Bus bus;

        private Double size;

        private InvestParameters investParameters;

        private TimeSeries relativeMinimum = TimeSeries.of(0);

        private TimeSeries relativeMaximum = TimeSeries.of(1);

        private TimeSeries fixedRelativeProfile;

        private EffectValues effectsPerFlowHour = EffectValues.empty();

        private OnOffParameters onOffParameters;

        private Double flowHoursTotalMin;

        private Double flowHoursTotalMax;

        private Double loadFactorMin;

        private Double loadFactorMax;

        private double[] previousFlowRate;

        private Builder(String label, Bus bus) {
            this.label = Objects.requireNonNull(label);
            this.bus = Objects.requireNonNull(bus);
        }

        public Builder setSize(double size) {
            this.size = size;
            return this;
        }

        public Builder setInvestParameters(InvestParameters investParameters) {
            this.investParameters = investParameters;
            return this;
        }

        public Builder setRelativeMinimum(TimeSeries relativeMinimum) {
            this.relativeMinimum = Objects.requireNonNull(relativeMinimum);
            return this;
        }

        public Builder setRelativeMaximum(TimeSeries relativeMaximum) {
            this.relativeMaximum = Objects.requireNonNull(relativeMaximum);
            return this;
        }

        public Builder setFixedRelativeProfile(TimeSeries fixedRelativeProfile) {
            this.fixedRelativeProfile = fixedRelativeProfile;
            return this;
        }

        public Builder setEffectsPerFlowHour(EffectValues effectsPerFlowHour) {
            this.effectsPerFlowHour = Objects.requireNonNull(effectsPerFlowHour);
            return this;
        }

        public Builder setOnOffParameters(OnOffParameters onOffParameters) {
            this.onOffParameters = onOffParameters;
            return this;
        }

        public Builder setFlowHoursTotalMin(Double flowHoursTotalMin) {
            this.flowHoursTotalMin = flowHoursTotalMin;
            return this;
        }

        public Builder setFlowHoursTotalMax(Double flowHoursTotalMax) {
            this.flowHoursTotalMax = flowHoursTotalMax;
            return this;
        }

        public Builder setLoadFactorMin(Double loadFactorMin) {
            this.loadFactorMin = loadFactorMin;
            return this;
        }

        public Builder setLoadFactorMax(Double loadFactorMax) {
            this.loadFactorMax = loadFactorMax;
            return this;
        }

        /**
         * Flow rates before the horizon, most recent last, null if unknown.
         */
        public Builder setPreviousFlowRate(double... previousFlowRate) {
            this.previousFlowRate = checkPreviousFlowRate(label, previousFlowRate);
            return this;
        }

        public Flow build() {
            return new Flow(this);
        }
    }

    public static Builder builder(String label, Bus bus) {
        return new Builder(label, bus);
    }

    private Flow(Builder builder) {
        super(builder.label);
        if (builder.size != null && builder.investParameters != null) {
            throw new PowsyblException("Flow '" + builder.label + "': size and invest parameters are exclusive");
        }
        if (builder.size != null && builder.size < 0) {
            throw new PowsyblException("Flow '" + builder.label + "': size must be positive: " + builder.size);
        }
        bus = builder.bus;
        size = builder.size;
        investParameters = builder.investParameters;
        relativeMinimum = builder.relativeMinimum;
        relativeMaximum = builder.relativeMaximum;
        fixedRelativeProfile = builder.fixedRelativeProfile;
        effectsPerFlowHour = builder.effectsPerFlowHour;
        onOffParameters = builder.onOffParameters;
        flowHoursTotalMin = builder.flowHoursTotalMin;
        flowHoursTotalMax = builder.flowHoursTotalMax;
        loadFactorMin = builder.loadFactorMin;
        loadFactorMax = builder.loadFactorMax;
        previousFlowRate = builder.previousFlowRate;
        checkPlausibility();
    }

    private void checkPlausibility() {
        if (!relativeMinimum.isLowerOrEqual(relativeMaximum)) {
            throw new PowsyblException("Flow '" + label + "': relative minimum " + relativeMinimum
                    + " must be lower than or equal to relative maximum " + relativeMaximum);
        }
        if (size == null && investParameters == null && fixedRelativeProfile != null) {
            LOGGER.warn("Flow '{}' has no size assigned, but a fixed relative profile. The default size is used "
                    + "and as flow rate = size * fixed relative profile, the resulting flow rate will be very high", label);
        }
    }

    @Override
    public String getLabelFull() {
        String componentLabel = component == null ? "unknownComp" : component.getLabel();
        return componentLabel + "__" + label;
    }

    public Bus getBus() {
        return bus;
    }

    /**
     * Fixed size, null if no size has been assigned (the modeling default size is then used) or if the
     * size is an investment decision.
     */
    public Double getSize() {
        return size;
    }

    public InvestParameters getInvestParameters() {
        return investParameters;
    }

    public boolean isWithInvestment() {
        return investParameters != null;
    }

    public TimeSeries getRelativeMinimum() {
        return relativeMinimum;
    }

    public TimeSeries getRelativeMaximum() {
        return relativeMaximum;
    }

    public TimeSeries getFixedRelativeProfile() {
        return fixedRelativeProfile;
    }

    public EffectValues getEffectsPerFlowHour() {
        return effectsPerFlowHour;
    }

    public OnOffParameters getOnOffParameters() {
        return onOffParameters;
    }

    /**
     * Make sure this flow gets an on variable, with default parameters if none are configured.
     */
    public void enableOnOff() {
        if (onOffParameters == null) {
            onOffParameters = new OnOffParameters();
        }
    }

    public Double getFlowHoursTotalMin() {
        return flowHoursTotalMin;
    }

    public Double getFlowHoursTotalMax() {
        return flowHoursTotalMax;
    }

    public Double getLoadFactorMin() {
        return loadFactorMin;
    }

    public Double getLoadFactorMax() {
        return loadFactorMax;
    }

    public double[] getPreviousFlowRate() {
        return previousFlowRate != null ? previousFlowRate.clone() : null;
    }

    /**
     * Seed of the next rolling horizon.
     */
    public void setPreviousFlowRate(double[] previousFlowRate) {
        this.previousFlowRate = checkPreviousFlowRate(label, previousFlowRate);
    }

    private static double[] checkPreviousFlowRate(String label, double[] previousFlowRate) {
        if (previousFlowRate == null) {
            return null;
        }
        if (previousFlowRate.length == 0) {
            throw new PowsyblException("Flow '" + label + "': previous flow rate is empty, use null if unknown");
        }
        return previousFlowRate.clone();
    }

    public Component getComponent() {
        return component;
    }

    void setComponent(Component component) {
        if (this.component != null && this.component != component) {
            throw new PowsyblException("Flow '" + label + "' already belongs to component '" + this.component.getLabel() + "'");
        }
        this.component = Objects.requireNonNull(component);
    }

    public boolean isInputInComponent() {
        if (component == null) {
            throw new PowsyblException("Flow '" + label + "' is not attached to a component");
        }
        return component.getInputs().contains(this);
    }

    @Override
    public void transformData(FlowSystem flowSystem) {
        effectsPerFlowHour = effectsPerFlowHour.resolve(flowSystem.getEffects());
        if (onOffParameters != null) {
            onOffParameters.transformData(flowSystem.getEffects());
        }
        if (investParameters != null) {
            investParameters.transformData(flowSystem.getEffects());
        }
    }
}
