/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import java.util.Objects;

/**
 * On/off behavior of a flow or of a component. Default parameters only create the on binary variable.
 */
public class OnOffParameters {

    private EffectValues effectsPerSwitchOn = EffectValues.empty();

    private EffectValues effectsPerRunningHour = EffectValues.empty();

    private Double onHoursTotalMin;

    private Double onHoursTotalMax;

    private TimeSeries consecutiveOnHoursMin;

    private TimeSeries consecutiveOnHoursMax;

    private TimeSeries consecutiveOffHoursMin;

    private TimeSeries consecutiveOffHoursMax;

    private Double switchOnTotalMax;

    private boolean forceSwitchOn = false;

    public EffectValues getEffectsPerSwitchOn() {
        return effectsPerSwitchOn;
    }

    public OnOffParameters setEffectsPerSwitchOn(EffectValues effectsPerSwitchOn) {
        this.effectsPerSwitchOn = Objects.requireNonNull(effectsPerSwitchOn);
        return this;
    }

    public EffectValues getEffectsPerRunningHour() {
        return effectsPerRunningHour;
    }

    public OnOffParameters setEffectsPerRunningHour(EffectValues effectsPerRunningHour) {
        this.effectsPerRunningHour = Objects.requireNonNull(effectsPerRunningHour);
        return this;
    }

    public Double getOnHoursTotalMin() {
        return onHoursTotalMin;
    }

    public OnOffParameters setOnHoursTotalMin(Double onHoursTotalMin) {
        this.onHoursTotalMin = onHoursTotalMin;
        return this;
    }

    public Double getOnHoursTotalMax() {
        return onHoursTotalMax;
    }

    public OnOffParameters setOnHoursTotalMax(Double onHoursTotalMax) {
        this.onHoursTotalMax = onHoursTotalMax;
        return this;
    }

    public TimeSeries getConsecutiveOnHoursMin() {
        return consecutiveOnHoursMin;
    }

    public OnOffParameters setConsecutiveOnHoursMin(TimeSeries consecutiveOnHoursMin) {
        this.consecutiveOnHoursMin = consecutiveOnHoursMin;
        return this;
    }

    public TimeSeries getConsecutiveOnHoursMax() {
        return consecutiveOnHoursMax;
    }

    public OnOffParameters setConsecutiveOnHoursMax(TimeSeries consecutiveOnHoursMax) {
        this.consecutiveOnHoursMax = consecutiveOnHoursMax;
        return this;
    }

    public TimeSeries getConsecutiveOffHoursMin() {
        return consecutiveOffHoursMin;
    }

    public OnOffParameters setConsecutiveOffHoursMin(TimeSeries consecutiveOffHoursMin) {
        this.consecutiveOffHoursMin = consecutiveOffHoursMin;
        return this;
    }

    public TimeSeries getConsecutiveOffHoursMax() {
        return consecutiveOffHoursMax;
    }

    public OnOffParameters setConsecutiveOffHoursMax(TimeSeries consecutiveOffHoursMax) {
        this.consecutiveOffHoursMax = consecutiveOffHoursMax;
        return this;
    }

    public Double getSwitchOnTotalMax() {
        return switchOnTotalMax;
    }

    public OnOffParameters setSwitchOnTotalMax(Double switchOnTotalMax) {
        this.switchOnTotalMax = switchOnTotalMax;
        return this;
    }

    public boolean isForceSwitchOn() {
        return forceSwitchOn;
    }

    /**
     * Create the switch on/off variables even if no effect or limit is attached to them.
     */
    public OnOffParameters setForceSwitchOn(boolean forceSwitchOn) {
        this.forceSwitchOn = forceSwitchOn;
        return this;
    }

    public boolean isUseOff() {
        return isUseConsecutiveOffHours();
    }

    public boolean isUseConsecutiveOnHours() {
        return consecutiveOnHoursMin != null || consecutiveOnHoursMax != null;
    }

    public boolean isUseConsecutiveOffHours() {
        return consecutiveOffHoursMin != null || consecutiveOffHoursMax != null;
    }

    public boolean isUseSwitchOn() {
        return forceSwitchOn || switchOnTotalMax != null || !effectsPerSwitchOn.isEmpty();
    }

    public void transformData(EffectCollection effects) {
        effectsPerSwitchOn = effectsPerSwitchOn.resolve(effects);
        effectsPerRunningHour = effectsPerRunningHour.resolve(effects);
    }

    @Override
    public String toString() {
        return "OnOffParameters(" +
                "effectsPerSwitchOn=" + effectsPerSwitchOn +
                ", effectsPerRunningHour=" + effectsPerRunningHour +
                ", onHoursTotalMin=" + onHoursTotalMin +
                ", onHoursTotalMax=" + onHoursTotalMax +
                ", consecutiveOnHoursMin=" + consecutiveOnHoursMin +
                ", consecutiveOnHoursMax=" + consecutiveOnHoursMax +
                ", consecutiveOffHoursMin=" + consecutiveOffHoursMin +
                ", consecutiveOffHoursMax=" + consecutiveOffHoursMax +
                ", switchOnTotalMax=" + switchOnTotalMax +
                ", forceSwitchOn=" + forceSwitchOn +
                ')';
    }
}
