/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Values per effect, like costs per flow hour. A value can be given for the standard effect of the flow
 * system before it is known: it is resolved by {@link #resolve(EffectCollection)} during data
 * normalization.
 */
public final class EffectValues {

    private static final EffectValues EMPTY = new EffectValues(Collections.emptyMap(), null);

    private final Map<Effect, TimeSeries> values;

    private final TimeSeries standardValue;

    private EffectValues(Map<Effect, TimeSeries> values, TimeSeries standardValue) {
        this.values = values;
        this.standardValue = standardValue;
    }

    public static EffectValues empty() {
        return EMPTY;
    }

    public static EffectValues of(Effect effect, double value) {
        return empty().with(effect, TimeSeries.of(value));
    }

    public static EffectValues of(Effect effect, TimeSeries value) {
        return empty().with(effect, value);
    }

    /**
     * Value allocated to the standard effect of the flow system.
     */
    public static EffectValues ofStandard(double value) {
        return new EffectValues(Collections.emptyMap(), TimeSeries.of(value));
    }

    public static EffectValues ofStandard(TimeSeries value) {
        return new EffectValues(Collections.emptyMap(), Objects.requireNonNull(value));
    }

    public EffectValues with(Effect effect, double value) {
        return with(effect, TimeSeries.of(value));
    }

    public EffectValues with(Effect effect, TimeSeries value) {
        Objects.requireNonNull(effect);
        Objects.requireNonNull(value);
        Map<Effect, TimeSeries> newValues = new LinkedHashMap<>(values);
        newValues.put(effect, value);
        return new EffectValues(Collections.unmodifiableMap(newValues), standardValue);
    }

    public boolean isEmpty() {
        return values.isEmpty() && standardValue == null;
    }

    public boolean isResolved() {
        return standardValue == null;
    }

    /**
     * Values by effect, only available once the standard value has been resolved.
     */
    public Map<Effect, TimeSeries> getValues() {
        if (!isResolved()) {
            throw new PowsyblException("Effect values have not been resolved against the standard effect");
        }
        return values;
    }

    public EffectValues resolve(EffectCollection effects) {
        Objects.requireNonNull(effects);
        if (isResolved()) {
            return this;
        }
        Effect standardEffect = effects.getStandardEffect()
                .orElseThrow(() -> new PowsyblException("A value is given for the standard effect but no standard effect is defined"));
        if (values.containsKey(standardEffect)) {
            throw new PowsyblException("Value for effect '" + standardEffect.getLabel() + "' given twice");
        }
        Map<Effect, TimeSeries> newValues = new LinkedHashMap<>();
        newValues.put(standardEffect, standardValue);
        newValues.putAll(values);
        return new EffectValues(Collections.unmodifiableMap(newValues), null);
    }

    @Override
    public String toString() {
        return "EffectValues(values=" + values + ", standardValue=" + standardValue + ")";
    }
}
