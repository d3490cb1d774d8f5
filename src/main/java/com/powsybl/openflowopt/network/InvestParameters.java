/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;

import java.util.*;

/**
 * Sizing decision of a flow. The size is either fixed or optimized between a minimum and a maximum,
 * and if optional it may also be zero (not invested).
 */
public class InvestParameters {

    private Double fixedSize;

    private double minimumSize = 0;

    /**
     * null means the modeling "big" value
     */
    private Double maximumSize;

    private boolean optional = true;

    private EffectValues fixEffects = EffectValues.empty();

    private EffectValues specificEffects = EffectValues.empty();

    private EffectValues divestEffects = EffectValues.empty();

    private List<Segment> sizeSegments = Collections.emptyList();

    private Map<Effect, List<Segment>> effectSegments = Collections.emptyMap();

    public Double getFixedSize() {
        return fixedSize;
    }

    public InvestParameters setFixedSize(Double fixedSize) {
        if (fixedSize != null && fixedSize < 0) {
            throw new PowsyblException("Fixed size must be positive: " + fixedSize);
        }
        this.fixedSize = fixedSize;
        return this;
    }

    /**
     * The fixed size if any, the configured minimum size otherwise.
     */
    public double getMinimumSize() {
        return fixedSize != null ? fixedSize : minimumSize;
    }

    public InvestParameters setMinimumSize(double minimumSize) {
        if (minimumSize < 0) {
            throw new PowsyblException("Minimum size must be positive: " + minimumSize);
        }
        this.minimumSize = minimumSize;
        return this;
    }

    /**
     * The fixed size if any, the configured maximum size otherwise, or the given default when none is configured.
     */
    public double getMaximumSize(double defaultMaximumSize) {
        if (fixedSize != null) {
            return fixedSize;
        }
        return maximumSize != null ? maximumSize : defaultMaximumSize;
    }

    public InvestParameters setMaximumSize(Double maximumSize) {
        this.maximumSize = maximumSize;
        return this;
    }

    public boolean isOptional() {
        return optional;
    }

    public InvestParameters setOptional(boolean optional) {
        this.optional = optional;
        return this;
    }

    public EffectValues getFixEffects() {
        return fixEffects;
    }

    public InvestParameters setFixEffects(EffectValues fixEffects) {
        this.fixEffects = Objects.requireNonNull(fixEffects);
        return this;
    }

    public EffectValues getSpecificEffects() {
        return specificEffects;
    }

    public InvestParameters setSpecificEffects(EffectValues specificEffects) {
        this.specificEffects = Objects.requireNonNull(specificEffects);
        return this;
    }

    public EffectValues getDivestEffects() {
        return divestEffects;
    }

    public InvestParameters setDivestEffects(EffectValues divestEffects) {
        this.divestEffects = Objects.requireNonNull(divestEffects);
        return this;
    }

    public boolean hasEffectsInSegments() {
        return !sizeSegments.isEmpty();
    }

    public List<Segment> getSizeSegments() {
        return sizeSegments;
    }

    public Map<Effect, List<Segment>> getEffectSegments() {
        return effectSegments;
    }

    /**
     * Piecewise linear investment effects: the size segments and, for each effect, the segments of the
     * corresponding effect value.
     */
    public InvestParameters setEffectsInSegments(List<Segment> sizeSegments, Map<Effect, List<Segment>> effectSegments) {
        Objects.requireNonNull(sizeSegments);
        Objects.requireNonNull(effectSegments);
        for (Map.Entry<Effect, List<Segment>> e : effectSegments.entrySet()) {
            if (e.getValue().size() != sizeSegments.size()) {
                throw new PowsyblException("Segment length of size segments (" + sizeSegments.size()
                        + ") and of effect '" + e.getKey().getLabel() + "' segments (" + e.getValue().size() + ") must be equal");
            }
        }
        this.sizeSegments = List.copyOf(sizeSegments);
        this.effectSegments = Collections.unmodifiableMap(new LinkedHashMap<>(effectSegments));
        return this;
    }

    public void transformData(EffectCollection effects) {
        fixEffects = fixEffects.resolve(effects);
        specificEffects = specificEffects.resolve(effects);
        divestEffects = divestEffects.resolve(effects);
    }

    @Override
    public String toString() {
        return "InvestParameters(" +
                "fixedSize=" + fixedSize +
                ", minimumSize=" + minimumSize +
                ", maximumSize=" + maximumSize +
                ", optional=" + optional +
                ", fixEffects=" + fixEffects +
                ", specificEffects=" + specificEffects +
                ", divestEffects=" + divestEffects +
                ", sizeSegments=" + sizeSegments +
                ')';
    }
}
