/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Effect;
import com.powsybl.openflowopt.network.EffectValues;
import com.powsybl.openflowopt.network.Element;
import com.powsybl.openflowopt.network.Segment;
import com.powsybl.openflowopt.util.DoubleArrays;

import java.util.*;

/**
 * Effects given as a piecewise linear function of a variable. One share variable is created per effect,
 * registered as an operation share for a time series variable and as an invest share for a scalar one.
 */
public class SegmentedSharesModel<E extends Element> extends AbstractElementModel<E> {

    public static final String DEFAULT_LABEL = "SegmentedShares";

    private final Variable variable;

    private final List<Segment> variableSegments;

    private final Map<Effect, List<Segment>> shareSegments;

    private final Variable outsideSegments;

    private final boolean canBeOutsideSegments;

    private final boolean asTimeSeries;

    private final Map<Effect, Variable> shares = new LinkedHashMap<>();

    private MultipleSegmentsModel<E> segmentsModel;

    /**
     * @param outsideSegments binary variable allowing all segments to be unselected when 0, if null a segment
     *                        must always be selected
     */
    public SegmentedSharesModel(E element, String label, Variable variable, List<Segment> variableSegments,
                                Map<Effect, List<Segment>> shareSegments, Variable outsideSegments) {
        this(element, label, variable, variableSegments, shareSegments, outsideSegments, false);
    }

    public SegmentedSharesModel(E element, String label, Variable variable, List<Segment> variableSegments,
                                Map<Effect, List<Segment>> shareSegments, boolean canBeOutsideSegments) {
        this(element, label, variable, variableSegments, shareSegments, null, canBeOutsideSegments);
    }

    private SegmentedSharesModel(E element, String label, Variable variable, List<Segment> variableSegments,
                                 Map<Effect, List<Segment>> shareSegments, Variable outsideSegments, boolean canBeOutsideSegments) {
        super(element, label);
        this.variable = Objects.requireNonNull(variable);
        this.variableSegments = List.copyOf(Objects.requireNonNull(variableSegments));
        this.shareSegments = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(shareSegments)));
        this.outsideSegments = outsideSegments;
        this.canBeOutsideSegments = canBeOutsideSegments;
        this.asTimeSeries = variable.isTimeIndexed();
        for (Map.Entry<Effect, List<Segment>> e : shareSegments.entrySet()) {
            if (e.getValue().size() != variableSegments.size()) {
                throw new PowsyblException("Segment length of variable segments (" + variableSegments.size()
                        + ") and of effect '" + e.getKey().getLabel() + "' segments (" + e.getValue().size() + ") must be equal");
            }
        }
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        for (Effect effect : shareSegments.keySet()) {
            String shortLabel = effect.getLabel() + "_segmented";
            shares.put(effect, asTimeSeries ? createTimeSeriesVariable(systemModel, shortLabel) : createVariable(systemModel, shortLabel));
        }

        Map<Variable, List<Segment>> segments = new LinkedHashMap<>();
        for (Map.Entry<Effect, List<Segment>> e : shareSegments.entrySet()) {
            segments.put(shares.get(e.getKey()), e.getValue());
        }
        segments.put(variable, variableSegments);

        String segmentsLabel = childLabel(MultipleSegmentsModel.DEFAULT_LABEL);
        segmentsModel = outsideSegments != null
                ? new MultipleSegmentsModel<>(element, segmentsLabel, segments, outsideSegments, asTimeSeries)
                : new MultipleSegmentsModel<>(element, segmentsLabel, segments, canBeOutsideSegments, asTimeSeries);
        addSubModel(segmentsModel).doModeling(systemModel);

        EffectCollectionModel effects = systemModel.getEffectCollectionModel();
        for (Map.Entry<Effect, Variable> e : shares.entrySet()) {
            EffectValues effectValues = EffectValues.of(e.getKey(), 1);
            if (asTimeSeries) {
                effects.addShareToOperation(systemModel, "segmented_effects", element, effectValues, DoubleArrays.of(1), e.getValue());
            } else {
                effects.addShareToInvest(systemModel, "segmented_effects", element, effectValues, 1, e.getValue());
            }
        }
    }

    public Map<Effect, Variable> getShares() {
        return Collections.unmodifiableMap(shares);
    }

    public MultipleSegmentsModel<E> getSegmentsModel() {
        return segmentsModel;
    }
}
