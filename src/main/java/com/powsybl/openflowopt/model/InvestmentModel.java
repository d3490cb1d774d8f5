/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.openflowopt.equations.EquationType;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Element;
import com.powsybl.openflowopt.network.InvestParameters;
import com.powsybl.openflowopt.util.DoubleArrays;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Objects;

/**
 * Sizing of a defining variable: a size variable, optionally gated by an is invested binary, bounding the
 * defining variable through its relative bounds or pinning it through a fixed relative profile.
 */
public class InvestmentModel<E extends Element> extends AbstractElementModel<E> {

    public static final String DEFAULT_LABEL = "Investment";

    private final InvestParameters parameters;

    private final Variable definingVariable;

    private final Pair<double[], double[]> relativeBounds;

    private final double[] fixedRelativeProfile;

    private final Variable onVariable;

    private Variable size;

    private Variable isInvested;

    private SegmentedSharesModel<E> segmentedShares;

    /**
     * @param relativeBounds relative (minimum, maximum) bounds of the defining variable, ignored with a fixed profile
     * @param fixedRelativeProfile if not null, the defining variable is the size times this profile
     * @param onVariable on variable of the defining variable, if any, used to relax the lower bound when off
     */
    public InvestmentModel(E element, String label, InvestParameters parameters, Variable definingVariable,
                           Pair<double[], double[]> relativeBounds, double[] fixedRelativeProfile, Variable onVariable) {
        super(element, label);
        this.parameters = Objects.requireNonNull(parameters);
        this.definingVariable = Objects.requireNonNull(definingVariable);
        this.relativeBounds = Objects.requireNonNull(relativeBounds);
        this.fixedRelativeProfile = fixedRelativeProfile;
        this.onVariable = onVariable;
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        double maximumSize = parameters.getMaximumSize(systemModel.getParameters().getBig());
        size = createVariable(systemModel, "size");
        if (parameters.getFixedSize() != null && !parameters.isOptional()) {
            size.setFixedValue(parameters.getFixedSize());
        } else {
            size.setLowerBound(parameters.isOptional() ? 0 : parameters.getMinimumSize())
                    .setUpperBound(maximumSize);
        }

        if (parameters.isOptional()) {
            isInvested = createVariable(systemModel, "isInvested").setBinary(true);
            createBoundsForOptionalInvestment(systemModel, maximumSize);
        }

        createBoundsForDefiningVariable(systemModel, maximumSize);

        createShares(systemModel);
    }

    private void createBoundsForOptionalInvestment(SystemModel systemModel, double maximumSize) {
        if (parameters.getFixedSize() != null) {
            // size = isInvested * fixed size
            createEquation(systemModel, "is_invested", EquationType.EQUALITY)
                    .addTerm(size, -1)
                    .addTerm(isInvested, parameters.getFixedSize());
        } else {
            // size <= isInvested * maximum size
            createEquation(systemModel, "is_invested_ub", EquationType.INEQUALITY)
                    .addTerm(size, 1)
                    .addTerm(isInvested, -maximumSize);

            // size >= isInvested * max(epsilon, minimum size)
            createEquation(systemModel, "is_invested_lb", EquationType.INEQUALITY)
                    .addTerm(size, -1)
                    .addTerm(isInvested, Math.max(systemModel.getParameters().getEpsilon(), parameters.getMinimumSize()));
        }
    }

    private void createBoundsForDefiningVariable(SystemModel systemModel, double maximumSize) {
        String definingLabel = definingVariable.getShortLabel();
        if (fixedRelativeProfile != null) {
            // var(t) = size * profile(t), no on/off interaction
            createEquation(systemModel, "fixed_" + definingLabel, EquationType.EQUALITY)
                    .addTerm(definingVariable, 1)
                    .addTerm(size, DoubleArrays.negate(fixedRelativeProfile));
            return;
        }

        double[] relativeMinimum = relativeBounds.getLeft();
        double[] relativeMaximum = relativeBounds.getRight();

        // var(t) <= size * relative maximum(t)
        createEquation(systemModel, "ub_" + definingLabel, EquationType.INEQUALITY)
                .addTerm(definingVariable, 1)
                .addTerm(size, DoubleArrays.negate(relativeMaximum));

        if (onVariable == null) {
            // var(t) >= size * relative minimum(t)
            createEquation(systemModel, "lb_" + definingLabel, EquationType.INEQUALITY)
                    .addTerm(definingVariable, -1)
                    .addTerm(size, relativeMinimum);
        } else {
            // var(t) >= size * relative minimum(t) - mega * (1 - on(t)) with mega = relative maximum(t) * maximum size
            double[] mega = DoubleArrays.scale(relativeMaximum, maximumSize);
            createEquation(systemModel, "lb_" + definingLabel, EquationType.INEQUALITY)
                    .addTerm(definingVariable, -1)
                    .addTerm(onVariable, mega)
                    .addTerm(size, relativeMinimum)
                    .addConstant(mega);
        }
    }

    private void createShares(SystemModel systemModel) {
        EffectCollectionModel effects = systemModel.getEffectCollectionModel();

        if (!parameters.getFixEffects().isEmpty()) {
            // isInvested * fix effects, unconditional if not optional
            effects.addShareToInvest(systemModel, "fix_effects", element, parameters.getFixEffects(), 1,
                    parameters.isOptional() ? isInvested : null);
        }

        // divest effects are paid, then cancelled if invested
        if (!parameters.getDivestEffects().isEmpty() && parameters.isOptional()) {
            effects.addShareToInvest(systemModel, "divest_effects", element, parameters.getDivestEffects(), 1, null);
            effects.addShareToInvest(systemModel, "divest_cancellation_effects", element, parameters.getDivestEffects(), -1, isInvested);
        }

        if (!parameters.getSpecificEffects().isEmpty()) {
            effects.addShareToInvest(systemModel, "specific_effects", element, parameters.getSpecificEffects(), 1, size);
        }

        if (parameters.hasEffectsInSegments()) {
            String segmentsLabel = childLabel(SegmentedSharesModel.DEFAULT_LABEL);
            segmentedShares = isInvested != null
                    ? new SegmentedSharesModel<>(element, segmentsLabel, size, parameters.getSizeSegments(), parameters.getEffectSegments(), isInvested)
                    : new SegmentedSharesModel<>(element, segmentsLabel, size, parameters.getSizeSegments(), parameters.getEffectSegments(), false);
            addSubModel(segmentedShares).doModeling(systemModel);
        }
    }

    public InvestParameters getParameters() {
        return parameters;
    }

    public Variable getSize() {
        return size;
    }

    /**
     * Null if the investment is not optional.
     */
    public Variable getIsInvested() {
        return isInvested;
    }

    public SegmentedSharesModel<E> getSegmentedShares() {
        return segmentedShares;
    }
}
