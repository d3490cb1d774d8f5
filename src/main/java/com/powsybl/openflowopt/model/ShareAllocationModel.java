/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.equations.Equation;
import com.powsybl.openflowopt.equations.EquationType;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Element;
import com.powsybl.openflowopt.network.TimeSeries;
import com.powsybl.openflowopt.util.DoubleArrays;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ledger of named shares. Guarantees that the sum variable equals the sum of all the shares and, for a
 * time series ledger, that the per time step sum variable equals the sum of the time series shares.
 */
public class ShareAllocationModel<E extends Element> extends AbstractElementModel<E> {

    private final boolean sharesAreTimeSeries;

    private final Double totalMin;

    private final Double totalMax;

    private final TimeSeries minPerHour;

    private final TimeSeries maxPerHour;

    private final Map<String, Variable> shares = new LinkedHashMap<>();

    private Variable sum;

    private Variable sumTimeSeries;

    private Equation eqSum;

    private Equation eqTimeSeries;

    public ShareAllocationModel(E element, String label, boolean sharesAreTimeSeries) {
        this(element, label, sharesAreTimeSeries, null, null, null, null);
    }

    public ShareAllocationModel(E element, String label, boolean sharesAreTimeSeries, Double totalMin, Double totalMax,
                                TimeSeries minPerHour, TimeSeries maxPerHour) {
        super(element, label);
        if (!sharesAreTimeSeries && (minPerHour != null || maxPerHour != null)) {
            throw new PowsyblException("Ledger '" + getLabelFull() + "': per hour bounds need time series shares");
        }
        this.sharesAreTimeSeries = sharesAreTimeSeries;
        this.totalMin = totalMin;
        this.totalMax = totalMax;
        this.minPerHour = minPerHour;
        this.maxPerHour = maxPerHour;
    }

    @Override
    public void doModeling(SystemModel systemModel) {
        sum = createVariable(systemModel, "sum");
        if (totalMin != null) {
            sum.setLowerBound(totalMin);
        }
        if (totalMax != null) {
            sum.setUpperBound(totalMax);
        }

        // sum = sum(share_i)
        eqSum = createEquation(systemModel, "sum", EquationType.EQUALITY);
        eqSum.addTerm(sum, -1);

        if (sharesAreTimeSeries) {
            int n = systemModel.getNrOfTimeSteps();
            double[] dt = systemModel.getDtInHours();
            sumTimeSeries = createTimeSeriesVariable(systemModel, "sum_TS");
            if (minPerHour != null) {
                sumTimeSeries.setLowerBound(DoubleArrays.multiply(minPerHour.toArray(n), dt));
            }
            if (maxPerHour != null) {
                sumTimeSeries.setUpperBound(DoubleArrays.multiply(maxPerHour.toArray(n), dt));
            }

            // sum_TS(t) = sum(share_TS_i(t))
            eqTimeSeries = createEquation(systemModel, "time_series", EquationType.EQUALITY);
            eqTimeSeries.addTerm(sumTimeSeries, -1);

            // sum also includes the time series total
            eqSum.addSumTerm(sumTimeSeries, 1);
        }
    }

    /**
     * Add a share equal to variable times factor, or to factor alone if variable is null.
     *
     * @param asSum if true, the share is the sum over time of variable times factor
     */
    public Variable addShare(SystemModel systemModel, String name, Variable variable, double[] factor, boolean asSum) {
        if (eqSum == null) {
            throw new PowsyblException("Ledger '" + getLabelFull() + "' has not been modeled yet");
        }
        if (shares.containsKey(name)) {
            throw new PowsyblException("A share with the label '" + name + "' is already present in '" + getLabelFull() + "'");
        }
        SingleShareModel<E> shareModel = addSubModel(new SingleShareModel<>(element, childLabel(name), variable, factor, asSum));
        shareModel.doModeling(systemModel);
        Variable share = shareModel.getShare();

        // scalar shares only count in the total
        if (!share.isTimeIndexed()) {
            eqSum.addTerm(share, 1);
        } else if (sharesAreTimeSeries) {
            eqTimeSeries.addTerm(share, 1);
        } else {
            eqSum.addSumTerm(share, 1);
        }
        shares.put(name, share);
        return share;
    }

    public boolean isSharesAreTimeSeries() {
        return sharesAreTimeSeries;
    }

    public Variable getSum() {
        return sum;
    }

    /**
     * Per time step sum, null for a ledger of scalar shares.
     */
    public Variable getSumTimeSeries() {
        return sumTimeSeries;
    }

    public Map<String, Variable> getShares() {
        return Collections.unmodifiableMap(shares);
    }
}
