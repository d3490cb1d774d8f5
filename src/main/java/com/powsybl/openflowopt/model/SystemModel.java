/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.model;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openflowopt.ModelingParameters;
import com.powsybl.openflowopt.equations.EquationSystem;
import com.powsybl.openflowopt.equations.Variable;
import com.powsybl.openflowopt.network.Bus;
import com.powsybl.openflowopt.network.Component;
import com.powsybl.openflowopt.network.Effect;
import com.powsybl.openflowopt.network.FlowSystem;
import com.powsybl.openflowopt.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Model of a flow system over one time horizon. Holds the context shared by all the element models: the
 * time steps, the modeling parameters, the equation system receiving every variable and equation, the
 * effect ledgers and the report node collecting diagnostics.
 */
public class SystemModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemModel.class);

    private final TimeHorizon timeHorizon;

    private final ModelingParameters parameters;

    private final ReportNode reportNode;

    private final EquationSystem equationSystem = new EquationSystem();

    private EffectCollectionModel effectCollectionModel;

    private final List<ComponentModel> componentModels = new ArrayList<>();

    private final List<BusModel> busModels = new ArrayList<>();

    private boolean modeled = false;

    public SystemModel(TimeHorizon timeHorizon, ModelingParameters parameters, ReportNode reportNode) {
        this.timeHorizon = Objects.requireNonNull(timeHorizon);
        this.parameters = Objects.requireNonNull(parameters);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    public SystemModel(TimeHorizon timeHorizon) {
        this(timeHorizon, new ModelingParameters(), ReportNode.NO_OP);
    }

    public TimeHorizon getTimeHorizon() {
        return timeHorizon;
    }

    public int getNrOfTimeSteps() {
        return timeHorizon.getNrOfTimeSteps();
    }

    public double[] getDtInHours() {
        return timeHorizon.getDtInHours();
    }

    public double getDtInHoursTotal() {
        return timeHorizon.getDtInHoursTotal();
    }

    public double[] getPreviousDtInHours() {
        return timeHorizon.getPreviousDtInHours();
    }

    public ModelingParameters getParameters() {
        return parameters;
    }

    public ReportNode getReportNode() {
        return reportNode;
    }

    public EquationSystem getEquationSystem() {
        return equationSystem;
    }

    public EffectCollectionModel getEffectCollectionModel() {
        if (effectCollectionModel == null) {
            throw new PowsyblException("Effects have not been modeled yet");
        }
        return effectCollectionModel;
    }

    /**
     * Register the ledgers of effects: must be done before any element model adds a share.
     */
    public void setEffectCollectionModel(EffectCollectionModel effectCollectionModel) {
        this.effectCollectionModel = Objects.requireNonNull(effectCollectionModel);
    }

    public List<ComponentModel> getComponentModels() {
        return Collections.unmodifiableList(componentModels);
    }

    public List<BusModel> getBusModels() {
        return Collections.unmodifiableList(busModels);
    }

    /**
     * Build the models of all the elements of the flow system: effects first, then components with their
     * flows, then buses whose balance needs the flow rates.
     */
    public void doModeling(FlowSystem flowSystem) {
        Objects.requireNonNull(flowSystem);
        if (modeled) {
            throw new PowsyblException("System model has already been built, create a new one for another horizon");
        }
        if (!flowSystem.isDataTransformed()) {
            throw new PowsyblException("Flow system data must be transformed before modeling");
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        ReportNode modelReportNode = Reports.createSystemModelReporter(reportNode, getNrOfTimeSteps());

        EffectCollectionModel effectsModel = new EffectCollectionModel(flowSystem.getEffects());
        flowSystem.getEffects().setModel(effectsModel);
        setEffectCollectionModel(effectsModel);
        effectsModel.doModeling(this);

        for (Component component : flowSystem.getComponents()) {
            ComponentModel componentModel = component.createModel();
            LOGGER.debug("Modeling component '{}'", component.getLabel());
            componentModel.doModeling(this);
            componentModels.add(componentModel);
        }

        for (Bus bus : flowSystem.getBuses()) {
            BusModel busModel = new BusModel(bus);
            bus.setModel(busModel);
            LOGGER.debug("Modeling bus '{}'", bus.getLabel());
            busModel.doModeling(this);
            busModels.add(busModel);
        }

        modeled = true;
        stopwatch.stop();
        int variableCount = equationSystem.getVariables().size();
        int equationCount = equationSystem.getEquations().size();
        Reports.reportModelSize(modelReportNode, variableCount, equationCount);
        LOGGER.info("System model built on {} time steps: {} variables, {} equations (in {} ms)",
                getNrOfTimeSteps(), variableCount, equationCount, stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    /**
     * Variables whose sum is to be minimized: the total of the objective effect and the penalty sum.
     */
    public List<Variable> getObjectiveVariables() {
        EffectCollectionModel effectsModel = getEffectCollectionModel();
        List<Variable> objectiveVariables = new ArrayList<>(2);
        effectsModel.getElement().getObjectiveEffect()
                .map(Effect::getModel)
                .ifPresent(effectModel -> objectiveVariables.add(effectModel.getTotal().getSum()));
        objectiveVariables.add(effectsModel.getPenalty().getSum());
        return objectiveVariables;
    }
}
