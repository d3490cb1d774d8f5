/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;
import com.powsybl.openflowopt.util.report.OpenFlowOptReportResourceBundle;

/**
 * Structured diagnostics of the model building. Warnings do not stop the building but flag a
 * numerically degraded model.
 */
public final class Reports {

    public static final String SYSTEM_MODEL_KEY = "ofo.systemModel";
    public static final String BIG_BINARY_BOUND_KEY = "ofo.bigBinaryBound";
    public static final String MAXIMUM_DURATION_INCONSISTENCY_KEY = "ofo.maximumDurationInconsistency";
    public static final String ZERO_EXCESS_PENALTY_KEY = "ofo.zeroExcessPenalty";

    private static final String MODEL_ID = "modelId";

    private Reports() {
    }

    public static ReportNode createRootReportNode() {
        return ReportNode.newRootReportNode()
                .withResourceBundles(OpenFlowOptReportResourceBundle.BASE_NAME)
                .withMessageTemplate("ofo.root")
                .build();
    }

    public static ReportNode createSystemModelReporter(ReportNode reportNode, int timeStepCount) {
        return reportNode.newReportNode()
                .withMessageTemplate(SYSTEM_MODEL_KEY)
                .withUntypedValue("timeStepCount", timeStepCount)
                .add();
    }

    public static void reportModelSize(ReportNode reportNode, int variableCount, int equationCount) {
        reportNode.newReportNode()
                .withMessageTemplate("ofo.modelSize")
                .withUntypedValue("variableCount", variableCount)
                .withUntypedValue("equationCount", equationCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportBigBinaryBound(ReportNode reportNode, String modelId, double upperBound, double bigBinaryBound) {
        reportNode.newReportNode()
                .withMessageTemplate(BIG_BINARY_BOUND_KEY)
                .withUntypedValue(MODEL_ID, modelId)
                .withUntypedValue("upperBound", upperBound)
                .withUntypedValue("bigBinaryBound", bigBinaryBound)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportMaximumDurationInconsistency(ReportNode reportNode, String modelId, double maximumDuration,
                                                          double previousDuration, double firstTimeStepDuration) {
        reportNode.newReportNode()
                .withMessageTemplate(MAXIMUM_DURATION_INCONSISTENCY_KEY)
                .withUntypedValue(MODEL_ID, modelId)
                .withUntypedValue("maximumDuration", maximumDuration)
                .withUntypedValue("previousDuration", previousDuration)
                .withUntypedValue("firstTimeStepDuration", firstTimeStepDuration)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportZeroExcessPenalty(ReportNode reportNode, String busId) {
        reportNode.newReportNode()
                .withMessageTemplate(ZERO_EXCESS_PENALTY_KEY)
                .withUntypedValue("busId", busId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }
}
