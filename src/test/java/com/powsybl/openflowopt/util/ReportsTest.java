/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openflowopt.util.report.OpenFlowOptReportResourceBundle;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReportsTest {

    @Test
    void testRootReport() {
        ReportNode reportNode = Reports.createRootReportNode();
        assertEquals("ofo.root", reportNode.getMessageKey());
        assertEquals("Flow optimization model", reportNode.getMessage());
    }

    @Test
    void testZeroExcessPenaltyReport() {
        ReportNode reportNode = ReportNode.newRootReportNode()
                .withLocale(Locale.ENGLISH)
                .withResourceBundles(OpenFlowOptReportResourceBundle.BASE_NAME)
                .withMessageTemplate("ofo.root")
                .build();
        Reports.reportZeroExcessPenalty(reportNode, "heat");
        assertEquals(1, reportNode.getChildren().size());
        ReportNode child = reportNode.getChildren().get(0);
        assertEquals(Reports.ZERO_EXCESS_PENALTY_KEY, child.getMessageKey());
        assertEquals("Excess penalty of bus heat is zero, excess is free", child.getMessage());
    }

    @Test
    void testSystemModelReport() {
        ReportNode reportNode = Reports.createRootReportNode();
        ReportNode systemModelNode = Reports.createSystemModelReporter(reportNode, 24);
        Reports.reportModelSize(systemModelNode, 10, 5);
        assertEquals("System model on 24 time steps", systemModelNode.getMessage());
        assertEquals("Model has 10 variables and 5 equations", systemModelNode.getChildren().get(0).getMessage());
    }
}
