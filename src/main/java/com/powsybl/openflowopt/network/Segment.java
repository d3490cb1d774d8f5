/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

/**
 * Sample points of one linear piece of a piecewise linear relation, for one variable.
 */
public record Segment(double start, double end) {

    public static Segment of(double start, double end) {
        return new Segment(start, end);
    }
}
