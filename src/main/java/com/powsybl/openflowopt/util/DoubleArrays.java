/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.util;

import com.powsybl.commons.PowsyblException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Element-wise arithmetic on per-step arrays. An array of length 1 is a scalar and is broadcast
 * against any other length.
 */
public final class DoubleArrays {

    private DoubleArrays() {
    }

    public static double[] of(double value) {
        return new double[] {value};
    }

    /**
     * @return a one element array, or null (unbounded) if value is null
     */
    public static double[] ofNullable(Double value) {
        return value != null ? new double[] {value} : null;
    }

    public static double get(double[] values, int i) {
        return values.length == 1 ? values[0] : values[i];
    }

    public static int broadcastLength(double[] a, double[] b) {
        if (a.length == 1) {
            return b.length;
        }
        if (b.length == 1 || a.length == b.length) {
            return a.length;
        }
        throw new PowsyblException("Incompatible array lengths: " + a.length + " and " + b.length);
    }

    public static double[] multiply(double[] a, double[] b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        int length = broadcastLength(a, b);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = get(a, i) * get(b, i);
        }
        return result;
    }

    public static double[] add(double[] a, double[] b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        int length = broadcastLength(a, b);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = get(a, i) + get(b, i);
        }
        return result;
    }

    public static double[] scale(double[] a, double factor) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] * factor;
        }
        return result;
    }

    public static double[] negate(double[] a) {
        return scale(a, -1);
    }

    public static double[] maximum(double[] a, double floor) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = Math.max(a[i], floor);
        }
        return result;
    }

    public static double sum(double[] a) {
        double sum = 0;
        for (double v : a) {
            sum += v;
        }
        return sum;
    }

    public static double max(double[] a) {
        return Arrays.stream(a).max().orElseThrow();
    }

    /**
     * Slice [from, to) of a per-step array, a scalar is returned unchanged.
     */
    public static double[] slice(double[] a, int from, int to) {
        if (a.length == 1) {
            return a;
        }
        return Arrays.copyOfRange(a, from, to);
    }

    public static int[] range(int from, int to) {
        int[] range = new int[Math.max(to - from, 0)];
        for (int i = 0; i < range.length; i++) {
            range[i] = from + i;
        }
        return range;
    }
}
