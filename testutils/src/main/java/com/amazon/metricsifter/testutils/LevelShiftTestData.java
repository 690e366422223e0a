/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.metricsifter.testutils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Generates metrics around a simulated incident. Every metric fluctuates around
 * a base level with Gaussian noise; the changed metrics additionally shift their
 * level up or down by a multiple of the noise at the incident index. Each
 * column draws from its own generator, seeded from the master seed in column
 * order, so that a column does not depend on the length of the others.
 */
public class LevelShiftTestData {

    private final double baseLevel;
    private final double noiseSigma;
    private final double shiftInSigmas;

    public LevelShiftTestData(double baseLevel, double noiseSigma, double shiftInSigmas) {
        this.baseLevel = baseLevel;
        this.noiseSigma = noiseSigma;
        this.shiftInSigmas = shiftInSigmas;
    }

    public LevelShiftTestData() {
        this(10.0, 1.0, 6.0);
    }

    /**
     * Generates shifted and noise metrics. Shifted and noise columns alternate as
     * long as both kinds remain; shifted metrics are named {@code shifted_<k>},
     * the others {@code noise_<k>}.
     *
     * @param length        number of samples per metric
     * @param shifted       number of metrics with a level shift
     * @param noise         number of metrics with noise only
     * @param incidentIndex first index of the shifted level
     * @param seed          the master seed
     * @return the generated metrics
     */
    public IncidentData generate(int length, int shifted, int noise, int incidentIndex, long seed) {
        Random prg = new Random(seed);
        List<String> names = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();
        List<String> changed = new ArrayList<>();
        int s = 0;
        int q = 0;
        while (s < shifted || q < noise) {
            if (s < shifted && (s <= q || q >= noise)) {
                String name = String.format("shifted_%03d", s++);
                names.add(name);
                changed.add(name);
                columns.add(levelShift(new Random(prg.nextLong()), length, incidentIndex));
            } else {
                names.add(String.format("noise_%03d", q++));
                columns.add(noise(new Random(prg.nextLong()), length));
            }
        }
        return new IncidentData(names, columns, changed, incidentIndex);
    }

    public double[] levelShift(Random random, int length, int incidentIndex) {
        double sign = random.nextBoolean() ? 1 : -1;
        double[] samples = noise(random, length);
        for (int i = incidentIndex; i < length; i++) {
            samples[i] += sign * shiftInSigmas * noiseSigma;
        }
        return samples;
    }

    public double[] noise(Random random, int length) {
        double[] samples = new double[length];
        for (int i = 0; i < length; i++) {
            samples[i] = baseLevel + noiseSigma * random.nextGaussian();
        }
        return samples;
    }

    public static double[] constant(int length, double value) {
        double[] samples = new double[length];
        Arrays.fill(samples, value);
        return samples;
    }

    /**
     * @param length number of samples
     * @param slope  increment between successive samples
     * @return a straight line starting at 0
     */
    public static double[] ramp(int length, double slope) {
        double[] samples = new double[length];
        for (int i = 0; i < length; i++) {
            samples[i] = slope * i;
        }
        return samples;
    }

    /**
     * @param samples the samples, left unchanged
     * @param from    first missing index, inclusive
     * @param to      last missing index, exclusive
     * @return a copy of the samples with {@code NaN} in {@code [from, to)}
     */
    public static double[] withMissing(double[] samples, int from, int to) {
        double[] copy = Arrays.copyOf(samples, samples.length);
        Arrays.fill(copy, from, to, Double.NaN);
        return copy;
    }
}
