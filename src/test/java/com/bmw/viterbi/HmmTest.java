/**
 * Copyright (C) 2015-2016, BMW Car IT GmbH and BMW AG
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.viterbi;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class HmmTest {

    private static final double[][] TRANSITION = {{0.7, 0.3}, {0.4, 0.6}};
    private static final double[][] EMISSION = {{0.5, 0.4, 0.1}, {0.1, 0.3, 0.6}};
    private static final double[] INITIAL = {0.6, 0.4};

    private static final double DELTA = 1e-9;

    @Test
    public void testDimensions() {
        final Hmm hmm = new Hmm(TRANSITION, EMISSION, INITIAL);
        assertEquals(2, hmm.numberOfStates());
        assertEquals(3, hmm.numberOfSymbols());
    }

    @Test
    public void testComputeMostLikelySequence() {
        final Hmm hmm = new Hmm(TRANSITION, EMISSION, INITIAL);

        final MostLikelySequence result = hmm.computeMostLikelySequence(new int[] {0, 1, 2});
        assertArrayEquals(new int[] {0, 0, 1}, result.sequence);
        assertEquals(0.01512, result.probability, 1e-6);

        // The same instance decodes further sequences.
        final MostLikelySequence single = hmm.computeMostLikelySequence(new int[] {0});
        assertArrayEquals(new int[] {0}, single.sequence);
    }

    @Test
    public void testProbabilitiesAreCopied() {
        final double[][] transition = {{0.7, 0.3}, {0.4, 0.6}};
        final double[][] emission = {{0.5, 0.4, 0.1}, {0.1, 0.3, 0.6}};
        final double[] initial = {0.6, 0.4};
        final Hmm hmm = new Hmm(transition, emission, initial);

        initial[0] = 0.0;
        emission[1][2] = 0.0;
        transition[0][0] = 0.0;

        final MostLikelySequence result = hmm.computeMostLikelySequence(new int[] {0, 1, 2});
        assertArrayEquals(new int[] {0, 0, 1}, result.sequence);
        assertEquals(0.01512, result.probability, 1e-6);
    }

    @Test
    public void testSmoothingProbabilitiesOfMostLikelySequence() {
        final Hmm hmm = new Hmm(TRANSITION, EMISSION, INITIAL);
        final int[] observations = {0, 1, 2, 2, 0};

        final MostLikelySequence result = hmm.computeMostLikelySequence(observations,
                new ViterbiAlgorithmParams().setComputeSmoothingProbabilities(true));
        assertNull(result.messageHistory);
        assertNotNull(result.smoothingProbabilities);

        final double[][] expected = hmm.computeSmoothingProbabilities(observations);
        assertEquals(observations.length, result.smoothingProbabilities.length);
        for (int t = 0; t < observations.length; t++) {
            assertEquals(expected[t][result.sequence[t]], result.smoothingProbabilities[t],
                    DELTA);
        }
    }

    @Test
    public void testLogProbabilitiesWithSmoothing() {
        final Hmm hmm = new Hmm(TRANSITION, EMISSION, INITIAL);
        final int[] observations = {0, 1, 2};

        final MostLikelySequence linear = hmm.computeMostLikelySequence(observations,
                new ViterbiAlgorithmParams().setComputeSmoothingProbabilities(true));
        final MostLikelySequence log = hmm.computeMostLikelySequence(observations,
                new ViterbiAlgorithmParams().setComputeSmoothingProbabilities(true)
                        .setUseLogProbabilities(true));

        assertArrayEquals(linear.sequence, log.sequence);
        assertEquals(linear.probability, log.probability, DELTA);
        assertArrayEquals(linear.smoothingProbabilities, log.smoothingProbabilities, 0.0);
    }

    @Test
    public void testObservationLogProbability() {
        final Hmm hmm = new Hmm(TRANSITION, EMISSION, INITIAL);
        assertEquals(Math.log(0.03628), hmm.observationLogProbability(new int[] {0, 1, 2}),
                DELTA);
    }

    @Test(expected = InvalidDimensionException.class)
    public void testInvalidDimension() {
        new Hmm(new double[][] {{0.2, 0.3, 0.5}, {0.2, 0.3, 0.5}, {0.2, 0.3, 0.5}}, EMISSION,
                new double[] {0.2, 0.3, 0.5});
    }

    @Test(expected = InvalidIndexException.class)
    public void testInvalidIndex() {
        new Hmm(TRANSITION, EMISSION, INITIAL).computeMostLikelySequence(new int[] {0, 3});
    }

    @Test(expected = EmptySequenceException.class)
    public void testEmptySequence() {
        new Hmm(TRANSITION, EMISSION, INITIAL).computeSmoothingProbabilities(new int[0]);
    }

}
