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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the forward-backward algorithm, also known as smoothing.
 * This algorithm computes the probability of each state at each time step given the
 * entire observation sequence.
 *
 * <p>Forward probabilities are normalized at each time step to prevent arithmetic underflows.
 * The scaling divisors are kept to compute the probability of the observation sequence.
 *
 * <p>Uses the same matrix conventions as {@link ViterbiAlgorithm}.
 */
public class ForwardBackwardAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(ForwardBackwardAlgorithm.class);

    private static final double DELTA = 1e-8;

    /**
     * Result of the forward-backward algorithm.
     */
    public static class Result {
        private final double[][] smoothingProbabilities;
        private final double[] scalingDivisors;

        Result(double[][] smoothingProbabilities, double[] scalingDivisors) {
            this.smoothingProbabilities = smoothingProbabilities;
            this.scalingDivisors = scalingDivisors;
        }

        /**
         * smoothingProbabilities()[t][k] is the probability of state k at time step t given
         * all observations.
         */
        public double[][] smoothingProbabilities() {
            return smoothingProbabilities;
        }

        /**
         * Returns the log probability of the entire observation sequence.
         * The log is returned to prevent arithmetic underflows for very small probabilities.
         */
        public double observationLogProbability() {
            double result = 0.0;
            for (double scalingDivisor : scalingDivisors) {
                result += Math.log(scalingDivisor);
            }
            return result;
        }
    }

    /**
     * @throws NullPointerException if any argument is null
     * @throws InvalidDimensionException if the dimensions of transition, emission and initial
     * do not match
     * @throws EmptySequenceException if there are no observations
     * @throws InvalidIndexException if an observation is not in [0, N)
     * @throws IllegalStateException if the observations have zero probability
     */
    public Result compute(int[] observations, double[][] transition, double[][] emission,
            double[] initial) {
        Utils.numberOfStates(transition, emission, initial);
        Utils.checkObservations(observations, Utils.numberOfSymbols(emission));
        return computeValidated(observations, transition, emission, initial);
    }

    Result computeValidated(int[] observations, double[][] transition, double[][] emission,
            double[] initial) {
        final Result result = computeIfPossible(observations, transition, emission, initial);
        if (result == null) {
            throw new IllegalStateException("Observations have zero probability.");
        }
        return result;
    }

    /**
     * Returns null instead of throwing if the observations have zero probability.
     */
    Result computeIfPossible(int[] observations, double[][] transition, double[][] emission,
            double[] initial) {
        final int numberOfStates = initial.length;
        final int numberOfTimeSteps = observations.length;
        logger.debug("Computing smoothing probabilities for {} time steps and {} states",
                numberOfTimeSteps, numberOfStates);

        final double[][] forwardProbabilities = new double[numberOfTimeSteps][numberOfStates];
        final double[] scalingDivisors = new double[numberOfTimeSteps];

        // Initial time step
        double sum = 0.0;
        for (int k = 0; k < numberOfStates; k++) {
            forwardProbabilities[0][k] = initial[k] * emission[k][observations[0]];
            sum += forwardProbabilities[0][k];
        }
        if (!normalizeForwardProbabilities(forwardProbabilities[0], sum, 0)) {
            return null;
        }
        scalingDivisors[0] = sum;

        // Remaining forward steps
        for (int t = 1; t < numberOfTimeSteps; t++) {
            sum = 0.0;
            for (int curState = 0; curState < numberOfStates; curState++) {
                final double forwardProbability = computeForwardProbability(curState,
                        forwardProbabilities[t - 1], transition)
                        * emission[curState][observations[t]];
                forwardProbabilities[t][curState] = forwardProbability;
                sum += forwardProbability;
            }
            if (!normalizeForwardProbabilities(forwardProbabilities[t], sum, t)) {
                return null;
            }
            scalingDivisors[t] = sum;
        }

        // Backward pass. Using the scaling divisors of the next steps eliminates the need to
        // normalize the smoothing probabilities,
        // see also https://en.wikipedia.org/wiki/Forward%E2%80%93backward_algorithm.
        final double[][] result = new double[numberOfTimeSteps][];
        double[] backwardProbabilities = new double[numberOfStates];
        Arrays.fill(backwardProbabilities, 1.0);
        result[numberOfTimeSteps - 1] = computeSmoothingProbabilitiesVector(
                forwardProbabilities[numberOfTimeSteps - 1], backwardProbabilities);
        for (int t = numberOfTimeSteps - 2; t >= 0; t--) {
            final double[] nextBackwardProbabilities = backwardProbabilities;
            backwardProbabilities = new double[numberOfStates];
            for (int state = 0; state < numberOfStates; state++) {
                backwardProbabilities[state] = computeUnscaledBackwardProbability(state,
                        nextBackwardProbabilities, observations[t + 1], transition, emission)
                        / scalingDivisors[t + 1];
            }
            result[t] = computeSmoothingProbabilitiesVector(forwardProbabilities[t],
                    backwardProbabilities);
        }
        return new Result(result, scalingDivisors);
    }

    /**
     * Returns the non-normalized forward probability of the specified state without the
     * emission factor.
     */
    private double computeForwardProbability(int curState, double[] prevForwardProbabilities,
            double[][] transition) {
        double result = 0.0;
        for (int prevState = 0; prevState < prevForwardProbabilities.length; prevState++) {
            result += prevForwardProbabilities[prevState] * transition[prevState][curState];
        }
        return result;
    }

    private double computeUnscaledBackwardProbability(int state,
            double[] nextBackwardProbabilities, int nextObservation, double[][] transition,
            double[][] emission) {
        double result = 0.0;
        for (int nextState = 0; nextState < nextBackwardProbabilities.length; nextState++) {
            result += emission[nextState][nextObservation] * nextBackwardProbabilities[nextState]
                    * transition[state][nextState];
        }
        return result;
    }

    private double[] computeSmoothingProbabilitiesVector(double[] forwardProbabilities,
            double[] backwardProbabilities) {
        assert forwardProbabilities.length == backwardProbabilities.length;
        final double[] result = new double[forwardProbabilities.length];
        for (int state = 0; state < result.length; state++) {
            result[state] = forwardProbabilities[state] * backwardProbabilities[state];
            assert Utils.probabilityInRange(result[state], DELTA);
        }
        assert sumsToOne(result);
        return result;
    }

    private boolean sumsToOne(double[] probabilities) {
        double sum = 0.0;
        for (double probability : probabilities) {
            sum += probability;
        }
        return Math.abs(sum - 1.0) <= DELTA;
    }

    /**
     * Returns false if the observations up to time step t have zero probability.
     */
    private boolean normalizeForwardProbabilities(double[] forwardProbabilities, double sum,
            int t) {
        if (sum <= 0.0) {
            logger.debug("Observations up to time step {} have zero probability.", t);
            return false;
        }
        for (int state = 0; state < forwardProbabilities.length; state++) {
            forwardProbabilities[state] /= sum;
        }
        return true;
    }

}
