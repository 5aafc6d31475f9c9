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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of the Viterbi algorithm for stationary first-order HMMs with discrete
 * observations, as described e.g. in Rabiner, Juang, An introduction to Hidden Markov Models,
 * IEEE ASSP Mag., pp 4-16, June 1986.
 *
 * <p>States are indexed 0..K-1 and observation symbols 0..N-1. The transition matrix is K x K,
 * where transition[i][j] is the probability of moving from state i to state j. The emission
 * matrix is K x N, where emission[k][s] is the probability of observing symbol s in state k.
 * Rows of both matrices and the initial distribution are expected to sum to 1, which is not
 * checked.
 *
 * <p>By default probabilities are multiplied, which underflows to 0 for long observation
 * sequences. See {@link ViterbiAlgorithmParams#setUseLogProbabilities(boolean)}.
 *
 * <p>If several states have the same maximum probability, the state with the lowest index is
 * chosen. This applies to back pointers as well as to the last state of the sequence.
 *
 * <p>Instances hold no state besides the parameters and can be shared between threads.
 */
public class ViterbiAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(ViterbiAlgorithm.class);

    private final ViterbiAlgorithmParams params;

    public ViterbiAlgorithm() {
        this(new ViterbiAlgorithmParams());
    }

    public ViterbiAlgorithm(ViterbiAlgorithmParams params) {
        if (params == null) {
            throw new NullPointerException("params must not be null.");
        }

        this.params = params;
    }

    /**
     * Computes the most likely sequence of states given the specified observations.
     *
     * Formally, this is argmax p(s_1, ..., s_T | o_1, ..., o_T) with respect to s_1, ..., s_T,
     * where s_t is the state at time step t, o_t is the observation at time step t and T is
     * the number of time steps.
     *
     * @param observations symbol index for each time step
     * @param transition K x K state transition probabilities
     * @param emission K x N emission probabilities
     * @param initial initial probability of each state
     *
     * @throws NullPointerException if any argument is null
     * @throws InvalidDimensionException if the dimensions of transition, emission and initial
     * do not match
     * @throws EmptySequenceException if there are no observations
     * @throws InvalidIndexException if an observation is not in [0, N)
     */
    public MostLikelySequence compute(int[] observations, double[][] transition,
            double[][] emission, double[] initial) {
        final int numberOfStates = Utils.numberOfStates(transition, emission, initial);
        Utils.checkObservations(observations, Utils.numberOfSymbols(emission));
        return computeValidated(observations, transition, emission, initial, numberOfStates);
    }

    /**
     * Same as {@link #compute(int[], double[][], double[][], double[])} for already validated
     * dimensions.
     */
    MostLikelySequence computeValidated(int[] observations, double[][] transition,
            double[][] emission, double[] initial, int numberOfStates) {
        final boolean logSpace = params.isUseLogProbabilities();
        final int numberOfTimeSteps = observations.length;
        logger.debug("Computing most likely sequence for {} time steps and {} states with {}",
                numberOfTimeSteps, numberOfStates, params);

        ForwardBackwardAlgorithm.Result forwardBackward = null;
        if (params.isComputeSmoothingProbabilities()) {
            forwardBackward = new ForwardBackwardAlgorithm().computeIfPossible(observations,
                    transition, emission, initial);
            if (forwardBackward == null) {
                logger.debug("Observations have zero probability, no smoothing probabilities.");
            }
        }

        if (logSpace) {
            transition = toLogProbabilities(transition);
            emission = toLogProbabilities(emission);
            initial = toLogProbabilities(initial);
        }

        final double[][] scores = new double[numberOfStates][numberOfTimeSteps];
        final int[][] backPointers = new int[numberOfStates][numberOfTimeSteps];

        // Initial time step
        for (int k = 0; k < numberOfStates; k++) {
            scores[k][0] = combine(initial[k], emission[k][observations[0]], logSpace);
            backPointers[k][0] = -1;
        }

        // Time steps depend on each other and must be processed in order.
        for (int t = 1; t < numberOfTimeSteps; t++) {
            forwardStep(t, observations[t], transition, emission, scores, backPointers,
                    logSpace);
        }

        final int lastState = mostLikelyState(scores, numberOfTimeSteps - 1);
        final double score = scores[lastState][numberOfTimeSteps - 1];
        final int[] sequence = retrieveMostLikelySequence(backPointers, lastState,
                numberOfTimeSteps);

        final double probability = logSpace ? Math.exp(score) : score;
        final double logProbability = logSpace ? score : Math.log(score);
        if (probability == 0.0) {
            logger.debug("Most likely sequence has probability 0 (log probability {}).",
                    logProbability);
        }

        double[] smoothingProbabilities = null;
        if (forwardBackward != null) {
            final double[][] stateProbabilities = forwardBackward.smoothingProbabilities();
            smoothingProbabilities = new double[numberOfTimeSteps];
            for (int t = 0; t < numberOfTimeSteps; t++) {
                smoothingProbabilities[t] = stateProbabilities[t][sequence[t]];
            }
        }

        final MostLikelySequence result;
        if (params.isKeepMessageHistory()) {
            result = new MostLikelySequence(sequence, probability, logProbability, scores,
                    backPointers, smoothingProbabilities);
        } else {
            result = new MostLikelySequence(sequence, probability, logProbability, null, null,
                    smoothingProbabilities);
        }
        logger.debug("Computed {}", result);
        return result;
    }

    /**
     * Computes the scores and back pointers of time step t from time step t-1.
     */
    private void forwardStep(int t, int observation, double[][] transition,
            double[][] emission, double[][] scores, int[][] backPointers, boolean logSpace) {
        final int numberOfStates = scores.length;
        for (int curState = 0; curState < numberOfStates; curState++) {
            // The emission factor is the same for all previous states and hence does not
            // affect the back pointer.
            int maxPrevState = 0;
            double maxScore = combine(scores[0][t - 1], transition[0][curState], logSpace);
            for (int prevState = 1; prevState < numberOfStates; prevState++) {
                final double score = combine(scores[prevState][t - 1],
                        transition[prevState][curState], logSpace);
                if (score > maxScore) {
                    maxScore = score;
                    maxPrevState = prevState;
                }
            }
            scores[curState][t] = combine(maxScore, emission[curState][observation], logSpace);
            backPointers[curState][t] = maxPrevState;
        }
    }

    /**
     * Retrieves the state with maximum score at time step t. Ties are broken in favor of the
     * lowest state index.
     */
    private int mostLikelyState(double[][] scores, int t) {
        assert scores.length > 0;
        int result = 0;
        double maxScore = scores[0][t];
        for (int k = 1; k < scores.length; k++) {
            if (scores[k][t] > maxScore) {
                maxScore = scores[k][t];
                result = k;
            }
        }
        return result;
    }

    /**
     * Follows the back pointers from the specified last state to the first time step.
     */
    private int[] retrieveMostLikelySequence(int[][] backPointers, int lastState,
            int numberOfTimeSteps) {
        final int[] result = new int[numberOfTimeSteps];
        result[numberOfTimeSteps - 1] = lastState;
        for (int t = numberOfTimeSteps - 1; t > 0; t--) {
            result[t - 1] = backPointers[result[t]][t];
            assert result[t - 1] >= 0;
        }
        return result;
    }

    private static double combine(double a, double b, boolean logSpace) {
        return logSpace ? a + b : a * b;
    }

    private static double[][] toLogProbabilities(double[][] probabilities) {
        final double[][] result = new double[probabilities.length][];
        for (int i = 0; i < probabilities.length; i++) {
            result[i] = toLogProbabilities(probabilities[i]);
        }
        return result;
    }

    private static double[] toLogProbabilities(double[] probabilities) {
        final double[] result = new double[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            result[i] = Math.log(probabilities[i]);
        }
        return result;
    }

}
