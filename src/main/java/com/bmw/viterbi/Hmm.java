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

/**
 * Implements a stationary HMM with K states and N discrete observation symbols. The
 * probabilities are validated once and copied, so one instance can decode any number of
 * observation sequences.
 *
 * @see ViterbiAlgorithm for the matrix conventions
 */
public class Hmm {

    private final double[][] transition;
    private final double[][] emission;
    private final double[] initial;
    private final int numberOfStates;
    private final int numberOfSymbols;

    /**
     * @throws NullPointerException if any argument is null
     * @throws InvalidDimensionException if the dimensions do not match
     */
    public Hmm(double[][] transition, double[][] emission, double[] initial) {
        this.numberOfStates = Utils.numberOfStates(transition, emission, initial);
        this.numberOfSymbols = Utils.numberOfSymbols(emission);
        this.transition = Utils.copy(transition);
        this.emission = Utils.copy(emission);
        this.initial = initial.clone();
    }

    public int numberOfStates() {
        return numberOfStates;
    }

    public int numberOfSymbols() {
        return numberOfSymbols;
    }

    /**
     * Computes the most likely sequence of states given the specified observations.
     *
     * @throws EmptySequenceException if there are no observations
     * @throws InvalidIndexException if an observation is not in [0, N)
     */
    public MostLikelySequence computeMostLikelySequence(int[] observations) {
        return computeMostLikelySequence(observations, new ViterbiAlgorithmParams());
    }

    /**
     * @see #computeMostLikelySequence(int[])
     */
    public MostLikelySequence computeMostLikelySequence(int[] observations,
            ViterbiAlgorithmParams params) {
        Utils.checkObservations(observations, numberOfSymbols);
        return new ViterbiAlgorithm(params).computeValidated(observations, transition, emission,
                initial, numberOfStates);
    }

    /**
     * Returns the probability of each state at each time step given all observations, i.e.
     * result[t][k] = p(s_t = k | o_1, ..., o_T).
     *
     * @throws IllegalStateException if the observations have zero probability
     */
    public double[][] computeSmoothingProbabilities(int[] observations) {
        return forwardBackward(observations).smoothingProbabilities();
    }

    /**
     * Returns log p(o_1, ..., o_T).
     *
     * @throws IllegalStateException if the observations have zero probability
     */
    public double observationLogProbability(int[] observations) {
        return forwardBackward(observations).observationLogProbability();
    }

    private ForwardBackwardAlgorithm.Result forwardBackward(int[] observations) {
        Utils.checkObservations(observations, numberOfSymbols);
        return new ForwardBackwardAlgorithm().computeValidated(observations, transition,
                emission, initial);
    }

}
