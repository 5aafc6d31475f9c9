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
 * Implementation utilities.
 */
class Utils {

    private Utils() {
    }

    /**
     * Checks that transition is K x K, that emission has K rows and that initial has length K.
     * The emission row lengths are checked by {@link #numberOfSymbols(double[][])}.
     *
     * @return the number of states K
     *
     * @throws NullPointerException if any argument or matrix row is null
     * @throws InvalidDimensionException if the shapes do not agree
     */
    static int numberOfStates(double[][] transition, double[][] emission, double[] initial) {
        if (transition == null) {
            throw new NullPointerException("transition must not be null.");
        }
        if (emission == null) {
            throw new NullPointerException("emission must not be null.");
        }
        if (initial == null) {
            throw new NullPointerException("initial must not be null.");
        }

        final int numberOfStates = transition.length;
        if (numberOfStates == 0) {
            throw new InvalidDimensionException("At least one state is required.");
        }
        for (int i = 0; i < numberOfStates; i++) {
            if (transition[i] == null) {
                throw new NullPointerException("Transition row " + i + " is null.");
            }
            if (transition[i].length != numberOfStates) {
                throw new InvalidDimensionException("Transition matrix must be square but row "
                        + i + " has " + transition[i].length + " instead of " + numberOfStates
                        + " entries.");
            }
        }

        if (emission.length != numberOfStates) {
            throw new InvalidDimensionException("Emission matrix has " + emission.length
                    + " rows but transition matrix has " + numberOfStates + " states.");
        }
        if (initial.length != numberOfStates) {
            throw new InvalidDimensionException("Initial distribution has " + initial.length
                    + " entries but transition matrix has " + numberOfStates + " states.");
        }
        return numberOfStates;
    }

    /**
     * Returns the number of observation symbols N.
     *
     * @throws InvalidDimensionException if there are no emission rows or if they differ in
     * length
     */
    static int numberOfSymbols(double[][] emission) {
        if (emission.length == 0) {
            throw new InvalidDimensionException("Emission matrix has no rows.");
        }
        if (emission[0] == null) {
            throw new NullPointerException("Emission row 0 is null.");
        }
        final int numberOfSymbols = emission[0].length;
        for (int k = 1; k < emission.length; k++) {
            if (emission[k] == null) {
                throw new NullPointerException("Emission row " + k + " is null.");
            }
            if (emission[k].length != numberOfSymbols) {
                throw new InvalidDimensionException("Emission row " + k + " has "
                        + emission[k].length + " instead of " + numberOfSymbols + " entries.");
            }
        }
        return numberOfSymbols;
    }

    /**
     * @throws NullPointerException if observations is null
     * @throws EmptySequenceException if there are no observations
     * @throws InvalidIndexException for the first observation not in [0, numberOfSymbols)
     */
    static void checkObservations(int[] observations, int numberOfSymbols) {
        if (observations == null) {
            throw new NullPointerException("observations must not be null.");
        }
        if (observations.length == 0) {
            throw new EmptySequenceException();
        }
        for (int t = 0; t < observations.length; t++) {
            if (observations[t] < 0 || observations[t] >= numberOfSymbols) {
                throw new InvalidIndexException(t, observations[t], numberOfSymbols);
            }
        }
    }

    static double[][] copy(double[][] matrix) {
        final double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    /**
     * Note that this check must not be used for probability densities.
     */
    static boolean probabilityInRange(double probability, double delta) {
        return probability >= -delta && probability <= 1.0 + delta;
    }

}
