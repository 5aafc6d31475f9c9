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
 * Thrown if an observation is not a symbol of the emission matrix, i.e. not in [0, N) where N
 * is the number of emission matrix columns.
 */
public class InvalidIndexException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int timeStep;
    private final int observation;
    private final int numberOfSymbols;

    public InvalidIndexException(int timeStep, int observation, int numberOfSymbols) {
        super("Observation " + observation + " at time step " + timeStep
                + " is not in [0, " + numberOfSymbols + ").");
        this.timeStep = timeStep;
        this.observation = observation;
        this.numberOfSymbols = numberOfSymbols;
    }

    /**
     * Zero-based position of the first invalid observation.
     */
    public int getTimeStep() {
        return timeStep;
    }

    public int getObservation() {
        return observation;
    }

    public int getNumberOfSymbols() {
        return numberOfSymbols;
    }

}
