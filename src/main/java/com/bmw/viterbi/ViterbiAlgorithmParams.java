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
 * Parameters for {@link ViterbiAlgorithm}.
 */
public class ViterbiAlgorithmParams {

    private boolean keepMessageHistory = false;
    private boolean useLogProbabilities = false;
    private boolean computeSmoothingProbabilities = false;

    /**
     * Whether to return the score table and the back pointer table in
     * {@link MostLikelySequence#messageHistory} and {@link MostLikelySequence#backPointers}
     * for debugging.
     */
    public ViterbiAlgorithmParams setKeepMessageHistory(boolean value) {
        this.keepMessageHistory = value;
        return this;
    }

    /**
     * Whether to add log probabilities instead of multiplying probabilities. This prevents
     * arithmetic underflows for long observation sequences. Input probabilities are still
     * passed as plain probabilities.
     */
    public ViterbiAlgorithmParams setUseLogProbabilities(boolean value) {
        this.useLogProbabilities = value;
        return this;
    }

    /**
     * Whether to compute smoothing probabilities using the {@link ForwardBackwardAlgorithm}
     * for the states of the most likely sequence. Note that this roughly doubles
     * computation time and memory footprint. If the observations have zero probability, the
     * smoothing probabilities are undefined and {@link MostLikelySequence#smoothingProbabilities}
     * stays null.
     */
    public ViterbiAlgorithmParams setComputeSmoothingProbabilities(boolean value) {
        this.computeSmoothingProbabilities = value;
        return this;
    }

    public boolean isKeepMessageHistory() {
        return keepMessageHistory;
    }

    public boolean isUseLogProbabilities() {
        return useLogProbabilities;
    }

    public boolean isComputeSmoothingProbabilities() {
        return computeSmoothingProbabilities;
    }

    @Override
    public String toString() {
        return "ViterbiAlgorithmParams [keepMessageHistory=" + keepMessageHistory
                + ", useLogProbabilities=" + useLogProbabilities
                + ", computeSmoothingProbabilities=" + computeSmoothingProbabilities + "]";
    }

}
