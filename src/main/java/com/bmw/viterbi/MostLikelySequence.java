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

/**
 * Contains the most likely sequence and additional results of the Viterbi algorithm.
 */
public class MostLikelySequence {

    /**
     * State index for each time step.
     */
    public final int[] sequence;

    /**
     * Joint probability p(s_1, ..., s_T, o_1, ..., o_T) of {@link #sequence} and the
     * observations. Underflows to 0 for long sequences unless log probabilities are used.
     */
    public final double probability;

    /**
     * Natural logarithm of {@link #probability}. Computed directly when the algorithm runs with
     * log probabilities and hence finite even if {@link #probability} underflowed.
     */
    public final double logProbability;

    /**
     * Score table, null if the message history is not kept.
     *
     * messageHistory[k][t] contains the (log) probability of the most likely sequence ending
     * in state k at time step t with given observations o_1, ..., o_t.
     * Formally, this is max p(s_1, ..., s_t = k, o_1, ..., o_t) w.r.t. s_1, ..., s_{t-1}.
     */
    public final double[][] messageHistory;

    /**
     * backPointers[k][t] contains the previous state (at time t-1) of the most likely
     * sequence passing at time step t through state k. Since there are no previous states for
     * t=0, backPointers[k][0] is -1. Null if the message history is not kept.
     */
    public final int[][] backPointers;

    /**
     * smoothingProbabilities[t] contains the probability of sequence[t] given all
     * observations. Null if smoothing probabilities are not computed or if the observations
     * have zero probability.
     */
    public final double[] smoothingProbabilities;

    public MostLikelySequence(int[] sequence, double probability, double logProbability,
            double[][] messageHistory, int[][] backPointers, double[] smoothingProbabilities) {
        this.sequence = sequence;
        this.probability = probability;
        this.logProbability = logProbability;
        this.messageHistory = messageHistory;
        this.backPointers = backPointers;
        this.smoothingProbabilities = smoothingProbabilities;
    }

    public int length() {
        return sequence.length;
    }

    public String messageHistoryString() {
        if (messageHistory == null) {
            return "No message history";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Message history\n\n");
        for (int t = 0; t < sequence.length; t++) {
            sb.append("Time step " + t + "\n");
            for (int k = 0; k < messageHistory.length; k++) {
                sb.append(k + ": " + messageHistory[k][t]);
                if (t > 0) {
                    sb.append(" <- " + backPointers[k][t]);
                }
                sb.append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "MostLikelySequence [sequence=" + Arrays.toString(sequence) + ", probability="
                + probability + ", logProbability=" + logProbability + "]";
    }

}
