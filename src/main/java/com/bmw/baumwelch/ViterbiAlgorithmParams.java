/**
 * Copyright (C) 2016, BMW AG
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

package com.bmw.baumwelch;

/**
 * Parameters for {@link ViterbiAlgorithm}.
 */
public class ViterbiAlgorithmParams {

    private boolean useLogProbabilities = false;
    private boolean keepMessageHistory = false;
    private boolean computeSmoothingProbabilities = false;

    /**
     * Whether to compute path scores as natural logarithms instead of raw probabilities.
     * Log probabilities do not underflow for long observation sequences but the path scores
     * in the result are then log probabilities.
     */
    public ViterbiAlgorithmParams setUseLogProbabilities(boolean value) {
        this.useLogProbabilities = value;
        return this;
    }

    /**
     * Whether to store the scores of the most likely paths ending in each state at each time
     * step. Useful for debugging.
     */
    public ViterbiAlgorithmParams setKeepMessageHistory(boolean value) {
        this.keepMessageHistory = value;
        return this;
    }

    /**
     * Whether to also report the posterior probability of each decoded state. This runs a
     * scaled forward-backward pass over the same sequence and keeps its T x N tables until
     * decoding returns.
     */
    public ViterbiAlgorithmParams setComputeSmoothingProbabilities(boolean value) {
        this.computeSmoothingProbabilities = value;
        return this;
    }

    public boolean isUseLogProbabilities() {
        return useLogProbabilities;
    }

    public boolean isKeepMessageHistory() {
        return keepMessageHistory;
    }

    public boolean isComputeSmoothingProbabilities() {
        return computeSmoothingProbabilities;
    }

}
