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
 * Parameters for {@link BaumWelchTrainer}.
 */
public class BaumWelchParams {

    private boolean scaleProbabilities = false;
    private boolean logObservationProbability = true;

    /**
     * Whether to normalize the forward probabilities at each time step. This prevents
     * arithmetic underflows for long observation sequences. The estimated parameters are the
     * same up to rounding.
     */
    public BaumWelchParams setScaleProbabilities(boolean value) {
        this.scaleProbabilities = value;
        return this;
    }

    /**
     * Whether to log the observation log probability under the parameters of each iteration
     * on debug level. The value is only reported and never used to stop training early.
     */
    public BaumWelchParams setLogObservationProbability(boolean value) {
        this.logObservationProbability = value;
        return this;
    }

    public boolean isScaleProbabilities() {
        return scaleProbabilities;
    }

    public boolean isLogObservationProbability() {
        return logObservationProbability;
    }

}
