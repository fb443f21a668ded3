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

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Forward and backward probabilities of one observation sequence as computed by
 * {@link ForwardBackwardAlgorithm}.
 */
public class ForwardBackwardResult {

    private final RealMatrix forwardProbabilities;
    private final RealMatrix backwardProbabilities;
    private final double[] scalingDivisors;

    ForwardBackwardResult(RealMatrix forwardProbabilities, RealMatrix backwardProbabilities,
            double[] scalingDivisors) {
        assert forwardProbabilities.getRowDimension() == scalingDivisors.length;
        Utils.checkDimensions(backwardProbabilities, forwardProbabilities.getRowDimension(),
                forwardProbabilities.getColumnDimension(), "backwardProbabilities");
        this.forwardProbabilities = forwardProbabilities;
        this.backwardProbabilities = backwardProbabilities;
        this.scalingDivisors = scalingDivisors;
    }

    /**
     * Returns the number T of time steps.
     */
    public int length() {
        return forwardProbabilities.getRowDimension();
    }

    public int numberOfStates() {
        return forwardProbabilities.getColumnDimension();
    }

    public double forwardProbability(int t, int state) {
        return forwardProbabilities.getEntry(t, state);
    }

    public double backwardProbability(int t, int state) {
        return backwardProbabilities.getEntry(t, state);
    }

    /**
     * Returns the divisor that normalized the forward probabilities of time step t or 1 if the
     * probabilities are not scaled.
     */
    public double scalingDivisor(int t) {
        return scalingDivisors[t];
    }

    /**
     * Returns a copy of the T x N forward probability table.
     */
    public RealMatrix forwardProbabilities() {
        return forwardProbabilities.copy();
    }

    /**
     * Returns a copy of the T x N backward probability table.
     */
    public RealMatrix backwardProbabilities() {
        return backwardProbabilities.copy();
    }

    /**
     * Returns ln P(y_0, ..., y_{T-1}), computed as the sum of the logs of the scaling divisors
     * plus the log of the summed forward probabilities of the last time step. With scaling, the
     * result stays finite for long sequences. Without scaling, the last forward row underflows
     * to zero for long sequences and the result is negative infinity.
     */
    public double observationLogProbability() {
        double result = 0.0;
        for (double scalingDivisor : scalingDivisors) {
            result += FastMath.log(scalingDivisor);
        }
        return result + FastMath.log(Utils.rowSum(forwardProbabilities, length() - 1));
    }

}
