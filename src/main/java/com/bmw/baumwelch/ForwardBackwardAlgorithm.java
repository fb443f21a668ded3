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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Computes the forward and backward probabilities of an observation sequence, which are the
 * first half of the expectation step of the Baum-Welch algorithm. See {@link Posteriors} for
 * the second half.
 *
 * <p>By default, raw probabilities are computed without any scaling. The forward probability
 * alpha[t][i] is then the joint probability of the observations up to t and state i at t and the
 * backward probability beta[t][i] is the probability of the observations after t given state i
 * at t. Both tables underflow to zero for long sequences.
 *
 * <p>With scaling enabled, the forward probabilities of each time step are normalized to sum
 * to 1 and the divisor is recorded. The backward probabilities at t are divided by the divisor
 * of time step t+1. The posteriors computed from scaled tables are the same as from unscaled
 * tables.
 */
public class ForwardBackwardAlgorithm {

    private final boolean scaleProbabilities;

    /**
     * Computes raw, unscaled probabilities.
     */
    public ForwardBackwardAlgorithm() {
        this(false);
    }

    public ForwardBackwardAlgorithm(boolean scaleProbabilities) {
        this.scaleProbabilities = scaleProbabilities;
    }

    public boolean isScaleProbabilities() {
        return scaleProbabilities;
    }

    /**
     * @throws ObservationRangeException if an observation index has no emission matrix row
     * @throws DegenerateNormalizerException if scaling is enabled and an observation has zero
     * probability
     */
    public ForwardBackwardResult apply(HmmParameters parameters,
            IndexedObservations observations) {
        checkArguments(parameters, observations);

        final double[] scalingDivisors = new double[observations.length()];
        final RealMatrix forwardProbabilities =
                computeForwardProbabilities(parameters, observations, scalingDivisors);
        final RealMatrix backwardProbabilities =
                computeBackwardProbabilities(parameters, observations, scalingDivisors);
        return new ForwardBackwardResult(forwardProbabilities, backwardProbabilities,
                scalingDivisors);
    }

    /**
     * alpha[0][i] = pi_i * B[y_0][i] and
     * alpha[t][i] = B[y_t][i] * sum_j A[i][j] * alpha[t-1][j].
     */
    private RealMatrix computeForwardProbabilities(HmmParameters parameters,
            IndexedObservations observations, double[] outScalingDivisors) {
        final int numberStates = parameters.numberOfStates();
        final RealMatrix result =
                new Array2DRowRealMatrix(observations.length(), numberStates);

        // Initial step
        final int firstObservation = observations.index(0);
        for (int state = 0; state < numberStates; state++) {
            result.setEntry(0, state, parameters.initialProbability(state)
                    * parameters.emissionProbability(firstObservation, state));
        }
        outScalingDivisors[0] = scale(result, 0);

        // Remaining steps
        for (int t = 1; t < observations.length(); t++) {
            final int observation = observations.index(t);
            for (int curState = 0; curState < numberStates; curState++) {
                double probability = 0.0;
                for (int prevState = 0; prevState < numberStates; prevState++) {
                    probability += parameters.transitionProbability(prevState, curState)
                            * result.getEntry(t - 1, prevState);
                }
                result.setEntry(t, curState,
                        probability * parameters.emissionProbability(observation, curState));
            }
            outScalingDivisors[t] = scale(result, t);
        }
        return result;
    }

    /**
     * beta[T-1][i] = 1 and
     * beta[t][i] = sum_j beta[t+1][j] * A[j][i] * B[y_{t+1}][j].
     */
    private RealMatrix computeBackwardProbabilities(HmmParameters parameters,
            IndexedObservations observations, double[] scalingDivisors) {
        final int numberStates = parameters.numberOfStates();
        final int lastStep = observations.length() - 1;
        final RealMatrix result = new Array2DRowRealMatrix(observations.length(), numberStates);

        for (int state = 0; state < numberStates; state++) {
            result.setEntry(lastStep, state, 1.0);
        }

        for (int t = lastStep - 1; t >= 0; t--) {
            final int nextObservation = observations.index(t + 1);
            for (int state = 0; state < numberStates; state++) {
                double probability = 0.0;
                for (int nextState = 0; nextState < numberStates; nextState++) {
                    probability += result.getEntry(t + 1, nextState)
                            * parameters.transitionProbability(state, nextState)
                            * parameters.emissionProbability(nextObservation, nextState);
                }
                // Using the scaling divisors of the next steps keeps the products of forward
                // and backward probabilities normalized.
                result.setEntry(t, state, probability / scalingDivisors[t + 1]);
            }
        }
        return result;
    }

    /**
     * Normalizes the forward probabilities of time step t if scaling is enabled.
     *
     * @return the scaling divisor of time step t, which is 1 if scaling is disabled.
     */
    private double scale(RealMatrix forwardProbabilities, int t) {
        if (!scaleProbabilities) {
            return 1.0;
        }

        final double sum = Utils.rowSum(forwardProbabilities, t);
        if (!Utils.isNormalizer(sum)) {
            throw new DegenerateNormalizerException(String.format(
                    "Observation at time step %d has (almost) zero probability given the previous "
                    + "observations.", t));
        }
        for (int state = 0; state < forwardProbabilities.getColumnDimension(); state++) {
            forwardProbabilities.setEntry(t, state, forwardProbabilities.getEntry(t, state) / sum);
        }
        return sum;
    }

    static void checkArguments(HmmParameters parameters, IndexedObservations observations) {
        if (parameters == null) {
            throw new NullPointerException("parameters must not be null.");
        }
        if (observations == null) {
            throw new NullPointerException("observations must not be null.");
        }
        if (observations.maxIndex() >= parameters.numberOfObservationClasses()) {
            throw new ObservationRangeException(String.format(
                    "Observation index %d exceeds the %d observation classes of the model.",
                    observations.maxIndex(), parameters.numberOfObservationClasses()));
        }
    }

}
