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
 * Posterior state probabilities of one observation sequence given the current parameters.
 *
 * <ul>
 *     <li>The pairwise posterior gamma[t][i][j] is the probability of state i at t and state j at
 *     t+1. It is only defined for t in [0, T-2].</li>
 *     <li>The marginal posterior delta[t][i] is the probability of state i at t.</li>
 * </ul>
 */
public final class Posteriors {

    private final RealMatrix[] pairwisePosteriors;
    private final RealMatrix marginalPosteriors;

    private Posteriors(RealMatrix[] pairwisePosteriors, RealMatrix marginalPosteriors) {
        this.pairwisePosteriors = pairwisePosteriors;
        this.marginalPosteriors = marginalPosteriors;
    }

    /**
     * Computes the posteriors from the forward and backward probabilities.
     *
     * <p>gamma[t][i][j] = alpha[t][i] * A[j][i] * beta[t+1][j] * B[y_{t+1}][j] normalized by
     * sum_k alpha[t][k] * beta[t][k]. For t in [0, T-2], delta[t][i] = sum_j gamma[t][i][j].
     * There is no transition after the last time step, so delta[T-1] is alpha[T-1] normalized
     * to sum to 1.
     *
     * @throws DegenerateNormalizerException if the observations have zero probability or a
     * probability below {@link Double#MIN_NORMAL}, which happens for long sequences without
     * scaling
     */
    public static Posteriors compute(HmmParameters parameters, IndexedObservations observations,
            ForwardBackwardResult forwardBackward) {
        ForwardBackwardAlgorithm.checkArguments(parameters, observations);
        if (forwardBackward == null) {
            throw new NullPointerException("forwardBackward must not be null.");
        }
        final int numberStates = parameters.numberOfStates();
        final int length = observations.length();
        if (forwardBackward.length() != length
                || forwardBackward.numberOfStates() != numberStates) {
            throw new IllegalArgumentException(String.format(
                    "Forward-backward tables are %d x %d but %d x %d is expected.",
                    forwardBackward.length(), forwardBackward.numberOfStates(), length,
                    numberStates));
        }

        final RealMatrix[] pairwisePosteriors = new RealMatrix[length - 1];
        final RealMatrix marginalPosteriors = new Array2DRowRealMatrix(length, numberStates);

        for (int t = 0; t < length - 1; t++) {
            // Equals the sequence probability for every t if the tables are unscaled.
            double normalizer = 0.0;
            for (int state = 0; state < numberStates; state++) {
                normalizer += forwardBackward.forwardProbability(t, state)
                        * forwardBackward.backwardProbability(t, state);
            }
            normalizer *= forwardBackward.scalingDivisor(t + 1);
            if (!Utils.isNormalizer(normalizer)) {
                throw new DegenerateNormalizerException(String.format(
                        "Observation sequence probability %s at time step %d is zero or "
                        + "subnormal.", normalizer, t));
            }

            final int nextObservation = observations.index(t + 1);
            final RealMatrix gamma = new Array2DRowRealMatrix(numberStates, numberStates);
            for (int i = 0; i < numberStates; i++) {
                double delta = 0.0;
                for (int j = 0; j < numberStates; j++) {
                    final double probability = forwardBackward.forwardProbability(t, i)
                            * parameters.transitionProbability(i, j)
                            * forwardBackward.backwardProbability(t + 1, j)
                            * parameters.emissionProbability(nextObservation, j)
                            / normalizer;
                    gamma.setEntry(i, j, probability);
                    delta += probability;
                }
                marginalPosteriors.setEntry(t, i, delta);
            }
            pairwisePosteriors[t] = gamma;
        }

        final int lastStep = length - 1;
        double lastSum = 0.0;
        for (int state = 0; state < numberStates; state++) {
            lastSum += forwardBackward.forwardProbability(lastStep, state);
        }
        if (!Utils.isNormalizer(lastSum)) {
            throw new DegenerateNormalizerException(String.format(
                    "Observation sequence probability %s at the last time step is zero or "
                    + "subnormal.", lastSum));
        }
        for (int state = 0; state < numberStates; state++) {
            marginalPosteriors.setEntry(lastStep, state,
                    forwardBackward.forwardProbability(lastStep, state) / lastSum);
        }

        return new Posteriors(pairwisePosteriors, marginalPosteriors);
    }

    /**
     * Returns the number T of time steps.
     */
    public int length() {
        return marginalPosteriors.getRowDimension();
    }

    public int numberOfStates() {
        return marginalPosteriors.getColumnDimension();
    }

    /**
     * Returns the probability of state i at t and state j at t+1 given all observations.
     *
     * @throws IndexOutOfBoundsException if t is not in [0, T-2]
     */
    public double pairwisePosterior(int t, int i, int j) {
        checkPairwiseTimeStep(t);
        return pairwisePosteriors[t].getEntry(i, j);
    }

    /**
     * Returns the probability of the specified state at t given all observations.
     */
    public double marginalPosterior(int t, int state) {
        return marginalPosteriors.getEntry(t, state);
    }

    /**
     * Returns a copy of the N x N pairwise posteriors of time step t, indexed by [i][j].
     */
    public RealMatrix pairwisePosteriors(int t) {
        checkPairwiseTimeStep(t);
        return pairwisePosteriors[t].copy();
    }

    /**
     * Returns a copy of the T x N marginal posterior table.
     */
    public RealMatrix marginalPosteriors() {
        return marginalPosteriors.copy();
    }

    private void checkPairwiseTimeStep(int t) {
        if (t < 0 || t >= pairwisePosteriors.length) {
            throw new IndexOutOfBoundsException("Pairwise posteriors are only defined for time "
                    + "steps 0 to " + (pairwisePosteriors.length - 1) + " but got " + t + ".");
        }
    }

}
