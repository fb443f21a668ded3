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
 * Re-estimates the model parameters from the posteriors of the expectation step, which is the
 * maximization step of the Baum-Welch algorithm.
 */
public final class ParameterUpdater {

    private ParameterUpdater() {
    }

    /**
     * Returns new parameters with
     * <ul>
     *     <li>pi_i = delta[0][i],</li>
     *     <li>A[j][i] = sum_{t=0}^{T-2} gamma[t][i][j] / sum_{t=0}^{T-2} delta[t][i],</li>
     *     <li>B[v][i] = sum_{t: y_t = v} delta[t][i] / sum_{t=0}^{T-1} delta[t][i].</li>
     * </ul>
     * The re-estimated transitions of each state sum to 1 over the real states, so the STOP row
     * of the new parameters is all zero. The passed parameters are not changed.
     *
     * @throws DegenerateNormalizerException if the sequence has less than two observations or if
     * a state has zero posterior probability at all time steps
     */
    public static HmmParameters update(HmmParameters parameters,
            IndexedObservations observations, Posteriors posteriors) {
        ForwardBackwardAlgorithm.checkArguments(parameters, observations);
        if (posteriors == null) {
            throw new NullPointerException("posteriors must not be null.");
        }
        if (posteriors.length() != observations.length()
                || posteriors.numberOfStates() != parameters.numberOfStates()) {
            throw new IllegalArgumentException(String.format(
                    "Posteriors are %d x %d but %d x %d is expected.", posteriors.length(),
                    posteriors.numberOfStates(), observations.length(),
                    parameters.numberOfStates()));
        }
        if (observations.length() < 2) {
            throw new DegenerateNormalizerException("Transition probabilities cannot be "
                    + "estimated from a single observation.");
        }

        final double[] initialProbabilities = updateInitialProbabilities(posteriors);
        final RealMatrix transitionProbabilities = updateTransitionProbabilities(posteriors);
        final RealMatrix emissionProbabilities = updateEmissionProbabilities(
                parameters.numberOfObservationClasses(), observations, posteriors);
        return new HmmParameters(initialProbabilities, transitionProbabilities,
                emissionProbabilities);
    }

    private static double[] updateInitialProbabilities(Posteriors posteriors) {
        final double[] result = new double[posteriors.numberOfStates()];
        for (int state = 0; state < result.length; state++) {
            result[state] = posteriors.marginalPosterior(0, state);
        }
        return result;
    }

    private static RealMatrix updateTransitionProbabilities(Posteriors posteriors) {
        final int numberStates = posteriors.numberOfStates();
        // The last time step has no outgoing transition.
        final int numberTransitions = posteriors.length() - 1;
        final RealMatrix result = new Array2DRowRealMatrix(numberStates, numberStates);

        for (int fromState = 0; fromState < numberStates; fromState++) {
            double expectedVisits = 0.0;
            for (int t = 0; t < numberTransitions; t++) {
                expectedVisits += posteriors.marginalPosterior(t, fromState);
            }
            if (!Utils.isNormalizer(expectedVisits)) {
                throw new DegenerateNormalizerException(String.format(
                        "State %d has (almost) zero posterior probability before the last "
                        + "time step.", fromState));
            }

            for (int toState = 0; toState < numberStates; toState++) {
                double expectedTransitions = 0.0;
                for (int t = 0; t < numberTransitions; t++) {
                    expectedTransitions += posteriors.pairwisePosterior(t, fromState, toState);
                }
                result.setEntry(toState, fromState, expectedTransitions / expectedVisits);
            }
        }
        return result;
    }

    private static RealMatrix updateEmissionProbabilities(int numberObservationClasses,
            IndexedObservations observations, Posteriors posteriors) {
        final int numberStates = posteriors.numberOfStates();
        final RealMatrix result = new Array2DRowRealMatrix(numberObservationClasses,
                numberStates);
        final double[] expectedVisits = new double[numberStates];

        // Adds the posteriors of each time step to the row of the observed class.
        for (int t = 0; t < observations.length(); t++) {
            final int observation = observations.index(t);
            for (int state = 0; state < numberStates; state++) {
                final double posterior = posteriors.marginalPosterior(t, state);
                result.addToEntry(observation, state, posterior);
                expectedVisits[state] += posterior;
            }
        }

        for (int state = 0; state < numberStates; state++) {
            if (!Utils.isNormalizer(expectedVisits[state])) {
                throw new DegenerateNormalizerException(String.format(
                        "State %d has (almost) zero posterior probability at all time steps.",
                        state));
            }
            for (int observation = 0; observation < numberObservationClasses; observation++) {
                result.setEntry(observation, state,
                        result.getEntry(observation, state) / expectedVisits[state]);
            }
        }
        return result;
    }

}
