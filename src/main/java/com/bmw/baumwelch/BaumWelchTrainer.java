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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Estimates HMM parameters from a single observation sequence with the Baum-Welch algorithm.
 *
 * <p>Runs a fixed number of iterations. There is no convergence check and no early stopping.
 * Each iteration computes new parameters from the parameters of the previous iteration, the
 * passed parameters are never changed.
 */
public class BaumWelchTrainer {

    private static final Logger logger = LogManager.getLogger(BaumWelchTrainer.class);

    /**
     * Receives the parameters of each completed iteration.
     */
    public interface IterationListener {

        /**
         * @param iteration one-based number of the completed iteration.
         */
        void iterationCompleted(int iteration, HmmParameters parameters);

    }

    private final BaumWelchParams params;
    private final ForwardBackwardAlgorithm forwardBackwardAlgorithm;

    public BaumWelchTrainer() {
        this(new BaumWelchParams());
    }

    public BaumWelchTrainer(BaumWelchParams params) {
        if (params == null) {
            throw new NullPointerException("params must not be null.");
        }

        this.params = params;
        this.forwardBackwardAlgorithm =
                new ForwardBackwardAlgorithm(params.isScaleProbabilities());
    }

    /**
     * See {@link #train(HmmParameters, IndexedObservations, int, IterationListener)}.
     */
    public HmmParameters train(HmmParameters initialParameters,
            IndexedObservations observations, int iterations) {
        return train(initialParameters, observations, iterations, null);
    }

    /**
     * Runs the specified number of expectation and maximization steps.
     *
     * @param iterations number of iterations. Zero returns the initial parameters.
     * @param listener optional listener notified after each iteration.
     * @return the parameters after the last iteration.
     *
     * @throws IllegalArgumentException if iterations is negative
     * @throws DegenerateNormalizerException if a posterior or update normalizer is zero. The
     * listener has been notified of all iterations completed before.
     */
    public HmmParameters train(HmmParameters initialParameters,
            IndexedObservations observations, int iterations, IterationListener listener) {
        ForwardBackwardAlgorithm.checkArguments(initialParameters, observations);
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must not be negative but is "
                    + iterations + ".");
        }

        logger.info("Training an HMM with {} hidden states and {} observation classes using {} "
                + "observations and {} iterations", initialParameters.numberOfStates(),
                initialParameters.numberOfObservationClasses(), observations.length(),
                iterations);

        HmmParameters parameters = initialParameters;
        for (int iteration = 1; iteration <= iterations; iteration++) {
            parameters = iterate(parameters, observations);
            logger.debug("Finished iteration {} of {}", iteration, iterations);
            if (listener != null) {
                listener.iterationCompleted(iteration, parameters);
            }
        }
        return parameters;
    }

    /**
     * Runs a single expectation and maximization step.
     *
     * @return new parameters, the passed parameters are not changed.
     */
    public HmmParameters iterate(HmmParameters parameters, IndexedObservations observations) {
        final ForwardBackwardResult forwardBackward =
                forwardBackwardAlgorithm.apply(parameters, observations);
        if (params.isLogObservationProbability() && logger.isDebugEnabled()) {
            logger.debug("Observation log probability: {}",
                    forwardBackward.observationLogProbability());
        }

        final Posteriors posteriors = Posteriors.compute(parameters, observations,
                forwardBackward);
        return ParameterUpdater.update(parameters, observations, posteriors);
    }

    public BaumWelchParams params() {
        return params;
    }

}
