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

import java.util.List;

/**
 * Discrete hidden Markov model that is trained with the Baum-Welch algorithm on a single
 * observation sequence and decodes observation sequences with the Viterbi algorithm.
 *
 * <p>Observations are integer labels, which are mapped to emission matrix rows by an
 * {@link ObservationIndexer}. By default, the minimum label of a sequence is mapped to row 0.
 *
 * <p>This class is not thread-safe. Training replaces the current parameters after each
 * completed iteration, so a failed training keeps the parameters of the last completed
 * iteration.
 */
public class DiscreteHmm {

    private final BaumWelchTrainer trainer;
    private final ViterbiAlgorithm viterbi;
    private final ObservationIndexer observationIndexer;

    private HmmParameters parameters;
    private IndexedObservations trainingObservations;

    /**
     * @param augmentedTransitionMatrix (N+1) x (N+1) transition matrix with the initial state
     * distribution in column N, see
     * {@link HmmParameters#fromAugmentedTransitionMatrix(double[][], double[][])}.
     * @param emissionProbabilities K x N emission matrix.
     *
     * @throws InvalidParametersException if the parameters are invalid
     */
    public DiscreteHmm(double[][] augmentedTransitionMatrix, double[][] emissionProbabilities) {
        this(HmmParameters.fromAugmentedTransitionMatrix(augmentedTransitionMatrix,
                emissionProbabilities));
    }

    public DiscreteHmm(HmmParameters parameters) {
        this(parameters, new MinOffsetObservationIndexer(), new BaumWelchParams(),
                new ViterbiAlgorithmParams());
    }

    public DiscreteHmm(HmmParameters parameters, ObservationIndexer observationIndexer,
            BaumWelchParams baumWelchParams, ViterbiAlgorithmParams viterbiParams) {
        if (parameters == null) {
            throw new NullPointerException("parameters must not be null.");
        }
        if (observationIndexer == null) {
            throw new NullPointerException("observationIndexer must not be null.");
        }

        this.parameters = parameters;
        this.observationIndexer = observationIndexer;
        this.trainer = new BaumWelchTrainer(baumWelchParams);
        this.viterbi = new ViterbiAlgorithm(viterbiParams);
    }

    /**
     * Runs the specified number of Baum-Welch iterations on the observation sequence and
     * replaces the current parameters with the result of each iteration.
     *
     * @param observations observation labels in temporal order.
     * @param iterations number of iterations. Zero leaves the parameters unchanged.
     *
     * @throws ObservationRangeException if the observations need more observation classes than
     * the model has. The parameters are not changed in this case.
     * @throws DegenerateNormalizerException if an iteration fails. The parameters of the last
     * completed iteration are kept.
     */
    public void train(int[] observations, int iterations) {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must not be negative but is "
                    + iterations + ".");
        }
        final IndexedObservations indexedObservations =
                observationIndexer.index(observations, parameters.numberOfObservationClasses());
        trainingObservations = indexedObservations;
        trainer.train(parameters, indexedObservations, iterations,
                (iteration, newParameters) -> parameters = newParameters);
    }

    /**
     * Computes the most likely sequence of hidden states for the observation sequence using
     * the current parameters. Does not change the parameters.
     *
     * @return hidden state index for each observation.
     */
    public List<Integer> decode(int[] observations) {
        return decodeWithDetails(observations).mostLikelySequence;
    }

    /**
     * Like {@link #decode(int[])} but also returns the additional results requested in the
     * {@link ViterbiAlgorithmParams}.
     */
    public ViterbiAlgorithm.Result decodeWithDetails(int[] observations) {
        return viterbi.compute(parameters,
                observationIndexer.index(observations, parameters.numberOfObservationClasses()));
    }

    /**
     * Returns the current parameters.
     */
    public HmmParameters parameters() {
        return parameters;
    }

    /**
     * Returns the observations of the last {@link #train(int[], int)} call or null if the
     * model has not been trained. The distinct labels can be used to label the rows of the
     * emission matrix.
     */
    public IndexedObservations trainingObservations() {
        return trainingObservations;
    }

}
