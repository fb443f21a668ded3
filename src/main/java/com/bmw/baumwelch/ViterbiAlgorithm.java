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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Implementation of the Viterbi algorithm for stationary discrete HMMs as described e.g. in
 * Rabiner, Juang, An introduction to Hidden Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 *
 * <p>Computes raw probabilities by default, which underflow to zero for long observation
 * sequences. See {@link ViterbiAlgorithmParams#setUseLogProbabilities(boolean)}.
 *
 * <p>Ties between equally likely predecessors or final states are broken in favour of the
 * lowest state index.
 */
public class ViterbiAlgorithm {

    /**
     * Contains the most likely sequence and additional results of the Viterbi algorithm.
     */
    public static class Result {

        /**
         * Hidden state index for each time step.
         */
        public final List<Integer> mostLikelySequence;

        /**
         * Joint probability of the most likely sequence and the observations. Is a log
         * probability if log probabilities are used.
         */
        public final double score;

        /**
         * N x T matrix of computed messages for each time step. Is null if the message history
         * is not kept.
         *
         * <p>messageHistory.getEntry(i, t) contains the probability of the most likely sequence
         * ending in state i with the observations up to t.
         * Formally, this is max p(s_1, ..., s_t = i, o_1, ..., o_t) w.r.t. s_1, ..., s_{t-1}.
         */
        public final RealMatrix messageHistory;

        /**
         * Posterior probability of each state of the most likely sequence given all
         * observations. Is null if smoothing probabilities are not computed.
         */
        public final List<Double> smoothingProbabilities;

        Result(List<Integer> mostLikelySequence, double score, RealMatrix messageHistory,
                List<Double> smoothingProbabilities) {
            this.mostLikelySequence = mostLikelySequence;
            this.score = score;
            this.messageHistory = messageHistory;
            this.smoothingProbabilities = smoothingProbabilities;
        }
    }

    private final ViterbiAlgorithmParams params;

    public ViterbiAlgorithm() {
        this(new ViterbiAlgorithmParams());
    }

    public ViterbiAlgorithm(ViterbiAlgorithmParams params) {
        if (params == null) {
            throw new NullPointerException("params must not be null.");
        }

        this.params = params;
    }

    /**
     * Returns the most likely sequence of states for all time steps.
     * Formally, this is argmax p(s_1, ..., s_T | o_1, ..., o_T) with respect to s_1, ..., s_T,
     * where s_t is a state at time step t, o_t is the observation at time step t and T is
     * the number of time steps.
     */
    public List<Integer> computeMostLikelySequence(HmmParameters parameters,
            IndexedObservations observations) {
        return compute(parameters, observations).mostLikelySequence;
    }

    /**
     * Like {@link #computeMostLikelySequence(HmmParameters, IndexedObservations)} but also
     * returns the additional results requested in the {@link ViterbiAlgorithmParams}.
     *
     * @throws DegenerateNormalizerException if smoothing probabilities are requested and the
     * observations have zero probability
     */
    public Result compute(HmmParameters parameters, IndexedObservations observations) {
        ForwardBackwardAlgorithm.checkArguments(parameters, observations);

        final int numberStates = parameters.numberOfStates();
        final int length = observations.length();
        final RealMatrix scores = new Array2DRowRealMatrix(numberStates, length);
        // Back pointers of time step 0 are never read.
        final int[][] backPointers = new int[numberStates][length];

        // score[i][0] = pi_i * B[y_0][i]
        final int firstObservation = observations.index(0);
        for (int state = 0; state < numberStates; state++) {
            scores.setEntry(state, 0, combine(parameters.initialProbability(state),
                    parameters.emissionProbability(firstObservation, state)));
        }

        // candidate[i][j] = score[j][t-1] * A[i][j] * B[y_t][i]
        for (int t = 1; t < length; t++) {
            final int observation = observations.index(t);
            for (int curState = 0; curState < numberStates; curState++) {
                final double emissionProbability =
                        parameters.emissionProbability(observation, curState);
                int maxPrevState = 0;
                double maxScore = candidateScore(parameters, scores, t, 0, curState,
                        emissionProbability);
                for (int prevState = 1; prevState < numberStates; prevState++) {
                    final double score = candidateScore(parameters, scores, t, prevState,
                            curState, emissionProbability);
                    if (score > maxScore) {
                        maxScore = score;
                        maxPrevState = prevState;
                    }
                }
                scores.setEntry(curState, t, maxScore);
                backPointers[curState][t] = maxPrevState;
            }
        }

        final int lastState = Utils.argmax(scores.getColumn(length - 1));
        final List<Integer> mostLikelySequence =
                retrieveMostLikelySequence(backPointers, lastState, length);

        return new Result(mostLikelySequence, scores.getEntry(lastState, length - 1),
                params.isKeepMessageHistory() ? scores : null,
                params.isComputeSmoothingProbabilities()
                        ? smoothingProbabilities(parameters, observations, mostLikelySequence)
                        : null);
    }

    public ViterbiAlgorithmParams params() {
        return params;
    }

    private double candidateScore(HmmParameters parameters, RealMatrix scores, int t,
            int prevState, int curState, double emissionProbability) {
        final double pathScore = combine(scores.getEntry(prevState, t - 1),
                parameters.transitionProbability(prevState, curState));
        return combine(pathScore, emissionProbability);
    }

    /**
     * Multiplies a path score with a raw probability.
     */
    private double combine(double score, double probability) {
        if (params.isUseLogProbabilities()) {
            return score + FastMath.log(probability);
        }
        return score * probability;
    }

    /**
     * Retrieves the most likely sequence from the back pointers ending in the specified last
     * state.
     */
    private static List<Integer> retrieveMostLikelySequence(int[][] backPointers, int lastState,
            int length) {
        final List<Integer> result = new ArrayList<>(length);
        int state = lastState;
        result.add(state);
        for (int t = length - 1; t > 0; t--) {
            state = backPointers[state][t];
            result.add(state);
        }
        Collections.reverse(result);
        return result;
    }

    private static List<Double> smoothingProbabilities(HmmParameters parameters,
            IndexedObservations observations, List<Integer> mostLikelySequence) {
        final ForwardBackwardResult forwardBackward =
                new ForwardBackwardAlgorithm(true).apply(parameters, observations);
        final Posteriors posteriors = Posteriors.compute(parameters, observations,
                forwardBackward);
        final List<Double> result = new ArrayList<>(mostLikelySequence.size());
        for (int t = 0; t < mostLikelySequence.size(); t++) {
            result.add(posteriors.marginalPosterior(t, mostLikelySequence.get(t)));
        }
        return result;
    }

}
