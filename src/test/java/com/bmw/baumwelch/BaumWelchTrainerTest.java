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

import static com.bmw.baumwelch.UmbrellaExample.NO_UMBRELLA;
import static com.bmw.baumwelch.UmbrellaExample.UMBRELLA;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

public class BaumWelchTrainerTest {

    private static final double DELTA = 1e-7;

    private final HmmParameters parameters = UmbrellaExample.parameters();
    private final IndexedObservations observations =
            UmbrellaExample.observations(UMBRELLA, UMBRELLA, NO_UMBRELLA, UMBRELLA);

    @Test
    public void testZeroIterations() {
        final HmmParameters trained = new BaumWelchTrainer().train(parameters, observations, 0);

        assertSame(parameters, trained);
    }

    @Test
    public void testFiveIterationsKeepParametersValid() {
        final HmmParameters trained = new BaumWelchTrainer().train(parameters, observations, 5);

        assertValid(trained);
    }

    @Test
    public void testSingleIterationIsOneUpdate() {
        final BaumWelchTrainer trainer = new BaumWelchTrainer();
        final Posteriors posteriors = Posteriors.compute(parameters, observations,
                new ForwardBackwardAlgorithm().apply(parameters, observations));

        assertEquals(ParameterUpdater.update(parameters, observations, posteriors),
                trainer.iterate(parameters, observations));
        assertEquals(UmbrellaExample.parameters(), parameters);
    }

    @Test
    public void testListenerIsNotifiedAfterEachIteration() {
        final List<HmmParameters> history = new ArrayList<>();
        final List<Integer> iterations = new ArrayList<>();

        final HmmParameters trained = new BaumWelchTrainer().train(parameters, observations, 3,
                (iteration, newParameters) -> {
                    iterations.add(iteration);
                    history.add(newParameters);
                });

        assertEquals(3, history.size());
        assertEquals(1, (int) iterations.get(0));
        assertEquals(3, (int) iterations.get(2));
        assertSame(trained, history.get(2));
        assertEquals(new BaumWelchTrainer().iterate(history.get(0), observations),
                history.get(1));
    }

    @Test
    public void testScaledTrainingMatchesUnscaledTraining() {
        final HmmParameters unscaled = new BaumWelchTrainer().train(parameters, observations, 5);
        final HmmParameters scaled = new BaumWelchTrainer(
                new BaumWelchParams().setScaleProbabilities(true))
                .train(parameters, observations, 5);

        assertMatrixEquals(unscaled.transitionMatrix(), scaled.transitionMatrix(), 1e-10);
        assertMatrixEquals(unscaled.emissionMatrix(), scaled.emissionMatrix(), 1e-10);
        for (int state = 0; state < unscaled.numberOfStates(); state++) {
            assertEquals(unscaled.initialProbability(state), scaled.initialProbability(state),
                    1e-10);
        }
    }

    @Test
    public void testTrainingIncreasesObservationProbability() {
        final ForwardBackwardAlgorithm forwardBackward = new ForwardBackwardAlgorithm();
        final double before =
                forwardBackward.apply(parameters, observations).observationLogProbability();

        final HmmParameters trained = new BaumWelchTrainer().train(parameters, observations, 5);

        final double after =
                forwardBackward.apply(trained, observations).observationLogProbability();
        assertTrue(after > before);
    }

    @Test
    public void testTrainingWithStopProbabilities() {
        final HmmParameters withStop = HmmParameters.fromAugmentedTransitionMatrix(
                new double[][] {{0.6, 0.3, 0.4}, {0.3, 0.6, 0.4}, {0.1, 0.1, 0.2}},
                UmbrellaExample.emissionMatrix());

        final HmmParameters trained = new BaumWelchTrainer().train(withStop, observations, 3);

        assertValid(trained);
        for (int column = 0; column <= trained.numberOfStates(); column++) {
            assertEquals(0.0, trained.stopProbability(column), 0.0);
        }
    }

    @Test(expected = DegenerateNormalizerException.class)
    public void testSubnormalSequenceProbabilityWithoutScaling() {
        final IndexedObservations longObservations =
                UmbrellaExample.observations(UmbrellaExample.periodicObservations(945));

        new BaumWelchTrainer().train(parameters, longObservations, 1);
    }

    @Test
    public void testLongSequenceWithScaling() {
        final IndexedObservations longObservations =
                UmbrellaExample.observations(UmbrellaExample.periodicObservations(945));

        final HmmParameters trained = new BaumWelchTrainer(
                new BaumWelchParams().setScaleProbabilities(true))
                .train(parameters, longObservations, 3);

        assertValid(trained);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeIterations() {
        new BaumWelchTrainer().train(parameters, observations, -1);
    }

    @Test(expected = NullPointerException.class)
    public void testNullParams() {
        new BaumWelchTrainer(null);
    }

    static void assertValid(HmmParameters parameters) {
        final RealMatrix transition = parameters.transitionMatrix();
        final RealMatrix emission = parameters.emissionMatrix();
        double initialSum = 0.0;
        for (int state = 0; state < parameters.numberOfStates(); state++) {
            initialSum += parameters.initialProbability(state);
            assertColumnIsDistribution(transition, state);
            assertColumnIsDistribution(emission, state);
        }
        assertEquals(1.0, initialSum, DELTA);
    }

    private static void assertColumnIsDistribution(RealMatrix matrix, int column) {
        double sum = 0.0;
        for (int row = 0; row < matrix.getRowDimension(); row++) {
            final double probability = matrix.getEntry(row, column);
            assertTrue(Double.isFinite(probability));
            assertTrue(probability >= 0.0);
            sum += probability;
        }
        assertEquals(1.0, sum, DELTA);
    }

    private static void assertMatrixEquals(RealMatrix expected, RealMatrix actual, double delta) {
        assertEquals(expected.getRowDimension(), actual.getRowDimension());
        assertEquals(expected.getColumnDimension(), actual.getColumnDimension());
        for (int row = 0; row < expected.getRowDimension(); row++) {
            for (int column = 0; column < expected.getColumnDimension(); column++) {
                assertEquals(expected.getEntry(row, column), actual.getEntry(row, column), delta);
            }
        }
    }

}
