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
import static com.bmw.baumwelch.UmbrellaExample.RAIN;
import static com.bmw.baumwelch.UmbrellaExample.SUN;
import static com.bmw.baumwelch.UmbrellaExample.UMBRELLA;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class ParameterUpdaterTest {

    private static final double DELTA = 1e-10;

    private final HmmParameters parameters = UmbrellaExample.parameters();
    private final IndexedObservations observations =
            UmbrellaExample.observations(UMBRELLA, UMBRELLA, NO_UMBRELLA, UMBRELLA);

    private HmmParameters update() {
        final Posteriors posteriors = Posteriors.compute(parameters, observations,
                new ForwardBackwardAlgorithm().apply(parameters, observations));
        return ParameterUpdater.update(parameters, observations, posteriors);
    }

    @Test
    public void testInitialProbabilitiesAreFirstMarginalPosteriors() {
        final HmmParameters updated = update();

        assertEquals(0.8662471679807356, updated.initialProbability(RAIN), DELTA);
        assertEquals(0.13375283201926444, updated.initialProbability(SUN), DELTA);
    }

    @Test
    public void testTransitionProbabilities() {
        final HmmParameters updated = update();

        assertEquals(0.6474587391081497, updated.transitionProbability(RAIN, RAIN), DELTA);
        assertEquals(0.35254126089185045, updated.transitionProbability(RAIN, SUN), DELTA);
        assertEquals(0.539555102592635, updated.transitionProbability(SUN, RAIN), DELTA);
        assertEquals(0.46044489740736505, updated.transitionProbability(SUN, SUN), DELTA);
    }

    @Test
    public void testEmissionProbabilities() {
        final HmmParameters updated = update();

        assertEquals(0.8947338526937587, updated.emissionProbability(UMBRELLA, RAIN), DELTA);
        assertEquals(0.10526614730624127, updated.emissionProbability(NO_UMBRELLA, RAIN), DELTA);
        assertEquals(0.45039624968887215, updated.emissionProbability(UMBRELLA, SUN), DELTA);
        assertEquals(0.5496037503111278, updated.emissionProbability(NO_UMBRELLA, SUN), DELTA);
    }

    @Test
    public void testInputParametersAreNotChanged() {
        update();

        assertEquals(UmbrellaExample.parameters(), parameters);
    }

    @Test
    public void testUnobservedClassGetsZeroEmissionProbability() {
        final HmmParameters threeClasses = new HmmParameters(new double[] {0.5, 0.5},
                new double[][] {{0.7, 0.3}, {0.3, 0.7}},
                new double[][] {{0.5, 0.2}, {0.3, 0.4}, {0.2, 0.4}});
        final IndexedObservations sequence = IndexedObservations.of(new int[] {0, 2, 0}, 3);
        final Posteriors posteriors = Posteriors.compute(threeClasses, sequence,
                new ForwardBackwardAlgorithm().apply(threeClasses, sequence));

        final HmmParameters updated = ParameterUpdater.update(threeClasses, sequence,
                posteriors);

        assertEquals(0.0, updated.emissionProbability(1, RAIN), 0.0);
        assertEquals(0.0, updated.emissionProbability(1, SUN), 0.0);
        assertEquals(1.0, updated.emissionProbability(0, SUN)
                + updated.emissionProbability(2, SUN), DELTA);
    }

    @Test(expected = DegenerateNormalizerException.class)
    public void testSingleObservation() {
        final IndexedObservations sequence = UmbrellaExample.observations(UMBRELLA);
        final Posteriors posteriors = Posteriors.compute(parameters, sequence,
                new ForwardBackwardAlgorithm().apply(parameters, sequence));
        ParameterUpdater.update(parameters, sequence, posteriors);
    }

    @Test(expected = DegenerateNormalizerException.class)
    public void testUnreachableState() {
        final HmmParameters unreachable = new HmmParameters(new double[] {1.0, 0.0},
                new double[][] {{1.0, 0.5}, {0.0, 0.5}}, new double[][] {{0.5, 0.5}, {0.5, 0.5}});
        final IndexedObservations sequence = IndexedObservations.of(new int[] {0, 1, 0}, 2);
        final Posteriors posteriors = Posteriors.compute(unreachable, sequence,
                new ForwardBackwardAlgorithm().apply(unreachable, sequence));
        ParameterUpdater.update(unreachable, sequence, posteriors);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPosteriorsOfOtherSequence() {
        final IndexedObservations other = UmbrellaExample.observations(UMBRELLA, UMBRELLA);
        final Posteriors posteriors = Posteriors.compute(parameters, other,
                new ForwardBackwardAlgorithm().apply(parameters, other));
        ParameterUpdater.update(parameters, observations, posteriors);
    }

}
