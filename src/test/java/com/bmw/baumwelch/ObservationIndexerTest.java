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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class ObservationIndexerTest {

    private final ObservationIndexer minOffsetIndexer = new MinOffsetObservationIndexer();
    private final ObservationIndexer dictionaryIndexer = new DictionaryObservationIndexer();

    @Test
    public void testMinOffset() {
        final IndexedObservations observations =
                minOffsetIndexer.index(new int[] {5, 7, 6, 5}, 3);

        assertEquals(4, observations.length());
        assertArrayEquals(new int[] {0, 2, 1, 0}, observations.indices());
        assertArrayEquals(new int[] {5, 6, 7}, observations.distinctLabels());
        assertEquals(2, observations.maxIndex());
    }

    @Test
    public void testMinOffsetWithNegativeLabels() {
        final IndexedObservations observations = minOffsetIndexer.index(new int[] {-1, 0}, 2);

        assertArrayEquals(new int[] {0, 1}, observations.indices());
    }

    @Test
    public void testMinOffsetKeepsGaps() {
        final IndexedObservations observations = minOffsetIndexer.index(new int[] {1, 3}, 3);

        assertArrayEquals(new int[] {0, 2}, observations.indices());
    }

    @Test(expected = ObservationRangeException.class)
    public void testMinOffsetRangeExceedsObservationClasses() {
        minOffsetIndexer.index(new int[] {0, 1, 2}, 2);
    }

    @Test(expected = ObservationRangeException.class)
    public void testMinOffsetGapExceedsObservationClasses() {
        minOffsetIndexer.index(new int[] {0, 2}, 2);
    }

    @Test(expected = ObservationRangeException.class)
    public void testMinOffsetDoesNotOverflow() {
        minOffsetIndexer.index(new int[] {Integer.MIN_VALUE, Integer.MAX_VALUE}, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyObservations() {
        minOffsetIndexer.index(new int[0], 2);
    }

    @Test(expected = NullPointerException.class)
    public void testNullObservations() {
        dictionaryIndexer.index(null, 2);
    }

    @Test
    public void testDictionaryMapsGapsDensely() {
        final IndexedObservations observations =
                dictionaryIndexer.index(new int[] {10, 30, 20, 30}, 3);

        assertArrayEquals(new int[] {0, 2, 1, 2}, observations.indices());
        assertArrayEquals(new int[] {10, 20, 30}, observations.distinctLabels());
    }

    @Test
    public void testDictionaryAcceptsGapsWithinObservationClasses() {
        final IndexedObservations observations = dictionaryIndexer.index(new int[] {0, 2}, 2);

        assertArrayEquals(new int[] {0, 1}, observations.indices());
    }

    @Test(expected = ObservationRangeException.class)
    public void testDictionaryTooManyDistinctLabels() {
        dictionaryIndexer.index(new int[] {0, 5, 9}, 2);
    }

    @Test
    public void testIndexedObservationsAreReadOnly() {
        final IndexedObservations observations = IndexedObservations.of(new int[] {1, 0}, 2);
        observations.indices()[0] = 0;

        assertEquals(1, observations.index(0));
    }

    @Test(expected = ObservationRangeException.class)
    public void testIndexOutOfRange() {
        IndexedObservations.of(new int[] {0, 2}, 2);
    }

}
