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

import java.util.stream.IntStream;

/**
 * Read-only observation sequence whose elements are zero-based emission matrix row indices.
 */
public final class IndexedObservations {

    private final int[] indices;
    private final int[] distinctLabels;

    /**
     * @param indices zero-based observation indices in temporal order.
     * @param distinctLabels sorted distinct raw labels of the indexed sequence.
     */
    IndexedObservations(int[] indices, int[] distinctLabels) {
        this.indices = indices;
        this.distinctLabels = distinctLabels;
    }

    /**
     * Creates an already indexed observation sequence.
     *
     * @throws ObservationRangeException if any index is negative or not less than
     * numberOfObservationClasses
     */
    public static IndexedObservations of(int[] indices, int numberOfObservationClasses) {
        checkObservations(indices);
        for (int t = 0; t < indices.length; t++) {
            if (indices[t] < 0 || indices[t] >= numberOfObservationClasses) {
                throw new ObservationRangeException(String.format(
                        "Observation index %d at time step %d is outside of [0, %d].",
                        indices[t], t, numberOfObservationClasses - 1));
            }
        }
        return new IndexedObservations(indices.clone(), distinctSortedLabels(indices));
    }

    /**
     * Returns the number T of time steps.
     */
    public int length() {
        return indices.length;
    }

    /**
     * Returns the emission matrix row index of the observation at time step t.
     */
    public int index(int t) {
        return indices[t];
    }

    public int[] indices() {
        return indices.clone();
    }

    /**
     * Returns the sorted distinct raw labels of the sequence, e.g. for labelling the rows of the
     * emission matrix.
     */
    public int[] distinctLabels() {
        return distinctLabels.clone();
    }

    /**
     * Returns the largest index of this sequence.
     */
    public int maxIndex() {
        return IntStream.of(indices).max().getAsInt();
    }

    static void checkObservations(int[] observations) {
        if (observations == null) {
            throw new NullPointerException("observations must not be null.");
        }
        if (observations.length == 0) {
            throw new IllegalArgumentException("observations must not be empty.");
        }
    }

    static int[] distinctSortedLabels(int[] observations) {
        return IntStream.of(observations).distinct().sorted().toArray();
    }

}
