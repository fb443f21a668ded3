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

import java.util.Arrays;

/**
 * Maps the i-th smallest distinct label of a sequence to index i.
 *
 * <p>Supports labels with gaps. Note that the dictionary is built for each sequence, so the
 * same label may be mapped to different indices for sequences with different label sets.
 */
public class DictionaryObservationIndexer implements ObservationIndexer {

    @Override
    public IndexedObservations index(int[] observations, int numberOfObservationClasses) {
        IndexedObservations.checkObservations(observations);

        final int[] labels = IndexedObservations.distinctSortedLabels(observations);
        if (labels.length > numberOfObservationClasses) {
            throw new ObservationRangeException(String.format(
                    "Observations contain %d distinct labels but the model has only %d "
                    + "observation classes.", labels.length, numberOfObservationClasses));
        }

        final int[] indices = new int[observations.length];
        for (int t = 0; t < observations.length; t++) {
            indices[t] = Arrays.binarySearch(labels, observations[t]);
        }
        return new IndexedObservations(indices, labels);
    }

}
