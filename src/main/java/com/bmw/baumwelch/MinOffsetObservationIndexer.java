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

/**
 * Subtracts the minimum label from every observation.
 *
 * <p>Assumes that the labels are contiguous integers. If the labels have gaps, the resulting
 * indices skip emission matrix rows, see {@link DictionaryObservationIndexer} for that case.
 */
public class MinOffsetObservationIndexer implements ObservationIndexer {

    @Override
    public IndexedObservations index(int[] observations, int numberOfObservationClasses) {
        IndexedObservations.checkObservations(observations);

        int min = observations[0];
        int max = observations[0];
        for (int observation : observations) {
            min = Math.min(min, observation);
            max = Math.max(max, observation);
        }

        final long maxIndex = (long) max - min;
        if (maxIndex > numberOfObservationClasses - 1) {
            throw new ObservationRangeException(String.format(
                    "Observation labels range from %d to %d, which requires %d observation "
                    + "classes but the model has %d.",
                    min, max, maxIndex + 1, numberOfObservationClasses));
        }

        final int[] indices = new int[observations.length];
        for (int t = 0; t < observations.length; t++) {
            indices[t] = observations[t] - min;
        }
        return new IndexedObservations(indices,
                IndexedObservations.distinctSortedLabels(observations));
    }

}
