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
 * Maps raw integer observation labels onto zero-based indices into the rows of the emission
 * matrix.
 */
public interface ObservationIndexer {

    /**
     * @param observations raw observation labels in temporal order.
     * @param numberOfObservationClasses number K of emission matrix rows.
     *
     * @throws NullPointerException if observations is null
     * @throws IllegalArgumentException if observations is empty
     * @throws ObservationRangeException if the observations cannot be mapped to K classes
     */
    IndexedObservations index(int[] observations, int numberOfObservationClasses);

}
