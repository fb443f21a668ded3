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
 * Thrown if a normalizer of the forward-backward posteriors or of the parameter update is zero
 * or below {@link Double#MIN_NORMAL}. Continuing would fill the posteriors or the updated
 * parameters with NaN, infinity or distributions that no longer sum to 1.
 *
 * <p>This happens if the observation sequence has (almost) zero probability under the current
 * parameters, if a hidden state has zero posterior probability over the whole sequence or if
 * the sequence is too short to observe a single transition. Without scaling, the sequence
 * probability of long sequences drops below {@link Double#MIN_NORMAL} after several hundred
 * time steps, see {@link BaumWelchParams#setScaleProbabilities(boolean)}.
 */
public class DegenerateNormalizerException extends HmmException {

    private static final long serialVersionUID = 1L;

    public DegenerateNormalizerException(String message) {
        super(message);
    }

}
