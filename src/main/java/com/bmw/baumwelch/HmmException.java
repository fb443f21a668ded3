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
 * Base class of all errors raised because the model parameters or the observations passed to
 * this library are malformed or incompatible with each other.
 *
 * <p>These errors are never transient, so callers should not retry the failed operation with
 * the same input.
 */
public abstract class HmmException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected HmmException(String message) {
        super(message);
    }

}
