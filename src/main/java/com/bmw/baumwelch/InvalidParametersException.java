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
 * Thrown if a transition or emission matrix is not a valid column-stochastic matrix.
 */
public class InvalidParametersException extends HmmException {

    private static final long serialVersionUID = 1L;

    /**
     * Used if the error is not bound to a single column.
     */
    public static final int NO_COLUMN = -1;

    private final int column;

    public InvalidParametersException(String message) {
        this(message, NO_COLUMN);
    }

    public InvalidParametersException(String message, int column) {
        super(message);
        this.column = column;
    }

    /**
     * Returns the offending column or {@link #NO_COLUMN}.
     */
    public int column() {
        return column;
    }

}
