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

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Implementation utilities.
 */
class Utils {

    /**
     * Tolerance for checking that probability distributions sum to 1.
     */
    static final double DELTA = 1e-7;

    static boolean sumsToOne(double sum) {
        return Math.abs(sum - 1.0) <= DELTA;
    }

    /**
     * Returns true if the value can be divided by without losing precision, i.e. it is at least
     * {@link Double#MIN_NORMAL}. Zero, subnormal, negative and NaN values are rejected.
     */
    static boolean isNormalizer(double value) {
        return value >= Double.MIN_NORMAL;
    }

    static double columnSum(RealMatrix matrix, int column) {
        double sum = 0.0;
        for (int row = 0; row < matrix.getRowDimension(); row++) {
            sum += matrix.getEntry(row, column);
        }
        return sum;
    }

    static double rowSum(RealMatrix matrix, int row) {
        double sum = 0.0;
        for (int column = 0; column < matrix.getColumnDimension(); column++) {
            sum += matrix.getEntry(row, column);
        }
        return sum;
    }

    /**
     * Returns the index of the maximum value. Ties are resolved in favour of the lowest index.
     */
    static int argmax(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty.");
        }

        int result = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[result]) {
                result = i;
            }
        }
        return result;
    }

    /**
     * Throws if the specified matrices do not have the specified dimensions.
     */
    static void checkDimensions(RealMatrix matrix, int rows, int columns, String name) {
        if (matrix.getRowDimension() != rows || matrix.getColumnDimension() != columns) {
            throw new IllegalArgumentException(String.format(
                    "%s must be a %d x %d matrix but is %d x %d.", name, rows, columns,
                    matrix.getRowDimension(), matrix.getColumnDimension()));
        }
    }

}
