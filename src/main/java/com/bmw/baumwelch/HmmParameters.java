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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Immutable parameters of a discrete hidden Markov model with N hidden states and K
 * observation classes.
 *
 * <p>The parameters consist of
 * <ul>
 *     <li>the initial state distribution pi (length N),</li>
 *     <li>the N x N transition matrix A, where A[j][i] is the probability of moving from
 *     source state i to destination state j, i.e. every column sums to 1,</li>
 *     <li>the K x N emission matrix B, where B[v][i] is the probability of observing class v
 *     in state i, i.e. every column sums to 1.</li>
 * </ul>
 *
 * <p>Alternatively, pi and A can be specified as a single (N+1) x (N+1) augmented transition
 * matrix, see {@link #fromAugmentedTransitionMatrix(double[][], double[][])}. Its STOP row may
 * hold part of the probability mass of a column, which then counts towards the column sum.
 * The forward, backward and Viterbi recursions only use the transitions between real states.
 *
 * <p>Training does not change an instance but produces a new one.
 */
public final class HmmParameters {

    private final double[] initialProbabilities;
    private final RealMatrix transitionProbabilities;
    /**
     * STOP row of the augmented transition matrix, length N+1. Entry N belongs to the START
     * column.
     */
    private final double[] stopProbabilities;
    private final RealMatrix emissionProbabilities;

    /**
     * @param initialProbabilities initial probability of each hidden state, must sum to 1.
     * @param transitionProbabilities N x N matrix, transitionProbabilities[j][i] is the
     * probability of the transition from state i to state j. Every column must sum to 1.
     * @param emissionProbabilities K x N matrix, emissionProbabilities[v][i] is the
     * probability of observation class v in state i. Every column must sum to 1.
     *
     * @throws ShapeMismatchException if the dimensions do not agree
     * @throws InvalidParametersException if any distribution is invalid
     */
    public HmmParameters(double[] initialProbabilities, double[][] transitionProbabilities,
            double[][] emissionProbabilities) {
        this(initialProbabilities, transitionProbabilities, null, emissionProbabilities);
    }

    /**
     * @param stopProbabilities STOP row of the augmented transition matrix or null if it is
     * all zero.
     */
    private HmmParameters(double[] initialProbabilities, double[][] transitionProbabilities,
            double[] stopProbabilities, double[][] emissionProbabilities) {
        if (initialProbabilities == null) {
            throw new NullPointerException("initialProbabilities must not be null.");
        }
        final int numberStates = initialProbabilities.length;
        if (numberStates == 0) {
            throw new ShapeMismatchException("At least one hidden state is required.");
        }
        checkShape(transitionProbabilities, numberStates, numberStates,
                "transitionProbabilities");
        checkShape(emissionProbabilities, -1, numberStates, "emissionProbabilities");

        this.initialProbabilities = initialProbabilities.clone();
        this.transitionProbabilities = new Array2DRowRealMatrix(transitionProbabilities);
        this.stopProbabilities = stopProbabilities != null
                ? stopProbabilities.clone() : new double[numberStates + 1];
        this.emissionProbabilities = new Array2DRowRealMatrix(emissionProbabilities);
        validate();
    }

    /**
     * Used for parameters computed by this library, which are valid by construction.
     * Takes ownership of the passed objects. The STOP row is all zero.
     */
    HmmParameters(double[] initialProbabilities, RealMatrix transitionProbabilities,
            RealMatrix emissionProbabilities) {
        this.initialProbabilities = initialProbabilities;
        this.transitionProbabilities = transitionProbabilities;
        this.stopProbabilities = new double[initialProbabilities.length + 1];
        this.emissionProbabilities = emissionProbabilities;
        assert isColumnStochastic();
    }

    /**
     * Creates parameters from a transition matrix augmented by a START and a STOP pseudo-state.
     *
     * @param augmentedTransitionMatrix (N+1) x (N+1) matrix. Rows and columns 0..N-1 are the
     * hidden states. Column N is the START state, so rows 0..N-1 of column N hold the initial
     * state distribution. Row N is the STOP state. Every column including its STOP entry must
     * sum to 1.
     * @param emissionProbabilities K x N emission matrix.
     *
     * @throws ShapeMismatchException if the dimensions do not agree
     * @throws InvalidParametersException if any distribution is invalid, where column N
     * denotes the initial state distribution
     */
    public static HmmParameters fromAugmentedTransitionMatrix(
            double[][] augmentedTransitionMatrix, double[][] emissionProbabilities) {
        if (augmentedTransitionMatrix == null) {
            throw new NullPointerException("augmentedTransitionMatrix must not be null.");
        }
        final int size = augmentedTransitionMatrix.length;
        checkShape(augmentedTransitionMatrix, size, size, "augmentedTransitionMatrix");
        if (size < 2) {
            throw new ShapeMismatchException("augmentedTransitionMatrix must be at least 2 x 2 "
                    + "to hold one hidden state and the START/STOP states.");
        }

        final int numberStates = size - 1;
        final double[] initialProbabilities = new double[numberStates];
        final double[][] transitionProbabilities = new double[numberStates][];
        for (int state = 0; state < numberStates; state++) {
            initialProbabilities[state] = augmentedTransitionMatrix[state][numberStates];
            transitionProbabilities[state] =
                    Arrays.copyOf(augmentedTransitionMatrix[state], numberStates);
        }
        return new HmmParameters(initialProbabilities, transitionProbabilities,
                augmentedTransitionMatrix[numberStates].clone(), emissionProbabilities);
    }

    /**
     * Returns the number N of hidden states.
     */
    public int numberOfStates() {
        return initialProbabilities.length;
    }

    /**
     * Returns the number K of observation classes.
     */
    public int numberOfObservationClasses() {
        return emissionProbabilities.getRowDimension();
    }

    public double initialProbability(int state) {
        return initialProbabilities[state];
    }

    /**
     * Returns the probability of moving from {@code fromState} to {@code toState}.
     */
    public double transitionProbability(int fromState, int toState) {
        return transitionProbabilities.getEntry(toState, fromState);
    }

    /**
     * Returns the probability of observing the observation class with the specified zero-based
     * index in the specified state.
     */
    public double emissionProbability(int observationIndex, int state) {
        return emissionProbabilities.getEntry(observationIndex, state);
    }

    /**
     * Returns the STOP entry of the specified column of the augmented transition matrix, where
     * column N is the START column.
     */
    public double stopProbability(int column) {
        return stopProbabilities[column];
    }

    public double[] initialProbabilities() {
        return initialProbabilities.clone();
    }

    /**
     * Returns a copy of the N x N transition matrix, indexed by [destination][source].
     */
    public RealMatrix transitionMatrix() {
        return transitionProbabilities.copy();
    }

    /**
     * Returns a copy of the K x N emission matrix, indexed by [observation class][state].
     */
    public RealMatrix emissionMatrix() {
        return emissionProbabilities.copy();
    }

    /**
     * Returns the (N+1) x (N+1) transition matrix with the initial distribution in column N and
     * the STOP probabilities in row N, i.e. the format accepted by
     * {@link #fromAugmentedTransitionMatrix(double[][], double[][])}.
     */
    public double[][] augmentedTransitionMatrix() {
        final int numberStates = numberOfStates();
        final double[][] result = new double[numberStates + 1][numberStates + 1];
        for (int toState = 0; toState < numberStates; toState++) {
            for (int fromState = 0; fromState < numberStates; fromState++) {
                result[toState][fromState] = transitionProbability(fromState, toState);
            }
            result[toState][numberStates] = initialProbabilities[toState];
        }
        result[numberStates] = stopProbabilities.clone();
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HmmParameters)) {
            return false;
        }
        final HmmParameters other = (HmmParameters) o;
        return Arrays.equals(initialProbabilities, other.initialProbabilities)
                && transitionProbabilities.equals(other.transitionProbabilities)
                && Arrays.equals(stopProbabilities, other.stopProbabilities)
                && emissionProbabilities.equals(other.emissionProbabilities);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(initialProbabilities);
        result = 31 * result + transitionProbabilities.hashCode();
        result = 31 * result + Arrays.hashCode(stopProbabilities);
        result = 31 * result + emissionProbabilities.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "HmmParameters [states=" + numberOfStates() + ", observationClasses="
                + numberOfObservationClasses() + "]";
    }

    private void validate() {
        final int numberStates = numberOfStates();
        for (int column = 0; column <= numberStates; column++) {
            checkEntries(new double[] {stopProbabilities[column]}, column, "Stop");
        }

        for (int column = 0; column < numberStates; column++) {
            checkEntries(transitionProbabilities.getColumn(column), column, "Transition");
            final double sum = Utils.columnSum(transitionProbabilities, column)
                    + stopProbabilities[column];
            if (!Utils.sumsToOne(sum)) {
                throw new InvalidParametersException(String.format(
                        "Transition probabilities from state %d including STOP sum to %s "
                        + "instead of 1.", column, sum), column);
            }
        }

        // The initial distribution is the START column of the augmented transition matrix.
        checkEntries(initialProbabilities, numberStates, "Initial");
        double initialSum = stopProbabilities[numberStates];
        for (double probability : initialProbabilities) {
            initialSum += probability;
        }
        if (!Utils.sumsToOne(initialSum)) {
            throw new InvalidParametersException(String.format(
                    "Initial state probabilities including STOP sum to %s instead of 1.",
                    initialSum), numberStates);
        }

        for (int column = 0; column < numberStates; column++) {
            checkEntries(emissionProbabilities.getColumn(column), column, "Emission");
            final double sum = Utils.columnSum(emissionProbabilities, column);
            if (!Utils.sumsToOne(sum)) {
                throw new InvalidParametersException(String.format(
                        "Emission probabilities of state %d sum to %s instead of 1.",
                        column, sum), column);
            }
        }
    }

    private static void checkEntries(double[] probabilities, int column, String kind) {
        for (double probability : probabilities) {
            if (!(probability >= 0.0) || Double.isInfinite(probability)) {
                throw new InvalidParametersException(String.format(
                        "%s probability %s in column %d is not a valid probability.",
                        kind, probability, column), column);
            }
        }
    }

    /**
     * @param rows expected number of rows or -1 if any positive number of rows is allowed.
     */
    private static void checkShape(double[][] matrix, int rows, int columns, String name) {
        if (matrix == null) {
            throw new NullPointerException(name + " must not be null.");
        }
        if (matrix.length == 0 || (rows >= 0 && matrix.length != rows)) {
            throw new ShapeMismatchException(String.format("%s must have %s rows but has %d.",
                    name, rows >= 0 ? String.valueOf(rows) : "at least 1", matrix.length));
        }
        for (int row = 0; row < matrix.length; row++) {
            if (matrix[row] == null || matrix[row].length != columns) {
                throw new ShapeMismatchException(String.format(
                        "Row %d of %s must have %d columns.", row, name, columns));
            }
        }
    }

    private boolean isColumnStochastic() {
        for (int column = 0; column < numberOfStates(); column++) {
            if (!Utils.sumsToOne(Utils.columnSum(transitionProbabilities, column)
                    + stopProbabilities[column])
                    || !Utils.sumsToOne(Utils.columnSum(emissionProbabilities, column))) {
                return false;
            }
        }
        double sum = stopProbabilities[numberOfStates()];
        for (double probability : initialProbabilities) {
            sum += probability;
        }
        return Utils.sumsToOne(sum);
    }

}
