/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.integral.algebra;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Solves systems of linear equations over a field. */
public class LinearSystems {
  private LinearSystems() {}

  /**
   * Solves {@code A v = b} by Gaussian elimination.
   *
   * <p>Returns a solution, or null if the system is inconsistent. If the
   * system is under-determined, free variables are set to zero.
   *
   * @param field Field of coefficients
   * @param matrix Rows of A; each row has one entry per unknown
   * @param rhs Entries of b, one per row
   * @param unknownCount Number of unknowns
   */
  public static <E> @Nullable List<E> solve(
      Field<E> field, List<List<E>> matrix, List<E> rhs, int unknownCount) {
    checkArgument(matrix.size() == rhs.size());
    final int rows = matrix.size();
    final List<List<E>> m = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      checkArgument(matrix.get(i).size() == unknownCount);
      final List<E> row = new ArrayList<>(matrix.get(i));
      row.add(rhs.get(i));
      m.add(row);
    }
    final int[] pivotColumns = new int[rows];
    int rank = 0;
    for (int col = 0; col < unknownCount && rank < rows; col++) {
      int pivot = -1;
      for (int r = rank; r < rows; r++) {
        if (!field.isZero(m.get(r).get(col))) {
          pivot = r;
          break;
        }
      }
      if (pivot < 0) {
        continue;
      }
      final List<E> pivotRow = m.get(pivot);
      m.set(pivot, m.get(rank));
      m.set(rank, pivotRow);
      final E inv = field.inverse(pivotRow.get(col));
      for (int c = col; c <= unknownCount; c++) {
        pivotRow.set(c, field.multiply(pivotRow.get(c), inv));
      }
      for (int r = 0; r < rows; r++) {
        if (r == rank) {
          continue;
        }
        final List<E> row = m.get(r);
        final E factor = row.get(col);
        if (field.isZero(factor)) {
          continue;
        }
        for (int c = col; c <= unknownCount; c++) {
          final E product = field.multiply(factor, pivotRow.get(c));
          row.set(c, field.subtract(row.get(c), product));
        }
      }
      pivotColumns[rank++] = col;
    }
    // Rows below the rank must read "0 = 0"
    for (int r = rank; r < rows; r++) {
      if (!field.isZero(m.get(r).get(unknownCount))) {
        return null;
      }
    }
    final List<E> solution = new ArrayList<>(unknownCount);
    for (int i = 0; i < unknownCount; i++) {
      solution.add(field.zero());
    }
    for (int r = 0; r < rank; r++) {
      solution.set(pivotColumns[r], m.get(r).get(unknownCount));
    }
    return solution;
  }
}

// End LinearSystems.java
