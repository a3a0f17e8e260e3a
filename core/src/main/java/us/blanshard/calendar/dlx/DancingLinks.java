/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.calendar.dlx;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Knuth's dancing links: a sparse 0/1 matrix held as circular doubly-linked
 * lists, supporting constant-time removal and exact reinsertion of columns
 * and of the rows that intersect them.
 *
 * <p> The nodes live in parallel arrays and link to each other by index.
 * Node 0 is the root of the column header list, nodes 1 through the number
 * of columns are the column headers, and the remaining nodes are the
 * intersections of rows with columns, row by row.
 *
 * <p> Columns must be uncovered in the reverse of the order they were
 * covered; this class enforces that with a stack.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class DancingLinks {

  /** Returned by {@link #chooseColumn} when every column is covered. */
  public static final int EXHAUSTED = -1;

  private static final int ROOT = 0;

  private final int numColumns;
  private final int numRows;

  private final int[] left;
  private final int[] right;
  private final int[] up;
  private final int[] down;
  private final int[] columnOf;  // Column index of each node, -1 for the root
  private final int[] rowOf;  // Row index of each node, -1 for the root and headers
  private final int[] rowStarts;  // First node of each row, plus a sentinel
  private final int[] sizes;  // Live row count per column

  private final int[] coverStack;
  private final boolean[] covered;
  private int coverDepth;

  /**
   * Builds the structure for a matrix with the given number of columns and the
   * given rows, each row listing the indexes of the columns it intersects.
   *
   * @throws IllegalArgumentException if a row is empty or names the same
   *     column twice
   * @throws IndexOutOfBoundsException if a row names a column out of range
   */
  public DancingLinks(int numColumns, List<int[]> rows) {
    checkArgument(numColumns >= 0, "Negative column count %s", numColumns);
    this.numColumns = numColumns;
    this.numRows = rows.size();

    int numNodes = 1 + numColumns;
    for (int[] row : rows) {
      checkArgument(row.length > 0, "Empty row");
      numNodes += row.length;
    }
    left = new int[numNodes];
    right = new int[numNodes];
    up = new int[numNodes];
    down = new int[numNodes];
    columnOf = new int[numNodes];
    rowOf = new int[numNodes];
    rowStarts = new int[numRows + 1];
    sizes = new int[numColumns];
    coverStack = new int[numColumns];
    covered = new boolean[numColumns];

    // The header list: root, then each column in declaration order.
    for (int node = 0; node <= numColumns; ++node) {
      left[node] = node == 0 ? numColumns : node - 1;
      right[node] = node == numColumns ? 0 : node + 1;
      up[node] = down[node] = node;
      columnOf[node] = node - 1;
      rowOf[node] = -1;
    }

    int node = numColumns + 1;
    for (int r = 0; r < numRows; ++r) {
      int[] row = rows.get(r);
      boolean[] seen = new boolean[numColumns];
      int first = node;
      rowStarts[r] = first;
      for (int c : row) {
        checkElementIndex(c, numColumns, "column");
        checkArgument(!seen[c], "Column %s repeated in row %s", c, r);
        seen[c] = true;
        int header = c + 1;
        columnOf[node] = c;
        rowOf[node] = r;
        up[node] = up[header];
        down[node] = header;
        down[up[header]] = node;
        up[header] = node;
        ++sizes[c];
        left[node] = node == first ? first + row.length - 1 : node - 1;
        right[node] = node == first + row.length - 1 ? first : node + 1;
        ++node;
      }
    }
    rowStarts[numRows] = node;
  }

  private DancingLinks(DancingLinks that) {
    this.numColumns = that.numColumns;
    this.numRows = that.numRows;
    this.left = that.left.clone();
    this.right = that.right.clone();
    this.up = that.up.clone();
    this.down = that.down.clone();
    this.columnOf = that.columnOf;  // Never modified after construction
    this.rowOf = that.rowOf;
    this.rowStarts = that.rowStarts;
    this.sizes = that.sizes.clone();
    this.coverStack = that.coverStack.clone();
    this.covered = that.covered.clone();
    this.coverDepth = that.coverDepth;
  }

  /**
   * Returns an independent structure in exactly this one's state, including
   * its stack of covered columns.
   */
  public DancingLinks copy() {
    return new DancingLinks(this);
  }

  public int getNumColumns() {
    return numColumns;
  }

  public int getNumRows() {
    return numRows;
  }

  /** Tells whether the given column is currently covered. */
  public boolean isCovered(int column) {
    checkElementIndex(column, numColumns, "column");
    return covered[column];
  }

  /** Tells whether every column has been covered. */
  public boolean isExhausted() {
    return right[ROOT] == ROOT;
  }

  /** Returns the number of rows still intersecting the given column. */
  public int size(int column) {
    checkElementIndex(column, numColumns, "column");
    return sizes[column];
  }

  /** Returns the uncovered columns, in declaration order. */
  public int[] liveColumns() {
    int[] answer = new int[numColumns - coverDepth];
    int i = 0;
    for (int h = right[ROOT]; h != ROOT; h = right[h])
      answer[i++] = columnOf[h];
    return answer;
  }

  /**
   * Returns the rows currently intersecting the given column, top to bottom,
   * which is the order the rows were supplied in.
   */
  public int[] rowsOf(int column) {
    checkElementIndex(column, numColumns, "column");
    int header = column + 1;
    int[] answer = new int[sizes[column]];
    int i = 0;
    for (int node = down[header]; node != header; node = down[node])
      answer[i++] = rowOf[node];
    return answer;
  }

  /** Returns the columns of the given row, in the order they were supplied. */
  public int[] columnsOf(int row) {
    checkElementIndex(row, numRows, "row");
    int[] answer = new int[rowStarts[row + 1] - rowStarts[row]];
    for (int i = 0; i < answer.length; ++i)
      answer[i] = columnOf[rowStarts[row] + i];
    return answer;
  }

  /**
   * Returns the live column with the fewest rows, preferring the earliest
   * declared column among equals, or {@link #EXHAUSTED} if all columns are
   * covered.
   */
  public int chooseColumn() {
    int best = EXHAUSTED;
    int bestSize = Integer.MAX_VALUE;
    for (int h = right[ROOT]; h != ROOT; h = right[h]) {
      int c = columnOf[h];
      if (sizes[c] < bestSize) {
        best = c;
        bestSize = sizes[c];
        if (bestSize == 0) break;
      }
    }
    return best;
  }

  /**
   * Removes the given column from the header list, and every row that
   * intersects it from all of that row's other columns.  The column's own
   * list of rows is left intact for {@link #uncover}.
   */
  public void cover(int column) {
    checkElementIndex(column, numColumns, "column");
    checkState(!covered[column], "Column %s is already covered", column);
    int header = column + 1;
    right[left[header]] = right[header];
    left[right[header]] = left[header];
    for (int i = down[header]; i != header; i = down[i]) {
      for (int j = right[i]; j != i; j = right[j]) {
        up[down[j]] = up[j];
        down[up[j]] = down[j];
        --sizes[columnOf[j]];
      }
    }
    covered[column] = true;
    coverStack[coverDepth++] = column;
  }

  /**
   * Reverses the most recent {@link #cover} that has not yet been reversed.
   *
   * @throws IllegalStateException if the given column is not the one most
   *     recently covered
   */
  public void uncover(int column) {
    checkElementIndex(column, numColumns, "column");
    checkState(coverDepth > 0 && coverStack[coverDepth - 1] == column,
        "Column %s is not the most recently covered one", column);
    int header = column + 1;
    for (int i = up[header]; i != header; i = up[i]) {
      for (int j = left[i]; j != i; j = left[j]) {
        ++sizes[columnOf[j]];
        up[down[j]] = j;
        down[up[j]] = j;
      }
    }
    right[left[header]] = header;
    left[right[header]] = header;
    covered[column] = false;
    --coverDepth;
  }

  /**
   * Returns a copy of every mutable link, for checking that a sequence of
   * covers and uncovers restored the structure.
   */
  int[][] linkState() {
    return new int[][] {
      left.clone(), right.clone(), up.clone(), down.clone(), sizes.clone()
    };
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("DancingLinks[");
    sb.append(numColumns).append(" columns, ").append(numRows).append(" rows, live ");
    sb.append(Arrays.toString(liveColumns()));
    sb.append(", sizes ").append(Ints.join(",", sizes)).append(']');
    return sb.toString();
  }
}
