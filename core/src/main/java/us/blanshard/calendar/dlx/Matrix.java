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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.primitives.Ints;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * An exact-cover problem: a fixed list of columns, identified by arbitrary
 * keys, and a list of rows, each carrying a payload and the set of columns it
 * covers.  Row and column order are exactly the order they were added in.
 *
 * @param <R> the type of the row payloads
 * @author Luke Blanshard
 */
@Immutable
public final class Matrix<R> {

  private final ImmutableList<Object> columns;
  private final ImmutableMap<Object, Integer> columnIndex;
  private final ImmutableList<R> rows;
  private final ImmutableList<int[]> rowColumns;

  private Matrix(Builder<R> builder) {
    this.columns = builder.columns;
    this.columnIndex = builder.columnIndex;
    this.rows = ImmutableList.copyOf(builder.rows);
    this.rowColumns = ImmutableList.copyOf(builder.rowColumns);
  }

  /**
   * Starts building a matrix with the given column keys.
   *
   * @throws IllegalArgumentException if a key appears twice
   */
  public static <R> Builder<R> builder(Iterable<?> columnKeys) {
    return new Builder<R>(columnKeys);
  }

  public static final class Builder<R> {
    private final ImmutableList<Object> columns;
    private final ImmutableMap<Object, Integer> columnIndex;
    private final List<R> rows = Lists.newArrayList();
    private final List<int[]> rowColumns = Lists.newArrayList();

    private Builder(Iterable<?> columnKeys) {
      this.columns = ImmutableList.copyOf(columnKeys);
      ImmutableMap.Builder<Object, Integer> index = ImmutableMap.builder();
      for (int i = 0; i < columns.size(); ++i)
        index.put(columns.get(i), i);
      try {
        this.columnIndex = index.buildOrThrow();
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Duplicate column key in " + columns, e);
      }
    }

    /**
     * Adds a row with the given payload, covering the columns with the given
     * keys.
     *
     * @throws IllegalArgumentException if a key is unknown or repeated, or if
     *     there are no keys
     */
    public Builder<R> addRow(R payload, Iterable<?> columnKeys) {
      checkNotNull(payload);
      List<Integer> indexes = Lists.newArrayList();
      for (Object key : columnKeys) {
        Integer index = columnIndex.get(key);
        checkArgument(index != null, "Unknown column %s", key);
        checkArgument(!indexes.contains(index), "Column %s repeated in row %s", key, payload);
        indexes.add(index);
      }
      checkArgument(!indexes.isEmpty(), "Row %s covers no columns", payload);
      rows.add(payload);
      rowColumns.add(Ints.toArray(indexes));
      return this;
    }

    public Matrix<R> build() {
      return new Matrix<R>(this);
    }
  }

  public int getNumColumns() {
    return columns.size();
  }

  public int getNumRows() {
    return rows.size();
  }

  public ImmutableList<Object> getColumns() {
    return columns;
  }

  public Object getColumn(int index) {
    return columns.get(index);
  }

  public int indexOfColumn(Object key) {
    Integer index = columnIndex.get(key);
    return index == null ? -1 : index;
  }

  public ImmutableList<R> getRows() {
    return rows;
  }

  public R getRow(int index) {
    return rows.get(index);
  }

  /** Returns the indexes of the columns covered by the given row. */
  public int[] columnsOf(int row) {
    return rowColumns.get(row).clone();
  }

  /** Returns a fresh dancing-links structure for this matrix. */
  public DancingLinks toLinks() {
    return new DancingLinks(columns.size(), rowColumns);
  }

  /** Converts row indexes, as found by {@link AlgorithmX}, to payloads. */
  public ImmutableList<R> decode(List<Integer> rowIndexes) {
    ImmutableList.Builder<R> builder = ImmutableList.builder();
    for (int index : rowIndexes)
      builder.add(rows.get(index));
    return builder.build();
  }

  @Override public String toString() {
    return "Matrix[" + columns.size() + " columns, " + rows.size() + " rows]";
  }
}
