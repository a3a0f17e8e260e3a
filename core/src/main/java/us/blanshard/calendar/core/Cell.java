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
package us.blanshard.calendar.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A square on a board, or an offset within a shape.  Rows grow downward and
 * columns grow rightward.  Cells order row-major.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Cell implements Comparable<Cell> {

  private static final Splitter SPLITTER = Splitter.on(',').trimResults();

  public final int row;
  public final int column;

  public static Cell of(int row, int column) {
    return new Cell(row, column);
  }

  /**
   * Parses the form produced by {@link #toJsonValue}: row and column separated
   * by a comma.
   */
  public static Cell fromJsonValue(String value) {
    List<String> parts = SPLITTER.splitToList(value);
    checkArgument(parts.size() == 2, "Bad cell: %s", value);
    Integer row = Ints.tryParse(parts.get(0));
    Integer column = Ints.tryParse(parts.get(1));
    checkArgument(row != null && column != null, "Bad cell: %s", value);
    return of(row, column);
  }

  public String toJsonValue() {
    return row + "," + column;
  }

  public Cell plus(Cell offset) {
    return of(row + offset.row, column + offset.column);
  }

  public Cell minus(Cell offset) {
    return of(row - offset.row, column - offset.column);
  }

  /** The four cells sharing an edge with this one. */
  public Cell[] neighbors() {
    return new Cell[] {
      of(row - 1, column), of(row, column - 1), of(row, column + 1), of(row + 1, column)
    };
  }

  @Override public int compareTo(Cell that) {
    int answer = Integer.compare(this.row, that.row);
    return answer != 0 ? answer : Integer.compare(this.column, that.column);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Cell)) return false;
    Cell that = (Cell) o;
    return this.row == that.row && this.column == that.column;
  }

  @Override public int hashCode() {
    return row * 31 + column;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, column);
  }

  private Cell(int row, int column) {
    this.row = row;
    this.column = column;
  }
}
