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

import com.google.common.collect.ImmutableSortedSet;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * The playing surface: a rectangle of rows and columns, not all of whose
 * cells need be part of the board.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Board {

  public final int rows;
  public final int columns;
  private final ImmutableSortedSet<Cell> cells;

  public static Board rectangle(int rows, int columns) {
    ImmutableSortedSet.Builder<Cell> builder = ImmutableSortedSet.naturalOrder();
    for (int r = 0; r < rows; ++r)
      for (int c = 0; c < columns; ++c)
        builder.add(Cell.of(r, c));
    return new Board(rows, columns, builder.build());
  }

  /**
   * Reads a board from a picture, one string per row, where {@code #} marks a
   * cell of the board and anything else is a hole.  The board is as wide as
   * the longest row.
   */
  public static Board fromPicture(String... lines) {
    return fromPicture(Arrays.asList(lines));
  }

  public static Board fromPicture(List<String> lines) {
    ImmutableSortedSet.Builder<Cell> builder = ImmutableSortedSet.naturalOrder();
    int columns = 0;
    for (int r = 0; r < lines.size(); ++r) {
      String line = lines.get(r);
      columns = Math.max(columns, line.length());
      for (int c = 0; c < line.length(); ++c)
        if (line.charAt(c) == '#') builder.add(Cell.of(r, c));
    }
    return new Board(lines.size(), columns, builder.build());
  }

  /** Tells whether the given cell lies within this board's rectangle. */
  public boolean inBounds(Cell cell) {
    return cell.row >= 0 && cell.row < rows && cell.column >= 0 && cell.column < columns;
  }

  /** Tells whether the given cell is part of the board. */
  public boolean contains(Cell cell) {
    return cells.contains(cell);
  }

  /** The board's cells, in row-major order. */
  public ImmutableSortedSet<Cell> getCells() {
    return cells;
  }

  public int size() {
    return cells.size();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Board)) return false;
    Board that = (Board) o;
    return this.rows == that.rows && this.columns == that.columns && this.cells.equals(that.cells);
  }

  @Override public int hashCode() {
    return cells.hashCode() * 31 + rows * 17 + columns;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < rows; ++r) {
      for (int c = 0; c < columns; ++c)
        sb.append(contains(Cell.of(r, c)) ? '#' : '.');
      sb.append('\n');
    }
    return sb.toString();
  }

  private Board(int rows, int columns, ImmutableSortedSet<Cell> cells) {
    checkArgument(rows > 0 && columns > 0, "Empty board: %s x %s", rows, columns);
    this.rows = rows;
    this.columns = columns;
    this.cells = cells;
  }
}
