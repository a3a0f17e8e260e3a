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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * A polyomino: a non-empty, edge-connected set of cell offsets.  Shapes
 * compare equal when their offsets do, so two shapes that differ only by a
 * translation are equal only after {@linkplain #normalize normalization}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Shape {

  private final ImmutableSortedSet<Cell> offsets;

  /**
   * Makes a shape from the given offsets.
   *
   * @throws InvalidPieceShapeException if there are no offsets, an offset is
   *     repeated, or the offsets aren't edge-connected
   */
  public static Shape of(Cell... offsets) {
    return of(Arrays.asList(offsets));
  }

  public static Shape of(Iterable<Cell> offsets) {
    List<Cell> list = Lists.newArrayList(offsets);
    ImmutableSortedSet<Cell> set = ImmutableSortedSet.copyOf(list);
    if (set.isEmpty())
      throw new InvalidPieceShapeException("A shape needs at least one cell");
    if (set.size() != list.size())
      throw new InvalidPieceShapeException("Repeated offset in " + list);
    if (!isConnected(set))
      throw new InvalidPieceShapeException("Disconnected offsets " + set);
    return new Shape(set);
  }

  /**
   * Reads a shape from a picture, one string per row, where {@code #} marks a
   * cell and anything else is empty.
   */
  public static Shape fromPicture(String... lines) {
    return fromPicture(Arrays.asList(lines));
  }

  public static Shape fromPicture(List<String> lines) {
    List<Cell> cells = Lists.newArrayList();
    for (int r = 0; r < lines.size(); ++r) {
      String line = lines.get(r);
      for (int c = 0; c < line.length(); ++c)
        if (line.charAt(c) == '#') cells.add(Cell.of(r, c));
    }
    return of(cells);
  }

  public ImmutableSortedSet<Cell> getOffsets() {
    return offsets;
  }

  public int size() {
    return offsets.size();
  }

  public int minRow() {
    int answer = Integer.MAX_VALUE;
    for (Cell c : offsets) answer = Math.min(answer, c.row);
    return answer;
  }

  public int minColumn() {
    int answer = Integer.MAX_VALUE;
    for (Cell c : offsets) answer = Math.min(answer, c.column);
    return answer;
  }

  /** The number of rows this shape spans. */
  public int height() {
    return offsets.last().row - offsets.first().row + 1;
  }

  /** The number of columns this shape spans. */
  public int width() {
    int max = Integer.MIN_VALUE;
    for (Cell c : offsets) max = Math.max(max, c.column);
    return max - minColumn() + 1;
  }

  public boolean isNormalized() {
    return minRow() == 0 && minColumn() == 0;
  }

  /**
   * Translates this shape so its minimum row and minimum column are both 0.
   * Two shapes are the same up to translation exactly when their normalized
   * forms are equal.
   */
  public Shape normalize() {
    if (isNormalized()) return this;
    return translate(Cell.of(-minRow(), -minColumn()));
  }

  /** Rotates this shape a quarter turn clockwise, about the origin. */
  public Shape rotate() {
    ImmutableSortedSet.Builder<Cell> builder = ImmutableSortedSet.naturalOrder();
    for (Cell c : offsets) builder.add(Cell.of(c.column, -c.row));
    return new Shape(builder.build());
  }

  /** Mirrors this shape left to right, about the origin's column. */
  public Shape reflect() {
    ImmutableSortedSet.Builder<Cell> builder = ImmutableSortedSet.naturalOrder();
    for (Cell c : offsets) builder.add(Cell.of(c.row, -c.column));
    return new Shape(builder.build());
  }

  public Shape translate(Cell by) {
    return new Shape(cellsAt(by));
  }

  /** Returns the cells this shape occupies when anchored at the given cell. */
  public ImmutableSortedSet<Cell> cellsAt(Cell anchor) {
    ImmutableSortedSet.Builder<Cell> builder = ImmutableSortedSet.naturalOrder();
    for (Cell c : offsets) builder.add(c.plus(anchor));
    return builder.build();
  }

  /**
   * Returns the distinct normalized orientations of this shape: its four
   * rotations followed by the four rotations of its mirror image, with
   * repeats dropped.  The first element is this shape, normalized.
   */
  public ImmutableList<Shape> orbit() {
    Set<Shape> orientations = Sets.newLinkedHashSet();
    Shape shape = normalize();
    for (int i = 0; i < 4; ++i) {
      orientations.add(shape);
      shape = shape.rotate().normalize();
    }
    shape = shape.reflect().normalize();
    for (int i = 0; i < 4; ++i) {
      orientations.add(shape);
      shape = shape.rotate().normalize();
    }
    return ImmutableList.copyOf(orientations);
  }

  private static boolean isConnected(Set<Cell> cells) {
    Set<Cell> seen = Sets.newHashSet();
    ArrayDeque<Cell> queue = new ArrayDeque<Cell>();
    Cell first = cells.iterator().next();
    seen.add(first);
    queue.add(first);
    while (!queue.isEmpty()) {
      for (Cell n : queue.removeFirst().neighbors()) {
        if (cells.contains(n) && seen.add(n))
          queue.add(n);
      }
    }
    return seen.size() == cells.size();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Shape)) return false;
    return offsets.equals(((Shape) o).offsets);
  }

  @Override public int hashCode() {
    return offsets.hashCode();
  }

  /**
   * Draws the normalized shape with {@code #} for cells and {@code .} for
   * gaps, rows separated by slashes.
   */
  @Override public String toString() {
    Shape shape = normalize();
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < shape.height(); ++r) {
      if (r > 0) sb.append('/');
      for (int c = 0; c < shape.width(); ++c)
        sb.append(shape.offsets.contains(Cell.of(r, c)) ? '#' : '.');
    }
    return sb.toString();
  }

  private Shape(ImmutableSortedSet<Cell> offsets) {
    this.offsets = offsets;
  }
}
