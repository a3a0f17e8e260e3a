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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A tiling: the placements chosen by the solver, and the board cells they
 * cover.  Solutions are equal when they contain the same placements, in any
 * order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Solution {

  private final ImmutableList<Placement> placements;
  private final ImmutableSortedMap<Cell, Piece> cells;

  /**
   * Decodes the given placements into a solution.
   *
   * @throws MalformedSolutionException if two placements claim the same cell,
   *     or the same piece is placed twice
   */
  public static Solution decode(Iterable<Placement> placements) {
    Map<Cell, Piece> cells = Maps.newHashMap();
    Set<Piece> pieces = Sets.newHashSet();
    for (Placement placement : placements) {
      if (!pieces.add(placement.piece))
        throw new MalformedSolutionException("Piece " + placement.piece + " placed twice");
      for (Cell cell : placement.cells) {
        Piece prev = cells.put(cell, placement.piece);
        if (prev != null) {
          throw new MalformedSolutionException(
              "Cell " + cell + " claimed by both " + prev + " and " + placement.piece);
        }
      }
    }
    return new Solution(ImmutableList.copyOf(placements), ImmutableSortedMap.copyOf(cells));
  }

  public ImmutableList<Placement> getPlacements() {
    return placements;
  }

  /** The board cells covered by this solution, mapped to their pieces. */
  public ImmutableSortedMap<Cell, Piece> asMap() {
    return cells;
  }

  /** Returns the piece covering the given cell, or null if none does. */
  @Nullable public Piece pieceAt(Cell cell) {
    return cells.get(cell);
  }

  /**
   * Tells whether this solution solves the given puzzle: it covers exactly the
   * open cells, and uses every piece exactly once.
   */
  public boolean solves(Puzzle puzzle) {
    return cells.keySet().equals(puzzle.getOpenCells())
        && placements.size() == puzzle.getPieces().size()
        && ImmutableSet.copyOf(cells.values()).equals(ImmutableSet.copyOf(puzzle.getPieces()));
  }

  /**
   * Draws this solution on the given puzzle's board, with a letter per piece
   * ({@code A} for the puzzle's first piece and so on), {@code x} for
   * excluded cells and {@code .} for anything else.
   */
  public String toPicture(Puzzle puzzle) {
    StringBuilder sb = new StringBuilder();
    Board board = puzzle.getBoard();
    for (int r = 0; r < board.rows; ++r) {
      for (int c = 0; c < board.columns; ++c) {
        Cell cell = Cell.of(r, c);
        Piece piece = cells.get(cell);
        if (piece != null)
          sb.append((char) ('A' + puzzle.getPieces().indexOf(piece)));
        else
          sb.append(puzzle.getExcluded().contains(cell) ? 'x' : '.');
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Solution)) return false;
    return ImmutableSet.copyOf(placements).equals(ImmutableSet.copyOf(((Solution) o).placements));
  }

  @Override public int hashCode() {
    return ImmutableSet.copyOf(placements).hashCode();
  }

  @Override public String toString() {
    return placements.toString();
  }

  private Solution(ImmutableList<Placement> placements, ImmutableSortedMap<Cell, Piece> cells) {
    this.placements = placements;
    this.cells = cells;
  }
}
