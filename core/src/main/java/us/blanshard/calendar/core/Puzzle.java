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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * One instance of the tiling puzzle: a board, the cells of it to leave
 * uncovered, and the pieces that must cover everything else, each used
 * exactly once.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Puzzle {

  private final Board board;
  private final ImmutableSortedSet<Cell> excluded;
  private final ImmutableSortedSet<Cell> openCells;
  private final ImmutableList<Piece> pieces;

  /**
   * Makes a puzzle.
   *
   * @throws InvalidExcludedCellException if there are no excluded cells, or one
   *     of them isn't on the board
   * @throws InvalidPieceShapeException if two pieces share a name
   */
  public Puzzle(Board board, Iterable<Cell> excluded, Iterable<Piece> pieces) {
    this.board = checkNotNull(board);
    this.excluded = ImmutableSortedSet.copyOf(excluded);
    this.pieces = ImmutableList.copyOf(pieces);

    if (this.excluded.isEmpty())
      throw new InvalidExcludedCellException("No excluded cells");
    for (Cell cell : this.excluded) {
      if (!board.contains(cell))
        throw new InvalidExcludedCellException("Excluded cell " + cell + " is not on the board");
    }
    checkArgument(!this.pieces.isEmpty(), "No pieces");
    Set<String> names = Sets.newHashSet();
    for (Piece piece : this.pieces) {
      if (!names.add(piece.name))
        throw new InvalidPieceShapeException("Duplicate piece name " + piece.name);
    }
    this.openCells = ImmutableSortedSet.copyOf(Sets.difference(board.getCells(), this.excluded));
  }

  /** Makes a puzzle with the usual two excluded cells. */
  public static Puzzle of(Board board, Cell first, Cell second, Piece... pieces) {
    return new Puzzle(board, Arrays.asList(first, second), Arrays.asList(pieces));
  }

  public Board getBoard() {
    return board;
  }

  public ImmutableSortedSet<Cell> getExcluded() {
    return excluded;
  }

  public ImmutableList<Piece> getPieces() {
    return pieces;
  }

  /** The cells that must be covered, in row-major order. */
  public ImmutableSortedSet<Cell> getOpenCells() {
    return openCells;
  }

  public boolean isOpen(Cell cell) {
    return openCells.contains(cell);
  }

  /** The total number of cells the pieces occupy. */
  public int getPieceArea() {
    int answer = 0;
    for (Piece piece : pieces) answer += piece.size();
    return answer;
  }

  /**
   * Returns every way the given piece fits on the open cells, ignoring the
   * other pieces: orientations in orbit order, then anchors in row-major
   * order.
   */
  public ImmutableList<Placement> placementsFor(Piece piece) {
    ImmutableList.Builder<Placement> builder = ImmutableList.builder();
    for (Shape orientation : piece.orbit()) {
      for (int r = 0; r + orientation.height() <= board.rows; ++r) {
        for (int c = 0; c + orientation.width() <= board.columns; ++c) {
          Cell anchor = Cell.of(r, c);
          if (fits(orientation, anchor))
            builder.add(new Placement(piece, orientation, anchor));
        }
      }
    }
    return builder.build();
  }

  /** Returns the placements of all the pieces, in piece order. */
  public ImmutableList<Placement> allPlacements() {
    ImmutableList.Builder<Placement> builder = ImmutableList.builder();
    for (Piece piece : pieces)
      builder.addAll(placementsFor(piece));
    return builder.build();
  }

  private boolean fits(Shape orientation, Cell anchor) {
    for (Cell offset : orientation.getOffsets()) {
      if (!isOpen(offset.plus(anchor))) return false;
    }
    return true;
  }

  /**
   * Draws the board with {@code #} for open cells, {@code x} for excluded
   * ones, and {@code .} for holes.
   */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < board.rows; ++r) {
      for (int c = 0; c < board.columns; ++c) {
        Cell cell = Cell.of(r, c);
        sb.append(isOpen(cell) ? '#' : excluded.contains(cell) ? 'x' : '.');
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
