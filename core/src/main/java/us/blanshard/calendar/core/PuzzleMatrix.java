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

import static java.util.logging.Level.FINE;

import us.blanshard.calendar.dlx.Matrix;

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Translates a puzzle into an exact-cover matrix.  The columns are the open
 * cells in row-major order followed by the pieces in catalog order; each row
 * is a placement, covering its cells and its piece.
 *
 * @author Luke Blanshard
 */
public class PuzzleMatrix {
  private static final Logger logger = Logger.getLogger(PuzzleMatrix.class.getName());

  /**
   * Builds the matrix for the given puzzle.  Rows come in piece order, then
   * orientation order, then anchor order, so the same puzzle always yields
   * the same matrix.  A column with no rows is not an error here; it just
   * makes the puzzle unsolvable.
   */
  public static Matrix<Placement> build(Puzzle puzzle) {
    List<Object> columns = Lists.newArrayList();
    columns.addAll(puzzle.getOpenCells());
    columns.addAll(puzzle.getPieces());

    Matrix.Builder<Placement> builder = Matrix.builder(columns);
    for (Piece piece : puzzle.getPieces()) {
      List<Placement> placements = puzzle.placementsFor(piece);
      if (placements.isEmpty() && logger.isLoggable(FINE))
        logger.fine("No room anywhere for " + piece + " on\n" + puzzle);
      for (Placement placement : placements) {
        builder.addRow(placement,
            Iterables.<Object>concat(placement.cells, Collections.singleton(piece)));
      }
    }
    Matrix<Placement> matrix = builder.build();
    if (logger.isLoggable(FINE))
      logger.fine("Built " + matrix + " for " + puzzle.getExcluded());
    return matrix;
  }

  /** Tells whether the given matrix column stands for a piece rather than a cell. */
  public static boolean isPieceColumn(Matrix<Placement> matrix, int column) {
    return matrix.getColumn(column) instanceof Piece;
  }

  // Static methods only.
  private PuzzleMatrix() {}
}
