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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static us.blanshard.calendar.core.TestHelper.DOMINO_A;
import static us.blanshard.calendar.core.TestHelper.DOMINO_B;
import static us.blanshard.calendar.core.TestHelper.SQUARE;
import static us.blanshard.calendar.core.TestHelper.c;
import static us.blanshard.calendar.core.TestHelper.pl;
import static us.blanshard.calendar.core.TestHelper.puzzle;
import static us.blanshard.calendar.core.TestHelper.rect;

import us.blanshard.calendar.dlx.AlgorithmX;
import us.blanshard.calendar.dlx.Matrix;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.util.List;

public class PuzzleMatrixTest {
  private final Puzzle puzzle = puzzle(rect(2, 3), c(0, 0), c(1, 2), DOMINO_A, DOMINO_B);

  @Test public void columns() {
    Matrix<Placement> matrix = PuzzleMatrix.build(puzzle);
    assertEquals(ImmutableList.<Object>of(c(0, 1), c(0, 2), c(1, 0), c(1, 1), DOMINO_A, DOMINO_B),
                 matrix.getColumns());
    assertEquals(false, PuzzleMatrix.isPieceColumn(matrix, 3));
    assertEquals(true, PuzzleMatrix.isPieceColumn(matrix, 4));
  }

  @Test public void rows() {
    Matrix<Placement> matrix = PuzzleMatrix.build(puzzle);
    assertEquals(6, matrix.getNumRows());
    assertEquals(pl(DOMINO_A, c(0, 1), c(0, 2)), matrix.getRow(0));
    assertArrayEquals(new int[] {0, 1, 4}, matrix.columnsOf(0));
    assertArrayEquals(new int[] {0, 3, 4}, matrix.columnsOf(2));
    assertEquals(pl(DOMINO_B, c(1, 0), c(1, 1)), matrix.getRow(4));
    assertArrayEquals(new int[] {2, 3, 5}, matrix.columnsOf(4));
  }

  @Test public void everyRowHasExactlyOnePieceColumn() {
    Matrix<Placement> matrix = PuzzleMatrix.build(Calendar.CLASSIC.puzzleFor(10, 18));
    for (int row = 0; row < matrix.getNumRows(); ++row) {
      int pieces = 0;
      for (int column : matrix.columnsOf(row))
        if (PuzzleMatrix.isPieceColumn(matrix, column)) ++pieces;
      assertEquals(1, pieces);
      Placement placement = matrix.getRow(row);
      assertEquals(placement.piece.size() + 1, matrix.columnsOf(row).length);
    }
    assertEquals(41 + 8, matrix.getNumColumns());
  }

  @Test public void deterministic() {
    Matrix<Placement> first = PuzzleMatrix.build(Calendar.CLASSIC.puzzleFor(3, 7));
    Matrix<Placement> second = PuzzleMatrix.build(Calendar.CLASSIC.puzzleFor(3, 7));
    assertEquals(first.getColumns(), second.getColumns());
    assertEquals(first.getRows(), second.getRows());
    for (int row = 0; row < first.getNumRows(); ++row)
      assertArrayEquals(first.columnsOf(row), second.columnsOf(row));
  }

  @Test public void pieceWithNoRoom_yieldsEmptyColumn() {
    Puzzle cramped = puzzle(rect(2, 3), c(0, 0), c(1, 2), SQUARE);
    Matrix<Placement> matrix = PuzzleMatrix.build(cramped);
    assertEquals(0, matrix.getNumRows());
    assertEquals(0, matrix.toLinks().size(matrix.indexOfColumn(SQUARE)));
    List<List<Integer>> covers = new AlgorithmX(matrix.toLinks()).solveAll();
    assertEquals(0, covers.size());
  }
}
