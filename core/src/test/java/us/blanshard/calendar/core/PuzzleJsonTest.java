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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static us.blanshard.calendar.core.TestHelper.DOMINO_A;
import static us.blanshard.calendar.core.TestHelper.DOMINO_B;
import static us.blanshard.calendar.core.TestHelper.c;
import static us.blanshard.calendar.core.TestHelper.pl;
import static us.blanshard.calendar.core.TestHelper.puzzle;
import static us.blanshard.calendar.core.TestHelper.rect;
import static us.blanshard.calendar.core.TestHelper.s;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParseException;

import org.junit.Test;

import java.io.StringReader;

public class PuzzleJsonTest {
  private final Puzzle puzzle = puzzle(rect(2, 3), c(0, 0), c(1, 2), DOMINO_A, DOMINO_B);

  @Test public void readLayout() {
    PuzzleJson.Layout layout = PuzzleJson.readLayout(new StringReader(
        "{\"board\": [\"###\", \"##.\"],"
        + " \"pieces\": [{\"name\": \"L\", \"shape\": [\"##\", \"#.\"]},"
        + " {\"name\": \"I\", \"shape\": [\"#\", \"#\"]}]}"));
    assertEquals(Board.fromPicture("###", "##."), layout.board);
    assertEquals(5, layout.board.size());
    assertEquals(2, layout.pieces.size());
    assertEquals("L", layout.pieces.get(0).name);
    assertEquals(s("##", "#."), layout.pieces.get(0).shape);
    assertEquals(s("#", "#"), layout.pieces.get(1).shape);
  }

  @Test(expected = JsonParseException.class) public void readLayout_noBoard() {
    PuzzleJson.readLayout(new StringReader("{\"pieces\": []}"));
  }

  @Test(expected = JsonParseException.class) public void readLayout_unnamedPiece() {
    PuzzleJson.readLayout(new StringReader(
        "{\"board\": [\"##\"], \"pieces\": [{\"shape\": [\"##\"]}]}"));
  }

  @Test(expected = InvalidPieceShapeException.class) public void readLayout_brokenPiece() {
    PuzzleJson.readLayout(new StringReader(
        "{\"board\": [\"###\"], \"pieces\": [{\"name\": \"X\", \"shape\": [\"#.#\"]}]}"));
  }

  @Test public void cells() {
    assertEquals("\"1,2\"", PuzzleJson.GSON.toJson(c(1, 2)));
    assertEquals(c(3, 0), PuzzleJson.GSON.fromJson("\"3,0\"", Cell.class));
  }

  @Test public void solution() {
    Solution solution = Solution.decode(ImmutableList.of(
        pl(DOMINO_A, c(0, 1), c(0, 2)), pl(DOMINO_B, c(1, 0), c(1, 1))));
    String json = PuzzleJson.GSON.toJson(solution);
    assertEquals("{\"placements\":["
                 + "{\"piece\":\"A\",\"cells\":[\"0,1\",\"0,2\"]},"
                 + "{\"piece\":\"B\",\"cells\":[\"1,0\",\"1,1\"]}]}", json);
    Solution read = PuzzleJson.readSolution(json, puzzle);
    assertEquals(solution, read);
    assertEquals(true, read.solves(puzzle));
  }

  @Test public void solution_fromSolver() {
    Solver.Result result = Solver.solve(puzzle);
    String json = PuzzleJson.GSON.toJson(result.solution);
    assertEquals(result.solution, PuzzleJson.readSolution(json, puzzle));
  }

  @Test public void solution_unknownPiece() {
    try {
      PuzzleJson.readSolution(
          "{\"placements\": [{\"piece\": \"Q\", \"cells\": [\"0,1\", \"0,2\"]}]}", puzzle);
      fail();
    } catch (JsonParseException e) {
      assertEquals("Unknown piece Q", e.getMessage());
    }
  }

  @Test(expected = JsonParseException.class) public void solution_wrongShape() {
    PuzzleJson.readSolution(
        "{\"placements\": [{\"piece\": \"A\", \"cells\": [\"0,0\", \"0,1\", \"0,2\"]}]}",
        puzzle);
  }

  @Test(expected = MalformedSolutionException.class) public void solution_overlap() {
    PuzzleJson.readSolution(
        "{\"placements\": [{\"piece\": \"A\", \"cells\": [\"0,1\", \"0,2\"]},"
        + " {\"piece\": \"B\", \"cells\": [\"0,1\", \"1,1\"]}]}",
        puzzle);
  }

  @Test(expected = UnsupportedOperationException.class) public void solution_plainGson() {
    PuzzleJson.GSON.fromJson("{\"placements\": []}", Solution.class);
  }
}
