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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static us.blanshard.calendar.core.TestHelper.DOMINO_A;
import static us.blanshard.calendar.core.TestHelper.DOMINO_B;
import static us.blanshard.calendar.core.TestHelper.DOMINO_C;
import static us.blanshard.calendar.core.TestHelper.I3;
import static us.blanshard.calendar.core.TestHelper.L3_A;
import static us.blanshard.calendar.core.TestHelper.L3_B;
import static us.blanshard.calendar.core.TestHelper.L4;
import static us.blanshard.calendar.core.TestHelper.T4;
import static us.blanshard.calendar.core.TestHelper.c;
import static us.blanshard.calendar.core.TestHelper.p;
import static us.blanshard.calendar.core.TestHelper.puzzle;
import static us.blanshard.calendar.core.TestHelper.rect;

import com.google.common.collect.ImmutableSet;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collection;

@RunWith(Parameterized.class)
public class SolverTest {
  private final Puzzle puzzle;
  private final int numSolutions;

  @Parameters public static Collection<Object[]> getParams() {
    return Arrays.asList(new Object[][]{
        { puzzle(rect(2, 3), c(0, 0), c(1, 2), DOMINO_A, DOMINO_B), 2 },
        { puzzle(rect(2, 4), c(0, 0), c(1, 3), L3_A, L3_B), 2 },  // Swapping the two Ls
        { puzzle(rect(2, 4), c(0, 0), c(1, 3), I3, L3_A), 0 },  // Right area, wrong shapes
        { puzzle(rect(2, 4), c(0, 1), c(1, 0), DOMINO_A, DOMINO_B, DOMINO_C), 0 },  // (0, 0) cut off
        { puzzle(rect(2, 4), c(0, 0), c(1, 3), DOMINO_A, DOMINO_B, DOMINO_C), 0 },  // Odd corners
        { puzzle(rect(4, 4), c(0, 0), c(3, 3), I3, L3_A, T4, L4), -1 },
        { puzzle(rect(4, 4), c(1, 1), c(2, 2), I3, L3_A, T4, L4), -1 },
        { puzzle(rect(3, 4), c(0, 0), c(2, 3), p("P", "###", "##."), p("L", "####", "#...")), -1 },
        { puzzle(rect(3, 4), c(1, 0), c(1, 3), L3_A, L3_B, DOMINO_A, DOMINO_B), -1 },
      });
  }

  public SolverTest(Puzzle puzzle, int numSolutions) {
    this.puzzle = puzzle;
    this.numSolutions = numSolutions;
  }

  @Test public void solveAll_matchesBruteForce() {
    Solver.Result result = Solver.solveAll(puzzle);
    assertEquals(NaiveSolver.solveAll(puzzle), ImmutableSet.copyOf(result.solutions));
    assertEquals(result.solutions.size(), ImmutableSet.copyOf(result.solutions).size());
    if (numSolutions >= 0)
      assertEquals(numSolutions, result.numSolutions);
  }

  @Test public void solveAll_everySolutionTilesThePuzzle() {
    for (Solution solution : Solver.solveAll(puzzle).solutions) {
      assertEquals(solution.toPicture(puzzle), true, solution.solves(puzzle));
      assertEquals(puzzle.getPieces().size(), solution.getPlacements().size());
    }
  }

  @Test public void solve_first() {
    Solver.Result all = Solver.solveAll(puzzle);
    Solver.Result first = Solver.solve(puzzle);
    assertEquals(all.isSolvable(), first.isSolvable());
    if (first.isSolvable()) {
      assertEquals(1, first.numSolutions);
      assertEquals(all.solutions.get(0).getPlacements(), first.solution.getPlacements());
      assertThat(first.numSteps).isAtMost(all.numSteps);
    } else {
      assertNull(first.solution);
      assertEquals(0, first.numSolutions);
      assertThat(first.solutions).isEmpty();
    }
  }

  @Test public void solve_deterministic() {
    Solver.Result one = Solver.solveAll(puzzle);
    Solver.Result two = Solver.solveAll(puzzle);
    assertEquals(one.numSteps, two.numSteps);
    assertEquals(one.solutions.size(), two.solutions.size());
    for (int i = 0; i < one.solutions.size(); ++i)
      assertEquals(one.solutions.get(i).getPlacements(), two.solutions.get(i).getPlacements());
  }
}
