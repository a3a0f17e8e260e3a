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
import static java.util.logging.Level.FINE;

import us.blanshard.calendar.dlx.AlgorithmX;
import us.blanshard.calendar.dlx.Matrix;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListeningExecutorService;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Solves tiling puzzles by handing their exact-cover matrices to Algorithm X
 * and decoding the covers it finds.
 *
 * @author Luke Blanshard
 */
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Finds the first solution to the given puzzle, if it has one.
   */
  public static Result solve(Puzzle puzzle) {
    return solve(puzzle, 1);
  }

  /**
   * Finds up to the given number of solutions to the given puzzle, in the
   * order the search reaches them.
   */
  public static Result solve(Puzzle puzzle, int maxSolutions) {
    checkArgument(maxSolutions > 0, "maxSolutions must be positive, got %s", maxSolutions);
    Matrix<Placement> matrix = PuzzleMatrix.build(puzzle);
    AlgorithmX search = new AlgorithmX(matrix.toLinks());
    List<List<Integer>> covers = search.solve(maxSolutions);
    return log(new Result(puzzle, decode(matrix, covers), search.getStepCount()));
  }

  /**
   * Finds every solution to the given puzzle.
   */
  public static Result solveAll(Puzzle puzzle) {
    return solve(puzzle, Integer.MAX_VALUE);
  }

  /**
   * Finds every solution to the given puzzle, splitting the search among the
   * given executor's threads.  The solutions come back in the same order as
   * from {@link #solveAll}.  Steps are not counted.
   */
  public static Result solveAllInParallel(Puzzle puzzle, ListeningExecutorService executor)
      throws InterruptedException, ExecutionException {
    Matrix<Placement> matrix = PuzzleMatrix.build(puzzle);
    List<List<Integer>> covers = AlgorithmX.searchInParallel(matrix.toLinks(), executor);
    return log(new Result(puzzle, decode(matrix, covers), 0));
  }

  private static ImmutableList<Solution> decode(
      Matrix<Placement> matrix, List<List<Integer>> covers) {
    ImmutableList.Builder<Solution> builder = ImmutableList.builder();
    for (List<Integer> cover : covers)
      builder.add(Solution.decode(matrix.decode(cover)));
    return builder.build();
  }

  private static Result log(Result result) {
    if (!result.isSolvable()) {
      logger.warning("No tiling after " + result.numSteps + " steps for\n" + result.puzzle);
    } else if (logger.isLoggable(FINE)) {
      logger.fine(result.numSolutions + " tiling(s) after " + result.numSteps
          + " steps, first:\n" + result.solution.toPicture(result.puzzle));
    }
    return result;
  }

  /**
   * A summary of a solver's work.  A puzzle with no tiling comes back with no
   * solutions; that is an answer, not an error.
   */
  @Immutable
  public static final class Result {
    public final Puzzle puzzle;
    public final int numSolutions;
    public final int numSteps;  // Rows tried by the search
    public final ImmutableList<Solution> solutions;
    @Nullable public final Solution solution;  // The first one found, or null

    Result(Puzzle puzzle, ImmutableList<Solution> solutions, int numSteps) {
      this.puzzle = puzzle;
      this.numSolutions = solutions.size();
      this.numSteps = numSteps;
      this.solutions = solutions;
      this.solution = solutions.isEmpty() ? null : solutions.get(0);
    }

    public boolean isSolvable() {
      return solution != null;
    }
  }

  // Static methods only.
  private Solver() {}
}
