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
package us.blanshard.calendar.dlx;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Knuth's Algorithm X: a depth-first search for exact covers of the matrix
 * held in a {@link DancingLinks}.  Each level covers the column with the
 * fewest remaining rows, then tries each of those rows in turn.
 *
 * <p> The search mutates the structure it is given, and leaves it as it
 * found it when it returns.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class AlgorithmX {

  /**
   * Receives the exact covers as the search finds them.
   */
  public interface Listener {
    /**
     * Called with the rows of a complete cover, in the order they were
     * chosen.  Returns true to keep searching, false to stop.
     */
    boolean solutionFound(List<Integer> rows);
  }

  private final DancingLinks links;
  private final List<Integer> partial = Lists.newArrayList();
  private int numSteps;

  public AlgorithmX(DancingLinks links) {
    this.links = checkNotNull(links);
  }

  /**
   * Returns the number of rows tried so far, over all searches run by this
   * object.
   */
  public int getStepCount() {
    return numSteps;
  }

  /**
   * Runs the search, handing each exact cover to the given listener.  Returns
   * true if the search ran to completion, false if the listener stopped it.
   */
  public boolean search(Listener listener) {
    checkNotNull(listener);
    return searchFrom(listener);
  }

  /**
   * Returns up to the given number of exact covers, in the order found.  An
   * empty list means the matrix has no exact cover.
   */
  public List<List<Integer>> solve(final int maxSolutions) {
    checkArgument(maxSolutions > 0, "maxSolutions must be positive, got %s", maxSolutions);
    final List<List<Integer>> solutions = Lists.newArrayList();
    search(new Listener() {
      @Override public boolean solutionFound(List<Integer> rows) {
        solutions.add(rows);
        return solutions.size() < maxSolutions;
      }
    });
    return solutions;
  }

  /** Returns the first exact cover found, or null if there is none. */
  @Nullable public List<Integer> solveFirst() {
    List<List<Integer>> solutions = solve(1);
    return solutions.isEmpty() ? null : solutions.get(0);
  }

  public List<List<Integer>> solveAll() {
    return solve(Integer.MAX_VALUE);
  }

  private boolean searchFrom(Listener listener) {
    int column = links.chooseColumn();
    if (column == DancingLinks.EXHAUSTED)
      return listener.solutionFound(ImmutableList.copyOf(partial));

    // A column no row can cover: dead end.
    if (links.size(column) == 0) return true;

    for (int row : links.rowsOf(column)) {
      ++numSteps;
      partial.add(row);
      int[] others = coverRow(links, row, column);
      boolean keepGoing = searchFrom(listener);
      uncoverRow(links, column, others);
      partial.remove(partial.size() - 1);
      if (!keepGoing) return false;
    }
    return true;
  }

  /**
   * Covers the chosen column and then the other columns of the given row, in
   * row order.  Returns the other columns, for {@link #uncoverRow}.
   */
  private static int[] coverRow(DancingLinks links, int row, int column) {
    int[] columns = links.columnsOf(row);
    int[] others = new int[columns.length - 1];
    int n = 0;
    links.cover(column);
    for (int c : columns) {
      if (c != column) {
        links.cover(c);
        others[n++] = c;
      }
    }
    return others;
  }

  private static void uncoverRow(DancingLinks links, int column, int[] others) {
    for (int i = others.length; i-- > 0; )
      links.uncover(others[i]);
    links.uncover(column);
  }

  /**
   * Finds every exact cover by giving each row of the most constrained
   * column to its own copy of the structure, searching the copies on the
   * given executor.  The covers come back in the order a sequential search
   * would have found them.  The given structure is only read.
   */
  public static List<List<Integer>> searchInParallel(
      DancingLinks links, ListeningExecutorService executor)
      throws InterruptedException, ExecutionException {
    int column = links.chooseColumn();
    if (column == DancingLinks.EXHAUSTED)
      return ImmutableList.<List<Integer>>of(ImmutableList.<Integer>of());

    List<ListenableFuture<List<List<Integer>>>> futures = Lists.newArrayList();
    for (final int row : links.rowsOf(column)) {
      final DancingLinks branch = links.copy();
      coverRow(branch, row, column);
      futures.add(executor.submit(new Callable<List<List<Integer>>>() {
        @Override public List<List<Integer>> call() {
          List<List<Integer>> answer = Lists.newArrayList();
          for (List<Integer> rest : new AlgorithmX(branch).solveAll()) {
            answer.add(ImmutableList.<Integer>builder().add(row).addAll(rest).build());
          }
          return answer;
        }
      }));
    }

    ImmutableList.Builder<List<Integer>> builder = ImmutableList.builder();
    for (List<List<Integer>> solutions : Futures.allAsList(futures).get())
      builder.addAll(solutions);
    return builder.build();
  }

  @Override public String toString() {
    return "AlgorithmX[" + numSteps + " steps, partial "
        + Ints.join(",", Ints.toArray(partial)) + "]";
  }
}
