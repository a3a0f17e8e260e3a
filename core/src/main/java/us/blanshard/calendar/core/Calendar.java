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
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;

import java.io.IOException;
import java.io.Reader;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * The physical calendar puzzles.  Both boards put the months in the first two
 * rows, six to a row, and the days 1 through 31 in the next five rows, seven
 * to a row.  The weekday board adds the days of the week, Sunday first, after
 * the 31st.
 *
 * <p> The boards and pieces are read from json resources next to this class,
 * see {@link PuzzleJson}.
 *
 * @author Luke Blanshard
 */
public enum Calendar {

  /** Month and day: 43 cells, 8 pieces. */
  CLASSIC("classic.json", false),

  /** Month, day and day of the week: 50 cells, 10 pieces. */
  WEEKDAY("weekday.json", true);

  private static final ImmutableMap<DayOfWeek, Cell> WEEKDAY_CELLS =
      ImmutableMap.<DayOfWeek, Cell>builder()
          .put(DayOfWeek.SUNDAY, Cell.of(6, 3))
          .put(DayOfWeek.MONDAY, Cell.of(6, 4))
          .put(DayOfWeek.TUESDAY, Cell.of(6, 5))
          .put(DayOfWeek.WEDNESDAY, Cell.of(6, 6))
          .put(DayOfWeek.THURSDAY, Cell.of(7, 4))
          .put(DayOfWeek.FRIDAY, Cell.of(7, 5))
          .put(DayOfWeek.SATURDAY, Cell.of(7, 6))
          .build();

  private final boolean hasWeekdays;
  private final Supplier<PuzzleJson.Layout> layout;

  private Calendar(final String resourceName, boolean hasWeekdays) {
    this.hasWeekdays = hasWeekdays;
    this.layout = Suppliers.memoize(new Supplier<PuzzleJson.Layout>() {
      @Override public PuzzleJson.Layout get() {
        return load(resourceName);
      }
    });
  }

  public boolean hasWeekdays() {
    return hasWeekdays;
  }

  public Board getBoard() {
    return layout.get().board;
  }

  public ImmutableList<Piece> getPieces() {
    return layout.get().pieces;
  }

  /** Returns the cell for the given month, 1 for January through 12. */
  public Cell monthCell(int month) {
    checkArgument(month >= 1 && month <= 12, "Bad month %s", month);
    return Cell.of((month - 1) / 6, (month - 1) % 6);
  }

  /** Returns the cell for the given day of the month, 1 through 31. */
  public Cell dayCell(int day) {
    checkArgument(day >= 1 && day <= 31, "Bad day %s", day);
    return Cell.of(2 + (day - 1) / 7, (day - 1) % 7);
  }

  public Cell weekdayCell(DayOfWeek dayOfWeek) {
    checkState(hasWeekdays, "%s has no weekdays", this);
    return WEEKDAY_CELLS.get(dayOfWeek);
  }

  /**
   * Returns the puzzle for the given month and day.  Only for calendars
   * without weekdays.
   */
  public Puzzle puzzleFor(int month, int day) {
    checkState(!hasWeekdays, "%s needs a day of the week", this);
    return new Puzzle(getBoard(), ImmutableList.of(monthCell(month), dayCell(day)), getPieces());
  }

  /** Returns the puzzle for the given date. */
  public Puzzle puzzleFor(LocalDate date) {
    List<Cell> excluded = hasWeekdays
        ? ImmutableList.of(monthCell(date.getMonthValue()), dayCell(date.getDayOfMonth()),
                           weekdayCell(date.getDayOfWeek()))
        : ImmutableList.of(monthCell(date.getMonthValue()), dayCell(date.getDayOfMonth()));
    return new Puzzle(getBoard(), excluded, getPieces());
  }

  private static PuzzleJson.Layout load(String resourceName) {
    try (Reader reader = Resources.asCharSource(
             Resources.getResource(Calendar.class, resourceName), UTF_8).openStream()) {
      return PuzzleJson.readLayout(reader);
    } catch (IOException e) {
      throw new IllegalStateException("Unable to read " + resourceName, e);
    }
  }
}
