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

import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * One orientation of a piece anchored at a board position, with the cells it
 * occupies.  Two placements are equal when they put the same piece on the
 * same cells.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Placement {

  public final Piece piece;
  public final Shape orientation;
  public final Cell anchor;
  public final ImmutableSortedSet<Cell> cells;

  public Placement(Piece piece, Shape orientation, Cell anchor) {
    this.piece = checkNotNull(piece);
    this.orientation = checkNotNull(orientation);
    this.anchor = checkNotNull(anchor);
    checkArgument(piece.orbit().contains(orientation),
        "%s is not an orientation of %s", orientation, piece);
    this.cells = orientation.cellsAt(anchor);
  }

  public boolean covers(Cell cell) {
    return cells.contains(cell);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Placement)) return false;
    Placement that = (Placement) o;
    return this.piece.equals(that.piece) && this.cells.equals(that.cells);
  }

  @Override public int hashCode() {
    return piece.hashCode() * 31 + cells.hashCode();
  }

  @Override public String toString() {
    return piece.name + "@" + cells;
  }
}
