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

import javax.annotation.concurrent.Immutable;

/**
 * A named puzzle piece.  Its shape is stored normalized, and its orbit of
 * orientations is computed once.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Piece {

  public final String name;
  public final Shape shape;
  private final ImmutableList<Shape> orientations;

  public Piece(String name, Shape shape) {
    checkArgument(!checkNotNull(name).isEmpty(), "Pieces need names");
    this.name = name;
    this.shape = shape.normalize();
    this.orientations = shape.orbit();
  }

  public static Piece of(String name, String... picture) {
    return new Piece(name, Shape.fromPicture(picture));
  }

  /** Returns the distinct orientations of this piece, see {@link Shape#orbit}. */
  public ImmutableList<Shape> orbit() {
    return orientations;
  }

  public int size() {
    return shape.size();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Piece)) return false;
    Piece that = (Piece) o;
    return this.name.equals(that.name) && this.shape.equals(that.shape);
  }

  @Override public int hashCode() {
    return name.hashCode() * 31 + shape.hashCode();
  }

  @Override public String toString() {
    return name;
  }
}
