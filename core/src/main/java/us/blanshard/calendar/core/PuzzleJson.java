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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.Immutable;

/**
 * Static methods that convert puzzle layouts and solutions to and from json.
 *
 * <p> A layout looks like this, with {@code #} marking cells:
 * <pre>
 *   {"board": ["###", "##."],
 *    "pieces": [{"name": "L", "shape": ["##", "#."]}, ...]}
 * </pre>
 *
 * @author Luke Blanshard
 */
public class PuzzleJson {

  /** A convenience for writing cells and solutions. */
  public static final Gson GSON = register(new GsonBuilder()).create();

  /**
   * A board and the pieces that go with it.
   */
  @Immutable
  public static final class Layout {
    public final Board board;
    public final ImmutableList<Piece> pieces;

    public Layout(Board board, Iterable<Piece> pieces) {
      this.board = board;
      this.pieces = ImmutableList.copyOf(pieces);
    }
  }

  /**
   * Registers type adapters in the given builder so that cells and solutions
   * can be written.  Cells are also read back; solutions need their puzzle to
   * be read, see {@link #readSolution}.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    final TypeAdapter<Cell> cellAdapter = new TypeAdapter<Cell>() {
      @Override public void write(JsonWriter out, Cell value) throws IOException {
        out.value(value.toJsonValue());
      }
      @Override public Cell read(JsonReader in) throws IOException {
        return Cell.fromJsonValue(in.nextString());
      }
    };
    builder.registerTypeAdapter(Cell.class, cellAdapter);

    builder.registerTypeAdapter(Solution.class, new TypeAdapter<Solution>() {
      @Override public void write(JsonWriter out, Solution value) throws IOException {
        out.beginObject();
        out.name("placements").beginArray();
        for (Placement p : value.getPlacements()) {
          out.beginObject();
          out.name("piece").value(p.piece.name);
          out.name("cells").beginArray();
          for (Cell cell : p.cells)
            cellAdapter.write(out, cell);
          out.endArray();
          out.endObject();
        }
        out.endArray();
        out.endObject();
      }
      @Override public Solution read(JsonReader in) {
        throw new UnsupportedOperationException("Use PuzzleJson.readSolution");
      }
    });

    return builder;
  }

  /**
   * Reads a layout.
   *
   * @throws JsonParseException if the json is malformed or lacks the board or
   *     the pieces
   * @throws InvalidPieceShapeException if a piece's shape is bad
   */
  public static Layout readLayout(Reader reader) {
    JsonObject object = JsonParser.parseReader(reader).getAsJsonObject();
    Board board = Board.fromPicture(toStrings(required(object, "board")));
    List<Piece> pieces = Lists.newArrayList();
    for (JsonElement element : required(object, "pieces").getAsJsonArray()) {
      JsonObject piece = element.getAsJsonObject();
      String name = required(piece, "name").getAsString();
      pieces.add(new Piece(name, Shape.fromPicture(toStrings(required(piece, "shape")))));
    }
    return new Layout(board, pieces);
  }

  /**
   * Reads a solution written by {@link #GSON}, resolving its pieces by name in
   * the given puzzle.
   *
   * @throws JsonParseException if the json is malformed or names an unknown
   *     piece, or a placement isn't an orientation of its piece
   * @throws MalformedSolutionException if the placements overlap
   */
  public static Solution readSolution(String json, Puzzle puzzle) {
    Map<String, Piece> pieces = Maps.newHashMap();
    for (Piece piece : puzzle.getPieces())
      pieces.put(piece.name, piece);

    List<Placement> placements = Lists.newArrayList();
    JsonObject object = JsonParser.parseString(json).getAsJsonObject();
    for (JsonElement element : required(object, "placements").getAsJsonArray()) {
      JsonObject p = element.getAsJsonObject();
      String name = required(p, "piece").getAsString();
      Piece piece = pieces.get(name);
      if (piece == null) throw new JsonParseException("Unknown piece " + name);
      List<Cell> cells = Lists.newArrayList();
      for (JsonElement cell : required(p, "cells").getAsJsonArray())
        cells.add(Cell.fromJsonValue(cell.getAsString()));
      placements.add(toPlacement(piece, Shape.of(cells)));
    }
    return Solution.decode(placements);
  }

  private static Placement toPlacement(Piece piece, Shape cells) {
    Shape orientation = cells.normalize();
    if (!piece.orbit().contains(orientation))
      throw new JsonParseException(cells + " is not an orientation of " + piece);
    return new Placement(piece, orientation, Cell.of(cells.minRow(), cells.minColumn()));
  }

  private static JsonElement required(JsonObject object, String name) {
    JsonElement element = object.get(name);
    if (element == null) throw new JsonParseException("Missing " + name + " in " + object);
    return element;
  }

  private static List<String> toStrings(JsonElement element) {
    JsonArray array = element.getAsJsonArray();
    List<String> answer = Lists.newArrayList();
    for (int i = 0; i < array.size(); ++i)
      answer.add(array.get(i).getAsString());
    return answer;
  }

  // Static methods only.
  private PuzzleJson() {}
}
