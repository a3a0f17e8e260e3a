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
import static org.junit.Assert.assertTrue;
import static us.blanshard.calendar.core.TestHelper.c;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CellTest {
  @Test public void order() {
    List<Cell> cells = Arrays.asList(c(1, 0), c(0, 5), c(1, -1), c(0, 0));
    Collections.sort(cells);
    assertEquals(Arrays.asList(c(0, 0), c(0, 5), c(1, -1), c(1, 0)), cells);
  }

  @Test public void arithmetic() {
    assertEquals(c(3, 5), c(1, 2).plus(c(2, 3)));
    assertEquals(c(-1, -1), c(1, 2).minus(c(2, 3)));
  }

  @Test public void neighbors() {
    assertEquals(Arrays.asList(c(0, 1), c(1, 0), c(1, 2), c(2, 1)),
                 Arrays.asList(c(1, 1).neighbors()));
  }

  @Test public void equality() {
    assertEquals(c(2, 3), c(2, 3));
    assertEquals(c(2, 3).hashCode(), c(2, 3).hashCode());
    assertTrue(!c(2, 3).equals(c(3, 2)));
  }

  @Test public void json() {
    assertEquals("4,-2", c(4, -2).toJsonValue());
    assertEquals(c(4, -2), Cell.fromJsonValue("4,-2"));
    assertEquals(c(1, 6), Cell.fromJsonValue(" 1 , 6 "));
  }

  @Test(expected = IllegalArgumentException.class) public void json_bad() {
    Cell.fromJsonValue("1;2");
  }

  @Test public void string() {
    assertEquals("(1, 2)", c(1, 2).toString());
  }
}
