/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.specfstar.compile;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("lineWidth"), is(Prop.LINE_WIDTH));
    assertThat(Prop.lookup("LINE_WIDTH"), is(Prop.LINE_WIDTH));
    assertThat(Prop.lookup("fstarOptions"), is(Prop.FSTAR_OPTIONS));
    assertThrows(RuntimeException.class, () -> Prop.lookup("noSuchProp"));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.LINE_WIDTH.intValue(map), is(80));
    assertThat(Prop.INDENT.intValue(map), is(2));
    assertThat(Prop.FSTAR_OPTIONS.stringValue(map),
        is("--fuel 0 --ifuel 1 --z3rlimit 15"));
    assertThat(Prop.OPENS.listValue(map),
        is(ImmutableList.of("Hacspec.Lib", "FStar.Mul")));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.LINE_WIDTH.set(map, 100);
    assertThat(Prop.LINE_WIDTH.intValue(map), is(100));
    Prop.LINE_WIDTH.set(map, null);
    assertThat(Prop.LINE_WIDTH.intValue(map), is(80));
    assertThrows(RuntimeException.class,
        () -> Prop.LINE_WIDTH.set(map, "wide"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.OPENS.intValue(map));
  }
}

// End PropTest.java
