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
package net.hydromatic.bounds.interval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multi-dimensional region, one {@link Interval} per dimension of a stage.
 */
public class Box {
  public final ImmutableList<Interval> intervals;

  private Box(ImmutableList<Interval> intervals) {
    this.intervals = intervals;
  }

  /** Creates a box. */
  public static Box of(List<Interval> intervals) {
    return new Box(ImmutableList.copyOf(intervals));
  }

  /**
   * Creates a box for a stage with a given number of dimensions. Throws if
   * the number of intervals is different.
   */
  public static Box of(int dimensionCount, List<Interval> intervals) {
    checkArgument(
        intervals.size() == dimensionCount,
        "box %s has %s dimensions; expected %s",
        intervals,
        intervals.size(),
        dimensionCount);
    return of(intervals);
  }

  /** Creates a box each of whose dimensions is empty. */
  public static Box empty(int dimensionCount) {
    return new Box(
        ImmutableList.copyOf(
            Collections.nCopies(dimensionCount, Interval.EMPTY)));
  }

  public int size() {
    return intervals.size();
  }

  public Interval get(int i) {
    return intervals.get(i);
  }

  /** Returns whether every dimension is empty. */
  public boolean isEmpty() {
    return intervals.stream().allMatch(Interval::isEmpty);
  }

  /** Returns whether every dimension has both endpoints. */
  public boolean isBounded() {
    return intervals.stream().allMatch(Interval::isBounded);
  }

  /** Returns a box with one dimension replaced. */
  public Box with(int i, Interval interval) {
    if (intervals.get(i).equals(interval)) {
      return this;
    }
    final List<Interval> list = new ArrayList<>(intervals);
    list.set(i, interval);
    return of(list);
  }

  /** Returns the union, dimension by dimension, of two boxes. */
  public Box union(Box box) {
    checkArgument(box.size() == size(), "dimension mismatch");
    final ImmutableList.Builder<Interval> b = ImmutableList.builder();
    for (int i = 0; i < size(); i++) {
      b.add(get(i).union(box.get(i)));
    }
    return new Box(b.build());
  }

  @Override
  public int hashCode() {
    return intervals.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Box && intervals.equals(((Box) o).intervals);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (int i = 0; i < intervals.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(intervals.get(i));
    }
    return b.append("}").toString();
  }
}

// End Box.java
