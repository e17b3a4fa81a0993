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
package net.hydromatic.bounds.ir;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for addressing statements within a program.
 *
 * <p>A path is the list of child indexes (see {@link Ir.Stmt#children()})
 * that leads from the root to a statement; the root's path is empty.
 */
public class Paths {
  private Paths() {}

  /** Returns the statement at a path. */
  public static Ir.Stmt get(Ir.Stmt root, List<Integer> path) {
    Ir.Stmt stmt = root;
    for (int i : path) {
      stmt = stmt.children().get(i);
    }
    return stmt;
  }

  /**
   * Returns the path of the first statement, in pre-order, that satisfies a
   * predicate, or null.
   */
  public static @Nullable ImmutableList<Integer> find(
      Ir.Stmt root, Predicate<Ir.Stmt> predicate) {
    final List<ImmutableList<Integer>> paths = new ArrayList<>();
    findAll(root, new ArrayList<>(), predicate, paths, true);
    return paths.isEmpty() ? null : paths.get(0);
  }

  /**
   * Returns the paths of all statements that satisfy a predicate, in
   * pre-order.
   */
  public static List<ImmutableList<Integer>> findAll(
      Ir.Stmt root, Predicate<Ir.Stmt> predicate) {
    final List<ImmutableList<Integer>> paths = new ArrayList<>();
    findAll(root, new ArrayList<>(), predicate, paths, false);
    return paths;
  }

  private static boolean findAll(
      Ir.Stmt stmt,
      List<Integer> path,
      Predicate<Ir.Stmt> predicate,
      List<ImmutableList<Integer>> paths,
      boolean firstOnly) {
    if (predicate.test(stmt)) {
      paths.add(ImmutableList.copyOf(path));
      if (firstOnly) {
        return true;
      }
    }
    final List<Ir.Stmt> children = stmt.children();
    for (int i = 0; i < children.size(); i++) {
      path.add(i);
      final boolean found =
          findAll(children.get(i), path, predicate, paths, firstOnly);
      path.remove(path.size() - 1);
      if (found) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the statements that enclose the statement at a path, outermost
   * first; does not include the statement itself.
   */
  public static List<Ir.Stmt> ancestors(Ir.Stmt root, List<Integer> path) {
    final List<Ir.Stmt> list = new ArrayList<>();
    Ir.Stmt stmt = root;
    for (int i : path) {
      list.add(stmt);
      stmt = stmt.children().get(i);
    }
    return list;
  }

  /** Returns the longest common prefix of a non-empty list of paths. */
  public static ImmutableList<Integer> commonPrefix(
      List<? extends List<Integer>> paths) {
    List<Integer> prefix = paths.get(0);
    for (List<Integer> path : paths) {
      int n = 0;
      while (n < prefix.size()
          && n < path.size()
          && prefix.get(n).equals(path.get(n))) {
        ++n;
      }
      prefix = prefix.subList(0, n);
    }
    return ImmutableList.copyOf(prefix);
  }

  /** Returns whether {@code path} starts with {@code prefix}. */
  public static boolean startsWith(List<Integer> path, List<Integer> prefix) {
    return path.size() >= prefix.size()
        && path.subList(0, prefix.size()).equals(prefix);
  }
}

// End Paths.java
