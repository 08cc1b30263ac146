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
package net.hydromatic.stave.util;

/**
 * Generates fresh variable names.
 *
 * <p>Effect variables and entity variables get different prefixes and share
 * one counter, so a name is never generated twice by the same generator.
 * Each inference run has its own generator.
 */
public class NameGenerator {
  private int id = 0;

  /** Generates a fresh effect variable name, e.g. "_e3". */
  public String effectVariable() {
    return "_e" + id++;
  }

  /** Generates a fresh entity variable name, e.g. "_v4". */
  public String entityVariable() {
    return "_v" + id++;
  }

  /** Returns the number of names generated so far. */
  public int count() {
    return id;
  }
}

// End NameGenerator.java
