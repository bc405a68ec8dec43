/*
 * Copyright 2025 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.esupgrade.safety;

import static com.google.common.truth.Truth.assertThat;

import com.esupgrade.ast.IR;
import com.esupgrade.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StructuralEquivalenceTest {

  @Test
  public void testSameNodeIsEquivalent() {
    Node regexp = IR.regexp("a+");
    Node fn = IR.function(IR.paramList(), IR.block());
    Node sum = IR.add(IR.number(1), IR.number(1));

    assertEquivalent(regexp, regexp);
    assertEquivalent(fn, fn);
    assertEquivalent(sum, sum);
  }

  @Test
  public void testNames() {
    assertEquivalent(IR.name("a"), IR.name("a"));
    assertNotEquivalent(IR.name("a"), IR.name("b"));
    assertNotEquivalent(IR.name("a"), IR.string("a"));
    assertNotEquivalent(IR.thisNode(), IR.thisNode());
  }

  @Test
  public void testLiterals() {
    assertEquivalent(IR.string("#id"), IR.string("#id"));
    assertNotEquivalent(IR.string("#id"), IR.string("#other"));
    assertEquivalent(IR.number(3), IR.number(3));
    assertNotEquivalent(IR.number(3), IR.number(4));
    assertNotEquivalent(IR.number(3), IR.string("3"));
    assertEquivalent(IR.trueNode(), IR.trueNode());
    assertNotEquivalent(IR.trueNode(), IR.falseNode());
    assertEquivalent(IR.nullNode(), IR.nullNode());
  }

  @Test
  public void testRegularExpressionsAreNeverEquivalent() {
    assertNotEquivalent(IR.regexp("a+"), IR.regexp("a+"));
  }

  @Test
  public void testNumbersCompareByValue() {
    assertNotEquivalent(IR.number(Double.NaN), IR.number(Double.NaN));
    assertEquivalent(IR.number(0.0), IR.number(-0.0));
  }

  @Test
  public void testMemberAccess() {
    assertEquivalent(IR.getprop(IR.name("a"), "b", "c"), IR.getprop(IR.name("a"), "b", "c"));
    assertNotEquivalent(IR.getprop(IR.name("a"), "b"), IR.getprop(IR.name("a"), "c"));
    assertNotEquivalent(IR.getprop(IR.name("a"), "b"), IR.getprop(IR.name("x"), "b"));
    assertEquivalent(
        IR.getelem(IR.name("a"), IR.number(0)), IR.getelem(IR.name("a"), IR.number(0)));
    assertNotEquivalent(IR.getprop(IR.name("a"), "b"), IR.getelem(IR.name("a"), IR.string("b")));
  }

  @Test
  public void testCalls() {
    assertEquivalent(
        IR.call(IR.name("f"), IR.name("x"), IR.string("y")),
        IR.call(IR.name("f"), IR.name("x"), IR.string("y")));
    assertEquivalent(
        IR.call(IR.getprop(IR.name("document"), "querySelector"), IR.string(".a")),
        IR.call(IR.getprop(IR.name("document"), "querySelector"), IR.string(".a")));
    assertNotEquivalent(
        IR.call(IR.name("f"), IR.name("x")), IR.call(IR.name("f"), IR.name("y")));
    assertNotEquivalent(
        IR.call(IR.name("f"), IR.name("x")), IR.call(IR.name("f"), IR.name("x"), IR.name("y")));
    assertNotEquivalent(IR.call(IR.name("f")), IR.call(IR.name("g")));
  }

  @Test
  public void testConstructorCallsAreNotCompared() {
    assertNotEquivalent(IR.newNode(IR.name("Foo")), IR.newNode(IR.name("Foo")));
  }

  @Test
  public void testOtherShapesAreNotCompared() {
    assertNotEquivalent(IR.add(IR.number(1), IR.number(1)), IR.add(IR.number(1), IR.number(1)));
    assertNotEquivalent(IR.add(IR.number(1), IR.number(1)), IR.number(2));
    assertNotEquivalent(IR.arraylit(), IR.arraylit());
    assertNotEquivalent(
        IR.templateLit(IR.templateLitString("a")), IR.templateLit(IR.templateLitString("a")));
    assertNotEquivalent(
        IR.call(IR.name("f"), IR.arraylit()), IR.call(IR.name("f"), IR.arraylit()));
  }

  @Test
  public void testDeepChain() {
    Node left = IR.name("a");
    Node right = IR.name("a");
    for (int i = 0; i < 100_000; i++) {
      left = IR.getprop(left, "p");
      right = IR.getprop(right, "p");
    }
    assertEquivalent(left, right);

    right = IR.getprop(right, "q");
    left = IR.getprop(left, "r");
    assertNotEquivalent(left, right);
  }

  private static void assertEquivalent(Node a, Node b) {
    assertThat(StructuralEquivalence.areEquivalent(a, b)).isTrue();
    assertThat(StructuralEquivalence.areEquivalent(b, a)).isTrue();
  }

  private static void assertNotEquivalent(Node a, Node b) {
    assertThat(StructuralEquivalence.areEquivalent(a, b)).isFalse();
    assertThat(StructuralEquivalence.areEquivalent(b, a)).isFalse();
  }
}
