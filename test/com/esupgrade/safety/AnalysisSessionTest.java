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
import static org.junit.Assert.assertThrows;

import com.esupgrade.ast.IR;
import com.esupgrade.ast.Node;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AnalysisSessionTest {

  @Test
  public void testRootMustBeUnattached() {
    Node name = IR.name("x");
    IR.script(IR.exprResult(name));
    assertThrows(IllegalArgumentException.class, () -> AnalysisSession.create(name));
  }

  @Test
  public void testNullArguments() {
    assertThrows(NullPointerException.class, () -> AnalysisSession.create(null));
    assertThrows(
        NullPointerException.class, () -> AnalysisSession.create(IR.script(), null));
  }

  @Test
  public void testNodesFromAnotherUnitAreRejected() {
    Node foreign = IR.name("x");
    IR.script(IR.let(foreign, IR.number(1)));
    AnalysisSession session = AnalysisSession.create(IR.script());

    assertThrows(IllegalArgumentException.class, () -> session.classify(foreign));
    assertThrows(IllegalArgumentException.class, () -> session.isWrapperObject(foreign));
    assertThrows(
        IllegalArgumentException.class, () -> session.isSafeToRewriteInitializer(foreign));
  }

  @Test
  public void testCatalogIsBuiltOnce() {
    AnalysisSession session = AnalysisSession.create(IR.script());
    BindingCatalog catalog = session.getBindingCatalog();

    assertThat(session.getBindingCatalog()).isSameInstanceAs(catalog);
    assertThat(catalog.getRoot()).isSameInstanceAs(session.getRoot());
  }

  @Test
  public void testOptionsAreCopied() {
    // let el = wrap(node); el.show();
    Node node = IR.name("node");
    Node script =
        IR.script(
            IR.let(IR.name("el"), IR.call(IR.name("wrap"), node)),
            IR.exprResult(IR.call(IR.getprop(IR.name("el"), "show"))));
    SafetyOptions options = new SafetyOptions();
    options.setWrapperCalleeNames(ImmutableList.of("wrap"));
    AnalysisSession session = AnalysisSession.create(script, options);

    options.setWrapperCalleeNames(ImmutableList.of("other"));

    assertThat(session.resolveAlias("el")).hasValue(node);
  }

  @Test
  public void testClassify() {
    // let x = 1; x = 2; let y = 1;
    Node x = IR.name("x");
    Node y = IR.name("y");
    Node script =
        IR.script(
            IR.let(x, IR.number(1)),
            IR.exprResult(IR.assign(IR.name("x"), IR.number(2))),
            IR.let(y, IR.number(1)));
    AnalysisSession session = AnalysisSession.create(script);

    assertThat(session.classify(x)).isEqualTo(Mutability.MUST_ALLOW_REASSIGNMENT);
    assertThat(session.classify(y)).isEqualTo(Mutability.IMMUTABLE_SAFE);
  }

  @Test
  public void testBindingQueries() {
    // let x = 1; function f(x) { x = 2; }
    Node outer = IR.name("x");
    Node param = IR.name("x");
    Node assign = IR.assign(IR.name("x"), IR.number(2));
    Node script =
        IR.script(
            IR.let(outer, IR.number(1)),
            IR.function(IR.name("f"), IR.paramList(param), IR.block(IR.exprResult(assign))));
    AnalysisSession session = AnalysisSession.create(script);

    assertThat(session.isShadowed(assign, "x", outer)).isTrue();
    assertThat(session.isShadowed(assign, "x", param)).isFalse();
    assertThrows(
        IllegalArgumentException.class, () -> session.isShadowed(assign, "x", IR.name("x")));

    ImmutableList<Binding> bindings = session.bindingsOf("x");
    assertThat(bindings).hasSize(2);
    assertThat(session.isShadowed(assign, "x", bindings.get(0))).isTrue();
    assertThat(session.isShadowed(assign, "x", bindings.get(1))).isFalse();
  }

  @Test
  public void testAliasQueries() {
    // let el = $(node); el.hide();
    Node node = IR.name("node");
    Node call = IR.call(IR.name("$"), node);
    Node script =
        IR.script(
            IR.let(IR.name("el"), call),
            IR.exprResult(IR.call(IR.getprop(IR.name("el"), "hide"))));
    AnalysisSession session = AnalysisSession.create(script);

    assertThat(session.getAliasResolver().isCached("el")).isFalse();
    assertThat(session.resolveAlias("el")).hasValue(node);
    assertThat(session.getAliasResolver().isCached("el")).isTrue();
    assertThat(session.isWrapperObject(call)).isTrue();
    assertThat(session.isSafeToRewriteInitializer(call)).isTrue();
    assertThat(session.countNonDeclaratorUsages("el")).isEqualTo(1);
  }

  @Test
  public void testTreeLocalQueries() {
    AnalysisSession session = AnalysisSession.create(IR.script());

    assertThat(session.areEquivalent(IR.name("a"), IR.name("a"))).isTrue();
    assertThat(session.isProvablyIterable(IR.arraylit())).isTrue();
    assertThat(session.isProvablyIterable(IR.name("someVar"))).isFalse();
    assertThat(session.supportsIndexOfAndIncludes(IR.string("abc"))).isTrue();
    assertThat(session.getNumericValue(IR.neg(IR.number(2)))).isEqualTo(-2.0);
    assertThat(session.isKnownPromise(IR.call(IR.name("fetch"), IR.string("/")))).isTrue();
    assertThat(session.containsStringLiteral(IR.add(IR.name("a"), IR.string("b")))).isTrue();
  }

  @Test
  public void testSessionsAreIndependent() {
    Node script = IR.script(IR.let(IR.name("el"), IR.call(IR.name("$"), IR.name("node"))));
    AnalysisSession first = AnalysisSession.create(script);
    AnalysisSession second = AnalysisSession.create(script);

    first.resolveAlias("el");

    assertThat(second.getAliasResolver().isCached("el")).isFalse();
    assertThat(second.getBindingCatalog()).isNotSameInstanceAs(first.getBindingCatalog());
  }
}
