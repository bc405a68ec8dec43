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

package com.esupgrade.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testDeclarationWithInitializer() {
    Node decl = IR.let(IR.name("x"), IR.number(1));
    assertThat(decl.isLet()).isTrue();
    Node name = decl.getFirstChild();
    assertThat(name.isName()).isTrue();
    assertThat(name.getFirstChild().isNumber()).isTrue();
  }

  @Test
  public void testDestructuringDeclaration() {
    Node pattern = IR.objectPattern(IR.stringKey("a", IR.name("b")));
    Node decl = IR.constNode(pattern, IR.name("obj"));

    Node lhs = decl.getFirstChild();
    assertThat(lhs.isDestructuringLhs()).isTrue();
    assertThat(lhs.getFirstChild()).isSameInstanceAs(pattern);
    assertThat(lhs.getSecondChild().getString()).isEqualTo("obj");
  }

  @Test
  public void testDeclarationList() {
    Node decl =
        IR.declarationList(
            Token.VAR, IR.declarator(IR.name("a"), IR.number(1)), IR.name("b"));
    assertThat(decl.getChildCount()).isEqualTo(2);
    assertThat(decl.getLastChild().hasChildren()).isFalse();
    assertThrows(
        IllegalArgumentException.class, () -> IR.declarationList(Token.FUNCTION, IR.name("a")));
  }

  @Test
  public void testGetprop() {
    Node n = IR.getprop(IR.name("a"), "b", "c");
    assertThat(n.isGetProp()).isTrue();
    assertThat(n.getSecondChild().getString()).isEqualTo("c");
    assertThat(n.getFirstChild().getSecondChild().getString()).isEqualTo("b");
  }

  @Test
  public void testTryCatch() {
    Node catchNode = IR.catchNode(IR.name("e"), IR.block());
    Node tryNode = IR.tryCatch(IR.block(), catchNode);
    assertThat(tryNode.getSecondChild().isBlock()).isTrue();
    assertThat(catchNode.getParent()).isSameInstanceAs(tryNode.getSecondChild());
  }

  @Test
  public void testInvalidShapes() {
    assertThrows(
        IllegalStateException.class,
        () -> IR.ifNode(IR.name("c"), IR.exprResult(IR.name("x"))));
    assertThrows(IllegalStateException.class, () -> IR.name("a.b"));
    assertThrows(IllegalStateException.class, () -> IR.exprResult(IR.block()));
    assertThrows(
        IllegalStateException.class,
        () -> IR.forOf(IR.var(IR.name("x"), IR.number(1)), IR.name("xs"), IR.block()));
    assertThrows(IllegalStateException.class, () -> IR.assign(IR.number(1), IR.number(2)));
    assertThrows(
        IllegalArgumentException.class, () -> IR.assignOp(Token.ADD, IR.name("x"), IR.number(1)));
  }

  @Test
  public void testStatements() {
    Node loop = IR.whileNode(IR.trueNode(), IR.block(IR.throwNode(IR.name("e"))));
    assertThat(loop.getToken()).isEqualTo(Token.WHILE);
    assertThat(loop.getSecondChild().getFirstChild().getToken()).isEqualTo(Token.THROW);

    Node doLoop = IR.doNode(IR.block(), IR.falseNode());
    assertThat(doLoop.getToken()).isEqualTo(Token.DO);
    assertThat(doLoop.getSecondChild().getToken()).isEqualTo(Token.FALSE);

    Node finallyOnly = IR.tryFinally(IR.block(), IR.block());
    assertThat(finallyOnly.getChildCount()).isEqualTo(3);
    assertThat(finallyOnly.getSecondChild().hasChildren()).isFalse();

    Node full =
        IR.tryCatchFinally(IR.block(), IR.catchNode(IR.name("e"), IR.block()), IR.block());
    assertThat(full.getChildCount()).isEqualTo(3);
    assertThat(full.getSecondChild().getFirstChild().isCatch()).isTrue();

    Node switchNode =
        IR.switchNode(
            IR.name("x"),
            IR.caseNode(IR.number(1), IR.block()),
            IR.defaultCase(IR.block()));
    assertThat(switchNode.getLastChild().getToken()).isEqualTo(Token.DEFAULT_CASE);
  }

  @Test
  public void testOperators() {
    assertThat(IR.comma(IR.name("a"), IR.name("b")).getToken()).isEqualTo(Token.COMMA);
    assertThat(IR.hook(IR.name("c"), IR.number(1), IR.number(2)).getChildCount()).isEqualTo(3);
    assertThat(IR.eq(IR.name("a"), IR.nullNode()).getToken()).isEqualTo(Token.EQ);
    assertThat(IR.sub(IR.name("a"), IR.number(1)).getToken()).isEqualTo(Token.SUB);
    assertThat(IR.mul(IR.name("a"), IR.number(2)).getToken()).isEqualTo(Token.MUL);
    assertThat(IR.typeof(IR.name("a")).getToken()).isEqualTo(Token.TYPEOF);
    assertThat(IR.and(IR.name("a"), IR.name("b")).getToken()).isEqualTo(Token.AND);
    assertThat(IR.or(IR.name("a"), IR.name("b")).getToken()).isEqualTo(Token.OR);
    assertThat(IR.not(IR.name("a")).getFirstChild().getString()).isEqualTo("a");
    assertThat(IR.await(IR.call(IR.name("f"))).getKind()).isEqualTo(NodeKind.OPERATOR);
    assertThrows(IllegalStateException.class, () -> IR.comma(IR.name("a"), IR.block()));
  }

  @Test
  public void testSpreadsAndMembers() {
    Node array = IR.arraylit(IR.number(1), IR.iterSpread(IR.name("rest")));
    assertThat(array.getLastChild().getToken()).isEqualTo(Token.ITER_SPREAD);

    Node method =
        IR.memberFunctionDef("m", IR.function(IR.paramList(), IR.block()));
    Node object = IR.objectlit(IR.objectSpread(IR.name("base")), method);
    assertThat(object.getFirstChild().getToken()).isEqualTo(Token.OBJECT_SPREAD);
    assertThat(object.getLastChild().getString()).isEqualTo("m");

    Node template =
        IR.templateLit(
            IR.templateLitString("a"),
            IR.templateLitSubstitution(IR.name("x")),
            IR.templateLitString("b"));
    assertThat(template.getChildCount()).isEqualTo(3);
    assertThat(template.getSecondChild().getFirstChild().getString()).isEqualTo("x");
  }

  @Test
  public void testObjectPatternElements() {
    // {[k]: a, ...rest}
    Node pattern =
        IR.objectPattern(
            IR.computedProp(IR.name("k"), IR.name("a")), IR.objectRest(IR.name("rest")));
    assertThat(pattern.getFirstChild().isComputedProp()).isTrue();
    assertThat(pattern.getLastChild().getToken()).isEqualTo(Token.OBJECT_REST);
    assertThrows(IllegalStateException.class, () -> IR.objectPattern(IR.name("a")));
  }

  @Test
  public void testMayBeExpression() {
    assertThat(IR.mayBeExpression(IR.name("x"))).isTrue();
    assertThat(IR.mayBeExpression(IR.thisNode())).isTrue();
    assertThat(IR.mayBeExpression(IR.function(IR.paramList(), IR.block()))).isTrue();
    assertThat(IR.mayBeExpression(IR.block())).isFalse();
    assertThat(IR.mayBeExpression(IR.var(IR.name("x")))).isFalse();
    assertThat(IR.mayBeExpression(IR.arrayPattern(IR.name("x")))).isFalse();
  }
}
