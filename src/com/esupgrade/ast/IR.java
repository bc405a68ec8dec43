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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node script(Node... stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatementNoReturn(stmt), "Script cannot contain %s", stmt);
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node... stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt);
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  // functions and classes

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName(), name);
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    return new Node(Token.FUNCTION, name, params, body);
  }

  /** Creates an anonymous function expression. */
  public static Node function(Node params, Node body) {
    return function(name(""), params, body);
  }

  public static Node arrowFunction(Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(body.isBlock() || mayBeExpression(body), body);
    Node func = new Node(Token.FUNCTION, name(""), params, body);
    func.setIsArrowFunction(true);
    return func;
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(
          param.isName()
              || param.isRest()
              || param.isDefaultValue()
              || param.isDestructuringPattern(),
          param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node classNode(Node name, Node superClass, Node members) {
    checkState(name.isName(), name);
    checkState(superClass.isEmpty() || mayBeExpression(superClass), superClass);
    checkState(members.getToken() == Token.CLASS_MEMBERS, members);
    return new Node(Token.CLASS, name, superClass, members);
  }

  public static Node classMembers(Node... members) {
    Node classMembers = new Node(Token.CLASS_MEMBERS);
    for (Node member : members) {
      checkState(member.getToken() == Token.MEMBER_FUNCTION_DEF, member);
      classMembers.addChildToBack(member);
    }
    return classMembers;
  }

  public static Node memberFunctionDef(String name, Node function) {
    checkState(function.isFunction(), function);
    Node member = Node.newString(Token.MEMBER_FUNCTION_DEF, name);
    member.addChildToBack(function);
    return member;
  }

  // declarations

  public static Node var(Node lhs, Node value) {
    return declaration(lhs, value, Token.VAR);
  }

  public static Node var(Node lhs) {
    return declaration(lhs, Token.VAR);
  }

  public static Node let(Node lhs, Node value) {
    return declaration(lhs, value, Token.LET);
  }

  public static Node let(Node lhs) {
    return declaration(lhs, Token.LET);
  }

  public static Node constNode(Node lhs, Node value) {
    return declaration(lhs, value, Token.CONST);
  }

  public static Node declaration(Node lhs, Token type) {
    checkState(lhs.isName() || lhs.isDestructuringPattern() || lhs.isDestructuringLhs(), lhs);
    if (lhs.isDestructuringPattern()) {
      lhs = new Node(Token.DESTRUCTURING_LHS, lhs);
    }
    return new Node(type, lhs);
  }

  public static Node declaration(Node lhs, Node value, Token type) {
    return declaration(declarator(lhs, value), type);
  }

  /**
   * Creates a declaration statement with several declarators, e.g. {@code var a = 1, b;}. Each
   * declarator is a NAME, optionally holding its initializer, or a DESTRUCTURING_LHS.
   */
  public static Node declarationList(Token type, Node... declarators) {
    checkArgument(type == Token.VAR || type == Token.LET || type == Token.CONST, type);
    checkArgument(declarators.length > 0, "empty declaration");
    Node decl = new Node(type);
    for (Node declarator : declarators) {
      checkState(declarator.isName() || declarator.isDestructuringLhs(), declarator);
      decl.addChildToBack(declarator);
    }
    return decl;
  }

  /** Attaches {@code value} as the initializer of a NAME or destructuring pattern. */
  public static Node declarator(Node lhs, Node value) {
    if (lhs.isName()) {
      checkState(!lhs.hasChildren(), lhs);
    } else {
      checkState(lhs.isArrayPattern() || lhs.isObjectPattern(), lhs);
      lhs = new Node(Token.DESTRUCTURING_LHS, lhs);
    }
    checkState(mayBeExpression(value), "%s can't be an expression", value);
    lhs.addChildToBack(value);
    return lhs;
  }

  // statements

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node throwNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.THROW, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    checkState(elseNode.isBlock(), elseNode);
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(body.isBlock(), body);
    return new Node(Token.WHILE, cond, body);
  }

  public static Node doNode(Node body, Node cond) {
    checkState(body.isBlock(), body);
    checkState(mayBeExpression(cond), cond);
    return new Node(Token.DO, body, cond);
  }

  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(
        init.isVar() || init.isLet() || init.isConst() || mayBeExpressionOrEmpty(init), init);
    checkState(mayBeExpressionOrEmpty(cond), cond);
    checkState(mayBeExpressionOrEmpty(incr), incr);
    checkState(body.isBlock(), body);
    Node forNode = new Node(Token.FOR, init, cond, incr);
    forNode.addChildToBack(body);
    return forNode;
  }

  public static Node forIn(Node target, Node obj, Node body) {
    return enhancedFor(Token.FOR_IN, target, obj, body);
  }

  public static Node forOf(Node target, Node iterable, Node body) {
    return enhancedFor(Token.FOR_OF, target, iterable, body);
  }

  private static Node enhancedFor(Token type, Node target, Node iterable, Node body) {
    if (target.isVar() || target.isLet() || target.isConst()) {
      checkState(target.hasOneChild(), target);
      Node declarator = target.getFirstChild();
      checkState(
          (declarator.isName() && !declarator.hasChildren())
              || (declarator.isDestructuringLhs() && declarator.hasOneChild()),
          "loop variable can't have an initializer: %s",
          declarator);
    } else {
      checkState(target.isValidAssignmentTarget(), target);
    }
    checkState(mayBeExpression(iterable), iterable);
    checkState(body.isBlock(), body);
    return new Node(type, target, iterable, body);
  }

  public static Node switchNode(Node cond, Node... cases) {
    checkState(mayBeExpression(cond), cond);
    Node switchNode = new Node(Token.SWITCH, cond);
    for (Node caseNode : cases) {
      checkState(
          caseNode.getToken() == Token.CASE || caseNode.getToken() == Token.DEFAULT_CASE,
          caseNode);
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node expr, Node body) {
    checkState(mayBeExpression(expr), expr);
    checkState(body.isBlock(), body);
    return new Node(Token.CASE, expr, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock(), body);
    return new Node(Token.DEFAULT_CASE, body);
  }

  public static Node tryCatch(Node tryBody, Node catchNode) {
    checkState(tryBody.isBlock(), tryBody);
    checkState(catchNode.isCatch(), catchNode);
    return new Node(Token.TRY, tryBody, new Node(Token.BLOCK, catchNode));
  }

  public static Node tryFinally(Node tryBody, Node finallyBody) {
    checkState(tryBody.isBlock(), tryBody);
    checkState(finallyBody.isBlock(), finallyBody);
    return new Node(Token.TRY, tryBody, block(), finallyBody);
  }

  public static Node tryCatchFinally(Node tryBody, Node catchNode, Node finallyBody) {
    checkState(finallyBody.isBlock(), finallyBody);
    Node tryNode = tryCatch(tryBody, catchNode);
    tryNode.addChildToBack(finallyBody);
    return tryNode;
  }

  public static Node catchNode(Node param, Node body) {
    checkState(param.isName() || param.isDestructuringPattern() || param.isEmpty(), param);
    checkState(body.isBlock(), body);
    return new Node(Token.CATCH, param, body);
  }

  // expressions

  public static Node name(String name) {
    checkState(
        name.indexOf('.') == -1, "Invalid name '%s'. Did you mean to use getprop?", name);
    return Node.newString(Token.NAME, name);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node newNode(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    Node newcall = new Node(Token.NEW, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      newcall.addChildToBack(arg);
    }
    return newcall;
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    checkState(mayBeExpression(target), target);
    Node result = new Node(Token.GETPROP, target, string(prop));
    for (String moreProp : moreProps) {
      result = new Node(Token.GETPROP, result, string(moreProp));
    }
    return result;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(elem), elem);
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isValidAssignmentTarget(), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  /** Creates a compound assignment such as {@code x += 1}. */
  public static Node assignOp(Token op, Node target, Node expr) {
    checkArgument(op.kind() == NodeKind.ASSIGNMENT, op);
    if (op == Token.ASSIGN) {
      return assign(target, expr);
    }
    checkState(target.isName() || target.isGetProp() || target.isGetElem(), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(op, target, expr);
  }

  public static Node inc(Node exp, boolean isPost) {
    Node op = unaryOp(Token.INC, exp);
    op.putBooleanProp(Node.Prop.INCRDECR, isPost);
    return op;
  }

  public static Node dec(Node exp, boolean isPost) {
    Node op = unaryOp(Token.DEC, exp);
    op.putBooleanProp(Node.Prop.INCRDECR, isPost);
    return op;
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeExpression(trueval), trueval);
    checkState(mayBeExpression(falseval), falseval);
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  public static Node comma(Node expr1, Node expr2) {
    return binaryOp(Token.COMMA, expr1, expr2);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node not(Node expr1) {
    return unaryOp(Token.NOT, expr1);
  }

  /** "&lt;" */
  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  /** "==" */
  public static Node eq(Node expr1, Node expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  /** "===" */
  public static Node sheq(Node expr1, Node expr2) {
    return binaryOp(Token.SHEQ, expr1, expr2);
  }

  public static Node neg(Node expr1) {
    return unaryOp(Token.NEG, expr1);
  }

  public static Node pos(Node expr1) {
    return unaryOp(Token.POS, expr1);
  }

  public static Node typeof(Node expr) {
    return unaryOp(Token.TYPEOF, expr);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node sub(Node expr1, Node expr2) {
    return binaryOp(Token.SUB, expr1, expr2);
  }

  public static Node mul(Node expr1, Node expr2) {
    return binaryOp(Token.MUL, expr1, expr2);
  }

  public static Node await(Node expr) {
    return unaryOp(Token.AWAIT, expr);
  }

  // literals

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node regexp(String pattern) {
    return new Node(Token.REGEXP, string(pattern));
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node superNode() {
    return new Node(Token.SUPER);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpressionOrEmpty(expr) || expr.getToken() == Token.ITER_SPREAD, expr);
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(
          propdef.isStringKey()
              || propdef.isComputedProp()
              || propdef.getToken() == Token.MEMBER_FUNCTION_DEF
              || propdef.getToken() == Token.OBJECT_SPREAD,
          propdef);
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  /**
   * Creates an object literal or pattern key. In an object pattern {@code value} is the target
   * the property is bound to.
   */
  public static Node stringKey(String s, Node value) {
    checkState(
        mayBeExpression(value) || value.isDefaultValue() || value.isDestructuringPattern(),
        value);
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToFront(value);
    return stringKey;
  }

  public static Node quotedStringKey(String s, Node value) {
    Node k = stringKey(s, value);
    k.putBooleanProp(Node.Prop.QUOTED, true);
    return k;
  }

  /** Creates the key of {@code {x}}, shorthand for {@code {x: x}}. */
  public static Node shorthandStringKey(String s) {
    Node k = stringKey(s, name(s));
    k.putBooleanProp(Node.Prop.SHORTHAND_PROPERTY, true);
    return k;
  }

  public static Node computedProp(Node key, Node value) {
    checkState(mayBeExpression(key), key);
    checkState(
        mayBeExpression(value) || value.isDefaultValue() || value.isDestructuringPattern(),
        value);
    return new Node(Token.COMPUTED_PROP, key, value);
  }

  public static Node iterSpread(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ITER_SPREAD, expr);
  }

  public static Node objectSpread(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.OBJECT_SPREAD, expr);
  }

  public static Node templateLit(Node... parts) {
    Node templateLit = new Node(Token.TEMPLATELIT);
    for (Node part : parts) {
      checkState(
          part.getToken() == Token.TEMPLATELIT_STRING || part.getToken() == Token.TEMPLATELIT_SUB,
          part);
      templateLit.addChildToBack(part);
    }
    return templateLit;
  }

  public static Node templateLitString(String cooked) {
    return Node.newString(Token.TEMPLATELIT_STRING, cooked);
  }

  public static Node templateLitSubstitution(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.TEMPLATELIT_SUB, expr);
  }

  // destructuring

  public static Node objectPattern(Node... keys) {
    Node objectPattern = new Node(Token.OBJECT_PATTERN);
    for (Node key : keys) {
      checkState(
          key.isStringKey() || key.isComputedProp() || key.getToken() == Token.OBJECT_REST, key);
      objectPattern.addChildToBack(key);
    }
    return objectPattern;
  }

  public static Node arrayPattern(Node... keys) {
    Node arrayPattern = new Node(Token.ARRAY_PATTERN);
    for (Node key : keys) {
      checkState(
          key.getToken() == Token.ITER_REST
              || key.isDefaultValue()
              || key.isEmpty()
              || key.isValidAssignmentTarget(),
          key);
      arrayPattern.addChildToBack(key);
    }
    return arrayPattern;
  }

  public static Node defaultValue(Node target, Node value) {
    checkState(target.isValidAssignmentTarget(), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.DEFAULT_VALUE, target, value);
  }

  public static Node iterRest(Node target) {
    checkState(target.isValidAssignmentTarget(), target);
    return new Node(Token.ITER_REST, target);
  }

  public static Node objectRest(Node target) {
    checkState(target.isValidAssignmentTarget(), target);
    return new Node(Token.OBJECT_REST, target);
  }

  // helper methods

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(token, expr);
  }

  private static boolean mayBeExpressionOrEmpty(Node n) {
    return n.isEmpty() || mayBeExpression(n);
  }

  private static boolean mayBeStatementNoReturn(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
        // EMPTY and FUNCTION are used both in expression and statement
        // contexts
        return true;

      case BLOCK:
      case BREAK:
      case CLASS:
      case CONST:
      case CONTINUE:
      case DO:
      case EXPR_RESULT:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case IF:
      case LABEL:
      case LET:
      case SWITCH:
      case THROW:
      case TRY:
      case VAR:
      case WHILE:
        return true;

      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is a statement, so make a best
   * guess.
   */
  public static boolean mayBeStatement(Node n) {
    return mayBeStatementNoReturn(n) || n.getToken() == Token.RETURN;
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeExpression(Node n) {
    return switch (n.getKind()) {
      case IDENTIFIER,
          LITERAL,
          TEMPLATE,
          COLLECTION,
          MEMBER_ACCESS,
          CALL,
          ASSIGNMENT,
          UPDATE,
          OPERATOR,
          FUNCTION ->
          true;
      case DECLARATION, PATTERN -> false;
      case STATEMENT -> n.isClass();
      case OTHER -> n.isThis() || n.getToken() == Token.SUPER;
    };
  }
}
