/*
 *
 * ***** BEGIN LICENSE BLOCK *****
 * Version: MPL 1.1/GPL 2.0
 *
 * The contents of this file are subject to the Mozilla Public License Version
 * 1.1 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * http://www.mozilla.org/MPL/
 *
 * Software distributed under the License is distributed on an "AS IS" basis,
 * WITHOUT WARRANTY OF ANY KIND, either express or implied. See the License
 * for the specific language governing rights and limitations under the
 * License.
 *
 * The Original Code is Rhino code, released
 * May 6, 1999.
 *
 * The Initial Developer of the Original Code is
 * Netscape Communications Corporation.
 * Portions created by the Initial Developer are Copyright (C) 1997-1999
 * the Initial Developer. All Rights Reserved.
 *
 * Contributor(s):
 *   Norris Boyd
 *   Roger Lawrence
 *   Mike McCabe
 *
 * Alternatively, the contents of this file may be used under the terms of
 * the GNU General Public License Version 2 or later (the "GPL"), in which
 * case the provisions of the GPL are applicable instead of those above. If
 * you wish to allow use of your version of this file only under the terms of
 * the GPL and not to allow others to use your version of this file under the
 * MPL, indicate your decision by deleting the provisions above and replacing
 * them with the notice and other provisions required by the GPL. If you do
 * not delete the provisions above, a recipient may use your version of this
 * file under either the MPL or the GPL.
 *
 * ***** END LICENSE BLOCK ***** */

package org.jsdce.rhino;

/**
 * The node types of the JavaScript tree. Operators reuse the token of the same name, so {@code ADD}
 * is both the {@code +} token and the addition expression node.
 */
public enum Token {
  // Structure.
  ROOT,
  SCRIPT,
  BLOCK,
  EMPTY,

  // Statements.
  EXPR_RESULT,
  VAR,
  FUNCTION,
  PARAM_LIST,
  RETURN,
  IF,
  WHILE,
  DO,
  FOR,
  FOR_IN,
  BREAK,
  CONTINUE,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  TRY,
  CATCH,
  THROW,
  LABEL,
  LABEL_NAME,
  WITH,
  DEBUGGER,

  // Primary expressions.
  NAME,
  STRINGLIT,
  NUMBER,
  TRUE,
  FALSE,
  NULL,
  THIS,
  REGEXP,
  OBJECTLIT,
  STRING_KEY,
  GETTER_DEF,
  SETTER_DEF,
  COMPUTED_PROP,
  ARRAYLIT,

  // Member access, calls.
  GETPROP,
  GETELEM,
  CALL,
  NEW,

  // Assignment.
  ASSIGN,
  ASSIGN_BITOR,
  ASSIGN_BITXOR,
  ASSIGN_BITAND,
  ASSIGN_LSH,
  ASSIGN_RSH,
  ASSIGN_URSH,
  ASSIGN_ADD,
  ASSIGN_SUB,
  ASSIGN_MUL,
  ASSIGN_DIV,
  ASSIGN_MOD,

  // Operators.
  HOOK,
  OR,
  AND,
  COALESCE,
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  SHEQ,
  SHNE,
  LT,
  LE,
  GT,
  GE,
  INSTANCEOF,
  IN,
  LSH,
  RSH,
  URSH,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  NOT,
  BITNOT,
  POS,
  NEG,
  TYPEOF,
  VOID,
  DELPROP,
  INC,
  DEC,
  COMMA;

  /** Returns true for the simple and compound assignment operators. */
  public boolean isAssignmentOp() {
    return compareTo(ASSIGN) >= 0 && compareTo(ASSIGN_MOD) <= 0;
  }

  /** Returns true for the compound assignment operators, such as {@code +=}. */
  public boolean isCompoundAssignmentOp() {
    return this != ASSIGN && isAssignmentOp();
  }

  /** Returns true for the operators that take two operands. */
  public boolean isBinaryOp() {
    switch (this) {
      case OR:
      case AND:
      case COALESCE:
      case BITOR:
      case BITXOR:
      case BITAND:
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
      case LT:
      case LE:
      case GT:
      case GE:
      case INSTANCEOF:
      case IN:
      case LSH:
      case RSH:
      case URSH:
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case COMMA:
        return true;
      default:
        return false;
    }
  }

  /** Returns true for the prefix operators that take one operand, excluding INC and DEC. */
  public boolean isUnaryOp() {
    switch (this) {
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
      case TYPEOF:
      case VOID:
      case DELPROP:
        return true;
      default:
        return false;
    }
  }
}
