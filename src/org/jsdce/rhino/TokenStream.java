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

import com.google.common.collect.ImmutableSet;

/** Keyword and identifier tables shared by the scanner and the code printer. */
public class TokenStream {

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "break", "case", "catch", "continue", "debugger", "default", "delete", "do", "else",
          "false", "finally", "for", "function", "if", "in", "instanceof", "new", "null",
          "return", "switch", "this", "throw", "true", "try", "typeof", "var", "void", "while",
          "with");

  /** Words that cannot be used as identifiers even though the parser gives them no meaning. */
  private static final ImmutableSet<String> FUTURE_RESERVED =
      ImmutableSet.of("class", "const", "enum", "export", "extends", "import", "super");

  private TokenStream() {}

  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name) || FUTURE_RESERVED.contains(name);
  }

  public static boolean isJSIdentifierStart(char c) {
    return Character.isJavaIdentifierStart(c) || c == '$';
  }

  public static boolean isJSIdentifierPart(char c) {
    return Character.isJavaIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
  }

  /** Returns true if {@code s} can be written as a bare identifier. */
  public static boolean isJSIdentifier(String s) {
    int length = s.length();
    if (length == 0 || !isJSIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < length; i++) {
      if (!isJSIdentifierPart(s.charAt(i))) {
        return false;
      }
    }
    return !isKeyword(s);
  }
}
