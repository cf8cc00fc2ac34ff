/*
 * Copyright 2026 The Closure Compiler Authors.
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

package org.jsdce.jscomp.parsing;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.jsdce.rhino.TokenStream;
import org.jspecify.annotations.Nullable;

/**
 * Splits JavaScript source text into tokens. Comments and whitespace are dropped; a token records
 * whether a line terminator preceded it so the parser can apply automatic semicolon insertion.
 */
final class Scanner {

  enum Kind {
    EOF,
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    REGEXP,
    PUNCTUATOR,
  }

  /** A lexical token. For strings {@code value} is the decoded text. */
  static final class JsToken {
    final Kind kind;
    final String value;
    final double number;
    final int lineno;
    final int charno;
    final boolean afterLineTerminator;

    JsToken(
        Kind kind,
        String value,
        double number,
        int lineno,
        int charno,
        boolean afterLineTerminator) {
      this.kind = kind;
      this.value = value;
      this.number = number;
      this.lineno = lineno;
      this.charno = charno;
      this.afterLineTerminator = afterLineTerminator;
    }

    boolean is(Kind kind, String value) {
      return this.kind == kind && this.value.equals(value);
    }

    boolean isPunctuator(String value) {
      return is(Kind.PUNCTUATOR, value);
    }

    boolean isKeyword(String value) {
      return is(Kind.KEYWORD, value);
    }

    @Override
    public String toString() {
      return kind == Kind.EOF ? "end of input" : value;
    }
  }

  // Longest first, so that a prefix never shadows a longer operator.
  private static final ImmutableList<String> PUNCTUATORS =
      ImmutableList.of(
          ">>>=", "===", "!==", "<<=", ">>=", ">>>", "&&", "||", "??", "==", "!=", "<=", ">=",
          "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "++", "--", "<<", ">>", "{", "}", "(",
          ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%", "&", "|", "^", "!", "~",
          "?", ":", "=", ".");

  private final String source;
  private int pos = 0;
  private int lineno = 1;
  private int lineStart = 0;
  private boolean sawLineTerminator = false;
  private @Nullable JsToken lastToken = null;

  Scanner(String source) {
    this.source = source;
  }

  /** Scans the whole source; the returned list always ends with an EOF token. */
  ImmutableList<JsToken> tokenize() {
    ImmutableList.Builder<JsToken> tokens = ImmutableList.builder();
    while (true) {
      JsToken token = nextToken();
      tokens.add(token);
      if (token.kind == Kind.EOF) {
        return tokens.build();
      }
      lastToken = token;
    }
  }

  private JsToken nextToken() {
    sawLineTerminator = false;
    skipWhitespaceAndComments();
    int startLine = lineno;
    int startChar = pos - lineStart;
    if (pos >= source.length()) {
      return token(Kind.EOF, "", 0, startLine, startChar);
    }
    char c = source.charAt(pos);
    if (TokenStream.isJSIdentifierStart(c)) {
      int start = pos;
      while (pos < source.length() && TokenStream.isJSIdentifierPart(source.charAt(pos))) {
        pos++;
      }
      String word = source.substring(start, pos);
      Kind kind = TokenStream.isKeyword(word) ? Kind.KEYWORD : Kind.NAME;
      return token(kind, word, 0, startLine, startChar);
    }
    if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
      return scanNumber(startLine, startChar);
    }
    if (c == '"' || c == '\'') {
      return scanString(c, startLine, startChar);
    }
    if (c == '/' && regexAllowed()) {
      return scanRegExp(startLine, startChar);
    }
    for (String p : PUNCTUATORS) {
      if (source.startsWith(p, pos)) {
        pos += p.length();
        return token(Kind.PUNCTUATOR, p, 0, startLine, startChar);
      }
    }
    throw error("illegal character '" + c + "'", startLine, startChar);
  }

  private JsToken token(Kind kind, String value, double number, int line, int charno) {
    return new JsToken(kind, value, number, line, charno, sawLineTerminator);
  }

  /**
   * A slash starts a regular expression unless the previous token ends an operand. A closing
   * brace is assumed to end an object literal.
   */
  private boolean regexAllowed() {
    if (lastToken == null) {
      return true;
    }
    switch (lastToken.kind) {
      case NAME:
      case NUMBER:
      case STRING:
      case REGEXP:
        return false;
      case KEYWORD:
        switch (lastToken.value) {
          case "this":
          case "true":
          case "false":
          case "null":
            return false;
          default:
            return true;
        }
      case PUNCTUATOR:
        switch (lastToken.value) {
          case ")":
          case "]":
          case "}":
            return false;
          default:
            return true;
        }
      default:
        return true;
    }
  }

  private void skipWhitespaceAndComments() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
        newline();
      } else if (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF') {
        pos++;
      } else if (source.startsWith("//", pos)) {
        while (pos < source.length() && !isLineTerminator(source.charAt(pos))) {
          pos++;
        }
      } else if (source.startsWith("/*", pos)) {
        int startLine = lineno;
        int startChar = pos - lineStart;
        pos += 2;
        while (!source.startsWith("*/", pos)) {
          if (pos >= source.length()) {
            throw error("unterminated comment", startLine, startChar);
          }
          if (isLineTerminator(source.charAt(pos))) {
            newline();
          } else {
            pos++;
          }
        }
        pos += 2;
      } else {
        return;
      }
    }
  }

  private void newline() {
    if (source.charAt(pos) == '\r' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
      pos++;
    }
    pos++;
    lineno++;
    lineStart = pos;
    sawLineTerminator = true;
  }

  private JsToken scanNumber(int startLine, int startChar) {
    int start = pos;
    double value;
    if (source.charAt(pos) == '0'
        && pos + 1 < source.length()
        && (source.charAt(pos + 1) == 'x' || source.charAt(pos + 1) == 'X')) {
      pos += 2;
      int digitsStart = pos;
      while (pos < source.length() && Character.digit(source.charAt(pos), 16) >= 0) {
        pos++;
      }
      if (pos == digitsStart) {
        throw error("missing hexadecimal digits after '0x'", startLine, startChar);
      }
      value = new BigInteger(source.substring(digitsStart, pos), 16).doubleValue();
    } else {
      skipDigits();
      if (pos < source.length() && source.charAt(pos) == '.') {
        pos++;
        skipDigits();
      }
      if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
        pos++;
        if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
          pos++;
        }
        int exponentStart = pos;
        skipDigits();
        if (pos == exponentStart) {
          throw error("missing exponent", startLine, startChar);
        }
      }
      value = Double.parseDouble(source.substring(start, pos));
    }
    if (pos < source.length() && TokenStream.isJSIdentifierStart(source.charAt(pos))) {
      throw error("identifier starts immediately after numeric literal", startLine, startChar);
    }
    return token(Kind.NUMBER, source.substring(start, pos), value, startLine, startChar);
  }

  private void skipDigits() {
    while (pos < source.length() && isDigit(source.charAt(pos))) {
      pos++;
    }
  }

  private JsToken scanString(char quote, int startLine, int startChar) {
    StringBuilder sb = new StringBuilder();
    pos++;
    while (true) {
      if (pos >= source.length() || isLineTerminator(source.charAt(pos))) {
        throw error("unterminated string literal", startLine, startChar);
      }
      char c = source.charAt(pos++);
      if (c == quote) {
        break;
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (pos >= source.length()) {
        throw error("unterminated string literal", startLine, startChar);
      }
      char e = source.charAt(pos++);
      switch (e) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'v':
          sb.append('\u000B');
          break;
        case '0':
          sb.append('\0');
          break;
        case 'x':
          sb.append((char) hexValue(2, startLine, startChar));
          break;
        case 'u':
          sb.append((char) hexValue(4, startLine, startChar));
          break;
        case '\r':
          if (pos < source.length() && source.charAt(pos) == '\n') {
            pos++;
          }
          lineno++;
          lineStart = pos;
          break;
        case '\n':
        case '\u2028':
        case '\u2029':
          // Line continuation.
          lineno++;
          lineStart = pos;
          break;
        default:
          sb.append(e);
      }
    }
    return token(Kind.STRING, sb.toString(), 0, startLine, startChar);
  }

  private int hexValue(int digits, int startLine, int startChar) {
    if (pos + digits > source.length()) {
      throw error("malformed escape sequence", startLine, startChar);
    }
    int value = 0;
    for (int i = 0; i < digits; i++) {
      int d = Character.digit(source.charAt(pos++), 16);
      if (d < 0) {
        throw error("malformed escape sequence", startLine, startChar);
      }
      value = value * 16 + d;
    }
    return value;
  }

  /** The token value is the literal text, slashes and flags included. */
  private JsToken scanRegExp(int startLine, int startChar) {
    int start = pos;
    pos++;
    boolean inClass = false;
    while (true) {
      if (pos >= source.length() || isLineTerminator(source.charAt(pos))) {
        throw error("unterminated regular expression literal", startLine, startChar);
      }
      char c = source.charAt(pos++);
      if (c == '\\') {
        pos++;
      } else if (c == '[') {
        inClass = true;
      } else if (c == ']') {
        inClass = false;
      } else if (c == '/' && !inClass) {
        break;
      }
    }
    while (pos < source.length() && TokenStream.isJSIdentifierPart(source.charAt(pos))) {
      pos++;
    }
    return token(Kind.REGEXP, source.substring(start, pos), 0, startLine, startChar);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isLineTerminator(char c) {
    return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
  }

  private static ParserException error(String message, int line, int charno) {
    return new ParserException(message, line, charno);
  }
}
