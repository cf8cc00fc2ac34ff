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

package org.jsdce.jscomp;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import org.jsdce.rhino.Node;
import org.jsdce.rhino.Token;

/**
 * CodePrinter prints out JS code in either pretty format or compact format.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {
  // There are two separate CodeConsumers, one for pretty-printing and
  // another for compact printing.

  /** The default length of a line after which a newline is forced when possible. */
  public static final int DEFAULT_LINE_LENGTH_THRESHOLD = 500;

  private CodePrinter() {}

  private abstract static class LineTrackingCodePrinter extends CodeConsumer {
    protected final StringBuilder code = new StringBuilder(1024);
    protected final int lineLengthThreshold;
    protected int lineLength = 0;
    protected int lineIndex = 0;

    LineTrackingCodePrinter(int lineLengthThreshold) {
      this.lineLengthThreshold = lineLengthThreshold <= 0 ? Integer.MAX_VALUE : lineLengthThreshold;
    }

    @Override
    char getLastChar() {
      return (code.length() > 0) ? code.charAt(code.length() - 1) : '\0';
    }

    void trackNewlines(String str) {
      // Correct lineIndex and lineLength if there were newlines in the string.
      int newlines = CharMatcher.is('\n').countIn(str);
      if (newlines > 0) {
        lineIndex += newlines;
        lineLength = str.length() - str.lastIndexOf('\n');
      }
    }

    public String getCode() {
      return code.toString();
    }
  }

  static class PrettyCodePrinter extends LineTrackingCodePrinter {
    static final String INDENT = "  ";

    private int indent = 0;

    /**
     * @param lineLengthThreshold The length of a line after which we force a newline when
     *     possible.
     */
    PrettyCodePrinter(int lineLengthThreshold) {
      super(lineLengthThreshold);
    }

    /** Appends a string to the code, keeping track of the current line length. */
    @Override
    void append(String str) {
      // For pretty printing: indent at the beginning of the line
      if (lineLength == 0) {
        for (int i = 0; i < indent; i++) {
          code.append(INDENT);
          lineLength += INDENT.length();
        }
      }
      code.append(str);
      lineLength += str.length();
      trackNewlines(str);
    }

    /**
     * Adds a newline to the code, resetting the line length and handling indenting for pretty
     * printing.
     */
    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append('\n');
        lineIndex++;
        lineLength = 0;
      }
    }

    @Override
    void maybeLineBreak() {
      maybeCutLine();
    }

    /** This may start a new line if the current line is longer than the line length threshold. */
    @Override
    void maybeCutLine() {
      if (lineLength > lineLengthThreshold) {
        startNewLine();
      }
    }

    @Override
    void endLine() {
      startNewLine();
    }

    @Override
    void appendBlockStart() {
      maybeInsertSpace();
      append("{");
      indent++;
    }

    @Override
    void appendBlockEnd() {
      maybeEndStatement();
      endLine();
      indent--;
      append("}");
    }

    @Override
    void listSeparator() {
      add(", ");
      maybeLineBreak();
    }

    @Override
    void endFunction(boolean statementContext) {
      super.endFunction(statementContext);
      if (statementContext) {
        startNewLine();
      }
    }

    @Override
    void beginCaseBody() {
      super.beginCaseBody();
      indent++;
      endLine();
    }

    @Override
    void endCaseBody() {
      super.endCaseBody();
      indent--;
    }

    @Override
    void appendOp(String op, boolean binOp) {
      if (getLastChar() != ' ' && binOp && op.charAt(0) != ',') {
        append(" ");
      }
      append(op);
      if (binOp) {
        append(" ");
      }
    }

    @Override
    void maybeInsertSpace() {
      if (getLastChar() != ' ' && getLastChar() != '\n') {
        add(" ");
      }
    }

    /** @return Whether the a line break should be added after the specified BLOCK. */
    @Override
    boolean breakAfterBlockFor(Node n, boolean isStatementContext) {
      checkState(n.isBlock(), n);
      Node parent = n.getParent();
      if (parent == null) {
        return true;
      }
      Token type = parent.getToken();
      switch (type) {
        case DO:
          // Don't break before 'while' in DO-WHILE statements.
          return false;
        case FUNCTION:
          // FUNCTIONs are handled separately, don't break here.
          return false;
        case TRY:
          // Don't break before catch
          return n != parent.getFirstChild();
        case CATCH:
          // Don't break before finally
          return parent.getGrandparent().getChildCount() != 3;
        case IF:
          // Don't break before else
          return n == parent.getLastChild();
        default:
          break;
      }
      return true;
    }

    @Override
    void endStatement(boolean needsSemicolon) {
      append(";");
      endLine();
      statementNeedsEnded = false;
    }
  }

  static class CompactCodePrinter extends LineTrackingCodePrinter {
    /**
     * @param lineLengthThreshold The length of a line after which we force a newline when
     *     possible.
     */
    CompactCodePrinter(int lineLengthThreshold) {
      super(lineLengthThreshold);
    }

    /** Appends a string to the code, keeping track of the current line length. */
    @Override
    void append(String str) {
      code.append(str);
      lineLength += str.length();
      trackNewlines(str);
    }

    /** Adds a newline to the code, resetting the line length. */
    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append('\n');
        lineLength = 0;
        lineIndex++;
      }
    }

    /** This may start a new line if the current line is longer than the line length threshold. */
    @Override
    void maybeCutLine() {
      if (lineLength > lineLengthThreshold) {
        startNewLine();
      }
    }
  }

  public static final class Builder {
    private final Node root;
    private boolean prettyPrint;
    private final int lineLengthThreshold = DEFAULT_LINE_LENGTH_THRESHOLD;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = node;
    }

    /** Sets the output options from compiler options. */
    public Builder setCompilerOptions(CompilerOptions options) {
      this.prettyPrint = options.isPrettyPrint();
      return this;
    }

    /**
     * Sets whether pretty printing should be used.
     *
     * @param prettyPrint If true, pretty printing will be used.
     */
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    /**
     * Generates the source code and returns it.
     */
    public String build() {
      checkNotNull(root, "Cannot build without root node being specified");
      return toSource(root, prettyPrint ? Format.PRETTY : Format.COMPACT, lineLengthThreshold);
    }
  }

  /** Specifies a format for code generation. */
  public enum Format {
    COMPACT,
    PRETTY
  }

  /** Converts a tree to JS code */
  private static String toSource(Node root, Format outputFormat, int lineLengthThreshold) {
    LineTrackingCodePrinter printer =
        outputFormat == Format.COMPACT
            ? new CompactCodePrinter(lineLengthThreshold)
            : new PrettyCodePrinter(lineLengthThreshold);
    CodeGenerator cg = new CodeGenerator(printer);
    cg.add(root);
    printer.endFile();
    return printer.getCode();
  }
}
