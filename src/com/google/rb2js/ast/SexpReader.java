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

package com.google.rb2js.ast;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads trees written as s-expressions, the notation Ruby parser gems print:
 *
 * <pre>
 *   (send nil :puts (str "hello"))
 * </pre>
 *
 * <p>Symbols and strings both read as {@link String} children; {@code nil}, {@code true} and
 * {@code false} in child position read as an empty slot and booleans. Every node gets a span
 * covering its own parenthesised text, so converting the text this reader consumed yields source
 * maps that point back into it.
 */
public final class SexpReader {

  /** Thrown for text that is not a well formed s-expression. */
  public static final class MalformedSexpException extends RuntimeException {
    private final int line;
    private final int column;

    MalformedSexpException(String message, int line, int column) {
      super(message + " at " + line + ":" + column);
      this.line = line;
      this.column = column;
    }

    public int getLine() {
      return line;
    }

    public int getColumn() {
      return column;
    }
  }

  private final String text;
  private final @Nullable String sourceFile;
  private int pos = 0;
  private int line = 1;
  private int column = 0;

  private SexpReader(String text, @Nullable String sourceFile) {
    this.text = text;
    this.sourceFile = sourceFile;
  }

  /** Reads a single tree. Several top level forms are wrapped in a {@code begin} node. */
  public static Node read(String text, @Nullable String sourceFile) {
    SexpReader reader = new SexpReader(text, sourceFile);
    List<Node> forms = new ArrayList<>();
    reader.skipSpace();
    while (!reader.atEnd()) {
      forms.add(reader.readNode());
      reader.skipSpace();
    }
    if (forms.isEmpty()) {
      throw new MalformedSexpException("empty input", 1, 0);
    }
    if (forms.size() == 1) {
      return forms.get(0);
    }
    SourceSpan span = null;
    Node first = forms.get(0);
    Node last = forms.get(forms.size() - 1);
    if (first.getSpan() != null && last.getSpan() != null) {
      span = first.getSpan().union(last.getSpan());
    }
    return Node.create(Token.BEGIN, forms, span);
  }

  public static Node read(String text) {
    return read(text, null);
  }

  private Node readNode() {
    int startLine = line;
    int startColumn = column;
    expect('(');
    skipSpace();
    String kindName = readBareWord();
    Token kind = Token.fromName(kindName);
    if (kind == null) {
      throw error("unknown node kind '" + kindName + "'");
    }
    List<@Nullable Object> children = new ArrayList<>();
    skipSpace();
    while (peek() != ')') {
      children.add(readChild());
      skipSpace();
    }
    expect(')');
    return Node.create(
        kind, children, SourceSpan.create(sourceFile, startLine, startColumn, line, column));
  }

  private @Nullable Object readChild() {
    char c = peek();
    switch (c) {
      case '(':
        return readNode();
      case ':':
        advance();
        if (peek() == '"') {
          return readQuoted();
        }
        return readSymbol();
      case '"':
        return readQuoted();
      default:
        break;
    }
    if (c == '-' || Character.isDigit(c)) {
      return readNumber();
    }
    String word = readBareWord();
    switch (word) {
      case "nil":
        return null;
      case "true":
        return Boolean.TRUE;
      case "false":
        return Boolean.FALSE;
      default:
        throw error("unexpected '" + word + "'");
    }
  }

  private String readSymbol() {
    int start = pos;
    while (!atEnd() && !isDelimiter(peek())) {
      advance();
    }
    if (start == pos) {
      throw error("empty symbol");
    }
    return text.substring(start, pos);
  }

  private Object readNumber() {
    int start = pos;
    boolean isFloat = false;
    if (peek() == '-') {
      advance();
    }
    while (!atEnd() && !isDelimiter(peek())) {
      char c = peek();
      if (c == '.' || c == 'e' || c == 'E') {
        isFloat = true;
      } else if (!Character.isDigit(c) && c != '-' && c != '+' && c != '_') {
        throw error("bad number");
      }
      advance();
    }
    String literal = text.substring(start, pos).replace("_", "");
    try {
      return isFloat ? (Object) Double.valueOf(literal) : (Object) Long.valueOf(literal);
    } catch (NumberFormatException e) {
      throw error("bad number '" + literal + "'");
    }
  }

  private String readQuoted() {
    expect('"');
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (atEnd()) {
        throw error("unterminated string");
      }
      char c = advance();
      if (c == '"') {
        return sb.toString();
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (atEnd()) {
        throw error("unterminated string");
      }
      char escaped = advance();
      switch (escaped) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'r':
          sb.append('\r');
          break;
        case '0':
          sb.append('\0');
          break;
        case 'e':
          sb.append('\u001b');
          break;
        case 'u':
          if (pos + 4 > text.length()) {
            throw error("bad unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
          } catch (NumberFormatException e) {
            throw error("bad unicode escape");
          }
          for (int i = 0; i < 4; i++) {
            advance();
          }
          break;
        default:
          sb.append(escaped);
      }
    }
  }

  private String readBareWord() {
    int start = pos;
    while (!atEnd() && !isDelimiter(peek())) {
      advance();
    }
    if (start == pos) {
      throw error("expected a word");
    }
    return text.substring(start, pos);
  }

  private static boolean isDelimiter(char c) {
    return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"';
  }

  private void skipSpace() {
    while (!atEnd()) {
      char c = peek();
      if (c == '#') {
        while (!atEnd() && peek() != '\n') {
          advance();
        }
      } else if (Character.isWhitespace(c)) {
        advance();
      } else {
        return;
      }
    }
  }

  private void expect(char c) {
    if (atEnd() || peek() != c) {
      throw error("expected '" + c + "'");
    }
    advance();
  }

  private boolean atEnd() {
    return pos >= text.length();
  }

  private char peek() {
    if (atEnd()) {
      throw error("unexpected end of input");
    }
    return text.charAt(pos);
  }

  private char advance() {
    char c = text.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 0;
    } else {
      column++;
    }
    return c;
  }

  private MalformedSexpException error(String message) {
    return new MalformedSexpException(message, line, column);
  }

  /** Appends {@code value} as a symbol when it reads back unchanged, else as a quoted string. */
  static void appendString(StringBuilder sb, String value) {
    boolean bare = !value.isEmpty();
    for (int i = 0; i < value.length() && bare; i++) {
      char c = value.charAt(i);
      bare = !isDelimiter(c) && c != '\\' && c != ':' && c != '#';
    }
    if (bare) {
      sb.append(':').append(value);
      return;
    }
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\r':
          sb.append("\\r");
          break;
        default:
          sb.append(c);
      }
    }
    sb.append('"');
  }
}
