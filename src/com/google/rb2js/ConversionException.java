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

package com.google.rb2js;

import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.SourceSpan;
import com.google.rb2js.ast.Token;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Base class of every error a conversion reports. Carries the stage that failed and, where one is
 * known, the kind and location of the offending node. Conversions are never retried; the caller
 * sees the first failure.
 */
public abstract class ConversionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** The three error categories a caller can tell apart. */
  public enum ErrorKind {
    SYNTAX,
    UNSUPPORTED_CONSTRUCT,
    PIPELINE
  }

  /** The conversion stage that failed. */
  public enum Stage {
    PARSE,
    FILTER,
    GENERATE,
    NORMALIZE,
    SOURCE_MAP;

    public String getDisplayName() {
      return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
  }

  private final ErrorKind kind;
  private Stage stage;
  private final @Nullable Token nodeKind;
  private final @Nullable SourceSpan span;
  private final String detail;

  protected ConversionException(
      ErrorKind kind,
      Stage stage,
      String detail,
      @Nullable Token nodeKind,
      @Nullable SourceSpan span,
      @Nullable Throwable cause) {
    super(detail, cause);
    this.kind = kind;
    this.stage = stage;
    this.detail = detail;
    this.nodeKind = nodeKind;
    this.span = span;
  }

  protected ConversionException(
      ErrorKind kind, Stage stage, String detail, @Nullable Node node, @Nullable Throwable cause) {
    this(
        kind,
        stage,
        detail,
        node == null ? null : node.getToken(),
        node == null ? null : node.getSpan(),
        cause);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public Stage getStage() {
    return stage;
  }

  /** Called by the facade when an error raised by shared code surfaces in a later stage. */
  void setStage(Stage stage) {
    this.stage = stage;
  }

  public @Nullable Token getNodeKind() {
    return nodeKind;
  }

  public @Nullable SourceSpan getSpan() {
    return span;
  }

  /** The message without location prefix. */
  public String getDetail() {
    return detail;
  }

  @Override
  public String getMessage() {
    StringBuilder sb = new StringBuilder();
    if (span != null) {
      sb.append(span).append(": ");
    }
    sb.append(stage.getDisplayName()).append(": ").append(detail);
    if (nodeKind != null) {
      sb.append(" [").append(nodeKind.getName()).append(']');
    }
    return sb.toString();
  }
}
