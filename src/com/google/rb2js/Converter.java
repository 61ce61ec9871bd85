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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.rb2js.ConversionException.Stage;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.SourceSpan;
import com.google.rb2js.sourcemap.SourceMap;
import com.google.rb2js.sourcemap.SourceMapGeneratorV3;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Converts Ruby syntax trees to JavaScript.
 *
 * <p>A conversion runs the configured filters over the tree, generates code at the requested
 * ECMAScript level, tidies the vertical whitespace of multi-line output and, when asked, builds a
 * source map. Converters keep no state between conversions and may be shared across threads.
 *
 * <pre>
 *   ConversionResult result =
 *       new Converter().convert("(send nil :puts (str \"hi\"))", ConverterOptions.defaults());
 *   result.getText(); // console.log("hi")
 * </pre>
 */
public final class Converter {
  private static final Logger logger = Logger.getLogger(Converter.class.getName());

  /** Source name used in maps when the options carry no file name. */
  static final String DEFAULT_SOURCE_NAME = "(input)";

  private final @Nullable SourceParser parser;
  private final FilterRegistry registry;

  /** A converter that reads s-expression text. */
  public Converter() {
    this(new SexpParser());
  }

  public Converter(@Nullable SourceParser parser) {
    this(parser, FilterRegistry.getDefault());
  }

  public Converter(@Nullable SourceParser parser, FilterRegistry registry) {
    this.parser = parser;
    this.registry = checkNotNull(registry);
  }

  /** Parses and converts source text. */
  public ConversionResult convert(String source, ConverterOptions options) {
    String text = source;
    Optional<String> template = Optional.empty();
    if (options.getTemplateMarker().isPresent()) {
      String[] parts = splitTemplate(source, options.getTemplateMarker().get());
      text = parts[0];
      if (parts.length > 1) {
        template = Optional.of(parts[1]);
      }
    }
    if (parser == null) {
      throw new PipelineException(Stage.PARSE, "no parser configured for source text", null);
    }
    Node ast = parser.parse(text, options.getFileName().orElse(null));
    return convert(ast, text, template, options);
  }

  /** Converts a tree that was parsed elsewhere. */
  public ConversionResult convert(Node ast, ConverterOptions options) {
    return convert(ast, null, Optional.empty(), options);
  }

  /**
   * Converts a tree parsed from {@code source}. The text decides between single line and
   * multi-line output and is embedded in the source map.
   */
  public ConversionResult convert(Node ast, String source, ConverterOptions options) {
    return convert(ast, source, Optional.empty(), options);
  }

  private ConversionResult convert(
      Node ast, @Nullable String source, Optional<String> template, ConverterOptions options) {
    Stage stage = Stage.FILTER;
    try {
      Pipeline pipeline = Pipeline.create(filtersFor(options), options);
      Node filtered = pipeline.process(ast);

      stage = Stage.GENERATE;
      boolean vertical = isVertical(ast, source);
      CodeConsumer consumer = new CodeConsumer(vertical, options.getWidth());
      CodeGenerator generator = new CodeGenerator(consumer, options);
      if (options.isStrict()) {
        generator.tagAsStrict();
      }
      generator.generate(filtered);

      stage = Stage.NORMALIZE;
      List<OutputLine> lines = new ArrayList<>(consumer.getLines());
      if (vertical) {
        WhitespaceNormalizer.normalize(lines);
      }

      stage = Stage.SOURCE_MAP;
      SourceMapGeneratorV3 mapGenerator =
          options.wantsSourceMap() ? new SourceMapGeneratorV3() : null;
      String sourceName = options.getFileName().orElse(DEFAULT_SOURCE_NAME);
      String text = new CodePrinter(vertical, mapGenerator, sourceName).print(lines);
      SourceMap sourceMap = null;
      if (mapGenerator != null) {
        if (source != null) {
          mapGenerator.addSourceContent(sourceName, source);
        }
        sourceMap = mapGenerator.build(sourceName);
      }
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Converted " + sourceName + " to " + text.length() + " characters");
      }
      return ConversionResult.create(text, filtered, sourceMap, template);
    } catch (ConversionException e) {
      if (e.getStage() != Stage.PARSE) {
        e.setStage(stage);
      }
      throw e;
    } catch (IllegalArgumentException
        | IllegalStateException
        | IndexOutOfBoundsException
        | NullPointerException
        | ClassCastException e) {
      throw new PipelineException(stage, String.valueOf(e.getMessage()), null, e);
    }
  }

  private ImmutableList<FilterFactory> filtersFor(ConverterOptions options) {
    return options.getFilters().orElse(registry.getDefaultFilters());
  }

  private static boolean isVertical(Node ast, @Nullable String source) {
    if (source != null && source.indexOf('\n') >= 0) {
      return true;
    }
    SourceSpan span = ast.getSpan();
    return span != null && span.isMultiLine();
  }

  /**
   * Splits {@code source} at the first line consisting of {@code marker}. Returns the code alone
   * when there is no such line, and the code followed by the text after the marker line otherwise.
   */
  static String[] splitTemplate(String source, String marker) {
    int lineStart = 0;
    while (lineStart <= source.length()) {
      int newline = source.indexOf('\n', lineStart);
      int lineEnd = newline < 0 ? source.length() : newline;
      int contentEnd = lineEnd;
      if (contentEnd > lineStart && source.charAt(contentEnd - 1) == '\r') {
        contentEnd--;
      }
      if (source.substring(lineStart, contentEnd).equals(marker)) {
        String template = newline < 0 ? "" : source.substring(newline + 1);
        return new String[] {source.substring(0, lineStart), template};
      }
      if (newline < 0) {
        break;
      }
      lineStart = newline + 1;
    }
    return new String[] {source};
  }
}
