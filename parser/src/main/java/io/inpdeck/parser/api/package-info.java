/**
 * Public API of the input-deck parser.
 *
 * <p><b>Language</b>
 *
 * <ul>
 *   <li>Sections: {@code &NAME [parameter...]} ... {@code &END [NAME]}, nestable
 *   <li>Keywords: {@code NAME [value...]}, values are bare words or quoted strings
 *   <li>Comments: {@code !} or {@code #} up to the end of the line, unless quoted
 *   <li>Directives: {@code @SET name value}, {@code @IF expr} ... {@code @ENDIF}, {@code @INCLUDE
 *       file}; references {@code ${name}}, {@code ${name-default}}, {@code $name}
 * </ul>
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * ParserOptions options = ParserOptions.builder().variable("CUTOFF", "400").build();
 * Document doc = DeckParser.create(options).parse(reader, "h2o.inp");
 * for (Keyword kw : doc.find("FORCE_EVAL/DFT/MGRID").orElseThrow().keywords()) {
 *   // ...
 * }
 * }</pre>
 *
 * <p>Every failure is a {@link io.inpdeck.parser.api.DeckParseException} carrying an {@link
 * io.inpdeck.parser.api.ErrorKind} and the offending line.
 */
package io.inpdeck.parser.api;
