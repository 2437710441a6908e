package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.DeckIOException;
import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.SourceLine;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/** Reads one document line by line, numbering lines from 1. */
final class LineCursor implements Closeable {
  private final BufferedReader reader;
  private final String source;
  private final boolean owned;
  private final SourceLine includedFrom;
  private int lineNumber;

  /**
   * @param reader the document text
   * @param source display name of the document
   * @param owned whether {@link #close()} closes {@code reader}
   * @param includedFrom the {@code @INCLUDE} line that opened this document, null for the top level
   */
  LineCursor(Reader reader, String source, boolean owned, SourceLine includedFrom) {
    this.reader = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    this.source = source;
    this.owned = owned;
    this.includedFrom = includedFrom;
  }

  /**
   * Reads the next line.
   *
   * @return the line, or null at end of input
   * @throws DeckParseException if reading fails
   */
  SourceLine next() throws DeckParseException {
    String raw;
    try {
      raw = reader.readLine();
    } catch (IOException e) {
      if (includedFrom != null) {
        throw DeckIOException.includeError(
            source,
            includedFrom.source(),
            includedFrom.lineNumber(),
            includedFrom.raw(),
            e);
      }
      throw DeckIOException.readError(source, lineNumber, e);
    }
    if (raw == null) {
      return null;
    }
    lineNumber++;
    return new SourceLine(source, lineNumber, raw, raw);
  }

  String source() {
    return source;
  }

  @Override
  public void close() throws IOException {
    if (owned) {
      reader.close();
    }
  }
}
