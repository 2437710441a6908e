package io.inpdeck.shell;

import io.inpdeck.parser.api.Document;
import io.inpdeck.parser.api.Keyword;
import io.inpdeck.parser.api.NodeVisitor;
import io.inpdeck.parser.api.Section;
import java.io.PrintWriter;

/** Prints a short summary line followed by an indented outline of the document. */
public final class TreeRenderer {
  private TreeRenderer() {}

  public static void render(Document document, PrintWriter out) {
    out.printf(
        "%s: %d sections, %d keywords%n",
        document.source(), document.sectionCount(), document.keywordCount());
    document.accept(
        new NodeVisitor() {
          int depth = 0;

          @Override
          public boolean enterSection(Section section) {
            out.println(
                indent(depth)
                    + "+ "
                    + section.name()
                    + section.parameter().map(p -> " [" + p + "]").orElse("")
                    + "  (line "
                    + section.lineNumber()
                    + ")");
            depth++;
            return true;
          }

          @Override
          public void exitSection(Section section) {
            depth--;
          }

          @Override
          public void visitKeyword(Keyword keyword) {
            out.println(indent(depth) + "- " + keyword.name() + " = " + keyword.values());
          }
        });
    out.flush();
  }

  private static String indent(int depth) {
    return "  ".repeat(depth);
  }
}
