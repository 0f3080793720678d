package com.flamingo.ai.quartorium.service.conversion.jats;

import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/** Renders a JATS {@code table-wrap} as a Markdown pipe table. */
final class PipeTables {

  private PipeTables() {}

  static String render(Element tableWrap) {
    List<List<String>> rows = new ArrayList<>();
    NodeList trs = tableWrap.getElementsByTagNameNS("*", "tr");
    for (int r = 0; r < trs.getLength(); r++) {
      Element row = (Element) trs.item(r);
      List<String> cells = new ArrayList<>();
      for (Element cell : JatsElements.children(row)) {
        if (JatsElements.is(cell, "td") || JatsElements.is(cell, "th")) {
          cells.add(JatsElements.text(cell).replace("|", "\\|"));
        }
      }
      if (!cells.isEmpty()) {
        rows.add(cells);
      }
    }
    if (rows.isEmpty()) {
      return "";
    }

    int columns = rows.stream().mapToInt(List::size).max().orElse(0);
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < rows.size(); r++) {
      appendRow(sb, rows.get(r), columns);
      if (r == 0) {
        sb.append('\n').append('|');
        for (int c = 0; c < columns; c++) {
          sb.append("---|");
        }
      }
      if (r < rows.size() - 1) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  private static void appendRow(StringBuilder sb, List<String> cells, int columns) {
    sb.append('|');
    for (int c = 0; c < columns; c++) {
      String cell = c < cells.size() ? cells.get(c) : "";
      sb.append(' ').append(cell).append(" |");
    }
  }
}
