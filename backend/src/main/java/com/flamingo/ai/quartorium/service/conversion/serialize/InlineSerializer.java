package com.flamingo.ai.quartorium.service.conversion.serialize;

import com.flamingo.ai.quartorium.service.conversion.tree.DocMark;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.MarkType;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeAttrs;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the inline content of a paragraph or heading as Markdown.
 *
 * <p>Marks are applied by grouping runs of consecutive nodes that share a mark, one mark type at a
 * time in precedence order, so the first type in the order wraps everything inside it. Overlapping
 * marks therefore nest instead of being rejected. Whitespace at the edge of a run is moved outside
 * its delimiters.
 */
@Slf4j
class InlineSerializer {

  private static final Pattern OPEN_GROUP = Pattern.compile("\\(([^()]*)$");
  private static final Pattern CLOSE_GROUP = Pattern.compile("^([^()]*?)\\)");

  private final List<MarkType> precedence;

  InlineSerializer(List<String> markPrecedence) {
    List<MarkType> order = new ArrayList<>();
    for (String name : markPrecedence) {
      Optional<MarkType> type = MarkType.fromName(name);
      if (type.isEmpty()) {
        log.warn("Ignoring unknown mark type '{}' in mark precedence", name);
      } else if (!order.contains(type.get())) {
        order.add(type.get());
      }
    }
    for (MarkType type : MarkType.values()) {
      if (!order.contains(type)) {
        order.add(type);
      }
    }
    this.precedence = List.copyOf(order);
  }

  List<MarkType> precedence() {
    return precedence;
  }

  String serialize(List<DocNode> inline, ReferenceKeyResolver resolver) {
    if (inline == null || inline.isEmpty()) {
      return "";
    }
    return render(tokenize(inline, resolver), 0);
  }

  /** A piece of Markdown with the marks of the node it came from. */
  private record Token(String text, List<DocMark> marks) {}

  private List<Token> tokenize(List<DocNode> inline, ReferenceKeyResolver resolver) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < inline.size()) {
      DocNode node = inline.get(i);
      if (node.isTextNode()) {
        if (node.text() != null && !node.text().isEmpty()) {
          tokens.add(new Token(node.text(), node.marks()));
        }
        i++;
      } else if (node.isType(NodeTypes.CITATION)) {
        i = citation(inline, i, tokens, resolver);
      } else if (NodeTypes.isReference(node.type())) {
        tokens.add(new Token("@" + resolver.resolve(node), node.marks()));
        i++;
      } else {
        String text = node.textContent();
        log.debug("Writing unsupported inline node {} as plain text", node.type());
        if (!text.isEmpty()) {
          tokens.add(new Token(text, node.marks()));
        }
        i++;
      }
    }
    return tokens;
  }

  /**
   * Writes the citation at {@code start}. A parenthesised run {@code (c1; c2)} becomes one
   * bracketed citation {@code [@k1; @k2]}, keeping any prefix and locator text inside the
   * parentheses. Any other citation is written as {@code @key}.
   *
   * @return index of the first node after the consumed ones
   */
  private int citation(
      List<DocNode> inline, int start, List<Token> tokens, ReferenceKeyResolver resolver) {
    DocNode first = inline.get(start);
    Token previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    Matcher open = previous == null ? null : OPEN_GROUP.matcher(previous.text());
    if (open != null && open.find()) {
      List<String> keys = new ArrayList<>();
      keys.add("@" + resolver.resolve(first));
      int next = start + 1;
      while (next + 1 < inline.size()
          && isSeparator(inline.get(next))
          && inline.get(next + 1).isType(NodeTypes.CITATION)) {
        keys.add("@" + resolver.resolve(inline.get(next + 1)));
        next += 2;
      }
      if (next < inline.size() && inline.get(next).isTextNode()) {
        DocNode after = inline.get(next);
        Matcher close = CLOSE_GROUP.matcher(after.text());
        if (close.find()) {
          tokens.remove(tokens.size() - 1);
          String before = previous.text().substring(0, open.start());
          if (!before.isEmpty()) {
            tokens.add(new Token(before, previous.marks()));
          }
          String group = "[" + open.group(1) + String.join("; ", keys) + close.group(1) + "]";
          tokens.add(new Token(group, first.marks()));
          String rest = after.text().substring(close.end());
          if (!rest.isEmpty()) {
            tokens.add(new Token(rest, after.marks()));
          }
          return next + 1;
        }
      }
    }
    tokens.add(new Token("@" + resolver.resolve(first), first.marks()));
    return start + 1;
  }

  private static boolean isSeparator(DocNode node) {
    return node.isTextNode() && node.text() != null && node.text().trim().equals(";");
  }

  private String render(List<Token> tokens, int level) {
    if (level == precedence.size()) {
      StringBuilder sb = new StringBuilder();
      tokens.forEach(token -> sb.append(token.text()));
      return sb.toString();
    }
    MarkType type = precedence.get(level);
    StringBuilder sb = new StringBuilder();
    int i = 0;
    while (i < tokens.size()) {
      DocMark mark = find(tokens.get(i).marks(), type);
      String identity = identity(mark, type);
      int j = i + 1;
      while (j < tokens.size()
          && Objects.equals(identity(find(tokens.get(j).marks(), type), type), identity)) {
        j++;
      }
      String inner = render(tokens.subList(i, j), level + 1);
      sb.append(mark == null ? inner : wrap(inner, type, mark));
      i = j;
    }
    return sb.toString();
  }

  private static DocMark find(List<DocMark> marks, MarkType type) {
    for (DocMark mark : marks) {
      if (MarkType.fromName(mark.type()).orElse(null) == type) {
        return mark;
      }
    }
    return null;
  }

  /** Runs are grouped by mark presence, comments also by their thread id. */
  private static String identity(DocMark mark, MarkType type) {
    if (mark == null) {
      return null;
    }
    return type == MarkType.COMMENT ? "comment:" + mark.attr(NodeAttrs.COMMENT_ID) : type.name();
  }

  private static String wrap(String inner, MarkType type, DocMark mark) {
    String core = inner.strip();
    if (core.isEmpty()) {
      return inner;
    }
    int coreStart = inner.indexOf(core);
    String leading = inner.substring(0, coreStart);
    String trailing = inner.substring(coreStart + core.length());

    String wrapped;
    switch (type) {
      case COMMENT -> {
        String commentId = mark.attr(NodeAttrs.COMMENT_ID);
        if (commentId == null || commentId.isBlank()) {
          log.debug("Comment mark without commentId, writing its text unmarked");
          return inner;
        }
        wrapped = "[" + core + "]{.comment ref=\"" + commentId + "\"}";
      }
      case STRIKETHROUGH -> wrapped = "~~" + core + "~~";
      case STRONG -> wrapped = "**" + core + "**";
      case EM -> wrapped = "*" + core + "*";
      case CODE -> wrapped = codeSpan(core);
      default -> wrapped = core;
    }
    return leading + wrapped + trailing;
  }

  private static String codeSpan(String code) {
    int longest = 0;
    int run = 0;
    for (int i = 0; i < code.length(); i++) {
      run = code.charAt(i) == '`' ? run + 1 : 0;
      longest = Math.max(longest, run);
    }
    String fence = "`".repeat(longest + 1);
    boolean pad = code.startsWith("`") || code.endsWith("`");
    return pad ? fence + " " + code + " " + fence : fence + code + fence;
  }
}
