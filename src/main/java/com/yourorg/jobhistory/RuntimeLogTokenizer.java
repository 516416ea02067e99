package com.yourorg.jobhistory;

import java.util.*;

/**
 * Splits masked runtime log text into records of tokens.
 * <p>
 * Tokens are separated by spaces; a token that starts with {@code "} runs to the closing
 * quote and may contain spaces and newlines. A backslash makes the next character
 * literal, inside or outside quotes. An unquoted newline ends the record.
 */
public class RuntimeLogTokenizer {

  public static List<List<String>> tokenize(String text) {
    List<List<String>> records = new ArrayList<>();
    List<String> current = new ArrayList<>();
    StringBuilder tok = new StringBuilder();

    boolean inQuotes = false;
    boolean quoted = false;
    boolean escaped = false;

    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);

      if (escaped) {
        tok.append(c);
        escaped = false;
        continue;
      }
      if (c == '\\') {
        escaped = true;
        continue;
      }
      if (inQuotes) {
        if (c == '"') inQuotes = false;
        else tok.append(c);
        continue;
      }

      switch (c) {
        case '"' -> {
          if (tok.length() == 0 && !quoted) {
            inQuotes = true;
            quoted = true;
          } else {
            tok.append(c);
          }
        }
        case ' ' -> {
          endToken(current, tok, quoted);
          quoted = false;
        }
        case '\n' -> {
          endToken(current, tok, quoted);
          quoted = false;
          if (!current.isEmpty()) records.add(current);
          current = new ArrayList<>();
        }
        case '\r' -> { /* CRLF logs */ }
        default -> tok.append(c);
      }
    }

    endToken(current, tok, quoted);
    if (!current.isEmpty()) records.add(current);
    return records;
  }

  private static void endToken(List<String> record, StringBuilder tok, boolean quoted) {
    if (tok.length() > 0 || quoted) record.add(tok.toString());
    tok.setLength(0);
  }
}
