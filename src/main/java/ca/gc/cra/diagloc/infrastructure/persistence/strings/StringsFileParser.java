package ca.gc.cra.diagloc.infrastructure.persistence.strings;

import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.domain.diag.MessageCatalog;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Single-pass parser for {@code .strings} catalogs.
 * <p><strong>Grammar:</strong></p>
 * <pre>
 * file    := (comment | record)*
 * comment := "/*" ... "*&#47;"  followed by optional whitespace
 * record  := '"' id '"' ' '* '=' ' '* '"' message '";'  followed by optional whitespace
 * </pre>
 * <p>Inside {@code message} a {@code "} preceded by {@code \} is a literal quote (the backslash is dropped);
 * any other {@code "} must be followed by {@code ;}. Backslashes are otherwise kept verbatim.</p>
 * <p><strong>Unknown identifiers:</strong> logged at WARN and discarded. Unlike the YAML format they are not
 * reported back to the caller.</p>
 * <p><strong>Errors:</strong> any grammar violation raises {@link MalformedStringsException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected identifier space; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class StringsFileParser {
  private static final Logger log = LoggerFactory.getLogger(StringsFileParser.class);

  private final DiagnosticIdentifierSpace identifiers;

  /**
   * @param identifiers identifier space used to resolve record identifiers
   */
  public StringsFileParser(DiagnosticIdentifierSpace identifiers) {
    this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
  }

  /**
   * Reads and parses a UTF-8 {@code .strings} file.
   *
   * @param path catalog file
   * @return parsed catalog
   * @throws IOException when the file cannot be read
   * @throws MalformedStringsException when the content violates the grammar
   */
  public MessageCatalog parse(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    return parse(Files.readString(path, StandardCharsets.UTF_8));
  }

  /**
   * Parses {@code .strings} text.
   *
   * @param text catalog content
   * @return parsed catalog; identifiers absent from the text are left unset
   * @throws MalformedStringsException when the content violates the grammar
   */
  public MessageCatalog parse(String text) {
    Objects.requireNonNull(text, "text");
    MessageCatalog.Builder catalog = MessageCatalog.builder(identifiers.size());
    int n = text.length();
    int pos = skipWhitespace(text, 0);

    while (pos < n) {
      if (text.startsWith("/*", pos)) {
        int end = text.indexOf("*/", pos + 2);
        if (end < 0) {
          throw new MalformedStringsException("unterminated comment", pos);
        }
        pos = skipWhitespace(text, end + 2);
        continue;
      }

      expect(text, pos, '"', "expected '\"' opening an identifier");
      pos++;
      int idEnd = text.indexOf('"', pos);
      if (idEnd < 0) {
        throw new MalformedStringsException("unterminated identifier", pos);
      }
      String id = text.substring(pos, idEnd);

      pos = skipSpaces(text, idEnd + 1);
      expect(text, pos, '=', "expected '=' after identifier \"" + id + "\"");
      pos = skipSpaces(text, pos + 1);
      expect(text, pos, '"', "expected '\"' opening the message of \"" + id + "\"");
      pos++;

      StringBuilder message = new StringBuilder();
      boolean terminated = false;
      for (int i = pos; i < n; i++) {
        char c = text.charAt(i);
        if (c != '"') {
          message.append(c);
          continue;
        }
        if (i > pos && text.charAt(i - 1) == '\\') {
          message.setLength(message.length() - 1);
          message.append('"');
          continue;
        }
        if (i + 1 < n && text.charAt(i + 1) == ';') {
          pos = skipWhitespace(text, i + 2);
          terminated = true;
          break;
        }
        throw new MalformedStringsException("unescaped '\"' not followed by ';' in \"" + id + "\"", i);
      }
      if (!terminated) {
        throw new MalformedStringsException("unterminated message for \"" + id + "\"", pos);
      }

      OptionalInt known = identifiers.indexOf(id);
      if (known.isPresent()) {
        catalog.put(DiagnosticId.of(known.getAsInt()), message.toString());
      } else {
        log.warn("Unknown diagnostic: {}", id);
      }
    }
    return catalog.build();
  }

  private static void expect(String text, int pos, char expected, String message) {
    if (pos >= text.length() || text.charAt(pos) != expected) {
      throw new MalformedStringsException(message, pos);
    }
  }

  private static int skipSpaces(String text, int pos) {
    while (pos < text.length() && text.charAt(pos) == ' ') {
      pos++;
    }
    return pos;
  }

  private static int skipWhitespace(String text, int pos) {
    while (pos < text.length() && isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  // space, \t, \n, \v, \f, \r
  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\u000B' || c == '\f' || c == '\r';
  }
}
