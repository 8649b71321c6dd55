package ca.gc.cra.diagloc.domain.diag;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Closed, immutable table of diagnostic identifiers and their default text.
 * <p><strong>Why:</strong> Every catalog format maps symbolic names to declaration indexes; the table is
 * injected rather than compiled in so stores can be exercised against small synthetic catalogs.</p>
 * <p><strong>Role:</strong> Domain value shared by parsers, converters and the message store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve names to identifiers ({@code name -> index}) and back ({@code index -> name}).</li>
 *   <li>Expose default text and declaration order for template generation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @since 0.1.0
 */
public final class DiagnosticIdentifierSpace {
  /** Name reported for identifiers outside {@code [0, size())}. */
  public static final String NOT_A_DIAGNOSTIC = "<not a diagnostic>";

  private final List<DiagnosticDefinition> definitions;
  private final Map<String, Integer> indexByName;

  private DiagnosticIdentifierSpace(List<DiagnosticDefinition> definitions) {
    this.definitions = definitions;
    Map<String, Integer> index = new HashMap<>(definitions.size() * 2);
    for (int i = 0; i < definitions.size(); i++) {
      String name = definitions.get(i).name();
      if (index.putIfAbsent(name, i) != null) {
        throw new IllegalArgumentException("duplicate diagnostic name: " + name);
      }
    }
    this.indexByName = Map.copyOf(index);
  }

  /**
   * Builds an identifier space from definitions listed in declaration order.
   *
   * @param definitions master catalog entries; position {@code i} becomes identifier {@code i}
   * @return immutable identifier space
   * @throws IllegalArgumentException if two definitions share a name
   */
  public static DiagnosticIdentifierSpace of(List<DiagnosticDefinition> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    return new DiagnosticIdentifierSpace(List.copyOf(definitions));
  }

  /**
   * Convenience factory for tests and tooling: alternating name/default-text pairs.
   *
   * @param namesAndTexts {@code name0, text0, name1, text1, ...}
   * @return immutable identifier space
   */
  public static DiagnosticIdentifierSpace ofPairs(String... namesAndTexts) {
    if (namesAndTexts.length % 2 != 0) {
      throw new IllegalArgumentException("expected name/text pairs");
    }
    List<DiagnosticDefinition> defs = new ArrayList<>(namesAndTexts.length / 2);
    for (int i = 0; i < namesAndTexts.length; i += 2) {
      defs.add(new DiagnosticDefinition(namesAndTexts[i], namesAndTexts[i + 1]));
    }
    return of(defs);
  }

  /** @return number of identifiers ({@code N}) */
  public int size() {
    return definitions.size();
  }

  /**
   * Looks up the identifier declared under {@code name}.
   *
   * @param name symbolic name; {@code null} yields empty
   * @return declaration index, or empty when the name is not part of this space
   */
  public OptionalInt indexOf(String name) {
    if (name == null) {
      return OptionalInt.empty();
    }
    Integer index = indexByName.get(name);
    return index == null ? OptionalInt.empty() : OptionalInt.of(index);
  }

  /**
   * Returns the symbolic name of {@code id}, or {@link #NOT_A_DIAGNOSTIC} when out of range.
   *
   * @param id identifier to name
   * @return symbolic name
   */
  public String nameOf(DiagnosticId id) {
    return contains(id) ? definitions.get(id.value()).name() : NOT_A_DIAGNOSTIC;
  }

  /**
   * Returns the default text declared for {@code id}.
   *
   * @param id identifier inside this space
   * @return default text
   * @throws IllegalArgumentException if {@code id} is outside this space
   */
  public String defaultText(DiagnosticId id) {
    if (!contains(id)) {
      throw new IllegalArgumentException("diagnostic id out of range: " + id.value());
    }
    return definitions.get(id.value()).defaultText();
  }

  /**
   * @param id candidate identifier
   * @return {@code true} when {@code 0 <= id < size()}
   */
  public boolean contains(DiagnosticId id) {
    return id != null && id.value() < definitions.size();
  }

  /** @return definitions in declaration order */
  public List<DiagnosticDefinition> definitions() {
    return definitions;
  }
}
