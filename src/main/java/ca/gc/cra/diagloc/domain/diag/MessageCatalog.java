package ca.gc.cra.diagloc.domain.diag;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * <strong>What:</strong> Per-locale table of localized texts indexed by {@link DiagnosticId}.
 * <p><strong>Why:</strong> Text catalogs are parsed once into this form and then served without further I/O.</p>
 * <p><strong>Role:</strong> Domain value produced by the YAML and {@code .strings} parsers.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe for concurrent readers.</p>
 *
 * <p>A slot that is absent or holds the empty string means "not localized".</p>
 *
 * @since 0.1.0
 */
public final class MessageCatalog {
  private final String[] messages;

  private MessageCatalog(String[] messages) {
    this.messages = messages;
  }

  /**
   * Starts a catalog with {@code size} empty slots.
   *
   * @param size number of identifiers in the identifier space
   * @return builder pre-sized to {@code size}
   */
  public static Builder builder(int size) {
    return new Builder(size);
  }

  /**
   * Returns an empty catalog with {@code size} slots.
   *
   * @param size number of identifiers
   * @return catalog where every lookup is empty
   */
  public static MessageCatalog empty(int size) {
    return builder(size).build();
  }

  /** @return number of slots, equal to the identifier space size */
  public int size() {
    return messages.length;
  }

  /**
   * Returns the localized text for {@code id}.
   *
   * @param id identifier to resolve
   * @return non-empty localized text, or empty when the slot is unset or holds the empty string
   */
  public Optional<String> message(DiagnosticId id) {
    Objects.requireNonNull(id, "id");
    if (id.value() >= messages.length) {
      return Optional.empty();
    }
    String text = messages[id.value()];
    return text == null || text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /**
   * Visits every localized entry in ascending identifier order.
   *
   * @param callback receives {@code (id, text)} for each non-empty slot
   */
  public void forEachAvailable(BiConsumer<DiagnosticId, String> callback) {
    Objects.requireNonNull(callback, "callback");
    for (int i = 0; i < messages.length; i++) {
      String text = messages[i];
      if (text != null && !text.isEmpty()) {
        callback.accept(DiagnosticId.of(i), text);
      }
    }
  }

  /** @return number of slots holding non-empty text */
  public int availableCount() {
    int count = 0;
    for (String text : messages) {
      if (text != null && !text.isEmpty()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Mutable accumulator used while a catalog file is being parsed. Later writes to the same slot win.
   */
  public static final class Builder {
    private final String[] messages;

    private Builder(int size) {
      if (size < 0) {
        throw new IllegalArgumentException("size must be >= 0");
      }
      this.messages = new String[size];
    }

    /**
     * Stores {@code text} at {@code id}, replacing any earlier value.
     *
     * @param id identifier inside the catalog
     * @param text localized text
     * @return this builder
     * @throws IllegalArgumentException if {@code id} is outside the catalog
     */
    public Builder put(DiagnosticId id, String text) {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(text, "text");
      if (id.value() >= messages.length) {
        throw new IllegalArgumentException(
            "diagnostic id " + id.value() + " outside catalog of size " + messages.length);
      }
      messages[id.value()] = text;
      return this;
    }

    /** @return immutable snapshot of the accumulated slots */
    public MessageCatalog build() {
      return new MessageCatalog(Arrays.copyOf(messages, messages.length));
    }
  }
}
