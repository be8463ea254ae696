package org.codegraph.shacl.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Value object representing a blank node, identified by its local label.
 */
public record BlankNode(String id) implements Term {

  /**
   * Creates a new BlankNode.
   *
   * @param id the local label, without the {@code _:} prefix
   * @throws IllegalArgumentException if id is blank
   */
  public BlankNode {
    Objects.requireNonNull(id, "BlankNode id cannot be null");
    if (id.isBlank()) {
      throw new IllegalArgumentException("BlankNode id cannot be blank");
    }
  }

  /**
   * Creates a BlankNode with the given label.
   *
   * @param id the local label
   * @return a new BlankNode
   */
  public static BlankNode of(String id) {
    return new BlankNode(id);
  }

  /**
   * Creates a BlankNode with a fresh random label.
   *
   * @return a new BlankNode
   */
  public static BlankNode generate() {
    return new BlankNode("b" + UUID.randomUUID().toString().replace("-", ""));
  }

  @Override
  public String toNTriples() {
    return "_:" + id;
  }

  @Override
  public String toString() {
    return toNTriples();
  }
}
