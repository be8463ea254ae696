package org.codegraph.shacl.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, duplicate-free collection of triples.
 *
 * <p>Triples keep their insertion order so that validation output is deterministic.
 * The only index is subject &rarr; predicate &rarr; objects; lookups by predicate
 * alone scan the triple set.</p>
 */
public final class Graph {

  private static final Graph EMPTY = new Graph(new LinkedHashSet<>());

  private final Set<Triple> triples;
  private final Map<Term, Map<Iri, List<Term>>> bySubject;

  private Graph(LinkedHashSet<Triple> triples) {
    this.triples = Collections.unmodifiableSet(triples);
    Map<Term, Map<Iri, List<Term>>> index = new LinkedHashMap<>();
    for (Triple triple : triples) {
      index.computeIfAbsent(triple.subject(), s -> new LinkedHashMap<>())
          .computeIfAbsent(triple.predicate(), p -> new ArrayList<>())
          .add(triple.object());
    }
    this.bySubject = index;
  }

  /**
   * Returns the empty graph.
   *
   * @return an empty graph
   */
  public static Graph empty() {
    return EMPTY;
  }

  /**
   * Creates a graph from the given triples, dropping duplicates.
   *
   * @param triples the triples
   * @return a new graph
   */
  public static Graph of(Collection<Triple> triples) {
    return new Graph(new LinkedHashSet<>(triples));
  }

  /**
   * Creates a graph from the given triples, dropping duplicates.
   *
   * @param triples the triples
   * @return a new graph
   */
  public static Graph of(Triple... triples) {
    return of(Arrays.asList(triples));
  }

  /**
   * Creates a new builder.
   *
   * @return a graph builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets all triples in insertion order.
   *
   * @return unmodifiable set of triples
   */
  public Set<Triple> triples() {
    return triples;
  }

  public int size() {
    return triples.size();
  }

  public boolean isEmpty() {
    return triples.isEmpty();
  }

  public boolean contains(Triple triple) {
    return triples.contains(triple);
  }

  /**
   * Finds triples matching an optional subject and an optional predicate.
   * A null argument matches anything.
   *
   * @param subject the subject to match, or null
   * @param predicate the predicate to match, or null
   * @return matching triples in insertion order
   */
  public List<Triple> triplesWith(Term subject, Iri predicate) {
    List<Triple> matches = new ArrayList<>();
    if (subject != null) {
      Map<Iri, List<Term>> predicates = bySubject.get(subject);
      if (predicates == null) {
        return matches;
      }
      predicates.forEach((p, objects) -> {
        if (predicate == null || predicate.equals(p)) {
          objects.forEach(o -> matches.add(new Triple(subject, p, o)));
        }
      });
      return matches;
    }
    for (Triple triple : triples) {
      if (predicate == null || predicate.equals(triple.predicate())) {
        matches.add(triple);
      }
    }
    return matches;
  }

  /**
   * Gets all objects of triples {@code (subject, predicate, ?)}.
   *
   * @param subject the subject
   * @param predicate the predicate
   * @return unmodifiable list of objects (empty if none)
   */
  public List<Term> objects(Term subject, Iri predicate) {
    Map<Iri, List<Term>> predicates = bySubject.get(subject);
    if (predicates == null) {
      return List.of();
    }
    List<Term> objects = predicates.get(predicate);
    return objects == null ? List.of() : Collections.unmodifiableList(objects);
  }

  /**
   * Gets the distinct subjects of triples {@code (?, predicate, object)}.
   *
   * @param predicate the predicate
   * @param object the object
   * @return distinct subjects in insertion order
   */
  public List<Term> subjects(Iri predicate, Term object) {
    Set<Term> subjects = new LinkedHashSet<>();
    for (Triple triple : triples) {
      if (triple.predicate().equals(predicate) && triple.object().equals(object)) {
        subjects.add(triple.subject());
      }
    }
    return new ArrayList<>(subjects);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Graph other)) {
      return false;
    }
    return triples.equals(other.triples);
  }

  @Override
  public int hashCode() {
    return triples.hashCode();
  }

  @Override
  public String toString() {
    return "Graph[" + triples.size() + " triples]";
  }

  /**
   * Accumulates triples for a new {@link Graph}.
   */
  public static final class Builder {

    private final LinkedHashSet<Triple> triples = new LinkedHashSet<>();

    private Builder() {
    }

    public Builder add(Triple triple) {
      triples.add(triple);
      return this;
    }

    public Builder add(Term subject, Iri predicate, Term object) {
      return add(new Triple(subject, predicate, object));
    }

    public Builder addAll(Collection<Triple> more) {
      triples.addAll(more);
      return this;
    }

    public Graph build() {
      return new Graph(new LinkedHashSet<>(triples));
    }
  }
}
