package org.codegraph.shacl.service;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.NodeKind;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.SparqlConstraint;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.exception.InvalidShapesException;
import org.codegraph.shacl.validator.ConstraintHelpers;
import org.codegraph.shacl.vocabulary.Rdf;
import org.codegraph.shacl.vocabulary.Sh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads node shapes from a shapes graph.
 *
 * <p>Shapes are the subjects typed {@code sh:NodeShape} or carrying a target,
 * plus every shape they reference through {@code sh:and}, {@code sh:or},
 * {@code sh:xone} or {@code sh:not}. Only single-predicate paths are supported.</p>
 */
@Service
public class ShapesGraphReader {

  private static final Logger logger = LoggerFactory.getLogger(ShapesGraphReader.class);

  /**
   * Reads all node shapes.
   *
   * @param shapesGraph the shapes graph
   * @return node shapes, targeted shapes first, in graph order
   * @throws InvalidShapesException if a shape is malformed
   */
  public List<NodeShape> readShapes(Graph shapesGraph) {
    Set<Term> roots = new LinkedHashSet<>(shapesGraph.subjects(Rdf.TYPE, Sh.NODE_SHAPE));
    shapesGraph.triplesWith(null, Sh.TARGET_CLASS).forEach(t -> roots.add(t.subject()));
    shapesGraph.triplesWith(null, Sh.TARGET_NODE).forEach(t -> roots.add(t.subject()));

    Map<Term, NodeShape> shapes = new LinkedHashMap<>();
    Deque<Term> pending = new ArrayDeque<>(roots);
    while (!pending.isEmpty()) {
      Term id = pending.removeFirst();
      if (shapes.containsKey(id)) {
        continue;
      }
      NodeShape shape = readNodeShape(shapesGraph, id);
      shapes.put(id, shape);
      pending.addAll(shape.getAnd());
      pending.addAll(shape.getOr());
      pending.addAll(shape.getXone());
      if (shape.getNot() != null) {
        pending.add(shape.getNot());
      }
    }
    logger.debug("Read {} node shapes ({} targeted) from shapes graph",
        shapes.size(), roots.size());
    return List.copyOf(shapes.values());
  }

  private NodeShape readNodeShape(Graph g, Term id) {
    NodeShape.Builder builder = NodeShape.builder(id)
        .implicitClassTarget(g.objects(id, Rdf.TYPE).contains(Rdf.RDFS_CLASS))
        .message(string(g, id, Sh.MESSAGE))
        .datatype(iri(g, id, Sh.DATATYPE))
        .classIri(iri(g, id, Sh.CLASS))
        .pattern(pattern(g, id))
        .minLength(integer(g, id, Sh.MIN_LENGTH))
        .maxLength(integer(g, id, Sh.MAX_LENGTH))
        .hasValue(single(g, id, Sh.HAS_VALUE))
        .minInclusive(single(g, id, Sh.MIN_INCLUSIVE))
        .maxInclusive(single(g, id, Sh.MAX_INCLUSIVE))
        .minExclusive(single(g, id, Sh.MIN_EXCLUSIVE))
        .maxExclusive(single(g, id, Sh.MAX_EXCLUSIVE))
        .not(single(g, id, Sh.NOT));

    for (Term target : g.objects(id, Sh.TARGET_CLASS)) {
      builder.targetClass(requireIri(target, "sh:targetClass of " + id));
    }
    g.objects(id, Sh.TARGET_NODE).forEach(builder::targetNode);

    Term nodeKind = single(g, id, Sh.NODE_KIND);
    if (nodeKind != null) {
      builder.nodeKind(NodeKind.fromIri(nodeKind).orElseThrow(() ->
          new InvalidShapesException("Unknown sh:nodeKind " + nodeKind + " on shape " + id)));
    }

    Term languageIn = single(g, id, Sh.LANGUAGE_IN);
    if (languageIn != null) {
      List<String> tags = new ArrayList<>();
      for (Term tag : readList(g, languageIn)) {
        tags.add(ConstraintHelpers.extractString(tag).orElseThrow(() ->
            new InvalidShapesException("sh:languageIn of " + id + " must list literals")));
      }
      builder.languageIn(tags);
    }

    Term in = single(g, id, Sh.IN);
    if (in != null) {
      builder.in(readList(g, in));
    }
    listValue(g, id, Sh.AND).ifPresent(builder::and);
    listValue(g, id, Sh.OR).ifPresent(builder::or);
    listValue(g, id, Sh.XONE).ifPresent(builder::xone);

    for (Term property : g.objects(id, Sh.PROPERTY)) {
      builder.property(readPropertyShape(g, property));
    }
    for (Term sparql : g.objects(id, Sh.SPARQL)) {
      builder.sparql(readSparqlConstraint(g, id, sparql));
    }
    return builder.build();
  }

  private PropertyShape readPropertyShape(Graph g, Term id) {
    Term path = single(g, id, Sh.PATH);
    if (path == null) {
      throw new InvalidShapesException("Property shape " + id + " has no sh:path");
    }
    PropertyShape.Builder builder = PropertyShape.builder(
            requireIri(path, "sh:path of property shape " + id))
        .id(id)
        .message(string(g, id, Sh.MESSAGE))
        .minCount(integer(g, id, Sh.MIN_COUNT))
        .maxCount(integer(g, id, Sh.MAX_COUNT))
        .datatype(iri(g, id, Sh.DATATYPE))
        .classIri(iri(g, id, Sh.CLASS))
        .pattern(pattern(g, id))
        .minLength(integer(g, id, Sh.MIN_LENGTH))
        .maxLength(integer(g, id, Sh.MAX_LENGTH))
        .hasValue(single(g, id, Sh.HAS_VALUE))
        .minInclusive(decimal(g, id, Sh.MIN_INCLUSIVE))
        .maxInclusive(decimal(g, id, Sh.MAX_INCLUSIVE))
        .minExclusive(decimal(g, id, Sh.MIN_EXCLUSIVE))
        .maxExclusive(decimal(g, id, Sh.MAX_EXCLUSIVE))
        .qualifiedMinCount(integer(g, id, Sh.QUALIFIED_MIN_COUNT));

    Term in = single(g, id, Sh.IN);
    if (in != null) {
      builder.in(readList(g, in));
    }
    Term qualifiedShape = single(g, id, Sh.QUALIFIED_VALUE_SHAPE);
    if (qualifiedShape != null) {
      builder.qualifiedClass(iri(g, qualifiedShape, Sh.CLASS));
    }
    return builder.build();
  }

  private SparqlConstraint readSparqlConstraint(Graph g, Term shapeId, Term id) {
    String select = string(g, id, Sh.SELECT);
    if (select == null) {
      throw new InvalidShapesException("SPARQL constraint of shape " + shapeId
          + " has no sh:select");
    }
    Map<String, String> prefixes = new LinkedHashMap<>();
    for (Term prefixesNode : g.objects(id, Sh.PREFIXES)) {
      for (Term declaration : g.objects(prefixesNode, Sh.DECLARE)) {
        String prefix = string(g, declaration, Sh.PREFIX);
        String namespace = string(g, declaration, Sh.NAMESPACE);
        if (prefix == null || namespace == null) {
          throw new InvalidShapesException("Prefix declaration " + declaration
              + " needs sh:prefix and sh:namespace");
        }
        prefixes.put(prefix, namespace);
      }
    }
    return new SparqlConstraint(shapeId, string(g, id, Sh.MESSAGE), select, prefixes);
  }

  private Optional<List<Term>> listValue(Graph g, Term subject, Iri predicate) {
    Term head = single(g, subject, predicate);
    return head == null ? Optional.empty() : Optional.of(readList(g, head));
  }

  /**
   * Reads an RDF collection.
   *
   * @param g the graph
   * @param head the first cell
   * @return the members in order
   * @throws InvalidShapesException if a cell lacks rdf:first or rdf:rest, or the list is cyclic
   */
  static List<Term> readList(Graph g, Term head) {
    List<Term> members = new ArrayList<>();
    Set<Term> visited = new HashSet<>();
    Term cell = head;
    while (!Rdf.NIL.equals(cell)) {
      if (!visited.add(cell)) {
        throw new InvalidShapesException("Cyclic RDF list at " + cell);
      }
      Term first = single(g, cell, Rdf.FIRST);
      Term rest = single(g, cell, Rdf.REST);
      if (first == null || rest == null) {
        throw new InvalidShapesException("Malformed RDF list at " + cell);
      }
      members.add(first);
      cell = rest;
    }
    return members;
  }

  private static Pattern pattern(Graph g, Term id) {
    String regex = string(g, id, Sh.PATTERN);
    if (regex == null) {
      return null;
    }
    String flags = string(g, id, Sh.FLAGS);
    int mask = 0;
    if (flags != null) {
      for (char flag : flags.toCharArray()) {
        mask |= switch (flag) {
          case 'i' -> Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
          case 'm' -> Pattern.MULTILINE;
          case 's' -> Pattern.DOTALL;
          case 'x' -> Pattern.COMMENTS;
          default -> throw new InvalidShapesException(
              "Unsupported sh:flags '" + flag + "' on shape " + id);
        };
      }
    }
    try {
      return Pattern.compile(regex, mask);
    } catch (PatternSyntaxException e) {
      throw new InvalidShapesException("Invalid sh:pattern on shape " + id + ": " + regex, e);
    }
  }

  private static Term single(Graph g, Term subject, Iri predicate) {
    List<Term> values = g.objects(subject, predicate);
    return values.isEmpty() ? null : values.get(0);
  }

  private static String string(Graph g, Term subject, Iri predicate) {
    Term value = single(g, subject, predicate);
    return value instanceof Literal literal ? literal.lexical() : null;
  }

  private static Iri iri(Graph g, Term subject, Iri predicate) {
    Term value = single(g, subject, predicate);
    return value == null ? null : requireIri(value, predicate + " of " + subject);
  }

  private static Iri requireIri(Term value, String what) {
    if (value instanceof Iri iri) {
      return iri;
    }
    throw new InvalidShapesException(what + " must be an IRI, got " + value);
  }

  private static Integer integer(Graph g, Term subject, Iri predicate) {
    BigDecimal value = decimal(g, subject, predicate);
    if (value == null) {
      return null;
    }
    try {
      return value.intValueExact();
    } catch (ArithmeticException e) {
      throw new InvalidShapesException(predicate + " of " + subject
          + " must be an integer, got " + value.toPlainString(), e);
    }
  }

  private static BigDecimal decimal(Graph g, Term subject, Iri predicate) {
    Term value = single(g, subject, predicate);
    if (value == null) {
      return null;
    }
    return ConstraintHelpers.extractNumber(value).orElseThrow(() ->
        new InvalidShapesException(predicate + " of " + subject + " must be numeric, got "
            + value));
  }
}
