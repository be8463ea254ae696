package org.codegraph.shacl.util;

import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.sparql.graph.GraphFactory;
import org.codegraph.shacl.domain.BlankNode;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.Triple;

/**
 * Converts between the validator's term model and Jena nodes and graphs.
 * Blank node labels are carried over unchanged in both directions.
 */
public final class JenaTermConverter {

  private JenaTermConverter() {
    // Utility class - prevent instantiation
  }

  /**
   * Converts a term to a Jena node.
   *
   * @param term the term
   * @return the equivalent concrete Jena node
   */
  public static Node toNode(Term term) {
    if (term instanceof Iri iri) {
      return NodeFactory.createURI(iri.value());
    }
    if (term instanceof BlankNode blank) {
      return NodeFactory.createBlankNode(blank.id());
    }
    Literal literal = (Literal) term;
    if (literal.hasLanguage()) {
      return NodeFactory.createLiteralLang(literal.lexical(), literal.language());
    }
    return NodeFactory.createLiteralDT(literal.lexical(),
        TypeMapper.getInstance().getSafeTypeByName(literal.datatype().value()));
  }

  /**
   * Converts a concrete Jena node to a term.
   *
   * @param node the Jena node
   * @return the equivalent term
   * @throws IllegalArgumentException if the node is a variable or another non-concrete node
   */
  public static Term toTerm(Node node) {
    if (node.isURI()) {
      return new Iri(node.getURI());
    }
    if (node.isBlank()) {
      return new BlankNode(node.getBlankNodeLabel());
    }
    if (node.isLiteral()) {
      String language = node.getLiteralLanguage();
      if (language != null && !language.isEmpty()) {
        return Literal.langString(node.getLiteralLexicalForm(), language);
      }
      return Literal.typed(node.getLiteralLexicalForm(), new Iri(node.getLiteralDatatypeURI()));
    }
    throw new IllegalArgumentException("Unsupported RDF node: " + node);
  }

  /**
   * Copies a graph into a new in-memory Jena graph.
   *
   * @param graph the graph
   * @return a new Jena graph with the same triples
   */
  public static org.apache.jena.graph.Graph toJenaGraph(Graph graph) {
    org.apache.jena.graph.Graph jenaGraph = GraphFactory.createDefaultGraph();
    for (Triple triple : graph.triples()) {
      jenaGraph.add(org.apache.jena.graph.Triple.create(
          toNode(triple.subject()), toNode(triple.predicate()), toNode(triple.object())));
    }
    return jenaGraph;
  }

  /**
   * Copies a Jena graph into an immutable graph.
   *
   * @param jenaGraph the Jena graph
   * @return a new graph with the same triples
   */
  public static Graph fromJenaGraph(org.apache.jena.graph.Graph jenaGraph) {
    Graph.Builder builder = Graph.builder();
    jenaGraph.find().forEachRemaining(t -> builder.add(
        toTerm(t.getSubject()), (Iri) toTerm(t.getPredicate()), toTerm(t.getObject())));
    return builder.build();
  }
}
