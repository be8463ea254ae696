package org.codegraph.shacl.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.syntax.syntaxtransform.QueryTransformOps;
import org.codegraph.shacl.domain.BlankNode;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.Term;

/**
 * Binds the {@code $this} placeholder of a query-based constraint to a focus node.
 *
 * <p>Text mode rewrites the query string:</p>
 * <ul>
 *   <li>IRI focus: {@code SELECT $this} becomes {@code SELECT ?this}, every other
 *       {@code $this} becomes {@code <iri>}, and when {@code ?this} is projected a
 *       {@code BIND(<iri> AS ?this) . } is inserted after the first {@code WHERE {}.</li>
 *   <li>Blank node focus: every {@code $this} becomes {@code _:id}; nothing is
 *       inserted. In SPARQL a blank node label in a pattern acts like a variable,
 *       so this path matches any node.</li>
 * </ul>
 *
 * <p>Text mode also rewrites {@code $this} inside comments and string literals.
 * {@link #bind(String, Term)} substitutes on the parsed query instead.</p>
 */
public final class ThisSubstitution {

  /** The placeholder token. */
  public static final String PLACEHOLDER = "$this";

  private static final String SELECT_PLACEHOLDER = "SELECT $this";
  private static final String SELECT_THIS = "SELECT ?this";
  private static final Pattern FIRST_WHERE = Pattern.compile("WHERE\\s*\\{");
  private static final Var THIS = Var.alloc("this");

  private ThisSubstitution() {
    // Utility class - prevent instantiation
  }

  /**
   * Rewrites the query text for the given focus node.
   *
   * @param query the query template
   * @param focusNode the focus node (IRI or blank node)
   * @return the rewritten query
   * @throws IllegalArgumentException if the focus node is a literal
   */
  public static String substitute(String query, Term focusNode) {
    if (focusNode instanceof Iri iri) {
      String bracketed = iri.toNTriples();
      String rewritten = query.replace(SELECT_PLACEHOLDER, SELECT_THIS)
          .replace(PLACEHOLDER, bracketed);
      if (!rewritten.contains(SELECT_THIS)) {
        return rewritten;
      }
      Matcher matcher = FIRST_WHERE.matcher(rewritten);
      return matcher.replaceFirst(
          Matcher.quoteReplacement("WHERE { BIND(" + bracketed + " AS ?this) . "));
    }
    if (focusNode instanceof BlankNode blank) {
      return query.replace(PLACEHOLDER, blank.toNTriples());
    }
    throw new IllegalArgumentException(
        "Literal focus node cannot be substituted for $this: " + focusNode);
  }

  /**
   * Parses the query and pre-binds {@code ?this} to the focus node on the syntax
   * tree. A blank node focus binds the data's own blank node.
   *
   * @param query the query template
   * @param focusNode the focus node (IRI or blank node)
   * @return the bound query
   * @throws IllegalArgumentException if the focus node is a literal
   * @throws org.apache.jena.query.QueryParseException if the query does not parse
   */
  public static Query bind(String query, Term focusNode) {
    if (focusNode instanceof Literal) {
      throw new IllegalArgumentException(
          "Literal focus node cannot be substituted for $this: " + focusNode);
    }
    Query parsed = QueryFactory.create(query);
    return QueryTransformOps.transform(parsed, Map.of(THIS, JenaTermConverter.toNode(focusNode)));
  }

  /**
   * Prepends {@code PREFIX} declarations to a query.
   *
   * @param query the query
   * @param prefixes prefix to namespace IRI, in declaration order
   * @return the query with a prologue, or the query unchanged if there are no prefixes
   */
  public static String withPrefixes(String query, Map<String, String> prefixes) {
    if (prefixes.isEmpty()) {
      return query;
    }
    StringBuilder sb = new StringBuilder();
    prefixes.forEach((prefix, namespace) ->
        sb.append("PREFIX ").append(prefix).append(": <").append(namespace).append(">\n"));
    return sb.append(query).toString();
  }
}
