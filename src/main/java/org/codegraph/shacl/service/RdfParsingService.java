package org.codegraph.shacl.service;

import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.sparql.graph.GraphFactory;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.exception.RdfParseException;
import org.codegraph.shacl.util.JenaTermConverter;
import org.codegraph.shacl.util.RdfContentTypeUtil;
import org.springframework.stereotype.Service;

/**
 * Service for parsing RDF text into graphs.
 * Complements ReportSerializationService (which handles serialization).
 */
@Service
public class RdfParsingService {

  /**
   * Parses Turtle text.
   *
   * @param content the Turtle text
   * @return the parsed graph (empty for blank input)
   * @throws RdfParseException if the content is malformed
   */
  public Graph parseTurtle(String content) {
    return parse(content, Lang.TURTLE);
  }

  /**
   * Parses RDF text in the syntax named by a content type.
   *
   * @param content the RDF text
   * @param contentType the content type (e.g., "text/turtle", "application/n-triples")
   * @return the parsed graph (empty for blank input)
   * @throws RdfParseException if the content type is unsupported or the content is malformed
   */
  public Graph parse(String content, String contentType) {
    Lang lang = RdfContentTypeUtil.determineLang(contentType);
    if (lang == null) {
      throw new RdfParseException("Unsupported RDF content type: " + contentType);
    }
    return parse(content, lang);
  }

  /**
   * Parses RDF text in the given syntax.
   *
   * @param content the RDF text
   * @param lang the syntax
   * @return the parsed graph (empty for blank input)
   * @throws RdfParseException if the content is malformed
   */
  public Graph parse(String content, Lang lang) {
    // Handle empty content
    if (content == null || content.isBlank()) {
      return Graph.empty();
    }

    org.apache.jena.graph.Graph jenaGraph = GraphFactory.createDefaultGraph();
    try {
      RDFParser.create()
          .fromString(content)
          .lang(lang)
          .parse(jenaGraph);
    } catch (RiotException e) {
      throw new RdfParseException("Invalid RDF syntax - " + e.getMessage(), e);
    }
    return JenaTermConverter.fromJenaGraph(jenaGraph);
  }
}
