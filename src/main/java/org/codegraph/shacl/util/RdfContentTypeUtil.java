package org.codegraph.shacl.util;

import java.util.Locale;
import org.apache.jena.riot.Lang;

/**
 * Maps MIME types to the Jena triple syntaxes accepted for data, shapes and
 * report graphs.
 */
public final class RdfContentTypeUtil {

  private RdfContentTypeUtil() {
    // Utility class - prevent instantiation
  }

  /**
   * Determines the Jena Lang for a content type. Quad formats are not graph
   * syntaxes and are rejected.
   *
   * @param contentType the content type (e.g., "text/turtle"), null or blank for Turtle
   * @return the corresponding Lang, or null if unsupported
   */
  public static Lang determineLang(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return Lang.TURTLE;
    }

    // Drop parameters such as charset
    String cleanType = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);

    return switch (cleanType) {
      case "text/turtle", "application/x-turtle" -> Lang.TURTLE;
      case "application/n-triples", "text/plain" -> Lang.NTRIPLES;
      case "application/ld+json", "application/json" -> Lang.JSONLD;
      case "application/rdf+xml", "application/xml" -> Lang.RDFXML;
      case "text/n3", "text/rdf+n3" -> Lang.N3;
      default -> null;
    };
  }
}
