package org.codegraph.shacl.vocabulary;

import java.util.Set;
import org.codegraph.shacl.domain.Iri;

/**
 * XML Schema datatype IRIs.
 */
public final class Xsd {

  public static final String NS = "http://www.w3.org/2001/XMLSchema#";

  public static final Iri STRING = iri("string");
  public static final Iri BOOLEAN = iri("boolean");
  public static final Iri DECIMAL = iri("decimal");
  public static final Iri INTEGER = iri("integer");
  public static final Iri DOUBLE = iri("double");
  public static final Iri FLOAT = iri("float");
  public static final Iri LONG = iri("long");
  public static final Iri INT = iri("int");
  public static final Iri SHORT = iri("short");
  public static final Iri BYTE = iri("byte");
  public static final Iri NON_NEGATIVE_INTEGER = iri("nonNegativeInteger");
  public static final Iri POSITIVE_INTEGER = iri("positiveInteger");
  public static final Iri NON_POSITIVE_INTEGER = iri("nonPositiveInteger");
  public static final Iri NEGATIVE_INTEGER = iri("negativeInteger");
  public static final Iri UNSIGNED_LONG = iri("unsignedLong");
  public static final Iri UNSIGNED_INT = iri("unsignedInt");
  public static final Iri UNSIGNED_SHORT = iri("unsignedShort");
  public static final Iri UNSIGNED_BYTE = iri("unsignedByte");

  /** Datatypes whose lexical space is numeric. */
  public static final Set<Iri> NUMERIC_TYPES = Set.of(
      DECIMAL, INTEGER, DOUBLE, FLOAT, LONG, INT, SHORT, BYTE,
      NON_NEGATIVE_INTEGER, POSITIVE_INTEGER, NON_POSITIVE_INTEGER, NEGATIVE_INTEGER,
      UNSIGNED_LONG, UNSIGNED_INT, UNSIGNED_SHORT, UNSIGNED_BYTE);

  private Xsd() {
    // Vocabulary constants
  }

  private static Iri iri(String localName) {
    return new Iri(NS + localName);
  }
}
