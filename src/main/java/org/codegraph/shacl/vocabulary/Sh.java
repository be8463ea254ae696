package org.codegraph.shacl.vocabulary;

import org.codegraph.shacl.domain.Iri;

/**
 * SHACL vocabulary IRIs (W3C SHACL Recommendation, namespace {@code sh:}).
 */
public final class Sh {

  public static final String NS = "http://www.w3.org/ns/shacl#";

  // Shape classes and targeting
  public static final Iri NODE_SHAPE = iri("NodeShape");
  public static final Iri PROPERTY_SHAPE = iri("PropertyShape");
  public static final Iri TARGET_CLASS = iri("targetClass");
  public static final Iri TARGET_NODE = iri("targetNode");
  public static final Iri PROPERTY = iri("property");
  public static final Iri PATH = iri("path");
  public static final Iri MESSAGE = iri("message");

  // Constraint parameters
  public static final Iri MIN_COUNT = iri("minCount");
  public static final Iri MAX_COUNT = iri("maxCount");
  public static final Iri DATATYPE = iri("datatype");
  public static final Iri CLASS = iri("class");
  public static final Iri NODE_KIND = iri("nodeKind");
  public static final Iri PATTERN = iri("pattern");
  public static final Iri FLAGS = iri("flags");
  public static final Iri MIN_LENGTH = iri("minLength");
  public static final Iri MAX_LENGTH = iri("maxLength");
  public static final Iri LANGUAGE_IN = iri("languageIn");
  public static final Iri IN = iri("in");
  public static final Iri HAS_VALUE = iri("hasValue");
  public static final Iri MIN_INCLUSIVE = iri("minInclusive");
  public static final Iri MAX_INCLUSIVE = iri("maxInclusive");
  public static final Iri MIN_EXCLUSIVE = iri("minExclusive");
  public static final Iri MAX_EXCLUSIVE = iri("maxExclusive");
  public static final Iri QUALIFIED_VALUE_SHAPE = iri("qualifiedValueShape");
  public static final Iri QUALIFIED_MIN_COUNT = iri("qualifiedMinCount");
  public static final Iri AND = iri("and");
  public static final Iri OR = iri("or");
  public static final Iri XONE = iri("xone");
  public static final Iri NOT = iri("not");
  public static final Iri SPARQL = iri("sparql");
  public static final Iri SELECT = iri("select");
  public static final Iri PREFIXES = iri("prefixes");
  public static final Iri DECLARE = iri("declare");
  public static final Iri PREFIX = iri("prefix");
  public static final Iri NAMESPACE = iri("namespace");

  // Node kinds
  public static final Iri IRI = iri("IRI");
  public static final Iri BLANK_NODE = iri("BlankNode");
  public static final Iri LITERAL = iri("Literal");
  public static final Iri BLANK_NODE_OR_IRI = iri("BlankNodeOrIRI");
  public static final Iri BLANK_NODE_OR_LITERAL = iri("BlankNodeOrLiteral");
  public static final Iri IRI_OR_LITERAL = iri("IRIOrLiteral");

  // Constraint components
  public static final Iri MIN_COUNT_COMPONENT = iri("MinCountConstraintComponent");
  public static final Iri MAX_COUNT_COMPONENT = iri("MaxCountConstraintComponent");
  public static final Iri DATATYPE_COMPONENT = iri("DatatypeConstraintComponent");
  public static final Iri CLASS_COMPONENT = iri("ClassConstraintComponent");
  public static final Iri NODE_KIND_COMPONENT = iri("NodeKindConstraintComponent");
  public static final Iri PATTERN_COMPONENT = iri("PatternConstraintComponent");
  public static final Iri MIN_LENGTH_COMPONENT = iri("MinLengthConstraintComponent");
  public static final Iri MAX_LENGTH_COMPONENT = iri("MaxLengthConstraintComponent");
  public static final Iri LANGUAGE_IN_COMPONENT = iri("LanguageInConstraintComponent");
  public static final Iri IN_COMPONENT = iri("InConstraintComponent");
  public static final Iri HAS_VALUE_COMPONENT = iri("HasValueConstraintComponent");
  public static final Iri MIN_INCLUSIVE_COMPONENT = iri("MinInclusiveConstraintComponent");
  public static final Iri MAX_INCLUSIVE_COMPONENT = iri("MaxInclusiveConstraintComponent");
  public static final Iri MIN_EXCLUSIVE_COMPONENT = iri("MinExclusiveConstraintComponent");
  public static final Iri MAX_EXCLUSIVE_COMPONENT = iri("MaxExclusiveConstraintComponent");
  public static final Iri QUALIFIED_MIN_COUNT_COMPONENT =
      iri("QualifiedMinCountConstraintComponent");
  public static final Iri AND_COMPONENT = iri("AndConstraintComponent");
  public static final Iri OR_COMPONENT = iri("OrConstraintComponent");
  public static final Iri XONE_COMPONENT = iri("XoneConstraintComponent");
  public static final Iri NOT_COMPONENT = iri("NotConstraintComponent");
  public static final Iri SPARQL_COMPONENT = iri("SPARQLConstraintComponent");

  // Validation report
  public static final Iri VALIDATION_REPORT = iri("ValidationReport");
  public static final Iri VALIDATION_RESULT = iri("ValidationResult");
  public static final Iri CONFORMS = iri("conforms");
  public static final Iri RESULT = iri("result");
  public static final Iri FOCUS_NODE = iri("focusNode");
  public static final Iri RESULT_PATH = iri("resultPath");
  public static final Iri VALUE = iri("value");
  public static final Iri RESULT_MESSAGE = iri("resultMessage");
  public static final Iri RESULT_SEVERITY = iri("resultSeverity");
  public static final Iri SOURCE_SHAPE = iri("sourceShape");
  public static final Iri SOURCE_CONSTRAINT_COMPONENT = iri("sourceConstraintComponent");

  // Severities
  public static final Iri VIOLATION = iri("Violation");
  public static final Iri WARNING = iri("Warning");
  public static final Iri INFO = iri("Info");

  private Sh() {
    // Vocabulary constants
  }

  private static Iri iri(String localName) {
    return new Iri(NS + localName);
  }
}
