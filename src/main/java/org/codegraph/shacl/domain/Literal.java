package org.codegraph.shacl.domain;

import java.math.BigDecimal;
import java.util.Objects;
import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.riot.out.NodeFmtLib;
import org.codegraph.shacl.vocabulary.Rdf;
import org.codegraph.shacl.vocabulary.Xsd;

/**
 * Value object representing an RDF literal.
 *
 * <p>A literal carrying a language tag always has datatype {@code rdf:langString};
 * a literal without a tag must carry an explicit datatype ({@code xsd:string} for
 * simple literals).</p>
 *
 * @param lexical the lexical form
 * @param datatype the datatype IRI
 * @param language the language tag, or null
 */
public record Literal(String lexical, Iri datatype, String language) implements Term {

  /**
   * Creates a new Literal with validation.
   *
   * @throws IllegalArgumentException if a language tag is combined with a datatype
   *     other than rdf:langString, or rdf:langString is used without a tag
   */
  public Literal {
    Objects.requireNonNull(lexical, "Literal lexical form cannot be null");
    if (language != null && language.isBlank()) {
      language = null;
    }
    if (language != null) {
      if (datatype == null) {
        datatype = Rdf.LANG_STRING;
      } else if (!Rdf.LANG_STRING.equals(datatype)) {
        throw new IllegalArgumentException(
            "Language-tagged literal must have datatype rdf:langString, got " + datatype);
      }
    } else {
      Objects.requireNonNull(datatype, "Literal datatype cannot be null");
      if (Rdf.LANG_STRING.equals(datatype)) {
        throw new IllegalArgumentException("rdf:langString literal requires a language tag");
      }
    }
  }

  /**
   * Creates a simple {@code xsd:string} literal.
   *
   * @param lexical the string value
   * @return a new Literal
   */
  public static Literal of(String lexical) {
    return new Literal(lexical, Xsd.STRING, null);
  }

  /**
   * Creates a typed literal.
   *
   * @param lexical the lexical form
   * @param datatype the datatype IRI
   * @return a new Literal
   */
  public static Literal typed(String lexical, Iri datatype) {
    return new Literal(lexical, datatype, null);
  }

  /**
   * Creates a language-tagged literal.
   *
   * @param lexical the lexical form
   * @param language the language tag
   * @return a new Literal
   */
  public static Literal langString(String lexical, String language) {
    Objects.requireNonNull(language, "Language tag cannot be null");
    return new Literal(lexical, Rdf.LANG_STRING, language);
  }

  /**
   * Creates an {@code xsd:integer} literal.
   *
   * @param value the integer value
   * @return a new Literal
   */
  public static Literal ofInteger(long value) {
    return typed(Long.toString(value), Xsd.INTEGER);
  }

  /**
   * Creates an {@code xsd:decimal} literal.
   *
   * @param value the decimal value
   * @return a new Literal
   */
  public static Literal ofDecimal(BigDecimal value) {
    return typed(value.toPlainString(), Xsd.DECIMAL);
  }

  /**
   * Creates an {@code xsd:boolean} literal.
   *
   * @param value the boolean value
   * @return a new Literal
   */
  public static Literal ofBoolean(boolean value) {
    return typed(Boolean.toString(value), Xsd.BOOLEAN);
  }

  /**
   * Checks whether this literal carries a language tag.
   *
   * @return true if a language tag is present
   */
  public boolean hasLanguage() {
    return language != null;
  }

  /**
   * Renders this literal in N-Triples syntax using Jena's node formatter.
   * Simple {@code xsd:string} literals are written without a datatype.
   *
   * @return the N-Triples form
   */
  @Override
  public String toNTriples() {
    Node node = hasLanguage()
        ? NodeFactory.createLiteralLang(lexical, language)
        : NodeFactory.createLiteralDT(lexical,
            TypeMapper.getInstance().getSafeTypeByName(datatype.value()));
    return NodeFmtLib.strNT(node);
  }

  @Override
  public String toString() {
    return toNTriples();
  }
}
