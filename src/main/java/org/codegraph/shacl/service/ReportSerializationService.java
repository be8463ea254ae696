package org.codegraph.shacl.service;

import java.io.StringWriter;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.codegraph.shacl.domain.BlankNode;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.ValidationReport;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.exception.RdfParseException;
import org.codegraph.shacl.util.JenaTermConverter;
import org.codegraph.shacl.util.RdfContentTypeUtil;
import org.codegraph.shacl.vocabulary.Rdf;
import org.codegraph.shacl.vocabulary.Sh;
import org.codegraph.shacl.vocabulary.Xsd;
import org.springframework.stereotype.Service;

/**
 * Service for writing validation reports as RDF.
 *
 * <p>The output is the exact input format of {@link ReportParsingService}: a
 * blank {@code sh:ValidationReport} node with {@code sh:conforms} and one blank
 * {@code sh:ValidationResult} node per result.</p>
 */
@Service
public class ReportSerializationService {

  /**
   * Builds the report graph.
   *
   * @param report the report
   * @return a new graph describing the report
   */
  public Graph toGraph(ValidationReport report) {
    Graph.Builder builder = Graph.builder();
    BlankNode reportNode = BlankNode.generate();
    builder.add(reportNode, Rdf.TYPE, Sh.VALIDATION_REPORT);
    builder.add(reportNode, Sh.CONFORMS, Literal.ofBoolean(report.conforms()));

    for (ValidationResult result : report.results()) {
      BlankNode resultNode = BlankNode.generate();
      builder.add(reportNode, Sh.RESULT, resultNode);
      builder.add(resultNode, Rdf.TYPE, Sh.VALIDATION_RESULT);
      builder.add(resultNode, Sh.FOCUS_NODE, result.focusNode());
      builder.add(resultNode, Sh.RESULT_SEVERITY, result.severity().iri());
      if (result.resultPath() != null) {
        builder.add(resultNode, Sh.RESULT_PATH, result.resultPath());
      }
      if (result.value() != null) {
        builder.add(resultNode, Sh.VALUE, result.value());
      }
      if (result.sourceShape() != null) {
        builder.add(resultNode, Sh.SOURCE_SHAPE, result.sourceShape());
      }
      if (result.constraintComponent() != null) {
        builder.add(resultNode, Sh.SOURCE_CONSTRAINT_COMPONENT, result.constraintComponent());
      }
      if (!result.message().isEmpty()) {
        builder.add(resultNode, Sh.RESULT_MESSAGE, Literal.of(result.message()));
      }
    }
    return builder.build();
  }

  /**
   * Serializes a report as Turtle.
   *
   * @param report the report
   * @return Turtle text using the sh, rdf and xsd prefixes
   */
  public String toTurtle(ValidationReport report) {
    return serialize(report, Lang.TURTLE);
  }

  /**
   * Serializes a report in the syntax named by a content type.
   *
   * @param report the report
   * @param contentType the requested content type
   * @return the serialized report
   * @throws RdfParseException if the content type is not a supported RDF syntax
   */
  public String serialize(ValidationReport report, String contentType) {
    Lang lang = RdfContentTypeUtil.determineLang(contentType);
    if (lang == null) {
      throw new RdfParseException("Unsupported RDF content type: " + contentType);
    }
    return serialize(report, lang);
  }

  private String serialize(ValidationReport report, Lang lang) {
    Model model = ModelFactory.createModelForGraph(JenaTermConverter.toJenaGraph(toGraph(report)));
    model.setNsPrefix("sh", Sh.NS);
    model.setNsPrefix("rdf", Rdf.NS);
    model.setNsPrefix("xsd", Xsd.NS);

    StringWriter writer = new StringWriter();
    RDFDataMgr.write(writer, model, lang);
    return writer.toString();
  }
}
