package org.codegraph.shacl.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.jena.riot.Lang;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RdfContentTypeUtil.
 */
class RdfContentTypeUtilTest {

  @Test
  void determineLang_shouldDefaultToTurtle_whenContentTypeMissing() {
    assertThat(RdfContentTypeUtil.determineLang(null)).isEqualTo(Lang.TURTLE);
    assertThat(RdfContentTypeUtil.determineLang("  ")).isEqualTo(Lang.TURTLE);
  }

  @Test
  void determineLang_shouldIgnoreParametersAndCase() {
    assertThat(RdfContentTypeUtil.determineLang("Text/Turtle; charset=UTF-8"))
        .isEqualTo(Lang.TURTLE);
    assertThat(RdfContentTypeUtil.determineLang("application/n-triples"))
        .isEqualTo(Lang.NTRIPLES);
    assertThat(RdfContentTypeUtil.determineLang("application/ld+json")).isEqualTo(Lang.JSONLD);
    assertThat(RdfContentTypeUtil.determineLang("application/rdf+xml")).isEqualTo(Lang.RDFXML);
  }

  @Test
  void determineLang_shouldReturnNull_whenQuadOrUnknownFormat() {
    assertThat(RdfContentTypeUtil.determineLang("application/trig")).isNull();
    assertThat(RdfContentTypeUtil.determineLang("image/png")).isNull();
  }
}
