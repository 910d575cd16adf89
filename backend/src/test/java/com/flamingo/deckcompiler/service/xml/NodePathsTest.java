package com.flamingo.deckcompiler.service.xml;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

@DisplayName("NodePaths")
class NodePathsTest {

  private Document document;

  @BeforeEach
  void setUp() throws Exception {
    String xml =
        "<presentation><set var='a'>1</set><slide><placeholder/><set var='b'>2</set>"
            + "<placeholder/></slide><slide><placeholder/></slide></presentation>";
    document =
        new XmlDocumentLoader()
            .load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void shouldNumberSameNamedSiblings_fromOne() {
    // Given
    NodePaths paths = new NodePaths();
    Element root = document.getDocumentElement();
    List<Element> slides = DomElements.childElements(root).subList(1, 3);
    List<Element> placeholders = DomElements.childElements(slides.get(0));

    // When / Then
    assertThat(paths.pathOf(root)).isEqualTo("/presentation");
    assertThat(paths.pathOf(slides.get(1))).isEqualTo("/presentation/slide[2]");
    assertThat(paths.pathOf(placeholders.get(2)))
        .isEqualTo("/presentation/slide[1]/placeholder[2]");
    assertThat(paths.pathOf(placeholders.get(1))).isEqualTo("/presentation/slide[1]/set[1]");
  }

  @Test
  void shouldAgreeWithUncachedPaths_forEveryElement() {
    NodePaths paths = new NodePaths();
    NodeList elements = document.getElementsByTagName("*");

    for (int i = elements.getLength() - 1; i >= 0; i--) {
      Element element = (Element) elements.item(i);
      assertThat(paths.pathOf(element)).isEqualTo(DomElements.pathOf(element));
    }
  }
}
