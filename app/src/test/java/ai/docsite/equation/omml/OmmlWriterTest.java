package ai.docsite.equation.omml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.equation.math.Equation;
import ai.docsite.equation.parse.EquationParser;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

class OmmlWriterTest {

    private static final Set<String> COMPOSITES = Set.of(
            "f", "num", "den", "sSub", "sSup", "sSubSup", "e", "sub", "sup", "d", "m");

    private final EquationParser parser = new EquationParser();
    private final OmmlWriter writer = new OmmlWriter();

    private Element write(String formula) {
        Equation equation = parser.parse(formula).orElseThrow();
        return writer.toDocument(equation).getDocumentElement();
    }

    @Test
    void rootIsOMathInTheMathNamespace() {
        Element root = write("x");

        assertThat(root.getNamespaceURI()).isEqualTo(OmmlWriter.MATH_NS);
        assertThat(root.getLocalName()).isEqualTo("oMath");
    }

    @Test
    void runCarriesStyleFontsAndText() {
        Element r = children(write("x")).get(0);

        assertThat(names(r)).containsExactly("rPr", "rPr", "t");
        Element sty = children(children(r).get(0)).get(0);
        assertThat(sty.getLocalName()).isEqualTo("sty");
        assertThat(sty.getAttributeNS(OmmlWriter.MATH_NS, "val")).isEqualTo("p");
        Element fonts = children(children(r).get(1)).get(0);
        assertThat(fonts.getNamespaceURI()).isEqualTo(OmmlWriter.WORD_NS);
        assertThat(fonts.getAttributeNS(OmmlWriter.WORD_NS, "hint")).isEqualTo("default");
        assertThat(fonts.getAttributeNS(OmmlWriter.WORD_NS, "ascii")).isEqualTo("Cambria Math");
        assertThat(fonts.getAttributeNS(OmmlWriter.WORD_NS, "hAnsi")).isEqualTo("Cambria Math");
        assertThat(children(r).get(2).getTextContent()).isEqualTo("x");
    }

    @Test
    void greekRunUsesEastAsianHint() {
        Element r = children(write("\\alpha")).get(0);

        Element fonts = children(children(r).get(1)).get(0);
        assertThat(fonts.getAttributeNS(OmmlWriter.WORD_NS, "hint")).isEqualTo("eastAsia");
        assertThat(children(r).get(2).getTextContent()).isEqualTo("α");
    }

    @Test
    void fractionLayout() {
        Element f = children(write("\\frac{1}{2}")).get(0);

        assertThat(f.getLocalName()).isEqualTo("f");
        assertThat(names(f)).containsExactly("fPr", "num", "den", "ctrlPr");
        assertThat(names(children(f).get(0))).containsExactly("ctrlPr");
        assertThat(names(children(f).get(1))).containsExactly("r", "ctrlPr");
    }

    @Test
    void scriptLayouts() {
        assertThat(names(children(write("x_d^*")).get(0))).containsExactly("sSubSupPr", "e", "sub", "sup", "ctrlPr");
        assertThat(names(children(write("x_d")).get(0))).containsExactly("sSubPr", "e", "sub", "ctrlPr");
        assertThat(names(children(write("x^2")).get(0))).containsExactly("sSupPr", "e", "sup", "ctrlPr");
    }

    @Test
    void casesDelimiterDeclaresEmptyClosingGlyph() {
        Element d = children(write("\\begin{cases}a & b\\\\c\\end{cases}")).get(0);
        Element dPr = children(d).get(0);

        assertThat(names(d)).containsExactly("dPr", "e", "ctrlPr");
        assertThat(names(dPr)).containsExactly("begChr", "endChr", "ctrlPr");
        assertThat(children(dPr).get(0).getAttributeNS(OmmlWriter.MATH_NS, "val")).isEqualTo("{");
        Element endChr = children(dPr).get(1);
        assertThat(endChr.hasAttributeNS(OmmlWriter.MATH_NS, "val")).isTrue();
        assertThat(endChr.getAttributeNS(OmmlWriter.MATH_NS, "val")).isEmpty();
    }

    @Test
    void rowSeparatorRunPreservesSpace() {
        Element e = children(children(write("\\begin{cases}a\\\\c\\end{cases}")).get(0)).get(1);
        Element separatorText = children(children(e).get(1)).get(2);

        assertThat(separatorText.getTextContent()).isEqualTo(" ");
        assertThat(separatorText.getAttributeNS("http://www.w3.org/XML/1998/namespace", "space")).isEqualTo("preserve");
    }

    @Test
    void lineBreaksInRunTextBecomeSpaces() {
        Element sub = children(children(write("x_{n\r\n+1}")).get(0)).get(2);
        Element text = children(children(sub).get(0)).get(2);

        assertThat(text.getTextContent()).isEqualTo("n +1");
        assertThat(text.hasAttributeNS("http://www.w3.org/XML/1998/namespace", "space")).isFalse();
    }

    @Test
    void matrixDeclaresOneCenteredColumnWhateverTheWidth() {
        Element d = children(write("\\begin{bmatrix}a&b&c\\\\d&e&f\\end{bmatrix}")).get(0);
        Element m = children(children(d).get(1)).get(0);
        Element mPr = children(m).get(0);
        Element mcs = children(mPr).get(0);

        assertThat(m.getLocalName()).isEqualTo("m");
        assertThat(names(m)).containsExactly("mPr", "mr", "mr", "ctrlPr");
        assertThat(names(mPr)).containsExactly("mcs", "plcHide", "ctrlPr");
        assertThat(children(mcs)).hasSize(1);
        Element mcPr = children(children(mcs).get(0)).get(0);
        assertThat(children(mcPr).get(0).getAttributeNS(OmmlWriter.MATH_NS, "val")).isEqualTo("1");
        assertThat(children(mcPr).get(1).getAttributeNS(OmmlWriter.MATH_NS, "val")).isEqualTo("center");
        assertThat(names(children(m).get(1))).containsExactly("e", "e", "e");
    }

    @Test
    void everyCompositeEndsWithControlProperties() {
        Element root = write("y = \\frac{\\omega_e^*}{2} (\\alpha + x^2) \\begin{bmatrix}a&\\\\i_\\beta&1\\end{bmatrix}"
                + " \\begin{cases}u_{d} & t>0\\end{cases} cos(\\theta)");

        List<Element> composites = new ArrayList<>();
        collect(root, composites);

        assertThat(composites).isNotEmpty();
        assertThat(composites).allSatisfy(element -> {
            List<Element> children = children(element);
            assertThat(children).isNotEmpty();
            assertThat(children.get(children.size() - 1).getLocalName())
                    .as("last child of m:%s", element.getLocalName())
                    .isEqualTo("ctrlPr");
        });
    }

    @Test
    void customFontIsApplied() {
        Equation equation = parser.parse("x").orElseThrow();
        Element r = children(new OmmlWriter("STIX Two Math").toDocument(equation).getDocumentElement()).get(0);

        Element fonts = children(children(r).get(1)).get(0);
        assertThat(fonts.getAttributeNS(OmmlWriter.WORD_NS, "ascii")).isEqualTo("STIX Two Math");
    }

    @Test
    void blankFontIsRejected() {
        assertThatThrownBy(() -> new OmmlWriter(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void printedMarkupIsWellFormedAndDeclaresNamespaces() throws Exception {
        String xml = writer.toXml(parser.parse("\\frac{\\pi}{2}").orElseThrow());

        assertThat(xml).doesNotStartWith("<?xml");
        assertThat(xml).startsWith("<m:oMath");
        assertThat(xml).contains("xmlns:m=\"" + OmmlWriter.MATH_NS + "\"");
        assertThat(xml).contains("xmlns:w=\"" + OmmlWriter.WORD_NS + "\"");

        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        Document reparsed = factory.newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        assertThat(reparsed.getElementsByTagNameNS(OmmlWriter.MATH_NS, "f").getLength()).isEqualTo(1);
        assertThat(reparsed.getElementsByTagNameNS(OmmlWriter.MATH_NS, "t").item(0).getTextContent()).isEqualTo("π");
    }

    private static void collect(Element element, List<Element> composites) {
        if (OmmlWriter.MATH_NS.equals(element.getNamespaceURI()) && COMPOSITES.contains(element.getLocalName())) {
            composites.add(element);
        }
        for (Element child : children(element)) {
            collect(child, composites);
        }
    }

    private static List<String> names(Element element) {
        List<String> names = new ArrayList<>();
        for (Element child : children(element)) {
            names.add(child.getLocalName());
        }
        return names;
    }

    private static List<Element> children(Element element) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) node);
            }
        }
        return children;
    }
}
