package ai.docsite.equation.omml;

import ai.docsite.equation.math.Delimited;
import ai.docsite.equation.math.Equation;
import ai.docsite.equation.math.FontHint;
import ai.docsite.equation.math.Fraction;
import ai.docsite.equation.math.MathNode;
import ai.docsite.equation.math.MathRun;
import ai.docsite.equation.math.Matrix;
import ai.docsite.equation.math.MatrixCell;
import ai.docsite.equation.math.Sub;
import ai.docsite.equation.math.SubSup;
import ai.docsite.equation.math.Sup;
import java.io.StringWriter;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Serializes an {@link Equation} into Office Math markup ({@code m:oMath}).
 *
 * <p>The element layout follows what the downstream renderer expects: every composite element ends with an
 * {@code m:ctrlPr} marker, delimiters always declare both glyphs, and matrices declare exactly one centered column.
 */
public final class OmmlWriter {

    public static final String MATH_NS = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String WORD_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String DEFAULT_MATH_FONT = "Cambria Math";

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final String mathFont;

    public OmmlWriter() {
        this(DEFAULT_MATH_FONT);
    }

    public OmmlWriter(String mathFont) {
        if (mathFont == null || mathFont.isBlank()) {
            throw new IllegalArgumentException("mathFont must not be blank");
        }
        this.mathFont = mathFont;
    }

    /**
     * Builds a standalone document whose root is the {@code m:oMath} element.
     */
    public Document toDocument(Equation equation) {
        Objects.requireNonNull(equation, "equation");
        Document document = newDocument();
        Element root = write(equation, document);
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:m", MATH_NS);
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:w", WORD_NS);
        document.appendChild(root);
        return document;
    }

    /**
     * Creates an unattached {@code m:oMath} element owned by {@code document}, ready to be placed inside a paragraph.
     */
    public Element write(Equation equation, Document document) {
        Objects.requireNonNull(equation, "equation");
        Objects.requireNonNull(document, "document");
        Element oMath = math(document, "oMath");
        appendAll(oMath, equation.nodes());
        return oMath;
    }

    /**
     * Prints the equation as an XML fragment without an XML declaration.
     */
    public String toXml(Equation equation) {
        Document document = toDocument(equation);
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException ex) {
            throw new OmmlSerializationException("Failed to print OMML markup", ex);
        }
    }

    private void appendAll(Element parent, List<MathNode> nodes) {
        for (MathNode node : nodes) {
            append(parent, node);
        }
    }

    private void append(Element parent, MathNode node) {
        if (node instanceof MathRun run) {
            parent.appendChild(run(parent.getOwnerDocument(), run));
        } else if (node instanceof Fraction fraction) {
            appendFraction(parent, fraction);
        } else if (node instanceof SubSup subSup) {
            appendScript(parent, "sSubSup", subSup.base(), subSup.sub(), subSup.sup());
        } else if (node instanceof Sub sub) {
            appendScript(parent, "sSub", sub.base(), sub.sub(), null);
        } else if (node instanceof Sup sup) {
            appendScript(parent, "sSup", sup.base(), null, sup.sup());
        } else if (node instanceof Delimited delimited) {
            appendDelimited(parent, delimited);
        } else if (node instanceof Matrix matrix) {
            appendMatrix(parent, matrix);
        } else {
            throw new IllegalArgumentException("Unsupported math node: " + node.getClass().getName());
        }
    }

    private void appendFraction(Element parent, Fraction fraction) {
        Element f = appendMath(parent, "f");
        Element fPr = appendMath(f, "fPr");
        fPr.appendChild(controlProperties(parent.getOwnerDocument()));
        appendArgument(f, "num", fraction.numerator());
        appendArgument(f, "den", fraction.denominator());
        f.appendChild(controlProperties(parent.getOwnerDocument()));
    }

    private void appendScript(Element parent, String kind, MathNode base, MathNode sub, MathNode sup) {
        Element script = appendMath(parent, kind);
        Element properties = appendMath(script, kind + "Pr");
        properties.appendChild(controlProperties(parent.getOwnerDocument()));
        appendArgument(script, "e", List.of(base));
        if (sub != null) {
            appendArgument(script, "sub", List.of(sub));
        }
        if (sup != null) {
            appendArgument(script, "sup", List.of(sup));
        }
        script.appendChild(controlProperties(parent.getOwnerDocument()));
    }

    private void appendDelimited(Element parent, Delimited delimited) {
        Element d = appendMath(parent, "d");
        Element dPr = appendMath(d, "dPr");
        setValue(appendMath(dPr, "begChr"), delimited.openGlyph());
        setValue(appendMath(dPr, "endChr"), delimited.closeGlyph());
        dPr.appendChild(controlProperties(parent.getOwnerDocument()));
        appendArgument(d, "e", delimited.inner());
        d.appendChild(controlProperties(parent.getOwnerDocument()));
    }

    private void appendMatrix(Element parent, Matrix matrix) {
        Element m = appendMath(parent, "m");
        Element mPr = appendMath(m, "mPr");
        Element mcPr = appendMath(appendMath(appendMath(mPr, "mcs"), "mc"), "mcPr");
        setValue(appendMath(mcPr, "count"), "1");
        setValue(appendMath(mcPr, "mcJc"), "center");
        setValue(appendMath(mPr, "plcHide"), "1");
        mPr.appendChild(controlProperties(parent.getOwnerDocument()));
        for (List<MatrixCell> row : matrix.rows()) {
            Element mr = appendMath(m, "mr");
            for (MatrixCell cell : row) {
                appendArgument(mr, "e", cell.content());
            }
        }
        m.appendChild(controlProperties(parent.getOwnerDocument()));
    }

    private void appendArgument(Element parent, String name, List<MathNode> content) {
        Element argument = appendMath(parent, name);
        appendAll(argument, content);
        argument.appendChild(controlProperties(parent.getOwnerDocument()));
    }

    private Element run(Document document, MathRun run) {
        Element r = math(document, "r");
        Element rPr = math(document, "rPr");
        setValue(appendMath(rPr, "sty"), "p");
        r.appendChild(rPr);
        Element wordProperties = word(document, "rPr");
        wordProperties.appendChild(fonts(document, run.hint()));
        r.appendChild(wordProperties);
        Element text = math(document, "t");
        // a fragment must stay on one output line
        String content = LINE_BREAK.matcher(run.text()).replaceAll(" ");
        if (!content.equals(content.strip())) {
            text.setAttributeNS(XMLConstants.XML_NS_URI, "xml:space", "preserve");
        }
        text.setTextContent(content);
        r.appendChild(text);
        return r;
    }

    private Element controlProperties(Document document) {
        Element ctrlPr = math(document, "ctrlPr");
        Element rPr = word(document, "rPr");
        rPr.appendChild(fonts(document, FontHint.EAST_ASIAN));
        ctrlPr.appendChild(rPr);
        return ctrlPr;
    }

    private Element fonts(Document document, FontHint hint) {
        Element rFonts = word(document, "rFonts");
        rFonts.setAttributeNS(WORD_NS, "w:hint", hint.markupValue());
        rFonts.setAttributeNS(WORD_NS, "w:ascii", mathFont);
        rFonts.setAttributeNS(WORD_NS, "w:hAnsi", mathFont);
        return rFonts;
    }

    private static Element appendMath(Element parent, String localName) {
        Element child = math(parent.getOwnerDocument(), localName);
        parent.appendChild(child);
        return child;
    }

    private static void setValue(Element element, String value) {
        element.setAttributeNS(MATH_NS, "m:val", value);
    }

    private static Element math(Document document, String localName) {
        return document.createElementNS(MATH_NS, "m:" + localName);
    }

    private static Element word(Document document, String localName) {
        return document.createElementNS(WORD_NS, "w:" + localName);
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException ex) {
            throw new OmmlSerializationException("Failed to create an XML document", ex);
        }
    }
}
