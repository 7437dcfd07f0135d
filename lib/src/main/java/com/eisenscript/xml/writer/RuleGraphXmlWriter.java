package com.eisenscript.xml.writer;

import com.eisenscript.xml.graph.CallRecord;
import com.eisenscript.xml.graph.InstanceCallRecord;
import com.eisenscript.xml.graph.RuleCallRecord;
import com.eisenscript.xml.graph.RuleGraph;
import com.eisenscript.xml.graph.RuleRecord;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
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
 * Serializes a {@link RuleGraph} as EisenXML:
 *
 * <pre>
 * &lt;?xml version="1.0" encoding="UTF-8"?&gt;
 * &lt;rules max_depth="1000"&gt;
 *   &lt;rule name="entry"&gt;
 *     &lt;call count="3" rule="foo_00" transforms="ry 10"/&gt;
 *   &lt;/rule&gt;
 *   &lt;rule name="foo_00"&gt;
 *     &lt;call count="2" rule="foo" transforms="rz 5"/&gt;
 *   &lt;/rule&gt;
 * &lt;/rules&gt;
 * </pre>
 *
 * <p>Attributes come out in alphabetical order, as the JDK serializer writes them.</p>
 */
public final class RuleGraphXmlWriter {
    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";
    static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    public Document toDocument(RuleGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Document document = newDocument();
        Element root = document.createElement("rules");
        root.setAttribute("max_depth", graph.getMaxDepth());
        document.appendChild(root);
        for (RuleRecord rule : graph.getRules()) {
            Element ruleElement = document.createElement("rule");
            ruleElement.setAttribute("name", rule.getName());
            rule.getWeight().ifPresent(weight -> ruleElement.setAttribute("weight", weight));
            rule.getMaxDepth().ifPresent(depth -> ruleElement.setAttribute("max_depth", depth));
            rule.getSuccessor().ifPresent(successor -> ruleElement.setAttribute("successor", successor));
            for (CallRecord call : rule.getCalls()) {
                ruleElement.appendChild(toElement(document, call));
            }
            root.appendChild(ruleElement);
        }
        return document;
    }

    public String toXml(RuleGraph graph) throws IOException {
        StringWriter writer = new StringWriter();
        write(graph, writer);
        return writer.toString();
    }

    public void write(RuleGraph graph, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(graph, writer);
        }
    }

    public void write(RuleGraph graph, Writer writer) throws IOException {
        Document document = toDocument(graph);
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(INDENT_AMOUNT, "2");
            // The serializer would put the root element on the declaration line.
            writer.write(XML_DECLARATION);
            writer.write(System.lineSeparator());
            transformer.transform(new DOMSource(document), new StreamResult(writer));
        } catch (TransformerException ex) {
            throw new IOException("Failed to serialize rule graph: " + ex.getMessage(), ex);
        }
        writer.flush();
    }

    private static Element toElement(Document document, CallRecord call) {
        Element element;
        String targetAttribute;
        if (call instanceof InstanceCallRecord) {
            element = document.createElement("instance");
            targetAttribute = "shape";
        } else if (call instanceof RuleCallRecord) {
            element = document.createElement("call");
            targetAttribute = "rule";
        } else {
            throw new IllegalArgumentException("Unsupported call: " + call);
        }
        element.setAttribute("transforms", call.getTransforms());
        if (call.getCount().isPresent()) {
            element.setAttribute("count", call.getCount().get());
        }
        element.setAttribute(targetAttribute, call.getTarget());
        return element;
    }

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML document builder unavailable", ex);
        }
    }
}
