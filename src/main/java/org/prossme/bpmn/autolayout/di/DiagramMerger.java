package org.prossme.bpmn.autolayout.di;

import lombok.extern.slf4j.Slf4j;
import org.prossme.bpmn.autolayout.bpmn.StructuralException;
import org.w3c.dom.Document;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splices diagram interchange into structural BPMN markup as text, so everything outside the
 * diagram section stays byte for byte as it came in.
 */
@Slf4j
public class DiagramMerger {

    private static final Pattern EXISTING_DIAGRAM = Pattern.compile(
            "[ \\t]*<(?:[\\w.-]+:)?BPMNDiagram\\b(?:[^>]*/>|.*?</(?:[\\w.-]+:)?BPMNDiagram\\s*>)\\s*",
            Pattern.DOTALL);
    private static final Pattern DEFINITIONS_END = Pattern.compile("</(?:[\\w.-]+:)?definitions\\s*>");

    /**
     * Replaces any diagram section of {@code structureXml} with the given diagrams.
     *
     * @throws StructuralException if the markup has no closing definitions tag
     */
    public static String merge(String structureXml, List<Document> diagrams) {
        String stripped = EXISTING_DIAGRAM.matcher(structureXml).replaceAll("");
        if (stripped.length() != structureXml.length()) {
            log.debug("Dropped existing diagram interchange ({} chars)", structureXml.length() - stripped.length());
        }

        int insertAt = lastMatchStart(stripped);
        if (insertAt < 0) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "BPMN markup has no closing definitions tag");
        }

        StringBuilder diagramXml = new StringBuilder();
        for (Document diagram : diagrams) {
            diagramXml.append(toXml(diagram).strip()).append('\n');
        }

        String before = stripped.substring(0, insertAt);
        if (!before.endsWith("\n")) {
            before = before + "\n";
        }
        return before + diagramXml + stripped.substring(insertAt);
    }

    /**
     * Serializes a DOM document (or fragment root) without an XML declaration.
     */
    public static String toXml(Document document) {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(stringWriter));
            return stringWriter.toString();
        } catch (TransformerException e) {
            throw new RuntimeException("Failed to serialize diagram interchange", e);
        }
    }

    private static int lastMatchStart(String xml) {
        Matcher matcher = DEFINITIONS_END.matcher(xml);
        int start = -1;
        while (matcher.find()) {
            start = matcher.start();
        }
        return start;
    }
}
