package com.droidassist.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a uiautomator window dump into the ordered text dump the extractor reads.
 *
 * Nodes are taken in document order. A node contributes its text attribute,
 * or its content-desc when the text is empty; nodes with neither are dropped.
 * screenIndex counts kept nodes only.
 */
@Component
@Slf4j
public class UiHierarchyParser {

    public List<TextElement> parse(String xml) {
        if (xml == null || xml.indexOf('<') < 0) {
            throw new UiDumpParseException("UI dump contains no XML", null);
        }
        // uiautomator may print a status line before the document
        String document = xml.substring(xml.indexOf('<'));

        Document dom;
        try {
            dom = newBuilder().parse(new InputSource(new StringReader(document)));
        } catch (SAXException | IOException e) {
            throw new UiDumpParseException("Malformed UI dump: " + e.getMessage(), e);
        }

        List<TextElement> elements = new ArrayList<>();
        NodeList nodes = dom.getElementsByTagName("node");
        for (int i = 0; i < nodes.getLength(); i++) {
            Element node = (Element) nodes.item(i);
            String text = TextElement.normalize(node.getAttribute("text"));
            if (text.isEmpty()) {
                text = TextElement.normalize(node.getAttribute("content-desc"));
            }
            if (text.isEmpty()) {
                continue;
            }
            BoundingBox bounds = BoundingBox.parse(node.getAttribute("bounds")).orElse(null);
            elements.add(new TextElement(text, elements.size(), bounds));
        }
        log.debug("Parsed {} text elements from {} layout nodes", elements.size(), nodes.getLength());
        return elements;
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }
}
