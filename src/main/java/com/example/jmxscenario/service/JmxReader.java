package com.example.jmxscenario.service;

import com.example.jmxscenario.exception.JmxParseException;
import com.example.jmxscenario.util.HashTreeIndex;
import com.example.jmxscenario.util.JmxProps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Parses JMX text into a DOM. Any failure here is fatal for the conversion.
 */
@Service
@Slf4j
public class JmxReader {

    public Document read(Path jmx) {
        if (!Files.isRegularFile(jmx)) {
            throw new JmxParseException("File not found", jmx.toString());
        }
        log.debug("Reading JMX file {}", jmx.toAbsolutePath());
        try (InputStream in = Files.newInputStream(jmx)) {
            return read(new InputSource(in));
        } catch (NoSuchFileException e) {
            throw new JmxParseException("File not found", jmx.toString(), e);
        } catch (IOException e) {
            throw new JmxParseException("Unable to read JMX file", e.getMessage(), e);
        }
    }

    public Document read(String xml) {
        if (xml == null || xml.trim().isEmpty()) {
            throw new JmxParseException("Invalid XML", "document is empty");
        }
        return read(new InputSource(new StringReader(xml)));
    }

    private Document read(InputSource source) {
        Document document;
        try {
            document = newBuilder().parse(source);
        } catch (SAXException e) {
            throw new JmxParseException("Invalid XML", e.getMessage(), e);
        } catch (IOException e) {
            throw new JmxParseException("Unable to read JMX document", e.getMessage(), e);
        }
        validate(document);
        return document;
    }

    private void validate(Document document) {
        Element root = document.getDocumentElement();
        if (root == null || !"jmeterTestPlan".equals(root.getTagName())) {
            throw new JmxParseException("Not a JMeter test plan",
                    "root element is " + (root == null ? "missing" : "<" + root.getTagName() + ">"));
        }
        boolean hasTree = JmxProps.childElements(root).stream()
                .anyMatch(el -> HashTreeIndex.HASH_TREE.equals(el.getTagName()));
        if (!hasTree) {
            throw new JmxParseException("Not a JMeter test plan", "top-level <hashTree> is missing");
        }
    }

    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
            dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            dbf.setExpandEntityReferences(false);
            DocumentBuilder db = dbf.newDocumentBuilder();
            db.setErrorHandler(new DefaultHandler());
            return db;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }
}
