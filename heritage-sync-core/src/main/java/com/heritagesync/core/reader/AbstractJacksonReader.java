package com.heritagesync.core.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Abstract base class for source readers that parse XML or JSON files using Jackson.
 *
 * <p>This class provides pre-configured Jackson mappers and utility methods for:
 * <ul>
 *   <li>XML parsing via XmlMapper</li>
 *   <li>JSON parsing via ObjectMapper</li>
 *   <li>JsonNode navigation and text extraction</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class AbstractJacksonReader {

    /**
     * Logger instance for this reader.
     * Automatically initialized with the concrete reader class name.
     */
    protected final Logger log;

    /**
     * XML mapper for parsing XML files.
     * Thread-safe and reusable across parse operations.
     */
    protected final XmlMapper xmlMapper;

    /**
     * JSON mapper for parsing JSON files.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractJacksonReader() {
        this.log = LoggerFactory.getLogger(getClass());
        this.xmlMapper = new XmlMapper();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Parses an XML file into a JsonNode tree.
     *
     * <p>The parser reads raw bytes, so the encoding declared in the XML prolog applies.
     *
     * @param file path to XML file
     * @return root JsonNode of parsed XML
     * @throws IOException if file cannot be read or parsed
     */
    protected JsonNode parseXml(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return xmlMapper.readTree(in);
        }
    }

    /**
     * Parses a JSON file into a JsonNode tree.
     *
     * @param file path to JSON file
     * @return root JsonNode of parsed JSON
     * @throws IOException if file cannot be read or parsed
     */
    protected JsonNode parseJson(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return objectMapper.readTree(in);
        }
    }

    /**
     * Extracts a text value from a child node.
     *
     * <p>Numbers and booleans are returned in their textual form. Empty XML elements
     * yield an empty string.
     *
     * @param node parent JsonNode
     * @param childName child element or property name
     * @return text content of child, or null if not found
     */
    protected String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }

        JsonNode childNode = node.get(childName);
        if (childNode == null || childNode.isNull()) {
            return null;
        }
        if (childNode.isValueNode()) {
            return childNode.asText();
        }
        // Empty XML element parsed as an empty object
        return childNode.isEmpty() ? "" : childNode.toString();
    }

    /**
     * Normalizes a JsonNode to always be an array.
     *
     * <p>If the node is already an array, returns it as-is.
     * If the node is a single object, wraps it in an array.
     * Useful for XML elements that can appear once or multiple times.
     *
     * @param node JsonNode to normalize
     * @return array JsonNode
     */
    protected JsonNode normalizeToArray(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return xmlMapper.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return xmlMapper.createArrayNode().add(node);
    }
}
