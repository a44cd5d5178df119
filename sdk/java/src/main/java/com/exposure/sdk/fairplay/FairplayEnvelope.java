package com.exposure.sdk.fairplay;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Parser for the XML envelope returned by both the certificate and the content key endpoints.
 *
 * <p>Success:
 * <pre>
 * &lt;fps&gt;
 *    &lt;checksum&gt;82033743d5c0&lt;/checksum&gt;
 *    &lt;version&gt;1.2.3.400&lt;/version&gt;
 *    &lt;hostname&gt;host.example.com&lt;/hostname&gt;
 *    &lt;cert&gt;MIIExzCCA6+gAwIBAgIIVRMcpsYSxcIwDQYJKoZIhvcNAQEFBQAwfzELMAkGA1UE&lt;/cert&gt;
 * &lt;/fps&gt;
 * </pre>
 * The content key endpoint carries {@code <ckc>} instead of {@code <cert>}.
 *
 * <p>Error:
 * <pre>
 * &lt;error&gt;
 *    &lt;checksum&gt;82033743d5c0&lt;/checksum&gt;
 *    &lt;version&gt;1.2.3.400&lt;/version&gt;
 *    &lt;hostname&gt;Some host&lt;/hostname&gt;
 *    &lt;code&gt;500&lt;/code&gt;
 *    &lt;message&gt;Error message&lt;/message&gt;
 * &lt;/error&gt;
 * </pre>
 */
public final class FairplayEnvelope {
    public static final String CERTIFICATE_ELEMENT = "cert";
    public static final String CONTENT_KEY_CONTEXT_ELEMENT = "ckc";

    private static final DocumentBuilderFactory FACTORY = createFactory();

    private FairplayEnvelope() {
    }

    /**
     * @param body           raw response body
     * @param payloadElement {@link #CERTIFICATE_ELEMENT} or {@link #CONTENT_KEY_CONTEXT_ELEMENT}
     */
    public static EnvelopeResult parse(byte[] body, String payloadElement) {
        if (body == null || body.length == 0) {
            return EnvelopeResult.unrecognized("Empty response body");
        }
        Document document;
        try {
            DocumentBuilder builder;
            synchronized (FACTORY) {
                builder = FACTORY.newDocumentBuilder();
            }
            builder.setErrorHandler(new DefaultHandler());
            document = builder.parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        } catch (SAXException | IOException e) {
            return EnvelopeResult.unrecognized("Malformed XML: " + e.getMessage());
        }

        Element root = document.getDocumentElement();
        String rootName = root.getTagName();
        if ("fps".equals(rootName)) {
            String encoded = childText(root, payloadElement);
            if (encoded == null) {
                return EnvelopeResult.unrecognized("<fps> envelope without <" + payloadElement + ">");
            }
            try {
                return EnvelopeResult.payload(Base64.getMimeDecoder().decode(encoded));
            } catch (IllegalArgumentException e) {
                return EnvelopeResult.unrecognized("Invalid base64 in <" + payloadElement + ">: " + e.getMessage());
            }
        }
        if ("error".equals(rootName)) {
            String code = childText(root, "code");
            String message = childText(root, "message");
            if (code != null && message != null) {
                try {
                    return EnvelopeResult.serverError(Integer.parseInt(code), message);
                } catch (NumberFormatException e) {
                    return EnvelopeResult.unrecognized("Non numeric error code: " + code);
                }
            }
            return EnvelopeResult.unrecognized("<error> envelope without <code> and <message>");
        }
        return EnvelopeResult.unrecognized("Unexpected root element <" + rootName + ">");
    }

    private static String childText(Element parent, String name) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(child.getNodeName())) {
                return child.getTextContent().trim();
            }
        }
        return null;
    }

    private static DocumentBuilderFactory createFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }
}
