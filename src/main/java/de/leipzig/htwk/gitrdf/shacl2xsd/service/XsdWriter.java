package de.leipzig.htwk.gitrdf.shacl2xsd.service;

import java.io.StringWriter;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeTerms;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Attribute;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Choice;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.ComplexType;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Declaration;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Element;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Facet;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.ModelGroup;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Restriction;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Schema;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.SimpleType;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Union;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.XsdNode;

/**
 * Serializes a schema tree to an indented XML Schema document.
 *
 * <p>Built-in datatypes are qualified with the schema prefix; every other type name and
 * element reference is qualified with {@code tns}, bound to the target namespace.
 */
@Component
public class XsdWriter {

  private static final Logger logger = LoggerFactory.getLogger(XsdWriter.class);

  static final String TARGET_PREFIX = "tns";

  public String write(Schema schema) {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      Document document = factory.newDocumentBuilder().newDocument();
      document.setXmlStandalone(true);

      String prefix = schema.getSchemaPrefix();
      org.w3c.dom.Element root = document.createElementNS(ShapeTerms.XSD_NAMESPACE, prefix + ":schema");
      root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + prefix, ShapeTerms.XSD_NAMESPACE);
      root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + TARGET_PREFIX, schema.getTargetNamespace());
      root.setAttribute("targetNamespace", schema.getTargetNamespace());
      root.setAttribute("elementFormDefault", schema.getElementFormDefault());
      root.setAttribute("attributeFormDefault", schema.getAttributeFormDefault());
      document.appendChild(root);

      Renderer renderer = new Renderer(document, prefix);
      for (XsdNode child : schema.getChildren()) {
        renderer.render(root, child);
      }

      String xml = serialize(document);
      logger.debug("Rendered schema for {} ({} characters)", schema.getTargetNamespace(), xml.length());
      return xml;
    } catch (ParserConfigurationException | TransformerException e) {
      throw new ShapeConversionException("Failed to render XML Schema: " + e.getMessage(), e);
    }
  }

  private String serialize(Document document) throws TransformerException {
    Transformer transformer = TransformerFactory.newInstance().newTransformer();
    transformer.setOutputProperty(OutputKeys.INDENT, "yes");
    transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
    transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

    StringWriter writer = new StringWriter();
    transformer.transform(new DOMSource(document), new StreamResult(writer));
    return writer.toString();
  }

  private static final class Renderer {

    private final Document document;
    private final String prefix;

    Renderer(Document document, String prefix) {
      this.document = document;
      this.prefix = prefix;
    }

    void render(org.w3c.dom.Element parent, XsdNode node) {
      if (node instanceof Element element) {
        renderElement(parent, element);
      } else if (node instanceof Attribute attribute) {
        renderAttribute(parent, attribute);
      } else if (node instanceof ComplexType complexType) {
        renderComplexType(parent, complexType);
      } else if (node instanceof ModelGroup group) {
        renderGroup(parent, group);
      } else if (node instanceof SimpleType simpleType) {
        renderSimpleType(parent, simpleType);
      } else {
        throw new IllegalArgumentException("Cannot render " + node + " at this position");
      }
    }

    private org.w3c.dom.Element create(String localName) {
      return document.createElementNS(ShapeTerms.XSD_NAMESPACE, prefix + ":" + localName);
    }

    /**
     * Datatype names: built-ins take the schema prefix, anything else lives in the target namespace.
     */
    private String qualify(String typeName) {
      return ShapeTerms.isBuiltInType(typeName) ? prefix + ":" + typeName : generated(typeName);
    }

    private static String generated(String name) {
      return TARGET_PREFIX + ":" + name;
    }

    private void renderElement(org.w3c.dom.Element parent, Element element) {
      org.w3c.dom.Element node = create("element");
      if (element.isReference()) {
        node.setAttribute("ref", generated(element.getRef()));
      } else {
        node.setAttribute("name", element.getName());
      }
      if (element.getMinOccurs() != null) {
        node.setAttribute("minOccurs", String.valueOf(element.getMinOccurs()));
      }
      if (element.getMaxOccurs() != null) {
        node.setAttribute("maxOccurs", String.valueOf(element.getMaxOccurs()));
      }
      renderValueType(node, element);
      parent.appendChild(node);
    }

    private void renderAttribute(org.w3c.dom.Element parent, Attribute attribute) {
      org.w3c.dom.Element node = create("attribute");
      node.setAttribute("name", attribute.getName());
      renderValueType(node, attribute);
      node.setAttribute("use", attribute.getUse().value());
      parent.appendChild(node);
    }

    private void renderValueType(org.w3c.dom.Element node, Declaration declaration) {
      if (declaration.getType() != null) {
        node.setAttribute("type", declaration.isGeneratedType()
            ? generated(declaration.getType()) : qualify(declaration.getType()));
      }
      if (declaration.getFixed() != null) {
        node.setAttribute("fixed", declaration.getFixed());
      }
      if (declaration.hasInlineType()) {
        renderSimpleType(node, declaration.getSimpleType());
      }
    }

    private void renderComplexType(org.w3c.dom.Element parent, ComplexType complexType) {
      org.w3c.dom.Element node = create("complexType");
      node.setAttribute("name", complexType.getName());
      parent.appendChild(node);

      org.w3c.dom.Element body = node;
      if (complexType.hasBase()) {
        org.w3c.dom.Element content = create("complexContent");
        org.w3c.dom.Element extension = create("extension");
        extension.setAttribute("base", generated(complexType.getBase()));
        content.appendChild(extension);
        node.appendChild(content);
        body = extension;
      }

      for (XsdNode child : complexType.getContent()) {
        render(body, child);
      }
      for (Attribute attribute : complexType.getAttributes()) {
        renderAttribute(body, attribute);
      }
    }

    private void renderGroup(org.w3c.dom.Element parent, ModelGroup group) {
      org.w3c.dom.Element node = create(group instanceof Choice ? "choice" : "all");
      for (Element element : group.getElements()) {
        renderElement(node, element);
      }
      parent.appendChild(node);
    }

    private void renderSimpleType(org.w3c.dom.Element parent, SimpleType simpleType) {
      org.w3c.dom.Element node = create("simpleType");
      if (simpleType.getContent() instanceof Restriction restriction) {
        org.w3c.dom.Element restrictionNode = create("restriction");
        restrictionNode.setAttribute("base", qualify(restriction.getBase()));
        for (Facet facet : restriction.getFacets()) {
          org.w3c.dom.Element facetNode = create(facet.kind().localName());
          facetNode.setAttribute("value", facet.value());
          restrictionNode.appendChild(facetNode);
        }
        node.appendChild(restrictionNode);
      } else if (simpleType.getContent() instanceof Union union) {
        org.w3c.dom.Element unionNode = create("union");
        unionNode.setAttribute("memberTypes",
            String.join(" ", union.getMemberTypes().stream().map(this::qualify).toList()));
        node.appendChild(unionNode);
      }
      parent.appendChild(node);
    }
  }
}
