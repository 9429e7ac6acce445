package sbtext;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
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
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * Prepares SVG costumes: finds the drawing's bounds and, when scaling, wraps its content in a
 * transform that maps those bounds onto a 64x64 box with the rotation center in the middle.
 */
final class SvgNormalizer {
  static final double TARGET_SIZE = 64;

  private static final Splitter VIEW_BOX_SPLITTER =
      Splitter.on(CharMatcher.whitespace().or(CharMatcher.is(','))).omitEmptyStrings();

  /** Raised for a viewBox whose width or height is not positive; the costume is skipped. */
  static final class NonPositiveViewBoxException extends CompilerException {
    private static final long serialVersionUID = 1L;

    NonPositiveViewBoxException(String sourceName) {
      super(
          Phase.CODEGEN,
          String.format("SVG viewBox must have positive width/height in '%s'.", sourceName));
    }
  }

  @AutoValue
  abstract static class Prepared {
    @SuppressWarnings("mutable")
    abstract byte[] data();

    abstract double rotationCenterX();

    abstract double rotationCenterY();

    static Prepared create(byte[] data, double rotationCenterX, double rotationCenterY) {
      return new AutoValue_SvgNormalizer_Prepared(data, rotationCenterX, rotationCenterY);
    }
  }

  private SvgNormalizer() {}

  static Prepared prepare(byte[] data, String sourceName, boolean scale)
      throws CompilerException {
    Document document = parse(data, sourceName);
    Element root = document.getDocumentElement();
    double[] bounds = readBounds(root, sourceName);
    if (!scale) {
      return Prepared.create(serialize(document), bounds[2] / 2, bounds[3] / 2);
    }

    String transform =
        String.format(
            "translate(%s %s) scale(%s %s)",
            Expression.formatNumber(-bounds[0]),
            Expression.formatNumber(-bounds[1]),
            Expression.formatNumber(TARGET_SIZE / bounds[2]),
            Expression.formatNumber(TARGET_SIZE / bounds[3]));
    String wrapperName = root.getPrefix() == null ? "g" : root.getPrefix() + ":g";
    Element wrapper = document.createElementNS(root.getNamespaceURI(), wrapperName);
    wrapper.setAttribute("transform", transform);
    while (root.getFirstChild() != null) {
      wrapper.appendChild(root.getFirstChild());
    }
    String size = Expression.formatNumber(TARGET_SIZE);
    root.setAttribute("viewBox", "0 0 " + size + " " + size);
    root.setAttribute("width", size);
    root.setAttribute("height", size);
    root.appendChild(wrapper);
    return Prepared.create(serialize(document), TARGET_SIZE / 2, TARGET_SIZE / 2);
  }

  /** Returns {@code [minX, minY, width, height]}. */
  static double[] readBounds(Element root, String sourceName) throws CompilerException {
    if (root.hasAttribute("viewBox")) {
      String viewBox = root.getAttribute("viewBox");
      List<String> parts = VIEW_BOX_SPLITTER.splitToList(viewBox);
      if (parts.size() == 4) {
        double[] bounds = new double[4];
        for (int i = 0; i < 4; i++) {
          try {
            bounds[i] = Double.parseDouble(parts.get(i));
          } catch (NumberFormatException e) {
            throw new CompilerException(
                CompilerException.Phase.CODEGEN,
                String.format("Invalid SVG viewBox in '%s': '%s'.", sourceName, viewBox),
                e);
          }
        }
        if (bounds[2] <= 0 || bounds[3] <= 0) {
          throw new NonPositiveViewBoxException(sourceName);
        }
        return bounds;
      }
    }
    Double width = parseLength(root.getAttribute("width"));
    Double height = parseLength(root.getAttribute("height"));
    if (width != null && height != null) {
      return new double[] {0, 0, width, height};
    }
    return new double[] {0, 0, TARGET_SIZE, TARGET_SIZE};
  }

  /** The leading number of a length such as {@code 48px}, or null unless it is positive. */
  static Double parseLength(String value) {
    String s = CharMatcher.whitespace().trimLeadingFrom(value);
    int end = 0;
    if (end < s.length() && (s.charAt(end) == '+' || s.charAt(end) == '-')) end++;
    boolean sawDigit = false;
    while (end < s.length() && isAsciiDigit(s.charAt(end))) {
      sawDigit = true;
      end++;
    }
    if (end < s.length() && s.charAt(end) == '.') {
      end++;
      while (end < s.length() && isAsciiDigit(s.charAt(end))) {
        sawDigit = true;
        end++;
      }
    }
    if (!sawDigit) return null;
    double n = Double.parseDouble(s.substring(0, end));
    return n > 0 ? n : null;
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static Document parse(byte[] data, String sourceName) throws CompilerException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(
          "http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(new DefaultHandler());
      return builder.parse(new ByteArrayInputStream(data));
    } catch (SAXException | IOException e) {
      throw new CompilerException(
          CompilerException.Phase.CODEGEN,
          String.format("Invalid SVG file '%s': %s.", sourceName, e.getMessage()),
          e);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException(e);
    }
  }

  private static byte[] serialize(Document document) throws CompilerException {
    try {
      Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      transformer.transform(new DOMSource(document), new StreamResult(out));
      return out.toByteArray();
    } catch (TransformerException e) {
      throw new CompilerException(
          CompilerException.Phase.CODEGEN, "Failed to write SVG: " + e.getMessage(), e);
    }
  }
}
