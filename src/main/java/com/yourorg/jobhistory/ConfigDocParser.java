package com.yourorg.jobhistory;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a job configuration document ({@code <configuration><property><name/><value/>...})
 * into a flat map, adding the fields derived from its file name.
 */
public class ConfigDocParser {
  private static final Logger log = LoggerFactory.getLogger(ConfigDocParser.class);

  public static final String DEFAULT_SUBMIT_HOST_PROPERTY = "mapreduce.job.submithostname";
  public static final String UNKNOWN_HOST = "unknown-host";

  public static final String JOBID = "JOBID";
  public static final String JOBTRACKER_START_TIME = "JOBTRACKER_START_TIME";
  public static final String JOB_NUMBER = "JOB_NUMBER";
  public static final String SUBMIT_HOST = "SUBMIT_HOST";

  private static final XMLInputFactory2 FACTORY = newFactory();

  private final String submitHostProperty;

  public ConfigDocParser(String submitHostProperty) {
    this.submitHostProperty = submitHostProperty != null ? submitHostProperty : DEFAULT_SUBMIT_HOST_PROPERTY;
  }

  public Map<String, String> parse(Path configFile) throws IOException {
    ConfigFilename name = ConfigFilename.parse(configFile.getFileName().toString());
    try (InputStream in = Files.newInputStream(configFile)) {
      return parse(name, in);
    }
  }

  public Map<String, String> parse(ConfigFilename name, InputStream doc) throws IOException {
    Map<String, String> out = readProperties(doc);

    out.put(JOBID, name.jobId());
    out.put(JOBTRACKER_START_TIME, name.trackerStartTime);
    out.put(JOB_NUMBER, name.jobNumber);

    String host = out.get(submitHostProperty);
    out.put(SUBMIT_HOST, host != null ? host.replace('.', '_') : UNKNOWN_HOST);
    return out;
  }

  public static Map<String, String> readProperties(InputStream doc) throws IOException {
    Map<String, String> out = new LinkedHashMap<>();
    XMLStreamReader2 r = null;
    try {
      r = (XMLStreamReader2) FACTORY.createXMLStreamReader(doc);

      boolean inProperty = false;
      String name = null;
      String value = null;

      while (r.hasNext()) {
        int ev = r.next();
        if (ev == XMLStreamConstants.START_ELEMENT) {
          switch (r.getLocalName()) {
            case "property" -> {
              inProperty = true;
              name = null;
              value = null;
            }
            case "name" -> { if (inProperty) name = r.getElementText().trim(); }
            case "value" -> { if (inProperty) value = r.getElementText(); }
            default -> { /* description, final, source */ }
          }
        } else if (ev == XMLStreamConstants.END_ELEMENT && "property".equals(r.getLocalName())) {
          if (name != null && !name.isEmpty()) out.put(name, value != null ? value : "");
          inProperty = false;
        }
      }
      return out;
    } catch (XMLStreamException e) {
      throw new IOException("Malformed config document: " + e.getMessage(), e);
    } finally {
      if (r != null) {
        try {
          r.close();
        } catch (XMLStreamException e) {
          log.debug("Failed to close config reader", e);
        }
      }
    }
  }

  private static XMLInputFactory2 newFactory() {
    XMLInputFactory2 f = (XMLInputFactory2) XMLInputFactory.newInstance();
    f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
    f.setXMLResolver((publicId, systemId, baseURI, ns) -> null);
    return f;
  }
}
