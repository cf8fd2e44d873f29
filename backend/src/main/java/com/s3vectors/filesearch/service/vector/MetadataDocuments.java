package com.s3vectors.filesearch.service.vector;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import software.amazon.awssdk.core.document.Document;

/** Conversions between plain maps and the SDK's {@link Document} type used for metadata. */
final class MetadataDocuments {

  private MetadataDocuments() {}

  static Document fromStringMap(Map<String, String> metadata) {
    Map<String, Document> fields = new LinkedHashMap<>();
    metadata.forEach((key, value) -> fields.put(key, Document.fromString(value)));
    return Document.fromMap(fields);
  }

  /** Converts a filter expression. Scalars become strings, the type all metadata is stored as. */
  static Document fromObject(Object value) {
    if (value == null) {
      return Document.fromNull();
    }
    if (value instanceof Document) {
      return (Document) value;
    }
    if (value instanceof Map) {
      Map<String, Document> fields = new LinkedHashMap<>();
      ((Map<?, ?>) value).forEach((k, v) -> fields.put(String.valueOf(k), fromObject(v)));
      return Document.fromMap(fields);
    }
    if (value instanceof Collection) {
      List<Document> items =
          ((Collection<?>) value)
              .stream().map(MetadataDocuments::fromObject).collect(Collectors.toList());
      return Document.fromList(items);
    }
    return Document.fromString(value.toString());
  }

  /** Flattens returned metadata into strings; non-string scalars use their textual form. */
  static Map<String, String> toStringMap(Document document) {
    Map<String, String> metadata = new LinkedHashMap<>();
    if (document == null || !document.isMap()) {
      return metadata;
    }
    document.asMap().forEach((key, value) -> metadata.put(key, asText(value)));
    return metadata;
  }

  private static String asText(Document value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isString()) {
      return value.asString();
    }
    if (value.isNumber()) {
      return value.asNumber().toString();
    }
    if (value.isBoolean()) {
      return String.valueOf(value.asBoolean());
    }
    return value.toString();
  }
}
