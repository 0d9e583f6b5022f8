package com.flamingo.ai.docpipeline.service.rasterize;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;

/** Document info fields shared by the rasterizer engines. */
final class PdfMetadata {

  static final String TITLE = "title";
  static final String AUTHOR = "author";
  static final String CREATOR = "creator";
  static final String PRODUCER = "producer";
  static final String PAGES = "pages";
  static final String FILE_SIZE = "file_size";

  private PdfMetadata() {}

  static Map<String, String> from(PDDocument document, long fileSize) {
    Map<String, String> metadata = new LinkedHashMap<>();
    PDDocumentInformation info = document.getDocumentInformation();
    if (info != null) {
      putIfPresent(metadata, TITLE, info.getTitle());
      putIfPresent(metadata, AUTHOR, info.getAuthor());
      putIfPresent(metadata, CREATOR, info.getCreator());
      putIfPresent(metadata, PRODUCER, info.getProducer());
    }
    metadata.put(PAGES, String.valueOf(document.getNumberOfPages()));
    metadata.put(FILE_SIZE, fileSize + " bytes");
    return metadata;
  }

  /**
   * Maps a pdfinfo field name onto the common key, or null for fields that are not kept.
   *
   * <p>pdfinfo prints {@code Title}, {@code Author}, {@code Creator}, {@code Producer}, {@code
   * Pages} and {@code File size} among others.
   */
  static String keyForPdfinfoField(String field) {
    return switch (field) {
      case "Title" -> TITLE;
      case "Author" -> AUTHOR;
      case "Creator" -> CREATOR;
      case "Producer" -> PRODUCER;
      case "Pages" -> PAGES;
      case "File size" -> FILE_SIZE;
      default -> null;
    };
  }

  static void putIfPresent(Map<String, String> metadata, String key, String value) {
    if (value != null && !value.isBlank()) {
      metadata.put(key, value.trim());
    }
  }
}
