package com.s3vectors.filesearch.service.embedding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import lombok.extern.slf4j.Slf4j;

/**
 * Extracts PDF text page by page. Documents without a text layer are described by name and size;
 * documents PDFBox cannot open are handed to the generic extractor.
 */
@Slf4j
class PdfContentExtractor implements ContentExtractor {

  private final ContentExtractor fallback;

  PdfContentExtractor(ContentExtractor fallback) {
    this.fallback = fallback;
  }

  @Override
  public String extractText(Path file) throws IOException {
    StringBuilder text = new StringBuilder();

    try (PDDocument document = Loader.loadPDF(file.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      int pageCount = document.getNumberOfPages();

      for (int page = 1; page <= pageCount; page++) {
        try {
          stripper.setStartPage(page);
          stripper.setEndPage(page);
          String pageText = stripper.getText(document);
          if (!pageText.isBlank()) {
            text.append("\n--- Page ").append(page).append(" ---\n").append(pageText);
          }
        } catch (IOException | RuntimeException e) {
          log.warn(
              "Error extracting text from page {} of {}: {}",
              page,
              file.getFileName(),
              e.getMessage());
        }
      }
    } catch (IOException | RuntimeException e) {
      log.error(
          "Could not read PDF {}, falling back to generic extraction: {}",
          file.getFileName(),
          e.getMessage());
      return fallback.extractText(file);
    }

    if (text.toString().isBlank()) {
      log.warn("No text content extracted from PDF {}, using file metadata", file.getFileName());
      return String.format(
          "PDF document: %s, size: %d bytes", file.getFileName(), Files.size(file));
    }

    log.info("Extracted {} characters from PDF {}", text.length(), file.getFileName());
    return text.toString();
  }
}
