package com.flamingo.ai.docpipeline.service.rasterize;

import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/** In-process PDF loading and page rendering with PDFBox. */
public final class PdfPageRenderer {

  private PdfPageRenderer() {}

  /**
   * Parses a PDF, mapping parse failures to {@link InvalidDocumentException}. The caller owns the
   * returned document.
   */
  public static PDDocument load(byte[] pdfBytes, String source) {
    if (pdfBytes == null || pdfBytes.length == 0) {
      throw new InvalidDocumentException(source, "Document is empty");
    }
    try {
      return Loader.loadPDF(pdfBytes);
    } catch (InvalidPasswordException e) {
      throw new InvalidDocumentException(source, "Document is password protected", e);
    } catch (IOException e) {
      throw new InvalidDocumentException(source, "Document is not a readable PDF", e);
    }
  }

  /** Renders the pages {@code [fromIndex, toIndex)} (0-based) to PNG, numbered from 1. */
  public static List<PageImage> render(PDDocument document, int fromIndex, int toIndex, int dpi)
      throws IOException {
    PDFRenderer renderer = new PDFRenderer(document);
    List<PageImage> pages = new ArrayList<>(toIndex - fromIndex);
    for (int index = fromIndex; index < toIndex; index++) {
      BufferedImage image = renderer.renderImageWithDPI(index, dpi, ImageType.RGB);
      pages.add(new PageImage(index + 1, dpi, toPng(image)));
    }
    return pages;
  }

  static byte[] toPng(BufferedImage image) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    if (!ImageIO.write(image, "png", baos)) {
      throw new IOException("No PNG writer available");
    }
    return baos.toByteArray();
  }
}
