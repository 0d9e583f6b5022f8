package com.flamingo.ai.docpipeline.service.document;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.exception.FileTooLargeException;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/** Checks that an upload is a non-empty PDF within the size limit and reads it. */
@Component
@RequiredArgsConstructor
public class PdfUploadValidator {

  private static final String PDF_MIME_TYPE = "application/pdf";
  private static final Set<String> GENERIC_MIME_TYPES =
      Set.of("application/octet-stream", "binary/octet-stream");
  private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

  private final PipelineConfig pipelineConfig;

  /**
   * Validates the upload and returns its bytes.
   *
   * @throws InvalidDocumentException if the file is empty or not a PDF
   * @throws FileTooLargeException if the file exceeds the upload limit
   */
  public byte[] validateAndRead(MultipartFile file) {
    String fileName = file.getOriginalFilename();
    if (file.isEmpty()) {
      throw new InvalidDocumentException(fileName, "File is empty");
    }
    if (!looksLikePdf(file.getContentType(), fileName)) {
      throw new InvalidDocumentException(
          fileName, "Unsupported file type: " + file.getContentType() + ". Only PDF is accepted");
    }
    long maxBytes = pipelineConfig.getUpload().getMaxFileBytes();
    if (file.getSize() > maxBytes) {
      throw new FileTooLargeException(file.getSize(), maxBytes);
    }

    byte[] bytes;
    try {
      bytes = file.getBytes();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read upload " + fileName, e);
    }
    if (bytes.length < PDF_MAGIC.length
        || !Arrays.equals(Arrays.copyOf(bytes, PDF_MAGIC.length), PDF_MAGIC)) {
      throw new InvalidDocumentException(fileName, "File is not a PDF document");
    }
    return bytes;
  }

  private static boolean looksLikePdf(String contentType, String fileName) {
    if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith(PDF_MIME_TYPE)) {
      return true;
    }
    boolean generic = contentType == null || GENERIC_MIME_TYPES.contains(contentType);
    return generic && fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
  }
}
