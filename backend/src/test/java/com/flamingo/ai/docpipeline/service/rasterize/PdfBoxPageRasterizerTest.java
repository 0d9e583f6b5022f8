package com.flamingo.ai.docpipeline.service.rasterize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import com.flamingo.ai.docpipeline.support.TestPdfs;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PdfBoxPageRasterizerTest {

  private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};

  private final PdfBoxPageRasterizer rasterizer = new PdfBoxPageRasterizer();

  @Test
  @DisplayName("renders every page to PNG, numbered from 1")
  void shouldRenderAllPages() {
    RasterizedDocument document = rasterizer.rasterize(TestPdfs.withPages(3), 36, "job-1");

    assertThat(document.pageCount()).isEqualTo(3);
    assertThat(document.pages()).extracting(PageImage::pageNumber).containsExactly(1, 2, 3);
    assertThat(document.pages()).allMatch(page -> page.dpi() == 36);
    assertThat(document.pages())
        .allMatch(page -> Arrays.equals(Arrays.copyOf(page.png(), 4), PNG_SIGNATURE));
    assertThat(document.metadata()).containsEntry("pages", "3");
    assertThat(document.metadata()).containsKey("file_size");
  }

  @Test
  @DisplayName("rejects bytes that are not a PDF")
  void shouldRejectInvalidPdf() {
    assertThatThrownBy(() -> rasterizer.rasterize("hello".getBytes(), 72, "job-2"))
        .isInstanceOf(InvalidDocumentException.class)
        .hasMessageContaining("not a readable PDF");
  }

  @Test
  @DisplayName("rejects a document without pages")
  void shouldRejectEmptyDocument() {
    assertThatThrownBy(() -> rasterizer.rasterize(TestPdfs.empty(), 72, "job-3"))
        .isInstanceOf(InvalidDocumentException.class);
  }

  @Test
  @DisplayName("rejects empty input")
  void shouldRejectEmptyInput() {
    assertThatThrownBy(() -> rasterizer.rasterize(new byte[0], 72, "job-4"))
        .isInstanceOf(InvalidDocumentException.class);
  }
}
