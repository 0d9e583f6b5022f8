package com.flamingo.ai.docpipeline.service.rasterize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docpipeline.common.process.ProcessExecutor;
import com.flamingo.ai.docpipeline.common.process.ProcessExecutor.ProcessResult;
import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import com.flamingo.ai.docpipeline.service.resilience.DownstreamGuard;
import com.flamingo.ai.docpipeline.service.storage.WorkspaceStorage;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PdftoppmPageRasterizerTest {

  private static final byte[] PDF = "%PDF-1.7 fake".getBytes();

  @Mock private ProcessExecutor processExecutor;

  @TempDir Path tempDir;

  private PipelineConfig config;
  private PdftoppmPageRasterizer rasterizer;

  /** pdfinfo's stdout, or null to make pdfinfo fail. */
  private String pdfinfoOutput;

  /** Pages that exist in the fake document. */
  private int documentPages;

  /** Whether pdftoppm writes its output files. */
  private boolean writeRenderOutput;

  private int renderExitCode;

  @BeforeEach
  void setUp() {
    config = new PipelineConfig();
    PipelineConfig.Breaker breaker = new PipelineConfig.Breaker();
    breaker.setFailureThreshold(2);
    config.getBreakers().put(DownstreamGuard.RASTERIZER, breaker);
    DownstreamGuard guard =
        new DownstreamGuard(
            CircuitBreaker.of(
                DownstreamGuard.RASTERIZER,
                DownstreamGuard.toConfig(config.breaker(DownstreamGuard.RASTERIZER))),
            new SimpleMeterRegistry());
    rasterizer =
        new PdftoppmPageRasterizer(processExecutor, new WorkspaceStorage(tempDir), guard, config);

    documentPages = 3;
    pdfinfoOutput =
        "Title:          Quarterly Report\nPages:          3\nFile size:      1234 bytes\n";
    writeRenderOutput = true;
    renderExitCode = 0;
    when(processExecutor.run(anyList(), anyString(), any(Duration.class), anyString()))
        .thenAnswer(this::fakeTool);
  }

  @Test
  @DisplayName("reads the page count from pdfinfo and loads every rendered page")
  void shouldRasterizeWithPdfinfoPageCount() {
    RasterizedDocument document = rasterizer.rasterize(PDF, 150, "job-1");

    assertThat(document.pageCount()).isEqualTo(3);
    assertThat(document.pages()).extracting(PageImage::pageNumber).containsExactly(1, 2, 3);
    assertThat(document.pages().get(1).png()).isEqualTo("png-2".getBytes());
    assertThat(document.metadata())
        .containsEntry("title", "Quarterly Report")
        .containsEntry("pages", "3");
    assertWorkspaceReleased();
  }

  @Test
  @DisplayName("probes the page count when pdfinfo does not report one")
  void shouldProbePageCount_whenPdfinfoHasNoPages() {
    pdfinfoOutput = "Producer: scanner\n";
    documentPages = 2;

    RasterizedDocument document = rasterizer.rasterize(PDF, 100, "job-2");

    assertThat(document.pageCount()).isEqualTo(2);
    assertThat(document.metadata())
        .containsEntry("pages", "2")
        .containsEntry("producer", "scanner");
    assertWorkspaceReleased();
  }

  @Test
  @DisplayName("the probe stops at the configured cap")
  void shouldCapProbe() {
    pdfinfoOutput = "";
    documentPages = 50;
    config.getRasterizer().setProbeMaxPages(4);
    rasterizer =
        new PdftoppmPageRasterizer(
            processExecutor,
            new WorkspaceStorage(tempDir),
            new DownstreamGuard(
                CircuitBreaker.of("r", DownstreamGuard.toConfig(new PipelineConfig.Breaker())),
                new SimpleMeterRegistry()),
            config);

    assertThat(rasterizer.rasterize(PDF, 100, "job-3").pageCount()).isEqualTo(4);
  }

  @Test
  @DisplayName("a document pdfinfo cannot read is invalid input")
  void shouldRejectUnreadableDocument() {
    pdfinfoOutput = null;

    assertThatThrownBy(() -> rasterizer.rasterize(PDF, 100, "job-4"))
        .isInstanceOf(InvalidDocumentException.class)
        .hasMessageContaining("Syntax Error");
    assertWorkspaceReleased();
  }

  @Test
  @DisplayName("a missing page image after a successful exit is a conversion failure")
  void shouldFail_whenOutputMissing() {
    writeRenderOutput = false;

    assertThatThrownBy(() -> rasterizer.rasterize(PDF, 100, "job-5"))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("page-1.png");
    assertWorkspaceReleased();
  }

  @Test
  @DisplayName("repeated pdftoppm failures open the rasterizer breaker")
  void shouldOpenBreaker_afterRepeatedFailures() {
    renderExitCode = 1;

    for (int i = 0; i < 2; i++) {
      assertThatThrownBy(() -> rasterizer.rasterize(PDF, 100, "job-6"))
          .isInstanceOf(ConversionException.class);
    }
    assertThatThrownBy(() -> rasterizer.rasterize(PDF, 100, "job-7"))
        .isInstanceOf(DownstreamUnavailableException.class);
  }

  @Test
  @DisplayName("parses the pdfinfo fields it keeps")
  void shouldParsePdfinfo() {
    Map<String, String> info =
        PdftoppmPageRasterizer.parsePdfinfo(
            "Title:  A: B\nAuthor:\nCreator: Writer\nPages: 12\nEncrypted: no\n");

    assertThat(info).containsOnlyKeys("title", "creator", "pages");
    assertThat(info).containsEntry("title", "A: B");
  }

  @Test
  @DisplayName("output names are zero-padded to the width of the page count")
  void shouldPadOutputNames() {
    assertThat(PdftoppmPageRasterizer.outputPath(tempDir, 3, 9).getFileName().toString())
        .isEqualTo("page-3.png");
    assertThat(PdftoppmPageRasterizer.outputPath(tempDir, 3, 120).getFileName().toString())
        .isEqualTo("page-003.png");
  }

  private ProcessResult fakeTool(InvocationOnMock invocation) throws IOException {
    List<String> command = invocation.getArgument(0);
    return switch (command.get(0)) {
      case "pdfinfo" -> pdfinfoOutput == null
          ? new ProcessResult(1, "", "Syntax Error: Couldn't find trailer dictionary")
          : new ProcessResult(0, pdfinfoOutput, "");
      case "pdftoppm" -> command.contains("-singlefile") ? probe(command) : render(command);
      default -> throw new IllegalArgumentException("unexpected tool " + command.get(0));
    };
  }

  private ProcessResult probe(List<String> command) throws IOException {
    int page = Integer.parseInt(command.get(command.indexOf("-f") + 1));
    if (page > documentPages) {
      return new ProcessResult(99, "", "Wrong page range given");
    }
    Files.writeString(Path.of(command.get(command.size() - 1) + ".png"), "probe");
    return new ProcessResult(0, "", "");
  }

  private ProcessResult render(List<String> command) throws IOException {
    if (renderExitCode != 0) {
      return new ProcessResult(renderExitCode, "", "I/O Error");
    }
    if (writeRenderOutput) {
      Path workDir = Path.of(command.get(command.size() - 1)).getParent();
      int last = Integer.parseInt(command.get(command.indexOf("-l") + 1));
      for (int page = 1; page <= last; page++) {
        Files.writeString(PdftoppmPageRasterizer.outputPath(workDir, page, last), "png-" + page);
      }
    }
    return new ProcessResult(0, "", "");
  }

  private void assertWorkspaceReleased() {
    try (Stream<Path> left = Files.list(tempDir)) {
      assertThat(left).isEmpty();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
