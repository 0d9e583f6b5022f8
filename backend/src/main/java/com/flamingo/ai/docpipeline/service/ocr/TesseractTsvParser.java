package com.flamingo.ai.docpipeline.service.ocr;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Tesseract's TSV output into page text and a page confidence.
 *
 * <p>Word rows (level 5) carry a confidence in [0,100]; rows with {@code -1} are layout rows
 * without a recognition score and are ignored. The page confidence is the plain mean of the
 * remaining word confidences.
 */
final class TesseractTsvParser {

  private static final int WORD_LEVEL = 5;
  private static final int COLUMNS = 12;

  private TesseractTsvParser() {}

  record ParsedPage(String text, double confidence, int wordCount) {}

  static ParsedPage parse(String tsv) {
    StringBuilder text = new StringBuilder();
    StringBuilder line = new StringBuilder();
    List<Double> confidences = new ArrayList<>();
    String currentLineKey = null;
    String currentBlock = null;

    for (String row : tsv.split("\\R")) {
      String[] columns = row.split("\t", -1);
      if (columns.length < COLUMNS || !isInteger(columns[0])) {
        continue;
      }
      if (Integer.parseInt(columns[0]) != WORD_LEVEL) {
        continue;
      }
      String word = columns[11].trim();
      if (word.isEmpty()) {
        continue;
      }

      String block = columns[2];
      String lineKey = columns[2] + "/" + columns[3] + "/" + columns[4];
      if (!lineKey.equals(currentLineKey)) {
        flushLine(text, line);
        if (currentBlock != null && !currentBlock.equals(block)) {
          text.append('\n');
        }
        currentLineKey = lineKey;
        currentBlock = block;
      }
      if (line.length() > 0) {
        line.append(' ');
      }
      line.append(word);

      double confidence = parseConfidence(columns[10]);
      if (confidence >= 0) {
        confidences.add(Math.min(100.0, confidence));
      }
    }
    flushLine(text, line);

    double mean = confidences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    return new ParsedPage(text.toString().strip(), mean, confidences.size());
  }

  private static void flushLine(StringBuilder text, StringBuilder line) {
    if (line.length() == 0) {
      return;
    }
    if (text.length() > 0) {
      text.append('\n');
    }
    text.append(line);
    line.setLength(0);
  }

  private static double parseConfidence(String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static boolean isInteger(String value) {
    return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
  }
}
