/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.awt.Color;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Objects;
import java.util.logging.Logger;

import com.lowagie.text.Chunk;
import com.lowagie.text.Document;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.Rectangle;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;

import io.crums.netcards.CardSettings;
import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;
import io.crums.netcards.Values;
import io.crums.netcards.render.FrameBorder.Run;
import io.crums.netcards.render.FrameBorder.Sides;

/**
 * PDF rendering. The layout follows the spreadsheet's: a label column and
 * one column per card, each panel framed, footnote marks raised after the
 * labels, and the legend in paragraphs below the table.
 */
public class PdfCardRenderer {

  public final static PdfCardRenderer DEFAULT = new PdfCardRenderer(CardSettings.DEFAULT);

  /** Frame line width, in points. */
  public final static float LINE_WIDTH = 0.75f;

  private final static float MARGIN = 36;

  private final CardSettings settings;
  private final Font font;
  private final Font markFont;


  public PdfCardRenderer(CardSettings settings) {
    this.settings = Objects.requireNonNull(settings, "null settings");
    float size = settings.getPdfFontSize();
    this.font = FontFactory.getFont(FontFactory.HELVETICA, size, Font.NORMAL, Color.BLACK);
    this.markFont = FontFactory.getFont(FontFactory.HELVETICA, size * 0.7f, Font.NORMAL, Color.BLACK);
  }


  /**
   * Creates and returns the PDF table for the given card table. The
   * footnote legend is not included.
   */
  public PdfPTable toPdfTable(CardTable table) {
    return toPdfTable(table, FootnoteCodec.encode(table, MarkStyle.PDF));
  }


  private PdfPTable toPdfTable(CardTable table, FootnoteCodec.Encoding encoding) {
    final int columns = table.columns();
    var pdfTable = new PdfPTable(columns);
    pdfTable.setWidthPercentage(100);
    var widths = new float[columns];
    widths[0] = settings.getXlsxLabelWidth();
    for (int c = 1; c < columns; ++c)
      widths[c] = table.valueColumns() == 1 ?
          settings.getXlsxValueWidth() : settings.getXlsxMultiWidth();
    pdfTable.setWidths(widths);

    var frames = new ArrayList<Run>();
    for (var panel : Panel.values())
      frames.addAll(
          FrameBorder.runs(table.panelOffset(panel), 0, table.panelSize(panel), columns));

    for (int r = 0; r < table.rowCount(); ++r) {
      var row = table.rows().get(r);
      var label = new Phrase(new Chunk(row.field(), font));
      String marks = encoding.marks().get(r);
      if (!marks.isEmpty()) {
        var raised = new Chunk(marks, markFont);
        raised.setTextRise(font.getSize() * 0.33f);
        label.add(raised);
      }
      pdfTable.addCell(newCell(label, FrameBorder.sidesAt(frames, r, 0)));
      var values = row.values();
      for (int c = 1; c < columns; ++c) {
        var text = Values.toText(values.get(c - 1), settings.getSignificantDigits());
        pdfTable.addCell(
            newCell(new Phrase(text, font), FrameBorder.sidesAt(frames, r, c)));
      }
    }
    return pdfTable;
  }


  private PdfPCell newCell(Phrase phrase, Sides sides) {
    var borders = new Rectangle(0, 0);
    borders.setBorder(Rectangle.NO_BORDER);
    if (sides.top())
      borders.setBorderWidthTop(LINE_WIDTH);
    if (sides.left())
      borders.setBorderWidthLeft(LINE_WIDTH);
    if (sides.bottom())
      borders.setBorderWidthBottom(LINE_WIDTH);
    if (sides.right())
      borders.setBorderWidthRight(LINE_WIDTH);

    var cell = new PdfPCell(phrase);
    cell.cloneNonPositionParameters(borders);
    cell.setHorizontalAlignment(Element.ALIGN_LEFT);
    cell.setVerticalAlignment(Element.ALIGN_TOP);
    cell.setUseBorderPadding(true);
    cell.setPadding(font.getSize() * 0.3f);
    return cell;
  }


  /**
   * Writes the given table as a PDF document to the given stream. The
   * stream is not closed. A table with no rows yields a single blank page.
   */
  public void write(CardTable table, OutputStream out) throws IOException {
    Objects.requireNonNull(out, "null out");
    var encoding = FootnoteCodec.encode(table, MarkStyle.PDF);
    var pdfTable = toPdfTable(table, encoding);

    var document = new Document(PageSize.A4, MARGIN, MARGIN, MARGIN, MARGIN);
    var writer = PdfWriter.getInstance(document, out);
    writer.setCloseStream(false);
    document.open();
    document.add(pdfTable);
    boolean first = true;
    for (var line : encoding.legendLines()) {
      var p = new Paragraph(line, font);
      if (first) {
        p.setSpacingBefore(font.getSize());
        first = false;
      }
      document.add(p);
    }
    // an empty card still gets its (blank) page
    if (table.rowCount() == 0)
      writer.setPageEmpty(false);
    document.close();
  }


  /**
   * Writes the given table to the given file, overwriting it if it exists.
   * If an error occurs mid-write, the file may be incomplete.
   */
  public void write(CardTable table, File file) throws IOException {
    try (var out = new FileOutputStream(file)) {
      write(table, out);
    }
    Logger.getLogger(NetworkCard.LOG_NAME).fine(() -> "wrote " + file);
  }

}
