/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import io.crums.netcards.CardSettings;
import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;
import io.crums.netcards.Values;
import io.crums.netcards.render.FrameBorder.Run;
import io.crums.netcards.render.FrameBorder.Sides;

/**
 * Spreadsheet ({@code .xlsx}) rendering. One row per field: the (marked)
 * label in the first column, the values in the next. The footnote legend
 * follows in the first value column. Each panel's rows are framed across all
 * columns; gridlines are hidden.
 */
public class XlsxRenderer {

  public final static XlsxRenderer DEFAULT = new XlsxRenderer(CardSettings.DEFAULT);

  /** The worksheet's name. */
  public final static String SHEET_NAME = "Sheet1";

  private final CardSettings settings;


  public XlsxRenderer(CardSettings settings) {
    this.settings = Objects.requireNonNull(settings, "null settings");
  }


  /**
   * Returns the given table rendered as a new workbook. The caller is
   * responsible for closing it.
   */
  public Workbook toWorkbook(CardTable table) {
    Objects.requireNonNull(table, "null table");
    var encoding = FootnoteCodec.encode(table, MarkStyle.SPREADSHEET);
    final int columns = table.columns();

    var workbook = new XSSFWorkbook();
    var sheet = workbook.createSheet(SHEET_NAME);
    sheet.setDisplayGridlines(false);
    sheet.setZoom(settings.getXlsxZoom());
    sheet.setColumnWidth(0, settings.getXlsxLabelWidth() * 256);
    int valueWidth = table.valueColumns() == 1 ?
        settings.getXlsxValueWidth() : settings.getXlsxMultiWidth();
    for (int c = 1; c < columns; ++c)
      sheet.setColumnWidth(c, valueWidth * 256);

    var frames = new ArrayList<Run>();
    for (var panel : Panel.values())
      frames.addAll(
          FrameBorder.runs(table.panelOffset(panel), 0, table.panelSize(panel), columns));

    var styles = new Styles(workbook);
    for (int r = 0; r < table.rowCount(); ++r) {
      var row = sheet.createRow(r);
      var label = row.createCell(0);
      label.setCellValue(encoding.labels().get(r));
      label.setCellStyle(styles.get(false, FrameBorder.sidesAt(frames, r, 0)));
      var values = table.rows().get(r).values();
      for (int c = 1; c < columns; ++c) {
        var cell = row.createCell(c);
        setValue(cell, values.get(c - 1));
        cell.setCellStyle(styles.get(true, FrameBorder.sidesAt(frames, r, c)));
      }
    }

    int r = table.rowCount();
    for (var line : encoding.legendLines()) {
      var cell = sheet.createRow(r++).createCell(1);
      cell.setCellValue(line);
      cell.setCellStyle(styles.get(true, Sides.NONE));
    }
    return workbook;
  }


  private void setValue(Cell cell, Object value) {
    if (value instanceof Long n)
      cell.setCellValue(n.doubleValue());
    else if (value instanceof Double d && Double.isFinite(d))
      cell.setCellValue(Values.roundSignificant(d, settings.getSignificantDigits()));
    else
      cell.setCellValue(Values.toText(value, settings.getSignificantDigits()));
  }


  /**
   * Writes the given table as a workbook to the given stream. The stream is
   * not closed.
   */
  public void write(CardTable table, OutputStream out) throws IOException {
    try (var workbook = toWorkbook(table)) {
      workbook.write(out);
    }
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



  /**
   * Cell styles are a limited workbook resource: one per distinct
   * (column role, border sides) combination.
   */
  private static class Styles {

    private final Workbook workbook;
    private final Map<List<Object>, CellStyle> cache = new HashMap<>();

    Styles(Workbook workbook) {
      this.workbook = workbook;
    }

    CellStyle get(boolean value, Sides sides) {
      return cache.computeIfAbsent(List.of(value, sides), k -> create(value, sides));
    }

    private CellStyle create(boolean value, Sides sides) {
      var style = workbook.createCellStyle();
      style.setAlignment(HorizontalAlignment.LEFT);
      style.setVerticalAlignment(VerticalAlignment.TOP);
      style.setWrapText(value);
      if (sides.top())
        style.setBorderTop(BorderStyle.THIN);
      if (sides.left())
        style.setBorderLeft(BorderStyle.THIN);
      if (sides.bottom())
        style.setBorderBottom(BorderStyle.THIN);
      if (sides.right())
        style.setBorderRight(BorderStyle.THIN);
      return style;
    }
  }

}
