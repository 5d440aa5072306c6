/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Properties;

/**
 * Population and rendering settings. A simple properties file is used to
 * store these; every property is optional and prefixed with
 * {@linkplain #ROOT "netcards."}.
 *
 * <h2>Properties</h2>
 * <p>
 * Widths for the spreadsheet are in characters; widths for LaTeX, in
 * centimeters.
 * </p>
 */
public class CardSettings {

  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "netcards.";

  /** The value fields take when cleared or inserted without one. Default: empty string. */
  public final static String BLANK = ROOT + "blank";
  /** The edge attribute that marks a graph as weighted. Default: "weight". */
  public final static String WEIGHT_ATTRIBUTE = ROOT + "weight.attribute";
  /**
   * Distributions with at most this many values are listed verbatim; larger
   * ones are summarized. Default: 5.
   */
  public final static String SUMMARY_THRESHOLD = ROOT + "summary.threshold";
  /** Significant digits for floating point values in text and spreadsheets. Default: 3. */
  public final static String SIGNIFICANT_DIGITS = ROOT + "significant.digits";
  /** Decimal places for floating point values in LaTeX output. Default: 4. */
  public final static String TEX_DECIMALS = ROOT + "tex.decimals";
  /** Width (cm) of the value column of a single card's LaTeX table. Default: none. */
  public final static String TEX_VALUE_WIDTH = ROOT + "tex.value.width";
  /** Width (cm) of each card column of a multi-card's LaTeX table. Default: 2.5. */
  public final static String TEX_MULTI_WIDTH = ROOT + "tex.multi.width";
  /** Spreadsheet label column width (characters). Default: 19. */
  public final static String XLSX_LABEL_WIDTH = ROOT + "xlsx.label.width";
  /** Spreadsheet value column width (characters). Default: 35. */
  public final static String XLSX_VALUE_WIDTH = ROOT + "xlsx.value.width";
  /** Spreadsheet value column width for multi-cards (characters). Default: 30. */
  public final static String XLSX_MULTI_WIDTH = ROOT + "xlsx.multi.width";
  /** Spreadsheet zoom percentage. Default: 150. */
  public final static String XLSX_ZOOM = ROOT + "xlsx.zoom";
  /** PDF font size (points). Default: 10. */
  public final static String PDF_FONT_SIZE = ROOT + "pdf.font.size";


  public final static List<String> PROP_NAMES = List.of(
      BLANK,
      WEIGHT_ATTRIBUTE,
      SUMMARY_THRESHOLD,
      SIGNIFICANT_DIGITS,
      TEX_DECIMALS,
      TEX_VALUE_WIDTH,
      TEX_MULTI_WIDTH,
      XLSX_LABEL_WIDTH,
      XLSX_VALUE_WIDTH,
      XLSX_MULTI_WIDTH,
      XLSX_ZOOM,
      PDF_FONT_SIZE);


  /**
   * Default settings.
   */
  public final static CardSettings DEFAULT = new CardSettings(new Properties());



  private static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    return props;
  }



  private final String blank;
  private final String weightAttribute;
  private final int summaryThreshold;
  private final int significantDigits;
  private final int texDecimals;
  private final Double texValueWidth;
  private final double texMultiWidth;
  private final int xlsxLabelWidth;
  private final int xlsxValueWidth;
  private final int xlsxMultiWidth;
  private final int xlsxZoom;
  private final float pdfFontSize;


  public CardSettings(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }


  public CardSettings(Properties props) {
    this.blank = props.getProperty(BLANK, NetworkCard.BLANK);
    this.weightAttribute = props.getProperty(WEIGHT_ATTRIBUTE, "weight").trim();
    if (weightAttribute.isEmpty())
      throw new IllegalArgumentException("empty " + WEIGHT_ATTRIBUTE);
    this.summaryThreshold = getInt(props, SUMMARY_THRESHOLD, 5, 0);
    this.significantDigits = getInt(props, SIGNIFICANT_DIGITS, 3, 1);
    this.texDecimals = getInt(props, TEX_DECIMALS, 4, 0);
    String width = props.getProperty(TEX_VALUE_WIDTH);
    this.texValueWidth =
        width == null || width.isBlank() ? null : getDouble(props, TEX_VALUE_WIDTH, 0);
    this.texMultiWidth = getDouble(props, TEX_MULTI_WIDTH, 2.5);
    this.xlsxLabelWidth = getInt(props, XLSX_LABEL_WIDTH, 19, 1);
    this.xlsxValueWidth = getInt(props, XLSX_VALUE_WIDTH, 35, 1);
    this.xlsxMultiWidth = getInt(props, XLSX_MULTI_WIDTH, 30, 1);
    this.xlsxZoom = getInt(props, XLSX_ZOOM, 150, 10);
    this.pdfFontSize = (float) getDouble(props, PDF_FONT_SIZE, 10);
  }


  private static int getInt(Properties props, String name, int defaultValue, int min) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank())
      return defaultValue;
    int n;
    try {
      n = Integer.parseInt(value.trim());
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(name + "=" + value + " (not an integer)", nfx);
    }
    if (n < min)
      throw new IllegalArgumentException(name + "=" + value + " (min is " + min + ")");
    return n;
  }


  private static double getDouble(Properties props, String name, double defaultValue) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank())
      return defaultValue;
    double d;
    try {
      d = Double.parseDouble(value.trim());
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(name + "=" + value + " (not a number)", nfx);
    }
    if (!(d > 0) || Double.isInfinite(d))
      throw new IllegalArgumentException(name + "=" + value + " (must be positive)");
    return d;
  }


  public final String getBlank() {
    return blank;
  }

  public final String getWeightAttribute() {
    return weightAttribute;
  }

  public final int getSummaryThreshold() {
    return summaryThreshold;
  }

  public final int getSignificantDigits() {
    return significantDigits;
  }

  public final int getTexDecimals() {
    return texDecimals;
  }

  /** Returns the LaTeX value column width (cm), or {@code null} if not set. */
  public final Double getTexValueWidth() {
    return texValueWidth;
  }

  public final double getTexMultiWidth() {
    return texMultiWidth;
  }

  public final int getXlsxLabelWidth() {
    return xlsxLabelWidth;
  }

  public final int getXlsxValueWidth() {
    return xlsxValueWidth;
  }

  public final int getXlsxMultiWidth() {
    return xlsxMultiWidth;
  }

  public final int getXlsxZoom() {
    return xlsxZoom;
  }

  public final float getPdfFontSize() {
    return pdfFontSize;
  }

}
