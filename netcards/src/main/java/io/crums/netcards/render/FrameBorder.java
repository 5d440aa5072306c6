/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decomposes the frame around a rectangular block of cells into runs of
 * cells sharing the same border sides. Only the block's outer edges are
 * drawn; interior cells get no borders.
 *
 * <h2>Cases</h2>
 * <ul>
 * <li>1 x 1: the cell, all four sides.</li>
 * <li>1 x N: left cap (top, left, bottom), a middle run (top, bottom), right
 *     cap (top, right, bottom).</li>
 * <li>N x 1: top cap (top, left, right), a middle run (left, right), bottom
 *     cap (bottom, left, right).</li>
 * <li>N x M: four corners, and the top, left, bottom and right edge runs
 *     between them.</li>
 * </ul>
 * Empty middle (or edge) runs are omitted.
 */
public class FrameBorder {

  /**
   * The sides of a cell's border that are drawn.
   */
  public record Sides(boolean top, boolean left, boolean bottom, boolean right) {

    public final static Sides NONE = new Sides(false, false, false, false);
    public final static Sides ALL = new Sides(true, true, true, true);

    /** Returns the union of this and the given sides. */
    public Sides or(Sides other) {
      return new Sides(
          top || other.top,
          left || other.left,
          bottom || other.bottom,
          right || other.right);
    }

    public boolean isNone() {
      return !(top || left || bottom || right);
    }
  }


  /**
   * A rectangular run of cells (inclusive bounds) sharing the same sides.
   */
  public record Run(int firstRow, int firstCol, int lastRow, int lastCol, Sides sides) {

    public Run {
      if (firstRow < 0 || firstCol < 0 || lastRow < firstRow || lastCol < firstCol)
        throw new IllegalArgumentException(
            "[" + firstRow + "," + firstCol + "]-[" + lastRow + "," + lastCol + "]");
    }

    /** Returns the number of cells in this run. */
    public int cells() {
      return (lastRow - firstRow + 1) * (lastCol - firstCol + 1);
    }

    public boolean contains(int row, int col) {
      return row >= firstRow && row <= lastRow && col >= firstCol && col <= lastCol;
    }
  }


  // only a namespace
  private FrameBorder() {  }


  /**
   * Returns the runs framing the given block. An empty block (no rows or no
   * columns) has no frame.
   *
   * @param firstRow  zero-based
   * @param firstCol  zero-based
   * @param rows      number of rows in the block
   * @param cols      number of columns in the block
   */
  public static List<Run> runs(int firstRow, int firstCol, int rows, int cols) {
    if (firstRow < 0 || firstCol < 0)
      throw new IllegalArgumentException("first row/col: " + firstRow + "/" + firstCol);
    if (rows <= 0 || cols <= 0)
      return Collections.emptyList();

    final int lastRow = firstRow + rows - 1;
    final int lastCol = firstCol + cols - 1;
    var runs = new ArrayList<Run>(8);

    if (rows == 1 && cols == 1) {
      runs.add(new Run(firstRow, firstCol, firstRow, firstCol, Sides.ALL));

    } else if (rows == 1) {
      runs.add(new Run(firstRow, firstCol, firstRow, firstCol, new Sides(true, true, true, false)));
      addRun(runs, firstRow, firstCol + 1, firstRow, lastCol - 1, new Sides(true, false, true, false));
      runs.add(new Run(firstRow, lastCol, firstRow, lastCol, new Sides(true, false, true, true)));

    } else if (cols == 1) {
      runs.add(new Run(firstRow, firstCol, firstRow, firstCol, new Sides(true, true, false, true)));
      addRun(runs, firstRow + 1, firstCol, lastRow - 1, firstCol, new Sides(false, true, false, true));
      runs.add(new Run(lastRow, firstCol, lastRow, firstCol, new Sides(false, true, true, true)));

    } else {
      // corners
      runs.add(new Run(firstRow, firstCol, firstRow, firstCol, new Sides(true, true, false, false)));
      runs.add(new Run(firstRow, lastCol, firstRow, lastCol, new Sides(true, false, false, true)));
      runs.add(new Run(lastRow, firstCol, lastRow, firstCol, new Sides(false, true, true, false)));
      runs.add(new Run(lastRow, lastCol, lastRow, lastCol, new Sides(false, false, true, true)));
      // edges
      addRun(runs, firstRow, firstCol + 1, firstRow, lastCol - 1, new Sides(true, false, false, false));
      addRun(runs, firstRow + 1, firstCol, lastRow - 1, firstCol, new Sides(false, true, false, false));
      addRun(runs, lastRow, firstCol + 1, lastRow, lastCol - 1, new Sides(false, false, true, false));
      addRun(runs, firstRow + 1, lastCol, lastRow - 1, lastCol, new Sides(false, false, false, true));
    }
    return runs;
  }


  private static void addRun(
      List<Run> runs, int firstRow, int firstCol, int lastRow, int lastCol, Sides sides) {
    if (lastRow >= firstRow && lastCol >= firstCol)
      runs.add(new Run(firstRow, firstCol, lastRow, lastCol, sides));
  }


  /**
   * Returns the sides drawn for the given cell, given the runs of one or more
   * frames. Cells outside every run have {@linkplain Sides#NONE no sides}.
   */
  public static Sides sidesAt(List<Run> runs, int row, int col) {
    var sides = Sides.NONE;
    for (var run : runs)
      if (run.contains(row, col))
        sides = sides.or(run.sides());
    return sides;
  }

}
