/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.cli;


import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;

import org.jgrapht.Graph;
import org.jgrapht.GraphTests;
import org.jgrapht.generate.GnpRandomGraphGenerator;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultDirectedWeightedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleGraph;
import org.jgrapht.graph.SimpleWeightedGraph;
import org.jgrapht.util.SupplierUtil;

import io.crums.netcards.CardSettings;
import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;
import io.crums.netcards.Values;
import io.crums.netcards.json.CardRowsParser;
import io.crums.netcards.json.JsonParsingException;
import io.crums.netcards.json.JsonUtils;
import io.crums.netcards.render.CardTable;
import io.crums.netcards.render.PdfCardRenderer;
import io.crums.netcards.render.TexRenderer;
import io.crums.netcards.render.XlsxRenderer;
import io.crums.netcards.stats.JGraphTStatistics;
import io.crums.netcards.stats.StatisticsPopulator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Network card command line tools.
 */
@Command(
    name = "netcards",
    mixinStandardHelpOptions = true,
    version = {
        "netcards 0.1.0",
    },
    description = {
        "Network card tools: blank card templates, and schema documentation.%n",
    },
    subcommands = {
        HelpCommand.class,
        Templates.class,
        SchemaDoc.class,
    })
public class NetCards {

  /** Logger name used by the command line tools. */
  public final static String LOG_NAME = "netcards.cli";


  public static void main(String[] args) {
    int exitCode = commandLine().execute(args);
    System.exit(exitCode);
  }


  /** Returns a new command line for this program (formats are case-insensitive). */
  static CommandLine commandLine() {
    return new CommandLine(new NetCards()).setCaseInsensitiveEnumValuesAllowed(true);
  }

}


/**
 * Template output formats.
 */
enum Format {
  XLSX("xlsx"),
  TEX("tex"),
  PDF("pdf"),
  JSON("json");

  final String ext;

  private Format(String ext) {
    this.ext = ext;
  }
}


@Command(
    name = "templates",
    description = {
        "Writes blank network card templates (values cleared, footnotes kept)",
        "for sample networks:",
        "  undirected_{unweighted,weighted}_{connected,unconnected}",
        "  directed_{unweighted,weighted}",
        "The undirected samples are G(n,p) random graphs with n=@|bold " + Templates.NODES + "|@ and",
        "p=@|bold " + Templates.P_CONNECTED + "|@ (connected) or p=@|bold " + Templates.P_UNCONNECTED +
        "|@ (unconnected). Link weights are random integers in [0, 10].%n",
    })
class Templates implements Runnable {

  final static int NODES = 100;
  final static double P_CONNECTED = 0.24;
  final static double P_UNCONNECTED = 0.01;

  /** Maximum number of random graphs drawn per template. */
  final static int MAX_TRIES = 64;

  @Spec
  private CommandSpec spec;

  @Option(
      names = {"-d", "--dir"},
      paramLabel = "DIR",
      description = {
          "Output directory (created if it doesn't exist)",
          "Default: current directory",
      })
  File dir = new File(".");

  @Option(
      names = "--seed",
      paramLabel = "N",
      description = "Random seed (default: random)")
  Long seed;

  @Option(
      names = {"-f", "--format"},
      paramLabel = "FORMAT",
      split = ",",
      description = {
          "Output format[s]: ${COMPLETION-CANDIDATES}",
          "(json is the full-fidelity row dump, footnotes included)",
          "Default: XLSX,TEX",
      })
  List<Format> formats;

  @Option(
      names = "--settings",
      paramLabel = "FILE",
      description = "Card settings (properties) file")
  File settingsFile;


  @Override
  public void run() {
    if (dir.exists() && !dir.isDirectory())
      throw new ParameterException(spec.commandLine(), "not a directory: " + dir);
    if (!dir.exists() && !dir.mkdirs())
      throw new ParameterException(spec.commandLine(), "failed to create directory: " + dir);

    CardSettings settings;
    if (settingsFile == null)
      settings = CardSettings.DEFAULT;
    else {
      try {
        settings = new CardSettings(settingsFile);
      } catch (IllegalArgumentException iax) {
        throw new ParameterException(spec.commandLine(), iax.getMessage());
      }
    }

    var outputs = formats == null || formats.isEmpty() ?
        EnumSet.of(Format.XLSX, Format.TEX) : EnumSet.copyOf(formats);
    var random = seed == null ? new Random() : new Random(seed);
    var writer = new TemplateWriter(settings, outputs);

    for (boolean connected : new boolean[] { true, false }) {
      String suffix = connected ? "connected" : "unconnected";
      double p = connected ? P_CONNECTED : P_UNCONNECTED;

      var unweighted = gnp(
          () -> new SimpleGraph<Integer, DefaultEdge>(
              SupplierUtil.createIntegerSupplier(), SupplierUtil.DEFAULT_EDGE_SUPPLIER, false),
          p, connected, random);
      writer.write(unweighted, "undirected_unweighted_" + suffix, !connected);

      var weighted = gnp(
          () -> new SimpleWeightedGraph<Integer, DefaultWeightedEdge>(
              SupplierUtil.createIntegerSupplier(), SupplierUtil.DEFAULT_WEIGHTED_EDGE_SUPPLIER),
          p, connected, random);
      for (var edge : weighted.edgeSet())
        weighted.setEdgeWeight(edge, random.nextInt(11));
      writer.write(weighted, "undirected_weighted_" + suffix, !connected);
    }

    var directed = new DefaultDirectedGraph<Integer, DefaultEdge>(DefaultEdge.class);
    addSampleEdges(directed);
    writer.write(directed, "directed_unweighted", false);

    var directedWeighted =
        new DefaultDirectedWeightedGraph<Integer, DefaultWeightedEdge>(DefaultWeightedEdge.class);
    addSampleEdges(directedWeighted);
    for (var edge : directedWeighted.edgeSet())
      directedWeighted.setEdgeWeight(edge, random.nextInt(11));
    writer.write(directedWeighted, "directed_weighted", false);

    var out = spec.commandLine().getOut();
    for (var file : writer.written)
      out.println(file);
    out.flush();
  }


  /**
   * Draws G(n,p) graphs until one with the desired connectivity turns up.
   */
  private <E> Graph<Integer, E> gnp(
      Supplier<Graph<Integer, E>> factory, double p, boolean connected, Random random) {

    for (int tries = 1; tries <= MAX_TRIES; ++tries) {
      var generator = new GnpRandomGraphGenerator<Integer, E>(NODES, p, random, false);
      var graph = factory.get();
      generator.generateGraph(graph);
      if (GraphTests.isConnected(graph) == connected)
        return graph;
      System.getLogger(NetCards.LOG_NAME).log(
          Level.DEBUG,
          "G(" + NODES + "," + p + ") draw " + tries + " not " +
          (connected ? "connected" : "unconnected"));
    }
    throw new IllegalStateException(
        "failed to draw a" + (connected ? " connected" : "n unconnected") +
        " G(" + NODES + "," + p + ") graph in " + MAX_TRIES + " tries");
  }


  private static <E> void addSampleEdges(Graph<Integer, E> graph) {
    for (int v = 0; v < 4; ++v)
      graph.addVertex(v);
    graph.addEdge(0, 1);
    graph.addEdge(0, 2);
    graph.addEdge(2, 3);
    graph.addEdge(3, 2);
  }


  /**
   * Populates, blanks, and writes template cards.
   */
  private class TemplateWriter {

    final CardSettings settings;
    final StatisticsPopulator populator;
    final EnumSet<Format> formats;
    final List<File> written = new ArrayList<>();

    TemplateWriter(CardSettings settings, EnumSet<Format> formats) {
      this.settings = settings;
      this.populator = new StatisticsPopulator(settings);
      this.formats = formats;
    }

    <E> void write(Graph<Integer, E> graph, String name, boolean noDiameter) {
      var card = populator.newCard(new JGraphTStatistics<>("", graph));
      card.clear(settings.getBlank(), true);
      if (noDiameter)
        card.update(Panel.STRUCTURE, StatisticsPopulator.DIAMETER, Values.NOT_APPLICABLE);

      var table = CardTable.of(card);
      for (var format : formats) {
        var file = new File(dir, name + "." + format.ext);
        try {
          switch (format) {
          case XLSX:
            new XlsxRenderer(settings).write(table, file);
            break;
          case TEX:
            new TexRenderer(settings).write(table, file);
            break;
          case PDF:
            new PdfCardRenderer(settings).write(table, file);
            break;
          case JSON:
            CardRowsParser.INSTANCE.write(card, file);
            break;
          }
        } catch (IOException iox) {
          throw new UncheckedIOException("failed to write " + file + ": " + iox.getMessage(), iox);
        }
        written.add(file);
      }
    }
  }

}


@Command(
    name = "schema-doc",
    description = {
        "Prints the field descriptions of a network card JSON schema as a",
        "LaTeX description list.%n",
    })
class SchemaDoc implements Runnable {

  final static String RESOURCE = "network_card.schema.json";

  @Spec
  private CommandSpec spec;

  @Parameters(
      arity = "0..1",
      paramLabel = "FILE",
      description = "JSON schema file (default: the bundled schema)")
  File schemaFile;


  @Override
  public void run() {
    if (schemaFile != null && !schemaFile.isFile())
      throw new ParameterException(spec.commandLine(), "file not found: " + schemaFile);

    String doc;
    try {
      doc = toLatex(loadSchema());
    } catch (JsonParsingException jpx) {
      throw new ParameterException(spec.commandLine(), "bad schema: " + jpx.getMessage());
    }
    var out = spec.commandLine().getOut();
    out.print(doc);
    out.flush();
  }


  private Object loadSchema() throws JsonParsingException {
    if (schemaFile != null) {
      try (var reader = Files.newBufferedReader(schemaFile.toPath(), StandardCharsets.UTF_8)) {
        return JsonUtils.parse(reader);
      } catch (IOException iox) {
        throw new UncheckedIOException(iox);
      }
    }
    var in = NetworkCard.class.getResourceAsStream(RESOURCE);
    if (in == null)
      throw new IllegalStateException("missing resource " + RESOURCE);
    try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return JsonUtils.parse(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }


  /**
   * Returns the field descriptions in the given schema as a (nested) LaTeX
   * description list, one item per panel.
   */
  static String toLatex(Object schema) throws JsonParsingException {
    var properties = JsonUtils.getJsonObject(
        JsonUtils.asObject(schema, "schema"), "properties", true);
    var out = new StringBuilder();
    out.append("%from netcards schema-doc\n");
    out.append("\\begin{description}\n");
    for (var panel : Panel.values()) {
      var box = JsonUtils.getJsonObject(
          JsonUtils.getJsonObject(properties, panel.key(), true), "properties", true);
      out.append("\\item[").append(panel.title()).append("]\n");
      out.append("\\begin{description}\n");
      for (Map.Entry<String, Object> field : box.entrySet()) {
        var desc = JsonUtils.getString(
            JsonUtils.asObject(field.getValue(), "'" + field.getKey() + "'"), "description", false);
        out.append("\\item[").append(TexRenderer.escape(field.getKey())).append("] ");
        if (desc != null)
          out.append(TexRenderer.escape(desc));
        out.append('\n');
      }
      out.append("\\end{description}\n");
    }
    out.append("\\end{description}\n");
    return out.toString();
  }

}
