package com.example.jmxscenario;

import ch.qos.logback.classic.Level;
import com.example.jmxscenario.exception.ConversionException;
import com.example.jmxscenario.exception.JmxParseException;
import com.example.jmxscenario.exception.OutputException;
import com.example.jmxscenario.model.CaptureConfig;
import com.example.jmxscenario.model.ConversionOutcome;
import com.example.jmxscenario.model.ConverterOptions;
import com.example.jmxscenario.model.ParsedScenario;
import com.example.jmxscenario.model.ScenarioStep;
import com.example.jmxscenario.service.ConversionService;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line launcher: {@code jmx-scenario <input.jmx> [-o pt_scenario.yaml] [-v]}.
 * Exit codes: 0 success, 1 parse error, 2 conversion error, 3 output error.
 */
public class App {
  public static final int OK = 0;
  public static final int PARSE_ERROR = 1;
  public static final int CONVERSION_ERROR = 2;
  public static final int OUTPUT_ERROR = 3;

  private static final String USAGE = "jmx-scenario <input.jmx> [options]";

  private final PrintStream out;
  private final PrintStream err;

  public App(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new App(System.out, System.err).run(args));
  }

  static Options createOptions() {
    Options options = new Options();
    options.addOption(Option.builder("o").longOpt("output").hasArg().argName("file")
        .desc("Output YAML file (default " + ConverterOptions.DEFAULT_OUTPUT + ")").build());
    options.addOption(Option.builder("v").longOpt("verbose").desc("Verbose output").build());
    options.addOption(Option.builder().longOpt("openapi").hasArg().argName("file-or-url")
        .desc("OpenAPI document used to resolve operationId endpoints (env JMX_OPENAPI)").build());
    options.addOption(Option.builder().longOpt("while-max").hasArg().argName("n")
        .desc("Safety maximum for while loops (default 100, env JMX_WHILE_MAX)").build());
    options.addOption(Option.builder().longOpt("while-interval").hasArg().argName("ms")
        .desc("Poll interval for while loops (env JMX_WHILE_INTERVAL_MS)").build());
    options.addOption(Option.builder("h").longOpt("help").desc("Show this help").build());
    return options;
  }

  public int run(String[] args) {
    Options options = createOptions();
    CommandLine cmd;
    ConverterOptions converterOptions;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(options, args);
      if (cmd.hasOption("h")) {
        printHelp(options, out);
        return OK;
      }
      if (cmd.getArgList().size() != 1) {
        err.println("Error: exactly one input JMX file is required");
        printHelp(options, err);
        return PARSE_ERROR;
      }
      converterOptions = toConverterOptions(cmd);
    } catch (ParseException | IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      printHelp(options, err);
      return PARSE_ERROR;
    }

    boolean verbose = cmd.hasOption("v");
    if (verbose) enableDebugLogging();
    Path input = Paths.get(cmd.getArgList().get(0));
    Path output = Paths.get(cmd.getOptionValue("o", ConverterOptions.DEFAULT_OUTPUT));

    try {
      ConversionService service = ConversionService.standalone();
      if (verbose) out.println("Parsing JMX file: " + input);
      Document document = service.parse(input);
      if (verbose) out.println("Building scenario...");
      ConversionOutcome outcome = service.convert(document, converterOptions);
      if (verbose) out.println("Writing YAML file: " + output);
      service.write(outcome, output);
      printSummary(outcome, output);
      return OK;
    } catch (JmxParseException e) {
      err.println("Parse error: " + e.getMessage());
      return PARSE_ERROR;
    } catch (ConversionException e) {
      err.println("Conversion error: " + e.getMessage());
      return CONVERSION_ERROR;
    } catch (OutputException e) {
      err.println("Output error: " + e.getMessage());
      return OUTPUT_ERROR;
    } catch (RuntimeException e) {
      err.println("Unexpected error: " + e);
      if (verbose) e.printStackTrace(err);
      return CONVERSION_ERROR;
    }
  }

  // command line first, then environment
  static ConverterOptions toConverterOptions(CommandLine cmd) {
    ConverterOptions o = ConverterOptions.fromEnvironment();
    if (cmd.hasOption("while-max")) o.setWhileMaxIterations(Integer.parseInt(cmd.getOptionValue("while-max").trim()));
    if (cmd.hasOption("while-interval")) o.setWhileIntervalMs(Integer.parseInt(cmd.getOptionValue("while-interval").trim()));
    if (cmd.hasOption("openapi")) o.setOpenApiLocation(cmd.getOptionValue("openapi"));
    return o;
  }

  private void printSummary(ConversionOutcome outcome, Path output) {
    ParsedScenario s = outcome.scenario;
    int captures = 0;
    int assertions = 0;
    for (ScenarioStep step : s.steps) {
      captures += step.capture.size();
      if (step.assertions != null) assertions++;
    }
    out.println("Scenario: " + s.name);
    out.println("Base URL: " + (s.settings.baseUrl == null ? "(none)" : s.settings.baseUrl));
    out.println("Variables: " + s.variables.size());
    out.println("Steps: " + s.steps.size());
    out.println("Captures: " + captures);
    out.println("Steps with assertions: " + assertions);
    if (!outcome.warnings.isEmpty()) {
      out.println("Warnings (" + outcome.warnings.size() + "):");
      for (String w : outcome.warnings) {
        out.println("  - " + w);
      }
    }
    for (ScenarioStep step : s.steps) {
      if (!step.enabled) out.println("Note: step '" + step.name + "' is disabled");
      for (CaptureConfig c : step.capture) {
        if (c instanceof CaptureConfig.Simple) {
          out.println("Note: capture '" + c.describe() + "' in '" + step.name + "' relies on path inference");
        }
      }
    }
    out.println("Output: " + output.toAbsolutePath());
    out.println("Conversion complete!");
  }

  private static void printHelp(Options options, PrintStream stream) {
    PrintWriter pw = new PrintWriter(stream);
    new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options,
        HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
    pw.flush();
  }

  private static void enableDebugLogging() {
    org.slf4j.Logger logger = LoggerFactory.getLogger("com.example.jmxscenario");
    if (logger instanceof ch.qos.logback.classic.Logger) {
      ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
    }
  }
}
