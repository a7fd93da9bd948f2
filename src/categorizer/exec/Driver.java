package categorizer.exec;

import categorizer.build.CursorPolicy;
import categorizer.build.LineSink;
import categorizer.build.ProductCategorizer;
import categorizer.tree.PrintTools;
import categorizer.tree.TraversalOrder;
import categorizer.tree.Tools;

import java.io.*;

/**
 * Implements the command line parser and runs the categorizer.
 * The single non-option argument names the category file; the
 * pre-order and post-order listings are written into the output
 * directory.
 */
public class Driver
{
  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  /** The input file supplied on the command line. */
  protected String filename;

  /** The categorizer that holds the tree once the input has been read. */
  protected ProductCategorizer categorizer;

  public Driver()
  {
    registerOptions();
  }

  /**
   * Register default legal set of options and default values for Driver.
   * Registering an option again puts it back to its default value.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.CONSTRUCTION, "cursor", "reference", "reference|reset",
        "Select how each line is placed into the tree\n"
        + "      =reference the cursor carries over between lines and stays on\n"
        + "                 the parent after a child is created (default)\n"
        + "      =reset     every line is a path from the root");
    options.add(options.OUTPUT, "outdir", ".", "dirname",
                "Set the output directory name (default is the working directory)");
    options.add(options.OUTPUT, "pre-file", ProductCategorizer.PRE_FILE, "filename",
                "Name of the pre-order listing (default is " + ProductCategorizer.PRE_FILE + ")");
    options.add(options.OUTPUT, "post-file", ProductCategorizer.POST_FILE, "filename",
                "Name of the post-order listing (default is " + ProductCategorizer.POST_FILE + ")");
    options.add(options.OUTPUT, "print-stdout",
                "Also print both listings to standard output");
  }

  /**
   * Returns the value of the given key or null
   * if the value is not set.  Key values are
   * set on the command line as <b>-option_name=value</b>.
   *
   * @param key The key to search
   * @return the value of the given key or null if the
   *   value is not set.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Sets the value of the option represented by <i>key</i> to
   * <i>value</i>.
   *
   * @param key The option name.
   * @param value The option value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  /**
   * Parses command line options.
   *
   * @param args The String array passed to main by the system.
   */
  protected void parseCommandLine(String[] args)
  {
    /* print a useful message if there are no arguments */
    if (args.length == 0)
    {
      printUsage();
      Tools.exit(1);
    }

    int i; /* used after loop; don't put inside for loop */
    for (i = 0; i < args.length; ++i)
    {
      String opt = args[i];
      // options start with "-"
      if (opt.length() < 2 || opt.charAt(0) != '-')
        /* not an option -- skip to handling the file name */
        break;

      int eq = opt.indexOf('=');

      // if value is not set
      if (eq == -1)
      {
        String option_name = opt.substring(1);

        if (options.contains(option_name))
          // no value on the command line, so just set it to "1"
          setOptionValue(option_name, "1");
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }
      // if value is set
      else
      {
        String option_name = opt.substring(1, eq);

        if (options.contains(option_name))
          setOptionValue(option_name, opt.substring(eq + 1));
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }

      if (getOptionValue("help") != null)
      {
        printUsage();
        Tools.exit(0);
      }

      if (getOptionValue("version") != null)
      {
        printVersion();
        Tools.exit(0);
      }

    }

    // end of arguments without a file name
    if (i >= args.length)
    {
      System.err.println("No input file!");
      Tools.exit(1);
    }
    if (i < args.length - 1)
    {
      System.err.println("Only one input file is accepted, got " + (args.length - i));
      Tools.exit(1);
    }
    filename = args[i];
  }

  /**
   * Prints the list of options that the driver accepts.
   */
  public void printUsage()
  {
    String usage = "\ncategorizer.exec.Driver [option]... file\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Prints the version.
   */
  public void printVersion()
  {
    System.err.println("Categorizer 1.0 - Category path tree builder");
  }

  /**
   * Runs this driver with args as the command line.
   *
   * @param args The command line from main.
   */
  public void run(String[] args)
  {
    parseCommandLine(args);

    try {
      PrintTools.setVerbosity(Integer.parseInt(getOptionValue("verbosity")));
    } catch (NumberFormatException e) {
      System.err.println("invalid verbosity " + getOptionValue("verbosity"));
      Tools.exit(1);
    }

    try {
      categorizer = new ProductCategorizer(
          CursorPolicy.fromName(getOptionValue("cursor")));
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      Tools.exit(1);
    }

    try {
      categorizer.fillTree(new File(filename));
    } catch (IOException e) {
      System.err.println("could not read input file " + filename + ": " + e);
      Tools.exit(1);
    }

    File outdir = new File(getOptionValue("outdir"));
    if (!outdir.isDirectory() && !outdir.mkdirs())
    {
      System.err.println("could not create output directory " + outdir);
      Tools.exit(1);
    }

    try {
      categorizer.printTree(new File(outdir, getOptionValue("pre-file")),
                            new File(outdir, getOptionValue("post-file")));
      if (getOptionValue("print-stdout") != null)
      {
        LineSink stdout = new LineSink() {
          public void write(String line)
          {
            System.out.print(line);
          }
        };
        for (TraversalOrder order : TraversalOrder.values())
        {
          System.out.println("*** " + order + " ***");
          categorizer.print(order, stdout);
        }
        System.out.flush();
      }
    } catch (IOException e) {
      System.err.println("could not write output files: " + e);
      Tools.exit(1);
    }
  }

  /** Returns the categorizer of the last run, or null before a run. */
  public ProductCategorizer getCategorizer()
  {
    return categorizer;
  }

  /**
   * Entry point; creates a new Driver object,
   * and calls run on it with args.
   *
   * @param args Command line options.
   */
  public static void main(String[] args)
  {
    (new Driver()).run(args);
  }
}
