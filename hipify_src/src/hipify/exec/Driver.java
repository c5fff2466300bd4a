package hipify.exec;

import java.io.*;
import java.util.*;

import hipify.utils.PrintTools;
import hipify.utils.Tools;

/**
 * Implements the command line parser and the options shared by every
 * translation run. Derived classes implement {@link #runPasses} over the
 * files named on the command line and report an exit status.
 */
public abstract class Driver
{
  /** Name of the options file written by -dump-options. */
  public static final String OPTIONS_FILE = "options.hipify";

  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  /** The filenames supplied on the command line. */
  protected List<String> filenames;

  /**
   * Constructor used by derived classes. Registering resets every option
   * to its default value.
   */
  protected Driver()
  {
    registerOptions();
  }

  /**
   * Register default legal set of options and default values for Driver.
   * Only registered options can have values set.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "dump-options",
                "Create file " + OPTIONS_FILE + " with default options");
    options.add(options.UTILITY, "load-options",
                "Load options from file " + OPTIONS_FILE);
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)\n"
                + "      =1 every edit\n"
                + "      =2 duplicate proposals and skipped constructs\n"
                + "      =3 front-end decisions\n"
                + "      =4 every match, table misses included");
    options.add(options.UTILITY, "macro", "A=1,B,...",
                "Sets macros for the specified names with comma-separated list (no space is allowed)"
                + " in both compilation views. e.g., -macro=USE_TEX=1,NDEBUG");
    options.add(options.UTILITY, "names", "filename",
                "Layer the cudaName=hipName lines of the given file over the default rename table");
    options.add(options.ANALYSIS, "conflict-policy", "identical", "identical|overlap",
                "Which proposed edits collide with an already accepted edit\n"
                + "      =identical only edits on exactly the same span (default)\n"
                + "      =overlap any edit whose span intersects an accepted one");
    options.add(options.ANALYSIS, "print-replacements",
                "Print every accepted replacement to stdout before applying");
    options.add(options.TRANSFORM, "dry-run",
                "Report replacements without writing any file");
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

  /** Parses one line of an options file. */
  protected void parseOption(String opt)
  {
    opt = opt.trim();
    // empty line
    if (opt.length() < 2)
      return;
    int eq = opt.indexOf('=');

    if (eq == -1) {
      if (options.contains(opt))
        setOptionValue(opt, "1");
      else
        System.err.println("ignoring unrecognized option " + opt);
    }
    else {
      String option_name = opt.substring(0, eq);
      if (options.contains(option_name))
        setOptionValue(option_name, opt.substring(eq + 1));
      else
        System.err.println("ignoring unrecognized option " + option_name);
    }
  }

  /**
   * Parses command line options and collects the input files.
   *
   * @param args The String array passed to main by the system.
   */
  protected void parseCommandLine(String[] args)
  {
    /* print a useful message if there are no arguments */
    if (args.length == 0) {
      printUsage();
      Tools.exit(1);
    }

    int i; /* used after loop; don't put inside for loop */
    for (i = 0; i < args.length; ++i) {
      String opt = args[i];
      // options start with "-"
      if (opt.isEmpty() || opt.charAt(0) != '-')
        break;

      int eq = opt.indexOf('=');
      if (eq == -1) {
        String option_name = opt.substring(1);
        if (options.contains(option_name))
          // no value on the command line, so just set it to "1"
          setOptionValue(option_name, "1");
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }
      else {
        String option_name = opt.substring(1, eq);
        if (options.contains(option_name))
          setOptionValue(option_name, opt.substring(eq + 1));
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }

      if (getOptionValue("help") != null) {
        printUsage();
        Tools.exit(0);
      }

      if (getOptionValue("version") != null) {
        printVersion();
        Tools.exit(0);
      }

      if (getOptionValue("dump-options") != null) {
        setOptionValue("dump-options", null);
        dumpOptionsFile();
        Tools.exit(0);
      }

      // load options file and then proceed with rest
      // of command line options
      if (getOptionValue("load-options") != null) {
        setOptionValue("load-options", null);
        loadOptionsFile();
        // prevent reentering this handler
        setOptionValue("load-options", null);
      }
    }

    // end of arguments without a file name
    if (i >= args.length) {
      System.err.println("No input files!");
      Tools.exit(1);
    }

    // Wildcards are expanded here for environments that do not rely on
    // the shell's expansion.
    int num_file_args = args.length - i;
    filenames = new ArrayList<String>(num_file_args);
    for (int j = 0; j < num_file_args; ++j, ++i) {
      File arg = new File(args[i]);
      if (arg.getName().contains("*") || arg.getName().contains("?")) {
        File parent = arg.getAbsoluteFile().getParentFile();
        File[] matches = parent.listFiles(new RegexFilter(arg.getName()));
        if (matches == null)
          continue;
        Arrays.sort(matches);
        for (File file : matches)
          filenames.add(file.getPath());
      }
      else {
        filenames.add(args[i]);
      }
    }
    if (filenames.isEmpty()) {
      System.err.println("No input files!");
      Tools.exit(1);
    }
  }

  /**
   * Prints the list of options that hipify accepts.
   */
  public void printUsage()
  {
    String usage = "\n" + getClass().getName() + " [option]... [file]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Dumps the default options to the options file in the working
   * directory; an existing file is not overwritten.
   */
  public void dumpOptionsFile()
  {
    File optionsFile = getOptionsFile();
    try {
      if (optionsFile.createNewFile()) {
        PrintStream ps = new PrintStream(new FileOutputStream(optionsFile), false, "UTF-8");
        try {
          ps.println(options.dumpOptions().trim());
        } finally {
          ps.close();
        }
      }
      else {
        System.err.println("Not overwriting existing " + optionsFile);
      }
    } catch (IOException e) {
      System.err.println("Error: Failed to dump " + OPTIONS_FILE + ": " + e.getMessage());
    }
  }

  /**
   * Loads the options file, searching the working directory and then the
   * home directory.
   */
  public void loadOptionsFile()
  {
    File optionsFile = getOptionsFile();
    if (!optionsFile.exists())
      optionsFile = new File(System.getProperty("user.home"), OPTIONS_FILE);
    if (!optionsFile.exists()) {
      System.err.println("Error: Failed to load " + OPTIONS_FILE);
      System.err.println("Use option -dump-options to create " + OPTIONS_FILE
                       + " with default values");
      Tools.exit(1);
    }
    try {
      BufferedReader br = new BufferedReader(new FileReader(optionsFile));
      try {
        String line;
        while ((line = br.readLine()) != null) {
          // Remove comments
          if (line.startsWith("#"))
            continue;
          parseOption(line);
        }
      } finally {
        br.close();
      }
    } catch (IOException e) {
      System.err.println("Error while loading options file: " + e.getMessage());
      Tools.exit(1);
    }
  }

  /** The options file of the working directory. */
  protected File getOptionsFile()
  {
    return new File(System.getProperty("user.dir"), OPTIONS_FILE);
  }

  /**
   * Prints the tool version.
   */
  public abstract void printVersion();

  /**
   * Runs the translation over the files named on the command line.
   *
   * @return the process exit status.
   */
  public abstract int runPasses();

  /**
   * Runs this driver with args as the command line.
   *
   * @param args The command line from main.
   * @return the process exit status.
   */
  public int run(String[] args)
  {
    parseCommandLine(args);
    PrintTools.printlnStatus(2, "Input files:", filenames);
    return runPasses();
  }

  /**
   * Implementation of file filter for handling wild card character and other
   * special characters to generate regular expressions out of a string.
   */
  private static class RegexFilter implements FileFilter
  {
    /** Regular expression */
    private String regex;

    /** Constructs a new filter with the given input string
     * @param str String to construct regular expression out of
     * */
    public RegexFilter(String str)
    {
      regex = str.replaceAll("\\.", "\\\\.") // . => \.
          .replaceAll("\\?", ".")            // ? => .
          .replaceAll("\\*", ".*");          // * => .*
    }

    @Override
    public boolean accept(File f)
    {
      return f.isFile() && f.getName().matches(regex);
    }
  }
}
