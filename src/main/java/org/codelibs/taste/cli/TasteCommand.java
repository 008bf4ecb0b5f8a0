package org.codelibs.taste.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.codelibs.taste.ItemSimilarityEngine;
import org.codelibs.taste.SimilarityConfig;
import org.codelibs.taste.TasteConstants;
import org.codelibs.taste.exception.TasteException;
import org.codelibs.taste.io.FileItemCatalogReader;
import org.codelibs.taste.io.FileRatingReader;
import org.codelibs.taste.model.ItemCatalog;
import org.codelibs.taste.recommender.QueryConfig;
import org.codelibs.taste.recommender.Recommendations;
import org.codelibs.taste.writer.ResultFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the items most similar to a given item from a MovieLens style ratings file and prints them.
 */
public class TasteCommand {

    private static final Logger logger = LoggerFactory
            .getLogger(TasteCommand.class);

    private static final String COMMAND_NAME = "taste-item-similarity";

    static final String RATINGS = "ratings";

    static final String ITEMS = "items";

    static final String ITEM = "item";

    static final String CONFIG = "config";

    static final String HELP = "help";

    private final PrintStream out;

    private final PrintStream err;

    public TasteCommand(final PrintStream out, final PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(final String[] args) {
        final int status = new TasteCommand(System.out, System.err).run(args);
        System.exit(status);
    }

    static Options createOptions() {
        final Options options = new Options();
        options.addOption(Option.builder("r").longOpt(RATINGS).hasArg()
                .argName("path").desc("ratings file (user, item, rating, timestamp)")
                .build());
        options.addOption(Option.builder("n").longOpt(ITEMS).hasArg()
                .argName("path").desc("item names file (id|name|...)").build());
        options.addOption(Option.builder("i").longOpt(ITEM).hasArg()
                .argName("id").desc("target item ID").build());
        options.addOption(Option.builder("c").longOpt(CONFIG).hasArg()
                .argName("path").desc("settings in a properties file").build());
        options.addOption(Option.builder().longOpt("min-rating").hasArg()
                .argName("value").desc("lowest rating kept (default 3)")
                .build());
        options.addOption(Option.builder().longOpt("score-threshold")
                .hasArg().argName("value")
                .desc("score a pair must exceed (default 0.97)").build());
        options.addOption(Option.builder().longOpt("min-support").hasArg()
                .argName("count")
                .desc("shared users a pair must exceed (default 50)").build());
        options.addOption(Option.builder().longOpt("top").hasArg()
                .argName("count").desc("number of results (default 10)")
                .build());
        options.addOption(Option.builder().longOpt("threads").hasArg()
                .argName("count").desc("aggregation threads (default 1)")
                .build());
        options.addOption(Option.builder().longOpt("grouping").hasArg()
                .argName("mode").desc("full or contiguous (default full)")
                .build());
        options.addOption(Option.builder("h").longOpt(HELP)
                .desc("print this message").build());
        return options;
    }

    public int run(final String[] args) {
        final Options options = createOptions();
        final CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (final ParseException e) {
            err.println(e.getMessage());
            printUsage(options, err);
            return 1;
        }

        if (cmd.hasOption(HELP)) {
            printUsage(options, out);
            return 0;
        }

        if (!cmd.hasOption(ITEM)) {
            out.println("Movie ID not provided!");
            out.println("Please enter a valid movie ID and run the script again.");
            return 1;
        }
        final int targetItemID;
        try {
            targetItemID = Integer.parseInt(cmd.getOptionValue(ITEM).trim());
        } catch (final NumberFormatException e) {
            err.println("Invalid movie ID: " + cmd.getOptionValue(ITEM));
            return 1;
        }
        if (!cmd.hasOption(RATINGS) || !cmd.hasOption(ITEMS)) {
            err.println("Both --" + RATINGS + " and --" + ITEMS
                    + " are required.");
            printUsage(options, err);
            return 1;
        }

        try {
            final Map<String, Object> settings = createSettings(cmd);
            final SimilarityConfig similarityConfig = SimilarityConfig
                    .create(settings);
            final QueryConfig queryConfig = QueryConfig.create(settings);

            final ItemCatalog catalog = FileItemCatalogReader.read(Paths
                    .get(cmd.getOptionValue(ITEMS)));

            final ItemSimilarityEngine engine = new ItemSimilarityEngine(
                    similarityConfig);
            try (FileRatingReader reader = new FileRatingReader(Paths.get(cmd
                    .getOptionValue(RATINGS)))) {
                engine.compute(reader.read());
            }

            final Recommendations recommendations = engine.recommend(
                    targetItemID, queryConfig);
            new ResultFormatter(catalog).write(recommendations,
                    queryConfig.getTopN(), out);
            out.flush();
            return 0;
        } catch (final TasteException e) {
            logger.error("Failed to compute item similarities.", e);
            err.println(e.getMessage());
            return 1;
        } catch (final IOException e) {
            logger.error("Failed to read input.", e);
            err.println(e.getMessage());
            return 1;
        }
    }

    /**
     * Settings of the properties file given by --config, overridden by command-line options.
     */
    Map<String, Object> createSettings(final CommandLine cmd)
            throws IOException {
        final Map<String, Object> settings = new HashMap<String, Object>();
        if (cmd.hasOption(CONFIG)) {
            final Path path = Paths.get(cmd.getOptionValue(CONFIG));
            final Properties properties = new Properties();
            try (Reader reader = Files.newBufferedReader(path,
                    StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            for (final String name : properties.stringPropertyNames()) {
                settings.put(name, properties.getProperty(name));
            }
            logger.info("Loaded {} settings from {}", settings.size(), path);
        }
        putOption(cmd, "min-rating", TasteConstants.MIN_RATING, settings);
        putOption(cmd, "score-threshold", TasteConstants.SCORE_THRESHOLD,
                settings);
        putOption(cmd, "min-support", TasteConstants.MIN_SUPPORT, settings);
        putOption(cmd, "top", TasteConstants.NUM_OF_ITEMS, settings);
        putOption(cmd, "threads", TasteConstants.NUM_OF_THREADS, settings);
        putOption(cmd, "grouping", TasteConstants.GROUPING, settings);
        return settings;
    }

    private static void putOption(final CommandLine cmd, final String option,
            final String key, final Map<String, Object> settings) {
        if (cmd.hasOption(option)) {
            settings.put(key, cmd.getOptionValue(option));
        }
    }

    private static void printUsage(final Options options,
            final PrintStream stream) {
        final PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH,
                COMMAND_NAME, null, options, HelpFormatter.DEFAULT_LEFT_PAD,
                HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

}
