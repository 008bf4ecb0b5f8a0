package org.codelibs.taste.cli;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.codelibs.taste.TasteConstants;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TasteCommandTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream out;

    private ByteArrayOutputStream err;

    private TasteCommand command;

    private File ratingsFile;

    private File itemsFile;

    @Before
    public void setup() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        command = new TasteCommand(new PrintStream(out, true, "UTF-8"),
                new PrintStream(err, true, "UTF-8"));

        // items 1 and 2 are rated alike by 4 users, item 3 only by 2
        final StringBuilder ratings = new StringBuilder();
        for (int user = 1; user <= 4; user++) {
            ratings.append(user).append("\t1\t5\t881250949\n");
            ratings.append(user).append("\t2\t4\t881250950\n");
        }
        ratings.append("1\t3\t5\t881250951\n");
        ratings.append("2\t3\t1\t881250952\n");
        ratings.append("3\t3\t4\t881250953\n");
        ratingsFile = folder.newFile("u.data");
        Files.write(ratingsFile.toPath(),
                ratings.toString().getBytes(StandardCharsets.UTF_8));

        itemsFile = folder.newFile("u.item");
        Files.write(itemsFile.toPath(), ("1|Toy Story (1995)|01-Jan-1995\n"
                + "2|GoldenEye (1995)|01-Jan-1995\n"
                + "3|Four Rooms (1995)|01-Jan-1995\n")
                .getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    public void test_run() throws IOException {
        final int status = command.run(new String[] { "--ratings",
                ratingsFile.getPath(), "--items", itemsFile.getPath(),
                "--item", "1", "--score-threshold", "0.5", "--min-support",
                "1", "--top", "5" });
        assertEquals(err(), 0, status);

        final String result = out();
        assertTrue(result, result.startsWith(
                "Top 5 recommendations for Toy Story (1995) based on Cosine Similarity score of ratings:"));
        assertTrue(result, result.contains(
                "4 viewers also watched:\nGoldenEye (1995)\nSimilarity Score: 1.0\n"));
        assertTrue(result, result.contains(
                "2 viewers also watched:\nFour Rooms (1995)\n"));
        assertTrue(result, result.contains(
                "based on the number of shared viewers:"));
    }

    @Test
    public void test_runWithDefaults() throws IOException {
        final int status = command.run(new String[] { "-r",
                ratingsFile.getPath(), "-n", itemsFile.getPath(), "-i", "1" });
        assertEquals(err(), 0, status);
        assertTrue(out(), !out().contains("viewers also watched"));
    }

    @Test
    public void test_missingItem() throws IOException {
        final int status = command.run(new String[] { "--ratings",
                ratingsFile.getPath(), "--items", itemsFile.getPath() });
        assertEquals(1, status);
        assertEquals("Movie ID not provided!\n"
                + "Please enter a valid movie ID and run the script again.\n",
                out().replace(System.lineSeparator(), "\n"));
    }

    @Test
    public void test_invalidItem() throws IOException {
        assertEquals(1, command.run(new String[] { "--ratings",
                ratingsFile.getPath(), "--items", itemsFile.getPath(),
                "--item", "star-wars" }));
        assertTrue(err(), err().contains("Invalid movie ID"));
    }

    @Test
    public void test_missingFiles() throws IOException {
        assertEquals(1, command.run(new String[] { "--item", "1" }));
        assertTrue(err(), err().contains("usage:"));
    }

    @Test
    public void test_unknownOption() throws IOException {
        assertEquals(1, command.run(new String[] { "--item", "1", "--foo" }));
    }

    @Test
    public void test_help() throws IOException {
        assertEquals(0, command.run(new String[] { "--help" }));
        assertTrue(out(), out().contains("--ratings"));
    }

    @Test
    public void test_missingRatingsFile() throws IOException {
        assertEquals(1, command.run(new String[] { "--ratings",
                new File(folder.getRoot(), "missing").getPath(), "--items",
                itemsFile.getPath(), "--item", "1" }));
    }

    @Test
    public void test_malformedRatings() throws IOException {
        Files.write(ratingsFile.toPath(),
                "1\t1\t5\nbroken line\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, command.run(new String[] { "--ratings",
                ratingsFile.getPath(), "--items", itemsFile.getPath(),
                "--item", "1" }));
    }

    @Test
    public void test_createSettings() throws IOException, ParseException {
        final File config = folder.newFile("taste.properties");
        Files.write(config.toPath(), ("min_support=5\n"
                + "num_of_threads=2\n" + "score_threshold=0.8\n")
                .getBytes(StandardCharsets.UTF_8));
        final CommandLine cmd = new DefaultParser().parse(
                TasteCommand.createOptions(), new String[] { "--config",
                        config.getPath(), "--min-support", "9", "--grouping",
                        "contiguous" });
        final Map<String, Object> settings = command.createSettings(cmd);
        assertEquals("9", settings.get(TasteConstants.MIN_SUPPORT));
        assertEquals("2", settings.get(TasteConstants.NUM_OF_THREADS));
        assertEquals("0.8", settings.get(TasteConstants.SCORE_THRESHOLD));
        assertEquals("contiguous", settings.get(TasteConstants.GROUPING));
    }

    private String out() throws IOException {
        return out.toString("UTF-8");
    }

    private String err() throws IOException {
        return err.toString("UTF-8");
    }
}
