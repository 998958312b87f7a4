package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure ('_' marks a fillable cell)")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("output", true, "filename of PNG image of the solution")
                .addOption("order", true, "variable order: mrv (default) or first")
                .addOption("values", true, "value order: lcv (default) or domain")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader file(CommandLine cmd, String option) throws IOException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return Files.newBufferedReader(Paths.get(cmd.getOptionValue(option)), StandardCharsets.UTF_8);
    }

    private static BacktrackingSearch.VariableOrder variableOrder(CommandLine cmd) {
        String o = cmd.getOptionValue("order", "mrv");
        switch (o) {
            case "mrv": return BacktrackingSearch.VariableOrder.MRV;
            case "first": return BacktrackingSearch.VariableOrder.FIRST;
            default: throw new IllegalArgumentException("unknown variable order: " + o);
        }
    }

    private static BacktrackingSearch.ValueOrder valueOrder(CommandLine cmd) {
        String o = cmd.getOptionValue("values", "lcv");
        switch (o) {
            case "lcv": return BacktrackingSearch.ValueOrder.LEAST_CONSTRAINING;
            case "domain": return BacktrackingSearch.ValueOrder.DOMAIN;
            default: throw new IllegalArgumentException("unknown value order: " + o);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    static void run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword;
        try (Reader structure = file(cmd, "structure"); Reader words = file(cmd, "words")) {
            crossword = Crossword.parseFrom(structure, words);
        }
        Optional<ImmutableMap<Variable, String>> assignment = new CrosswordSolver(crossword)
                .setVariableOrder(variableOrder(cmd))
                .setValueOrder(valueOrder(cmd))
                .setLogInterval(logInterval(cmd))
                .solve();
        if (!assignment.isPresent()) {
            out.println("No solution.");
            return;
        }
        out.print(TextRenderer.render(crossword, assignment.get()));
        if (cmd.hasOption("output")) {
            ImageRenderer.save(crossword, assignment.get(), Paths.get(cmd.getOptionValue("output")));
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(args, System.out);
    }
}
