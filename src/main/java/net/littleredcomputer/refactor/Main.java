package net.littleredcomputer.refactor;

import com.google.common.base.Stopwatch;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.MetamathReader;
import net.littleredcomputer.metamath.MetamathWriter;
import net.littleredcomputer.metamath.VerificationException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("task", true, "refactor (default), verify or steps")
                .addOption("database", true, "Metamath database to read, - for standard input")
                .addOption("output", true, "where to write the refactored database, - for standard output")
                .addOption("ranking", true, "candidate ranking file; without one, candidates come from structural search")
                .addOption("prefix", true, "label prefix of new theorems")
                .addOption("minsize", true, "fewest steps in a candidate, hypothesis steps included")
                .addOption("maxsize", true, "most citation steps in a candidate from structural search")
                .addOption("maxcandidates", true, "most candidates considered per proof")
                .addOption("maxfragment", true, "most citation steps replaced by one citation of a new theorem")
                .addOption("threads", true, "worker threads")
                .addOption("theorem", true, "theorem whose proof steps to list")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static String database(CommandLine cmd) throws IOException {
        if (!cmd.hasOption("database")) throw new IllegalArgumentException("Must specify -database");
        String d = cmd.getOptionValue("database");
        if (d.equals("-")) {
            try (Reader r = new InputStreamReader(System.in, StandardCharsets.UTF_8)) {
                return CharStreams.toString(r);
            }
        }
        return Files.asCharSource(new File(d), StandardCharsets.UTF_8).read();
    }

    private static RefactorSettings settings(CommandLine cmd) {
        RefactorSettings s = new RefactorSettings();
        if (cmd.hasOption("prefix")) s.setLabelPrefix(cmd.getOptionValue("prefix"));
        if (cmd.hasOption("minsize")) s.setMinSize(Integer.parseInt(cmd.getOptionValue("minsize")));
        if (cmd.hasOption("maxsize")) s.setMaxSize(Integer.parseInt(cmd.getOptionValue("maxsize")));
        if (cmd.hasOption("maxcandidates")) s.setMaxCandidatesPerProof(Integer.parseInt(cmd.getOptionValue("maxcandidates")));
        if (cmd.hasOption("maxfragment")) s.setMaxFragmentSize(Integer.parseInt(cmd.getOptionValue("maxfragment")));
        if (cmd.hasOption("threads")) s.setThreads(Integer.parseInt(cmd.getOptionValue("threads")));
        s.setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")));
        return s;
    }

    private static CandidateOracle oracle(CommandLine cmd, RefactorSettings s) throws IOException {
        if (!cmd.hasOption("ranking")) return new StructuralSearch(s.minSize(), s.maxSize());
        try (Reader r = Files.asCharSource(new File(cmd.getOptionValue("ranking")), StandardCharsets.UTF_8).openBufferedStream()) {
            return RankingFile.parseFrom(r);
        }
    }

    private static void steps(Database db, String label) throws VerificationException {
        Assertion t = db.get(label);
        ProofGraph g = ProofGraph.of(db, t);
        for (int i = 0; i < g.size(); ++i) {
            System.out.printf("%d %s %s <- %s\n", i, g.step(i), g.result(i), Arrays.toString(g.inputs(g.resolve(i))));
        }
    }

    public static void main(String[] args) throws ParseException, IOException, VerificationException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        String task = cmd.getOptionValue("task", "refactor");
        Stopwatch sw = Stopwatch.createStarted();
        switch (task) {
            case "verify": {
                MetamathReader.Result r = MetamathReader.parseFrom(database(cmd));
                System.out.printf("verified %d theorems in %s\n", r.database().theorems().count(), sw);
                break;
            }
            case "steps": {
                if (!cmd.hasOption("theorem")) throw new IllegalArgumentException("Must specify -theorem");
                steps(MetamathReader.parseFrom(database(cmd)).database(), cmd.getOptionValue("theorem"));
                break;
            }
            case "refactor": {
                if (!cmd.hasOption("output")) throw new IllegalArgumentException("Must specify -output");
                RefactorSettings s = settings(cmd);
                MetamathReader.Result r = MetamathReader.parseFrom(database(cmd));
                RunReport report = new Pipeline(s).run(r.database(), oracle(cmd, s));
                String out = new MetamathWriter(r.database(), r.sourceMap()).write(report.accepted(), report.rewritten());
                String o = cmd.getOptionValue("output");
                if (o.equals("-")) {
                    System.out.print(out);
                } else {
                    Files.asCharSink(new File(o), StandardCharsets.UTF_8).write(out);
                }
                System.err.println(report);
                System.err.println(report.acceptedList());
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown task: " + task);
        }
    }
}
