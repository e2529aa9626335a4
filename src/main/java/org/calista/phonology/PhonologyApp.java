package org.calista.phonology;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.phonology.core.PhonologyKernel;
import org.calista.phonology.exceptions.UnknownSegmentException;
import org.calista.phonology.grammar.GrammarRow;
import org.calista.phonology.inventory.InventoryEntry;
import org.calista.phonology.inventory.SegmentCheck;
import org.calista.phonology.inventory.WordCheck;
import org.calista.phonology.learn.LearningTrace;
import org.calista.phonology.session.GrammarSession;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * PhonologyApp: interactive console runner over one grammar session.
 *
 * Lifecycle:
 *  1) build kernel (config + feature table)
 *  2) open a session
 *  3) run command loop until "exit" / EOF
 */
public final class PhonologyApp {

    private static final Logger log = LogManager.getLogger(PhonologyApp.class);

    private static final String HELP = String.join(System.lineSeparator(),
            "learn <segment>    learn one segment",
            "word <word>        learn every segment of a word",
            "valid <segment>    check one segment against the grammar",
            "check <word>       check every segment of a word",
            "inventory [all]    predicted inventory (all = include diacritic variants)",
            "grammar            current grammar table",
            "reset              forget everything",
            "exit");

    private final Path cfgPath;
    private PhonologyKernel kernel;
    private GrammarSession session;

    public static void main(String[] args) throws Exception {
        Path cfg = args.length > 0 ? Path.of(args[0]) : Path.of("config/phonology.json");
        PhonologyApp app = new PhonologyApp(cfg);
        app.start();
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            app.runLoop(in, System.out);
        }
    }

    public PhonologyApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    /** For embedding/tests: run over an existing session. */
    PhonologyApp(GrammarSession session) {
        this.cfgPath = null;
        this.session = session;
    }

    public void start() throws IOException {
        kernel = PhonologyKernel.builder()
                .configRoot(Path.of("."))
                .build(cfgPath);
        session = kernel.newSession();
        log.info("Phonology grammar started. session={}", session.id());
    }

    public void runLoop(Reader input, PrintStream out) throws IOException {
        BufferedReader in = (input instanceof BufferedReader b) ? b : new BufferedReader(input);
        out.println("Type 'help' for commands, 'exit' to quit.");

        while (true) {
            out.print("> ");
            String line = in.readLine();
            if (line == null) break;

            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.equalsIgnoreCase("exit")) break;

            try {
                execute(line, out);
            } catch (UnknownSegmentException e) {
                out.println("error: " + e.getMessage());
                log.debug("Command failed: {}", line, e);
            }
        }
        out.println("Bye.");
    }

    void execute(String line, PrintStream out) {
        int sp = line.indexOf(' ');
        String cmd = (sp < 0 ? line : line.substring(0, sp)).toLowerCase(Locale.ROOT);
        String arg = sp < 0 ? "" : line.substring(sp + 1).trim();

        switch (cmd) {
            case "learn" -> out.println(session.learnSegment(arg));
            case "word" -> {
                List<LearningTrace> traces = session.learnWord(arg);
                for (LearningTrace t : traces) out.println(t);
            }
            case "valid" -> out.println(arg + ": " + (session.validSegment(arg) ? "valid" : "invalid"));
            case "check" -> {
                WordCheck wc = session.checkWord(arg);
                out.println(arg + ": " + (wc.valid ? "valid" : "invalid"));
                for (SegmentCheck c : wc.details) out.println("  " + c);
            }
            case "inventory" -> {
                boolean basicOnly = arg.isEmpty() ? basicOnlyDefault() : !"all".equalsIgnoreCase(arg);
                for (InventoryEntry e : session.predictedInventory(basicOnly)) out.println("  " + e);
            }
            case "grammar" -> {
                for (GrammarRow r : session.grammarTable()) out.println("  " + r);
            }
            case "reset" -> {
                session.reset();
                out.println("grammar cleared");
            }
            case "help" -> out.println(HELP);
            default -> out.println("unknown command: " + cmd + " (try 'help')");
        }
    }

    private boolean basicOnlyDefault() {
        return kernel == null || kernel.config().inventory.basicOnlyDefault;
    }

}
