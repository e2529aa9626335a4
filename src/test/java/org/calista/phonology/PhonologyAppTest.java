package org.calista.phonology;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.phonology.feature.impl.TableFeatureProvider;
import org.calista.phonology.session.GrammarSession;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PhonologyAppTest {

    private static String run(String script) throws IOException {
        GrammarSession session = new GrammarSession(TableFeatureProvider.defaultTable(new ObjectMapper()));
        PhonologyApp app = new PhonologyApp(session);

        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8)) {
            app.runLoop(new StringReader(script), out);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testConsoleSession() throws IOException {
        String out = run(String.join("\n",
                "learn s",
                "learn p",
                "grammar",
                "valid t",
                "check tps",
                "inventory",
                "exit"));

        assertTrue(out.contains("Labial attracts=[Consonantal, Anterior] rejects=[]"), out);
        assertTrue(out.contains("t: valid"), out);
        assertTrue(out.contains("tps: valid"), out);
        assertTrue(out.contains("Bye."), out);
    }

    @Test
    void testConsoleReportsUnknownSegmentsAndKeepsRunning() throws IOException {
        String out = run(String.join("\n", "learn Q", "frobnicate", "reset", "grammar"));

        assertTrue(out.contains("error: Unknown segment: 'Q'"), out);
        assertTrue(out.contains("unknown command: frobnicate"), out);
        assertTrue(out.contains("grammar cleared"), out);
        assertTrue(out.contains("Bye."), "EOF ends the loop like exit");
    }
}
