package com.layeredilp;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

public class IlpDriverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2021-01-02T03:04:05Z"), ZoneOffset.UTC);

    private static Path write(String suffix, String content) throws IOException {
        Path temp = Files.createTempFile("driver", suffix);
        Files.writeString(temp, content);
        return temp;
    }

    @Test
    public void compilesGraph() throws IOException {
        Path sgf = write(".sgf", "c two edges\nt pair\nn 0 0\nn 1 0\nn 2 1\nn 3 1\ne 0 3\ne 1 2\n");
        StringWriter out = new StringWriter();
        int code = new IlpDriver(out, CLOCK).run(new String[]{"-objective", "total", sgf.toString()});
        assertEquals(0, code);
        String lp = out.toString();
        assertTrue(lp.startsWith("\\ layered-ilp -objective total " + sgf + "\n\\ 2021/01/02 03:04:05\n\\ two edges\nMin\n"));
        assertTrue(lp.endsWith("End\n"));
        Files.deleteIfExists(sgf);
    }

    @Test
    public void decodesSolution() throws IOException {
        Path sol = write(".sol", "InputFile pair.lp\nObjective 0\nBeginSolution\n"
                + "p_0_0 1\np_1_0 0\np_2_1 0\np_3_1 1\nc_0_3_0_3 0\nc_1_2_1_2 0\nEndSolution\n");
        StringWriter out = new StringWriter();
        assertEquals(0, new IlpDriver(out, CLOCK).run(new String[]{"-decode", sol.toString()}));
        assertEquals(String.join("\n",
                "c Objective 0",
                "t pair 4 2 2",
                "n 1 0 0",
                "n 0 0 1",
                "n 2 1 0",
                "n 3 1 1",
                "e 0 3",
                "e 1 2",
                ""), out.toString().replace(System.lineSeparator(), "\n"));
        Files.deleteIfExists(sol);
    }

    @Test
    public void argumentErrorsExitWithTwo() {
        StringWriter out = new StringWriter();
        IlpDriver d = new IlpDriver(out, CLOCK);
        assertEquals(2, d.run(new String[]{}));
        assertEquals(2, d.run(new String[]{"-objective", "stretch", "-vertical", "2", "g.sgf"}));
        assertEquals(2, d.run(new String[]{"-objective", "total", "-unknown", "g.sgf"}));
        assertEquals("", out.toString());
    }

    @Test
    public void inputErrorsExitWithOneAndWriteNothing() throws IOException {
        StringWriter out = new StringWriter();
        IlpDriver d = new IlpDriver(out, CLOCK);
        assertEquals(1, d.run(new String[]{"-objective", "total", "/nonexistent/graph.sgf"}));

        Path sameLayer = write(".sgf", "n 0 0\nn 1 0\ne 0 1\n");
        assertEquals(1, d.run(new String[]{"-objective", "total", sameLayer.toString()}));

        Path badRecord = write(".sgf", "n 0 0\nq 1\n");
        assertEquals(1, d.run(new String[]{"-objective", "total", badRecord.toString()}));

        Path truncated = write(".sol", "BeginSolution\np_0_0 0\n");
        assertEquals(1, d.run(new String[]{"-decode", truncated.toString()}));

        assertEquals("", out.toString());
        Files.deleteIfExists(sameLayer);
        Files.deleteIfExists(badRecord);
        Files.deleteIfExists(truncated);
    }
}
