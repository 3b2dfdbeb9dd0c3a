package com.layeredilp;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job: compile a layered graph into an LP program, or decode a
 * solver solution back into a layered graph. The artifact goes to the
 * given writer, diagnostics to the log and stderr.
 */
public final class IlpDriver {
    private static final Logger log = LoggerFactory.getLogger(IlpDriver.class);

    static final String PROGRAM = "layered-ilp";

    private final Writer out;
    private final Clock clock;

    public IlpDriver() {
        this(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), Clock.systemUTC());
    }

    public IlpDriver(Writer out, Clock clock) {
        this.out = out;
        this.clock = clock;
    }

    /** @return the process exit code */
    public int run(String[] args) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage();
            System.err.println("Argument error: " + e.getMessage());
            return 2;
        }

        final IlpConfig config = parsed.config;
        final String inputPath = parsed.inputPath;

        final Instant t0 = clock.instant();
        try {
            switch (config.mode) {
                case COMPILE: {
                    LayeredGraph g = LayeredGraph.readFromFile(inputPath);
                    log.info("graph {}: {} nodes, {} edges, {} layers",
                            g.getName(), g.getNodeCount(), g.getEdgeCount(), g.getLayerCount());
                    Program program = new ProgramAssembler(config).assemble(g);
                    log.info("{}", ProgramStats.of(program));
                    new LpWriter(clock).write(program, PROGRAM + " " + String.join(" ", args), g.getComments(), out);
                    break;
                }
                case DECODE: {
                    LayeredGraph g = SolutionDecoder.readFromFile(inputPath);
                    log.info("solution {}: {} nodes, {} edges", g.getName(), g.getNodeCount(), g.getEdgeCount());
                    g.write(new PrintWriter(out));
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown mode: " + config.mode);
            }
            log.info("elapsed time: {} seconds", Duration.between(t0, clock.instant()).toMillis() / 1000.0);
            return 0;
        } catch (FileNotFoundException e) {
            System.err.println("File not found: " + inputPath);
            return 1;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            System.err.println("*unrecoverable error: " + e.getMessage());
            log.debug("stack trace", e);
            return 1;
        }
    }

    static void usage() {
        System.err.println(
                "Usage: " + PROGRAM + " -objective <name> [options] <graph.sgf>\n" +
                        "       " + PROGRAM + " -decode <solution.sol>\n" +
                        "Objectives:\n" +
                        "  total          total number of crossings\n" +
                        "  bottleneck     largest number of crossings on one edge\n" +
                        "  stretch        total stretch (positions spread over [0,1])\n" +
                        "  bn_stretch     largest stretch of one edge\n" +
                        "  quad_stretch   sum of squared stretch\n" +
                        "  vertical       total non-verticality (sum of squared offsets)\n" +
                        "  bn_vertical    largest offset of one edge\n" +
                        "  quad_vertical  sum of squared offsets, quadratic form\n" +
                        "Ceilings:\n" +
                        "  -total N  -bottleneck N  -stretch X  -bn_stretch X  -vertical N  -bn_vertical N\n" +
                        "Options:\n" +
                        "  -seed N        permute constraints and terms with this seed\n" +
                        "  -bipartite N   log dense bipartite subgraphs of up to N nodes per layer (vertical only)\n"
        );
    }
}
