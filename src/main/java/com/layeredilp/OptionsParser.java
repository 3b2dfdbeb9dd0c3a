package com.layeredilp;

import java.math.BigDecimal;

public final class OptionsParser {

    public static final class Parsed {
        public final IlpConfig config;
        public final String inputPath;
        private Parsed(IlpConfig c, String p){ config=c; inputPath=p; }
    }

    private OptionsParser() {}

    public static Parsed parse(String[] args){
        IlpConfig.Builder b = new IlpConfig.Builder();
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-decode": b.mode(IlpConfig.Mode.DECODE); break;      // solution -> sgf
                case "-objective": b.objective(ObjectiveKind.fromLabel(value(args, ++i, a))); break;
                case "-total": b.total(Long.parseLong(value(args, ++i, a))); break;
                case "-bottleneck": b.bottleneck(Long.parseLong(value(args, ++i, a))); break;
                case "-stretch": b.stretch(new BigDecimal(value(args, ++i, a))); break;
                case "-bn_stretch": b.bnStretch(new BigDecimal(value(args, ++i, a))); break;
                case "-vertical": b.vertical(Long.parseLong(value(args, ++i, a))); break;
                case "-bn_vertical": b.bnVertical(Long.parseLong(value(args, ++i, a))); break;
                case "-seed": b.seed(Long.parseLong(value(args, ++i, a))); break;
                case "-bipartite": b.bipartite(Integer.parseInt(value(args, ++i, a))); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), input);
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }
}
