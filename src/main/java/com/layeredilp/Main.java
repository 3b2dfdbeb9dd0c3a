package com.layeredilp;

public class Main {

    public static void main(String[] args) {
        int code = new IlpDriver().run(args);
        if (code != 0) System.exit(code);
    }
}
