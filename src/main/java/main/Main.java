package main;

import java.util.ArrayList;
import java.util.List;

import cache.TheoryCache;
import kb.PatientRecord;
import service.FactChecker;
import utils.Log;
import utils.ResultExporter;

import init.Config;


public class Main {

    private static final String USAGE =
            "usage: Main [--parallel] [--facts] [--axioms] STATEMENT...\n"
          + "  e.g. Main --facts \"(fp< 50.0 (heart-rate 12815))\"";

    public static void init() {
        Config.load();
        Log.initLogLevel();
    }

    public static int run(String[] args) {
        boolean parallel = false;
        boolean showFacts = false;
        boolean showAxioms = false;
        List<String> statements = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--parallel":
                    parallel = true;
                    break;
                case "--facts":
                    showFacts = true;
                    break;
                case "--axioms":
                    showAxioms = true;
                    break;
                case "-h":
                case "--help":
                    System.out.println(USAGE);
                    return 0;
                default:
                    if (arg.startsWith("--")) {
                        System.err.println("Unknown option " + arg);
                        System.err.println(USAGE);
                        return 2;
                    }
                    statements.add(arg);
            }
        }
        if (statements.isEmpty() && !showFacts && !showAxioms) {
            System.err.println(USAGE);
            return 2;
        }

        FactChecker factChecker = new FactChecker(new PatientRecord(), parallel);
        TheoryCache theory = factChecker.getTheory();
        if (showFacts) {
            System.out.println("[-] Facts:");
            for (String sentence : theory.getFactSentences()) {
                System.out.println("    " + sentence);
            }
        }
        if (showAxioms) {
            System.out.println("[-] Axioms:");
            for (String axiom : theory.getAxioms()) {
                System.out.println(axiom);
                System.out.println();
            }
        }

        ResultExporter resultExporter = Config.resultPath.isEmpty() ? null : new ResultExporter(Config.resultPath);
        try {
            for (String statement : statements) {
                FactChecker.Evaluation evaluation = factChecker.evaluate(statement);
                System.out.println("[-] " + evaluation.getOutcome() + "  " + evaluation.getStatement());
                if (evaluation.getResult() != null) {
                    System.out.println("    original " + evaluation.getResult().getOriginal()
                            + ", negated " + evaluation.getResult().getNegated()
                            + ", " + evaluation.getResult().getTime() + "ms");
                    if (resultExporter != null) {
                        resultExporter.writeResult(evaluation.getResult());
                    }
                } else if (evaluation.getMessage() != null) {
                    System.out.println("    " + evaluation.getMessage());
                }
            }
        } finally {
            if (resultExporter != null) {
                resultExporter.close();
            }
        }
        Log.debug(theory.getCacheStats());
        return 0;
    }

    public static void main(String[] args) {
        init();
        long startTime = System.currentTimeMillis();
        int code = run(args);
        Log.printTime("[-] Time cost", startTime);
        if (code != 0) {
            System.exit(code);
        }
    }

}
