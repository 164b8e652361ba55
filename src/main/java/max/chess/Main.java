package max.chess;

import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.explain.ComplexityLevel;
import max.chess.tactics.explain.ExplanationComposer;
import max.chess.tactics.explain.ExplanationFormatter;
import max.chess.tactics.explain.MoveExplanation;

import java.util.Arrays;
import java.util.List;

public class Main {
    public static void main(String[] args) {
        if (args.length < 3) {
            System.err.println("Usage: Main <fen> <move> <evaluation> [pv line ...]");
            System.err.println("  e.g. Main \"8/3q4/6k1/8/8/5N2/8/4K3 w - - 0 1\" f3e5 +4.20 \"f3e5+ g6f5 e5d7\"");
            System.exit(1);
        }

        AnalysisConfig.Builder config = new AnalysisConfig.Builder();
        String overriddenDebug = System.getProperty("tactics.debug");
        if (overriddenDebug != null) {
            config.debug(Boolean.parseBoolean(overriddenDebug));
        }
        String overriddenSee = System.getProperty("tactics.see");
        if (overriddenSee != null) {
            config.showSeeValues(Boolean.parseBoolean(overriddenSee));
        }
        String overriddenLevel = System.getProperty("tactics.level");
        if (overriddenLevel != null) {
            config.complexity(ComplexityLevel.valueOf(overriddenLevel.toUpperCase()));
        }
        AnalysisConfig analysisConfig = config.build();

        List<String> pvLines = Arrays.asList(args).subList(3, args.length);
        MoveExplanation explanation = new ExplanationComposer(analysisConfig).explain(args[0], args[1], args[2], pvLines);

        System.out.println(args[1] + ": " + ExplanationFormatter.adjust(explanation.text(), analysisConfig.complexity));
        explanation.sacrifice().description().ifPresent(text -> System.out.println("  sacrifice: " + text));
        explanation.exchangeValue().ifPresent(see -> System.out.println("  SEE: " + see));
        explanation.defenses().forEach(defense -> System.out.println("  defense: " + defense.description()));
        explanation.threats().forEach(threat -> System.out.println("  threat: " + threat.description()));
        if (analysisConfig.debug) {
            explanation.errors().forEach(error -> System.err.println("  error: " + error));
        }
    }
}
