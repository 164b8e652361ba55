package max.chess.tactics.config;

import max.chess.tactics.explain.ComplexityLevel;

public final class AnalysisConfig {

    public static final AnalysisConfig DEFAULT = new Builder().build();

    public final boolean debug;

    // Composer
    public final int maxReasons;               // reasons surfaced per move (default 2)
    public final double winningAdvantage;      // pawns, fallback "maintains winning advantage"
    public final double balancedBand;          // pawns, fallback "maintains balance"
    public final double mateScorePawns;        // mate scores count as +/- this many pawns
    public final boolean showSeeValues;        // append "(SEE +n)" to capture wording

    // Detectors
    public final int valuableTargetValue;      // fork/double attack targets must be worth at least this
    public final int relativePinMinGain;       // behind - pinner gain needed for a defended relative pin
    public final int perpetualMinPlies;
    public final double perpetualCheckRatio;
    public final int perpetualScanPlies;
    public final int smotheredMinBlockers;
    public final int proximityRadius;          // hanging/trapped pieces must be this close to the move
    public final double singularGap;           // pawns between best and second best line

    // Sacrifice / brilliancy
    public final double decisiveAdvantage;     // no brilliancy when already this far ahead
    public final double badPosition;           // no brilliancy when this far behind after the move
    public final int sacrificeMaterial;        // material given up to call it a sacrifice
    public final double compensationThreshold; // eval still favouring the mover
    public final double exchangeSacrificeFloor;

    // Move quality
    public final int blunderCp;
    public final int mistakeCp;
    public final int inaccuracyCp;
    public final int excellentCp;
    public final int bookCp;
    public final int aggressiveness;           // 0..100, scales the cp thresholds
    public final double blunderDrop;
    public final double mistakeDrop;
    public final double inaccuracyDrop;
    public final double improvingDelta;

    // Presentation
    public final ComplexityLevel complexity;

    // Resources
    public final int poolMaxSize;

    private AnalysisConfig(Builder b) {
        debug = b.debug;

        maxReasons = b.maxReasons;
        winningAdvantage = b.winningAdvantage;
        balancedBand = b.balancedBand;
        mateScorePawns = b.mateScorePawns;
        showSeeValues = b.showSeeValues;

        valuableTargetValue = b.valuableTargetValue;
        relativePinMinGain = b.relativePinMinGain;
        perpetualMinPlies = b.perpetualMinPlies;
        perpetualCheckRatio = b.perpetualCheckRatio;
        perpetualScanPlies = b.perpetualScanPlies;
        smotheredMinBlockers = b.smotheredMinBlockers;
        proximityRadius = b.proximityRadius;
        singularGap = b.singularGap;

        decisiveAdvantage = b.decisiveAdvantage;
        badPosition = b.badPosition;
        sacrificeMaterial = b.sacrificeMaterial;
        compensationThreshold = b.compensationThreshold;
        exchangeSacrificeFloor = b.exchangeSacrificeFloor;

        blunderCp = b.blunderCp;
        mistakeCp = b.mistakeCp;
        inaccuracyCp = b.inaccuracyCp;
        excellentCp = b.excellentCp;
        bookCp = b.bookCp;
        aggressiveness = b.aggressiveness;
        blunderDrop = b.blunderDrop;
        mistakeDrop = b.mistakeDrop;
        inaccuracyDrop = b.inaccuracyDrop;
        improvingDelta = b.improvingDelta;

        complexity = b.complexity;
        poolMaxSize = b.poolMaxSize;
    }

    public static class Builder {
        private boolean debug = false;

        private int maxReasons = 2;
        private double winningAdvantage = 3.0, balancedBand = 0.3, mateScorePawns = 100.0;
        private boolean showSeeValues = false;

        private int valuableTargetValue = 3;
        private int relativePinMinGain = 4;
        private int perpetualMinPlies = 8;
        private double perpetualCheckRatio = 0.6;
        private int perpetualScanPlies = 12;
        private int smotheredMinBlockers = 6;
        private int proximityRadius = 2;
        private double singularGap = 1.5;

        private double decisiveAdvantage = 2.0;
        private double badPosition = 0.70;
        private int sacrificeMaterial = 2;
        private double compensationThreshold = 0.5;
        private double exchangeSacrificeFloor = -0.5;

        private int blunderCp = 300, mistakeCp = 100, inaccuracyCp = 30, excellentCp = 10, bookCp = 30;
        private int aggressiveness = 50;
        private double blunderDrop = 3.0, mistakeDrop = 1.5, inaccuracyDrop = 0.75;
        private double improvingDelta = 0.3;

        private ComplexityLevel complexity = ComplexityLevel.INTERMEDIATE;
        private int poolMaxSize = 50;

        public Builder debug(boolean v){debug=v;return this;}

        public Builder maxReasons(int v){maxReasons=v;return this;}
        public Builder winningAdvantage(double v){winningAdvantage=v;return this;}
        public Builder balancedBand(double v){balancedBand=v;return this;}
        public Builder mateScorePawns(double v){mateScorePawns=v;return this;}
        public Builder showSeeValues(boolean v){showSeeValues=v;return this;}

        public Builder valuableTargetValue(int v){valuableTargetValue=v;return this;}
        public Builder relativePinMinGain(int v){relativePinMinGain=v;return this;}
        public Builder perpetualMinPlies(int v){perpetualMinPlies=v;return this;}
        public Builder perpetualCheckRatio(double v){perpetualCheckRatio=v;return this;}
        public Builder perpetualScanPlies(int v){perpetualScanPlies=v;return this;}
        public Builder smotheredMinBlockers(int v){smotheredMinBlockers=v;return this;}
        public Builder proximityRadius(int v){proximityRadius=v;return this;}
        public Builder singularGap(double v){singularGap=v;return this;}

        public Builder decisiveAdvantage(double v){decisiveAdvantage=v;return this;}
        public Builder badPosition(double v){badPosition=v;return this;}
        public Builder sacrificeMaterial(int v){sacrificeMaterial=v;return this;}
        public Builder compensationThreshold(double v){compensationThreshold=v;return this;}
        public Builder exchangeSacrificeFloor(double v){exchangeSacrificeFloor=v;return this;}

        public Builder blunderCp(int v){blunderCp=v;return this;}
        public Builder mistakeCp(int v){mistakeCp=v;return this;}
        public Builder inaccuracyCp(int v){inaccuracyCp=v;return this;}
        public Builder excellentCp(int v){excellentCp=v;return this;}
        public Builder bookCp(int v){bookCp=v;return this;}
        public Builder aggressiveness(int v){aggressiveness=v;return this;}
        public Builder blunderDrop(double v){blunderDrop=v;return this;}
        public Builder mistakeDrop(double v){mistakeDrop=v;return this;}
        public Builder inaccuracyDrop(double v){inaccuracyDrop=v;return this;}
        public Builder improvingDelta(double v){improvingDelta=v;return this;}

        public Builder complexity(ComplexityLevel v){complexity=v;return this;}
        public Builder poolMaxSize(int v){poolMaxSize=v;return this;}
        public AnalysisConfig build(){return new AnalysisConfig(this);}
    }
}
