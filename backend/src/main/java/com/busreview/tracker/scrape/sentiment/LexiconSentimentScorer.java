package com.busreview.tracker.scrape.sentiment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LexiconSentimentScorer extends ThresholdSentimentScorer {
    private static final Logger log = LoggerFactory.getLogger(LexiconSentimentScorer.class);
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}']+|!");
    private static final Set<String> NEGATIONS = Set.of(
        "not", "no", "never", "none", "nothing", "neither", "nor", "without", "hardly", "barely"
    );
    private static final Map<String, Double> INTENSIFIERS = Map.of(
        "very", 0.293,
        "really", 0.293,
        "extremely", 0.293,
        "so", 0.293,
        "too", 0.293,
        "highly", 0.293,
        "slightly", -0.293,
        "somewhat", -0.293,
        "bit", -0.293
    );
    private static final double NEGATION_SCALAR = -0.74;
    private static final double EXCLAMATION_BOOST = 0.292;
    private static final int MAX_EXCLAMATIONS = 4;
    private static final double NORMALIZATION_ALPHA = 15.0;
    private static final int NEGATION_WINDOW = 3;

    private final Map<String, Double> lexicon;

    public LexiconSentimentScorer(Map<String, Double> lexicon, SentimentThresholds thresholds) {
        super(thresholds);
        this.lexicon = Map.copyOf(lexicon);
    }

    public static LexiconSentimentScorer fromClasspath(String resource, SentimentThresholds thresholds) {
        String path = resource == null || resource.isBlank() ? "sentiment-lexicon.tsv" : resource.trim();
        ClassLoader loader = LexiconSentimentScorer.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Sentiment lexicon not found on classpath: " + path);
            }
            Map<String, Double> lexicon = readLexicon(in);
            log.info("Loaded sentiment lexicon {} with {} entries", path, lexicon.size());
            return new LexiconSentimentScorer(lexicon, thresholds);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sentiment lexicon " + path, e);
        }
    }

    static Map<String, Double> readLexicon(InputStream in) throws IOException {
        Map<String, Double> lexicon = new HashMap<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split("\t");
            if (parts.length < 2) {
                log.warn("Skipping lexicon line {}: expected word<TAB>valence", lineNumber);
                continue;
            }
            try {
                lexicon.put(parts[0].trim().toLowerCase(Locale.ROOT), Double.parseDouble(parts[1].trim()));
            } catch (NumberFormatException e) {
                log.warn("Skipping lexicon line {}: invalid valence '{}'", lineNumber, parts[1]);
            }
        }
        return lexicon;
    }

    @Override
    protected double polarity(String text) {
        List<String> tokens = tokenize(text);
        double sum = 0.0;
        int exclamations = 0;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if ("!".equals(token)) {
                exclamations++;
                continue;
            }
            Double valence = lexicon.get(token);
            if (valence == null) {
                continue;
            }
            double adjusted = valence;
            for (int back = 1; back <= NEGATION_WINDOW && i - back >= 0; back++) {
                String previous = tokens.get(i - back);
                Double boost = INTENSIFIERS.get(previous);
                if (boost != null && back == 1) {
                    adjusted += Math.signum(adjusted) * boost;
                }
                if (isNegation(previous)) {
                    adjusted *= NEGATION_SCALAR;
                    break;
                }
            }
            sum += adjusted;
        }
        if (sum != 0.0 && exclamations > 0) {
            sum += Math.signum(sum) * Math.min(exclamations, MAX_EXCLAMATIONS) * EXCLAMATION_BOOST;
        }
        if (sum == 0.0) {
            return 0.0;
        }
        return sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
    }

    private boolean isNegation(String token) {
        return NEGATIONS.contains(token) || token.endsWith("n't");
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
