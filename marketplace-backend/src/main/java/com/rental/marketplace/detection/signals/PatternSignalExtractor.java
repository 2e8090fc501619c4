package com.rental.marketplace.detection.signals;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.detection.SignalExtractor;
import com.rental.marketplace.enums.SignalCategory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural spam tells over all text fields joined together: contact details, shouting,
 * punctuation runs, repetition and link shorteners.
 */
@Component
public class PatternSignalExtractor implements SignalExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION_RUN = Pattern.compile("[!?]{2,}");
    private static final Pattern URL = Pattern.compile("https?://[^\\s]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final List<WeightedPattern> patterns = new ArrayList<>();
    private final SpamDetectionProperties.Heuristics heuristics;

    public PatternSignalExtractor(SpamDetectionProperties properties) {
        for (SpamDetectionProperties.PatternRule rule : properties.getPatterns()) {
            patterns.add(new WeightedPattern(Pattern.compile(rule.getRegex()), rule.getWeight()));
        }
        this.heuristics = properties.getHeuristics();
    }

    @Override
    public SignalCategory category() {
        return SignalCategory.PATTERN;
    }

    @Override
    public double score(DetectionSubject subject) {
        String text = subject.textBlob();
        if (text.isEmpty()) {
            return 0.0;
        }

        double score = 0.0;
        for (WeightedPattern pattern : patterns) {
            if (pattern.regex.matcher(text).find()) {
                score += pattern.weight;
            }
        }

        if (hasExcessiveCapitalization(text)) score += heuristics.getCapsPenalty();
        if (hasExcessivePunctuation(text)) score += heuristics.getPunctuationPenalty();
        if (hasRepeatedWords(text)) score += heuristics.getRepeatedWordPenalty();
        if (hasSuspiciousUrl(text)) score += heuristics.getSuspiciousUrlPenalty();

        return SignalExtractor.clamp(score);
    }

    boolean hasExcessiveCapitalization(String text) {
        String[] words = WHITESPACE.split(text);
        int capsWords = 0;
        for (String word : words) {
            if (word.length() > 2 && word.equals(word.toUpperCase(Locale.ROOT))) {
                capsWords++;
            }
        }
        return (double) capsWords / words.length > heuristics.getCapsRatio();
    }

    boolean hasExcessivePunctuation(String text) {
        Matcher matcher = PUNCTUATION_RUN.matcher(text);
        int runs = 0;
        while (matcher.find()) {
            runs++;
        }
        return runs > heuristics.getPunctuationRuns();
    }

    boolean hasRepeatedWords(String text) {
        Map<String, Integer> counts = new HashMap<>();
        for (String word : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            if (word.length() > heuristics.getRepeatedWordMinLength()
                    && counts.merge(word, 1, Integer::sum) > heuristics.getRepeatedWordLimit()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A link whose host is a known shortener or a bare IPv4 address.
     */
    boolean hasSuspiciousUrl(String text) {
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            String host = hostOf(matcher.group());
            if (host == null) {
                continue;
            }
            if (IPV4.matcher(host).matches()) {
                return true;
            }
            for (String shortener : heuristics.getShortenerHosts()) {
                if (host.equals(shortener) || host.endsWith("." + shortener)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String hostOf(String url) {
        try {
            String host = new URI(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            // fall back to the text between the scheme and the first separator
            String rest = url.substring(url.indexOf("//") + 2);
            String host = rest.split("[/?#:]", 2)[0];
            return host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
        }
    }

    private static final class WeightedPattern {
        private final Pattern regex;
        private final double weight;

        private WeightedPattern(Pattern regex, double weight) {
            this.regex = regex;
            this.weight = weight;
        }
    }
}
