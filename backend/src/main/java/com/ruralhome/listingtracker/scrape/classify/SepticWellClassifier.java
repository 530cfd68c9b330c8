package com.ruralhome.listingtracker.scrape.classify;

import com.ruralhome.listingtracker.scrape.model.Candidate;
import com.ruralhome.listingtracker.scrape.model.ClassificationResult;
import com.ruralhome.listingtracker.scrape.model.DetailEntry;
import com.ruralhome.listingtracker.scrape.model.EnrichedRecord;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects septic systems and private wells in listing text.
 * <p>
 * Detail lines are checked first, in order, with the first matching pattern per attribute recorded as
 * {@code "<category>: <line>"}. The description is checked afterwards with stricter phrases and every matching
 * pattern is recorded as {@code "description: <matched text>"}. A bare "well" never counts, so street and
 * town names such as Howell stay negative.
 */
@Component
public class SepticWellClassifier {
    private static final List<Pattern> DETAIL_SEPTIC = compile(
        "\\bseptic\\b",
        "\\bsewer:\\s*septic\\b"
    );
    private static final List<Pattern> DETAIL_WELL = compile(
        "\\bprivate\\s+well\\b",
        "\\bwater:\\s*well\\b",
        "\\bwell\\s+water\\b",
        "\\bdrilled\\s+well\\b"
    );
    private static final List<Pattern> DESCRIPTION_SEPTIC = compile(
        "\\bseptic\\s*system\\b",
        "\\bseptic\\s*tank\\b",
        "\\bprivate\\s+septic\\b"
    );
    private static final List<Pattern> DESCRIPTION_WELL = compile(
        "\\bprivate\\s+well\\b",
        "\\bwell\\s+water\\b",
        "\\bwater\\s+well\\b",
        "\\bdrilled\\s+well\\b"
    );

    public ClassificationResult classify(EnrichedRecord record) {
        if (record == null) {
            return ClassificationResult.none();
        }
        List<String> septic = new ArrayList<>();
        List<String> well = new ArrayList<>();

        for (DetailEntry entry : record.details()) {
            String category = categoryLabel(entry.category());
            for (String line : entry.texts()) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                String text = line.trim();
                String lower = text.toLowerCase(Locale.ROOT);
                if (matchesAny(DETAIL_SEPTIC, lower)) {
                    septic.add(category + ": " + text);
                }
                if (matchesAny(DETAIL_WELL, lower)) {
                    well.add(category + ": " + text);
                }
            }
        }

        String description = cleanDescription(record.description());
        if (!description.isEmpty()) {
            collectDescriptionMentions(DESCRIPTION_SEPTIC, description, septic);
            collectDescriptionMentions(DESCRIPTION_WELL, description, well);
        }
        return new ClassificationResult(septic, well);
    }

    /**
     * Search results carry no free text, so a bare candidate is always negative.
     */
    public ClassificationResult classify(Candidate candidate) {
        return ClassificationResult.none();
    }

    private void collectDescriptionMentions(List<Pattern> patterns, String description, List<String> out) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(description);
            if (matcher.find()) {
                out.add("description: " + matcher.group());
            }
        }
    }

    private boolean matchesAny(List<Pattern> patterns, String lower) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }

    private String categoryLabel(String category) {
        if (category == null || category.isBlank()) {
            return "detail";
        }
        return category.trim().toLowerCase(Locale.ROOT);
    }

    static String cleanDescription(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        String text = Jsoup.parse(description).text();
        return text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private static List<Pattern> compile(String... expressions) {
        List<Pattern> patterns = new ArrayList<>();
        for (String expression : expressions) {
            patterns.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }
}
