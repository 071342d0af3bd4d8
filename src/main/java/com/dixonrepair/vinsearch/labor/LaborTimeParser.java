package com.dixonrepair.vinsearch.labor;

import com.dixonrepair.vinsearch.config.ValidationProperties;
import com.dixonrepair.vinsearch.model.LaborFigure;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a labor time figure from result text.
 *
 * <p>Formats are tried most-specific first so that "1 hr 30 min" is not read
 * as "30 min" and "1-2 hours" is not read as "2 hours". Single figures in
 * minutes or hours share one rule, so the first one in the text wins. Figures
 * outside the configured minute range are ignored.
 */
@Component
@RequiredArgsConstructor
public class LaborTimeParser {

    private static final String NUM = "(\\d+(?:\\.\\d+)?)";
    private static final String DASH = "\\s*(?:-|–|—|to)\\s*";
    private static final String MINUTES = "\\s*(?:minutes|minute|mins|min)\\b";
    private static final String HOURS = "\\s*(?:hours|hour|hrs|hr)\\b";

    private final ValidationProperties props;

    private final List<FormatRule> rules = List.of(
            new FormatRule(Pattern.compile(NUM + DASH + NUM + MINUTES, Pattern.CASE_INSENSITIVE),
                    m -> LaborFigure.range(num(m, 1), num(m, 2))),
            new FormatRule(Pattern.compile(NUM + DASH + NUM + HOURS, Pattern.CASE_INSENSITIVE),
                    m -> LaborFigure.range(num(m, 1) * 60, num(m, 2) * 60)),
            new FormatRule(Pattern.compile("(\\d+)" + HOURS + "\\s*(?:and\\s*)?(\\d+)" + MINUTES, Pattern.CASE_INSENSITIVE),
                    m -> LaborFigure.of(num(m, 1) * 60 + num(m, 2))),
            new FormatRule(Pattern.compile(NUM + "\\s*(minutes|minute|mins|min|hours|hour|hrs|hr)\\b", Pattern.CASE_INSENSITIVE),
                    m -> LaborFigure.of(m.group(2).toLowerCase(Locale.ROOT).startsWith("h") ? num(m, 1) * 60 : num(m, 1))));

    public Optional<LaborFigure> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (FormatRule rule : rules) {
            Matcher matcher = rule.pattern.matcher(text);
            while (matcher.find()) {
                LaborFigure figure = rule.converter.apply(matcher);
                if (inRange(figure)) {
                    return Optional.of(figure);
                }
            }
        }
        return Optional.empty();
    }

    private boolean inRange(LaborFigure figure) {
        return figure.getLowMinutes() >= props.getMinLaborMinutes()
                && figure.getHighMinutes() <= props.getMaxLaborMinutes();
    }

    private static double num(Matcher m, int group) {
        return Double.parseDouble(m.group(group));
    }

    private static final class FormatRule {
        private final Pattern pattern;
        private final Function<Matcher, LaborFigure> converter;

        private FormatRule(Pattern pattern, Function<Matcher, LaborFigure> converter) {
            this.pattern = pattern;
            this.converter = converter;
        }
    }
}
