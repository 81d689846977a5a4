package com.paxkun.ezstremio.service.search;

import com.paxkun.ezstremio.service.LoggerService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RelevanceFilter narrows the accumulated search hits down to the ones worth opening.
 * <p>
 * The year check is the only strict rule: a title that names a year must name the
 * requested one. The name check is computed and logged but never rejects a hit, since
 * the site search already matched the query and localized titles often contain one
 * another ("Dobrá čarodějka" vs. "Čarodějka").
 */
@Component
@RequiredArgsConstructor
public class RelevanceFilter {

    // ASCII word boundaries: "2019ž" still holds the year 2019
    private static final Pattern YEAR_TOKEN = Pattern.compile("(?<![A-Za-z0-9_])(19|20)\\d{2}(?![A-Za-z0-9_])");
    private static final Pattern NUMERIC = Pattern.compile("\\d{1,9}");

    private final LoggerService logger;

    /**
     * Applies the year filter and the name check, then removes duplicate addresses.
     *
     * @return relevant candidates in first-seen order, one per address
     */
    public List<Candidate> filter(List<Candidate> candidates, TitleContext context) {
        List<Candidate> relevant = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (!matchesYear(candidate.title(), context.year())) {
                continue;
            }
            if (!matchesName(candidate.title(), context.searchNames())) {
                logger.debug("FILTER", "No name match, keeping anyway | title=" + sanitizeForLog(candidate.title()));
            }
            relevant.add(candidate);
        }
        return deduplicate(relevant);
    }

    /**
     * A title passes when the target year is unknown, when it carries no year at all,
     * or when one of its years equals the target exactly.
     */
    boolean matchesYear(String title, String year) {
        if (year == null || !NUMERIC.matcher(year).matches()) {
            return true;
        }
        int target = Integer.parseInt(year);
        if (target <= 0) {
            return true;
        }

        Matcher matcher = YEAR_TOKEN.matcher(title);
        boolean sawYear = false;
        while (matcher.find()) {
            sawYear = true;
            if (Integer.parseInt(matcher.group()) == target) {
                return true;
            }
        }
        return !sawYear;
    }

    boolean matchesName(String title, List<String> names) {
        String normalizedTitle = TitleNormalizer.normalizeForMatch(title);
        for (String name : names) {
            if (normalizedTitle.contains(TitleNormalizer.normalizeForMatch(name))) {
                return true;
            }
        }
        return false;
    }

    List<Candidate> deduplicate(List<Candidate> candidates) {
        Map<String, Candidate> unique = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            unique.putIfAbsent(candidate.address(), candidate);
        }
        return new ArrayList<>(unique.values());
    }

    private String sanitizeForLog(String value) {
        return value == null ? "" : value.replaceAll("[\\r\\n]", "").trim();
    }
}
