package com.paxkun.ezstremio.service.stream;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * StreamRanker composes the display text of each stream and orders the streams by
 * inferred quality.
 * <p>
 * Keys, all descending and strictly lexicographic: resolution of the uploaded original,
 * resolution of the encoded stream, file size, whether the description names the
 * requested year. Equal keys keep the input order.
 */
@Component
public class StreamRanker {

    static final String SITE_LABEL = "Prehraj.to";
    static final String MARKER = "⚡";

    private static final Pattern SOURCE_4K = Pattern.compile("Source:\\s*4K");
    private static final Pattern SOURCE_1080 = Pattern.compile("Source:\\s*1080p");
    private static final Pattern SOURCE_RAW = Pattern.compile("Source:.*x\\s*(\\d+)");
    private static final Pattern STREAM_RESOLUTION = Pattern.compile(MARKER + "\\s+(\\d{3,4})p");
    private static final Pattern SIZE = Pattern.compile("^\\s*(\\d+(?:[.,]\\d+)?)\\s*(GB|MB|kB)");

    private static final Comparator<Scored> ORDER = Comparator
            .comparingInt(Scored::sourceHeight)
            .thenComparingInt(Scored::streamHeight)
            .thenComparingDouble(Scored::sizeMegabytes)
            .thenComparingInt(scored -> scored.mentionsYear() ? 1 : 0)
            .reversed();

    /**
     * @param streams streams already merged with their search hit, in merge order
     * @param year    requested release year, may be empty
     */
    public List<RankedResult> rank(List<StreamDescriptor> streams, String year) {
        String targetYear = year == null ? "" : year;
        List<Scored> scored = new ArrayList<>();
        for (StreamDescriptor stream : streams) {
            RankedResult result = compose(stream);
            scored.add(new Scored(
                    result,
                    sourceHeight(result.description()),
                    streamHeight(result.name()),
                    sizeMegabytes(stream.originSize()),
                    result.description().contains(targetYear)));
        }

        // List.sort is stable
        scored.sort(ORDER);

        List<RankedResult> ranked = new ArrayList<>(scored.size());
        for (Scored entry : scored) {
            ranked.add(entry.result());
        }
        return ranked;
    }

    RankedResult compose(StreamDescriptor stream) {
        String name = SITE_LABEL + " " + MARKER + " " + stream.label();
        String description = "📂 " + stream.originTitle()
                + "\n💾 " + stream.originSize() + " • ⏱️ " + stream.originDuration();
        if (!stream.sourceResolutionHint().isEmpty()) {
            description += "\n⚙️ Source: " + displayResolution(stream.sourceResolutionHint());
        }
        return new RankedResult(name, description, stream.address());
    }

    /** "3840 x 2160 px" reads as "4K", "1920 x 1080 px" as "1080p"; anything else is shown as is. */
    static String displayResolution(String hint) {
        if (hint.contains("3840") || hint.contains("2160")) {
            return "4K";
        }
        if (hint.contains("1920") || hint.contains("1080")) {
            return "1080p";
        }
        return hint;
    }

    static int sourceHeight(String description) {
        if (SOURCE_4K.matcher(description).find()) {
            return 2160;
        }
        if (SOURCE_1080.matcher(description).find()) {
            return 1080;
        }
        Matcher raw = SOURCE_RAW.matcher(description);
        return raw.find() ? parseOrZero(raw.group(1)) : 0;
    }

    static int streamHeight(String name) {
        Matcher matcher = STREAM_RESOLUTION.matcher(name);
        return matcher.find() ? parseOrZero(matcher.group(1)) : 0;
    }

    /** Reads the leading number of the size field; "1,5 GB" and "1.5 GB" are the same size. */
    static double sizeMegabytes(String size) {
        Matcher matcher = SIZE.matcher(size);
        if (!matcher.find()) {
            return 0;
        }
        double value = Double.parseDouble(matcher.group(1).replace(',', '.'));
        switch (matcher.group(2)) {
            case "GB":
                return value * 1024;
            case "kB":
                return value / 1024;
            default:
                return value;
        }
    }

    private static int parseOrZero(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private record Scored(RankedResult result, int sourceHeight, int streamHeight, double sizeMegabytes,
                          boolean mentionsYear) {
    }
}
