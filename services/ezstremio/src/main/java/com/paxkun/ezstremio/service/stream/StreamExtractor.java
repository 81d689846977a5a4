package com.paxkun.ezstremio.service.stream;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * StreamExtractor pulls playable sources out of a prehraj.to details page.
 * <p>
 * The player is configured by an inline script of the form
 * {@code var sources = [{ file: "...", label: '1080p' }, ...];}. Only the minimal pieces
 * are matched; the script is not parsed as JavaScript. The page's "Rozlišení:" list item
 * gives the resolution of the uploaded original, shared by all streams of the page.
 */
@Component
public class StreamExtractor {

    static final String RESOLUTION_MARKER = "Rozlišení:";

    private static final Pattern SOURCES = Pattern.compile("var sources = (\\[[\\s\\S]*?\\]);");
    private static final Pattern FILE = Pattern.compile("file:\\s*[\"']([^\"']+)[\"']");
    private static final Pattern LABEL = Pattern.compile("label:\\s*[\"']([^\"']+)[\"']");

    /**
     * @param html raw details page
     * @return streams in the order the page lists them; empty when the page has no source list
     */
    public List<StreamDescriptor> extract(String html) {
        List<StreamDescriptor> streams = new ArrayList<>();
        if (html == null || html.isEmpty()) {
            return streams;
        }

        Matcher sources = SOURCES.matcher(html);
        if (!sources.find()) {
            return streams;
        }

        String resolution = extractResolution(html);
        for (String segment : sources.group(1).split("\\{")) {
            if (!segment.contains("file:")) {
                continue;
            }
            Matcher file = FILE.matcher(segment);
            if (!file.find()) {
                continue;
            }
            Matcher label = LABEL.matcher(segment);
            String streamLabel = label.find() ? label.group(1) : StreamDescriptor.UNKNOWN_LABEL;
            streams.add(new StreamDescriptor(streamLabel, resolution, file.group(1)));
        }
        return streams;
    }

    /**
     * Reads {@code <li><span>Rozlišení:</span><span>1920 x 1080 px</span></li>}.
     *
     * @return the value span's text, or empty when the page does not show it
     */
    String extractResolution(String html) {
        Document doc = Jsoup.parse(html);
        for (Element item : doc.select("li")) {
            if (!item.text().contains(RESOLUTION_MARKER)) {
                continue;
            }
            for (Element span : item.select("span")) {
                String text = span.text();
                if (!text.contains(RESOLUTION_MARKER) && !text.isBlank()) {
                    return text.trim();
                }
            }
        }
        return "";
    }
}
