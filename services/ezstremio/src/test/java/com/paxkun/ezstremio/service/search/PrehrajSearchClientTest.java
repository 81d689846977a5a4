package com.paxkun.ezstremio.service.search;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrehrajSearchClientTest {

    private static final String BASE_URL = "https://prehraj.to";

    @Test
    void parsesResultTilesIntoAbsoluteCandidates() {
        String html = "<section>"
                + "<a class=\"video--link\" href=\"/wicked-2024-cz-dabing/6d3f1a\">\n"
                + "  <span class=\"video__tag\">2:40:12</span>\n"
                + "  <span class=\"video__tag\">8.21 GB</span>\n"
                + "  <h3 class=\"video__title\">Wicked 2024 CZ dabing</h3>\n"
                + "</a>"
                + "<a class=\"video--link\" href=\"https://prehraj.to/wicked-sk/99aa\">\n"
                + "  <span>1:55:00</span>\n"
                + "  <span>700 MB</span>\n"
                + "  <h3>Wicked SK</h3>\n"
                + "</a>"
                + "</section>";

        List<Candidate> results = PrehrajSearchClient.parseResults(html, BASE_URL);

        assertThat(results).containsExactly(
                new Candidate("Wicked 2024 CZ dabing", "2:40:12", "8.21 GB", "https://prehraj.to/wicked-2024-cz-dabing/6d3f1a"),
                new Candidate("Wicked SK", "1:55:00", "700 MB", "https://prehraj.to/wicked-sk/99aa"));
    }

    @Test
    void fallsBackToLinksCarryingSizeAndDuration() {
        String html = "<div>"
                + "<a href=\"/hledej/wicked\">Hledat 1 GB 1:00</a>"
                + "<a href=\"/cenik\">Ceník</a>"
                + "<a class=\"tile\" href=\"/wicked-cz/1\">\n2:40:12\n1.5 GB\nWicked CZ\n</a>"
                + "<a href=\"/o-nas\">O nás</a>"
                + "</div>";

        List<Candidate> results = PrehrajSearchClient.parseResults(html, BASE_URL);

        assertThat(results).containsExactly(
                new Candidate("Wicked CZ", "2:40:12", "1.5 GB", "https://prehraj.to/wicked-cz/1"));
    }

    @Test
    void usesTitleAttributeWhenTextOnlyHoldsMetadata() {
        String html = "<a class=\"video--link\" href=\"/x/1\" title=\"Wicked (2024)\">\n1:10:00\n2 GB\n</a>";

        List<Candidate> results = PrehrajSearchClient.parseResults(html, BASE_URL);

        assertThat(results).extracting(Candidate::title).containsExactly("Wicked (2024)");
    }

    @Test
    void emptyPageYieldsNoCandidates() {
        assertThat(PrehrajSearchClient.parseResults("<html><title>Nic nenalezeno</title></html>", BASE_URL)).isEmpty();
    }
}
